package com.examboard.pseudocode.transform;

import static com.examboard.pseudocode.transform.mapping.IndexArithmetic.group;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.scope.ParameterInfo;
import com.examboard.pseudocode.scope.ScopeKind;
import com.examboard.pseudocode.scope.ScopeManager;
import com.examboard.pseudocode.scope.VariableInfo;
import com.examboard.pseudocode.transform.mapping.IndexArithmetic;
import com.examboard.pseudocode.transform.types.PseudoType;
import com.examboard.pseudocode.transform.types.TypeNormalizer;

import lombok.Data;

/**
 * Rules shared by the Java and TypeScript transformers: declarations, callables, control flow,
 * loop rewriting and construct simplification. Language subclasses supply the type normalizer and
 * recognize the I/O library calls of their platform.
 *
 * An instance keeps per-conversion state and must not be shared between threads.
 */
public abstract class AbstractAstTransformer implements AstTransformer {
    private static final Logger log = LoggerFactory.getLogger(AbstractAstTransformer.class);

    private static final Set<String> SILENT_FEATURES = Set.of(
        "imports", "package declarations", "exports", "imports/exports"
    );

    private static final Set<String> CONSTANT_KINDS = Set.of("const", "final", "readonly");

    private static final Set<String> GENERIC_PRINT = Set.of("print", "println");

    protected final ConversionOptions options;

    private Diagnostics diagnostics;
    private TransformContext context;
    private ScopeManager scopes;
    private ExpressionTranslator expressions;
    private final Deque<ControlKind> controls = new ArrayDeque<>();
    private final Deque<CallableFrame> callables = new ArrayDeque<>();
    private final List<IrNode> mainProgram = new ArrayList<>();

    protected AbstractAstTransformer(ConversionOptions options) {
        this.options = options;
    }

    // ------------------------------------------------------------------
    // Language hooks
    // ------------------------------------------------------------------

    protected abstract TypeNormalizer createTypeNormalizer(Set<String> typeNames, Diagnostics diagnostics);

    /**
     * Library names that resolve without a declaration.
     */
    protected abstract Set<String> builtInNames();

    /**
     * Platform console output such as {@code System.out.println} or {@code console.log}.
     */
    protected abstract boolean isLanguageOutputCall(SyntaxNode call);

    /**
     * Calls that read one value from the user.
     */
    protected abstract boolean isInputCall(SyntaxNode call);

    /**
     * Initializers that only create an input reader, for example {@code new Scanner(System.in)}.
     */
    protected abstract boolean isInputSetup(SyntaxNode initializer);

    /**
     * Calls that only convert their single argument, such as {@code Integer.parseInt(x)}.
     */
    protected abstract boolean isConversionCall(SyntaxNode call);

    protected boolean isFormattedOutput(SyntaxNode call) {
        return false;
    }

    /**
     * @return the prompt argument of an input call, or null
     */
    protected SyntaxNode inputPrompt(SyntaxNode call) {
        return call.childCount() > 1 ? call.child(1) : null;
    }

    protected boolean isEntryPoint(SyntaxNode method) {
        return false;
    }

    /**
     * Strips wrappers such as {@code Promise<T>} from a declared return type.
     */
    protected String unwrapReturnType(String spelling) {
        return spelling;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    @Override
    public TransformResult transform(SyntaxNode program) {
        diagnostics = new Diagnostics();
        scopes = new ScopeManager(diagnostics);
        controls.clear();
        callables.clear();
        mainProgram.clear();

        Set<String> typeNames = new LinkedHashSet<>();
        Set<String> enumNames = new LinkedHashSet<>();
        collectTypeNames(program, typeNames, enumNames);
        context = new TransformContext(diagnostics, options, scopes, createTypeNormalizer(typeNames, diagnostics),
                typeNames, builtInNames());
        context.getEnumNames().addAll(enumNames);
        expressions = new ExpressionTranslator(context);
        hoist(program.getChildren());

        List<IrNode> items = new ArrayList<>();
        for (SyntaxNode item : program.getChildren()) {
            items.addAll(convertStatement(item));
        }
        if (!mainProgram.isEmpty()) {
            items.add(IrNode.comment(List.of("Main program")));
            items.addAll(mainProgram);
        }
        if (items.isEmpty()) {
            diagnostics.info(DiagnosticCode.EMPTY_PROGRAM, "The program contains no statements", null, null);
        }
        log.debug("Transformed {} top-level items into {} IR nodes", program.childCount(), items.size());
        IrNode root = IrNode.builder().kind(IrKind.PROGRAM).children(items).build();
        return new TransformResult(root, diagnostics.toList());
    }

    private void collectTypeNames(SyntaxNode node, Set<String> typeNames, Set<String> enumNames) {
        switch (node.getKind()) {
            case CLASS_DECLARATION, INTERFACE_DECLARATION, TYPE_ALIAS -> typeNames.add(node.getValue());
            case ENUM_DECLARATION -> {
                typeNames.add(node.getValue());
                enumNames.add(node.getValue());
            }
            default -> {
            }
        }
        if (node.is(SyntaxKind.PROGRAM) || node.is(SyntaxKind.CLASS_DECLARATION)) {
            for (SyntaxNode child : node.getChildren()) {
                collectTypeNames(child, typeNames, enumNames);
            }
        }
    }

    /**
     * Declares top-level callables and enum constants up front so that earlier statements can use them.
     */
    private void hoist(List<SyntaxNode> items) {
        for (SyntaxNode item : items) {
            if (item.is(SyntaxKind.METHOD_DECLARATION)) {
                scopes.declareCallable(item.getValue(), quietParameters(item.childrenOf(SyntaxKind.PARAMETER)),
                        quietType(unwrapReturnType(item.attribute(SyntaxAttributes.RETURN_TYPE))));
            } else if (item.is(SyntaxKind.ENUM_DECLARATION)) {
                for (SyntaxNode member : item.getChildren()) {
                    scopes.declareVariable(member.getValue(), PseudoType.INTEGER, List.of(), true, null);
                }
            } else if (item.is(SyntaxKind.CLASS_DECLARATION)) {
                hoist(item.childrenOf(SyntaxKind.ENUM_DECLARATION));
            }
        }
        log.debug("Hoisted declarations of {} top-level items", items.size());
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    /**
     * Converts one statement. A runtime failure is contained here: it becomes a
     * TRANSFORMATION_ERROR and an error comment, and the surrounding state is restored.
     */
    protected List<IrNode> convertStatement(SyntaxNode node) {
        int scopeDepth = scopes.depth();
        int pendingDepth = context.pendingDepth();
        int controlDepth = controls.size();
        int callableDepth = callables.size();
        context.beginStatement();
        try {
            return context.finishStatement(dispatch(node));
        } catch (RuntimeException e) {
            log.error("Failed to convert {} on line {}", node.getKind(), node.getLine(), e);
            while (scopes.depth() > scopeDepth) {
                scopes.exitScope();
            }
            context.truncatePending(pendingDepth);
            while (controls.size() > controlDepth) {
                controls.pop();
            }
            while (callables.size() > callableDepth) {
                callables.pop();
            }
            String message = "Could not convert statement on line " + node.getLine() + ": " + e.getMessage();
            diagnostics.error(DiagnosticCode.TRANSFORMATION_ERROR, message, node.getLine(), node.getColumn());
            return List.of(IrNode.builder()
                    .kind(IrKind.ERROR_RECOVERY)
                    .meta(IrMetadata.MESSAGE, message)
                    .meta(IrMetadata.SOURCE_LINE, String.valueOf(node.getLine()))
                    .build());
        }
    }

    protected List<IrNode> convertStatements(List<SyntaxNode> statements) {
        List<IrNode> result = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            result.addAll(convertStatement(statement));
        }
        return result;
    }

    private List<IrNode> dispatch(SyntaxNode node) {
        return switch (node.getKind()) {
            case CLASS_DECLARATION -> convertClass(node);
            case INTERFACE_DECLARATION -> convertInterface(node);
            case ENUM_DECLARATION -> convertEnum(node);
            case TYPE_ALIAS -> convertTypeAlias(node);
            case FIELD_DECLARATION, VARIABLE_DECLARATION -> convertDeclaration(node);
            case DECLARATION_GROUP -> node.getChildren().stream()
                    .flatMap(child -> dispatch(child).stream())
                    .toList();
            case DESTRUCTURING_DECLARATION -> convertDestructuring(node);
            case METHOD_DECLARATION -> convertMethod(node);
            case CONSTRUCTOR_DECLARATION -> convertConstructor(node);
            case BLOCK -> inScope(ScopeKind.BLOCK, () -> convertStatements(node.getChildren()));
            case IF_STATEMENT -> convertIf(node);
            case WHILE_STATEMENT -> convertWhile(node);
            case DO_WHILE_STATEMENT -> convertDoWhile(node);
            case FOR_STATEMENT -> convertFor(node);
            case FOR_EACH_STATEMENT -> convertForEach(node);
            case SWITCH_STATEMENT -> convertSwitch(node);
            case BREAK_STATEMENT, CONTINUE_STATEMENT -> convertJump(node);
            case RETURN_STATEMENT -> convertReturn(node);
            case THROW_STATEMENT -> convertThrow(node);
            case TRY_STATEMENT -> convertTry(node);
            case EXPRESSION_STATEMENT -> convertExpressionStatement(node.child(0));
            case EMPTY -> List.of();
            case UNSUPPORTED -> convertUnsupported(node);
            case ASSIGNMENT, BINARY_EXPRESSION, UNARY_EXPRESSION, UPDATE_EXPRESSION, CONDITIONAL_EXPRESSION,
                    CALL_EXPRESSION, MEMBER_ACCESS, INDEX_ACCESS, NEW_EXPRESSION, NEW_ARRAY, ARRAY_LITERAL,
                    OBJECT_LITERAL, PROPERTY_ASSIGNMENT, LITERAL, TEMPLATE_LITERAL, IDENTIFIER, LAMBDA_EXPRESSION,
                    CAST_EXPRESSION, SPREAD_ELEMENT, PARENTHESIZED, SEQUENCE_EXPRESSION, EXPRESSION_LIST ->
                    convertExpressionStatement(node);
            case PROGRAM, PARAMETER, SWITCH_CASE, CATCH_CLAUSE ->
                    throw new IllegalStateException(node.getKind() + " is not a statement");
        };
    }

    private List<IrNode> inScope(ScopeKind kind, ScopedWork work) {
        scopes.enterScope(kind);
        try {
            return work.run();
        } finally {
            scopes.exitScope();
        }
    }

    @FunctionalInterface
    private interface ScopedWork {
        List<IrNode> run();
    }

    private IrNode branch(SyntaxNode statement) {
        return IrNode.block(inScope(ScopeKind.BLOCK, () -> statement.is(SyntaxKind.BLOCK)
                ? convertStatements(statement.getChildren())
                : convertStatement(statement)));
    }

    private IrNode loopBody(SyntaxNode statement, List<IrNode> prefix, List<SyntaxNode> suffix) {
        controls.push(ControlKind.LOOP);
        try {
            List<IrNode> body = new ArrayList<>(prefix);
            body.addAll(statement.is(SyntaxKind.BLOCK)
                    ? convertStatements(statement.getChildren())
                    : convertStatement(statement));
            for (SyntaxNode update : suffix) {
                body.addAll(convertStatement(asStatement(update)));
            }
            return IrNode.block(body);
        } finally {
            controls.pop();
        }
    }

    private static SyntaxNode asStatement(SyntaxNode expression) {
        return SyntaxNode.builder()
                .kind(SyntaxKind.EXPRESSION_STATEMENT)
                .child(expression)
                .line(expression.getLine())
                .column(expression.getColumn())
                .build();
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    private List<IrNode> convertDeclaration(SyntaxNode node) {
        String name = node.getValue();
        int line = node.getLine();
        SyntaxNode initializer = node.childCount() > 0 ? node.child(0) : null;
        SyntaxNode unwrapped = initializer == null ? null : initializer.unwrapParentheses();

        if (unwrapped != null && isInputSetup(unwrapped)) {
            context.getInputReaders().add(name);
            log.debug("Dropped input reader setup for {} on line {}", name, line);
            return List.of();
        }
        if (unwrapped != null && unwrapped.is(SyntaxKind.LAMBDA_EXPRESSION)) {
            return convertNamedLambda(name, unwrapped, line);
        }
        annotateModifiers(node);
        if (node.flag(SyntaxAttributes.OPTIONAL)) {
            context.annotate("Optional property " + name);
        }

        PseudoType type = declarationType(node, initializer);
        String kind = node.attribute(SyntaxAttributes.DECLARATION_KIND);
        boolean constantKind = kind != null && CONSTANT_KINDS.contains(kind);

        if (constantKind && unwrapped != null && isLiteralValue(unwrapped)) {
            String value = expressions.render(initializer);
            scopes.declareVariable(name, type, type.getDimensions(), true, value);
            return List.of(IrNode.builder()
                    .kind(IrKind.CONSTANT_DECLARATION)
                    .meta(IrMetadata.NAME, name)
                    .meta(IrMetadata.VALUE, value)
                    .build());
        }
        if (constantKind) {
            context.annotate(name + " is " + kind + "; its value is computed when the program runs");
        }

        IrNode.IrNodeBuilder declaration = IrNode.builder()
                .kind(IrKind.VARIABLE_DECLARATION)
                .meta(IrMetadata.NAME, name)
                .meta(IrMetadata.DATA_TYPE, type.render());

        if (unwrapped == null) {
            scopes.declareVariable(name, type, type.getDimensions());
            return List.of(declaration.build());
        }
        SyntaxNode inputSource = unwrapConversion(unwrapped);
        if (inputSource.is(SyntaxKind.CALL_EXPRESSION) && isInputCall(inputSource)) {
            scopes.declareVariable(name, type, type.getDimensions());
            List<IrNode> result = new ArrayList<>();
            result.add(declaration.build());
            result.addAll(input(name, inputSource));
            return result;
        }
        if (unwrapped.is(SyntaxKind.CONDITIONAL_EXPRESSION)) {
            scopes.declareVariable(name, type, type.getDimensions());
            return List.of(declaration.build(), expandConditional(unwrapped, value -> assignment(name, value)));
        }
        if (unwrapped.is(SyntaxKind.NEW_ARRAY) && unwrapped.findChild(SyntaxKind.ARRAY_LITERAL).isEmpty()) {
            scopes.declareVariable(name, type, type.getDimensions());
            return List.of(declaration.build());
        }
        String value = expressions.render(initializer);
        scopes.declareVariable(VariableInfo.builder()
                .name(name)
                .type(type)
                .arrayDimensions(type.getDimensions())
                .constant(constantKind)
                .initialValue(value)
                .build());
        return List.of(declaration.meta(IrMetadata.VALUE, value).build());
    }

    /**
     * Declared type if present, otherwise the initializer's inferred type, otherwise STRING with a warning.
     * Array dimensions are taken from the initializer where the declaration leaves them open.
     */
    private PseudoType declarationType(SyntaxNode node, SyntaxNode initializer) {
        PseudoType declared = context.getTypes().normalize(node.attribute(SyntaxAttributes.TYPE), node.getLine());
        PseudoType inferred = initializer == null ? null : expressions.typeOf(initializer);
        if (declared == null && inferred == null) {
            diagnostics.warning(DiagnosticCode.TYPE_CONVERSION_FALLBACK,
                    "Type of '" + node.getValue() + "' could not be determined and was declared as STRING",
                    node.getLine(), node.getColumn(), "Add a type annotation");
            return PseudoType.fallbackType();
        }
        if (declared == null) {
            return inferred;
        }
        if (declared.isArray() && inferred != null && inferred.isArray()
                && inferred.getDimensions().size() == declared.getDimensions().size()) {
            List<String> dimensions = new ArrayList<>();
            for (int i = 0; i < declared.getDimensions().size(); i++) {
                String size = declared.getDimensions().get(i);
                dimensions.add(size.equals(PseudoType.UNKNOWN_SIZE) ? inferred.getDimensions().get(i) : size);
            }
            return declared.withDimensions(dimensions);
        }
        return declared;
    }

    private void annotateModifiers(SyntaxNode node) {
        if (node.hasModifier("static")) {
            context.annotate("Static member");
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "static modifier on " + node.getValue() + " kept as a comment", node.getLine(), node.getColumn());
        }
        if (node.flag(SyntaxAttributes.ASYNC) || node.hasModifier("async")) {
            context.annotate("Asynchronous; runs to completion here");
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "async modifier on " + node.getValue() + " kept as a comment", node.getLine(), node.getColumn());
        }
        String typeParameters = node.attribute(SyntaxAttributes.TYPE_PARAMETERS);
        if (typeParameters != null) {
            context.annotate("Generic type parameters " + typeParameters);
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "Type parameters " + typeParameters + " kept as a comment", node.getLine(), node.getColumn());
        }
    }

    private static boolean isLiteralValue(SyntaxNode node) {
        if (node.is(SyntaxKind.LITERAL)) {
            return !node.isLiteral(SyntaxAttributes.LITERAL_NULL);
        }
        return node.is(SyntaxKind.UNARY_EXPRESSION) && "-".equals(node.attribute(SyntaxAttributes.OPERATOR))
                && node.child(0).is(SyntaxKind.LITERAL);
    }

    private List<IrNode> convertDestructuring(SyntaxNode node) {
        List<SyntaxNode> targets = node.getChildren().stream()
                .filter(c -> c.hasAttribute(SyntaxAttributes.PROPERTY))
                .toList();
        SyntaxNode last = node.childCount() > 0 ? node.child(node.childCount() - 1) : null;
        if (last == null || last.hasAttribute(SyntaxAttributes.PROPERTY)) {
            context.annotate("Destructuring pattern without a source value");
            return List.of();
        }
        boolean objectPattern = "object".equals(node.attribute(SyntaxAttributes.PATTERN));
        String source = expressions.operand(last);
        PseudoType sourceType = expressions.typeOf(last);

        context.annotate("Destructuring split into separate assignments");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Destructuring on line " + node.getLine() + " split into separate assignments",
                node.getLine(), node.getColumn());

        List<IrNode> result = new ArrayList<>();
        for (SyntaxNode target : targets) {
            String name = target.getValue();
            String property = target.attribute(SyntaxAttributes.PROPERTY);
            if (target.flag(SyntaxAttributes.REST)) {
                context.annotate(name + " collects the remaining values of " + source);
            }
            String value;
            PseudoType type = null;
            if (objectPattern) {
                value = source + "." + property;
            } else {
                value = source + "[" + IndexArithmetic.plusOne(property) + "]";
                type = sourceType != null && sourceType.isArray() ? sourceType.indexed() : null;
            }
            if (target.childCount() > 0) {
                context.annotate(name + " defaults to " + expressions.render(target.child(0)));
            }
            scopes.declareVariable(name, type, List.of());
            result.add(assignment(name, value));
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Callables
    // ------------------------------------------------------------------

    private List<IrNode> convertMethod(SyntaxNode node) {
        String name = node.getValue();
        if (isEntryPoint(node)) {
            convertEntryPoint(node);
            return List.of();
        }
        Optional<SyntaxNode> body = node.findChild(SyntaxKind.BLOCK);
        List<SyntaxNode> parameterNodes = node.childrenOf(SyntaxKind.PARAMETER);
        PseudoType returnType = context.getTypes()
                .normalize(unwrapReturnType(node.attribute(SyntaxAttributes.RETURN_TYPE)), node.getLine());

        if (node.flag(SyntaxAttributes.ABSTRACT) || body.isEmpty()) {
            String signature = signature(name, quietParameters(parameterNodes), returnType);
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "Abstract method " + name + " converted to a comment", node.getLine(), node.getColumn());
            return List.of(IrNode.comment(List.of("Abstract " + signature)));
        }

        annotateModifiers(node);
        String accessor = node.attribute(SyntaxAttributes.ACCESSOR);
        if (accessor != null) {
            context.annotate("Property " + ("get".equals(accessor) ? "getter" : "setter") + " for " + name);
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "Accessor " + name + " converted to a subroutine", node.getLine(), node.getColumn());
        }
        return List.of(callable(name, parameterNodes, returnType, body.get().getChildren(), List.of()));
    }

    private List<IrNode> convertConstructor(SyntaxNode node) {
        String className = node.getValue();
        List<SyntaxNode> parameterNodes = node.childrenOf(SyntaxKind.PARAMETER);
        List<IrNode> prefix = new ArrayList<>();
        for (SyntaxNode parameter : parameterNodes) {
            if (parameter.flag(SyntaxAttributes.PROPERTY)) {
                prefix.add(assignment("this." + parameter.getValue(), parameter.getValue()));
            }
        }
        context.annotate("Constructor");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Constructor of " + className + " converted to a procedure", node.getLine(), node.getColumn());
        List<SyntaxNode> body = node.findChild(SyntaxKind.BLOCK).map(SyntaxNode::getChildren).orElse(List.of());
        return List.of(callable(className, parameterNodes, null, body, prefix));
    }

    /**
     * Builds a PROCEDURE (no return type) or FUNCTION with its own scope.
     */
    private IrNode callable(String name, List<SyntaxNode> parameterNodes, PseudoType returnType,
            List<SyntaxNode> bodyStatements, List<IrNode> prefix) {
        scopes.enterScope(ScopeKind.FUNCTION);
        callables.push(new CallableFrame(name, returnType == null));
        List<ParameterInfo> parameters;
        List<IrNode> body = new ArrayList<>(prefix);
        try {
            parameters = declareParameters(parameterNodes);
            body.addAll(convertStatements(bodyStatements));
        } finally {
            callables.pop();
            scopes.exitScope();
        }
        scopes.declareCallable(name, parameters, returnType);
        return callableNode(name, parameters, returnType, body);
    }

    private static IrNode callableNode(String name, List<ParameterInfo> parameters, PseudoType returnType,
            List<IrNode> body) {
        IrNode.IrNodeBuilder builder = IrNode.builder()
                .kind(returnType == null ? IrKind.PROCEDURE : IrKind.FUNCTION)
                .meta(IrMetadata.NAME, name)
                .meta(IrMetadata.PARAMETERS, parameterText(parameters))
                .child(IrNode.block(body));
        if (returnType != null) {
            builder.meta(IrMetadata.RETURN_TYPE, signatureType(returnType));
        }
        return builder.build();
    }

    private void convertEntryPoint(SyntaxNode node) {
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Method " + node.getValue() + " converted to the main program", node.getLine(), node.getColumn());
        List<SyntaxNode> body = node.findChild(SyntaxKind.BLOCK).map(SyntaxNode::getChildren).orElse(List.of());
        scopes.enterScope(ScopeKind.FUNCTION);
        callables.push(new CallableFrame(node.getValue(), true));
        try {
            for (SyntaxNode parameter : node.childrenOf(SyntaxKind.PARAMETER)) {
                scopes.declareVariable(parameter.getValue(), quietType(parameter.attribute(SyntaxAttributes.TYPE)),
                        List.of());
            }
            mainProgram.addAll(convertStatements(body));
        } finally {
            callables.pop();
            scopes.exitScope();
        }
        log.debug("Collected entry point {} with {} statements", node.getValue(), body.size());
    }

    /**
     * An arrow function or lambda bound to a name becomes a named FUNCTION or PROCEDURE.
     */
    private List<IrNode> convertNamedLambda(String name, SyntaxNode lambda, int line) {
        List<SyntaxNode> parameterNodes = lambda.childrenOf(SyntaxKind.PARAMETER);
        SyntaxNode body = lambda.child(lambda.childCount() - 1);
        PseudoType declaredReturn = context.getTypes()
                .normalize(unwrapReturnType(lambda.attribute(SyntaxAttributes.RETURN_TYPE)), line);
        if (lambda.flag(SyntaxAttributes.ASYNC)) {
            context.annotate("Asynchronous; runs to completion here");
        }
        context.annotate("Function expression " + name + " converted to a named subroutine");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Function expression " + name + " converted to a named subroutine", line, lambda.getColumn());

        if (body.is(SyntaxKind.BLOCK)) {
            return List.of(callable(name, parameterNodes, declaredReturn, body.getChildren(), List.of()));
        }

        SyntaxNode expression = body.unwrapParentheses();
        scopes.declareCallable(name, quietParameters(parameterNodes), declaredReturn);
        scopes.enterScope(ScopeKind.FUNCTION);
        List<ParameterInfo> parameters;
        PseudoType returnType;
        List<IrNode> statements;
        try {
            parameters = declareParameters(parameterNodes);
            returnType = declaredReturn != null ? declaredReturn : expressions.typeOf(expression);
            boolean procedure = expression.is(SyntaxKind.CALL_EXPRESSION)
                    && (isOutputCall(expression) || returnType == null);
            if (procedure) {
                returnType = null;
            } else if (returnType == null) {
                diagnostics.warning(DiagnosticCode.TYPE_CONVERSION_FALLBACK,
                        "Return type of " + name + " could not be determined and was declared as STRING",
                        line, lambda.getColumn(), "Add a return type annotation");
                returnType = PseudoType.fallbackType();
            }
            callables.push(new CallableFrame(name, procedure));
            try {
                SyntaxNode statement = procedure
                        ? asStatement(expression)
                        : SyntaxNode.builder().kind(SyntaxKind.RETURN_STATEMENT).child(expression)
                                .line(expression.getLine()).column(expression.getColumn()).build();
                statements = convertStatement(statement);
            } finally {
                callables.pop();
            }
        } finally {
            scopes.exitScope();
        }
        scopes.declareCallable(name, parameters, returnType);
        return List.of(callableNode(name, parameters, returnType, statements));
    }

    private List<ParameterInfo> declareParameters(List<SyntaxNode> parameterNodes) {
        List<ParameterInfo> parameters = new ArrayList<>();
        for (SyntaxNode parameter : parameterNodes) {
            String name = parameter.getValue();
            PseudoType type = context.getTypes().normalize(parameter.attribute(SyntaxAttributes.TYPE),
                    parameter.getLine());
            SyntaxNode defaultValue = parameter.childCount() > 0 ? parameter.child(0) : null;
            if (type == null && defaultValue != null) {
                type = expressions.typeOf(defaultValue);
            }
            if (type == null) {
                diagnostics.warning(DiagnosticCode.TYPE_CONVERSION_FALLBACK,
                        "Parameter '" + name + "' has no type and was declared as STRING", parameter.getLine(),
                        parameter.getColumn(), "Add a type annotation");
                type = PseudoType.fallbackType();
            }
            if (parameter.flag(SyntaxAttributes.OPTIONAL)) {
                context.annotate("Parameter " + name + " is optional");
            }
            if (defaultValue != null) {
                context.annotate("Parameter " + name + " defaults to " + expressions.render(defaultValue));
            }
            if (parameter.flag(SyntaxAttributes.REST)) {
                context.annotate("Parameter " + name + " collects the remaining arguments");
            }
            if (parameter.flag(SyntaxAttributes.PROPERTY)) {
                context.annotate("Parameter " + name + " is also stored as a property");
            }
            boolean optional = parameter.flag(SyntaxAttributes.OPTIONAL) || defaultValue != null;
            scopes.declareVariable(name, type, type.getDimensions());
            parameters.add(new ParameterInfo(name, type, optional));
        }
        return parameters;
    }

    private List<ParameterInfo> quietParameters(List<SyntaxNode> parameterNodes) {
        return parameterNodes.stream()
                .map(p -> new ParameterInfo(p.getValue(), quietType(p.attribute(SyntaxAttributes.TYPE)),
                        p.flag(SyntaxAttributes.OPTIONAL)))
                .toList();
    }

    private PseudoType quietType(String spelling) {
        return context.getTypes().withDiagnostics(new Diagnostics()).normalize(spelling, 0);
    }

    private static String parameterText(List<ParameterInfo> parameters) {
        return parameters.stream()
                .map(p -> p.getName() + " : " + (p.getType() == null ? "STRING" : signatureType(p.getType())))
                .collect(Collectors.joining(", "));
    }

    /**
     * Array parameters and results are written without bounds.
     */
    private static String signatureType(PseudoType type) {
        return type.isArray() ? "ARRAY OF " + type.getName() : type.render();
    }

    private static String signature(String name, List<ParameterInfo> parameters, PseudoType returnType) {
        String text = name + "(" + parameterText(parameters) + ")";
        return returnType == null ? "PROCEDURE " + text : "FUNCTION " + text + " RETURNS " + signatureType(returnType);
    }

    // ------------------------------------------------------------------
    // Types: classes, interfaces, enums, aliases
    // ------------------------------------------------------------------

    private List<IrNode> convertClass(SyntaxNode node) {
        String name = node.getValue();
        IrNode.IrNodeBuilder block = IrNode.builder()
                .kind(IrKind.CLASS_BLOCK)
                .meta(IrMetadata.NAME, name)
                .annotation("Class " + name);
        if (node.hasModifier("abstract")) {
            block.annotation("Abstract class");
        }
        String parent = node.attribute(SyntaxAttributes.EXTENDS);
        if (parent != null) {
            block.annotation("Inherits from " + parent);
        }
        String interfaces = node.attribute(SyntaxAttributes.IMPLEMENTS);
        if (interfaces != null) {
            block.annotation("Implements " + interfaces);
        }
        String typeParameters = node.attribute(SyntaxAttributes.TYPE_PARAMETERS);
        if (typeParameters != null) {
            block.annotation("Generic type parameters " + typeParameters);
        }
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Class " + name + " converted to declarations and subroutines", node.getLine(), node.getColumn());

        scopes.enterScope(ScopeKind.CLASS);
        try {
            predeclareMembers(node);
            List<IrNode> members = new ArrayList<>(parameterProperties(node));
            members.addAll(convertStatements(node.getChildren()));
            block.children(members);
        } finally {
            scopes.exitScope();
        }
        return List.of(block.build());
    }

    private void predeclareMembers(SyntaxNode classNode) {
        for (SyntaxNode member : classNode.getChildren()) {
            List<SyntaxNode> fields = member.is(SyntaxKind.DECLARATION_GROUP) ? member.getChildren() : List.of(member);
            for (SyntaxNode field : fields) {
                if (field.is(SyntaxKind.FIELD_DECLARATION)) {
                    PseudoType type = quietType(field.attribute(SyntaxAttributes.TYPE));
                    scopes.declareVariable(field.getValue(), type, type == null ? List.of() : type.getDimensions());
                }
            }
            if (member.is(SyntaxKind.METHOD_DECLARATION)) {
                scopes.declareCallable(member.getValue(), quietParameters(member.childrenOf(SyntaxKind.PARAMETER)),
                        quietType(unwrapReturnType(member.attribute(SyntaxAttributes.RETURN_TYPE))));
            } else if (member.is(SyntaxKind.CONSTRUCTOR_DECLARATION)) {
                scopes.declareCallable(classNode.getValue(),
                        quietParameters(member.childrenOf(SyntaxKind.PARAMETER)), null);
            }
        }
    }

    /**
     * Fields introduced by TypeScript constructor parameter properties.
     */
    private List<IrNode> parameterProperties(SyntaxNode classNode) {
        List<IrNode> fields = new ArrayList<>();
        for (SyntaxNode constructor : classNode.childrenOf(SyntaxKind.CONSTRUCTOR_DECLARATION)) {
            for (SyntaxNode parameter : constructor.childrenOf(SyntaxKind.PARAMETER)) {
                if (!parameter.flag(SyntaxAttributes.PROPERTY)) {
                    continue;
                }
                PseudoType type = quietType(parameter.attribute(SyntaxAttributes.TYPE));
                PseudoType declared = type == null ? PseudoType.fallbackType() : type;
                scopes.declareVariable(parameter.getValue(), declared, declared.getDimensions());
                fields.add(IrNode.builder()
                        .kind(IrKind.VARIABLE_DECLARATION)
                        .meta(IrMetadata.NAME, parameter.getValue())
                        .meta(IrMetadata.DATA_TYPE, declared.render())
                        .annotation("Property declared by constructor parameter " + parameter.getValue())
                        .build());
            }
        }
        return fields;
    }

    private List<IrNode> convertInterface(SyntaxNode node) {
        String name = node.getValue();
        List<String> lines = new ArrayList<>();
        String parents = node.attribute(SyntaxAttributes.EXTENDS);
        lines.add("Interface " + name + (parents == null ? "" : " extends " + parents));
        for (SyntaxNode member : node.getChildren()) {
            String type = member.attribute(SyntaxAttributes.TYPE);
            switch (member.getKind()) {
                case FIELD_DECLARATION -> {
                    if (member.flag(SyntaxAttributes.INDEX_SIGNATURE)) {
                        lines.add("  Index signature: " + member.getValue() + " : " + summaryType(type));
                    } else {
                        lines.add("  Property " + member.getValue()
                                + (member.flag(SyntaxAttributes.OPTIONAL) ? " (optional)" : "")
                                + " : " + summaryType(type));
                    }
                }
                case METHOD_DECLARATION -> lines.add("  " + signature(member.getValue(),
                        quietParameters(member.childrenOf(SyntaxKind.PARAMETER)),
                        quietType(unwrapReturnType(member.attribute(SyntaxAttributes.RETURN_TYPE)))));
                case UNSUPPORTED -> lines.add("  " + member.getValue());
                default -> log.debug("Skipping {} in interface {}", member.getKind(), name);
            }
        }
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Interface " + name + " converted to a summary comment", node.getLine(), node.getColumn());
        return List.of(IrNode.builder().kind(IrKind.INTERFACE_SUMMARY).annotations(lines).build());
    }

    private String summaryType(String spelling) {
        PseudoType type = quietType(spelling);
        if (type == null) {
            return spelling == null ? "unknown" : spelling;
        }
        return type.isFallback() ? spelling : type.render();
    }

    private List<IrNode> convertEnum(SyntaxNode node) {
        String name = node.getValue();
        context.getEnumNames().add(name);
        context.annotate("Enumeration " + name);
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Enum " + name + " converted to constants", node.getLine(), node.getColumn());
        List<IrNode> constants = new ArrayList<>();
        long next = 0;
        for (SyntaxNode member : node.getChildren()) {
            String value;
            PseudoType type = PseudoType.INTEGER;
            if (member.childCount() > 0) {
                SyntaxNode initializer = member.child(0);
                value = expressions.render(initializer);
                PseudoType inferred = expressions.typeOf(initializer);
                type = inferred == null ? PseudoType.fallbackType() : inferred;
                if (initializer.isLiteral(SyntaxAttributes.LITERAL_INTEGER)) {
                    next = Long.parseLong(ExpressionTranslator.integerLiteral(initializer.getValue())) + 1;
                }
            } else {
                value = String.valueOf(next++);
            }
            scopes.declareVariable(member.getValue(), type, List.of(), true, value);
            constants.add(IrNode.builder()
                    .kind(IrKind.CONSTANT_DECLARATION)
                    .meta(IrMetadata.NAME, member.getValue())
                    .meta(IrMetadata.VALUE, value)
                    .build());
        }
        return constants;
    }

    private List<IrNode> convertTypeAlias(SyntaxNode node) {
        String alias = "Type alias " + node.getValue() + " = " + node.attribute(SyntaxAttributes.TYPE);
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Type alias " + node.getValue() + " converted to a comment", node.getLine(), node.getColumn());
        return List.of(IrNode.comment(List.of(alias)));
    }

    // ------------------------------------------------------------------
    // Control flow
    // ------------------------------------------------------------------

    private List<IrNode> convertIf(SyntaxNode node) {
        String condition = expressions.condition(node.child(0));
        IrNode.IrNodeBuilder builder = IrNode.builder()
                .kind(IrKind.IF)
                .meta(IrMetadata.CONDITION, condition)
                .child(branch(node.child(1)));
        SyntaxNode elseBranch = node.child(2);
        if (!elseBranch.isEmpty()) {
            builder.child(branch(elseBranch));
        }
        return List.of(builder.build());
    }

    private List<IrNode> convertWhile(SyntaxNode node) {
        String condition = expressions.condition(node.child(0));
        IrNode body = inLoopScope(() -> List.of(loopBody(node.child(1), List.of(), List.of()))).get(0);
        return List.of(IrNode.builder()
                .kind(IrKind.WHILE)
                .meta(IrMetadata.CONDITION, condition)
                .child(body)
                .build());
    }

    private List<IrNode> inLoopScope(ScopedWork work) {
        return inScope(ScopeKind.BLOCK, work);
    }

    private List<IrNode> convertDoWhile(SyntaxNode node) {
        IrNode body = inLoopScope(() -> List.of(loopBody(node.child(0), List.of(), List.of()))).get(0);
        String condition = expressions.negate(node.child(1));
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "do-while loop converted to REPEAT ... UNTIL with the condition negated",
                node.getLine(), node.getColumn());
        return List.of(IrNode.builder()
                .kind(IrKind.REPEAT_UNTIL)
                .meta(IrMetadata.CONDITION, condition)
                .child(body)
                .build());
    }

    private List<IrNode> convertFor(SyntaxNode node) {
        Optional<CountingLoop> counting = CountingLoop.match(node.child(0), node.child(1), node.child(2));
        if (counting.isPresent()) {
            return List.of(countingLoop(node, counting.get()));
        }
        return inScope(ScopeKind.BLOCK, () -> whileLoop(node));
    }

    private IrNode countingLoop(SyntaxNode node, CountingLoop loop) {
        String variable = loop.getVariable();
        int line = node.getLine();
        if (!loop.isDeclared() && !context.isKnownName(variable)) {
            context.reportUndeclared(variable, line);
        }
        String start = expressions.render(loop.getStart());
        String end;
        boolean shifted = false;
        Optional<SyntaxNode> measured = loop.measuredCollection();
        if (measured.isPresent() && "0".equals(start)) {
            String collection = expressions.render(measured.get());
            start = "1";
            end = "LENGTH(" + collection + ")";
            shifted = true;
            diagnostics.info(DiagnosticCode.LOOP_BOUND_CONVERSION,
                    "Loop over " + collection + " converted to run from 1 to LENGTH(" + collection + ")",
                    line, node.getColumn());
        } else {
            String bound = expressions.render(loop.getBound());
            end = switch (loop.getComparison()) {
                case "<" -> IndexArithmetic.minusOne(bound);
                case ">" -> IndexArithmetic.plusOne(bound);
                default -> bound;
            };
        }

        PseudoType type = loop.getDeclaredType() == null
                ? PseudoType.INTEGER
                : Optional.ofNullable(context.getTypes().normalize(loop.getDeclaredType(), line))
                        .orElse(PseudoType.INTEGER);
        boolean indexShifted = shifted;
        IrNode body = inLoopScope(() -> {
            scopes.declareVariable(VariableInfo.builder()
                    .name(variable)
                    .type(type)
                    .indexShifted(indexShifted)
                    .build());
            return List.of(loopBody(node.child(3), List.of(), List.of()));
        }).get(0);

        IrNode.IrNodeBuilder builder = IrNode.builder()
                .kind(IrKind.FOR)
                .meta(IrMetadata.VARIABLE, variable)
                .meta(IrMetadata.START, start)
                .meta(IrMetadata.END, end)
                .child(body);
        String step = loop.stepText(expressions);
        if (step != null) {
            builder.meta(IrMetadata.STEP, step);
        }
        return builder.build();
    }

    /**
     * A loop that is not a simple counter: initializer statements, then a WHILE loop with the
     * update appended to its body.
     */
    private List<IrNode> whileLoop(SyntaxNode node) {
        SyntaxNode init = node.child(0);
        SyntaxNode condition = node.child(1);
        SyntaxNode update = node.child(2);
        List<IrNode> result = new ArrayList<>();
        if (init.is(SyntaxKind.VARIABLE_DECLARATION) || init.is(SyntaxKind.DECLARATION_GROUP)) {
            result.addAll(convertStatement(init));
        } else if (!init.isEmpty()) {
            for (SyntaxNode expression : sequence(init)) {
                result.addAll(convertStatement(asStatement(expression)));
            }
        }
        String conditionText = condition.isEmpty() ? "TRUE" : expressions.condition(condition);
        IrNode body = loopBody(node.child(3), List.of(), update.isEmpty() ? List.of() : sequence(update));
        diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "for loop on line " + node.getLine() + " is not a simple counting loop and was converted to WHILE",
                node.getLine(), node.getColumn(), "Use a single counter variable with a fixed step");
        result.add(IrNode.builder()
                .kind(IrKind.WHILE)
                .meta(IrMetadata.CONDITION, conditionText)
                .annotation("for loop converted to WHILE; the update runs at the end of each pass")
                .child(body)
                .build());
        return result;
    }

    private static List<SyntaxNode> sequence(SyntaxNode node) {
        return node.is(SyntaxKind.SEQUENCE_EXPRESSION) ? node.getChildren() : List.of(node);
    }

    private List<IrNode> convertForEach(SyntaxNode node) {
        String name = node.getValue();
        SyntaxNode iterable = node.child(0);
        String collection = expressions.render(iterable);
        PseudoType collectionType = expressions.typeOf(iterable);
        int line = node.getLine();

        if ("in".equals(node.attribute(SyntaxAttributes.ITERATION))) {
            context.annotate("for...in loop converted to a counting loop over the positions of " + collection);
            diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "for...in loop over " + collection + " converted to a counting loop", line, node.getColumn(),
                    "Loop over the indices of an array instead");
            IrNode body = inLoopScope(() -> {
                scopes.declareVariable(VariableInfo.builder().name(name).type(PseudoType.INTEGER)
                        .indexShifted(true).build());
                return List.of(loopBody(node.child(1), List.of(), List.of()));
            }).get(0);
            return List.of(forNode(name, "1", "LENGTH(" + collection + ")", body));
        }

        String index = name + "Index";
        PseudoType declared = context.getTypes().normalize(node.attribute(SyntaxAttributes.TYPE), line);
        PseudoType elementType = declared != null ? declared
                : collectionType == null ? null
                : collectionType.isArray() ? collectionType.indexed()
                : collectionType.isString() ? PseudoType.CHAR : null;
        String element = collectionType != null && collectionType.isString()
                ? "SUBSTRING(" + collection + ", " + index + ", 1)"
                : collection + "[" + index + "]";

        context.annotate("for-each loop converted to a counting loop over LENGTH(" + collection + ")");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "for-each loop over " + collection + " converted to a counting loop", line, node.getColumn());

        List<IrNode> result = new ArrayList<>();
        if (elementType != null) {
            result.add(IrNode.builder()
                    .kind(IrKind.VARIABLE_DECLARATION)
                    .meta(IrMetadata.NAME, name)
                    .meta(IrMetadata.DATA_TYPE, elementType.render())
                    .build());
        }
        IrNode body = inLoopScope(() -> {
            scopes.declareVariable(index, PseudoType.INTEGER, List.of());
            scopes.declareVariable(name, elementType, elementType == null ? List.of() : elementType.getDimensions());
            return List.of(loopBody(node.child(1), List.of(assignment(name, element)), List.of()));
        }).get(0);
        result.add(forNode(index, "1", "LENGTH(" + collection + ")", body));
        return result;
    }

    private static IrNode forNode(String variable, String start, String end, IrNode body) {
        return IrNode.builder()
                .kind(IrKind.FOR)
                .meta(IrMetadata.VARIABLE, variable)
                .meta(IrMetadata.START, start)
                .meta(IrMetadata.END, end)
                .child(body)
                .build();
    }

    private List<IrNode> convertSwitch(SyntaxNode node) {
        String subject = expressions.render(node.child(0));
        List<SyntaxNode> cases = node.getChildren().subList(1, node.childCount());
        List<IrNode> branches = new ArrayList<>();
        IrNode otherwise = null;
        List<String> pendingLabels = new ArrayList<>();
        boolean pendingDefault = false;

        controls.push(ControlKind.SWITCH);
        try {
            for (int i = 0; i < cases.size(); i++) {
                SyntaxNode switchCase = cases.get(i);
                boolean last = i == cases.size() - 1;
                boolean arrow = switchCase.flag(SyntaxAttributes.ARROW);
                List<SyntaxNode> body = new ArrayList<>(switchCase.child(1).getChildren());
                List<String> labels = switchCase.child(0).getChildren().stream().map(expressions::render).toList();
                boolean isDefault = switchCase.flag(SyntaxAttributes.DEFAULT) || pendingDefault;

                if (body.isEmpty() && !arrow && !last) {
                    pendingLabels.addAll(labels);
                    pendingDefault = isDefault;
                    continue;
                }
                List<String> allLabels = new ArrayList<>(pendingLabels);
                allLabels.addAll(labels);
                pendingLabels.clear();
                pendingDefault = false;

                boolean terminated = false;
                if (!body.isEmpty()) {
                    SyntaxNode tail = body.get(body.size() - 1);
                    if (tail.is(SyntaxKind.BREAK_STATEMENT) && tail.getValue() == null) {
                        body.remove(body.size() - 1);
                        terminated = true;
                    } else {
                        terminated = tail.is(SyntaxKind.RETURN_STATEMENT) || tail.is(SyntaxKind.THROW_STATEMENT)
                                || tail.is(SyntaxKind.CONTINUE_STATEMENT) || tail.is(SyntaxKind.BREAK_STATEMENT);
                    }
                }
                boolean fallsThrough = !arrow && !terminated && !body.isEmpty() && !last;
                IrNode block = IrNode.block(inScope(ScopeKind.BLOCK, () -> convertStatements(body)));

                if (isDefault) {
                    IrNode.IrNodeBuilder builder = IrNode.builder().kind(IrKind.OTHERWISE_BRANCH).child(block);
                    if (!allLabels.isEmpty()) {
                        builder.annotation("Cases " + String.join(", ", allLabels) + " also reach OTHERWISE");
                    }
                    if (fallsThrough) {
                        builder.annotation("Falls through to the next case");
                        reportFallThrough("default", switchCase);
                    }
                    otherwise = builder.build();
                    continue;
                }
                String label = String.join(", ", allLabels);
                IrNode.IrNodeBuilder builder = IrNode.builder()
                        .kind(IrKind.CASE_BRANCH)
                        .meta(IrMetadata.LABEL, label)
                        .child(block);
                if (fallsThrough) {
                    builder.meta(IrMetadata.FALLS_THROUGH, "true").annotation("Falls through to the next case");
                    reportFallThrough(label, switchCase);
                }
                branches.add(builder.build());
            }
        } finally {
            controls.pop();
        }
        if (otherwise != null) {
            branches.add(otherwise);
        }
        return List.of(IrNode.builder()
                .kind(IrKind.CASE)
                .meta(IrMetadata.EXPRESSION, subject)
                .children(branches)
                .build());
    }

    private void reportFallThrough(String label, SyntaxNode switchCase) {
        diagnostics.warning(DiagnosticCode.SWITCH_FALL_THROUGH,
                "Case " + label + " falls through to the next case", switchCase.getLine(), switchCase.getColumn(),
                "End the case with break");
    }

    private List<IrNode> convertJump(SyntaxNode node) {
        boolean isBreak = node.is(SyntaxKind.BREAK_STATEMENT);
        String label = node.getValue() == null ? "" : " " + node.getValue();
        ControlKind enclosing = controls.peek();
        String text;
        if (!isBreak) {
            text = "continue" + label + ": skip to the next pass of the loop";
        } else if (enclosing == ControlKind.SWITCH && label.isEmpty()) {
            text = "break: leave the CASE here";
        } else {
            text = "break" + label + ": exit the loop here";
        }
        diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                (isBreak ? "break" : "continue") + " on line " + node.getLine() + " has no pseudocode equivalent",
                node.getLine(), node.getColumn(), "Rewrite the loop condition so the loop ends naturally");
        return List.of(IrNode.comment(List.of(text)));
    }

    private List<IrNode> convertReturn(SyntaxNode node) {
        CallableFrame frame = callables.peek();
        if (node.childCount() == 0) {
            return List.of(IrNode.builder().kind(IrKind.RETURN).build());
        }
        SyntaxNode value = node.child(0).unwrapParentheses();
        if (frame != null && frame.isProcedure() && !frame.isReturnReported()) {
            frame.setReturnReported(true);
            diagnostics.warning(DiagnosticCode.MANUAL_REVIEW,
                    "Procedure " + frame.getName() + " returns a value", node.getLine(), node.getColumn(),
                    "Declare a return type so that it becomes a FUNCTION");
        }
        if (value.is(SyntaxKind.CONDITIONAL_EXPRESSION)) {
            return List.of(expandConditional(value, text -> IrNode.builder()
                    .kind(IrKind.RETURN)
                    .meta(IrMetadata.EXPRESSION, text)
                    .build()));
        }
        return List.of(IrNode.builder()
                .kind(IrKind.RETURN)
                .meta(IrMetadata.EXPRESSION, expressions.render(node.child(0)))
                .build());
    }

    private List<IrNode> convertThrow(SyntaxNode node) {
        String error = expressions.render(node.child(0));
        diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "throw on line " + node.getLine() + " converted to a comment", node.getLine(), node.getColumn(),
                "Report the problem with OUTPUT");
        return List.of(IrNode.comment(List.of("Error raised here: " + error)));
    }

    private List<IrNode> convertTry(SyntaxNode node) {
        context.annotate("try block: the statements run without error handling");
        diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "try statement on line " + node.getLine() + " converted without error handling",
                node.getLine(), node.getColumn(), "Check values with IF statements");
        List<IrNode> result = new ArrayList<>(inScope(ScopeKind.BLOCK,
                () -> convertStatements(node.child(0).getChildren())));
        for (SyntaxNode clause : node.childrenOf(SyntaxKind.CATCH_CLAUSE)) {
            SyntaxNode block = clause.child(0);
            if (clause.flag(SyntaxAttributes.FINALLY)) {
                List<IrNode> finallyStatements = inScope(ScopeKind.BLOCK,
                        () -> convertStatements(block.getChildren()));
                result.add(IrNode.comment(List.of("finally block: always runs")));
                result.addAll(finallyStatements);
                continue;
            }
            String type = clause.attribute(SyntaxAttributes.TYPE);
            String parameter = clause.getValue() == null ? "" : " " + clause.getValue();
            result.add(IrNode.comment(List.of("Error handler" + (type == null ? "" : " for " + type) + parameter
                    + " not converted (" + block.childCount() + " statements)")));
        }
        return result;
    }

    private List<IrNode> convertUnsupported(SyntaxNode node) {
        String feature = node.attribute(SyntaxAttributes.FEATURE);
        if (feature != null && SILENT_FEATURES.contains(feature)) {
            return List.of();
        }
        return List.of(IrNode.comment(List.of("Unsupported " + feature + ": " + node.getValue())));
    }

    // ------------------------------------------------------------------
    // Expression statements
    // ------------------------------------------------------------------

    private List<IrNode> convertExpressionStatement(SyntaxNode expression) {
        SyntaxNode node = expression.unwrapParentheses();
        return switch (node.getKind()) {
            case ASSIGNMENT -> convertAssignment(node);
            case UPDATE_EXPRESSION -> {
                String target = renderTarget(node.child(0));
                String operator = node.attribute(SyntaxAttributes.OPERATOR).equals("++") ? " + 1" : " - 1";
                yield List.of(assignment(target, target + operator));
            }
            case CALL_EXPRESSION -> convertCall(node);
            case UNARY_EXPRESSION -> {
                if ("await".equals(node.attribute(SyntaxAttributes.OPERATOR))) {
                    context.annotate("await removed; the call runs to completion");
                    yield convertExpressionStatement(node.child(0));
                }
                yield List.of(IrNode.text(IrKind.EXPRESSION, expressions.render(node)));
            }
            case CONDITIONAL_EXPRESSION -> {
                context.annotate("Conditional expression expanded to IF");
                diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                        "Conditional expression statement expanded to IF", node.getLine(), node.getColumn());
                yield List.of(IrNode.builder()
                        .kind(IrKind.IF)
                        .meta(IrMetadata.CONDITION, expressions.condition(node.child(0)))
                        .child(IrNode.block(convertExpressionStatement(node.child(1))))
                        .child(IrNode.block(convertExpressionStatement(node.child(2))))
                        .build());
            }
            case SEQUENCE_EXPRESSION -> node.getChildren().stream()
                    .flatMap(child -> convertExpressionStatement(child).stream())
                    .toList();
            default -> List.of(IrNode.text(IrKind.EXPRESSION, expressions.render(node)));
        };
    }

    private List<IrNode> convertAssignment(SyntaxNode node) {
        String operator = node.attribute(SyntaxAttributes.OPERATOR);
        SyntaxNode targetNode = node.child(0);
        SyntaxNode value = node.child(1).unwrapParentheses();

        if (operator.equals("=") && value.is(SyntaxKind.ASSIGNMENT) && "=".equals(value.attribute(SyntaxAttributes.OPERATOR))) {
            context.annotate("Chained assignment split into separate assignments");
            List<IrNode> result = new ArrayList<>(convertAssignment(value));
            result.add(assignment(renderTarget(targetNode), renderTarget(value.child(0))));
            return result;
        }
        String target = renderTarget(targetNode);
        if (operator.equals("=")) {
            SyntaxNode inputSource = unwrapConversion(value);
            if (inputSource.is(SyntaxKind.CALL_EXPRESSION) && isInputCall(inputSource)) {
                return input(target, inputSource);
            }
            if (value.is(SyntaxKind.CONDITIONAL_EXPRESSION)) {
                return List.of(expandConditional(value, text -> assignment(target, text)));
            }
            return List.of(assignment(target, expressions.render(node.child(1))));
        }

        String base = operator.substring(0, operator.length() - 1);
        PseudoType targetType = expressions.typeOf(targetNode);
        PseudoType valueType = expressions.typeOf(value);
        String valueText = expressions.render(value);
        String expanded = switch (base) {
            case "+" -> target + ((targetType != null && targetType.isString()) ? " & " : " + ") + group(valueText);
            case "-", "*" -> target + " " + base + " " + group(valueText);
            case "/" -> targetType != null && targetType.isInteger() && valueType != null && valueType.isInteger()
                    ? "DIV(" + target + ", " + valueText + ")"
                    : target + " / " + group(valueText);
            case "%" -> target + " MOD " + group(valueText);
            case "**" -> target + " ^ " + group(valueText);
            case "&&" -> target + " AND " + group(valueText);
            case "||" -> target + " OR " + group(valueText);
            default -> {
                diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                        "Compound operator '" + operator + "' has no pseudocode equivalent", node.getLine(),
                        node.getColumn());
                yield target + " " + base + " " + group(valueText);
            }
        };
        return List.of(assignment(target, expanded));
    }

    /**
     * Renders an assignment target. Plain names are written as-is, even for counters that count from 1.
     */
    private String renderTarget(SyntaxNode target) {
        SyntaxNode node = target.unwrapParentheses();
        if (node.is(SyntaxKind.IDENTIFIER)) {
            String name = node.getValue();
            if (!context.isKnownName(name)) {
                context.reportUndeclared(name, node.getLine());
            }
            return name;
        }
        return expressions.render(node);
    }

    private List<IrNode> convertCall(SyntaxNode call) {
        if (isOutputCall(call)) {
            return List.of(output(call));
        }
        if (isInputCall(call)) {
            SyntaxNode prompt = inputPrompt(call);
            log.debug("Dropped input call without a target on line {}", call.getLine());
            return prompt == null ? List.of() : List.of(outputNode(expressions.render(prompt)));
        }
        SyntaxNode callee = call.child(0);
        if (callee.is(SyntaxKind.MEMBER_ACCESS) && callee.child(0).is(SyntaxKind.IDENTIFIER)
                && context.getInputReaders().contains(callee.child(0).getValue())) {
            log.debug("Dropped {} on input reader {}", callee.getValue(), callee.child(0).getValue());
            return List.of();
        }
        Optional<IrNode> append = appendAssignment(call);
        if (append.isPresent()) {
            return List.of(append.get());
        }
        return List.of(IrNode.text(IrKind.PROCEDURE_CALL, expressions.render(call)));
    }

    /**
     * {@code sb.append(a).append(b)} on a string builder becomes {@code sb ← sb & a & b}.
     */
    private Optional<IrNode> appendAssignment(SyntaxNode call) {
        List<SyntaxNode> parts = new ArrayList<>();
        SyntaxNode current = call;
        while (current.is(SyntaxKind.CALL_EXPRESSION) && current.child(0).is(SyntaxKind.MEMBER_ACCESS)
                && current.child(0).getValue().equals("append") && current.childCount() == 2) {
            parts.add(0, current.child(1));
            current = current.child(0).child(0);
        }
        if (parts.isEmpty() || !current.is(SyntaxKind.IDENTIFIER)) {
            return Optional.empty();
        }
        PseudoType type = expressions.typeOf(current);
        if (type == null || !type.isString()) {
            return Optional.empty();
        }
        String target = current.getValue();
        String appended = parts.stream().map(expressions::operand).map(IndexArithmetic::group)
                .collect(Collectors.joining(" & "));
        diagnostics.info(DiagnosticCode.METHOD_MAPPING, "append converted to string concatenation with &",
                call.getLine(), call.getColumn());
        return Optional.of(assignment(target, target + " & " + appended));
    }

    private boolean isOutputCall(SyntaxNode call) {
        SyntaxNode callee = call.child(0);
        if (callee.is(SyntaxKind.IDENTIFIER) && GENERIC_PRINT.contains(callee.getValue())
                && scopes.lookupCallable(callee.getValue()).isEmpty()) {
            return true;
        }
        return isLanguageOutputCall(call);
    }

    private IrNode output(SyntaxNode call) {
        List<SyntaxNode> args = call.getChildren().subList(1, call.childCount());
        if (args.isEmpty()) {
            return outputNode("\"\"");
        }
        if (isFormattedOutput(call)) {
            context.annotate("Formatted output; the format string is kept as written");
            diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                    "Formatted output has no pseudocode equivalent", call.getLine(), call.getColumn(),
                    "Build the text with & and OUTPUT it");
            return outputNode(expressions.renderList(args));
        }
        List<String> parts = new ArrayList<>();
        for (SyntaxNode arg : args) {
            parts.addAll(expressions.outputParts(arg));
        }
        return outputNode(String.join(", ", parts));
    }

    private List<IrNode> input(String target, SyntaxNode call) {
        List<IrNode> result = new ArrayList<>();
        SyntaxNode prompt = inputPrompt(call);
        if (prompt != null) {
            result.add(outputNode(expressions.render(prompt)));
        }
        result.add(IrNode.builder().kind(IrKind.INPUT).meta(IrMetadata.TARGET, target).build());
        return result;
    }

    private SyntaxNode unwrapConversion(SyntaxNode node) {
        SyntaxNode current = node.unwrapParentheses();
        while (current.is(SyntaxKind.CALL_EXPRESSION) && current.childCount() == 2 && isConversionCall(current)) {
            current = current.child(1).unwrapParentheses();
        }
        return current;
    }

    private IrNode expandConditional(SyntaxNode conditional, Function<String, IrNode> branch) {
        context.annotate("Conditional expression expanded to IF");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED, "Conditional expression expanded to IF",
                conditional.getLine(), conditional.getColumn());
        return IrNode.builder()
                .kind(IrKind.IF)
                .meta(IrMetadata.CONDITION, expressions.condition(conditional.child(0)))
                .child(IrNode.block(List.of(branch.apply(expressions.render(conditional.child(1))))))
                .child(IrNode.block(List.of(branch.apply(expressions.render(conditional.child(2))))))
                .build();
    }

    private static IrNode assignment(String target, String expression) {
        return IrNode.builder()
                .kind(IrKind.ASSIGNMENT)
                .meta(IrMetadata.TARGET, target)
                .meta(IrMetadata.EXPRESSION, expression)
                .build();
    }

    private static IrNode outputNode(String expression) {
        return IrNode.builder().kind(IrKind.OUTPUT).meta(IrMetadata.EXPRESSION, expression).build();
    }

    /**
     * Dotted path of a callee such as {@code System.out.println}, or null for other shapes.
     */
    protected static String calleePath(SyntaxNode call) {
        return path(call.child(0));
    }

    private static String path(SyntaxNode node) {
        if (node.is(SyntaxKind.IDENTIFIER)) {
            return node.getValue();
        }
        if (node.is(SyntaxKind.MEMBER_ACCESS)) {
            String owner = path(node.child(0));
            return owner == null ? null : owner + "." + node.getValue();
        }
        return null;
    }

    protected TransformContext getContext() {
        return context;
    }

    private enum ControlKind {
        LOOP,
        SWITCH
    }

    @Data
    private static final class CallableFrame {
        private final String name;
        private final boolean procedure;
        private boolean returnReported;
    }
}
