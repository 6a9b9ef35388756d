package com.examboard.pseudocode.transform;

import static com.examboard.pseudocode.transform.mapping.IndexArithmetic.group;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.scope.CallableInfo;
import com.examboard.pseudocode.scope.ScopeKind;
import com.examboard.pseudocode.scope.ScopeManager;
import com.examboard.pseudocode.scope.VariableInfo;
import com.examboard.pseudocode.transform.mapping.ArgumentRenderer;
import com.examboard.pseudocode.transform.mapping.IndexArithmetic;
import com.examboard.pseudocode.transform.mapping.MappedCall;
import com.examboard.pseudocode.transform.mapping.StringMethodMapper;
import com.examboard.pseudocode.transform.types.PseudoType;

/**
 * Renders expression subtrees as pseudocode text and infers their types.
 *
 * Rendering applies the operator vocabulary, 0-based to 1-based index conversion, library
 * method mapping and identifier resolution. Type inference never reports diagnostics.
 */
public class ExpressionTranslator implements ArgumentRenderer {
    private static final Logger log = LoggerFactory.getLogger(ExpressionTranslator.class);

    private static final Map<String, String> OPERATORS = Map.ofEntries(
        Map.entry("==", "="),
        Map.entry("===", "="),
        Map.entry("!=", "<>"),
        Map.entry("!==", "<>"),
        Map.entry("&&", "AND"),
        Map.entry("||", "OR"),
        Map.entry("%", "MOD"),
        Map.entry("**", "^"),
        Map.entry("+", "+"),
        Map.entry("-", "-"),
        Map.entry("*", "*"),
        Map.entry("/", "/"),
        Map.entry("<", "<"),
        Map.entry(">", ">"),
        Map.entry("<=", "<="),
        Map.entry(">=", ">=")
    );

    private static final Set<String> COMPARISONS = Set.of(
        "==", "===", "!=", "!==", "<", ">", "<=", ">=", "&&", "||", "instanceof", "in"
    );

    private static final Set<String> INTEGER_CASTS = Set.of("int", "long", "short", "byte");

    private final TransformContext context;
    private final StringMethodMapper methods;
    private final Diagnostics diagnostics;
    private final ScopeManager scopes;

    public ExpressionTranslator(TransformContext context) {
        this.context = context;
        this.diagnostics = context.getDiagnostics();
        this.scopes = context.getScopes();
        this.methods = new StringMethodMapper(diagnostics);
    }

    @Override
    public String value(SyntaxNode argument) {
        return render(argument);
    }

    public String render(SyntaxNode node) {
        return switch (node.getKind()) {
            case LITERAL -> literal(node);
            case TEMPLATE_LITERAL -> template(node);
            case IDENTIFIER -> identifier(node);
            case PARENTHESIZED -> parenthesized(node);
            case BINARY_EXPRESSION -> binary(node);
            case UNARY_EXPRESSION -> unary(node);
            case UPDATE_EXPRESSION -> nestedUpdate(node);
            case ASSIGNMENT -> nestedAssignment(node);
            case CONDITIONAL_EXPRESSION -> inlineConditional(node);
            case CALL_EXPRESSION -> call(node);
            case MEMBER_ACCESS -> member(node);
            case INDEX_ACCESS -> index(node);
            case NEW_EXPRESSION -> newObject(node);
            case NEW_ARRAY -> newArray(node);
            case ARRAY_LITERAL -> arrayLiteral(node);
            case OBJECT_LITERAL -> objectLiteral(node);
            case PROPERTY_ASSIGNMENT -> node.getValue() + ": " + render(node.child(0));
            case LAMBDA_EXPRESSION -> inlineLambda(node);
            case CAST_EXPRESSION -> cast(node);
            case SPREAD_ELEMENT -> "..." + render(node.child(0));
            case SEQUENCE_EXPRESSION, EXPRESSION_LIST -> renderList(node.getChildren());
            case UNSUPPORTED -> node.getValue();
            case EMPTY -> "";
            case PROGRAM, CLASS_DECLARATION, INTERFACE_DECLARATION, ENUM_DECLARATION, TYPE_ALIAS,
                    FIELD_DECLARATION, METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, PARAMETER,
                    VARIABLE_DECLARATION, DECLARATION_GROUP, DESTRUCTURING_DECLARATION, BLOCK, IF_STATEMENT,
                    WHILE_STATEMENT, DO_WHILE_STATEMENT, FOR_STATEMENT, FOR_EACH_STATEMENT, SWITCH_STATEMENT,
                    SWITCH_CASE, BREAK_STATEMENT, CONTINUE_STATEMENT, RETURN_STATEMENT, THROW_STATEMENT,
                    TRY_STATEMENT, CATCH_CLAUSE, EXPRESSION_STATEMENT ->
                    throw new IllegalStateException(node.getKind() + " on line " + node.getLine()
                            + " cannot be rendered as an expression");
        };
    }

    public String renderList(List<SyntaxNode> nodes) {
        return nodes.stream().map(this::render).collect(Collectors.joining(", "));
    }

    /**
     * Renders an operand of an operator, adding parentheses when a mapped call expanded into an operation.
     */
    public String operand(SyntaxNode node) {
        String text = render(node);
        return switch (node.getKind()) {
            case CALL_EXPRESSION, MEMBER_ACCESS, TEMPLATE_LITERAL, CAST_EXPRESSION -> group(text);
            default -> text;
        };
    }

    /**
     * Renders a condition; a negation of a comparison keeps its parentheses.
     */
    public String condition(SyntaxNode node) {
        SyntaxNode inner = node.unwrapParentheses();
        return render(inner);
    }

    /**
     * Renders the logical negation of a condition, inverting comparisons where possible.
     */
    public String negate(SyntaxNode node) {
        SyntaxNode inner = node.unwrapParentheses();
        if (inner.is(SyntaxKind.UNARY_EXPRESSION) && "!".equals(inner.attribute(SyntaxAttributes.OPERATOR))) {
            return condition(inner.child(0));
        }
        if (inner.is(SyntaxKind.BINARY_EXPRESSION)) {
            String inverted = switch (inner.attribute(SyntaxAttributes.OPERATOR)) {
                case "<" -> ">=";
                case ">" -> "<=";
                case "<=" -> ">";
                case ">=" -> "<";
                case "==", "===" -> "<>";
                case "!=", "!==" -> "=";
                default -> null;
            };
            if (inverted != null) {
                return operand(inner.child(0)) + " " + inverted + " " + operand(inner.child(1));
            }
        }
        if (inner.isLiteral(SyntaxAttributes.LITERAL_BOOLEAN)) {
            return "true".equals(inner.getValue()) ? "FALSE" : "TRUE";
        }
        return "NOT " + group(render(inner));
    }

    /**
     * Splits a string concatenation into the comma separated parts of an OUTPUT statement.
     */
    public List<String> outputParts(SyntaxNode node) {
        List<String> parts = new ArrayList<>();
        collectOutputParts(node, parts);
        return parts;
    }

    private void collectOutputParts(SyntaxNode node, List<String> parts) {
        if (node.is(SyntaxKind.BINARY_EXPRESSION) && "+".equals(node.attribute(SyntaxAttributes.OPERATOR))
                && isString(typeOf(node))) {
            SyntaxNode left = node.child(0);
            if (isString(typeOf(left))) {
                collectOutputParts(left, parts);
            } else {
                parts.add(render(left));
            }
            SyntaxNode right = node.child(1);
            if (right.is(SyntaxKind.TEMPLATE_LITERAL)) {
                collectOutputParts(right, parts);
            } else {
                parts.add(render(right));
            }
            return;
        }
        if (node.is(SyntaxKind.TEMPLATE_LITERAL) && node.childCount() > 0) {
            context.annotate("Template literal converted to an OUTPUT list");
            for (SyntaxNode part : node.getChildren()) {
                parts.add(part.flag(SyntaxAttributes.TEMPLATE_PART) ? "\"" + part.getValue() + "\"" : render(part));
            }
            return;
        }
        parts.add(render(node));
    }

    // ------------------------------------------------------------------
    // Literals and names
    // ------------------------------------------------------------------

    private String literal(SyntaxNode node) {
        String value = node.getValue();
        return switch (node.attribute(SyntaxAttributes.LITERAL_TYPE)) {
            case SyntaxAttributes.LITERAL_INTEGER -> integerLiteral(value);
            case SyntaxAttributes.LITERAL_DECIMAL -> decimalLiteral(value);
            case SyntaxAttributes.LITERAL_STRING -> "\"" + value + "\"";
            case SyntaxAttributes.LITERAL_CHAR -> "'" + value + "'";
            case SyntaxAttributes.LITERAL_BOOLEAN -> "true".equals(value) ? "TRUE" : "FALSE";
            case SyntaxAttributes.LITERAL_NULL -> "NULL";
            default -> value;
        };
    }

    static String integerLiteral(String raw) {
        String text = raw.replace("_", "");
        while (!text.isEmpty() && "lLn".indexOf(text.charAt(text.length() - 1)) >= 0) {
            text = text.substring(0, text.length() - 1);
        }
        String lower = text.toLowerCase();
        try {
            if (lower.startsWith("0x")) {
                return String.valueOf(Long.parseLong(text.substring(2), 16));
            }
            if (lower.startsWith("0b")) {
                return String.valueOf(Long.parseLong(text.substring(2), 2));
            }
        } catch (NumberFormatException e) {
            log.debug("Keeping literal {} as written: {}", raw, e.getMessage());
        }
        return text;
    }

    private static String decimalLiteral(String raw) {
        String text = raw.replace("_", "");
        if (!text.isEmpty() && "fFdD".indexOf(text.charAt(text.length() - 1)) >= 0) {
            text = text.substring(0, text.length() - 1);
        }
        if (text.startsWith(".")) {
            text = "0" + text;
        }
        if (text.endsWith(".")) {
            text = text + "0";
        }
        return text;
    }

    private String template(SyntaxNode node) {
        if (node.childCount() == 0) {
            return "\"\"";
        }
        boolean interpolated = node.getChildren().stream().anyMatch(c -> !c.flag(SyntaxAttributes.TEMPLATE_PART));
        if (interpolated) {
            context.annotate("Template literal converted to string concatenation");
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "Template literal converted to concatenation with &", node.getLine(), node.getColumn());
        }
        return node.getChildren().stream()
                .map(part -> part.flag(SyntaxAttributes.TEMPLATE_PART) ? "\"" + part.getValue() + "\"" : operand(part))
                .collect(Collectors.joining(" & "));
    }

    private String identifier(SyntaxNode node) {
        String name = node.getValue();
        if (name.equals("this") || name.equals("super")) {
            return name;
        }
        Optional<VariableInfo> variable = scopes.lookupVariable(name);
        if (variable.isPresent()) {
            if (variable.get().isIndexShifted()) {
                diagnostics.info(DiagnosticCode.LOOP_BOUND_CONVERSION,
                        "Loop variable " + name + " counts from 1; its value is written as (" + name + " - 1)",
                        node.getLine(), node.getColumn());
                return "(" + name + " - 1)";
            }
            return name;
        }
        if (!context.isKnownName(name)) {
            context.reportUndeclared(name, node.getLine());
        }
        return name;
    }

    private String parenthesized(SyntaxNode node) {
        SyntaxNode inner = node.unwrapParentheses();
        String text = render(inner);
        if (text.startsWith("(") && text.endsWith(")") && isSingleGroup(text)) {
            return text;
        }
        return "(" + text + ")";
    }

    private static boolean isSingleGroup(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Operators
    // ------------------------------------------------------------------

    private String binary(SyntaxNode node) {
        String operator = node.attribute(SyntaxAttributes.OPERATOR);
        SyntaxNode left = node.child(0);
        SyntaxNode right = node.child(1);
        int line = node.getLine();

        if (operator.equals("instanceof") || operator.equals("in")) {
            diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                    "Operator '" + operator + "' has no pseudocode equivalent", line, node.getColumn());
            String rightText = operator.equals("instanceof") ? right.getValue() : operand(right);
            return operand(left) + " " + operator + " " + rightText;
        }

        String leftText = operand(left);
        String rightText = operand(right);
        if (operator.equals("+") && (isString(typeOf(left)) || isString(typeOf(right)))) {
            return leftText + " & " + rightText;
        }
        if (operator.equals("/") && isInteger(typeOf(left)) && isInteger(typeOf(right))) {
            return "DIV(" + render(left) + ", " + render(right) + ")";
        }
        String mapped = OPERATORS.get(operator);
        if (mapped == null) {
            diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                    "Operator '" + operator + "' has no pseudocode equivalent and was kept as written",
                    line, node.getColumn());
            mapped = operator;
        }
        return leftText + " " + mapped + " " + rightText;
    }

    private String unary(SyntaxNode node) {
        String operator = node.attribute(SyntaxAttributes.OPERATOR);
        SyntaxNode operandNode = node.child(0);
        return switch (operator) {
            case "!" -> "NOT " + operand(operandNode);
            case "-" -> "-" + operand(operandNode);
            case "+" -> operand(operandNode);
            case "await" -> {
                context.annotate("await removed; the call runs to completion");
                yield render(operandNode);
            }
            default -> {
                diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                        "Operator '" + operator + "' has no pseudocode equivalent", node.getLine(), node.getColumn());
                yield operator + (Character.isLetter(operator.charAt(0)) ? " " : "") + operand(operandNode);
            }
        };
    }

    private String nestedUpdate(SyntaxNode node) {
        String target = render(node.child(0));
        diagnostics.warning(DiagnosticCode.MANUAL_REVIEW,
                "The update " + node.attribute(SyntaxAttributes.OPERATOR) + " on " + target
                        + " inside an expression was not converted and may need manual review",
                node.getLine(), node.getColumn(), "Move the increment into its own statement");
        return target;
    }

    private String nestedAssignment(SyntaxNode node) {
        String target = render(node.child(0));
        diagnostics.warning(DiagnosticCode.MANUAL_REVIEW,
                "Assignment to " + target + " inside an expression may need manual review",
                node.getLine(), node.getColumn(), "Move the assignment into its own statement");
        return target + " ← " + render(node.child(1));
    }

    private String inlineConditional(SyntaxNode node) {
        context.annotate("Conditional expression written inline");
        diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Conditional expression written as an inline IF", node.getLine(), node.getColumn());
        return "(IF " + condition(node.child(0)) + " THEN " + render(node.child(1))
                + " ELSE " + render(node.child(2)) + ")";
    }

    private String cast(SyntaxNode node) {
        String type = node.attribute(SyntaxAttributes.TYPE);
        String operandText = render(node.child(0));
        if (type != null && INTEGER_CASTS.contains(type) && !isInteger(typeOf(node.child(0)))) {
            diagnostics.info(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                    "Cast to " + type + " converted to INT", node.getLine(), node.getColumn());
            return "INT(" + operandText + ")";
        }
        return operandText;
    }

    // ------------------------------------------------------------------
    // Calls, members and indexing
    // ------------------------------------------------------------------

    private String call(SyntaxNode node) {
        SyntaxNode callee = node.child(0);
        List<SyntaxNode> args = node.getChildren().subList(1, node.childCount());
        int line = node.getLine();

        if (callee.is(SyntaxKind.MEMBER_ACCESS)) {
            SyntaxNode receiver = callee.child(0);
            String method = callee.getValue();
            if (receiver.isIdentifier("this")) {
                return method + "(" + renderList(args) + ")";
            }
            if (receiver.is(SyntaxKind.IDENTIFIER) && !scopes.lookupVariable(receiver.getValue()).isPresent()) {
                Optional<MappedCall> mapped = methods.mapStaticCall(receiver.getValue(), method, args, this, line);
                if (mapped.isPresent()) {
                    return mapped.get().getText();
                }
            }
            String receiverText = render(receiver);
            Optional<MappedCall> mapped = methods.mapInstanceCall(receiverText, typeOf(receiver), method, args,
                    this, line);
            if (mapped.isPresent()) {
                return mapped.get().getText();
            }
            return receiverText + "." + method + "(" + renderList(args) + ")";
        }
        if (callee.is(SyntaxKind.IDENTIFIER)) {
            String name = callee.getValue();
            if (!context.isKnownName(name)) {
                context.reportUndeclared(name, line);
            }
            return name + "(" + renderList(args) + ")";
        }
        return render(callee) + "(" + renderList(args) + ")";
    }

    private String member(SyntaxNode node) {
        SyntaxNode object = node.child(0);
        String property = node.getValue();
        if (object.isIdentifier("this")) {
            Optional<ScopeKind> declaredIn = scopes.scopeKindOf(property);
            if (declaredIn.isPresent() && declaredIn.get() != ScopeKind.CLASS && declaredIn.get() != ScopeKind.GLOBAL) {
                // A local of the same name hides the field.
                return "this." + property;
            }
            return property;
        }
        if (property.equals("length")) {
            return methods.mapLengthProperty(render(object), node.getLine()).getText();
        }
        if (object.is(SyntaxKind.IDENTIFIER) && context.getEnumNames().contains(object.getValue())) {
            return property;
        }
        return render(object) + "." + property;
    }

    private String index(SyntaxNode node) {
        String target = render(node.child(0));
        SyntaxNode indexNode = node.child(1);
        if (indexNode.unwrapParentheses().isLiteral(SyntaxAttributes.LITERAL_STRING)) {
            return target + "[" + render(indexNode) + "]";
        }
        return target + "[" + oneBased(indexNode) + "]";
    }

    /**
     * Converts a 0-based index or position into its 1-based form.
     */
    @Override
    public String oneBased(SyntaxNode argument) {
        SyntaxNode index = argument.unwrapParentheses();
        int line = argument.getLine();
        int column = argument.getColumn();
        if (index.isLiteral(SyntaxAttributes.LITERAL_INTEGER)) {
            String original = integerLiteral(index.getValue());
            String shifted = IndexArithmetic.plusOne(original);
            diagnostics.info(DiagnosticCode.ARRAY_INDEX_CONVERSION,
                    "Array index " + original + " converted to " + shifted, line, column);
            return shifted;
        }
        if (index.is(SyntaxKind.IDENTIFIER)) {
            if (isShifted(index)) {
                diagnostics.info(DiagnosticCode.ARRAY_INDEX_CONVERSION,
                        "Index " + index.getValue() + " left unchanged; the loop already counts from 1", line, column);
                return index.getValue();
            }
            String name = render(index);
            diagnostics.info(DiagnosticCode.ARRAY_INDEX_CONVERSION,
                    "Array index " + name + " converted to " + name + " + 1", line, column);
            return name + " + 1";
        }
        if (containsIndexAccess(index)) {
            diagnostics.warning(DiagnosticCode.MANUAL_REVIEW,
                    "Nested index expression on line " + line + " may need manual review", line, column,
                    "Store the inner element in a variable first");
        }
        if (mentionsShiftedVariable(index)) {
            String shifted = shiftedIndex(index);
            diagnostics.info(DiagnosticCode.ARRAY_INDEX_CONVERSION,
                    "Index on line " + line + " uses a loop variable that counts from 1; converted to " + shifted,
                    line, column);
            return shifted;
        }
        String text = render(index);
        String shifted = IndexArithmetic.plusOne(text);
        diagnostics.info(DiagnosticCode.ARRAY_INDEX_CONVERSION,
                "Array index " + text + " converted to " + shifted, line, column);
        return shifted;
    }

    /**
     * Rewrites an index whose sum mentions 1-based loop variables. Each such variable stands for
     * {@code v - 1}; a variable that is a whole term of the sum keeps its name and the offset is folded
     * into the constant, any other use is written as {@code (v - 1)}. One is added for 1-based numbering.
     */
    private String shiftedIndex(SyntaxNode index) {
        StringBuilder text = new StringBuilder();
        long[] constant = { 1 };
        collectTerms(index, 1, text, constant);
        if (text.length() == 0) {
            return String.valueOf(constant[0]);
        }
        return IndexArithmetic.shift(text.toString(), constant[0]);
    }

    private void collectTerms(SyntaxNode node, int sign, StringBuilder text, long[] constant) {
        SyntaxNode term = node.unwrapParentheses();
        if (term.is(SyntaxKind.BINARY_EXPRESSION)) {
            String operator = term.attribute(SyntaxAttributes.OPERATOR);
            if (operator.equals("+") || operator.equals("-")) {
                collectTerms(term.child(0), sign, text, constant);
                collectTerms(term.child(1), operator.equals("+") ? sign : -sign, text, constant);
                return;
            }
        }
        if (term.isLiteral(SyntaxAttributes.LITERAL_INTEGER)) {
            String value = integerLiteral(term.getValue());
            if (IndexArithmetic.isInteger(value)) {
                constant[0] += sign * Long.parseLong(value);
                return;
            }
        }
        String rendered;
        if (term.is(SyntaxKind.IDENTIFIER) && isShifted(term)) {
            constant[0] -= sign;
            rendered = term.getValue();
        } else {
            rendered = operand(term);
            if (sign < 0 && !term.is(SyntaxKind.BINARY_EXPRESSION)) {
                rendered = IndexArithmetic.group(rendered);
            }
        }
        if (text.length() == 0) {
            text.append(sign < 0 ? "-" : "").append(rendered);
        } else {
            text.append(sign < 0 ? " - " : " + ").append(rendered);
        }
    }

    private boolean isShifted(SyntaxNode identifier) {
        return scopes.lookupVariable(identifier.getValue()).map(VariableInfo::isIndexShifted).orElse(false);
    }

    private boolean containsIndexAccess(SyntaxNode node) {
        if (node.is(SyntaxKind.INDEX_ACCESS)) {
            return true;
        }
        return node.getChildren().stream().anyMatch(this::containsIndexAccess);
    }

    private boolean mentionsShiftedVariable(SyntaxNode node) {
        if (node.is(SyntaxKind.IDENTIFIER)) {
            return isShifted(node);
        }
        if (node.is(SyntaxKind.MEMBER_ACCESS)) {
            return mentionsShiftedVariable(node.child(0));
        }
        return node.getChildren().stream().anyMatch(this::mentionsShiftedVariable);
    }

    // ------------------------------------------------------------------
    // Object creation and literals
    // ------------------------------------------------------------------

    private String newObject(SyntaxNode node) {
        String type = node.getValue();
        List<SyntaxNode> args = node.getChildren();
        if (type.equals("StringBuilder") || type.equals("StringBuffer") || type.equals("String")) {
            diagnostics.info(DiagnosticCode.METHOD_MAPPING, type + " converted to a STRING value",
                    node.getLine(), node.getColumn());
            if (args.isEmpty() || isInteger(typeOf(args.get(0)))) {
                return "\"\"";
            }
            return render(args.get(0));
        }
        return "NEW " + type + "(" + renderList(args) + ")";
    }

    private String newArray(SyntaxNode node) {
        Optional<SyntaxNode> initializer = node.findChild(SyntaxKind.ARRAY_LITERAL);
        if (initializer.isPresent()) {
            return render(initializer.get());
        }
        PseudoType type = typeOf(node);
        return type == null ? "NEW ARRAY" : type.render();
    }

    private String arrayLiteral(SyntaxNode node) {
        return "[" + renderList(node.getChildren()) + "]";
    }

    private String objectLiteral(SyntaxNode node) {
        diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                "Object literal has no pseudocode equivalent and was kept as written", node.getLine(),
                node.getColumn(), "Declare a class or separate variables");
        return "{" + renderList(node.getChildren()) + "}";
    }

    private String inlineLambda(SyntaxNode node) {
        context.annotate("Lambda expression kept inline; declare a named FUNCTION instead");
        diagnostics.warning(DiagnosticCode.CONSTRUCT_SIMPLIFIED,
                "Lambda expression kept inline", node.getLine(), node.getColumn(),
                "Declare a named FUNCTION and call it");
        List<SyntaxNode> parameters = node.childrenOf(SyntaxKind.PARAMETER);
        SyntaxNode body = node.child(node.childCount() - 1);
        scopes.enterScope(ScopeKind.FUNCTION);
        try {
            for (SyntaxNode parameter : parameters) {
                scopes.declareVariable(parameter.getValue(), null, List.of());
            }
            String parameterText = parameters.stream().map(SyntaxNode::getValue).collect(Collectors.joining(", "));
            String bodyText = body.is(SyntaxKind.BLOCK) ? "{ ... }" : render(body);
            return "(" + parameterText + ") => " + bodyText;
        } finally {
            scopes.exitScope();
        }
    }

    // ------------------------------------------------------------------
    // Type inference
    // ------------------------------------------------------------------

    /**
     * Infers the pseudocode type of an expression.
     *
     * @return null when the type cannot be determined
     */
    public PseudoType typeOf(SyntaxNode node) {
        return switch (node.getKind()) {
            case LITERAL -> literalType(node);
            case TEMPLATE_LITERAL -> PseudoType.STRING;
            case IDENTIFIER -> scopes.lookupVariable(node.getValue()).map(VariableInfo::getType).orElse(null);
            case PARENTHESIZED -> typeOf(node.child(0));
            case BINARY_EXPRESSION -> binaryType(node);
            case UNARY_EXPRESSION -> "!".equals(node.attribute(SyntaxAttributes.OPERATOR))
                    ? PseudoType.BOOLEAN : typeOf(node.child(0));
            case UPDATE_EXPRESSION, ASSIGNMENT -> typeOf(node.child(0));
            case CONDITIONAL_EXPRESSION -> {
                PseudoType whenTrue = typeOf(node.child(1));
                yield whenTrue != null ? whenTrue : typeOf(node.child(2));
            }
            case CALL_EXPRESSION -> callType(node);
            case MEMBER_ACCESS -> memberType(node);
            case INDEX_ACCESS -> {
                PseudoType target = typeOf(node.child(0));
                if (target == null) {
                    yield null;
                }
                yield target.isArray() ? target.indexed() : target.isString() ? PseudoType.CHAR : null;
            }
            case NEW_EXPRESSION -> newObjectType(node);
            case NEW_ARRAY -> newArrayType(node);
            case ARRAY_LITERAL -> arrayLiteralType(node);
            case CAST_EXPRESSION -> castType(node);
            case SEQUENCE_EXPRESSION -> typeOf(node.child(node.childCount() - 1));
            case OBJECT_LITERAL, PROPERTY_ASSIGNMENT, LAMBDA_EXPRESSION, SPREAD_ELEMENT, EXPRESSION_LIST,
                    UNSUPPORTED, EMPTY -> null;
            case PROGRAM, CLASS_DECLARATION, INTERFACE_DECLARATION, ENUM_DECLARATION, TYPE_ALIAS,
                    FIELD_DECLARATION, METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, PARAMETER,
                    VARIABLE_DECLARATION, DECLARATION_GROUP, DESTRUCTURING_DECLARATION, BLOCK, IF_STATEMENT,
                    WHILE_STATEMENT, DO_WHILE_STATEMENT, FOR_STATEMENT, FOR_EACH_STATEMENT, SWITCH_STATEMENT,
                    SWITCH_CASE, BREAK_STATEMENT, CONTINUE_STATEMENT, RETURN_STATEMENT, THROW_STATEMENT,
                    TRY_STATEMENT, CATCH_CLAUSE, EXPRESSION_STATEMENT -> null;
        };
    }

    private static PseudoType literalType(SyntaxNode node) {
        return switch (node.attribute(SyntaxAttributes.LITERAL_TYPE)) {
            case SyntaxAttributes.LITERAL_INTEGER -> PseudoType.INTEGER;
            case SyntaxAttributes.LITERAL_DECIMAL -> PseudoType.REAL;
            case SyntaxAttributes.LITERAL_STRING -> PseudoType.STRING;
            case SyntaxAttributes.LITERAL_CHAR -> PseudoType.CHAR;
            case SyntaxAttributes.LITERAL_BOOLEAN -> PseudoType.BOOLEAN;
            default -> null;
        };
    }

    private PseudoType binaryType(SyntaxNode node) {
        String operator = node.attribute(SyntaxAttributes.OPERATOR);
        if (COMPARISONS.contains(operator)) {
            return PseudoType.BOOLEAN;
        }
        PseudoType left = typeOf(node.child(0));
        PseudoType right = typeOf(node.child(1));
        if (operator.equals("+") && (isString(left) || isString(right))) {
            return PseudoType.STRING;
        }
        if (isInteger(left) && isInteger(right)) {
            return PseudoType.INTEGER;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return PseudoType.REAL;
        }
        if (operator.equals("??")) {
            return left != null ? left : right;
        }
        return left != null && left.isNumeric() ? left : right != null && right.isNumeric() ? right : null;
    }

    private PseudoType callType(SyntaxNode node) {
        SyntaxNode callee = node.child(0);
        if (callee.is(SyntaxKind.IDENTIFIER)) {
            return switch (callee.getValue()) {
                case "parseInt" -> PseudoType.INTEGER;
                case "parseFloat", "Number" -> PseudoType.REAL;
                case "String", "prompt" -> PseudoType.STRING;
                case "Boolean" -> PseudoType.BOOLEAN;
                default -> scopes.lookupCallable(callee.getValue()).flatMap(CallableInfo::getReturnType).orElse(null);
            };
        }
        if (!callee.is(SyntaxKind.MEMBER_ACCESS)) {
            return null;
        }
        SyntaxNode receiver = callee.child(0);
        String method = callee.getValue();
        if (receiver.isIdentifier("this")) {
            return scopes.lookupCallable(method).flatMap(CallableInfo::getReturnType).orElse(null);
        }
        if (receiver.is(SyntaxKind.IDENTIFIER) && !scopes.lookupVariable(receiver.getValue()).isPresent()) {
            PseudoType staticType = staticCallType(receiver.getValue(), method, node);
            if (staticType != null) {
                return staticType;
            }
        }
        PseudoType receiverType = typeOf(receiver);
        return switch (method) {
            case "length", "size", "indexOf", "nextInt", "nextLong", "nextShort", "nextByte" -> PseudoType.INTEGER;
            case "nextDouble", "nextFloat" -> PseudoType.REAL;
            case "nextLine", "next", "readLine" -> PseudoType.STRING;
            case "nextBoolean", "contains", "includes", "startsWith", "endsWith", "equals", "equalsIgnoreCase",
                    "isEmpty" -> PseudoType.BOOLEAN;
            case "charAt" -> PseudoType.CHAR;
            case "substring", "toUpperCase", "toLowerCase", "concat", "trim", "toString", "append" ->
                    receiverType == null || receiverType.isString() || receiverType.isFallback()
                            ? PseudoType.STRING : null;
            default -> null;
        };
    }

    private PseudoType staticCallType(String owner, String method, SyntaxNode call) {
        return switch (owner) {
            case "Math" -> switch (method) {
                case "round", "floor", "ceil" -> PseudoType.INTEGER;
                case "abs", "max", "min" -> call.childCount() > 1 ? typeOf(call.child(1)) : PseudoType.REAL;
                default -> PseudoType.REAL;
            };
            case "Integer", "Long", "Short", "Byte" -> method.startsWith("parse") || method.equals("valueOf")
                    ? PseudoType.INTEGER : null;
            case "Double", "Float" -> method.startsWith("parse") || method.equals("valueOf") ? PseudoType.REAL : null;
            case "Boolean" -> method.startsWith("parse") ? PseudoType.BOOLEAN : null;
            case "String" -> PseudoType.STRING;
            default -> null;
        };
    }

    private PseudoType memberType(SyntaxNode node) {
        SyntaxNode object = node.child(0);
        if (node.getValue().equals("length")) {
            return PseudoType.INTEGER;
        }
        if (object.isIdentifier("this")) {
            return scopes.lookupVariable(node.getValue()).map(VariableInfo::getType).orElse(null);
        }
        if (object.is(SyntaxKind.IDENTIFIER) && context.getEnumNames().contains(object.getValue())) {
            return PseudoType.INTEGER;
        }
        return null;
    }

    private PseudoType newObjectType(SyntaxNode node) {
        String type = node.getValue();
        if (type.equals("StringBuilder") || type.equals("StringBuffer") || type.equals("String")) {
            return PseudoType.STRING;
        }
        return context.getTypeNames().contains(type) ? PseudoType.userDefined(type) : null;
    }

    private PseudoType newArrayType(SyntaxNode node) {
        PseudoType element = quietNormalize(node.getValue());
        if (element == null) {
            return null;
        }
        List<String> dimensions = new ArrayList<>();
        Optional<SyntaxNode> initializer = node.findChild(SyntaxKind.ARRAY_LITERAL);
        for (SyntaxNode dimension : node.getChildren()) {
            if (dimension.is(SyntaxKind.ARRAY_LITERAL)) {
                continue;
            }
            dimensions.add(dimension.isEmpty() ? PseudoType.UNKNOWN_SIZE : quietRender(dimension));
        }
        if (initializer.isPresent()) {
            List<String> literalSizes = literalDimensions(initializer.get());
            for (int i = 0; i < dimensions.size() && i < literalSizes.size(); i++) {
                if (dimensions.get(i).equals(PseudoType.UNKNOWN_SIZE)) {
                    dimensions.set(i, literalSizes.get(i));
                }
            }
        }
        return PseudoType.arrayOf(element, dimensions);
    }

    private PseudoType arrayLiteralType(SyntaxNode node) {
        List<String> dimensions = literalDimensions(node);
        SyntaxNode element = node;
        while (element.is(SyntaxKind.ARRAY_LITERAL) && element.childCount() > 0) {
            element = element.child(0);
        }
        PseudoType elementType = element.is(SyntaxKind.ARRAY_LITERAL) ? null : typeOf(element);
        if (elementType == null || elementType.isArray()) {
            return null;
        }
        return PseudoType.arrayOf(elementType, dimensions);
    }

    /**
     * Sizes of a (possibly nested) array literal, taken from its first row at each level.
     */
    public List<String> literalDimensions(SyntaxNode literal) {
        List<String> dimensions = new ArrayList<>();
        SyntaxNode level = literal;
        while (level.is(SyntaxKind.ARRAY_LITERAL)) {
            dimensions.add(String.valueOf(level.childCount()));
            if (level.childCount() == 0) {
                break;
            }
            level = level.child(0);
        }
        return dimensions;
    }

    private PseudoType castType(SyntaxNode node) {
        String type = node.attribute(SyntaxAttributes.TYPE);
        PseudoType normalized = quietNormalize(type);
        return normalized != null && !normalized.isFallback() ? normalized : typeOf(node.child(0));
    }

    /**
     * Normalizes a type spelling without reporting fallbacks, for inference only.
     */
    private PseudoType quietNormalize(String spelling) {
        Diagnostics scratch = new Diagnostics();
        return context.getTypes().withDiagnostics(scratch).normalize(spelling, 0);
    }

    private String quietRender(SyntaxNode node) {
        if (node.isLiteral(SyntaxAttributes.LITERAL_INTEGER)) {
            return integerLiteral(node.getValue());
        }
        if (node.is(SyntaxKind.IDENTIFIER)) {
            return node.getValue();
        }
        return PseudoType.UNKNOWN_SIZE;
    }

    private static boolean isString(PseudoType type) {
        return type != null && type.isString();
    }

    private static boolean isInteger(PseudoType type) {
        return type != null && type.isInteger();
    }

    private static boolean isNumeric(PseudoType type) {
        return type != null && type.isNumeric();
    }
}
