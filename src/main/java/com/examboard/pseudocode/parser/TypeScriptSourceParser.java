package com.examboard.pseudocode.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.model.Language;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.parser.SourceToken.TokenType;

/**
 * Structural parser for TypeScript source, including automatic semicolon insertion
 * at line breaks.
 */
public class TypeScriptSourceParser extends AbstractSourceParser {
    private static final Logger log = LoggerFactory.getLogger(TypeScriptSourceParser.class);

    private static final Set<String> CLASS_MODIFIERS = Set.of(
        "public", "private", "protected", "static", "readonly", "abstract", "async", "declare",
        "override", "accessor"
    );

    private static final Set<String> PARAMETER_PROPERTY_MODIFIERS = Set.of(
        "public", "private", "protected", "readonly", "override"
    );

    public TypeScriptSourceParser() {
        this(ConversionOptions.DEFAULT_MAX_NESTING_DEPTH);
    }

    public TypeScriptSourceParser(int maxNestingDepth) {
        super(maxNestingDepth);
    }

    public TypeScriptSourceParser(ConversionOptions options) {
        this(options.getMaxNestingDepth());
    }

    @Override
    public Language getLanguage() {
        return Language.TYPESCRIPT;
    }

    @Override
    protected AbstractSourceParser createEmbeddedParser() {
        return new TypeScriptSourceParser(maxNestingDepth);
    }

    @Override
    protected boolean isArrowToken(SourceToken token) {
        return token.is("=>");
    }

    @Override
    protected SyntaxNode parseTopLevel() {
        return parseStatement();
    }

    @Override
    protected void consumeStatementEnd() {
        if (match(";")) {
            return;
        }
        SourceToken next = peek();
        if (next.is("}") || isAtEnd() || next.getLine() > previous().getLine()) {
            return;
        }
        throw error("Expected ';' or a line break after statement, found '" + next.getValue() + "'");
    }

    @Override
    protected boolean endsStatementImplicitly(SourceToken previous) {
        return peek().getLine() > previous.getLine();
    }

    // ------------------------------------------------------------------
    // Statements and declarations
    // ------------------------------------------------------------------

    @Override
    protected SyntaxNode parseLanguageStatement() {
        SourceToken t = peek();
        if (t.is("let") || t.is("const") || t.is("var")) {
            if (t.is("const") && peekAt(1).is("enum")) {
                advance();
                return parseEnum();
            }
            return parseVariableStatement(true);
        }
        if (t.is("function") || (t.is("async") && peekAt(1).is("function"))) {
            return parseFunction("");
        }
        if (t.is("class") || (t.is("abstract") && peekAt(1).is("class"))) {
            return parseClass("");
        }
        if (t.is("interface")) {
            return parseInterface();
        }
        if (t.is("type") && peekAt(1).isIdentifier() && (peekAt(2).is("=") || peekAt(2).is("<"))) {
            return parseTypeAlias();
        }
        if (t.is("enum")) {
            return parseEnum();
        }
        if (t.is("@")) {
            skipDecorator();
            return parseStatement();
        }
        if (t.is("import") && !peekAt(1).is("(")) {
            int from = pos;
            reportUnsupported("imports/exports", "Remove the import; pseudocode has no modules", t);
            skipModuleStatement();
            return unsupported(t, "imports", joinTokens(from, pos));
        }
        if (t.is("export")) {
            return parseExport();
        }
        if ((t.is("namespace") || t.is("module")) && peekAt(1).getLine() == t.getLine()
                && (peekAt(1).isIdentifier() || peekAt(1).getType() == TokenType.STRING_LITERAL)) {
            int from = pos;
            reportUnsupported("namespaces", "Declare the contents at the top level", t);
            while (!check("{") && !isAtEnd()) {
                advance();
            }
            skipBalanced("{", "}");
            return unsupported(t, "namespaces", joinTokens(from, pos));
        }
        if (t.is("declare") && peekAt(1).getLine() == t.getLine() && !peekAt(1).is("=")) {
            int from = pos;
            reportUnsupported("ambient declarations", "Remove declare statements", t);
            advance();
            if (check("namespace") || check("module") || check("global")) {
                while (!check("{") && !isAtEnd()) {
                    advance();
                }
                skipBalanced("{", "}");
            } else {
                skipPastSemicolon();
            }
            return unsupported(t, "ambient declarations", joinTokens(from, pos));
        }
        return null;
    }

    private SyntaxNode parseExport() {
        SourceToken exportToken = advance();
        reportUnsupported("imports/exports", "Remove the export keyword", exportToken);
        match("default");
        if (check("{") || check("*")) {
            int from = pos - 1;
            skipModuleStatement();
            return unsupported(exportToken, "exports", joinTokens(from, pos));
        }
        if (check("function") || check("async") || check("class") || check("abstract") || check("interface")
                || check("const") || check("let") || check("var") || check("enum") || check("type")) {
            return parseStatement();
        }
        // export default <expression>
        SyntaxNode expression = parseExpression();
        consumeStatementEnd();
        return node(SyntaxKind.EXPRESSION_STATEMENT, exportToken).child(expression).build();
    }

    /**
     * Skips an import or export clause, which may span several lines and ends with a module path.
     */
    private void skipModuleStatement() {
        int startLine = peek().getLine();
        while (!isAtEnd()) {
            SourceToken t = peek();
            if (t.is("{")) {
                skipBalanced("{", "}");
                continue;
            }
            if (t.is(";")) {
                advance();
                return;
            }
            if (t.getLine() > startLine && previous().getType() == TokenType.STRING_LITERAL) {
                return;
            }
            advance();
        }
    }

    private void skipDecorator() {
        SourceToken at = advance();
        reportUnsupported("decorators", "Remove decorators such as @Component", at);
        expectPropertyName();
        while (check(".") && peekAt(1).isIdentifier()) {
            advance();
            advance();
        }
        if (check("(")) {
            skipBalanced("(", ")");
        }
    }

    private SyntaxNode parseVariableStatement(boolean consumeEnd) {
        SourceToken kindToken = advance();
        String declarationKind = kindToken.getValue();
        List<SyntaxNode> declarations = new ArrayList<>();
        do {
            if (check("{") || check("[")) {
                declarations.add(parseDestructuring(declarationKind));
                continue;
            }
            SourceToken name = expectIdentifier("variable name");
            match("!");
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.VARIABLE_DECLARATION, name)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.DECLARATION_KIND, declarationKind);
            if (match(":")) {
                builder.attribute(SyntaxAttributes.TYPE, parseTypeText());
            }
            if (match("=")) {
                builder.child(parseAssignment());
            }
            declarations.add(builder.build());
        } while (match(","));
        if (consumeEnd) {
            consumeStatementEnd();
        }
        if (declarations.size() == 1) {
            return declarations.get(0);
        }
        return node(SyntaxKind.DECLARATION_GROUP, kindToken).children(declarations).build();
    }

    /**
     * Parses {@code {a, b: c} = source} or {@code [x, y] = source}. Each target becomes an
     * IDENTIFIER child whose {@code property} attribute names the source property or position.
     */
    private SyntaxNode parseDestructuring(String declarationKind) {
        SourceToken open = advance();
        boolean objectPattern = open.is("{");
        String close = objectPattern ? "}" : "]";
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.DESTRUCTURING_DECLARATION, open)
                .attribute(SyntaxAttributes.PATTERN, objectPattern ? "object" : "array")
                .attribute(SyntaxAttributes.DECLARATION_KIND, declarationKind);
        int position = 0;
        while (!check(close) && !isAtEnd()) {
            if (check(",")) {
                advance();
                position++;
                continue;
            }
            boolean rest = match("...");
            if (check("{") || check("[")) {
                reportUnsupported("nested destructuring", "Assign each value separately", peek());
                skipBalanced(peek().getValue(), check("{") ? "}" : "]");
            } else {
                SourceToken source = expectPropertyName();
                SourceToken target = source;
                if (objectPattern && match(":")) {
                    target = expectIdentifier("destructuring target");
                }
                SyntaxNode.SyntaxNodeBuilder targetBuilder = node(SyntaxKind.IDENTIFIER, target)
                        .value(target.getValue())
                        .attribute(SyntaxAttributes.PROPERTY,
                                objectPattern ? source.getValue() : String.valueOf(position));
                if (rest) {
                    targetBuilder.attribute(SyntaxAttributes.REST, "true");
                }
                if (match("=")) {
                    targetBuilder.child(parseAssignment());
                }
                builder.child(targetBuilder.build());
            }
            if (!check(close)) {
                expect(",", "Expected ',' in destructuring pattern");
                position++;
            }
        }
        expect(close, "Expected '" + close + "' to close destructuring pattern");
        if (match(":")) {
            parseTypeText();
        }
        if (match("=")) {
            builder.child(parseAssignment());
        }
        return builder.build();
    }

    private SyntaxNode parseFunction(String modifiers) {
        boolean async = match("async");
        SourceToken functionToken = expect("function", "Expected 'function'");
        match("*");
        SourceToken name = expectIdentifier("function name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.METHOD_DECLARATION, functionToken)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, async ? (modifiers + " async").trim() : modifiers);
        if (async) {
            builder.attribute(SyntaxAttributes.ASYNC, "true");
        }
        return parseCallableRest(builder);
    }

    /**
     * Type parameters, parameters, return type and body of a function or method.
     */
    private SyntaxNode parseCallableRest(SyntaxNode.SyntaxNodeBuilder builder) {
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        builder.children(parseParameters());
        if (match(":")) {
            builder.attribute(SyntaxAttributes.RETURN_TYPE, parseTypeText());
        }
        if (check("{")) {
            builder.child(parseBlock());
        } else {
            // Overload signature or abstract member.
            consumeStatementEnd();
            builder.attribute(SyntaxAttributes.ABSTRACT, "true");
        }
        return builder.build();
    }

    private String parseTypeParameters() {
        SourceToken open = peek();
        reportUnsupported("generics", "Replace type parameters with a specific type", open);
        int from = pos;
        skipAngleBrackets();
        return joinTokens(from, pos).replace(" ", "").replace("extends", " extends ");
    }

    private SyntaxNode parseClass(String outerModifiers) {
        List<String> modifiers = new ArrayList<>();
        if (!outerModifiers.isEmpty()) {
            modifiers.add(outerModifiers);
        }
        if (match("abstract")) {
            modifiers.add("abstract");
        }
        SourceToken classToken = expect("class", "Expected 'class'");
        SourceToken name = expectIdentifier("class name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.CLASS_DECLARATION, classToken)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, String.join(" ", modifiers));
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        if (match("extends")) {
            builder.attribute(SyntaxAttributes.EXTENDS, parseTypeText());
        }
        if (match("implements")) {
            builder.attribute(SyntaxAttributes.IMPLEMENTS, parseTypeList());
        }
        expect("{", "Expected '{' to open class body");
        while (!check("}") && !isAtEnd()) {
            int start = pos;
            SyntaxNode member = guarded(() -> parseClassMember(name.getValue()));
            if (member != null) {
                builder.child(member);
            }
            if (pos == start) {
                advance();
            }
        }
        expect("}", "Expected '}' to close class " + name.getValue());
        return builder.build();
    }

    private String parseTypeList() {
        List<String> types = new ArrayList<>();
        do {
            types.add(parseTypeText());
        } while (match(","));
        return String.join(", ", types);
    }

    private SyntaxNode parseClassMember(String className) {
        if (match(";")) {
            return null;
        }
        while (check("@")) {
            skipDecorator();
        }
        List<String> modifiers = new ArrayList<>();
        while (CLASS_MODIFIERS.contains(peek().getValue()) && peek().getType() != TokenType.STRING_LITERAL
                && isMemberNameStart(peekAt(1))) {
            modifiers.add(advance().getValue());
        }
        String accessor = null;
        if ((check("get") || check("set")) && isMemberNameStart(peekAt(1))) {
            accessor = advance().getValue();
        }
        if (check("[") && !peekAt(1).is("]")) {
            // Index signature.
            int from = pos;
            skipBalanced("[", "]");
            if (match(":")) {
                parseTypeText();
            }
            consumeStatementEnd();
            return unsupported(tokens.get(from), "index signatures", joinTokens(from, pos));
        }
        String joinedModifiers = String.join(" ", modifiers);
        SourceToken name = expectPropertyName();
        if (name.is("constructor") && check("(")) {
            return parseCallableRest(node(SyntaxKind.CONSTRUCTOR_DECLARATION, name)
                    .value(className)
                    .attribute(SyntaxAttributes.MODIFIERS, joinedModifiers));
        }
        boolean optional = match("?");
        match("!");
        if (check("(") || check("<")) {
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.METHOD_DECLARATION, name)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.MODIFIERS, joinedModifiers);
            if (modifiers.contains("async")) {
                builder.attribute(SyntaxAttributes.ASYNC, "true");
            }
            if (accessor != null) {
                builder.attribute(SyntaxAttributes.ACCESSOR, accessor);
            }
            return parseCallableRest(builder);
        }
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.FIELD_DECLARATION, name)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, joinedModifiers);
        if (modifiers.contains("readonly")) {
            builder.attribute(SyntaxAttributes.DECLARATION_KIND, "readonly");
        }
        if (optional) {
            builder.attribute(SyntaxAttributes.OPTIONAL, "true");
        }
        if (match(":")) {
            builder.attribute(SyntaxAttributes.TYPE, parseTypeText());
        }
        if (match("=")) {
            builder.child(parseAssignment());
        }
        consumeStatementEnd();
        return builder.build();
    }

    private static boolean isMemberNameStart(SourceToken t) {
        return t.isIdentifier() || t.getType() == TokenType.KEYWORD || t.getType() == TokenType.STRING_LITERAL
                || t.is("[") || t.is("*");
    }

    private SyntaxNode parseInterface() {
        SourceToken interfaceToken = advance();
        SourceToken name = expectIdentifier("interface name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.INTERFACE_DECLARATION, interfaceToken)
                .value(name.getValue());
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        if (match("extends")) {
            builder.attribute(SyntaxAttributes.EXTENDS, parseTypeList());
        }
        expect("{", "Expected '{' to open interface body");
        while (!check("}") && !isAtEnd()) {
            int start = pos;
            SyntaxNode member = guarded(this::parseInterfaceMember);
            if (member != null) {
                builder.child(member);
            }
            if (pos == start) {
                advance();
            }
        }
        expect("}", "Expected '}' to close interface " + name.getValue());
        return builder.build();
    }

    private SyntaxNode parseInterfaceMember() {
        if (match(";") || match(",")) {
            return null;
        }
        boolean readonly = check("readonly") && isMemberNameStart(peekAt(1));
        if (readonly) {
            advance();
        }
        if (check("[")) {
            SourceToken open = peek();
            int from = pos;
            skipBalanced("[", "]");
            String signature = joinTokens(from, pos);
            String type = match(":") ? parseTypeText() : "any";
            endInterfaceMember();
            return node(SyntaxKind.FIELD_DECLARATION, open)
                    .value(signature)
                    .attribute(SyntaxAttributes.TYPE, type)
                    .attribute(SyntaxAttributes.INDEX_SIGNATURE, "true")
                    .build();
        }
        if (check("(") || check("<")) {
            SourceToken at = peek();
            int from = pos;
            reportUnsupported("call signatures", "Declare a named method instead", at);
            while (!check(";") && !check("}") && !isAtEnd() && !(peek().getLine() > at.getLine() && check(","))) {
                if (check("(")) {
                    skipBalanced("(", ")");
                } else {
                    advance();
                }
            }
            endInterfaceMember();
            return unsupported(at, "call signatures", joinTokens(from, pos));
        }
        SourceToken name = expectPropertyName();
        boolean optional = match("?");
        if (check("(") || check("<")) {
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.METHOD_DECLARATION, name)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.ABSTRACT, "true");
            if (check("<")) {
                builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
            }
            builder.children(parseParameters());
            if (match(":")) {
                builder.attribute(SyntaxAttributes.RETURN_TYPE, parseTypeText());
            }
            endInterfaceMember();
            return builder.build();
        }
        expect(":", "Expected ':' after property name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.FIELD_DECLARATION, name)
                .value(name.getValue())
                .attribute(SyntaxAttributes.TYPE, parseTypeText());
        if (optional) {
            builder.attribute(SyntaxAttributes.OPTIONAL, "true");
        }
        if (readonly) {
            builder.attribute(SyntaxAttributes.DECLARATION_KIND, "readonly");
        }
        endInterfaceMember();
        return builder.build();
    }

    private void endInterfaceMember() {
        if (!match(";") && !match(",")) {
            consumeStatementEnd();
        }
    }

    private SyntaxNode parseTypeAlias() {
        SourceToken typeToken = advance();
        reportUnsupported("type aliases", "Use the underlying type directly", typeToken);
        SourceToken name = expectIdentifier("type alias name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.TYPE_ALIAS, typeToken).value(name.getValue());
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        expect("=", "Expected '=' in type alias");
        builder.attribute(SyntaxAttributes.TYPE, parseTypeText());
        consumeStatementEnd();
        return builder.build();
    }

    private SyntaxNode parseEnum() {
        SourceToken enumToken = advance();
        reportUnsupported("enums", "Declare a CONSTANT for each value", enumToken);
        SourceToken name = expectIdentifier("enum name");
        expect("{", "Expected '{' after enum name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.ENUM_DECLARATION, enumToken).value(name.getValue());
        while (!check("}") && !isAtEnd()) {
            SourceToken member = advance();
            String memberName = member.getValue();
            SyntaxNode.SyntaxNodeBuilder memberBuilder = node(SyntaxKind.IDENTIFIER, member).value(memberName);
            if (match("=")) {
                memberBuilder.child(parseAssignment());
            }
            builder.child(memberBuilder.build());
            if (!match(",")) {
                break;
            }
        }
        expect("}", "Expected '}' to close enum " + name.getValue());
        return builder.build();
    }

    @Override
    protected List<SyntaxNode> parseParameters() {
        expect("(", "Expected '(' before parameters");
        List<SyntaxNode> parameters = new ArrayList<>();
        while (!check(")") && !isAtEnd()) {
            while (check("@")) {
                skipDecorator();
            }
            boolean property = false;
            while (PARAMETER_PROPERTY_MODIFIERS.contains(peek().getValue())
                    && (peekAt(1).isIdentifier() || PARAMETER_PROPERTY_MODIFIERS.contains(peekAt(1).getValue()))) {
                advance();
                property = true;
            }
            boolean rest = match("...");
            SourceToken start = peek();
            String name;
            if (check("{") || check("[")) {
                reportUnsupported("destructured parameters", "Pass the values as separate parameters", start);
                skipBalanced(start.getValue(), check("{") ? "}" : "]");
                name = "param" + (parameters.size() + 1);
            } else {
                name = expectPropertyName().getValue();
            }
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.PARAMETER, start).value(name);
            if (match("?")) {
                builder.attribute(SyntaxAttributes.OPTIONAL, "true");
            }
            if (match(":")) {
                builder.attribute(SyntaxAttributes.TYPE, parseTypeText());
            }
            if (match("=")) {
                builder.child(parseAssignment());
            }
            if (rest) {
                builder.attribute(SyntaxAttributes.REST, "true");
            }
            if (property) {
                builder.attribute(SyntaxAttributes.PROPERTY, "true");
            }
            parameters.add(builder.build());
            if (!match(",")) {
                break;
            }
        }
        expect(")", "Expected ')' after parameters");
        return parameters;
    }

    @Override
    protected SyntaxNode tryParseForEach(SourceToken forToken) {
        int start = pos;
        boolean declared = check("let") || check("const") || check("var");
        if (declared) {
            advance();
        }
        String name = null;
        SourceToken nameToken = peek();
        if (peek().isIdentifier() && (peekAt(1).is("of") || peekAt(1).is("in"))) {
            name = advance().getValue();
        } else if (declared && (check("[") || check("{"))) {
            int close = findClosing(pos, peek().getValue(), check("[") ? "]" : "}");
            if (close > 0 && (tokenAt(close + 1).is("of") || tokenAt(close + 1).is("in"))) {
                reportUnsupported("destructuring in loops", "Read each value inside the loop body", nameToken);
                name = joinTokens(pos, close + 1);
                pos = close + 1;
            }
        }
        if (name == null) {
            pos = start;
            return null;
        }
        SourceToken iteration = advance();
        if (iteration.is("in")) {
            reportUnsupported("for...in loops", "Use a FOR loop over the indices", iteration);
        }
        SyntaxNode iterable = parseExpression();
        expect(")", "Expected ')' after for-" + iteration.getValue() + " header");
        SyntaxNode body = parseStatement();
        return node(SyntaxKind.FOR_EACH_STATEMENT, forToken)
                .value(name)
                .attribute(SyntaxAttributes.ITERATION, iteration.getValue())
                .child(iterable)
                .child(body)
                .build();
    }

    @Override
    protected SyntaxNode parseForInit() {
        if (check("let") || check("const") || check("var")) {
            return parseVariableStatement(false);
        }
        return parseExpressionSequence();
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    /**
     * Parses a type with a small grammar: unions and intersections of postfix array types over
     * named, generic, literal, tuple, object and function types.
     */
    @Override
    protected String parseTypeText() {
        List<String> members = new ArrayList<>();
        if (check("|") || check("&")) {
            advance();
        }
        members.add(parsePostfixType());
        List<String> separators = new ArrayList<>();
        while (check("|") || check("&")) {
            separators.add(advance().getValue());
            members.add(parsePostfixType());
        }
        StringBuilder sb = new StringBuilder(members.get(0));
        for (int i = 0; i < separators.size(); i++) {
            sb.append(' ').append(separators.get(i)).append(' ').append(members.get(i + 1));
        }
        return sb.toString();
    }

    private String parsePostfixType() {
        StringBuilder sb = new StringBuilder(parseTypeAtom());
        while (check("[") && peekAt(1).is("]")) {
            advance();
            advance();
            sb.append("[]");
        }
        return sb.toString();
    }

    private String parseTypeAtom() {
        SourceToken t = peek();
        if (t.is("(")) {
            int from = pos;
            skipBalanced("(", ")");
            String group = joinTokens(from, pos);
            if (match("=>")) {
                return group + " => " + parseTypeText();
            }
            return group;
        }
        if (t.is("{") || t.is("[")) {
            int from = pos;
            skipBalanced(t.getValue(), t.is("{") ? "}" : "]");
            return joinTokens(from, pos);
        }
        if (t.getType() == TokenType.STRING_LITERAL) {
            advance();
            return "\"" + t.getValue() + "\"";
        }
        if (t.getType() == TokenType.NUMBER_LITERAL || t.getType() == TokenType.BOOLEAN_LITERAL
                || t.getType() == TokenType.NULL_LITERAL) {
            advance();
            return t.getValue();
        }
        if (t.is("typeof") || t.is("keyof") || t.is("readonly") || t.is("unique")) {
            advance();
            return t.getValue() + " " + parsePostfixType();
        }
        if (t.is("new")) {
            advance();
            return "new " + parseTypeAtom();
        }
        if (t.isIdentifier() || t.getType() == TokenType.KEYWORD) {
            StringBuilder sb = new StringBuilder(advance().getValue());
            while (check(".") && peekAt(1).isIdentifier()) {
                advance();
                sb.append('.').append(advance().getValue());
            }
            if (check("<")) {
                int from = pos;
                skipAngleBrackets();
                sb.append(joinTokens(from, pos).replace(" ", "").replace(",", ", "));
            }
            return sb.toString();
        }
        throw error("Expected a type, found '" + t.getValue() + "'");
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    @Override
    protected SyntaxNode parseBraceExpression() {
        SourceToken open = expect("{", "Expected '{' to open object literal");
        List<SyntaxNode> properties = new ArrayList<>();
        while (!check("}") && !isAtEnd()) {
            SourceToken start = peek();
            if (check("...")) {
                properties.add(parseElement());
            } else if (check("[")) {
                advance();
                SyntaxNode key = parseExpression();
                expect("]", "Expected ']' after computed property name");
                expect(":", "Expected ':' after computed property name");
                properties.add(node(SyntaxKind.PROPERTY_ASSIGNMENT, start)
                        .value("[" + key.getValue() + "]")
                        .child(parseAssignment())
                        .build());
            } else {
                SourceToken key = advance();
                if (check("(")) {
                    SyntaxNode method = node(SyntaxKind.LAMBDA_EXPRESSION, key)
                            .children(parseParameters())
                            .child(parseBlockAfterReturnType())
                            .build();
                    properties.add(node(SyntaxKind.PROPERTY_ASSIGNMENT, key).value(key.getValue()).child(method).build());
                } else if (match(":")) {
                    properties.add(node(SyntaxKind.PROPERTY_ASSIGNMENT, key)
                            .value(key.getValue())
                            .child(parseAssignment())
                            .build());
                } else {
                    // Shorthand property.
                    properties.add(node(SyntaxKind.PROPERTY_ASSIGNMENT, key)
                            .value(key.getValue())
                            .child(node(SyntaxKind.IDENTIFIER, key).value(key.getValue()).build())
                            .build());
                }
            }
            if (!match(",")) {
                break;
            }
        }
        expect("}", "Expected '}' to close object literal opened on line " + lineOf(open));
        return node(SyntaxKind.OBJECT_LITERAL, open).children(properties).build();
    }

    private SyntaxNode parseBlockAfterReturnType() {
        if (match(":")) {
            parseTypeText();
        }
        return parseBlock();
    }

    @Override
    protected SyntaxNode parseLanguagePrimary() {
        SourceToken t = peek();
        if (t.is("async") && t.getLine() == peekAt(1).getLine()
                && ((peekAt(1).isIdentifier() && isArrowToken(peekAt(2))) || peekAt(1).is("(") || peekAt(1).is("function"))) {
            if (peekAt(1).is("function")) {
                return parseFunctionExpression();
            }
            advance();
            SourceToken start = peek();
            if (start.is("(") && !isLambdaAhead()) {
                pos--;
                return null;
            }
            SyntaxNode lambda = parseLambda(start);
            return lambda.toBuilder().attribute(SyntaxAttributes.ASYNC, "true").build();
        }
        if (t.is("function")) {
            return parseFunctionExpression();
        }
        if (t.is("class")) {
            int from = pos;
            reportUnsupported("class expressions", "Declare the class by name", t);
            while (!check("{") && !isAtEnd()) {
                advance();
            }
            skipBalanced("{", "}");
            return unsupported(t, "class expressions", joinTokens(from, pos));
        }
        if (t.is("<") && peekAt(1).isIdentifier() && peekAt(2).is(">")) {
            reportUnsupported("type assertions", "Remove the type assertion", t);
            advance();
            String type = peek().getValue();
            advance();
            advance();
            return node(SyntaxKind.CAST_EXPRESSION, t)
                    .attribute(SyntaxAttributes.TYPE, type)
                    .child(parseUnary())
                    .build();
        }
        return null;
    }

    private SyntaxNode parseFunctionExpression() {
        SourceToken start = peek();
        boolean async = match("async");
        advance();
        match("*");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.LAMBDA_EXPRESSION, start);
        if (peek().isIdentifier()) {
            builder.value(advance().getValue());
        }
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        builder.children(parseParameters());
        if (match(":")) {
            builder.attribute(SyntaxAttributes.RETURN_TYPE, parseTypeText());
        }
        builder.child(parseBlock());
        if (async) {
            builder.attribute(SyntaxAttributes.ASYNC, "true");
        }
        return builder.build();
    }

    @Override
    protected SyntaxNode parseLanguagePostfix(SyntaxNode expression) {
        SourceToken t = peek();
        if (t.is("!") && t.getLine() == previous().getLine()) {
            // Non-null assertion has no runtime meaning.
            advance();
            return expression;
        }
        return null;
    }

    @Override
    protected boolean isTypeAssertionOperator(SourceToken t) {
        boolean assertion = t.isIdentifier() && (t.is("as") || t.is("satisfies"))
                && t.getLine() == previous().getLine();
        if (assertion) {
            reportUnsupported("type assertions", "Remove the type assertion", t);
        }
        return assertion;
    }

    @Override
    protected boolean isRelationalKeyword(SourceToken t) {
        return t.is("in") && t.getType() == TokenType.KEYWORD;
    }

    @Override
    protected boolean isUnaryKeyword(SourceToken t) {
        if (t.is("typeof") || t.is("delete") || t.is("void")) {
            return t.getType() == TokenType.KEYWORD;
        }
        return t.isIdentifier() && t.is("await") && !isArrowToken(peekAt(1)) && !peekAt(1).is("=")
                && !peekAt(1).is(";") && !peekAt(1).is(")");
    }

    @Override
    protected void onLambdaParsed(SourceToken start) {
        log.debug("Parsed arrow function on line {}", lineOf(start));
    }
}
