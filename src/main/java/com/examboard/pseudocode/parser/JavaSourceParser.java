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
 * Structural parser for Java source: whole compilation units as well as loose
 * fragments (statements or methods without an enclosing class).
 */
public class JavaSourceParser extends AbstractSourceParser {
    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    private static final Set<String> PRIMITIVE_TYPES = Set.of(
        "int", "long", "short", "byte", "double", "float", "char", "boolean", "void"
    );

    private static final Set<String> MEMBER_MODIFIERS = Set.of(
        "public", "private", "protected", "static", "final", "abstract", "native", "transient",
        "volatile", "strictfp", "synchronized", "default"
    );

    public JavaSourceParser() {
        this(ConversionOptions.DEFAULT_MAX_NESTING_DEPTH);
    }

    public JavaSourceParser(int maxNestingDepth) {
        super(maxNestingDepth);
    }

    public JavaSourceParser(ConversionOptions options) {
        this(options.getMaxNestingDepth());
    }

    @Override
    public Language getLanguage() {
        return Language.JAVA;
    }

    @Override
    protected AbstractSourceParser createEmbeddedParser() {
        return new JavaSourceParser(maxNestingDepth);
    }

    @Override
    protected boolean isArrowToken(SourceToken token) {
        return token.is("->");
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    @Override
    protected SyntaxNode parseTopLevel() {
        SourceToken start = peek();
        if (start.is("package") || start.is("import")) {
            boolean isImport = start.is("import");
            int from = pos;
            reportUnsupported(isImport ? "imports" : "package declarations",
                    "Remove the " + start.getValue() + " line; pseudocode has no modules", start);
            skipPastSemicolon();
            return unsupported(start, isImport ? "imports" : "package declarations", joinTokens(from, pos));
        }

        int beforeModifiers = pos;
        String modifiers = parseModifiers(true);
        if (isTypeDeclarationStart()) {
            return parseTypeDeclaration(modifiers);
        }
        if (isMethodAhead()) {
            return parseMember(modifiers, null);
        }
        if (!modifiers.isEmpty() && isLocalDeclarationAhead()) {
            return parseLocalDeclaration(modifiers, true);
        }
        pos = beforeModifiers;
        return parseStatement();
    }

    /**
     * Consumes modifiers and annotations, returning the modifiers joined by spaces.
     */
    private String parseModifiers(boolean memberContext) {
        List<String> modifiers = new ArrayList<>();
        while (!isAtEnd()) {
            SourceToken t = peek();
            if (t.is("@") && !peekAt(1).is("interface")) {
                reportUnsupported("annotations", "Remove annotations such as @Override", t);
                advance();
                expectPropertyName();
                while (check(".") && peekAt(1).isIdentifier()) {
                    advance();
                    advance();
                }
                if (check("(")) {
                    skipBalanced("(", ")");
                }
            } else if (t.getType() == TokenType.KEYWORD
                    && (memberContext ? MEMBER_MODIFIERS.contains(t.getValue()) : t.is("final"))
                    && !(t.is("synchronized") && peekAt(1).is("("))
                    && !(t.is("default") && (peekAt(1).is(":") || peekAt(1).is("->")))) {
                if (t.is("synchronized")) {
                    reportUnsupported("synchronized", "Remove the synchronized modifier", t);
                }
                modifiers.add(advance().getValue());
            } else {
                break;
            }
        }
        return String.join(" ", modifiers);
    }

    private boolean isTypeDeclarationStart() {
        SourceToken t = peek();
        return t.is("class") || t.is("interface") || t.is("enum")
                || (t.is("@") && peekAt(1).is("interface"))
                || (t.is("record") && peekAt(1).isIdentifier());
    }

    private SyntaxNode parseTypeDeclaration(String modifiers) {
        SourceToken t = peek();
        if (t.is("class")) {
            return parseClass(modifiers);
        }
        if (t.is("interface")) {
            return parseInterface(modifiers);
        }
        if (t.is("enum")) {
            return parseEnum(modifiers);
        }
        String feature = t.is("@") ? "annotation types" : "records";
        reportUnsupported(feature, "Declare a class with fields instead", t);
        int from = pos;
        while (!check("{") && !isAtEnd()) {
            advance();
        }
        skipBalanced("{", "}");
        return unsupported(t, feature, joinTokens(from, pos));
    }

    private SyntaxNode parseClass(String modifiers) {
        SourceToken classToken = advance();
        SourceToken name = expectIdentifier("class name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.CLASS_DECLARATION, classToken)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, modifiers);
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        if (match("extends")) {
            builder.attribute(SyntaxAttributes.EXTENDS, parseTypeText());
        }
        if (match("implements")) {
            builder.attribute(SyntaxAttributes.IMPLEMENTS, parseTypeList());
        }
        builder.children(parseClassBody(name.getValue()));
        return builder.build();
    }

    private SyntaxNode parseInterface(String modifiers) {
        SourceToken interfaceToken = advance();
        SourceToken name = expectIdentifier("interface name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.INTERFACE_DECLARATION, interfaceToken)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, modifiers);
        if (check("<")) {
            builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, parseTypeParameters());
        }
        if (match("extends")) {
            builder.attribute(SyntaxAttributes.EXTENDS, parseTypeList());
        }
        builder.children(parseClassBody(null));
        return builder.build();
    }

    private SyntaxNode parseEnum(String modifiers) {
        SourceToken enumToken = advance();
        reportUnsupported("enums", "Declare a CONSTANT for each value", enumToken);
        SourceToken name = expectIdentifier("enum name");
        if (match("implements")) {
            parseTypeList();
        }
        expect("{", "Expected '{' after enum name");
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.ENUM_DECLARATION, enumToken)
                .value(name.getValue())
                .attribute(SyntaxAttributes.MODIFIERS, modifiers);
        while (peek().isIdentifier()) {
            SourceToken constant = advance();
            builder.child(node(SyntaxKind.IDENTIFIER, constant).value(constant.getValue()).build());
            if (check("(")) {
                skipBalanced("(", ")");
            }
            if (check("{")) {
                skipBalanced("{", "}");
            }
            if (!match(",")) {
                break;
            }
        }
        // Enum bodies with fields and methods are not represented.
        while (!check("}") && !isAtEnd()) {
            if (check("{")) {
                skipBalanced("{", "}");
            } else {
                advance();
            }
        }
        expect("}", "Expected '}' to close enum " + name.getValue());
        return builder.build();
    }

    private List<SyntaxNode> parseClassBody(String className) {
        expect("{", "Expected '{' to open class body");
        List<SyntaxNode> members = new ArrayList<>();
        while (!check("}") && !isAtEnd()) {
            int start = pos;
            SyntaxNode member = guarded(() -> parseClassMember(className));
            if (member != null) {
                members.add(member);
            }
            if (pos == start) {
                advance();
            }
        }
        expect("}", "Expected '}' to close class body");
        return members;
    }

    private SyntaxNode parseClassMember(String className) {
        if (match(";")) {
            return null;
        }
        String modifiers = parseModifiers(true);
        if (check("{")) {
            SourceToken block = peek();
            int from = pos;
            reportUnsupported("initializer blocks", "Move the statements into a procedure", block);
            skipBalanced("{", "}");
            return unsupported(block, "initializer blocks", joinTokens(from, pos));
        }
        if (isTypeDeclarationStart()) {
            return parseTypeDeclaration(modifiers);
        }
        return parseMember(modifiers, className);
    }

    /**
     * Parses a constructor, method or field after its modifiers.
     */
    private SyntaxNode parseMember(String modifiers, String className) {
        String typeParameters = check("<") ? parseTypeParameters() : null;
        SourceToken first = peek();
        if (className != null && first.isIdentifier() && first.getValue().equals(className) && peekAt(1).is("(")) {
            advance();
            List<SyntaxNode> parameters = parseParameters();
            skipThrows();
            return node(SyntaxKind.CONSTRUCTOR_DECLARATION, first)
                    .value(className)
                    .attribute(SyntaxAttributes.MODIFIERS, modifiers)
                    .children(parameters)
                    .child(parseBlock())
                    .build();
        }

        String type = parseTypeText();
        SourceToken name = expectIdentifier("member name");
        if (check("(")) {
            List<SyntaxNode> parameters = parseParameters();
            while (check("[") && peekAt(1).is("]")) {
                advance();
                advance();
                type = type + "[]";
            }
            skipThrows();
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.METHOD_DECLARATION, name)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.RETURN_TYPE, type)
                    .attribute(SyntaxAttributes.MODIFIERS, modifiers)
                    .children(parameters);
            if (typeParameters != null) {
                builder.attribute(SyntaxAttributes.TYPE_PARAMETERS, typeParameters);
            }
            if (check("{")) {
                builder.child(parseBlock());
            } else {
                expect(";", "Expected method body or ';'");
                builder.attribute(SyntaxAttributes.ABSTRACT, "true");
            }
            return builder.build();
        }
        return parseDeclarators(SyntaxKind.FIELD_DECLARATION, type, name, modifiers, true);
    }

    private void skipThrows() {
        if (match("throws")) {
            parseTypeList();
        }
    }

    private String parseTypeParameters() {
        SourceToken open = peek();
        reportUnsupported("generics", "Replace type parameters with a specific type", open);
        int from = pos;
        skipAngleBrackets();
        return joinTokens(from, pos).replace(" ", "");
    }

    private String parseTypeList() {
        List<String> types = new ArrayList<>();
        do {
            types.add(parseTypeText());
        } while (match(","));
        return String.join(", ", types);
    }

    @Override
    protected List<SyntaxNode> parseParameters() {
        expect("(", "Expected '(' before parameters");
        List<SyntaxNode> parameters = new ArrayList<>();
        while (!check(")") && !isAtEnd()) {
            parseModifiers(false);
            SourceToken start = peek();
            SyntaxNode.SyntaxNodeBuilder builder;
            if (start.isIdentifier() && (peekAt(1).is(",") || peekAt(1).is(")"))) {
                // Untyped lambda parameter.
                advance();
                builder = node(SyntaxKind.PARAMETER, start).value(start.getValue());
            } else {
                String type = parseTypeText();
                boolean varargs = type.endsWith("...");
                if (varargs) {
                    type = type.substring(0, type.length() - 3) + "[]";
                }
                SourceToken name = expectIdentifier("parameter name");
                while (check("[") && peekAt(1).is("]")) {
                    advance();
                    advance();
                    type = type + "[]";
                }
                builder = node(SyntaxKind.PARAMETER, name)
                        .value(name.getValue())
                        .attribute(SyntaxAttributes.TYPE, type);
                if (varargs) {
                    builder.attribute(SyntaxAttributes.REST, "true");
                }
            }
            parameters.add(builder.build());
            if (!match(",")) {
                break;
            }
        }
        expect(")", "Expected ')' after parameters");
        return parameters;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    @Override
    protected SyntaxNode parseLanguageStatement() {
        SourceToken t = peek();
        if (t.is("final") || (t.is("@") && !peekAt(1).is("interface"))) {
            String modifiers = parseModifiers(false);
            if (isTypeDeclarationStart()) {
                return parseTypeDeclaration(modifiers);
            }
            return parseLocalDeclaration(modifiers, true);
        }
        if (t.is("class") || t.is("interface") || t.is("enum") || t.is("abstract") || t.is("static")) {
            String modifiers = parseModifiers(true);
            return parseTypeDeclaration(modifiers);
        }
        if (t.is("synchronized") && peekAt(1).is("(")) {
            reportUnsupported("synchronized", "Remove the synchronized block and keep its body", t);
            advance();
            skipBalanced("(", ")");
            return parseBlock();
        }
        if (t.is("assert")) {
            int from = pos;
            reportUnsupported("assert statements", "Check the condition with an IF statement", t);
            skipPastSemicolon();
            return unsupported(t, "assert statements", joinTokens(from, pos));
        }
        if (isLocalDeclarationAhead()) {
            return parseLocalDeclaration("", true);
        }
        return null;
    }

    @Override
    protected SyntaxNode tryParseForEach(SourceToken forToken) {
        int start = pos;
        String modifiers = parseModifiers(false);
        int typeEnd = scanType(pos);
        if (typeEnd > 0 && tokenAt(typeEnd).isIdentifier() && tokenAt(typeEnd + 1).is(":")) {
            String type = parseTypeText();
            SourceToken name = advance();
            advance();
            SyntaxNode iterable = parseExpression();
            expect(")", "Expected ')' after for-each header");
            SyntaxNode body = parseStatement();
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.FOR_EACH_STATEMENT, forToken)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.TYPE, type)
                    .attribute(SyntaxAttributes.ITERATION, ":")
                    .child(iterable)
                    .child(body);
            if (!modifiers.isEmpty()) {
                builder.attribute(SyntaxAttributes.MODIFIERS, modifiers);
            }
            return builder.build();
        }
        pos = start;
        return null;
    }

    @Override
    protected SyntaxNode parseForInit() {
        if (check("final") || isLocalDeclarationAhead()) {
            String modifiers = parseModifiers(false);
            return parseLocalDeclaration(modifiers, false);
        }
        return parseExpressionSequence();
    }

    private boolean isLocalDeclarationAhead() {
        SourceToken t = peek();
        if (t.is("var") && peekAt(1).isIdentifier()) {
            return true;
        }
        int typeEnd = scanType(pos);
        if (typeEnd < 0 || !tokenAt(typeEnd).isIdentifier()) {
            return false;
        }
        SourceToken after = tokenAt(typeEnd + 1);
        return after.is("=") || after.is(";") || after.is(",") || after.is("[") || after.is(":");
    }

    private SyntaxNode parseLocalDeclaration(String modifiers, boolean consumeEnd) {
        String type = check("var") ? advance().getValue() : parseTypeText();
        SourceToken name = expectIdentifier("variable name");
        SyntaxNode declaration = parseDeclarators(SyntaxKind.VARIABLE_DECLARATION, type, name, modifiers, consumeEnd);
        log.debug("Parsed local declaration of {} on line {}", name.getValue(), lineOf(name));
        return declaration;
    }

    /**
     * Parses {@code name [= init] (, name [= init])*} for fields and locals.
     */
    private SyntaxNode parseDeclarators(SyntaxKind kind, String type, SourceToken firstName, String modifiers,
            boolean consumeEnd) {
        List<SyntaxNode> declarations = new ArrayList<>();
        SourceToken name = firstName;
        while (true) {
            String declaredType = type;
            while (check("[") && peekAt(1).is("]")) {
                advance();
                advance();
                declaredType = declaredType + "[]";
            }
            SyntaxNode.SyntaxNodeBuilder builder = node(kind, name)
                    .value(name.getValue())
                    .attribute(SyntaxAttributes.TYPE, declaredType)
                    .attribute(SyntaxAttributes.MODIFIERS, modifiers);
            if (modifiers.contains("final")) {
                builder.attribute(SyntaxAttributes.DECLARATION_KIND, "final");
            }
            if (match("=")) {
                builder.child(check("{") ? parseBraceExpression() : parseExpression());
            }
            declarations.add(builder.build());
            if (!match(",")) {
                break;
            }
            name = expectIdentifier("variable name");
        }
        if (consumeEnd) {
            consumeStatementEnd();
        }
        if (declarations.size() == 1) {
            return declarations.get(0);
        }
        return node(SyntaxKind.DECLARATION_GROUP, firstName).children(declarations).build();
    }

    // ------------------------------------------------------------------
    // Types and expressions
    // ------------------------------------------------------------------

    /**
     * Finds the end of a type spelling starting at {@code index}, or -1 when none starts there.
     */
    private int scanType(int index) {
        SourceToken t = tokenAt(index);
        boolean primitive = t.getType() == TokenType.KEYWORD && PRIMITIVE_TYPES.contains(t.getValue());
        if (!primitive && !t.isIdentifier()) {
            return -1;
        }
        int i = index + 1;
        if (!primitive) {
            while (tokenAt(i).is(".") && tokenAt(i + 1).isIdentifier()) {
                i += 2;
            }
            if (tokenAt(i).is("<")) {
                int nested = 0;
                do {
                    SourceToken current = tokenAt(i);
                    int delta = angleDelta(current);
                    if (delta == 0 && !(current.isIdentifier() || current.is(",") || current.is("?")
                            || current.is("extends") || current.is("super") || current.is(".")
                            || current.is("[") || current.is("]") || current.is("&")
                            || (current.getType() == TokenType.KEYWORD && PRIMITIVE_TYPES.contains(current.getValue())))) {
                        return -1;
                    }
                    nested += delta;
                    i++;
                } while (nested > 0 && i < tokens.size());
                if (nested != 0) {
                    return -1;
                }
            }
        }
        while (tokenAt(i).is("[") && tokenAt(i + 1).is("]")) {
            i += 2;
        }
        if (tokenAt(i).is("...")) {
            i++;
        }
        return i;
    }

    private boolean isMethodAhead() {
        int i = pos;
        if (tokenAt(i).is("<")) {
            int nested = 0;
            do {
                nested += angleDelta(tokenAt(i));
                i++;
            } while (nested > 0 && i < tokens.size());
        }
        int typeEnd = scanType(i);
        return typeEnd > 0 && tokenAt(typeEnd).isIdentifier() && tokenAt(typeEnd + 1).is("(");
    }

    @Override
    protected String parseTypeText() {
        SourceToken start = peek();
        int end = scanType(pos);
        if (end < 0) {
            throw error("Expected a type, found '" + start.getValue() + "'");
        }
        for (int i = pos; i < end; i++) {
            if (tokens.get(i).is("<")) {
                reportUnsupported("generics", "Use arrays of a specific type instead of generic collections",
                        tokens.get(i));
                break;
            }
        }
        StringBuilder sb = new StringBuilder();
        while (pos < end) {
            SourceToken t = advance();
            if (t.is(",")) {
                sb.append(", ");
            } else if (t.is("extends") || t.is("super")) {
                sb.append(' ').append(t.getValue()).append(' ');
            } else {
                sb.append(t.getValue());
            }
        }
        return sb.toString();
    }

    @Override
    protected SyntaxNode parseBraceExpression() {
        SourceToken open = expect("{", "Expected '{' to open array initializer");
        List<SyntaxNode> elements = new ArrayList<>();
        while (!check("}") && !isAtEnd()) {
            elements.add(check("{") ? parseBraceExpression() : parseExpression());
            if (!match(",")) {
                break;
            }
        }
        expect("}", "Expected '}' to close array initializer");
        return node(SyntaxKind.ARRAY_LITERAL, open).children(elements).build();
    }

    @Override
    protected SyntaxNode tryParseCast() {
        SourceToken next = peekAt(1);
        boolean primitive = next.getType() == TokenType.KEYWORD && PRIMITIVE_TYPES.contains(next.getValue());
        if (!primitive && !next.isIdentifier()) {
            return null;
        }
        int typeEnd = scanType(pos + 1);
        if (typeEnd < 0 || !tokenAt(typeEnd).is(")")) {
            return null;
        }
        SourceToken after = tokenAt(typeEnd + 1);
        boolean operandFollows = after.isIdentifier() || after.isLiteral() || after.is("(")
                || after.is("this") || after.is("new") || after.is("!") || after.is("~")
                || (primitive && (after.is("-") || after.is("+")));
        if (!operandFollows) {
            return null;
        }
        SourceToken open = advance();
        String type = parseTypeText();
        expect(")", "Expected ')' after cast type");
        SyntaxNode operand = parseUnary();
        return node(SyntaxKind.CAST_EXPRESSION, open)
                .attribute(SyntaxAttributes.TYPE, type)
                .child(operand)
                .build();
    }

    @Override
    protected SyntaxNode parseLanguagePostfix(SyntaxNode expression) {
        if (check("::")) {
            SourceToken reference = advance();
            reportUnsupported("method references", "Write a named FUNCTION instead", reference);
            SourceToken name = expectPropertyName();
            return node(SyntaxKind.MEMBER_ACCESS, name).value(name.getValue()).child(expression).build();
        }
        return null;
    }

    @Override
    protected void onLambdaParsed(SourceToken start) {
        reportUnsupported("lambda expressions", "Write a named FUNCTION instead", start);
    }
}
