package com.examboard.pseudocode.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.parser.SourceToken.TokenType;
import com.examboard.pseudocode.parser.exception.ParseException;

/**
 * Recursive-descent parser for the statement and expression grammar shared by Java and TypeScript.
 * Subclasses supply declarations, types and the few constructs that differ between the languages.
 *
 * The parser is purely structural: it never resolves identifiers or types.
 */
public abstract class AbstractSourceParser implements SourceParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceParser.class);

    protected static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
        "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "??=", "&&=", "||="
    );

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("??", 1),
        Map.entry("||", 2),
        Map.entry("&&", 3),
        Map.entry("|", 4),
        Map.entry("^", 5),
        Map.entry("&", 6),
        Map.entry("==", 7),
        Map.entry("!=", 7),
        Map.entry("===", 7),
        Map.entry("!==", 7),
        Map.entry("<", 8),
        Map.entry(">", 8),
        Map.entry("<=", 8),
        Map.entry(">=", 8),
        Map.entry("instanceof", 8),
        Map.entry("<<", 9),
        Map.entry(">>", 9),
        Map.entry(">>>", 9),
        Map.entry("+", 10),
        Map.entry("-", 10),
        Map.entry("*", 11),
        Map.entry("/", 11),
        Map.entry("%", 11),
        Map.entry("**", 12)
    );

    private static final int RELATIONAL_PRECEDENCE = 8;

    protected final int maxNestingDepth;
    protected List<SourceToken> tokens;
    protected int pos;
    protected Diagnostics diagnostics;
    protected int lineOffset;
    private int depth;
    private boolean nestingReported;
    private final Set<String> reportedFeatures = new HashSet<>();

    protected AbstractSourceParser(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public ParseResult parse(String sourceText) {
        diagnostics = new Diagnostics();
        pos = 0;
        depth = 0;
        lineOffset = 0;
        nestingReported = false;
        reportedFeatures.clear();

        if (sourceText == null || sourceText.isBlank()) {
            return new ParseResult(program(List.of()), diagnostics.toList());
        }

        tokens = new SourceTokenizer(sourceText, getLanguage(), diagnostics).tokenize();
        int delimiterErrors = new DelimiterChecker(diagnostics).check(tokens);
        if (delimiterErrors > 0) {
            log.debug("Found {} unbalanced delimiters, parsing best-effort", delimiterErrors);
        }

        List<SyntaxNode> items = new ArrayList<>();
        while (!isAtEnd()) {
            int start = pos;
            if (check("}")) {
                // Already reported by the delimiter check.
                advance();
                continue;
            }
            SyntaxNode item = guarded(this::parseTopLevel);
            if (item != null) {
                items.add(item);
            }
            if (pos == start) {
                advance();
            }
        }

        log.debug("Parsed {} top-level items from {} source", items.size(), getLanguage().getDisplayName());
        return new ParseResult(program(items), diagnostics.toList());
    }

    // ------------------------------------------------------------------
    // Language hooks
    // ------------------------------------------------------------------

    /**
     * Parses one top-level item: a declaration or a statement.
     */
    protected abstract SyntaxNode parseTopLevel();

    /**
     * Parses a statement only this language has (declarations in statement position included).
     *
     * @return null when the current token does not start such a statement
     */
    protected abstract SyntaxNode parseLanguageStatement();

    /**
     * Called right after {@code for (}. Parses an enhanced for loop header and body when one starts here.
     *
     * @return null when the loop is a classic three-part loop
     */
    protected abstract SyntaxNode tryParseForEach(SourceToken forToken);

    /**
     * Parses the initializer clause of a classic for loop, not consuming the {@code ;}.
     */
    protected abstract SyntaxNode parseForInit();

    /**
     * Parses a type spelling and returns its source text.
     */
    protected abstract String parseTypeText();

    protected abstract List<SyntaxNode> parseParameters();

    /**
     * Parses an expression starting with {@code {}: an object literal or an array initializer.
     */
    protected abstract SyntaxNode parseBraceExpression();

    /**
     * Attempts to parse a cast at the current {@code (}.
     *
     * @return null when the parenthesis does not start a cast
     */
    protected SyntaxNode tryParseCast() {
        return null;
    }

    /**
     * Parses a language-specific primary expression.
     *
     * @return null when the current token does not start one
     */
    protected SyntaxNode parseLanguagePrimary() {
        return null;
    }

    /**
     * Handles postfix operators that exist in one language only.
     *
     * @return the new expression, or null when nothing was consumed
     */
    protected SyntaxNode parseLanguagePostfix(SyntaxNode expression) {
        return null;
    }

    protected abstract boolean isArrowToken(SourceToken token);

    protected abstract AbstractSourceParser createEmbeddedParser();

    protected void consumeStatementEnd() {
        if (!check(";") && endsAtUnterminatedLiteral()) {
            return;
        }
        expect(";", "Expected ';' after statement");
    }

    /**
     * True when the statement so far ended with a string that ran to the end of its line.
     * The tokenizer has already reported it.
     */
    protected boolean endsAtUnterminatedLiteral() {
        SourceToken last = previous();
        return last.isUnterminated() && (isAtEnd() || peek().getLine() > last.getLine());
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    protected SyntaxNode parseStatement() {
        SourceToken t = peek();
        SyntaxNode languageStatement = parseLanguageStatement();
        if (languageStatement != null) {
            return languageStatement;
        }
        if (t.is("{")) {
            return parseBlock();
        }
        if (t.is(";")) {
            advance();
            return SyntaxNode.empty(lineOf(t), t.getColumn());
        }
        if (t.getType() == TokenType.KEYWORD) {
            switch (t.getValue()) {
                case "if":
                    return parseIf();
                case "while":
                    return parseWhile();
                case "do":
                    return parseDoWhile();
                case "for":
                    return parseFor();
                case "switch":
                    return parseSwitch();
                case "break":
                    return parseJump(SyntaxKind.BREAK_STATEMENT);
                case "continue":
                    return parseJump(SyntaxKind.CONTINUE_STATEMENT);
                case "return":
                    return parseReturn();
                case "throw":
                    return parseThrow();
                case "try":
                    return parseTry();
                default:
                    break;
            }
        }
        if (t.isIdentifier() && peekAt(1).is(":") && !peekAt(2).is(":")) {
            // Labels have no pseudocode meaning; keep the labelled statement.
            advance();
            advance();
            return parseStatement();
        }
        SyntaxNode expression = parseExpression();
        consumeStatementEnd();
        return node(SyntaxKind.EXPRESSION_STATEMENT, t).child(expression).build();
    }

    protected SyntaxNode parseBlock() {
        SourceToken open = peek();
        if (depth >= maxNestingDepth) {
            return skipTooDeep(open);
        }
        depth++;
        try {
            expect("{", "Expected '{'");
            List<SyntaxNode> statements = parseStatementsUntil(Set.of("}"));
            expect("}", "Expected '}' to close block opened on line " + lineOf(open));
            return node(SyntaxKind.BLOCK, open).children(statements).build();
        } finally {
            depth--;
        }
    }

    /**
     * Parses statements until one of the given tokens (not consumed) or end of input.
     */
    protected List<SyntaxNode> parseStatementsUntil(Set<String> terminators) {
        List<SyntaxNode> statements = new ArrayList<>();
        while (!isAtEnd() && terminators.stream().noneMatch(this::check)) {
            int start = pos;
            SyntaxNode statement = guarded(this::parseStatement);
            if (statement != null && !statement.isEmpty()) {
                statements.add(statement);
            }
            if (pos == start) {
                advance();
            }
        }
        return statements;
    }

    private SyntaxNode parseIf() {
        SourceToken ifToken = advance();
        expect("(", "Expected '(' after 'if'");
        SyntaxNode condition = parseExpression();
        expect(")", "Expected ')' after if condition");
        SyntaxNode thenBranch = parseStatement();
        SyntaxNode elseBranch = match("else") ? parseStatement() : SyntaxNode.empty(lineOf(ifToken), 0);
        return node(SyntaxKind.IF_STATEMENT, ifToken)
                .child(condition)
                .child(thenBranch)
                .child(elseBranch)
                .build();
    }

    private SyntaxNode parseWhile() {
        SourceToken whileToken = advance();
        expect("(", "Expected '(' after 'while'");
        SyntaxNode condition = parseExpression();
        expect(")", "Expected ')' after while condition");
        SyntaxNode body = parseStatement();
        return node(SyntaxKind.WHILE_STATEMENT, whileToken).child(condition).child(body).build();
    }

    private SyntaxNode parseDoWhile() {
        SourceToken doToken = advance();
        SyntaxNode body = parseStatement();
        expect("while", "Expected 'while' after do body");
        expect("(", "Expected '(' after 'while'");
        SyntaxNode condition = parseExpression();
        expect(")", "Expected ')' after do-while condition");
        consumeStatementEnd();
        return node(SyntaxKind.DO_WHILE_STATEMENT, doToken).child(body).child(condition).build();
    }

    private SyntaxNode parseFor() {
        SourceToken forToken = advance();
        expect("(", "Expected '(' after 'for'");
        SyntaxNode forEach = tryParseForEach(forToken);
        if (forEach != null) {
            return forEach;
        }
        SyntaxNode init = check(";") ? SyntaxNode.empty(lineOf(forToken), 0) : parseForInit();
        expect(";", "Expected ';' after for initializer");
        SyntaxNode condition = check(";") ? SyntaxNode.empty(lineOf(forToken), 0) : parseExpression();
        expect(";", "Expected ';' after for condition");
        SyntaxNode update = check(")") ? SyntaxNode.empty(lineOf(forToken), 0) : parseExpressionSequence();
        expect(")", "Expected ')' after for clauses");
        SyntaxNode body = parseStatement();
        return node(SyntaxKind.FOR_STATEMENT, forToken)
                .child(init)
                .child(condition)
                .child(update)
                .child(body)
                .build();
    }

    /**
     * Comma-separated expressions; a single expression is returned unwrapped.
     */
    protected SyntaxNode parseExpressionSequence() {
        SourceToken start = peek();
        List<SyntaxNode> expressions = new ArrayList<>();
        expressions.add(parseExpression());
        while (match(",")) {
            expressions.add(parseExpression());
        }
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        return node(SyntaxKind.SEQUENCE_EXPRESSION, start).children(expressions).build();
    }

    private SyntaxNode parseSwitch() {
        SourceToken switchToken = advance();
        expect("(", "Expected '(' after 'switch'");
        SyntaxNode discriminant = parseExpression();
        expect(")", "Expected ')' after switch expression");
        expect("{", "Expected '{' to open switch body");

        List<SyntaxNode> cases = new ArrayList<>();
        while (!check("}") && !isAtEnd()) {
            SyntaxNode switchCase = guarded(this::parseSwitchCase);
            if (switchCase != null) {
                cases.add(switchCase);
            }
        }
        expect("}", "Expected '}' to close switch opened on line " + lineOf(switchToken));
        return node(SyntaxKind.SWITCH_STATEMENT, switchToken).child(discriminant).children(cases).build();
    }

    private SyntaxNode parseSwitchCase() {
        SourceToken caseToken = peek();
        List<SyntaxNode> labels = new ArrayList<>();
        boolean isDefault = false;
        if (match("case")) {
            do {
                labels.add(parseConditional());
            } while (match(","));
        } else if (match("default")) {
            isDefault = true;
        } else {
            throw error("Expected 'case' or 'default' in switch, found '" + caseToken.getValue() + "'");
        }

        boolean arrow = false;
        List<SyntaxNode> body;
        if (match("->")) {
            arrow = true;
            SyntaxNode statement = parseStatement();
            body = statement.is(SyntaxKind.BLOCK) ? statement.getChildren() : List.of(statement);
        } else {
            expect(":", "Expected ':' after case label");
            body = parseStatementsUntil(Set.of("case", "default", "}"));
        }

        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.SWITCH_CASE, caseToken)
                .child(node(SyntaxKind.EXPRESSION_LIST, caseToken).children(labels).build())
                .child(node(SyntaxKind.BLOCK, caseToken).children(body).build());
        if (isDefault) {
            builder.attribute(SyntaxAttributes.DEFAULT, "true");
        }
        if (arrow) {
            builder.attribute(SyntaxAttributes.ARROW, "true");
        }
        return builder.build();
    }

    private SyntaxNode parseJump(SyntaxKind kind) {
        SourceToken jump = advance();
        SyntaxNode.SyntaxNodeBuilder builder = node(kind, jump);
        if (peek().isIdentifier() && peek().getLine() == jump.getLine()) {
            builder.value(advance().getValue());
        }
        consumeStatementEnd();
        return builder.build();
    }

    private SyntaxNode parseReturn() {
        SourceToken returnToken = advance();
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.RETURN_STATEMENT, returnToken);
        if (!check(";") && !check("}") && !isAtEnd() && !endsStatementImplicitly(returnToken)) {
            builder.child(parseExpression());
        }
        consumeStatementEnd();
        return builder.build();
    }

    /**
     * True when a line break after {@code previous} ends the statement.
     */
    protected boolean endsStatementImplicitly(SourceToken previous) {
        return false;
    }

    private SyntaxNode parseThrow() {
        SourceToken throwToken = advance();
        reportUnsupported("exception handling (throw)", "Report the problem with OUTPUT instead", throwToken);
        SyntaxNode expression = parseExpression();
        consumeStatementEnd();
        return node(SyntaxKind.THROW_STATEMENT, throwToken).child(expression).build();
    }

    private SyntaxNode parseTry() {
        SourceToken tryToken = advance();
        reportUnsupported("exception handling (try/catch)", "Validate values with IF statements instead", tryToken);
        if (check("(")) {
            // Java try-with-resources: the resources are not represented.
            skipBalanced("(", ")");
        }
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.TRY_STATEMENT, tryToken).child(parseBlock());
        while (check("catch")) {
            SourceToken catchToken = advance();
            String parameter = null;
            String type = null;
            if (match("(")) {
                int start = pos;
                while (!check(")") && !isAtEnd()) {
                    advance();
                }
                List<String> words = new ArrayList<>();
                for (int i = start; i < pos; i++) {
                    words.add(tokens.get(i).getValue());
                }
                if (!words.isEmpty()) {
                    int nameIndex = words.indexOf(":") > 0 ? 0 : words.size() - 1;
                    parameter = words.get(nameIndex);
                    String rest = nameIndex == 0
                            ? String.join("", words.subList(Math.min(2, words.size()), words.size()))
                            : String.join(" ", words.subList(0, nameIndex));
                    type = rest.isBlank() ? null : rest;
                }
                expect(")", "Expected ')' after catch parameter");
            }
            SyntaxNode.SyntaxNodeBuilder catchBuilder = node(SyntaxKind.CATCH_CLAUSE, catchToken)
                    .value(parameter)
                    .child(parseBlock());
            if (type != null) {
                catchBuilder.attribute(SyntaxAttributes.TYPE, type);
            }
            builder.child(catchBuilder.build());
        }
        if (check("finally")) {
            SourceToken finallyToken = advance();
            builder.child(node(SyntaxKind.CATCH_CLAUSE, finallyToken)
                    .attribute(SyntaxAttributes.FINALLY, "true")
                    .child(parseBlock())
                    .build());
        }
        return builder.build();
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    protected SyntaxNode parseExpression() {
        SourceToken start = peek();
        if (depth >= maxNestingDepth) {
            return skipTooDeep(start);
        }
        depth++;
        try {
            return parseAssignment();
        } finally {
            depth--;
        }
    }

    protected SyntaxNode parseAssignment() {
        SyntaxNode left = parseConditional();
        SourceToken t = peek();
        if (t.getType() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(t.getValue())) {
            advance();
            SyntaxNode right = parseAssignment();
            return node(SyntaxKind.ASSIGNMENT, t)
                    .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                    .child(left)
                    .child(right)
                    .build();
        }
        return left;
    }

    protected SyntaxNode parseConditional() {
        SyntaxNode condition = parseBinary(1);
        if (check("?")) {
            SourceToken question = advance();
            SyntaxNode whenTrue = parseAssignment();
            expect(":", "Expected ':' in conditional expression");
            SyntaxNode whenFalse = parseAssignment();
            return node(SyntaxKind.CONDITIONAL_EXPRESSION, question)
                    .child(condition)
                    .child(whenTrue)
                    .child(whenFalse)
                    .build();
        }
        return condition;
    }

    private SyntaxNode parseBinary(int minPrecedence) {
        SyntaxNode left = parseUnary();
        while (true) {
            SourceToken t = peek();
            int precedence = binaryPrecedence(t);
            if (precedence < minPrecedence) {
                break;
            }
            advance();
            if (t.is("??")) {
                reportUnsupported("nullish coalescing", "Test the value with an IF statement", t);
            }
            SyntaxNode right;
            if (t.is("instanceof")) {
                SourceToken typeToken = peek();
                right = node(SyntaxKind.IDENTIFIER, typeToken).value(parseTypeText()).build();
                if (peek().isIdentifier() && !isBinaryOperatorToken(peek())) {
                    // Pattern binding such as "obj instanceof String s".
                    advance();
                }
            } else if (isTypeAssertionOperator(t)) {
                String type = parseTypeText();
                left = node(SyntaxKind.CAST_EXPRESSION, t)
                        .attribute(SyntaxAttributes.TYPE, type)
                        .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                        .child(left)
                        .build();
                continue;
            } else {
                boolean rightAssociative = t.is("**");
                right = parseBinary(rightAssociative ? precedence : precedence + 1);
            }
            left = node(SyntaxKind.BINARY_EXPRESSION, t)
                    .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                    .child(left)
                    .child(right)
                    .build();
        }
        return left;
    }

    private int binaryPrecedence(SourceToken t) {
        if (t.getType() == TokenType.EOF || t.isLiteral()) {
            return -1;
        }
        if (isTypeAssertionOperator(t) || isRelationalKeyword(t)) {
            return RELATIONAL_PRECEDENCE;
        }
        if (t.getType() != TokenType.OPERATOR && !t.is("instanceof")) {
            return -1;
        }
        return BINARY_PRECEDENCE.getOrDefault(t.getValue(), -1);
    }

    private boolean isBinaryOperatorToken(SourceToken t) {
        return binaryPrecedence(t) > 0;
    }

    /**
     * TypeScript {@code as} and {@code satisfies}.
     */
    protected boolean isTypeAssertionOperator(SourceToken t) {
        return false;
    }

    /**
     * TypeScript {@code in}.
     */
    protected boolean isRelationalKeyword(SourceToken t) {
        return false;
    }

    protected SyntaxNode parseUnary() {
        SourceToken t = peek();
        if (t.getType() == TokenType.OPERATOR && Set.of("!", "-", "+", "~").contains(t.getValue())) {
            advance();
            SyntaxNode operand = parseUnary();
            return node(SyntaxKind.UNARY_EXPRESSION, t)
                    .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                    .child(operand)
                    .build();
        }
        if (t.is("++") || t.is("--")) {
            advance();
            SyntaxNode operand = parseUnary();
            return node(SyntaxKind.UPDATE_EXPRESSION, t)
                    .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                    .attribute(SyntaxAttributes.PREFIX, "true")
                    .child(operand)
                    .build();
        }
        if (isUnaryKeyword(t)) {
            advance();
            SyntaxNode operand = parseUnary();
            return node(SyntaxKind.UNARY_EXPRESSION, t)
                    .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                    .child(operand)
                    .build();
        }
        if (t.is("(")) {
            SyntaxNode cast = tryParseCast();
            if (cast != null) {
                return cast;
            }
        }
        return parsePostfix(parsePrimary());
    }

    /**
     * TypeScript {@code typeof}, {@code delete}, {@code void} and {@code await}.
     */
    protected boolean isUnaryKeyword(SourceToken t) {
        return false;
    }

    private SyntaxNode parsePostfix(SyntaxNode start) {
        SyntaxNode expression = start;
        while (true) {
            SourceToken t = peek();
            if (t.is(".")) {
                advance();
                SourceToken name = expectPropertyName();
                expression = node(SyntaxKind.MEMBER_ACCESS, name).value(name.getValue()).child(expression).build();
            } else if (t.is("?.")) {
                advance();
                reportUnsupported("optional chaining", "Check the value with an IF statement first", t);
                if (check("(")) {
                    expression = parseCall(expression, t);
                } else if (check("[")) {
                    expression = parseIndex(expression);
                } else {
                    SourceToken name = expectPropertyName();
                    expression = node(SyntaxKind.MEMBER_ACCESS, name)
                            .value(name.getValue())
                            .attribute(SyntaxAttributes.OPTIONAL_CHAIN, "true")
                            .child(expression)
                            .build();
                }
            } else if (t.is("[")) {
                expression = parseIndex(expression);
            } else if (t.is("(")) {
                expression = parseCall(expression, t);
            } else if ((t.is("++") || t.is("--")) && t.getLine() == previous().getLine()) {
                advance();
                expression = node(SyntaxKind.UPDATE_EXPRESSION, t)
                        .attribute(SyntaxAttributes.OPERATOR, t.getValue())
                        .attribute(SyntaxAttributes.PREFIX, "false")
                        .child(expression)
                        .build();
            } else {
                SyntaxNode languagePostfix = parseLanguagePostfix(expression);
                if (languagePostfix == null) {
                    break;
                }
                expression = languagePostfix;
            }
        }
        return expression;
    }

    private SyntaxNode parseIndex(SyntaxNode target) {
        SourceToken open = advance();
        SyntaxNode index = parseExpression();
        expect("]", "Expected ']' after index");
        return node(SyntaxKind.INDEX_ACCESS, open).child(target).child(index).build();
    }

    private SyntaxNode parseCall(SyntaxNode callee, SourceToken at) {
        List<SyntaxNode> arguments = parseArguments();
        return node(SyntaxKind.CALL_EXPRESSION, at).child(callee).children(arguments).build();
    }

    protected List<SyntaxNode> parseArguments() {
        expect("(", "Expected '('");
        List<SyntaxNode> arguments = new ArrayList<>();
        if (!check(")")) {
            do {
                if (check(")")) {
                    break;
                }
                arguments.add(parseElement());
            } while (match(","));
        }
        expect(")", "Expected ')' after arguments");
        return arguments;
    }

    /**
     * An argument or array element: an expression, possibly spread.
     */
    protected SyntaxNode parseElement() {
        if (check("...")) {
            SourceToken spread = advance();
            reportUnsupported("spread syntax", "List the elements explicitly", spread);
            return node(SyntaxKind.SPREAD_ELEMENT, spread).child(parseAssignment()).build();
        }
        return parseExpression();
    }

    protected SyntaxNode parsePrimary() {
        SourceToken t = peek();
        switch (t.getType()) {
            case NUMBER_LITERAL: {
                advance();
                return node(SyntaxKind.LITERAL, t)
                        .value(t.getValue())
                        .attribute(SyntaxAttributes.LITERAL_TYPE, isDecimal(t.getValue())
                                ? SyntaxAttributes.LITERAL_DECIMAL : SyntaxAttributes.LITERAL_INTEGER)
                        .build();
            }
            case STRING_LITERAL:
                advance();
                return literal(t, SyntaxAttributes.LITERAL_STRING);
            case CHAR_LITERAL:
                advance();
                return literal(t, SyntaxAttributes.LITERAL_CHAR);
            case BOOLEAN_LITERAL:
                advance();
                return literal(t, SyntaxAttributes.LITERAL_BOOLEAN);
            case NULL_LITERAL:
                advance();
                return literal(t, SyntaxAttributes.LITERAL_NULL);
            case TEMPLATE_LITERAL:
                advance();
                return parseTemplate(t);
            default:
                break;
        }

        SyntaxNode languagePrimary = parseLanguagePrimary();
        if (languagePrimary != null) {
            return languagePrimary;
        }

        if (t.isIdentifier() && isArrowToken(peekAt(1))) {
            return parseLambda(t);
        }
        if (t.isIdentifier()) {
            advance();
            return node(SyntaxKind.IDENTIFIER, t).value(t.getValue()).build();
        }
        if (t.is("this") || t.is("super")) {
            advance();
            return node(SyntaxKind.IDENTIFIER, t).value(t.getValue()).build();
        }
        if (t.is("(")) {
            if (isLambdaAhead()) {
                return parseLambda(t);
            }
            advance();
            SyntaxNode inner = parseExpressionSequence();
            expect(")", "Expected ')' to close parenthesis opened on line " + lineOf(t));
            return node(SyntaxKind.PARENTHESIZED, t).child(inner).build();
        }
        if (t.is("[")) {
            advance();
            List<SyntaxNode> elements = new ArrayList<>();
            while (!check("]") && !isAtEnd()) {
                elements.add(parseElement());
                if (!match(",")) {
                    break;
                }
            }
            expect("]", "Expected ']' to close array literal");
            return node(SyntaxKind.ARRAY_LITERAL, t).children(elements).build();
        }
        if (t.is("{")) {
            return parseBraceExpression();
        }
        if (t.is("new")) {
            return parseNew();
        }
        if (t.is("switch")) {
            reportUnsupported("switch expressions", "Use a CASE statement that assigns a variable", t);
            int start = pos;
            advance();
            if (check("(")) {
                skipBalanced("(", ")");
            }
            if (check("{")) {
                skipBalanced("{", "}");
            }
            return unsupported(t, "switch expressions", joinTokens(start, pos));
        }
        throw error("Unexpected token '" + t.getValue() + "'");
    }

    private SyntaxNode literal(SourceToken t, String literalType) {
        return node(SyntaxKind.LITERAL, t)
                .value(t.getValue())
                .attribute(SyntaxAttributes.LITERAL_TYPE, literalType)
                .build();
    }

    private static boolean isDecimal(String number) {
        String lower = number.toLowerCase();
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return false;
        }
        return lower.contains(".") || lower.contains("e") || lower.endsWith("f") || lower.endsWith("d");
    }

    private SyntaxNode parseNew() {
        SourceToken newToken = advance();
        StringBuilder typeName = new StringBuilder(expectPropertyName().getValue());
        while (check(".") && peekAt(1).isIdentifier()) {
            advance();
            typeName.append('.').append(advance().getValue());
        }
        if (check("<")) {
            reportUnsupported("generics", "Use a concrete element type", peek());
            skipAngleBrackets();
        }
        if (check("[")) {
            List<SyntaxNode> dimensions = new ArrayList<>();
            while (check("[")) {
                SourceToken open = advance();
                dimensions.add(check("]") ? SyntaxNode.empty(lineOf(open), open.getColumn()) : parseExpression());
                expect("]", "Expected ']' in array creation");
            }
            SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.NEW_ARRAY, newToken)
                    .value(typeName.toString())
                    .children(dimensions);
            if (check("{")) {
                builder.child(parseBraceExpression());
            }
            return builder.build();
        }
        List<SyntaxNode> arguments = check("(") ? parseArguments() : List.of();
        if (check("{")) {
            SourceToken body = peek();
            reportUnsupported("anonymous classes", "Declare a named class instead", body);
            skipBalanced("{", "}");
        }
        return node(SyntaxKind.NEW_EXPRESSION, newToken).value(typeName.toString()).children(arguments).build();
    }

    /**
     * Parses {@code x -> body}, {@code (a, b) => body} and typed parameter lists.
     */
    protected SyntaxNode parseLambda(SourceToken start) {
        List<SyntaxNode> parameters;
        if (start.isIdentifier() && !check("(")) {
            SourceToken name = advance();
            parameters = List.of(node(SyntaxKind.PARAMETER, name).value(name.getValue()).build());
        } else {
            parameters = parseParameters();
        }
        String returnType = null;
        if (match(":")) {
            returnType = parseTypeText();
        }
        SourceToken arrow = advance();
        if (!isArrowToken(arrow)) {
            throw new ParseException("Expected arrow in lambda expression", lineOf(arrow), arrow.getColumn());
        }
        SyntaxNode body = check("{") ? parseBlock() : parseAssignment();
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.LAMBDA_EXPRESSION, start)
                .children(parameters)
                .child(body)
                .attribute(SyntaxAttributes.ARROW, "true");
        if (returnType != null) {
            builder.attribute(SyntaxAttributes.RETURN_TYPE, returnType);
        }
        onLambdaParsed(start);
        return builder.build();
    }

    protected void onLambdaParsed(SourceToken start) {
    }

    /**
     * Looks past a balanced parenthesis group for an arrow.
     */
    protected boolean isLambdaAhead() {
        int close = findClosing(pos, "(", ")");
        if (close < 0) {
            return false;
        }
        SourceToken after = tokenAt(close + 1);
        if (isArrowToken(after)) {
            return true;
        }
        if (!after.is(":")) {
            return false;
        }
        int nested = 0;
        for (int i = close + 2; i < Math.min(tokens.size(), close + 60); i++) {
            SourceToken t = tokens.get(i);
            if (nested == 0 && isArrowToken(t)) {
                return true;
            }
            if (t.is("(") || t.is("[") || t.is("{") || t.is("<")) {
                nested++;
            } else if (t.is(")") || t.is("]") || t.is("}") || t.is(">")) {
                nested--;
            } else if (t.is(";") || t.is("=")) {
                return false;
            }
            if (nested < 0) {
                return false;
            }
        }
        return false;
    }

    private SyntaxNode parseTemplate(SourceToken token) {
        String text = token.getValue();
        SyntaxNode.SyntaxNodeBuilder builder = node(SyntaxKind.TEMPLATE_LITERAL, token);
        StringBuilder literalPart = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                literalPart.append(c).append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                if (literalPart.length() > 0) {
                    builder.child(templatePart(token, literalPart.toString()));
                    literalPart.setLength(0);
                }
                int braceDepth = 1;
                int j = i + 2;
                while (j < text.length() && braceDepth > 0) {
                    if (text.charAt(j) == '{') {
                        braceDepth++;
                    } else if (text.charAt(j) == '}') {
                        braceDepth--;
                    }
                    j++;
                }
                String expressionText = text.substring(i + 2, braceDepth == 0 ? j - 1 : j);
                builder.child(parseEmbeddedExpression(expressionText, token));
                i = j;
                continue;
            }
            literalPart.append(c);
            i++;
        }
        if (literalPart.length() > 0) {
            builder.child(templatePart(token, literalPart.toString()));
        }
        return builder.build();
    }

    private SyntaxNode templatePart(SourceToken token, String text) {
        return node(SyntaxKind.LITERAL, token)
                .value(text.replace("\"", "\\\"").replace("\n", "\\n"))
                .attribute(SyntaxAttributes.LITERAL_TYPE, SyntaxAttributes.LITERAL_STRING)
                .attribute(SyntaxAttributes.TEMPLATE_PART, "true")
                .build();
    }

    /**
     * Parses an expression embedded in a literal, reporting its problems at the literal's position.
     */
    protected SyntaxNode parseEmbeddedExpression(String text, SourceToken at) {
        AbstractSourceParser embedded = createEmbeddedParser();
        embedded.diagnostics = new Diagnostics();
        embedded.tokens = new SourceTokenizer(text, getLanguage(), embedded.diagnostics).tokenize();
        embedded.pos = 0;
        embedded.depth = depth;
        embedded.lineOffset = lineOf(at) - 1;
        SyntaxNode result;
        try {
            result = embedded.parseExpression();
        } catch (ParseException e) {
            embedded.diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                    "Invalid expression in template literal: " + e.getMessage(), lineOf(at), at.getColumn());
            result = node(SyntaxKind.IDENTIFIER, at).value(text.trim()).build();
        }
        for (Diagnostic diagnostic : embedded.diagnostics.getEntries()) {
            diagnostics.add(diagnostic.toBuilder().line(lineOf(at)).column(at.getColumn()).build());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Recovery and guards
    // ------------------------------------------------------------------

    /**
     * Runs a parse step, turning a {@link ParseException} into a diagnostic and resynchronizing.
     */
    protected SyntaxNode guarded(Supplier<SyntaxNode> step) {
        int start = pos;
        try {
            return step.get();
        } catch (ParseException e) {
            log.debug("Recovering from parse error on line {}: {}", e.getLine(), e.getMessage());
            diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                    e.getMessage() + " on line " + e.getLine(), e.getLine(), e.getColumn());
            synchronize(start);
            return null;
        }
    }

    /**
     * Skips to the end of the current statement: past the next {@code ;}, past a balanced block,
     * or up to (not including) the {@code }} that closes the enclosing block. Outside brackets it
     * also stops before the first token of a new line, once the failed statement has consumed something.
     */
    protected void synchronize(int statementStart) {
        int nested = 0;
        while (!isAtEnd()) {
            SourceToken t = peek();
            if (nested == 0 && pos > statementStart && t.getLine() > previous().getLine()) {
                return;
            }
            if (t.is("(") || t.is("[") || t.is("{")) {
                nested++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                if (nested == 0) {
                    if (t.is("}")) {
                        return;
                    }
                } else {
                    nested--;
                    if (nested == 0 && t.is("}")) {
                        advance();
                        return;
                    }
                }
            } else if (t.is(";") && nested == 0) {
                advance();
                return;
            }
            advance();
        }
    }

    private SyntaxNode skipTooDeep(SourceToken at) {
        if (!nestingReported) {
            nestingReported = true;
            diagnostics.error(DiagnosticCode.NESTING_TOO_DEEP,
                    "Nesting deeper than " + maxNestingDepth + " levels on line " + lineOf(at)
                            + " was not converted",
                    lineOf(at), at.getColumn());
        }
        int start = pos;
        if (check("{")) {
            skipBalanced("{", "}");
        } else {
            int nested = 0;
            while (!isAtEnd()) {
                SourceToken t = peek();
                if (t.is("(") || t.is("[") || t.is("{")) {
                    nested++;
                } else if (t.is(")") || t.is("]") || t.is("}")) {
                    if (nested == 0) {
                        break;
                    }
                    nested--;
                } else if (nested == 0 && (t.is(";") || t.is(","))) {
                    break;
                }
                advance();
            }
        }
        return unsupported(at, "nesting deeper than " + maxNestingDepth + " levels", joinTokens(start, pos));
    }

    protected void reportUnsupported(String feature, String suggestion, SourceToken at) {
        String key = feature + "@" + lineOf(at);
        if (reportedFeatures.add(key)) {
            diagnostics.warning(DiagnosticCode.UNSUPPORTED_FEATURE, "Unsupported feature: " + feature,
                    lineOf(at), at.getColumn(), suggestion);
        }
    }

    protected SyntaxNode unsupported(SourceToken at, String feature, String text) {
        return node(SyntaxKind.UNSUPPORTED, at)
                .value(text)
                .attribute(SyntaxAttributes.FEATURE, feature)
                .build();
    }

    /**
     * Skips a balanced region starting at the current opening token.
     */
    protected void skipBalanced(String open, String close) {
        int nested = 0;
        while (!isAtEnd()) {
            SourceToken t = advance();
            if (t.is(open)) {
                nested++;
            } else if (t.is(close)) {
                nested--;
                if (nested <= 0) {
                    return;
                }
            }
        }
    }

    protected void skipAngleBrackets() {
        int nested = 0;
        while (!isAtEnd()) {
            SourceToken t = advance();
            nested += angleDelta(t);
            if (nested <= 0) {
                return;
            }
        }
    }

    protected static int angleDelta(SourceToken t) {
        if (t.getType() != TokenType.OPERATOR) {
            return 0;
        }
        return switch (t.getValue()) {
            case "<" -> 1;
            case ">" -> -1;
            case ">>" -> -2;
            case ">>>" -> -3;
            default -> 0;
        };
    }

    /**
     * Skips tokens up to and including the next {@code ;} at nesting level zero.
     */
    protected void skipPastSemicolon() {
        int nested = 0;
        while (!isAtEnd()) {
            SourceToken t = advance();
            if (t.is("(") || t.is("[") || t.is("{")) {
                nested++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                nested--;
            } else if (t.is(";") && nested <= 0) {
                return;
            }
        }
    }

    protected int findClosing(int openIndex, String open, String close) {
        int nested = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            SourceToken t = tokens.get(i);
            if (t.is(open)) {
                nested++;
            } else if (t.is(close)) {
                nested--;
                if (nested == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Rebuilds readable source text from a token range.
     */
    protected String joinTokens(int from, int to) {
        StringBuilder sb = new StringBuilder();
        SourceToken previousToken = null;
        for (int i = from; i < to && i < tokens.size(); i++) {
            SourceToken t = tokens.get(i);
            String text = switch (t.getType()) {
                case STRING_LITERAL -> "\"" + t.getValue() + "\"";
                case CHAR_LITERAL -> "'" + t.getValue() + "'";
                case TEMPLATE_LITERAL -> "`" + t.getValue() + "`";
                default -> t.getValue();
            };
            if (previousToken != null && needsSpace(previousToken, t)) {
                sb.append(' ');
            }
            sb.append(text);
            previousToken = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(SourceToken before, SourceToken after) {
        if (after.is(";") || after.is(",") || after.is(".") || after.is(")") || after.is("]")) {
            return false;
        }
        if (before.is("(") || before.is("[") || before.is(".") || before.is("@")) {
            return false;
        }
        return !(after.is("(") || after.is("[")) || before.getType() == TokenType.KEYWORD;
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    protected SyntaxNode.SyntaxNodeBuilder node(SyntaxKind kind, SourceToken at) {
        return SyntaxNode.builder().kind(kind).line(lineOf(at)).column(at.getColumn());
    }

    protected int lineOf(SourceToken token) {
        return token.getLine() + lineOffset;
    }

    private SyntaxNode program(List<SyntaxNode> items) {
        return SyntaxNode.builder().kind(SyntaxKind.PROGRAM).children(items).line(1).column(1).build();
    }

    protected SourceToken peek() {
        return tokens.get(pos);
    }

    protected SourceToken peekAt(int offset) {
        return tokenAt(pos + offset);
    }

    protected SourceToken tokenAt(int index) {
        if (index < 0) {
            return tokens.get(0);
        }
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    protected SourceToken previous() {
        return pos > 0 ? tokens.get(pos - 1) : tokens.get(0);
    }

    protected boolean check(String value) {
        return peek().is(value);
    }

    protected boolean match(String value) {
        if (check(value)) {
            advance();
            return true;
        }
        return false;
    }

    protected SourceToken advance() {
        SourceToken current = tokens.get(pos);
        if (!isAtEnd()) {
            pos++;
        }
        return current;
    }

    protected SourceToken expect(String value, String message) {
        if (check(value)) {
            return advance();
        }
        throw error(message + ", found '" + describe(peek()) + "'");
    }

    protected SourceToken expectIdentifier(String what) {
        if (peek().isIdentifier()) {
            return advance();
        }
        throw error("Expected " + what + ", found '" + describe(peek()) + "'");
    }

    /**
     * Property names may be keywords or literals, e.g. {@code obj.default} or {@code arr.length}.
     */
    protected SourceToken expectPropertyName() {
        SourceToken t = peek();
        switch (t.getType()) {
            case IDENTIFIER:
            case KEYWORD:
            case BOOLEAN_LITERAL:
            case NULL_LITERAL:
                return advance();
            default:
                throw error("Expected a name, found '" + describe(t) + "'");
        }
    }

    protected boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    protected ParseException error(String message) {
        SourceToken t = peek();
        return new ParseException(message, lineOf(t), t.getColumn());
    }

    private static String describe(SourceToken t) {
        return t.getType() == TokenType.EOF ? "end of input" : t.getValue();
    }
}
