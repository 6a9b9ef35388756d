package com.examboard.pseudocode.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.Language;
import com.examboard.pseudocode.parser.SourceToken.TokenType;

/**
 * Tokenizer for Java and TypeScript source text.
 * Comments are skipped; every token carries its 1-based line and column.
 */
public class SourceTokenizer {
    private static final Logger log = LoggerFactory.getLogger(SourceTokenizer.class);

    private static final Set<String> JAVA_KEYWORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while"
    );

    private static final Set<String> TYPESCRIPT_KEYWORDS = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
        "else", "enum", "export", "extends", "finally", "for", "function", "if", "import", "in",
        "instanceof", "let", "new", "return", "super", "switch", "this", "throw", "try", "typeof",
        "var", "void", "while", "with", "yield", "interface", "implements", "package", "private",
        "protected", "public", "static"
    );

    // Longest first so that greedy matching picks ">>>=" before ">>".
    private static final String[] OPERATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "??=", "&&=", "||=",
        "=>", "->", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=",
        "%=", "&=", "|=", "^=", "<<", ">>", "**", "::",
        "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|", "^", "~", "?", ":", "@"
    };

    private static final String PUNCTUATION = "(){}[];,.";

    private final String source;
    private final Language language;
    private final Diagnostics diagnostics;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public SourceTokenizer(String source, Language language, Diagnostics diagnostics) {
        this.source = source;
        this.language = language;
        this.diagnostics = diagnostics;
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an EOF token.
     */
    public List<SourceToken> tokenize() {
        List<SourceToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new SourceToken(TokenType.EOF, "", line, column));
                break;
            }
            tokens.add(nextToken());
        }
        log.debug("Tokenized {} source into {} tokens", language.getDisplayName(), tokens.size());
        return tokens;
    }

    private SourceToken nextToken() {
        int startLine = line;
        int startColumn = column;
        char c = peek();

        if (c == '"') {
            return readQuoted('"', TokenType.STRING_LITERAL, "string", startLine, startColumn);
        }
        if (c == '\'') {
            TokenType type = language == Language.JAVA ? TokenType.CHAR_LITERAL : TokenType.STRING_LITERAL;
            return readQuoted('\'', type, type == TokenType.CHAR_LITERAL ? "character" : "string",
                    startLine, startColumn);
        }
        if (c == '`' && language == Language.TYPESCRIPT) {
            return readTemplateLiteral(startLine, startColumn);
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekAt(1)))) {
            return readNumber(startLine, startColumn);
        }
        if (Character.isJavaIdentifierStart(c)) {
            return readIdentifierOrKeyword(startLine, startColumn);
        }
        if (PUNCTUATION.indexOf(c) >= 0 && !(c == '.' && source.startsWith("...", pos))) {
            advance();
            return new SourceToken(TokenType.PUNCTUATION, String.valueOf(c), startLine, startColumn);
        }
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                for (int i = 0; i < operator.length(); i++) {
                    advance();
                }
                return new SourceToken(TokenType.OPERATOR, operator, startLine, startColumn);
            }
        }

        advance();
        diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                "Unexpected character '" + c + "' on line " + startLine, startLine, startColumn);
        return new SourceToken(TokenType.OPERATOR, String.valueOf(c), startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (pos < source.length() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                boolean closed = false;
                while (pos < source.length()) {
                    if (peek() == '*' && peekAt(1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                            "Unterminated block comment starting on line " + startLine, startLine, startColumn);
                }
            } else {
                break;
            }
        }
    }

    private SourceToken readQuoted(char quote, TokenType type, String description, int startLine, int startColumn) {
        advance();
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = peek();
            if (c == '\\') {
                sb.append(c);
                advance();
                if (pos < source.length()) {
                    sb.append(peek());
                    advance();
                }
                continue;
            }
            if (c == quote) {
                advance();
                return new SourceToken(type, normalizeQuotes(sb.toString(), quote, type), startLine, startColumn);
            }
            if (c == '\n') {
                break;
            }
            sb.append(c);
            advance();
        }
        diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                "Unterminated " + description + " literal on line " + startLine, startLine, startColumn);
        return new SourceToken(type, sb.toString(), startLine, startColumn, true);
    }

    /**
     * Single-quoted TypeScript strings are stored with double-quote escaping so every
     * string literal renders the same way downstream.
     */
    private String normalizeQuotes(String content, char quote, TokenType type) {
        if (quote != '\'' || type != TokenType.STRING_LITERAL) {
            return content;
        }
        return content.replace("\\'", "'").replace("\"", "\\\"");
    }

    /**
     * Reads a backtick literal, keeping {@code ${...}} parts verbatim for the parser to split.
     */
    private SourceToken readTemplateLiteral(int startLine, int startColumn) {
        advance();
        StringBuilder sb = new StringBuilder();
        int expressionDepth = 0;
        while (pos < source.length()) {
            char c = peek();
            if (expressionDepth == 0) {
                if (c == '\\') {
                    sb.append(c);
                    advance();
                    if (pos < source.length()) {
                        sb.append(peek());
                        advance();
                    }
                    continue;
                }
                if (c == '`') {
                    advance();
                    return new SourceToken(TokenType.TEMPLATE_LITERAL, sb.toString(), startLine, startColumn);
                }
                if (c == '$' && peekAt(1) == '{') {
                    sb.append("${");
                    advance();
                    advance();
                    expressionDepth = 1;
                    continue;
                }
            } else if (c == '{') {
                expressionDepth++;
            } else if (c == '}') {
                expressionDepth--;
            } else if (c == '"' || c == '\'') {
                char quote = c;
                sb.append(c);
                advance();
                while (pos < source.length() && peek() != quote && peek() != '\n') {
                    sb.append(peek());
                    advance();
                }
                if (pos < source.length() && peek() == quote) {
                    sb.append(quote);
                    advance();
                }
                continue;
            }
            sb.append(c);
            advance();
        }
        diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                "Unterminated template literal on line " + startLine, startLine, startColumn);
        return new SourceToken(TokenType.TEMPLATE_LITERAL, sb.toString(), startLine, startColumn, true);
    }

    private SourceToken readNumber(int startLine, int startColumn) {
        StringBuilder sb = new StringBuilder();
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X' || peekAt(1) == 'b' || peekAt(1) == 'B')) {
            sb.append(peek());
            advance();
            sb.append(peek());
            advance();
            while (pos < source.length() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                sb.append(peek());
                advance();
            }
            return new SourceToken(TokenType.NUMBER_LITERAL, sb.toString(), startLine, startColumn);
        }
        while (pos < source.length()) {
            char c = peek();
            if (Character.isDigit(c) || c == '_') {
                sb.append(c);
            } else if (c == '.' && Character.isDigit(peekAt(1))) {
                sb.append(c);
            } else if (c == '.' && sb.indexOf(".") < 0 && !Character.isJavaIdentifierStart(peekAt(1))
                    && peekAt(1) != '.') {
                sb.append(c);
            } else if ((c == 'e' || c == 'E') && (Character.isDigit(peekAt(1))
                    || ((peekAt(1) == '+' || peekAt(1) == '-') && Character.isDigit(peekAt(2))))) {
                sb.append(c);
                advance();
                sb.append(peek());
            } else {
                break;
            }
            advance();
        }
        if (pos < source.length() && "lLfFdDn".indexOf(peek()) >= 0) {
            sb.append(peek());
            advance();
        }
        return new SourceToken(TokenType.NUMBER_LITERAL, sb.toString(), startLine, startColumn);
    }

    private SourceToken readIdentifierOrKeyword(int startLine, int startColumn) {
        StringBuilder sb = new StringBuilder();
        while (pos < source.length() && Character.isJavaIdentifierPart(peek())) {
            sb.append(peek());
            advance();
        }
        String word = sb.toString();
        TokenType type;
        if (word.equals("true") || word.equals("false")) {
            type = TokenType.BOOLEAN_LITERAL;
        } else if (word.equals("null") || (language == Language.TYPESCRIPT && word.equals("undefined"))) {
            type = TokenType.NULL_LITERAL;
        } else if ((language == Language.JAVA ? JAVA_KEYWORDS : TYPESCRIPT_KEYWORDS).contains(word)) {
            type = TokenType.KEYWORD;
        } else {
            type = TokenType.IDENTIFIER;
        }
        return new SourceToken(type, word, startLine, startColumn);
    }

    private char peek() {
        return source.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
