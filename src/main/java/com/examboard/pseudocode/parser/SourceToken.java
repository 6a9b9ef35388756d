package com.examboard.pseudocode.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token produced by the source tokenizer.
 */
@Data
@AllArgsConstructor
public class SourceToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;
    private boolean unterminated;

    public SourceToken(TokenType type, String value, int line, int column) {
        this(type, value, line, column, false);
    }

    public enum TokenType {
        IDENTIFIER,
        KEYWORD,
        NUMBER_LITERAL,
        STRING_LITERAL,
        CHAR_LITERAL,
        TEMPLATE_LITERAL,
        BOOLEAN_LITERAL,
        NULL_LITERAL,
        OPERATOR,
        PUNCTUATION,
        EOF
    }

    /**
     * True when this token is a symbol, keyword or identifier spelled exactly {@code text}.
     * String-like literals never match.
     */
    public boolean is(String text) {
        return switch (type) {
            case STRING_LITERAL, CHAR_LITERAL, TEMPLATE_LITERAL, EOF -> false;
            default -> value.equals(text);
        };
    }

    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    public boolean isLiteral() {
        return switch (type) {
            case NUMBER_LITERAL, STRING_LITERAL, CHAR_LITERAL, TEMPLATE_LITERAL, BOOLEAN_LITERAL, NULL_LITERAL -> true;
            default -> false;
        };
    }
}
