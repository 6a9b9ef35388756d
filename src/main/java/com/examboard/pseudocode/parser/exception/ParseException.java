package com.examboard.pseudocode.parser.exception;

/**
 * Raised inside a parser when an unexpected token is met. Never escapes {@code parse}:
 * the parser turns it into a diagnostic and resynchronizes.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
