package com.examboard.pseudocode.transform.mapping;

import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Text-level arithmetic on rendered pseudocode expressions, used when moving
 * indices between 0-based and 1-based numbering. Integer literals are folded.
 */
@UtilityClass
public class IndexArithmetic {

    private static final Set<String> OPERATORS = Set.of(
        "+", "-", "*", "/", "&", "=", "<>", "<", ">", "<=", ">=", "^", "←", "AND", "OR", "MOD"
    );

    public static String plusOne(String expression) {
        return shift(expression, 1);
    }

    public static String minusOne(String expression) {
        return shift(expression, -1);
    }

    /**
     * Adds {@code delta} to the expression, folding it into a trailing integer term when there is one:
     * {@code n - 1} plus one is {@code n}, {@code k + 1} plus one is {@code k + 2}.
     */
    public static String shift(String expression, long delta) {
        String text = expression.trim();
        if (delta == 0) {
            return text;
        }
        if (isInteger(text)) {
            return String.valueOf(Long.parseLong(text) + delta);
        }
        int split = lastTopLevelAdditive(text);
        if (split > 0) {
            String left = text.substring(0, split);
            char operator = text.charAt(split + 1);
            String right = text.substring(split + 3).trim();
            if (isInteger(right)) {
                long term = (operator == '+' ? Long.parseLong(right) : -Long.parseLong(right)) + delta;
                if (term == 0) {
                    return left;
                }
                return left + (term > 0 ? " + " + term : " - " + (-term));
            }
        }
        return text + (delta > 0 ? " + " + delta : " - " + (-delta));
    }

    /**
     * Renders {@code minuend - subtrahend} with folding.
     */
    public static String difference(String minuend, String subtrahend) {
        String a = minuend.trim();
        String b = subtrahend.trim();
        if (isInteger(b)) {
            return shift(a, -Long.parseLong(b));
        }
        return a + " - " + group(b);
    }

    public static boolean isInteger(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return text.length() - start < 19;
    }

    /**
     * Wraps the expression in parentheses when it has an operator outside any parentheses.
     */
    public static String group(String expression) {
        return hasTopLevelOperator(expression) ? "(" + expression + ")" : expression;
    }

    /**
     * True when a binary operator appears outside parentheses, brackets and string literals.
     */
    public static boolean hasTopLevelOperator(String expression) {
        String text = expression.trim();
        if (text.startsWith("NOT ")) {
            return true;
        }
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                case ' ' -> {
                    if (depth == 0) {
                        int end = text.indexOf(' ', i + 1);
                        if (end > 0 && OPERATORS.contains(text.substring(i + 1, end))) {
                            return true;
                        }
                    }
                }
                default -> {
                }
            }
        }
        return false;
    }

    /**
     * Position of the space before the last top-level {@code +} or {@code -}, or -1.
     */
    private static int lastTopLevelAdditive(String text) {
        int depth = 0;
        char quote = 0;
        int found = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && c == ' ' && i + 2 < text.length()
                    && (text.charAt(i + 1) == '+' || text.charAt(i + 1) == '-') && text.charAt(i + 2) == ' ') {
                found = i;
            } else if (depth == 0 && c == ' ' && found >= 0 && isLowerPrecedence(text, i)) {
                // A comparison or logical operator after the last sum ends the arithmetic term.
                return -1;
            }
        }
        return found;
    }

    private static boolean isLowerPrecedence(String text, int spaceIndex) {
        int end = text.indexOf(' ', spaceIndex + 1);
        if (end < 0) {
            return false;
        }
        String operator = text.substring(spaceIndex + 1, end);
        return Set.of("=", "<>", "<", ">", "<=", ">=", "AND", "OR", "&", "←").contains(operator);
    }
}
