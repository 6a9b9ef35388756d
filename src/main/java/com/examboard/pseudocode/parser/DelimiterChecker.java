package com.examboard.pseudocode.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.parser.SourceToken.TokenType;

/**
 * Reports unbalanced braces, parentheses and brackets before parsing starts.
 */
public class DelimiterChecker {

    private static final Map<String, String> CLOSER_FOR = Map.of("(", ")", "{", "}", "[", "]");
    private static final Map<String, String> OPENER_FOR = Map.of(")", "(", "}", "{", "]", "[");

    private final Diagnostics diagnostics;

    public DelimiterChecker(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @return the number of delimiter errors found
     */
    public int check(List<SourceToken> tokens) {
        int errors = 0;
        Deque<SourceToken> open = new ArrayDeque<>();
        for (SourceToken token : tokens) {
            if (token.getType() != TokenType.PUNCTUATION) {
                continue;
            }
            String value = token.getValue();
            if (CLOSER_FOR.containsKey(value)) {
                open.push(token);
            } else if (OPENER_FOR.containsKey(value)) {
                if (open.isEmpty()) {
                    diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                            "Unmatched '" + value + "' on line " + token.getLine(), token.getLine(), token.getColumn());
                    errors++;
                    continue;
                }
                SourceToken opener = open.peek();
                if (!OPENER_FOR.get(value).equals(opener.getValue())) {
                    diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                            "Mismatched '" + value + "' on line " + token.getLine() + ": expected '"
                                    + CLOSER_FOR.get(opener.getValue()) + "' to close '" + opener.getValue()
                                    + "' opened on line " + opener.getLine(),
                            token.getLine(), token.getColumn());
                    errors++;
                    // Only discard the opener when the closer matches something further out.
                    if (open.stream().noneMatch(t -> t.getValue().equals(OPENER_FOR.get(value)))) {
                        continue;
                    }
                    while (!open.isEmpty() && !open.peek().getValue().equals(OPENER_FOR.get(value))) {
                        open.pop();
                    }
                }
                open.pop();
            }
        }
        while (!open.isEmpty()) {
            SourceToken opener = open.pollLast();
            diagnostics.error(DiagnosticCode.STRUCTURAL_ERROR,
                    "Unclosed '" + opener.getValue() + "' opened on line " + opener.getLine(),
                    opener.getLine(), opener.getColumn());
            errors++;
        }
        return errors;
    }
}
