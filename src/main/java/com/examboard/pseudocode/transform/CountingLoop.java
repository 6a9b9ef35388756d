package com.examboard.pseudocode.transform;

import java.util.Optional;
import java.util.Set;

import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.transform.mapping.IndexArithmetic;

import lombok.Value;

/**
 * A three-part for loop that counts one variable from a start value towards a bound in fixed steps.
 * Loops of any other shape are rewritten as WHILE loops.
 */
@Value
class CountingLoop {
    private static final Set<String> INCREASING = Set.of("<", "<=");
    private static final Set<String> DECREASING = Set.of(">", ">=");

    String variable;
    /**
     * Declared type spelling when the loop declares its own variable.
     */
    String declaredType;
    boolean declared;
    SyntaxNode start;
    String comparison;
    SyntaxNode bound;
    /**
     * "+" or "-"; the step expression is null for a step of one.
     */
    String stepSign;
    SyntaxNode step;

    static Optional<CountingLoop> match(SyntaxNode init, SyntaxNode condition, SyntaxNode update) {
        String variable;
        String declaredType = null;
        boolean declared;
        SyntaxNode start;
        if (init.is(SyntaxKind.VARIABLE_DECLARATION) && init.childCount() == 1) {
            variable = init.getValue();
            declaredType = init.attribute(SyntaxAttributes.TYPE);
            declared = true;
            start = init.child(0);
        } else if (init.is(SyntaxKind.ASSIGNMENT) && "=".equals(init.attribute(SyntaxAttributes.OPERATOR))
                && init.child(0).is(SyntaxKind.IDENTIFIER)) {
            variable = init.child(0).getValue();
            declared = false;
            start = init.child(1);
        } else {
            return Optional.empty();
        }

        SyntaxNode test = condition.unwrapParentheses();
        if (!test.is(SyntaxKind.BINARY_EXPRESSION) || !test.child(0).isIdentifier(variable)) {
            return Optional.empty();
        }
        String comparison = test.attribute(SyntaxAttributes.OPERATOR);
        if (!INCREASING.contains(comparison) && !DECREASING.contains(comparison)) {
            return Optional.empty();
        }

        SyntaxNode change = update.unwrapParentheses();
        String sign;
        SyntaxNode step = null;
        if (change.is(SyntaxKind.UPDATE_EXPRESSION) && change.child(0).isIdentifier(variable)) {
            sign = "++".equals(change.attribute(SyntaxAttributes.OPERATOR)) ? "+" : "-";
        } else if (change.is(SyntaxKind.ASSIGNMENT) && change.child(0).isIdentifier(variable)) {
            String operator = change.attribute(SyntaxAttributes.OPERATOR);
            SyntaxNode value = change.child(1).unwrapParentheses();
            if (operator.equals("+=") || operator.equals("-=")) {
                sign = operator.substring(0, 1);
                step = value;
            } else if (operator.equals("=") && value.is(SyntaxKind.BINARY_EXPRESSION)
                    && value.child(0).isIdentifier(variable)
                    && Set.of("+", "-").contains(value.attribute(SyntaxAttributes.OPERATOR))) {
                sign = value.attribute(SyntaxAttributes.OPERATOR);
                step = value.child(1);
            } else {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (step != null && step.isLiteral(SyntaxAttributes.LITERAL_INTEGER)) {
            long amount = Long.parseLong(ExpressionTranslator.integerLiteral(step.getValue()));
            if (amount == 0) {
                return Optional.empty();
            }
            if (amount == 1) {
                step = null;
            }
        } else if (step != null && !isStepExpression(step)) {
            return Optional.empty();
        }
        boolean increasing = sign.equals("+");
        if (increasing != INCREASING.contains(comparison)) {
            return Optional.empty();
        }
        return Optional.of(new CountingLoop(variable, declaredType, declared, start, comparison, test.child(1),
                sign, step));
    }

    private static boolean isStepExpression(SyntaxNode step) {
        return step.is(SyntaxKind.IDENTIFIER) || step.is(SyntaxKind.MEMBER_ACCESS);
    }

    /**
     * The collection whose size bounds the loop, for {@code i < a.length}, {@code i < s.length()}
     * and {@code i < list.size()}.
     */
    Optional<SyntaxNode> measuredCollection() {
        if (!comparison.equals("<")) {
            return Optional.empty();
        }
        SyntaxNode target = bound.unwrapParentheses();
        if (target.is(SyntaxKind.MEMBER_ACCESS) && "length".equals(target.getValue())) {
            return Optional.of(target.child(0));
        }
        if (target.is(SyntaxKind.CALL_EXPRESSION) && target.childCount() == 1
                && target.child(0).is(SyntaxKind.MEMBER_ACCESS)
                && Set.of("length", "size").contains(target.child(0).getValue())) {
            return Optional.of(target.child(0).child(0));
        }
        return Optional.empty();
    }

    /**
     * @return the STEP text, or null for a step of +1
     */
    String stepText(ExpressionTranslator expressions) {
        if (step == null) {
            return stepSign.equals("+") ? null : "-1";
        }
        String amount = expressions.render(step);
        return stepSign.equals("+") ? amount : "-" + IndexArithmetic.group(amount);
    }
}
