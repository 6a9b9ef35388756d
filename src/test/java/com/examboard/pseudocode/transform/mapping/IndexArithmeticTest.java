package com.examboard.pseudocode.transform.mapping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IndexArithmeticTest {

    @Test
    void testShiftFoldsLiterals() {
        assertThat(IndexArithmetic.plusOne("0")).isEqualTo("1");
        assertThat(IndexArithmetic.minusOne("5")).isEqualTo("4");
        assertThat(IndexArithmetic.plusOne("-1")).isEqualTo("0");
    }

    @Test
    void testShiftFoldsTrailingTerm() {
        assertThat(IndexArithmetic.plusOne("n - 1")).isEqualTo("n");
        assertThat(IndexArithmetic.plusOne("k + 1")).isEqualTo("k + 2");
        assertThat(IndexArithmetic.minusOne("k + 1")).isEqualTo("k");
        assertThat(IndexArithmetic.minusOne("LENGTH(s)")).isEqualTo("LENGTH(s) - 1");
    }

    @Test
    void testShiftLeavesParenthesizedTermsAlone() {
        assertThat(IndexArithmetic.plusOne("(a - 1) * 2")).isEqualTo("(a - 1) * 2 + 1");
    }

    @Test
    void testDifference() {
        assertThat(IndexArithmetic.difference("3", "1")).isEqualTo("2");
        assertThat(IndexArithmetic.difference("LENGTH(s)", "2")).isEqualTo("LENGTH(s) - 2");
        assertThat(IndexArithmetic.difference("end", "start")).isEqualTo("end - start");
        assertThat(IndexArithmetic.difference("a", "b + 1")).isEqualTo("a - (b + 1)");
    }

    @Test
    void testGroupOnlyWrapsTopLevelOperators() {
        assertThat(IndexArithmetic.group("a + b")).isEqualTo("(a + b)");
        assertThat(IndexArithmetic.group("f(a + b)")).isEqualTo("f(a + b)");
        assertThat(IndexArithmetic.group("\"a + b\"")).isEqualTo("\"a + b\"");
        assertThat(IndexArithmetic.group("x MOD 2")).isEqualTo("(x MOD 2)");
        assertThat(IndexArithmetic.group("NOT done")).isEqualTo("(NOT done)");
    }

    @Test
    void testIsInteger() {
        assertThat(IndexArithmetic.isInteger("42")).isTrue();
        assertThat(IndexArithmetic.isInteger("-7")).isTrue();
        assertThat(IndexArithmetic.isInteger("-")).isFalse();
        assertThat(IndexArithmetic.isInteger("1.5")).isFalse();
        assertThat(IndexArithmetic.isInteger("")).isFalse();
        assertThat(IndexArithmetic.isInteger(null)).isFalse();
    }
}
