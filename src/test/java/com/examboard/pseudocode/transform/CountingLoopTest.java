package com.examboard.pseudocode.transform;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.parser.JavaSourceParser;

import static org.assertj.core.api.Assertions.*;

class CountingLoopTest {

    @Test
    void testMatchIncrementingLoop() {
        CountingLoop loop = match("for (int i = 0; i < 10; i++) { }").get();

        assertThat(loop.getVariable()).isEqualTo("i");
        assertThat(loop.isDeclared()).isTrue();
        assertThat(loop.getDeclaredType()).isEqualTo("int");
        assertThat(loop.getStart().getValue()).isEqualTo("0");
        assertThat(loop.getComparison()).isEqualTo("<");
        assertThat(loop.getStepSign()).isEqualTo("+");
        assertThat(loop.getStep()).isNull();
    }

    @Test
    void testMatchAssignedVariable() {
        CountingLoop loop = match("for (k = 1; k <= n; k++) { }").get();

        assertThat(loop.isDeclared()).isFalse();
        assertThat(loop.getBound().getValue()).isEqualTo("n");
    }

    @Test
    void testStepOfOneIsDropped() {
        assertThat(match("for (int i = 0; i < 10; i += 1) { }").get().getStep()).isNull();
        assertThat(match("for (int i = 0; i < 10; i += 2) { }").get().getStep().getValue()).isEqualTo("2");
    }

    @Test
    void testDecreasingLoop() {
        CountingLoop loop = match("for (int i = 10; i >= 0; i = i - 1) { }").get();

        assertThat(loop.getStepSign()).isEqualTo("-");
        assertThat(loop.getComparison()).isEqualTo(">=");
    }

    @Test
    void testMeasuredCollection() {
        assertThat(match("for (int i = 0; i < nums.length; i++) { }").get().measuredCollection())
                .map(SyntaxNode::getValue).contains("nums");
        assertThat(match("for (int i = 0; i < list.size(); i++) { }").get().measuredCollection())
                .map(SyntaxNode::getValue).contains("list");
        assertThat(match("for (int i = 0; i <= nums.length; i++) { }").get().measuredCollection()).isEmpty();
    }

    @Test
    void testShapesThatAreNotCountingLoops() {
        assertThat(match("for (int i = 0; i < 10; i--) { }")).isEmpty();
        assertThat(match("for (int i = 0; i < 10; i += 0) { }")).isEmpty();
        assertThat(match("for (int i = 1; i < 100; i *= 2) { }")).isEmpty();
        assertThat(match("for (int i = 0; j < 10; i++) { }")).isEmpty();
        assertThat(match("for (int i = 0; i != 10; i++) { }")).isEmpty();
    }

    private static Optional<CountingLoop> match(String source) {
        SyntaxNode loop = new JavaSourceParser().parse(source).getTree().child(0);
        return CountingLoop.match(loop.child(0), loop.child(1), loop.child(2));
    }
}
