package com.examboard.pseudocode.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IndentationTrackerTest {

    @Test
    void testOpenerAndCloser() {
        IndentationTracker tracker = new IndentationTracker(3);

        assertThat(tracker.place(LineRole.OPENER, "WHILE x DO")).isEqualTo("WHILE x DO");
        assertThat(tracker.place(LineRole.PLAIN, "x ← x - 1")).isEqualTo("   x ← x - 1");
        assertThat(tracker.place(LineRole.CLOSER, "ENDWHILE")).isEqualTo("ENDWHILE");
        assertThat(tracker.getLevel()).isZero();
    }

    @Test
    void testContinuationSitsOneLevelUp() {
        IndentationTracker tracker = new IndentationTracker(2);
        tracker.place(LineRole.OPENER, "IF a THEN");
        tracker.place(LineRole.OPENER, "IF b THEN");

        assertThat(tracker.place(LineRole.CONTINUATION, "ELSE")).isEqualTo("  ELSE");
        assertThat(tracker.getLevel()).isEqualTo(2);
    }

    @Test
    void testDedentAtZeroIsIgnored() {
        IndentationTracker tracker = new IndentationTracker(4);

        tracker.dedent();

        assertThat(tracker.getLevel()).isZero();
        assertThat(tracker.place(LineRole.CLOSER, "ENDIF")).isEqualTo("ENDIF");
    }

    @Test
    void testNonPositiveWidthDoesNotIndent() {
        IndentationTracker tracker = new IndentationTracker(-2);
        tracker.place(LineRole.OPENER, "WHILE TRUE DO");

        assertThat(tracker.place(LineRole.PLAIN, "OUTPUT x")).isEqualTo("OUTPUT x");
    }
}
