package com.examboard.pseudocode.parser;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.Language;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DelimiterCheckerTest {

    @Test
    void testBalancedSourceHasNoErrors() {
        Diagnostics diagnostics = new Diagnostics();

        int errors = check("if (a[0] > 1) { f(a); }", diagnostics);

        assertThat(errors).isZero();
        assertThat(diagnostics.toList()).isEmpty();
    }

    @Test
    void testUnclosedBraceReportsItsLine() {
        Diagnostics diagnostics = new Diagnostics();

        int errors = check("""
            while (x < 3) {
                x++;
            """, diagnostics);

        assertThat(errors).isEqualTo(1);
        Diagnostic diagnostic = diagnostics.toList().get(0);
        assertThat(diagnostic.getCode()).isEqualTo(DiagnosticCode.STRUCTURAL_ERROR);
        assertThat(diagnostic.getMessage()).isEqualTo("Unclosed '{' opened on line 1");
        assertThat(diagnostic.getLine()).isEqualTo(1);
    }

    @Test
    void testStrayCloser() {
        Diagnostics diagnostics = new Diagnostics();

        int errors = check("x = 1; }", diagnostics);

        assertThat(errors).isEqualTo(1);
        assertThat(diagnostics.toList().get(0).getMessage()).startsWith("Unmatched '}'");
    }

    @Test
    void testMismatchedCloserNamesBothSides() {
        Diagnostics diagnostics = new Diagnostics();

        int errors = check("f(a];", diagnostics);

        assertThat(errors).isGreaterThanOrEqualTo(1);
        assertThat(diagnostics.toList().get(0).getMessage())
                .contains("Mismatched ']'")
                .contains("expected ')'");
    }

    private static int check(String source, Diagnostics diagnostics) {
        Diagnostics scratch = new Diagnostics();
        return new DelimiterChecker(diagnostics)
                .check(new SourceTokenizer(source, Language.JAVA, scratch).tokenize());
    }
}
