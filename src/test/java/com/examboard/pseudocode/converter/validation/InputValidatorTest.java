package com.examboard.pseudocode.converter.validation;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.Severity;

import static org.assertj.core.api.Assertions.*;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    void testPlainSourceIsAccepted() {
        assertThat(validator.validate("int x = 1;\nx++;\n")).isEmpty();
        assertThat(validator.validate("")).isEmpty();
    }

    @Test
    void testNullIsRejected() {
        List<Diagnostic> diagnostics = validator.validate(null);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).isError()).isTrue();
        assertThat(diagnostics.get(0).getMessage()).isEqualTo("Source code must not be null");
    }

    @Test
    void testOversizedInputIsRejected() {
        String huge = "x".repeat(InputValidator.MAX_INPUT_LENGTH + 1);

        List<Diagnostic> diagnostics = validator.validate(huge);

        assertThat(diagnostics.get(0).isError()).isTrue();
        assertThat(diagnostics.get(0).getMessage()).contains("the limit is 1000000");
    }

    @Test
    void testBinaryContentIsRejected() {
        assertThat(validator.validate("abc\0def").get(0).getMessage())
                .isEqualTo("Source code appears to contain binary content");
        assertThat(validator.validate("\u0001\u0002\u0003\u0004 x").get(0).isError()).isTrue();
    }

    @Test
    void testWarningsDoNotReject() {
        String source = "int a = 1;\r\nint b = 2;\nString s = \"\uFFFD\";\n" + "// " + "y".repeat(600);

        List<Diagnostic> diagnostics = validator.validate(source);

        assertThat(diagnostics).hasSize(3);
        assertThat(diagnostics).allMatch(d -> d.getSeverity() == Severity.WARNING);
        assertThat(diagnostics).extracting(Diagnostic::getLine).contains(4);
    }
}
