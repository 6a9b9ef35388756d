package com.examboard.pseudocode.converter.validation;

import java.util.List;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;

/**
 * Checks raw input before it reaches the parser. Errors reject the input; warnings are passed on
 * with the conversion result.
 */
public class InputValidator {
    public static final int MAX_INPUT_LENGTH = 1_000_000;

    private static final int SAMPLE_LENGTH = 1000;
    private static final double MAX_CONTROL_RATIO = 0.1;
    private static final int LONG_LINE = 500;

    public List<Diagnostic> validate(String source) {
        Diagnostics diagnostics = new Diagnostics();
        if (source == null) {
            diagnostics.error(DiagnosticCode.VALIDATION_ERROR, "Source code must not be null", null, null);
            return diagnostics.toList();
        }
        if (source.length() > MAX_INPUT_LENGTH) {
            diagnostics.error(DiagnosticCode.VALIDATION_ERROR, "Source code is " + source.length()
                    + " characters long; the limit is " + MAX_INPUT_LENGTH, null, null);
            return diagnostics.toList();
        }
        if (isBinary(source)) {
            diagnostics.error(DiagnosticCode.VALIDATION_ERROR, "Source code appears to contain binary content",
                    null, null);
            return diagnostics.toList();
        }
        if (source.indexOf('\uFFFD') >= 0) {
            diagnostics.warning(DiagnosticCode.VALIDATION_ERROR,
                    "Source code contains characters that could not be decoded", null, null,
                    "Save the file as UTF-8");
        }
        boolean crlf = source.contains("\r\n");
        if (crlf && source.replace("\r\n", "").indexOf('\n') >= 0) {
            diagnostics.warning(DiagnosticCode.VALIDATION_ERROR, "Source code mixes \\n and \\r\\n line endings",
                    null, null, "Normalize the line endings");
        }
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].length() > LONG_LINE) {
                diagnostics.warning(DiagnosticCode.VALIDATION_ERROR,
                        "Line is longer than " + LONG_LINE + " characters", i + 1, null);
            }
        }
        return diagnostics.toList();
    }

    /**
     * NUL anywhere, or too many control characters near the start.
     */
    private static boolean isBinary(String source) {
        if (source.indexOf('\0') >= 0) {
            return true;
        }
        int sample = Math.min(SAMPLE_LENGTH, source.length());
        if (sample == 0) {
            return false;
        }
        int control = 0;
        for (int i = 0; i < sample; i++) {
            char c = source.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t' && c != '\f') {
                control++;
            }
        }
        return (double) control / sample > MAX_CONTROL_RATIO;
    }
}
