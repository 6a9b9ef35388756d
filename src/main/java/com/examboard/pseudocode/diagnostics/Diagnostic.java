package com.examboard.pseudocode.diagnostics;

import lombok.Builder;
import lombok.Value;

/**
 * A single message produced while parsing, transforming or generating.
 * Line and column are 1-based and absent for whole-program notes.
 */
@Value
@Builder(toBuilder = true)
public class Diagnostic {
    String message;
    Integer line;
    Integer column;
    DiagnosticCode code;
    Severity severity;
    String suggestion;

    public boolean hasPosition() {
        return line != null;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Renders the diagnostic as a single human readable line.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(" [").append(code).append("]");
        if (line != null) {
            sb.append(" line ").append(line);
            if (column != null) {
                sb.append(", column ").append(column);
            }
        }
        sb.append(": ").append(message);
        if (suggestion != null && !suggestion.isBlank()) {
            sb.append(" (suggestion: ").append(suggestion).append(")");
        }
        return sb.toString();
    }
}
