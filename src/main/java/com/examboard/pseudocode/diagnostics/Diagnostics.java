package com.examboard.pseudocode.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics accumulated during one conversion stage.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class Diagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public void add(Diagnostic diagnostic) {
        entries.add(diagnostic);
    }

    public void addAll(Collection<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
    }

    public void error(DiagnosticCode code, String message, Integer line, Integer column) {
        add(code, Severity.ERROR, message, line, column, null);
    }

    public void warning(DiagnosticCode code, String message, Integer line, Integer column) {
        add(code, Severity.WARNING, message, line, column, null);
    }

    public void warning(DiagnosticCode code, String message, Integer line, Integer column, String suggestion) {
        add(code, Severity.WARNING, message, line, column, suggestion);
    }

    public void info(DiagnosticCode code, String message, Integer line, Integer column) {
        add(code, Severity.INFO, message, line, column, null);
    }

    public void add(DiagnosticCode code, Severity severity, String message, Integer line, Integer column,
            String suggestion) {
        entries.add(Diagnostic.builder()
                .code(code)
                .severity(severity)
                .message(message)
                .line(line)
                .column(column)
                .suggestion(suggestion)
                .build());
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(Diagnostic::isError);
    }

    public boolean hasCode(DiagnosticCode code) {
        return entries.stream().anyMatch(d -> d.getCode() == code);
    }

    public long count(Severity severity) {
        return entries.stream().filter(d -> d.getSeverity() == severity).count();
    }

    public long count(DiagnosticCode code) {
        return entries.stream().filter(d -> d.getCode() == code).count();
    }

    public List<Diagnostic> toList() {
        return List.copyOf(entries);
    }
}
