package com.examboard.pseudocode.diagnostics;

/**
 * How serious a diagnostic is.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
