package com.examboard.pseudocode.config;

/**
 * Controls how many advisory diagnostics are produced.
 * STRICT additionally reports undeclared identifiers and over-long lines.
 */
public enum Strictness {
    PERMISSIVE,
    STRICT
}
