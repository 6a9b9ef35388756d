package com.examboard.pseudocode.diagnostics;

/**
 * Closed taxonomy of diagnostic codes reported by the conversion pipeline.
 */
public enum DiagnosticCode {
    STRUCTURAL_ERROR,
    UNSUPPORTED_FEATURE,
    TYPE_CONVERSION_FALLBACK,
    VALIDATION_ERROR,
    ARRAY_INDEX_CONVERSION,
    LOOP_BOUND_CONVERSION,
    METHOD_MAPPING,
    NO_DIRECT_EQUIVALENT,
    CONSTRUCT_SIMPLIFIED,
    UNDECLARED_IDENTIFIER,
    SWITCH_FALL_THROUGH,
    MANUAL_REVIEW,
    SCOPE_ERROR,
    NESTING_TOO_DEEP,
    EMPTY_PROGRAM,
    TRANSFORMATION_ERROR,
    LINE_TOO_LONG,
    INVALID_CONFIGURATION
}
