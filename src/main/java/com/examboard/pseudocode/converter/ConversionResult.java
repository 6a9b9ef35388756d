package com.examboard.pseudocode.converter;

import java.util.List;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of converting one source text. The pseudocode is always present, possibly empty.
 */
@Value
@Builder
public class ConversionResult {
    String pseudocode;
    @Singular
    List<Diagnostic> diagnostics;
    boolean success;
    ConversionMetadata metadata;

    public boolean hasCode(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.getCode() == code);
    }
}
