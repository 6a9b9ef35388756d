package com.examboard.pseudocode.converter;

import com.examboard.pseudocode.model.Language;

import lombok.Builder;
import lombok.Value;

/**
 * Figures reported alongside a conversion.
 */
@Value
@Builder
public class ConversionMetadata {
    Language language;
    /**
     * Statements, declarations and callables in the converted program.
     */
    int statementCount;
    long errorCount;
    long warningCount;
    long infoCount;
    long durationMillis;
}
