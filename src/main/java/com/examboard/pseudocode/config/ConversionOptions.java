package com.examboard.pseudocode.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration shared by the parser, transformer and generator.
 */
@Value
@Builder(toBuilder = true)
public class ConversionOptions {
    public static final int DEFAULT_INDENT_WIDTH = 3;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_MAX_LINE_LENGTH = 80;

    @Builder.Default
    int indentWidth = DEFAULT_INDENT_WIDTH;

    @Builder.Default
    boolean includeAnnotationComments = true;

    @Builder.Default
    Strictness strictness = Strictness.PERMISSIVE;

    @Builder.Default
    int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

    @Builder.Default
    int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

    public static ConversionOptions defaults() {
        return ConversionOptions.builder().build();
    }

    public boolean isStrict() {
        return strictness == Strictness.STRICT;
    }
}
