package com.examboard.pseudocode.cli.model;

import java.nio.file.Path;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.model.Language;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run a conversion. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Language language;
    /**
     * Null when reading standard input.
     */
    Path inputFile;
    Path outputFile;
    ConversionOptions conversionOptions;

    public boolean isReadingStdin() {
        return inputFile == null;
    }

    public String getSourceName() {
        return inputFile == null ? "<stdin>" : inputFile.toString();
    }
}
