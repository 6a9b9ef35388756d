package com.examboard.pseudocode.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.examboard.pseudocode.cli.exception.OptionsValidationException;
import com.examboard.pseudocode.cli.model.ConvertOptions;
import com.examboard.pseudocode.cli.model.ValidatedConvertOptions;
import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.config.Strictness;
import com.examboard.pseudocode.model.Language;

public class ConvertOptionsValidator {

    public static final String STDIN = "-";

    public ValidatedConvertOptions validate(ConvertOptions o) {
        List<String> errors = new ArrayList<>();

        Path inputFile = null;
        boolean stdin = STDIN.equals(o.getInput());
        if (isBlank(o.getInput())) {
            errors.add("An input file (or - for standard input) is required.");
        } else if (!stdin) {
            inputFile = Path.of(o.getInput()).toAbsolutePath().normalize();
            if (!Files.isRegularFile(inputFile)) {
                errors.add("Input file does not exist or is not a regular file: " + inputFile);
            }
        }

        Language language = o.getLanguage();
        if (language == null) {
            if (stdin) {
                errors.add("--language is required when reading standard input.");
            } else if (!isBlank(o.getInput())) {
                Optional<Language> inferred = Language.fromFileName(o.getInput());
                if (inferred.isEmpty()) {
                    errors.add("Cannot infer the language of " + o.getInput()
                            + "; use --language java or --language typescript.");
                } else {
                    language = inferred.get();
                }
            }
        }

        if (o.getIndentWidth() < 0) {
            errors.add("Indent width must be >= 0. Got: " + o.getIndentWidth());
        }
        if (o.getMaxNestingDepth() <= 0) {
            errors.add("Maximum nesting depth must be > 0. Got: " + o.getMaxNestingDepth());
        }

        Path outputFile = null;
        if (o.getOutput() != null) {
            outputFile = o.getOutput().toAbsolutePath().normalize();
            Path parent = outputFile.getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                errors.add("Output directory does not exist: " + parent);
            }
            if (Files.isDirectory(outputFile)) {
                errors.add("Output path is a directory: " + outputFile);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        ConversionOptions conversionOptions = ConversionOptions.builder()
                .indentWidth(o.getIndentWidth())
                .includeAnnotationComments(!o.isNoComments())
                .strictness(o.isStrict() ? Strictness.STRICT : Strictness.PERMISSIVE)
                .maxNestingDepth(o.getMaxNestingDepth())
                .build();
        return new ValidatedConvertOptions(language, inputFile, outputFile, conversionOptions);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
