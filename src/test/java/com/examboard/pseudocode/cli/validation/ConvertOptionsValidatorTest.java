package com.examboard.pseudocode.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.examboard.pseudocode.cli.exception.OptionsValidationException;
import com.examboard.pseudocode.cli.model.ConvertOptions;
import com.examboard.pseudocode.cli.model.ValidatedConvertOptions;
import com.examboard.pseudocode.config.Strictness;
import com.examboard.pseudocode.model.Language;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class ConvertOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

    @Test
    void testLanguageIsInferredFromExtension() throws IOException {
        Path source = Files.writeString(tempDir.resolve("app.tsx"), "let x = 1;");

        ValidatedConvertOptions validated = validator.validate(options(source.toString()));

        assertThat(validated.getLanguage()).isEqualTo(Language.TYPESCRIPT);
        assertThat(validated.getInputFile()).isEqualTo(source.toAbsolutePath().normalize());
        assertThat(validated.isReadingStdin()).isFalse();
        assertThat(validated.getOutputFile()).isNull();
    }

    @Test
    void testDefaultsBecomeConversionOptions() throws IOException {
        Path source = Files.writeString(tempDir.resolve("Main.java"), "int x = 1;");

        ValidatedConvertOptions validated = validator.validate(options(source.toString()));

        assertThat(validated.getConversionOptions().getIndentWidth()).isEqualTo(3);
        assertThat(validated.getConversionOptions().isIncludeAnnotationComments()).isTrue();
        assertThat(validated.getConversionOptions().getStrictness()).isEqualTo(Strictness.PERMISSIVE);
        assertThat(validated.getConversionOptions().getMaxNestingDepth()).isEqualTo(256);
    }

    @Test
    void testFlagsAreApplied() {
        ValidatedConvertOptions validated = validator.validate(options(
                "-", "--language", "JAVA", "--no-comments", "--strict", "-w", "4", "--max-nesting-depth", "20"));

        assertThat(validated.isReadingStdin()).isTrue();
        assertThat(validated.getSourceName()).isEqualTo("<stdin>");
        assertThat(validated.getConversionOptions().isIncludeAnnotationComments()).isFalse();
        assertThat(validated.getConversionOptions().isStrict()).isTrue();
        assertThat(validated.getConversionOptions().getIndentWidth()).isEqualTo(4);
        assertThat(validated.getConversionOptions().getMaxNestingDepth()).isEqualTo(20);
    }

    @Test
    void testAllProblemsAreCollected() {
        ConvertOptions options = options("-", "--indent-width", "-2", "--max-nesting-depth", "0");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).containsExactly(
                        "--language is required when reading standard input.",
                        "Indent width must be >= 0. Got: -2",
                        "Maximum nesting depth must be > 0. Got: 0"));
    }

    @Test
    void testUnknownExtension() throws IOException {
        Path source = Files.writeString(tempDir.resolve("script.py"), "print(1)");

        assertThatThrownBy(() -> validator.validate(options(source.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Cannot infer the language of");
    }

    @Test
    void testOutputLocationIsChecked() throws IOException {
        Path source = Files.writeString(tempDir.resolve("A.java"), "int a;");
        Path missingDirectory = tempDir.resolve("nowhere").resolve("out.txt");

        assertThatThrownBy(() -> validator.validate(options(source.toString(), "-o", missingDirectory.toString())))
                .hasMessageContaining("Output directory does not exist:");
        assertThatThrownBy(() -> validator.validate(options(source.toString(), "-o", tempDir.toString())))
                .hasMessageContaining("Output path is a directory:");
    }

    private static ConvertOptions options(String... args) {
        return CommandLine.populateSpec(ConvertOptions.class, args);
    }
}
