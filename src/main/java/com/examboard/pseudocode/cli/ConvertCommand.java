package com.examboard.pseudocode.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.cli.exception.OptionsValidationException;
import com.examboard.pseudocode.cli.model.ConvertOptions;
import com.examboard.pseudocode.cli.model.ValidatedConvertOptions;
import com.examboard.pseudocode.cli.output.ConversionResultsPrinter;
import com.examboard.pseudocode.cli.validation.ConvertOptionsValidator;
import com.examboard.pseudocode.converter.ConversionResult;
import com.examboard.pseudocode.converter.PseudocodeConverter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command converting one Java or TypeScript file into pseudocode.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        version = "pseudocode-converter 1.0.0",
        description = "Converts a Java or TypeScript source file into exam-board pseudocode."
)
public class ConvertCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONVERSION_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;

    public ConvertCommand() {
        this(System.in);
    }

    public ConvertCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ConversionResultsPrinter printer = new ConversionResultsPrinter(out, err);

        ValidatedConvertOptions validated;
        try {
            validated = new ConvertOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            log.debug("Option validation failed: {}", e.getMessage());
            printer.printOptionErrors(e.getErrors());
            return EXIT_USAGE;
        }
        printer.printBanner(validated);

        try {
            String source = readSource(validated);
            ConversionResult result = new PseudocodeConverter()
                    .convertCode(source, validated.getLanguage(), validated.getConversionOptions());

            if (validated.getOutputFile() != null) {
                Files.writeString(validated.getOutputFile(), result.getPseudocode(), StandardCharsets.UTF_8);
                printer.printWritten(validated.getOutputFile(), result);
            } else {
                printer.printPseudocode(result);
            }
            if (options.isShowDiagnostics() || !result.isSuccess()) {
                printer.printDiagnostics(result);
            }
            printer.printSummary(result);
            return result.isSuccess() ? EXIT_OK : EXIT_CONVERSION_FAILED;
        } catch (IOException e) {
            log.error("I/O failure while converting {}", validated.getSourceName(), e);
            printer.printFailure(e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * Undecodable bytes become U+FFFD so that input validation can report them.
     */
    private String readSource(ValidatedConvertOptions validated) throws IOException {
        byte[] bytes = validated.isReadingStdin()
                ? stdin.readAllBytes()
                : Files.readAllBytes(validated.getInputFile());
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
