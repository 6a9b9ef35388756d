package com.examboard.pseudocode.cli.output;

import java.io.PrintWriter;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.cli.model.ValidatedConvertOptions;
import com.examboard.pseudocode.converter.ConversionMetadata;
import com.examboard.pseudocode.converter.ConversionResult;
import com.examboard.pseudocode.diagnostics.Diagnostic;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * Pseudocode goes to standard output, diagnostics and option errors to standard error.
 */
public class ConversionResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultsPrinter.class);

    private final PrintWriter out;
    private final PrintWriter err;

    public ConversionResultsPrinter(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public void printBanner(ValidatedConvertOptions v) {
        log.info("Converting {} ({})", v.getSourceName(), v.getLanguage().getDisplayName());
        log.debug("Indent width: {}, comments: {}, strictness: {}",
                v.getConversionOptions().getIndentWidth(),
                v.getConversionOptions().isIncludeAnnotationComments(),
                v.getConversionOptions().getStrictness());
    }

    public void printPseudocode(ConversionResult result) {
        out.print(result.getPseudocode());
        out.flush();
    }

    public void printWritten(Path outputFile, ConversionResult result) {
        log.info("Wrote {} statements to {}", result.getMetadata().getStatementCount(), outputFile);
    }

    public void printDiagnostics(ConversionResult result) {
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            err.println(diagnostic.format());
        }
        ConversionMetadata m = result.getMetadata();
        err.println(m.getErrorCount() + " errors, " + m.getWarningCount() + " warnings, " + m.getInfoCount()
                + " notes (" + m.getDurationMillis() + " ms)");
        err.flush();
    }

    public void printSummary(ConversionResult result) {
        ConversionMetadata m = result.getMetadata();
        if (result.isSuccess()) {
            log.info("Conversion finished: {} statements, {} warnings", m.getStatementCount(), m.getWarningCount());
        } else {
            log.warn("Conversion finished with {} errors", m.getErrorCount());
        }
    }

    public void printOptionErrors(Iterable<String> errors) {
        err.println("Invalid options:");
        for (String error : errors) {
            err.println("  - " + error);
        }
        err.flush();
    }

    public void printFailure(String message) {
        err.println("Error: " + message);
        err.flush();
    }
}
