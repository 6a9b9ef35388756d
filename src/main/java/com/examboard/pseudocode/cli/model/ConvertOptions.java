package com.examboard.pseudocode.cli.model;

import java.nio.file.Path;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.model.Language;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds the options of the "convert" command. No validation, no execution logic, no printing.
 */
@Getter
public class ConvertOptions {

    @Parameters(index = "0", paramLabel = "<input>",
            description = "Source file to convert, or - to read standard input")
    private String input;

    @Option(names = { "--language", "-l" },
            description = "Source language: ${COMPLETION-CANDIDATES}. Inferred from the file extension when omitted")
    private Language language;

    @Option(names = { "--indent-width", "-w" }, defaultValue = "" + ConversionOptions.DEFAULT_INDENT_WIDTH,
            description = "Spaces per indentation level (default: ${DEFAULT-VALUE})")
    private int indentWidth;

    @Option(names = { "--no-comments" }, description = "Leave out explanatory // comments")
    private boolean noComments;

    @Option(names = { "--strict" }, description = "Also report undeclared identifiers and over-long lines")
    private boolean strict;

    @Option(names = { "--max-nesting-depth" }, defaultValue = "" + ConversionOptions.DEFAULT_MAX_NESTING_DEPTH,
            description = "Deepest block nesting the parser accepts (default: ${DEFAULT-VALUE})")
    private int maxNestingDepth;

    @Option(names = { "--output", "-o" }, description = "Write the pseudocode to this file instead of standard output")
    private Path output;

    @Option(names = { "--show-diagnostics", "-d" }, description = "Print diagnostics to standard error")
    private boolean showDiagnostics;
}
