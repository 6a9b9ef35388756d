package com.examboard.pseudocode.generator;

import java.util.ArrayList;
import java.util.List;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;

/**
 * Final text pass: trailing whitespace, blank line runs, the closing newline and, in strict mode,
 * line length notes.
 */
public class PseudocodeFormatter {

    private final ConversionOptions options;
    private final Diagnostics diagnostics;

    public PseudocodeFormatter(ConversionOptions options, Diagnostics diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
    }

    public String format(List<String> lines) {
        List<String> kept = new ArrayList<>();
        boolean previousBlank = true;
        for (String raw : lines) {
            String line = raw.stripTrailing();
            boolean blank = line.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            kept.add(line);
            previousBlank = blank;
        }
        while (!kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
            kept.remove(kept.size() - 1);
        }
        if (kept.isEmpty()) {
            return "";
        }
        if (options.isStrict()) {
            checkLineLengths(kept);
        }
        return String.join("\n", kept) + "\n";
    }

    private void checkLineLengths(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            int length = lines.get(i).length();
            if (length > options.getMaxLineLength()) {
                diagnostics.info(DiagnosticCode.LINE_TOO_LONG, "Output line " + (i + 1) + " is " + length
                        + " characters long (limit " + options.getMaxLineLength() + ")", i + 1, null);
            }
        }
    }
}
