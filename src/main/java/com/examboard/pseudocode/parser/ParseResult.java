package com.examboard.pseudocode.parser;

import java.util.List;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.Severity;
import com.examboard.pseudocode.model.syntax.SyntaxNode;

import lombok.Value;

/**
 * Syntax tree plus the diagnostics produced while building it.
 */
@Value
public class ParseResult {
    SyntaxNode tree;
    List<Diagnostic> diagnostics;

    public boolean hasStructuralErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }
}
