package com.examboard.pseudocode.transform;

import java.util.List;

import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.model.ir.IrNode;

import lombok.Value;

@Value
public class TransformResult {
    IrNode program;
    List<Diagnostic> diagnostics;
}
