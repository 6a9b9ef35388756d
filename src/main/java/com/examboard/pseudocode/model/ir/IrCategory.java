package com.examboard.pseudocode.model.ir;

public enum IrCategory {
    PROGRAM,
    STATEMENT,
    EXPRESSION,
    DECLARATION,
    CONTROL_STRUCTURE,
    FUNCTION_LIKE
}
