package com.examboard.pseudocode.model.ir;

/**
 * Closed set of intermediate representation node kinds. Each kind belongs to exactly one category.
 */
public enum IrKind {
    PROGRAM(IrCategory.PROGRAM),

    CLASS_BLOCK(IrCategory.DECLARATION),
    INTERFACE_SUMMARY(IrCategory.DECLARATION),
    VARIABLE_DECLARATION(IrCategory.DECLARATION),
    CONSTANT_DECLARATION(IrCategory.DECLARATION),

    PROCEDURE(IrCategory.FUNCTION_LIKE),
    FUNCTION(IrCategory.FUNCTION_LIKE),

    IF(IrCategory.CONTROL_STRUCTURE),
    WHILE(IrCategory.CONTROL_STRUCTURE),
    REPEAT_UNTIL(IrCategory.CONTROL_STRUCTURE),
    FOR(IrCategory.CONTROL_STRUCTURE),
    CASE(IrCategory.CONTROL_STRUCTURE),
    CASE_BRANCH(IrCategory.CONTROL_STRUCTURE),
    OTHERWISE_BRANCH(IrCategory.CONTROL_STRUCTURE),

    BLOCK(IrCategory.STATEMENT),
    ASSIGNMENT(IrCategory.STATEMENT),
    OUTPUT(IrCategory.STATEMENT),
    INPUT(IrCategory.STATEMENT),
    PROCEDURE_CALL(IrCategory.STATEMENT),
    RETURN(IrCategory.STATEMENT),
    COMMENT(IrCategory.STATEMENT),
    ERROR_RECOVERY(IrCategory.STATEMENT),

    EXPRESSION(IrCategory.EXPRESSION);

    private final IrCategory category;

    IrKind(IrCategory category) {
        this.category = category;
    }

    public IrCategory getCategory() {
        return category;
    }
}
