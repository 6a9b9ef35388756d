package com.examboard.pseudocode.model.ir;

import lombok.experimental.UtilityClass;

/**
 * Metadata keys carried by {@link IrNode}s. Values are fully rendered pseudocode text.
 */
@UtilityClass
public class IrMetadata {
    public static final String TEXT = "text";
    public static final String NAME = "name";
    public static final String PARAMETERS = "parameters";
    public static final String RETURN_TYPE = "returnType";
    public static final String DATA_TYPE = "dataType";
    public static final String VALUE = "value";
    public static final String CONDITION = "condition";
    public static final String VARIABLE = "variable";
    public static final String START = "start";
    public static final String END = "end";
    public static final String STEP = "step";
    public static final String TARGET = "target";
    public static final String EXPRESSION = "expression";
    public static final String LABEL = "label";
    public static final String FALLS_THROUGH = "fallsThrough";
    public static final String UNDECLARED = "undeclared";
    public static final String MESSAGE = "message";
    public static final String SOURCE_LINE = "sourceLine";
}
