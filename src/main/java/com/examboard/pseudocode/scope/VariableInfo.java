package com.examboard.pseudocode.scope;

import java.util.List;

import com.examboard.pseudocode.transform.types.PseudoType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What the converter knows about a declared variable.
 */
@Value
@Builder(toBuilder = true)
public class VariableInfo {
    String name;
    PseudoType type;
    @Singular
    List<String> arrayDimensions;
    boolean constant;
    String initialValue;
    /**
     * Set for loop variables whose range was rewritten to start at 1.
     */
    boolean indexShifted;

    public boolean isArray() {
        return type != null && type.isArray();
    }
}
