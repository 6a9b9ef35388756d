package com.examboard.pseudocode.scope;

import com.examboard.pseudocode.transform.types.PseudoType;

import lombok.Value;

@Value
public class ParameterInfo {
    String name;
    PseudoType type;
    boolean optional;

    public boolean isArray() {
        return type != null && type.isArray();
    }
}
