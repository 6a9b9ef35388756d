package com.examboard.pseudocode.scope;

import java.util.List;
import java.util.Optional;

import com.examboard.pseudocode.transform.types.PseudoType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A declared procedure or function. An absent return type means procedure.
 */
@Value
@Builder
public class CallableInfo {
    String name;
    @Singular
    List<ParameterInfo> parameters;
    PseudoType returnType;

    public Optional<PseudoType> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    public boolean isFunction() {
        return returnType != null;
    }
}
