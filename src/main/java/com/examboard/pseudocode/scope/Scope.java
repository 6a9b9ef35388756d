package com.examboard.pseudocode.scope;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * One record of the scope arena. The parent is addressed by its index; -1 marks the global scope.
 */
@Getter
public class Scope {
    private final ScopeKind kind;
    private final int parentIndex;
    private final Map<String, VariableInfo> variables = new LinkedHashMap<>();
    private final Map<String, CallableInfo> callables = new LinkedHashMap<>();

    public Scope(ScopeKind kind, int parentIndex) {
        this.kind = kind;
        this.parentIndex = parentIndex;
    }
}
