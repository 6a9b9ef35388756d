package com.examboard.pseudocode.scope;

public enum ScopeKind {
    GLOBAL,
    CLASS,
    FUNCTION,
    BLOCK
}
