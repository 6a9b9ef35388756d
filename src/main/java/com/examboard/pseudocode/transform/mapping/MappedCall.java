package com.examboard.pseudocode.transform.mapping;

import com.examboard.pseudocode.transform.types.PseudoType;

import lombok.Value;

/**
 * A call rewritten into pseudocode, with the type of its result when known.
 */
@Value
public class MappedCall {
    String text;
    PseudoType type;
}
