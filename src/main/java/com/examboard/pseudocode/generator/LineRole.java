package com.examboard.pseudocode.generator;

/**
 * How an emitted line moves the indentation level.
 */
public enum LineRole {
    /** Emitted at the current level; the following lines are one level deeper. */
    OPENER,
    /** Ends a block: the level drops first, then the line is emitted. */
    CLOSER,
    /** Separates sections of a block (ELSE, case labels) one level shallower than the body. */
    CONTINUATION,
    PLAIN
}
