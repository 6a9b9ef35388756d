package com.examboard.pseudocode.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single indentation level counter used while generating. Lines are indented as they are
 * placed; no earlier stage applies indentation.
 */
public class IndentationTracker {
    private static final Logger log = LoggerFactory.getLogger(IndentationTracker.class);

    private final String unit;
    private int level;

    public IndentationTracker(int indentWidth) {
        this.unit = " ".repeat(Math.max(0, indentWidth));
    }

    /**
     * Indents the text for its role and applies the role's level change.
     */
    public String place(LineRole role, String text) {
        return switch (role) {
            case OPENER -> {
                String line = indent(level, text);
                level++;
                yield line;
            }
            case CLOSER -> {
                dedent();
                yield indent(level, text);
            }
            case CONTINUATION -> indent(Math.max(0, level - 1), text);
            case PLAIN -> indent(level, text);
        };
    }

    public void dedent() {
        if (level == 0) {
            log.warn("Unbalanced block closer at indentation level 0");
            return;
        }
        level--;
    }

    public int getLevel() {
        return level;
    }

    private String indent(int depth, String text) {
        return unit.repeat(depth) + text;
    }
}
