package com.examboard.pseudocode.transform;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Value;

/**
 * Annotations and undeclared names collected while one statement is being converted.
 */
@Value
class PendingStatement {
    Set<String> undeclared = new LinkedHashSet<>();
    List<String> annotations = new ArrayList<>();

    void annotate(String annotation) {
        if (!annotations.contains(annotation)) {
            annotations.add(annotation);
        }
    }
}
