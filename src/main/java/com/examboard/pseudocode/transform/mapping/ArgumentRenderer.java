package com.examboard.pseudocode.transform.mapping;

import com.examboard.pseudocode.model.syntax.SyntaxNode;

/**
 * Renders call arguments for {@link StringMethodMapper}.
 */
public interface ArgumentRenderer {

    String value(SyntaxNode argument);

    /**
     * Renders a 0-based position argument as a 1-based position.
     */
    String oneBased(SyntaxNode argument);
}
