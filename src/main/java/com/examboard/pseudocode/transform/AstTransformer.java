package com.examboard.pseudocode.transform;

import com.examboard.pseudocode.model.syntax.SyntaxNode;

/**
 * Turns a syntax tree into the pseudocode intermediate representation.
 * Implementations never throw for input-shaped problems; they report diagnostics instead.
 */
public interface AstTransformer {

    TransformResult transform(SyntaxNode program);
}
