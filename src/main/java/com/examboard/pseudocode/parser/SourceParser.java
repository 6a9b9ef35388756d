package com.examboard.pseudocode.parser;

import com.examboard.pseudocode.model.Language;

/**
 * Builds a syntax tree from raw source text. Implementations always return a tree,
 * reporting problems as diagnostics instead of throwing.
 */
public interface SourceParser {

    ParseResult parse(String sourceText);

    Language getLanguage();
}
