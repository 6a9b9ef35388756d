package com.examboard.pseudocode.model.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable node of the language-neutral syntax tree built by the parsers.
 */
@Value
@Builder(toBuilder = true)
public class SyntaxNode {
    SyntaxKind kind;
    String value;
    @Singular
    List<SyntaxNode> children;
    int line;
    int column;
    @Singular
    Map<String, String> attributes;

    public static SyntaxNode empty(int line, int column) {
        return SyntaxNode.builder().kind(SyntaxKind.EMPTY).line(line).column(column).build();
    }

    public boolean is(SyntaxKind expected) {
        return kind == expected;
    }

    public boolean isEmpty() {
        return kind == SyntaxKind.EMPTY;
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public Optional<SyntaxNode> findChild(SyntaxKind childKind) {
        return children.stream().filter(c -> c.getKind() == childKind).findFirst();
    }

    public List<SyntaxNode> childrenOf(SyntaxKind childKind) {
        return children.stream().filter(c -> c.getKind() == childKind).toList();
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public boolean flag(String key) {
        return "true".equals(attributes.get(key));
    }

    public boolean hasModifier(String modifier) {
        String modifiers = attributes.get(SyntaxAttributes.MODIFIERS);
        return modifiers != null && Arrays.asList(modifiers.split(" ")).contains(modifier);
    }

    /**
     * Strips any number of enclosing parentheses.
     */
    public SyntaxNode unwrapParentheses() {
        SyntaxNode current = this;
        while (current.kind == SyntaxKind.PARENTHESIZED && current.childCount() == 1) {
            current = current.child(0);
        }
        return current;
    }

    public boolean isLiteral(String literalType) {
        return kind == SyntaxKind.LITERAL && literalType.equals(attributes.get(SyntaxAttributes.LITERAL_TYPE));
    }

    public boolean isIdentifier(String name) {
        return kind == SyntaxKind.IDENTIFIER && name.equals(value);
    }
}
