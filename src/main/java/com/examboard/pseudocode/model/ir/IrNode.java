package com.examboard.pseudocode.model.ir;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable node of the pseudocode intermediate representation.
 * Metadata holds already rendered text, so generation needs no further lookups.
 */
@Value
@Builder(toBuilder = true)
public class IrNode {
    IrKind kind;
    @Singular
    List<IrNode> children;
    @Singular("meta")
    Map<String, String> metadata;
    @Singular
    List<String> annotations;

    public IrCategory getCategory() {
        return kind.getCategory();
    }

    public String meta(String key) {
        return metadata.get(key);
    }

    public Optional<String> optionalMeta(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public boolean flag(String key) {
        return "true".equals(metadata.get(key));
    }

    public IrNode child(int index) {
        return children.get(index);
    }

    public static IrNode block(List<IrNode> statements) {
        return IrNode.builder().kind(IrKind.BLOCK).children(statements).build();
    }

    public static IrNode comment(List<String> annotations) {
        return IrNode.builder().kind(IrKind.COMMENT).annotations(annotations).build();
    }

    public static IrNode text(IrKind kind, String text) {
        return IrNode.builder().kind(kind).meta(IrMetadata.TEXT, text).build();
    }
}
