package com.examboard.pseudocode.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.scope.ScopeManager;
import com.examboard.pseudocode.transform.types.TypeNormalizer;

import lombok.Getter;

/**
 * Mutable state of a single transformation: scopes, diagnostics and the per-statement
 * collection of annotations and undeclared names.
 */
@Getter
public class TransformContext {
    private final Diagnostics diagnostics;
    private final ConversionOptions options;
    private final ScopeManager scopes;
    private final TypeNormalizer types;
    private final Set<String> typeNames;
    private final Set<String> builtInNames;
    private final Set<String> enumNames = new HashSet<>();
    private final Set<String> inputReaders = new HashSet<>();
    private final Set<String> reportedUndeclared = new HashSet<>();
    private final Deque<PendingStatement> pending = new ArrayDeque<>();

    public TransformContext(Diagnostics diagnostics, ConversionOptions options, ScopeManager scopes,
            TypeNormalizer types, Set<String> typeNames, Set<String> builtInNames) {
        this.diagnostics = diagnostics;
        this.options = options;
        this.scopes = scopes;
        this.types = types;
        this.typeNames = typeNames;
        this.builtInNames = builtInNames;
    }

    public void beginStatement() {
        pending.push(new PendingStatement());
    }

    /**
     * Closes the current statement, attaching its annotations and undeclared names to the first node.
     */
    public List<IrNode> finishStatement(List<IrNode> nodes) {
        PendingStatement statement = pending.pop();
        if (nodes.isEmpty()) {
            if (!statement.getAnnotations().isEmpty()) {
                return List.of(IrNode.comment(statement.getAnnotations()));
            }
            return nodes;
        }
        if (statement.getAnnotations().isEmpty() && statement.getUndeclared().isEmpty()) {
            return nodes;
        }
        IrNode first = nodes.get(0);
        IrNode.IrNodeBuilder builder = first.toBuilder()
                .clearAnnotations()
                .annotations(statement.getAnnotations())
                .annotations(first.getAnnotations());
        if (!statement.getUndeclared().isEmpty()) {
            builder.meta(IrMetadata.UNDECLARED, String.join(",", statement.getUndeclared()));
        }
        List<IrNode> result = new ArrayList<>(nodes);
        result.set(0, builder.build());
        return result;
    }

    /**
     * Drops the current statement's collected state, used when its conversion failed.
     */
    public void abandonStatement() {
        if (!pending.isEmpty()) {
            pending.pop();
        }
    }

    public void annotate(String annotation) {
        if (!pending.isEmpty()) {
            pending.peek().annotate(annotation);
        }
    }

    public void reportUndeclared(String name, int line) {
        if (!pending.isEmpty()) {
            pending.peek().getUndeclared().add(name);
        }
        if (options.isStrict() && reportedUndeclared.add(name)) {
            diagnostics.warning(DiagnosticCode.UNDECLARED_IDENTIFIER,
                    "Identifier '" + name + "' is used but never declared", line, null,
                    "Add a DECLARE statement for " + name);
        }
    }

    public boolean isKnownName(String name) {
        return scopes.lookupVariable(name).isPresent() || scopes.lookupCallable(name).isPresent()
                || typeNames.contains(name) || enumNames.contains(name) || builtInNames.contains(name)
                || inputReaders.contains(name);
    }

    public int pendingDepth() {
        return pending.size();
    }

    /**
     * Restores the pending stack after a failed statement left entries behind.
     */
    public void truncatePending(int depth) {
        while (pending.size() > depth) {
            pending.pop();
        }
    }
}
