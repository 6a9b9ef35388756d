package com.examboard.pseudocode.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.transform.types.PseudoType;

/**
 * Lexical scopes kept in an arena addressed by index. Scopes are entered and left in
 * stack order, so the current scope is always the last entry and is dropped when left;
 * lookups walk from the current scope outward through parent indices.
 *
 * One instance serves a single conversion.
 */
public class ScopeManager {
    private static final Logger log = LoggerFactory.getLogger(ScopeManager.class);

    private final List<Scope> arena = new ArrayList<>();
    private final Diagnostics diagnostics;
    private int current;

    public ScopeManager(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        arena.add(new Scope(ScopeKind.GLOBAL, -1));
        current = 0;
    }

    public void enterScope(ScopeKind kind) {
        arena.add(new Scope(kind, current));
        current = arena.size() - 1;
    }

    /**
     * Leaves the current scope and discards it. At the global scope this is a no-op reported as a SCOPE_ERROR.
     */
    public void exitScope() {
        int parent = arena.get(current).getParentIndex();
        if (parent < 0) {
            log.warn("Attempted to exit the global scope");
            diagnostics.error(DiagnosticCode.SCOPE_ERROR, "Attempted to exit the global scope", null, null);
            return;
        }
        if (current == arena.size() - 1) {
            arena.remove(current);
        }
        current = parent;
    }

    /**
     * Number of live scopes, the global one included.
     */
    public int scopeCount() {
        return arena.size();
    }

    public void declareVariable(String name, PseudoType type, List<String> dimensions) {
        declareVariable(VariableInfo.builder()
                .name(name)
                .type(type)
                .arrayDimensions(dimensions)
                .build());
    }

    public void declareVariable(String name, PseudoType type, List<String> dimensions, boolean constant,
            String initialValue) {
        declareVariable(VariableInfo.builder()
                .name(name)
                .type(type)
                .arrayDimensions(dimensions)
                .constant(constant)
                .initialValue(initialValue)
                .build());
    }

    /**
     * Re-declaring a name in the same scope replaces the earlier entry.
     */
    public void declareVariable(VariableInfo variable) {
        arena.get(current).getVariables().put(variable.getName(), variable);
    }

    public void declareCallable(CallableInfo callable) {
        arena.get(current).getCallables().put(callable.getName(), callable);
    }

    public void declareCallable(String name, List<ParameterInfo> parameters, PseudoType returnType) {
        declareCallable(CallableInfo.builder().name(name).parameters(parameters).returnType(returnType).build());
    }

    public Optional<VariableInfo> lookupVariable(String name) {
        return lookup(scope -> scope.getVariables().get(name));
    }

    public Optional<CallableInfo> lookupCallable(String name) {
        return lookup(scope -> scope.getCallables().get(name));
    }

    /**
     * Kind of the innermost scope that declares the variable.
     */
    public Optional<ScopeKind> scopeKindOf(String name) {
        int index = current;
        while (index >= 0) {
            Scope scope = arena.get(index);
            if (scope.getVariables().containsKey(name)) {
                return Optional.of(scope.getKind());
            }
            index = scope.getParentIndex();
        }
        return Optional.empty();
    }

    private <T> Optional<T> lookup(Function<Scope, T> finder) {
        int index = current;
        while (index >= 0) {
            Scope scope = arena.get(index);
            T found = finder.apply(scope);
            if (found != null) {
                return Optional.of(found);
            }
            index = scope.getParentIndex();
        }
        return Optional.empty();
    }

    /**
     * Number of scopes between the current one and the global scope; 0 at global level.
     */
    public int depth() {
        int depth = 0;
        int index = arena.get(current).getParentIndex();
        while (index >= 0) {
            depth++;
            index = arena.get(index).getParentIndex();
        }
        return depth;
    }

    public ScopeKind currentKind() {
        return arena.get(current).getKind();
    }

    /**
     * True when the current scope or any enclosing one is of the given kind.
     */
    public boolean isInside(ScopeKind kind) {
        int index = current;
        while (index >= 0) {
            Scope scope = arena.get(index);
            if (scope.getKind() == kind) {
                return true;
            }
            index = scope.getParentIndex();
        }
        return false;
    }
}
