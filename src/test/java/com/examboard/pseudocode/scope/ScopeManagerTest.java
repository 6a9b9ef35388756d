package com.examboard.pseudocode.scope;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.transform.types.PseudoType;

import static org.assertj.core.api.Assertions.*;

class ScopeManagerTest {

    private Diagnostics diagnostics;
    private ScopeManager scopes;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        scopes = new ScopeManager(diagnostics);
    }

    @Test
    void testLookupWalksOutward() {
        scopes.declareVariable("total", PseudoType.INTEGER, List.of());
        scopes.enterScope(ScopeKind.FUNCTION);
        scopes.enterScope(ScopeKind.BLOCK);

        assertThat(scopes.lookupVariable("total")).map(VariableInfo::getType).contains(PseudoType.INTEGER);
        assertThat(scopes.scopeKindOf("total")).contains(ScopeKind.GLOBAL);
        assertThat(scopes.depth()).isEqualTo(2);
    }

    @Test
    void testInnerDeclarationShadowsOuter() {
        scopes.declareVariable("x", PseudoType.INTEGER, List.of());
        scopes.enterScope(ScopeKind.FUNCTION);
        scopes.declareVariable("x", PseudoType.STRING, List.of());

        assertThat(scopes.lookupVariable("x").get().getType()).isEqualTo(PseudoType.STRING);
        assertThat(scopes.scopeKindOf("x")).contains(ScopeKind.FUNCTION);

        scopes.exitScope();

        assertThat(scopes.lookupVariable("x").get().getType()).isEqualTo(PseudoType.INTEGER);
    }

    @Test
    void testVariablesDoNotLeakOutOfScope() {
        scopes.enterScope(ScopeKind.BLOCK);
        scopes.declareVariable("temp", PseudoType.REAL, List.of());
        scopes.exitScope();

        assertThat(scopes.lookupVariable("temp")).isEmpty();
        assertThat(scopes.depth()).isZero();
    }

    @Test
    void testExitedScopesAreDiscarded() {
        for (int i = 0; i < 50; i++) {
            scopes.enterScope(ScopeKind.FUNCTION);
            scopes.enterScope(ScopeKind.BLOCK);
            scopes.declareVariable("i", PseudoType.INTEGER, List.of());
            scopes.exitScope();
            scopes.exitScope();
        }

        assertThat(scopes.scopeCount()).isEqualTo(1);

        scopes.enterScope(ScopeKind.BLOCK);
        assertThat(scopes.scopeCount()).isEqualTo(2);
        assertThat(scopes.lookupVariable("i")).isEmpty();
    }

    @Test
    void testRedeclarationInSameScopeReplaces() {
        scopes.declareVariable("n", PseudoType.INTEGER, List.of());
        scopes.declareVariable("n", PseudoType.REAL, List.of(), true, "1.5");

        VariableInfo n = scopes.lookupVariable("n").get();
        assertThat(n.getType()).isEqualTo(PseudoType.REAL);
        assertThat(n.isConstant()).isTrue();
        assertThat(n.getInitialValue()).isEqualTo("1.5");
    }

    @Test
    void testCallablesAreScoped() {
        scopes.declareCallable("area", List.of(new ParameterInfo("r", PseudoType.REAL, false)), PseudoType.REAL);
        scopes.declareCallable("show", List.of(), null);

        assertThat(scopes.lookupCallable("area").get().isFunction()).isTrue();
        assertThat(scopes.lookupCallable("show").get().isFunction()).isFalse();
        assertThat(scopes.lookupCallable("missing")).isEmpty();
    }

    @Test
    void testIsInsideChecksEnclosingScopes() {
        scopes.enterScope(ScopeKind.CLASS);
        scopes.enterScope(ScopeKind.FUNCTION);
        scopes.enterScope(ScopeKind.BLOCK);

        assertThat(scopes.currentKind()).isEqualTo(ScopeKind.BLOCK);
        assertThat(scopes.isInside(ScopeKind.CLASS)).isTrue();
        assertThat(scopes.isInside(ScopeKind.GLOBAL)).isTrue();
    }

    @Test
    void testExitingGlobalScopeIsReported() {
        scopes.exitScope();

        assertThat(diagnostics.hasCode(DiagnosticCode.SCOPE_ERROR)).isTrue();
        assertThat(scopes.currentKind()).isEqualTo(ScopeKind.GLOBAL);
    }

    @Test
    void testArrayVariable() {
        PseudoType grid = PseudoType.arrayOf(PseudoType.INTEGER, List.of("3", "4"));
        scopes.declareVariable("grid", grid, grid.getDimensions());

        VariableInfo info = scopes.lookupVariable("grid").get();
        assertThat(info.isArray()).isTrue();
        assertThat(info.getArrayDimensions()).containsExactly("3", "4");
    }
}
