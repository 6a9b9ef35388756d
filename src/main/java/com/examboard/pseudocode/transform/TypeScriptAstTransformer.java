package com.examboard.pseudocode.transform;

import java.util.Set;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.transform.types.TypeNormalizer;
import com.examboard.pseudocode.transform.types.TypeScriptTypeNormalizer;

/**
 * TypeScript flavour: {@code console} output, {@code prompt}/{@code readline-sync} input and
 * {@code Promise<T>} return types read as {@code T}.
 */
public class TypeScriptAstTransformer extends AbstractAstTransformer {

    private static final Set<String> BUILT_INS = Set.of(
        "console", "Math", "Number", "String", "Boolean", "Array", "Object", "JSON", "parseInt", "parseFloat",
        "isNaN", "prompt", "process", "readlineSync", "require", "undefined", "this", "super", "Promise",
        "setTimeout", "Date"
    );

    private static final Set<String> OUTPUT_CALLS = Set.of(
        "console.log", "console.info", "console.warn", "console.error", "console.debug", "process.stdout.write"
    );

    private static final Set<String> INPUT_CALLS = Set.of("prompt", "readlineSync.question", "readline.question");

    public TypeScriptAstTransformer(ConversionOptions options) {
        super(options);
    }

    @Override
    protected TypeNormalizer createTypeNormalizer(Set<String> typeNames, Diagnostics diagnostics) {
        return new TypeScriptTypeNormalizer(typeNames, diagnostics);
    }

    @Override
    protected Set<String> builtInNames() {
        return BUILT_INS;
    }

    @Override
    protected boolean isLanguageOutputCall(SyntaxNode call) {
        String path = calleePath(call);
        return path != null && OUTPUT_CALLS.contains(path);
    }

    @Override
    protected boolean isInputCall(SyntaxNode call) {
        String path = calleePath(call);
        if (path == null) {
            return false;
        }
        if (INPUT_CALLS.contains(path)) {
            return true;
        }
        SyntaxNode callee = call.child(0);
        return callee.is(SyntaxKind.IDENTIFIER) && getContext().getInputReaders().contains(callee.getValue())
                || callee.is(SyntaxKind.MEMBER_ACCESS) && "question".equals(callee.getValue())
                        && callee.child(0).is(SyntaxKind.IDENTIFIER)
                        && getContext().getInputReaders().contains(callee.child(0).getValue());
    }

    @Override
    protected boolean isInputSetup(SyntaxNode initializer) {
        if (!initializer.is(SyntaxKind.CALL_EXPRESSION)) {
            return false;
        }
        // require("prompt-sync")() creates the reader
        SyntaxNode call = initializer.child(0).is(SyntaxKind.CALL_EXPRESSION) ? initializer.child(0) : initializer;
        String path = calleePath(call);
        if ("require".equals(path) && call.childCount() == 2) {
            String module = call.child(1).getValue();
            return module != null && (module.contains("prompt-sync") || module.contains("readline"));
        }
        return "readline.createInterface".equals(path);
    }

    @Override
    protected boolean isConversionCall(SyntaxNode call) {
        String path = calleePath(call);
        return path != null && Set.of("parseInt", "parseFloat", "Number", "String", "Number.parseInt",
                "Number.parseFloat").contains(path);
    }

    @Override
    protected String unwrapReturnType(String spelling) {
        if (spelling == null) {
            return null;
        }
        String type = spelling.trim();
        if (type.startsWith("Promise<") && type.endsWith(">")) {
            return type.substring("Promise<".length(), type.length() - 1).trim();
        }
        return type;
    }
}
