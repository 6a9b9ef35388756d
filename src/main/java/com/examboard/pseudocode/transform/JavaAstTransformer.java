package com.examboard.pseudocode.transform;

import java.util.Set;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.transform.types.JavaTypeNormalizer;
import com.examboard.pseudocode.transform.types.TypeNormalizer;

/**
 * Java flavour: {@code System.out} output, {@code Scanner}/{@code BufferedReader} input and
 * {@code public static void main} as the main program.
 */
public class JavaAstTransformer extends AbstractAstTransformer {

    private static final Set<String> BUILT_INS = Set.of(
        "System", "Math", "Integer", "Long", "Double", "Float", "Short", "Byte", "Boolean", "Character",
        "String", "StringBuilder", "Arrays", "Collections", "List", "ArrayList", "Map", "HashMap", "Objects",
        "Scanner", "this", "super", "length"
    );

    private static final Set<String> OUTPUT_CALLS = Set.of(
        "System.out.println", "System.out.print", "System.out.printf", "System.out.format",
        "System.err.println", "System.err.print", "System.err.printf", "System.err.format"
    );

    private static final Set<String> READ_METHODS = Set.of(
        "nextInt", "nextLine", "next", "nextDouble", "nextFloat", "nextLong", "nextShort", "nextByte",
        "nextBoolean", "readLine"
    );

    private static final Set<String> READERS = Set.of("Scanner", "BufferedReader", "InputStreamReader", "Console");

    public JavaAstTransformer(ConversionOptions options) {
        super(options);
    }

    @Override
    protected TypeNormalizer createTypeNormalizer(Set<String> typeNames, Diagnostics diagnostics) {
        return new JavaTypeNormalizer(typeNames, diagnostics);
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
    protected boolean isFormattedOutput(SyntaxNode call) {
        String path = calleePath(call);
        return path != null && (path.endsWith(".printf") || path.endsWith(".format"));
    }

    @Override
    protected boolean isInputCall(SyntaxNode call) {
        SyntaxNode callee = call.child(0);
        if (!callee.is(SyntaxKind.MEMBER_ACCESS) || !READ_METHODS.contains(callee.getValue())) {
            return false;
        }
        SyntaxNode receiver = callee.child(0).unwrapParentheses();
        if (receiver.is(SyntaxKind.IDENTIFIER)) {
            return getContext().getInputReaders().contains(receiver.getValue());
        }
        return receiver.is(SyntaxKind.NEW_EXPRESSION) && READERS.contains(receiver.getValue());
    }

    /**
     * Java readers take no prompt argument.
     */
    @Override
    protected SyntaxNode inputPrompt(SyntaxNode call) {
        return null;
    }

    @Override
    protected boolean isInputSetup(SyntaxNode initializer) {
        return initializer.is(SyntaxKind.NEW_EXPRESSION) && READERS.contains(initializer.getValue())
                || initializer.is(SyntaxKind.CALL_EXPRESSION) && "System.console".equals(calleePath(initializer));
    }

    @Override
    protected boolean isConversionCall(SyntaxNode call) {
        String path = calleePath(call);
        return path != null && Set.of("Integer.parseInt", "Integer.valueOf", "Double.parseDouble", "Double.valueOf",
                "Long.parseLong", "Float.parseFloat", "Boolean.parseBoolean").contains(path);
    }

    @Override
    protected boolean isEntryPoint(SyntaxNode method) {
        return "main".equals(method.getValue()) && method.hasModifier("static")
                && "void".equals(method.attribute(SyntaxAttributes.RETURN_TYPE));
    }
}
