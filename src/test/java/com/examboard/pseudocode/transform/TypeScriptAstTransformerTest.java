package com.examboard.pseudocode.transform;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.parser.TypeScriptSourceParser;

import static org.assertj.core.api.Assertions.*;

class TypeScriptAstTransformerTest {

    @Test
    void testFunctionWithStringConcatenation() {
        IrNode function = transform("""
            function greet(name: string): string {
                return "Hello " + name;
            }
            """).getProgram().child(0);

        assertThat(function.getKind()).isEqualTo(IrKind.FUNCTION);
        assertThat(function.meta(IrMetadata.NAME)).isEqualTo("greet");
        assertThat(function.meta(IrMetadata.PARAMETERS)).isEqualTo("name : STRING");
        assertThat(function.meta(IrMetadata.RETURN_TYPE)).isEqualTo("STRING");
        assertThat(function.child(0).child(0).meta(IrMetadata.EXPRESSION)).isEqualTo("\"Hello \" & name");
    }

    @Test
    void testVoidFunctionIsProcedure() {
        IrNode procedure = transform("""
            function show(n: number): void {
                console.log(n);
            }
            """).getProgram().child(0);

        assertThat(procedure.getKind()).isEqualTo(IrKind.PROCEDURE);
        assertThat(procedure.optionalMeta(IrMetadata.RETURN_TYPE)).isEmpty();
    }

    @Test
    void testPromiseReturnTypeIsUnwrapped() {
        IrNode function = transform("""
            async function load(): Promise<number> {
                return 1;
            }
            """).getProgram().child(0);

        assertThat(function.getKind()).isEqualTo(IrKind.FUNCTION);
        assertThat(function.meta(IrMetadata.RETURN_TYPE)).isEqualTo("REAL");
    }

    @Test
    void testConstLiteralIsConstant() {
        IrNode constant = transform("const PI = 3.14;").getProgram().child(0);

        assertThat(constant.getKind()).isEqualTo(IrKind.CONSTANT_DECLARATION);
        assertThat(constant.meta(IrMetadata.NAME)).isEqualTo("PI");
        assertThat(constant.meta(IrMetadata.VALUE)).isEqualTo("3.14");
    }

    @Test
    void testPromptIsOutputThenInput() {
        TransformResult result = transform("let name = prompt(\"Name?\");");

        List<IrNode> items = result.getProgram().getChildren();
        assertThat(items).extracting(IrNode::getKind).containsSubsequence(IrKind.OUTPUT, IrKind.INPUT);
        IrNode prompt = items.stream().filter(item -> item.getKind() == IrKind.OUTPUT).findFirst().orElseThrow();
        assertThat(prompt.meta(IrMetadata.EXPRESSION)).isEqualTo("\"Name?\"");
        assertThat(items.get(items.size() - 1).meta(IrMetadata.TARGET)).isEqualTo("name");
    }

    @Test
    void testForOfBecomesIndexedLoop() {
        TransformResult result = transform("""
            const names: string[] = ["Ann", "Bo"];
            for (const n of names) {
                console.log(n);
            }
            """);

        List<IrNode> items = result.getProgram().getChildren();
        IrNode loop = items.get(items.size() - 1);
        assertThat(loop.getKind()).isEqualTo(IrKind.FOR);
        assertThat(loop.meta(IrMetadata.VARIABLE)).isEqualTo("nIndex");
        assertThat(loop.meta(IrMetadata.START)).isEqualTo("1");
        assertThat(loop.meta(IrMetadata.END)).isEqualTo("LENGTH(names)");

        IrNode element = loop.child(0).child(0);
        assertThat(element.getKind()).isEqualTo(IrKind.ASSIGNMENT);
        assertThat(element.meta(IrMetadata.TARGET)).isEqualTo("n");
        assertThat(element.meta(IrMetadata.EXPRESSION)).isEqualTo("names[nIndex]");
        assertThat(codes(result)).contains(DiagnosticCode.CONSTRUCT_SIMPLIFIED);
    }

    @Test
    void testAnyTypeFallsBackToString() {
        TransformResult result = transform("let data: any = 5;");

        assertThat(result.getProgram().child(0).meta(IrMetadata.DATA_TYPE)).isEqualTo("STRING");
        assertThat(codes(result)).contains(DiagnosticCode.TYPE_CONVERSION_FALLBACK);
    }

    private static TransformResult transform(String source) {
        return new TypeScriptAstTransformer(ConversionOptions.defaults())
                .transform(new TypeScriptSourceParser().parse(source).getTree());
    }

    private static List<DiagnosticCode> codes(TransformResult result) {
        return result.getDiagnostics().stream().map(Diagnostic::getCode).toList();
    }
}
