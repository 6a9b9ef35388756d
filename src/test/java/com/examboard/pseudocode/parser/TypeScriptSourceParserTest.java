package com.examboard.pseudocode.parser;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TypeScriptSourceParserTest {

    @Test
    void testParseTypedLet() {
        SyntaxNode declaration = parse("let total: number = 0;").getTree().child(0);

        assertThat(declaration.getKind()).isEqualTo(SyntaxKind.VARIABLE_DECLARATION);
        assertThat(declaration.getValue()).isEqualTo("total");
        assertThat(declaration.attribute(SyntaxAttributes.DECLARATION_KIND)).isEqualTo("let");
        assertThat(declaration.attribute(SyntaxAttributes.TYPE)).isEqualTo("number");
    }

    @Test
    void testSeveralDeclaratorsFormAGroup() {
        SyntaxNode group = parse("const a = 1, b = 2;").getTree().child(0);

        assertThat(group.getKind()).isEqualTo(SyntaxKind.DECLARATION_GROUP);
        assertThat(group.getChildren()).extracting(SyntaxNode::getValue).containsExactly("a", "b");
    }

    @Test
    void testSemicolonsAreOptionalAtLineEnds() {
        ParseResult result = parse("""
            let x = 1
            x = x + 2
            console.log(x)
            """);

        assertThat(result.hasStructuralErrors()).isFalse();
        assertThat(result.getTree().getChildren()).hasSize(3);
    }

    @Test
    void testParseFunctionWithOptionalAndDefaultParameters() {
        String source = """
            function greet(name: string, title?: string, times: number = 1): string {
                return title + name;
            }
            """;

        SyntaxNode function = parse(source).getTree().child(0);

        assertThat(function.getKind()).isEqualTo(SyntaxKind.METHOD_DECLARATION);
        assertThat(function.getValue()).isEqualTo("greet");
        assertThat(function.attribute(SyntaxAttributes.RETURN_TYPE)).isEqualTo("string");
        assertThat(function.childrenOf(SyntaxKind.PARAMETER)).hasSize(3);
        assertThat(function.child(1).flag(SyntaxAttributes.OPTIONAL)).isTrue();
        assertThat(function.child(2).childCount()).isEqualTo(1);
        assertThat(function.findChild(SyntaxKind.BLOCK)).isPresent();
    }

    @Test
    void testArrowFunctionIsALambdaInitializer() {
        SyntaxNode declaration = parse("const square = (n: number): number => n * n;").getTree().child(0);

        SyntaxNode lambda = declaration.child(0);
        assertThat(lambda.getKind()).isEqualTo(SyntaxKind.LAMBDA_EXPRESSION);
        assertThat(lambda.childrenOf(SyntaxKind.PARAMETER)).hasSize(1);
        assertThat(lambda.attribute(SyntaxAttributes.RETURN_TYPE)).isEqualTo("number");
    }

    @Test
    void testForOfAndForIn() {
        SyntaxNode program = parse("""
            for (const item of items) { }
            for (const key in record) { }
            """).getTree();

        assertThat(program.child(0).getKind()).isEqualTo(SyntaxKind.FOR_EACH_STATEMENT);
        assertThat(program.child(0).attribute(SyntaxAttributes.ITERATION)).isEqualTo("of");
        assertThat(program.child(1).attribute(SyntaxAttributes.ITERATION)).isEqualTo("in");
    }

    @Test
    void testEnumMembersKeepInitializers() {
        SyntaxNode enumeration = parse("enum Color { Red, Green = 5, Blue }").getTree().child(0);

        assertThat(enumeration.getKind()).isEqualTo(SyntaxKind.ENUM_DECLARATION);
        assertThat(enumeration.getChildren()).extracting(SyntaxNode::getValue)
                .containsExactly("Red", "Green", "Blue");
        assertThat(enumeration.child(1).childCount()).isEqualTo(1);
    }

    @Test
    void testInterfaceIsParsed() {
        ParseResult result = parse("""
            interface Point {
                x: number;
                y?: number;
            }
            """);

        SyntaxNode point = result.getTree().child(0);
        assertThat(point.getKind()).isEqualTo(SyntaxKind.INTERFACE_DECLARATION);
        assertThat(point.getChildren()).hasSize(2);
        assertThat(result.hasStructuralErrors()).isFalse();
    }

    @Test
    void testImportIsReportedAsUnsupported() {
        ParseResult result = parse("import { readFileSync } from \"fs\";\nlet y = 2;");

        assertThat(result.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.UNSUPPORTED_FEATURE);
        assertThat(result.getTree().child(1).getKind()).isEqualTo(SyntaxKind.VARIABLE_DECLARATION);
    }

    @Test
    void testUnclosedFunctionBodyIsStructural() {
        ParseResult result = parse("function f() {\n  let x = 1;\n");

        assertThat(result.hasStructuralErrors()).isTrue();
    }

    private static ParseResult parse(String source) {
        return new TypeScriptSourceParser().parse(source);
    }
}
