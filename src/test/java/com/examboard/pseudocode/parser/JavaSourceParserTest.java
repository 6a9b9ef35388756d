package com.examboard.pseudocode.parser;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JavaSourceParserTest {

    @Test
    void testParseLocalDeclaration() {
        ParseResult result = parse("int x = 5;");

        assertThat(result.hasStructuralErrors()).isFalse();
        SyntaxNode declaration = result.getTree().child(0);
        assertThat(declaration.getKind()).isEqualTo(SyntaxKind.VARIABLE_DECLARATION);
        assertThat(declaration.getValue()).isEqualTo("x");
        assertThat(declaration.attribute(SyntaxAttributes.TYPE)).isEqualTo("int");
        assertThat(declaration.child(0).isLiteral(SyntaxAttributes.LITERAL_INTEGER)).isTrue();
        assertThat(declaration.child(0).getValue()).isEqualTo("5");
    }

    @Test
    void testFinalLocalIsMarked() {
        SyntaxNode declaration = parse("final double RATE = 0.2;").getTree().child(0);

        assertThat(declaration.attribute(SyntaxAttributes.DECLARATION_KIND)).isEqualTo("final");
        assertThat(declaration.child(0).isLiteral(SyntaxAttributes.LITERAL_DECIMAL)).isTrue();
    }

    @Test
    void testParseClassMembers() {
        String source = """
            public abstract class Shape {
                private int sides;

                Shape(int sides) {
                    this.sides = sides;
                }

                abstract double area();

                static int count(int[] values) {
                    return values.length;
                }
            }
            """;

        ParseResult result = parse(source);

        assertThat(result.hasStructuralErrors()).isFalse();
        SyntaxNode shape = result.getTree().child(0);
        assertThat(shape.getKind()).isEqualTo(SyntaxKind.CLASS_DECLARATION);
        assertThat(shape.hasModifier("abstract")).isTrue();
        assertThat(shape.getChildren()).extracting(SyntaxNode::getKind).containsExactly(
                SyntaxKind.FIELD_DECLARATION,
                SyntaxKind.CONSTRUCTOR_DECLARATION,
                SyntaxKind.METHOD_DECLARATION,
                SyntaxKind.METHOD_DECLARATION);

        SyntaxNode constructor = shape.child(1);
        assertThat(constructor.getValue()).isEqualTo("Shape");
        assertThat(constructor.childrenOf(SyntaxKind.PARAMETER)).hasSize(1);

        SyntaxNode area = shape.child(2);
        assertThat(area.flag(SyntaxAttributes.ABSTRACT)).isTrue();
        assertThat(area.findChild(SyntaxKind.BLOCK)).isEmpty();

        SyntaxNode count = shape.child(3);
        assertThat(count.attribute(SyntaxAttributes.RETURN_TYPE)).isEqualTo("int");
        assertThat(count.hasModifier("static")).isTrue();
        assertThat(count.child(0).attribute(SyntaxAttributes.TYPE)).isEqualTo("int[]");
    }

    @Test
    void testClassicAndEnhancedForLoops() {
        String source = """
            for (int i = 0; i < 10; i++) { }
            for (String s : names) { }
            """;

        SyntaxNode program = parse(source).getTree();

        SyntaxNode classic = program.child(0);
        assertThat(classic.getKind()).isEqualTo(SyntaxKind.FOR_STATEMENT);
        assertThat(classic.child(0).getKind()).isEqualTo(SyntaxKind.VARIABLE_DECLARATION);
        assertThat(classic.child(1).getKind()).isEqualTo(SyntaxKind.BINARY_EXPRESSION);
        assertThat(classic.child(2).getKind()).isEqualTo(SyntaxKind.UPDATE_EXPRESSION);

        SyntaxNode enhanced = program.child(1);
        assertThat(enhanced.getKind()).isEqualTo(SyntaxKind.FOR_EACH_STATEMENT);
        assertThat(enhanced.getValue()).isEqualTo("s");
        assertThat(enhanced.attribute(SyntaxAttributes.TYPE)).isEqualTo("String");
    }

    @Test
    void testSwitchCasesKeepLabelsAndDefault() {
        String source = """
            switch (day) {
                case 1:
                case 2:
                    x = 1;
                    break;
                default:
                    x = 0;
            }
            """;

        SyntaxNode statement = parse(source).getTree().child(0);

        assertThat(statement.getKind()).isEqualTo(SyntaxKind.SWITCH_STATEMENT);
        assertThat(statement.childrenOf(SyntaxKind.SWITCH_CASE)).hasSize(3);
        assertThat(statement.child(1).child(1).getChildren()).isEmpty();
        assertThat(statement.child(3).flag(SyntaxAttributes.DEFAULT)).isTrue();
    }

    @Test
    void testImportIsUnsupported() {
        ParseResult result = parse("import java.util.Scanner;\nint x = 1;");

        SyntaxNode unsupported = result.getTree().child(0);
        assertThat(unsupported.getKind()).isEqualTo(SyntaxKind.UNSUPPORTED);
        assertThat(unsupported.attribute(SyntaxAttributes.FEATURE)).isEqualTo("imports");
        assertThat(result.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.UNSUPPORTED_FEATURE);
        assertThat(result.hasStructuralErrors()).isFalse();
    }

    @Test
    void testMissingSemicolonRecovers() {
        ParseResult result = parse("""
            int x = 5
            int y = 6;
            """);

        assertThat(result.hasStructuralErrors()).isTrue();
        assertThat(result.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.STRUCTURAL_ERROR
                && d.getMessage().contains("Expected ';'"));
        assertThat(result.getTree().getChildren()).extracting(SyntaxNode::getValue).containsExactly("y");
    }

    @Test
    void testUnterminatedStringEndsItsDeclaration() {
        ParseResult result = parse("""
            String s = "abc;
            int x = 1;
            """);

        assertThat(result.getDiagnostics()).hasSize(1);
        assertThat(result.getDiagnostics().get(0).getMessage()).contains("Unterminated string literal");
        assertThat(result.getTree().getChildren()).extracting(SyntaxNode::getValue).containsExactly("s", "x");
        assertThat(result.getTree().child(0).child(0).getValue()).isEqualTo("abc;");
    }

    @Test
    void testNestingLimitIsReportedOnce() {
        ParseResult result = new JavaSourceParser(2).parse("{ { { x = 1; } } { { y = 2; } } }");

        assertThat(result.getDiagnostics())
                .filteredOn(d -> d.getCode() == DiagnosticCode.NESTING_TOO_DEEP)
                .hasSize(1);
    }

    @Test
    void testBlankSourceGivesEmptyProgram() {
        ParseResult result = parse("   \n");

        assertThat(result.getTree().getKind()).isEqualTo(SyntaxKind.PROGRAM);
        assertThat(result.getTree().getChildren()).isEmpty();
        assertThat(result.getDiagnostics()).isEmpty();
    }

    private static ParseResult parse(String source) {
        return new JavaSourceParser().parse(source);
    }
}
