package com.examboard.pseudocode.transform;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.parser.JavaSourceParser;

import static org.assertj.core.api.Assertions.*;

class JavaAstTransformerTest {

    @Test
    void testCountingLoopBecomesFor() {
        IrNode loop = transform("for (int i = 0; i < 5; i++) { System.out.println(i); }").getProgram().child(0);

        assertThat(loop.getKind()).isEqualTo(IrKind.FOR);
        assertThat(loop.meta(IrMetadata.VARIABLE)).isEqualTo("i");
        assertThat(loop.meta(IrMetadata.START)).isEqualTo("0");
        assertThat(loop.meta(IrMetadata.END)).isEqualTo("4");
        assertThat(loop.optionalMeta(IrMetadata.STEP)).isEmpty();

        IrNode output = loop.child(0).child(0);
        assertThat(output.getKind()).isEqualTo(IrKind.OUTPUT);
        assertThat(output.meta(IrMetadata.EXPRESSION)).isEqualTo("i");
    }

    @Test
    void testArrayLengthLoopStartsAtOne() {
        TransformResult result = transform("""
            int[] nums = {1, 2, 3};
            for (int i = 0; i < nums.length; i++) {
                System.out.println(nums[i]);
            }
            """);

        IrNode declaration = result.getProgram().child(0);
        assertThat(declaration.meta(IrMetadata.DATA_TYPE)).isEqualTo("ARRAY[1:3] OF INTEGER");
        assertThat(declaration.meta(IrMetadata.VALUE)).isEqualTo("[1, 2, 3]");

        IrNode loop = result.getProgram().child(1);
        assertThat(loop.meta(IrMetadata.START)).isEqualTo("1");
        assertThat(loop.meta(IrMetadata.END)).isEqualTo("LENGTH(nums)");
        assertThat(loop.child(0).child(0).meta(IrMetadata.EXPRESSION)).isEqualTo("nums[i]");
        assertThat(codes(result)).contains(DiagnosticCode.LOOP_BOUND_CONVERSION);
    }

    @Test
    void testIrregularForBecomesWhile() {
        TransformResult result = transform("for (int i = 1; i < 100; i *= 2) { System.out.println(i); }");

        List<IrNode> items = result.getProgram().getChildren();
        assertThat(items).extracting(IrNode::getKind).containsExactly(IrKind.VARIABLE_DECLARATION, IrKind.WHILE);
        assertThat(items.get(1).meta(IrMetadata.CONDITION)).isEqualTo("i < 100");
        assertThat(codes(result)).contains(DiagnosticCode.CONSTRUCT_SIMPLIFIED);
    }

    @Test
    void testFinalLiteralIsConstant() {
        IrNode constant = transform("final int MAX = 10;").getProgram().child(0);

        assertThat(constant.getKind()).isEqualTo(IrKind.CONSTANT_DECLARATION);
        assertThat(constant.meta(IrMetadata.NAME)).isEqualTo("MAX");
        assertThat(constant.meta(IrMetadata.VALUE)).isEqualTo("10");
    }

    @Test
    void testScannerReadBecomesInput() {
        TransformResult result = transform("""
            Scanner sc = new Scanner(System.in);
            int age = sc.nextInt();
            """);

        List<IrNode> items = result.getProgram().getChildren();
        assertThat(items).extracting(IrNode::getKind).containsExactly(IrKind.VARIABLE_DECLARATION, IrKind.INPUT);
        assertThat(items.get(1).meta(IrMetadata.TARGET)).isEqualTo("age");
    }

    @Test
    void testDoWhileBecomesRepeatWithNegatedCondition() {
        IrNode loop = transform("""
            int n = 0;
            do {
                n++;
            } while (n < 3);
            """).getProgram().child(1);

        assertThat(loop.getKind()).isEqualTo(IrKind.REPEAT_UNTIL);
        assertThat(loop.meta(IrMetadata.CONDITION)).isEqualTo("n >= 3");
    }

    @Test
    void testSwitchMergesEmptyLabelsAndMovesDefaultLast() {
        IrNode caseOf = transform("""
            int day = 2;
            switch (day) {
                default:
                    System.out.println("Other");
                    break;
                case 1:
                    System.out.println("Mon");
                    break;
                case 2:
                case 3:
                    System.out.println("Mid");
                    break;
            }
            """).getProgram().child(1);

        assertThat(caseOf.getKind()).isEqualTo(IrKind.CASE);
        assertThat(caseOf.meta(IrMetadata.EXPRESSION)).isEqualTo("day");
        assertThat(caseOf.getChildren()).extracting(IrNode::getKind)
                .containsExactly(IrKind.CASE_BRANCH, IrKind.CASE_BRANCH, IrKind.OTHERWISE_BRANCH);
        assertThat(caseOf.child(1).meta(IrMetadata.LABEL)).isEqualTo("2, 3");
        assertThat(caseOf.child(1).child(0).getChildren()).hasSize(1);
    }

    @Test
    void testFallThroughIsFlagged() {
        TransformResult result = transform("""
            int x = 0;
            switch (x) {
                case 1:
                    x = 5;
                case 2:
                    x = 6;
                    break;
            }
            """);

        IrNode first = result.getProgram().child(1).child(0);
        assertThat(first.flag(IrMetadata.FALLS_THROUGH)).isTrue();
        assertThat(first.getAnnotations()).contains("Falls through to the next case");
        assertThat(codes(result)).contains(DiagnosticCode.SWITCH_FALL_THROUGH);
    }

    @Test
    void testMainMethodBecomesMainProgram() {
        TransformResult result = transform("""
            public class Main {
                static int add(int a, int b) {
                    return a + b;
                }

                public static void main(String[] args) {
                    int total = add(2, 3);
                    System.out.println("Total: " + total);
                }
            }
            """);

        List<IrNode> items = result.getProgram().getChildren();
        IrNode marker = items.stream()
                .filter(item -> item.getKind() == IrKind.COMMENT && item.getAnnotations().contains("Main program"))
                .findFirst()
                .orElseThrow();
        IrNode output = items.get(items.size() - 1);
        assertThat(items.indexOf(marker)).isLessThan(items.size() - 1);
        assertThat(output.getKind()).isEqualTo(IrKind.OUTPUT);
        assertThat(output.meta(IrMetadata.EXPRESSION)).isEqualTo("\"Total: \", total");
    }

    @Test
    void testFailingStatementBecomesErrorRecovery() {
        SyntaxNode stray = SyntaxNode.builder().kind(SyntaxKind.SWITCH_CASE).line(4).column(1).build();
        SyntaxNode program = SyntaxNode.builder().kind(SyntaxKind.PROGRAM).child(stray).build();

        TransformResult result = new JavaAstTransformer(ConversionOptions.defaults()).transform(program);

        IrNode recovery = result.getProgram().child(0);
        assertThat(recovery.getKind()).isEqualTo(IrKind.ERROR_RECOVERY);
        assertThat(recovery.meta(IrMetadata.MESSAGE))
                .isEqualTo("Could not convert statement on line 4: SWITCH_CASE is not a statement");
        assertThat(codes(result)).contains(DiagnosticCode.TRANSFORMATION_ERROR);
    }

    @Test
    void testIndexArithmeticOnLoopCountingFromOne() {
        TransformResult result = transform("""
            int[] a = {1, 2, 3, 4};
            int[] b = {0, 0, 0, 0};
            for (int i = 0; i < a.length; i++) {
                b[i] = a[a.length - 1 - i];
                b[i] = a[i * 2];
                b[i] = a[i + 1];
            }
            """);

        IrNode body = result.getProgram().child(2).child(0);
        assertThat(body.getChildren()).extracting(n -> n.meta(IrMetadata.TARGET)).containsOnly("b[i]");
        assertThat(body.getChildren()).extracting(n -> n.meta(IrMetadata.EXPRESSION)).containsExactly(
                "a[LENGTH(a) - i + 1]",
                "a[(i - 1) * 2 + 1]",
                "a[i + 1]");
    }

    @Test
    void testUndeclaredCounterIsRecorded() {
        IrNode loop = transform("for (i = 0; i < 5; i++) { print(i); }").getProgram().child(0);

        assertThat(loop.getKind()).isEqualTo(IrKind.FOR);
        assertThat(loop.meta(IrMetadata.UNDECLARED)).isEqualTo("i");
        assertThat(loop.child(0).child(0).getKind()).isEqualTo(IrKind.OUTPUT);
    }

    @Test
    void testEmptyProgramIsNoted() {
        TransformResult result = transform("");

        assertThat(result.getProgram().getChildren()).isEmpty();
        assertThat(codes(result)).containsExactly(DiagnosticCode.EMPTY_PROGRAM);
    }

    private static TransformResult transform(String source) {
        SyntaxNode tree = new JavaSourceParser().parse(source).getTree();
        return new JavaAstTransformer(ConversionOptions.defaults()).transform(tree);
    }

    private static List<DiagnosticCode> codes(TransformResult result) {
        return result.getDiagnostics().stream().map(Diagnostic::getCode).toList();
    }
}
