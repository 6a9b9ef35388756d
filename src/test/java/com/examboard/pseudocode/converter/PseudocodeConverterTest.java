package com.examboard.pseudocode.converter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.config.Strictness;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Severity;
import com.examboard.pseudocode.model.Language;

import static org.assertj.core.api.Assertions.*;

class PseudocodeConverterTest {

    private PseudocodeConverter converter;

    @BeforeEach
    void setUp() {
        converter = new PseudocodeConverter();
    }

    @Test
    void testCountingLoopIsTheSameInBothLanguages() {
        String expected = """
            FOR i ← 0 TO 4
               OUTPUT i
            NEXT i
            """;

        ConversionResult java = converter.convertJava("""
            for (int i = 0; i < 5; i++) {
                System.out.println(i);
            }
            """, null);
        ConversionResult typeScript = converter.convertTypeScript("""
            for (let i = 0; i < 5; i++) {
                console.log(i);
            }
            """, null);

        assertThat(java.getPseudocode()).isEqualTo(expected);
        assertThat(typeScript.getPseudocode()).isEqualTo(expected);
        assertThat(java.isSuccess()).isTrue();
        assertThat(typeScript.getMetadata().getLanguage()).isEqualTo(Language.TYPESCRIPT);
    }

    @Test
    void testUndeclaredCounterWithGenericPrint() {
        String expected = """
            FOR i ← 0 TO 4
               OUTPUT i
            NEXT i
            """;
        String source = "for (i = 0; i < 5; i++) { print(i); }";

        assertThat(converter.convertJava(source, null).getPseudocode()).isEqualTo(expected);
        assertThat(converter.convertTypeScript(source, null).getPseudocode()).isEqualTo(expected);

        ConversionOptions strict = ConversionOptions.builder().strictness(Strictness.STRICT).build();
        ConversionResult result = converter.convertJava(source, strict);
        assertThat(result.getPseudocode()).isEqualTo(expected);
        assertThat(result.getDiagnostics())
                .filteredOn(d -> d.getCode() == DiagnosticCode.UNDECLARED_IDENTIFIER)
                .singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("'i'"));
    }

    @Test
    void testIndexArithmeticInsideLoopCountingFromOne() {
        ConversionResult result = converter.convertJava("""
            int[] a = {1, 2, 3, 4};
            int[] b = {0, 0, 0, 0};
            for (int i = 0; i < a.length; i++) {
                b[i] = a[a.length - 1 - i];
                b[i] = a[i * 2];
            }
            """, null);

        assertThat(result.getPseudocode()).contains("""
            FOR i ← 1 TO LENGTH(a)
               b[i] ← a[LENGTH(a) - i + 1]
               b[i] ← a[(i - 1) * 2 + 1]
            NEXT i
            """);
    }

    @Test
    void testLoopVariableCountingFromOneUsedAsValue() {
        ConversionResult result = converter.convertJava("""
            int[] nums = {7, 8, 9};
            for (int i = 0; i < nums.length; i++) {
                System.out.println(i);
            }
            """, null);

        assertThat(result.getPseudocode()).contains("   OUTPUT (i - 1)\n");
        assertThat(result.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.LOOP_BOUND_CONVERSION
                && d.getMessage().contains("(i - 1)"));
    }

    @Test
    void testNestedIfElse() {
        ConversionResult result = converter.convertJava("""
            int x = 5;
            if (x > 3) {
                if (x > 4) {
                    System.out.println("big");
                } else {
                    System.out.println("medium");
                }
            } else {
                System.out.println("small");
            }
            """, ConversionOptions.defaults());

        assertThat(result.getPseudocode()).isEqualTo("""
            DECLARE x : INTEGER ← 5
            IF x > 3 THEN
               IF x > 4 THEN
                  OUTPUT "big"
               ELSE
                  OUTPUT "medium"
               ENDIF
            ELSE
               OUTPUT "small"
            ENDIF
            """);
    }

    @Test
    void testElseIfChain() {
        ConversionResult result = converter.convertJava("""
            int n = 7;
            if (n > 0) {
                System.out.println("positive");
            } else if (n == 0) {
                System.out.println("zero");
            } else {
                System.out.println("negative");
            }
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            DECLARE n : INTEGER ← 7
            IF n > 0 THEN
               OUTPUT "positive"
            ELSE IF n = 0 THEN
               OUTPUT "zero"
            ELSE
               OUTPUT "negative"
            ENDIF
            """);
    }

    @Test
    void testSwitchBecomesCase() {
        ConversionResult result = converter.convertJava("""
            int day = 2;
            switch (day) {
                case 1:
                    System.out.println("Mon");
                    break;
                case 2:
                case 3:
                    System.out.println("Mid");
                    break;
                default:
                    System.out.println("Other");
            }
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            DECLARE day : INTEGER ← 2
            CASE OF day
            1:
               OUTPUT "Mon"
            2, 3:
               OUTPUT "Mid"
            OTHERWISE:
               OUTPUT "Other"
            ENDCASE
            """);
        assertThat(result.hasCode(DiagnosticCode.SWITCH_FALL_THROUGH)).isFalse();
    }

    @Test
    void testArrayLoopRunsFromOne() {
        ConversionResult result = converter.convertJava("""
            int[] nums = {1, 2, 3};
            for (int i = 0; i < nums.length; i++) {
                System.out.println(nums[i]);
            }
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            DECLARE nums : ARRAY[1:3] OF INTEGER ← [1, 2, 3]
            FOR i ← 1 TO LENGTH(nums)
               OUTPUT nums[i]
            NEXT i
            """);
        assertThat(result.hasCode(DiagnosticCode.LOOP_BOUND_CONVERSION)).isTrue();
    }

    @Test
    void testJavaClassWithMainMethod() {
        ConversionResult result = converter.convertJava("""
            public class Main {
                static int add(int a, int b) {
                    return a + b;
                }

                public static void main(String[] args) {
                    int total = add(2, 3);
                    System.out.println("Total: " + total);
                }
            }
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            // Class Main
            // Static member
            FUNCTION add(a : INTEGER, b : INTEGER) RETURNS INTEGER
               RETURN a + b
            ENDFUNCTION

            // Main program
            DECLARE total : INTEGER ← add(2, 3)
            OUTPUT "Total: ", total
            """);
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void testTypeScriptFunction() {
        ConversionResult result = converter.convertTypeScript("""
            function greet(name: string): string {
                return "Hello " + name;
            }

            console.log(greet("Ann"));
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            FUNCTION greet(name : STRING) RETURNS STRING
               RETURN "Hello " & name
            ENDFUNCTION

            OUTPUT greet("Ann")
            """);
    }

    @Test
    void testTypeScriptDoWhile() {
        ConversionResult result = converter.convertTypeScript("""
            let n = 0;
            do {
                n = n + 1;
            } while (n < 3);
            """, null);

        assertThat(result.getPseudocode()).isEqualTo("""
            DECLARE n : REAL ← 0
            REPEAT
               n ← n + 1
            UNTIL n >= 3
            """);
    }

    @Test
    void testConstantsInBothLanguages() {
        assertThat(converter.convertJava("final int MAX = 10;", null).getPseudocode())
                .isEqualTo("CONSTANT MAX = 10\n");
        assertThat(converter.convertTypeScript("const PI = 3.14;", null).getPseudocode())
                .isEqualTo("CONSTANT PI = 3.14\n");
    }

    @Test
    void testEmptyInput() {
        ConversionResult result = converter.convertJava("", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPseudocode()).isEmpty();
        assertThat(result.getDiagnostics()).hasSize(1);
        assertThat(result.getDiagnostics().get(0).getCode()).isEqualTo(DiagnosticCode.EMPTY_PROGRAM);
        assertThat(result.getMetadata().getStatementCount()).isZero();
    }

    @Test
    void testStructuralErrorGivesBestEffortOutput() {
        ConversionResult result = converter.convertJava("""
            int x = 5;
            if (x > 3) {
                x = 1;
            """, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getPseudocode()).startsWith("// ERROR: STRUCTURAL_ERROR (");
        assertThat(result.hasCode(DiagnosticCode.STRUCTURAL_ERROR)).isTrue();
        assertThat(result.getMetadata().getErrorCount()).isPositive();
    }

    @Test
    void testUnterminatedStringKeepsFollowingStatements() {
        ConversionResult result = converter.convertJava("""
            String s = "abc;
            int x = 1;
            """, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getPseudocode())
                .startsWith("// ERROR: STRUCTURAL_ERROR (1 found) - output is best-effort\n")
                .contains("DECLARE x : INTEGER ← 1\n");
        assertThat(result.getDiagnostics())
                .filteredOn(d -> d.getCode() == DiagnosticCode.STRUCTURAL_ERROR)
                .hasSize(1);
        assertThat(result.hasCode(DiagnosticCode.EMPTY_PROGRAM)).isFalse();
    }

    @Test
    void testStructuralErrorsSuppressEmptyProgramNote() {
        ConversionResult result = converter.convertJava("x = ;", null);

        assertThat(result.hasCode(DiagnosticCode.STRUCTURAL_ERROR)).isTrue();
        assertThat(result.hasCode(DiagnosticCode.EMPTY_PROGRAM)).isFalse();
    }

    @Test
    void testRejectedInput() {
        ConversionResult result = converter.convertCode("int x\0 = 1;", Language.JAVA, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getPseudocode()).isEmpty();
        assertThat(result.hasCode(DiagnosticCode.VALIDATION_ERROR)).isTrue();
    }

    @Test
    void testMetadataCountsStatementsAndSeverities() {
        ConversionResult result = converter.convertJava("""
            int x = 5;
            System.out.println(x);
            """, null);

        ConversionMetadata metadata = result.getMetadata();
        assertThat(metadata.getStatementCount()).isEqualTo(2);
        assertThat(metadata.getErrorCount()).isZero();
        assertThat(metadata.getInfoCount()).isEqualTo(result.getDiagnostics().stream()
                .filter(d -> d.getSeverity() == Severity.INFO).count());
        assertThat(metadata.getDurationMillis()).isNotNegative();
    }

    @Test
    void testAnnotationCommentsCanBeDisabled() {
        ConversionOptions options = ConversionOptions.builder().includeAnnotationComments(false).build();

        ConversionResult result = converter.convertJava("""
            public class Main {
                public static void main(String[] args) {
                    System.out.println("hi");
                }
            }
            """, options);

        assertThat(result.getPseudocode()).doesNotContain("//");
        assertThat(result.getPseudocode()).contains("OUTPUT \"hi\"");
    }
}
