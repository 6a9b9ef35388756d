package com.examboard.pseudocode.transform;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.parser.JavaSourceParser;

import static org.assertj.core.api.Assertions.*;

class ExpressionTranslationTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "a != b           | a <> b",
        "a == b           | a = b",
        "a > 1 && b < 2   | a > 1 AND b < 2",
        "a > 1 || b < 2   | a > 1 OR b < 2",
        "!done            | NOT done",
        "a % 2            | a MOD 2",
        "a / b            | DIV(a, b)",
        "x / 2.0          | x / 2.0",
        "s.length()       | LENGTH(s)",
        "s.charAt(0)      | SUBSTRING(s, 1, 1)",
        "s.toUpperCase()  | UCASE(s)",
        "nums[0]          | nums[1]",
        "grid[0][1]       | grid[1][2]",
        "s + a            | s & a",
        "true             | TRUE"
    })
    void testOperatorAndCallMapping(String source, String expected) {
        String program = """
            int a = 1;
            int b = 2;
            double x = 1.5;
            boolean done = false;
            String s = "hi";
            int[] nums = {4, 5};
            int[][] grid = {{1, 2}, {3, 4}};
            Object result = %s;
            """.formatted(source);

        IrNode assignment = new JavaAstTransformer(ConversionOptions.defaults())
                .transform(new JavaSourceParser().parse(program).getTree())
                .getProgram()
                .child(7);

        assertThat(assignment.meta(IrMetadata.VALUE)).isEqualTo(expected);
    }
}
