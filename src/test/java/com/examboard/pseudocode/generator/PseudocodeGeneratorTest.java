package com.examboard.pseudocode.generator;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.config.Strictness;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;

import static org.assertj.core.api.Assertions.*;

class PseudocodeGeneratorTest {

    @Test
    void testGenerateNestedControlFlow() {
        IrNode program = program(
                IrNode.builder().kind(IrKind.VARIABLE_DECLARATION)
                        .meta(IrMetadata.NAME, "count")
                        .meta(IrMetadata.DATA_TYPE, "INTEGER")
                        .meta(IrMetadata.VALUE, "0")
                        .build(),
                IrNode.builder().kind(IrKind.WHILE)
                        .meta(IrMetadata.CONDITION, "count < 3")
                        .child(IrNode.block(List.of(
                                IrNode.builder().kind(IrKind.IF)
                                        .meta(IrMetadata.CONDITION, "count = 1")
                                        .child(IrNode.block(List.of(output("\"one\""))))
                                        .build(),
                                assignment("count", "count + 1"))))
                        .build());

        String expected = """
            DECLARE count : INTEGER ← 0
            WHILE count < 3 DO
               IF count = 1 THEN
                  OUTPUT "one"
               ENDIF
               count ← count + 1
            ENDWHILE
            """;

        assertThat(generate(program)).isEqualTo(expected);
    }

    @Test
    void testElseIfChain() {
        IrNode inner = IrNode.builder().kind(IrKind.IF)
                .meta(IrMetadata.CONDITION, "n = 0")
                .child(IrNode.block(List.of(output("\"zero\""))))
                .child(IrNode.block(List.of(output("\"negative\""))))
                .build();
        IrNode outer = IrNode.builder().kind(IrKind.IF)
                .meta(IrMetadata.CONDITION, "n > 0")
                .child(IrNode.block(List.of(output("\"positive\""))))
                .child(IrNode.block(List.of(inner)))
                .build();

        String expected = """
            IF n > 0 THEN
               OUTPUT "positive"
            ELSE IF n = 0 THEN
               OUTPUT "zero"
            ELSE
               OUTPUT "negative"
            ENDIF
            """;

        assertThat(generate(program(outer))).isEqualTo(expected);
    }

    @Test
    void testCaseLabelsAndBodies() {
        IrNode caseOf = IrNode.builder().kind(IrKind.CASE)
                .meta(IrMetadata.EXPRESSION, "day")
                .child(IrNode.builder().kind(IrKind.CASE_BRANCH)
                        .meta(IrMetadata.LABEL, "1")
                        .child(IrNode.block(List.of(output("\"Mon\""))))
                        .build())
                .child(IrNode.builder().kind(IrKind.OTHERWISE_BRANCH)
                        .child(IrNode.block(List.of(output("\"Other\""))))
                        .build())
                .build();

        String expected = """
            CASE OF day
            1:
               OUTPUT "Mon"
            OTHERWISE:
               OUTPUT "Other"
            ENDCASE
            """;

        assertThat(generate(program(caseOf))).isEqualTo(expected);
    }

    @Test
    void testCallablesAreSeparatedByBlankLines() {
        IrNode function = IrNode.builder().kind(IrKind.FUNCTION)
                .meta(IrMetadata.NAME, "square")
                .meta(IrMetadata.PARAMETERS, "n : INTEGER")
                .meta(IrMetadata.RETURN_TYPE, "INTEGER")
                .child(IrNode.block(List.of(IrNode.builder().kind(IrKind.RETURN)
                        .meta(IrMetadata.EXPRESSION, "n * n").build())))
                .build();
        IrNode procedure = IrNode.builder().kind(IrKind.PROCEDURE)
                .meta(IrMetadata.NAME, "hello")
                .child(IrNode.block(List.of(output("\"hi\""))))
                .build();

        String expected = """
            FUNCTION square(n : INTEGER) RETURNS INTEGER
               RETURN n * n
            ENDFUNCTION

            PROCEDURE hello()
               OUTPUT "hi"
            ENDPROCEDURE

            CALL hello()
            """;

        assertThat(generate(program(function, procedure, IrNode.text(IrKind.PROCEDURE_CALL, "hello()"))))
                .isEqualTo(expected);
    }

    @Test
    void testAnnotationsCanBeSwitchedOff() {
        IrNode annotated = IrNode.builder().kind(IrKind.OUTPUT)
                .meta(IrMetadata.EXPRESSION, "x")
                .annotation("Converted from printf")
                .build();
        IrNode recovery = IrNode.builder().kind(IrKind.ERROR_RECOVERY)
                .meta(IrMetadata.MESSAGE, "Could not convert statement on line 2: boom")
                .build();
        IrNode program = program(IrNode.comment(List.of("Main program")), annotated, recovery);

        assertThat(generate(program)).isEqualTo("""
            // Main program
            // Converted from printf
            OUTPUT x
            // ERROR: Could not convert statement on line 2: boom
            """);

        ConversionOptions quiet = ConversionOptions.builder().includeAnnotationComments(false).build();
        assertThat(new PseudocodeGenerator(quiet).generate(program)).isEqualTo("""
            OUTPUT x
            // ERROR: Could not convert statement on line 2: boom
            """);
    }

    @Test
    void testRepeatForAndConstant() {
        IrNode program = program(
                IrNode.builder().kind(IrKind.CONSTANT_DECLARATION)
                        .meta(IrMetadata.NAME, "MAX").meta(IrMetadata.VALUE, "10").build(),
                IrNode.builder().kind(IrKind.FOR)
                        .meta(IrMetadata.VARIABLE, "i")
                        .meta(IrMetadata.START, "10")
                        .meta(IrMetadata.END, "1")
                        .meta(IrMetadata.STEP, "-1")
                        .child(IrNode.block(List.of(
                                IrNode.builder().kind(IrKind.REPEAT_UNTIL)
                                        .meta(IrMetadata.CONDITION, "TRUE")
                                        .child(IrNode.block(List.of(IrNode.builder().kind(IrKind.INPUT)
                                                .meta(IrMetadata.TARGET, "x").build())))
                                        .build())))
                        .build());

        assertThat(generate(program)).isEqualTo("""
            CONSTANT MAX = 10
            FOR i ← 10 TO 1 STEP -1
               REPEAT
                  INPUT x
               UNTIL TRUE
            NEXT i
            """);
    }

    @Test
    void testEmptyProgramGivesEmptyText() {
        assertThat(generate(program())).isEmpty();
    }

    @Test
    void testIndentWidthIsConfigurable() {
        IrNode loop = IrNode.builder().kind(IrKind.WHILE)
                .meta(IrMetadata.CONDITION, "TRUE")
                .child(IrNode.block(List.of(output("1"))))
                .build();

        assertThat(new PseudocodeGenerator(ConversionOptions.builder().indentWidth(4).build())
                .generate(program(loop))).isEqualTo("WHILE TRUE DO\n    OUTPUT 1\nENDWHILE\n");

        PseudocodeGenerator flat = new PseudocodeGenerator(ConversionOptions.builder().indentWidth(0).build());
        assertThat(flat.generate(program(loop))).isEqualTo("WHILE TRUE DO\nOUTPUT 1\nENDWHILE\n");
        assertThat(flat.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.INVALID_CONFIGURATION);
    }

    @Test
    void testStrictModeNotesLongLines() {
        ConversionOptions strict = ConversionOptions.builder()
                .strictness(Strictness.STRICT)
                .maxLineLength(10)
                .build();
        PseudocodeGenerator generator = new PseudocodeGenerator(strict);

        generator.generate(program(output("\"a fairly long line\"")));

        assertThat(generator.getDiagnostics()).anyMatch(d -> d.getCode() == DiagnosticCode.LINE_TOO_LONG);
    }

    private static String generate(IrNode program) {
        return new PseudocodeGenerator(ConversionOptions.defaults()).generate(program);
    }

    private static IrNode program(IrNode... items) {
        return IrNode.builder().kind(IrKind.PROGRAM).children(List.of(items)).build();
    }

    private static IrNode output(String expression) {
        return IrNode.builder().kind(IrKind.OUTPUT).meta(IrMetadata.EXPRESSION, expression).build();
    }

    private static IrNode assignment(String target, String expression) {
        return IrNode.builder().kind(IrKind.ASSIGNMENT)
                .meta(IrMetadata.TARGET, target)
                .meta(IrMetadata.EXPRESSION, expression)
                .build();
    }
}
