package com.examboard.pseudocode.transform.mapping;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxAttributes;
import com.examboard.pseudocode.model.syntax.SyntaxKind;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.transform.types.PseudoType;

import static org.assertj.core.api.Assertions.*;

class StringMethodMapperTest {

    private static final ArgumentRenderer RENDERER = new ArgumentRenderer() {
        @Override
        public String value(SyntaxNode argument) {
            return argument.getValue();
        }

        @Override
        public String oneBased(SyntaxNode argument) {
            return IndexArithmetic.plusOne(argument.getValue());
        }
    };

    private Diagnostics diagnostics;
    private StringMethodMapper mapper;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        mapper = new StringMethodMapper(diagnostics);
    }

    @Test
    void testLengthOnString() {
        MappedCall call = map("s", PseudoType.STRING, "length").get();

        assertThat(call.getText()).isEqualTo("LENGTH(s)");
        assertThat(call.getType()).isEqualTo(PseudoType.INTEGER);
        assertThat(diagnostics.toList().get(0).getCode()).isEqualTo(DiagnosticCode.METHOD_MAPPING);
        assertThat(diagnostics.toList().get(0).getMessage()).isEqualTo("length converted to LENGTH");
    }

    @Test
    void testCharAtUsesOneBasedPosition() {
        MappedCall call = map("word", PseudoType.STRING, "charAt", integer("0")).get();

        assertThat(call.getText()).isEqualTo("SUBSTRING(word, 1, 1)");
        assertThat(call.getType()).isEqualTo(PseudoType.CHAR);
    }

    @Test
    void testSubstringConvertsEndToLength() {
        assertThat(map("s", PseudoType.STRING, "substring", integer("1"), integer("3")).get().getText())
                .isEqualTo("SUBSTRING(s, 2, 2)");
        assertThat(map("s", PseudoType.STRING, "substring", integer("2")).get().getText())
                .isEqualTo("SUBSTRING(s, 3, LENGTH(s) - 2)");
    }

    @Test
    void testIndexOfIsAdjusted() {
        MappedCall call = map("s", PseudoType.STRING, "indexOf", string("\"a\"")).get();

        assertThat(call.getText()).isEqualTo("FIND(s, \"a\") - 1");
        assertThat(diagnostics.toList().get(0).getMessage())
                .isEqualTo("indexOf converted to FIND - result adjusted for 0-based indexing");
    }

    @Test
    void testCaseConversionAndEquality() {
        assertThat(map("s", PseudoType.STRING, "toUpperCase").get().getText()).isEqualTo("UCASE(s)");
        assertThat(map("s", PseudoType.STRING, "toLowerCase").get().getText()).isEqualTo("LCASE(s)");
        assertThat(map("s", PseudoType.STRING, "equals", string("t")).get().getText()).isEqualTo("s = t");
    }

    @Test
    void testUnknownReceiverStillMapsStringMethods() {
        assertThat(map("name", null, "trim").get().getText()).isEqualTo("TRIM(name)");
    }

    @Test
    void testStringMethodsOnOtherTypesPassThrough() {
        assertThat(map("n", PseudoType.INTEGER, "charAt", integer("0"))).isEmpty();
        assertThat(diagnostics.toList()).isEmpty();
    }

    @Test
    void testUnmappedStringMethodIsReported() {
        assertThat(map("s", PseudoType.STRING, "repeat", integer("3"))).isEmpty();
        assertThat(diagnostics.hasCode(DiagnosticCode.NO_DIRECT_EQUIVALENT)).isTrue();
    }

    @Test
    void testArraySize() {
        PseudoType numbers = PseudoType.arrayOf(PseudoType.INTEGER, List.of("5"));

        assertThat(map("nums", numbers, "size").get().getText()).isEqualTo("LENGTH(nums)");
    }

    @Test
    void testMathCalls() {
        MappedCall round = mapper.mapStaticCall("Math", "round", List.of(string("x")), RENDERER, 1).get();

        assertThat(round.getText()).isEqualTo("ROUND(x, 0)");
        assertThat(diagnostics.toList().get(0).getMessage()).isEqualTo("Math.round converted to ROUND");
        assertThat(mapper.mapStaticCall("Math", "random", List.of(), RENDERER, 1).get().getText())
                .isEqualTo("RANDOM()");
        assertThat(mapper.mapStaticCall("Math", "sqrt", List.of(string("x")), RENDERER, 1)).isEmpty();
        assertThat(mapper.mapStaticCall("Helper", "round", List.of(string("x")), RENDERER, 1)).isEmpty();
    }

    private Optional<MappedCall> map(String receiver, PseudoType type, String method, SyntaxNode... args) {
        return mapper.mapInstanceCall(receiver, type, method, List.of(args), RENDERER, 1);
    }

    private static SyntaxNode integer(String value) {
        return SyntaxNode.builder()
                .kind(SyntaxKind.LITERAL)
                .value(value)
                .attribute(SyntaxAttributes.LITERAL_TYPE, SyntaxAttributes.LITERAL_INTEGER)
                .build();
    }

    private static SyntaxNode string(String text) {
        return SyntaxNode.builder().kind(SyntaxKind.IDENTIFIER).value(text).build();
    }
}
