package com.examboard.pseudocode.parser;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.Language;
import com.examboard.pseudocode.parser.SourceToken.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SourceTokenizerTest {

    @Test
    void testTokenizeSimpleStatement() {
        Diagnostics diagnostics = new Diagnostics();
        List<SourceToken> tokens = new SourceTokenizer("int x = 42;", Language.JAVA, diagnostics).tokenize();

        assertThat(tokens).extracting(SourceToken::getValue).containsExactly("int", "x", "=", "42", ";", "");
        assertThat(tokens).extracting(SourceToken::getType).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER_LITERAL,
                TokenType.PUNCTUATION, TokenType.EOF);
        assertThat(diagnostics.toList()).isEmpty();
    }

    @Test
    void testLongestOperatorWins() {
        List<SourceToken> tokens = tokenize("a >>>= b === c", Language.TYPESCRIPT);

        assertThat(tokens).extracting(SourceToken::getValue).contains(">>>=", "===");
    }

    @Test
    void testCommentsAreSkippedAndPositionsTracked() {
        String source = """
            // leading comment
            /* block
               comment */ int y;
            """;

        List<SourceToken> tokens = tokenize(source, Language.JAVA);

        SourceToken first = tokens.get(0);
        assertThat(first.getValue()).isEqualTo("int");
        assertThat(first.getLine()).isEqualTo(3);
        assertThat(first.getColumn()).isEqualTo(15);
    }

    @Test
    void testSingleQuotesDifferByLanguage() {
        assertThat(tokenize("'a'", Language.JAVA).get(0).getType()).isEqualTo(TokenType.CHAR_LITERAL);
        assertThat(tokenize("'abc'", Language.TYPESCRIPT).get(0).getType()).isEqualTo(TokenType.STRING_LITERAL);
    }

    @Test
    void testTemplateLiteralKeepsInterpolation() {
        SourceToken token = tokenize("`Hi ${name}!`", Language.TYPESCRIPT).get(0);

        assertThat(token.getType()).isEqualTo(TokenType.TEMPLATE_LITERAL);
        assertThat(token.getValue()).isEqualTo("Hi ${name}!");
    }

    @Test
    void testLiteralKeywords() {
        List<SourceToken> tokens = tokenize("true null undefined", Language.TYPESCRIPT);

        assertThat(tokens).extracting(SourceToken::getType).startsWith(
                TokenType.BOOLEAN_LITERAL, TokenType.NULL_LITERAL, TokenType.NULL_LITERAL);
    }

    @Test
    void testNumberSuffixesAndHex() {
        List<SourceToken> tokens = tokenize("10L 0xFF 1.5e3 2.0f", Language.JAVA);

        assertThat(tokens).extracting(SourceToken::getValue).startsWith("10L", "0xFF", "1.5e3", "2.0f");
    }

    @Test
    void testUnterminatedStringIsReported() {
        Diagnostics diagnostics = new Diagnostics();
        new SourceTokenizer("String s = \"open;\nint x;", Language.JAVA, diagnostics).tokenize();

        assertThat(diagnostics.hasCode(DiagnosticCode.STRUCTURAL_ERROR)).isTrue();
        assertThat(diagnostics.toList().get(0).getMessage()).contains("Unterminated string literal on line 1");
    }

    @Test
    void testUnterminatedStringStopsAtLineEnd() {
        List<SourceToken> tokens = tokenize("s = \"open;\nint x;", Language.JAVA);

        SourceToken literal = tokens.get(2);
        assertThat(literal.getValue()).isEqualTo("open;");
        assertThat(literal.isUnterminated()).isTrue();
        assertThat(tokens.get(3).getValue()).isEqualTo("int");
        assertThat(tokens.get(3).isUnterminated()).isFalse();
    }

    @Test
    void testUnterminatedBlockCommentIsReported() {
        Diagnostics diagnostics = new Diagnostics();
        new SourceTokenizer("int x; /* never closed", Language.JAVA, diagnostics).tokenize();

        assertThat(diagnostics.hasErrors()).isTrue();
    }

    private static List<SourceToken> tokenize(String source, Language language) {
        return new SourceTokenizer(source, language, new Diagnostics()).tokenize();
    }
}
