package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest extends TexMathTestBase {

    private static List<String> texts(String input) {
        final var lexer = new Lexer(input, Settings.defaults());
        final List<String> out = new ArrayList<>();
        Token token = lexer.lex();
        while (!token.isEof()) {
            out.add(token.text());
            token = lexer.lex();
        }
        return out;
    }

    @Test
    void controlWordSwallowsFollowingWhitespace() {
        assertThat(texts("\\alpha  x")).containsExactly("\\alpha", "x");
    }

    @Test
    void whitespaceRunBecomesSingleSpace() {
        assertThat(texts("a \t\n b")).containsExactly("a", " ", "b");
    }

    @Test
    void controlSymbolIsTwoCharacters() {
        assertThat(texts("\\{\\,")).containsExactly("\\{", "\\,");
    }

    @Test
    void controlSpaceTakesAtMostOneNewline() {
        assertThat(texts("a\\ \nb")).containsExactly("a", "\\ ", "b");
        assertThat(texts("a\\\n\nb")).containsExactly("a", "\\ ", " ", "b");
    }

    @Test
    void atSignIsPartOfControlWord() {
        assertThat(texts("\\df@tag")).containsExactly("\\df@tag");
    }

    @Test
    void verbIsOneToken() {
        assertThat(texts("\\verb|a b|c")).containsExactly("\\verb|a b|", "c");
        assertThat(texts("\\verb*!x!")).containsExactly("\\verb*!x!");
    }

    @Test
    void combiningMarksStayWithTheirBase() {
        assertThat(texts("e\u0301x")).containsExactly("e\u0301", "x");
    }

    @Test
    void surrogatePairIsOneToken() {
        assertThat(texts("𝐀")).containsExactly("𝐀");
    }

    @Test
    void commentRunsToEndOfLine() {
        assertThat(texts("a%hidden\nb")).containsExactly("a", "b");
    }

    @Test
    void eofIsRepeatedWithEmptySpanAtEnd() {
        final var lexer = new Lexer("x", Settings.defaults());
        lexer.lex();
        final Token eof = lexer.lex();
        assertThat(eof.isEof()).isTrue();
        assertThat(eof.loc().start()).isEqualTo(1);
        assertThat(eof.loc().end()).isEqualTo(1);
        assertThat(lexer.lex().isEof()).isTrue();
    }

    @Test
    void tokenSpansPointIntoTheInput() {
        final var lexer = new Lexer("ab\\beta", Settings.defaults());
        lexer.lex();
        lexer.lex();
        final Token beta = lexer.lex();
        assertThat(beta.loc().start()).isEqualTo(2);
        assertThat(beta.loc().end()).isEqualTo(7);
        assertThat(beta.loc().text()).isEqualTo("\\beta");
    }

    @Test
    void loneSurrogateIsRejectedAtItsOffset() {
        assertThatThrownBy(() -> texts("ab\uD835"))
            .isInstanceOf(LexException.class)
            .satisfies(e -> assertThat(((LexException) e).position()).isEqualTo(2));
    }

    @Test
    void trailingBackslashIsRejected() {
        assertThatThrownBy(() -> texts("x\\"))
            .isInstanceOf(LexException.class)
            .hasMessageContaining("Unexpected character");
    }

    @Test
    void activeAndCommentCatcodesAreSetByDefault() {
        final var lexer = new Lexer("", Settings.defaults());
        assertThat(lexer.catcode("~")).isEqualTo(Lexer.CATCODE_ACTIVE);
        assertThat(lexer.catcode("%")).isEqualTo(Lexer.CATCODE_COMMENT);
        assertThat(lexer.catcode("x")).isEqualTo(-1);
    }
}
