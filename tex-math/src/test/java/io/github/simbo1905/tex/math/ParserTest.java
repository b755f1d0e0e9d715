package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest extends TexMathTestBase {

    private static ParseNode only(String expression) {
        final List<ParseNode> nodes = parse(expression);
        assertThat(nodes).hasSize(1);
        return nodes.get(0);
    }

    private static String text(ParseNode node) {
        return ((ParseNode.SymbolNode) node).text();
    }

    @Test
    void superscriptAndSubscriptInEitherOrder() {
        final var first = (ParseNode.SupSub) only("x^2_i");
        final var second = (ParseNode.SupSub) only("x_i^2");
        for (final ParseNode.SupSub supsub : List.of(first, second)) {
            assertThat(text(supsub.base())).isEqualTo("x");
            assertThat(text(supsub.sup())).isEqualTo("2");
            assertThat(text(supsub.sub())).isEqualTo("i");
        }
    }

    @Test
    void doubleSuperscriptIsRejectedAtSecondCaret() {
        assertThatThrownBy(() -> parse("x^2^3"))
            .isInstanceOf(TexParseException.class)
            .satisfies(e -> {
                final var ex = (TexParseException) e;
                assertThat(ex.rawMessage()).isEqualTo("Double superscript");
                assertThat(ex.position()).isEqualTo(3);
                assertThat(ex.getMessage()).isEqualTo("TeX parse error: Double superscript at position 4: x^2^̲3");
            });
    }

    @Test
    void doubleSubscriptIsRejected() {
        assertThatThrownBy(() -> parse("x_1_2"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Double subscript");
    }

    @Test
    void primeIsASuperscript() {
        final var supsub = (ParseNode.SupSub) only("f''");
        final var primes = (ParseNode.OrdGroup) supsub.sup();
        assertThat(primes.body()).hasSize(2).allSatisfy(p -> assertThat(text(p)).isEqualTo("\\prime"));
        assertThatThrownBy(() -> parse("f^2'"))
            .hasMessageContaining("Double superscript");
    }

    @Test
    void unicodeSuperscriptBecomesScript() {
        final var supsub = (ParseNode.SupSub) only("x²");
        assertThat(supsub.sup()).isInstanceOf(ParseNode.OrdGroup.class);
        assertThat(((ParseNode.OrdGroup) supsub.sup()).body()).extracting(ParserTest::text).containsExactly("2");
    }

    @Test
    void unicodeScriptCannotRepeatAnExplicitScript() {
        assertThatThrownBy(() -> parse("x^3²"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Double superscript");
        assertThatThrownBy(() -> parse("x_3₂"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Double subscript");
    }

    @Test
    void unicodeScriptsOfBothKindsCombine() {
        final var supsub = (ParseNode.SupSub) only("x²₃");
        assertThat(((ParseNode.OrdGroup) supsub.sup()).body()).extracting(ParserTest::text).containsExactly("2");
        assertThat(((ParseNode.OrdGroup) supsub.sub()).body()).extracting(ParserTest::text).containsExactly("3");
        assertThat(parse("x_3²")).singleElement().isInstanceOf(ParseNode.SupSub.class);
    }

    @Test
    void missingScriptGroup() {
        assertThatThrownBy(() -> parse("x^"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Expected group after '^'");
    }

    @Test
    void unbalancedBraces() {
        assertThatThrownBy(() -> parse("{a"))
            .hasMessageContaining("Expected '}'");
        assertThatThrownBy(() -> parse("a}"))
            .hasMessageContaining("Expected 'EOF', got '}'");
    }

    @Test
    void fractionArgumentsAreGroups() {
        final var frac = (ParseNode.Genfrac) only("\\frac12");
        assertThat(frac.hasBarLine()).isTrue();
        assertThat(((ParseNode.OrdGroup) frac.numer()).body()).extracting(ParserTest::text).containsExactly("1");
        assertThat(((ParseNode.OrdGroup) frac.denom()).body()).extracting(ParserTest::text).containsExactly("2");
    }

    @Test
    void binomHasDelimitersAndNoBar() {
        final var binom = (ParseNode.Genfrac) only("\\binom{n}{k}");
        assertThat(binom.hasBarLine()).isFalse();
        assertThat(binom.leftDelim()).isEqualTo("(");
        assertThat(binom.rightDelim()).isEqualTo(")");
    }

    @Test
    void infixOverSplitsItsGroup() {
        final var frac = (ParseNode.Genfrac) only("a+b \\over c");
        assertThat(((ParseNode.OrdGroup) frac.numer()).body()).hasSize(2);
        assertThat(((ParseNode.OrdGroup) frac.denom()).body()).hasSize(1);
        assertThatThrownBy(() -> parse("a \\over b \\over c"))
            .hasMessageContaining("only one infix operator per group");
    }

    @Test
    void infixOverStaysInsideBraces() {
        final List<ParseNode> nodes = parse("x{a \\over b}");
        assertThat(nodes).hasSize(2);
        assertThat(((ParseNode.OrdGroup) nodes.get(1)).body().get(0)).isInstanceOf(ParseNode.Genfrac.class);
    }

    @Test
    void undefinedControlSequenceFailsWhenThrowing() {
        assertThatThrownBy(() -> parse("\\nosuch"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Undefined control sequence: \\nosuch");
    }

    @Test
    void undefinedControlSequenceBecomesColouredText() {
        final List<ParseNode> nodes = parse("\\nosuch", Settings.defaults().withThrowOnError(false));
        final var color = (ParseNode.Color) nodes.get(0);
        assertThat(color.color()).isEqualTo("#cc0000");
        final var text = (ParseNode.Text) color.body().get(0);
        assertThat(text.body()).extracting(ParserTest::text).containsExactly("\\", "n", "o", "s", "u", "c", "h");
    }

    @Test
    void textModeFormsDashLigatures() {
        final var text = (ParseNode.Text) only("\\text{a--b---c}");
        assertThat(text.body()).extracting(ParserTest::text).containsExactly("a", "--", "b", "---", "c");
    }

    @Test
    void mathOnlyFunctionInTextIsRejected() {
        assertThatThrownBy(() -> parse("\\text{\\frac12}"))
            .hasMessageContaining("Can't use function '\\frac' in text mode");
    }

    @Test
    void limitsAttachToOperators() {
        final var supsub = (ParseNode.SupSub) only("\\sum\\limits_1^n");
        assertThat(((ParseNode.Op) supsub.base()).limits()).isTrue();
        final var nolimits = (ParseNode.SupSub) only("\\sum\\nolimits_1^n");
        assertThat(((ParseNode.Op) nolimits.base()).limits()).isFalse();
        assertThatThrownBy(() -> parse("x\\limits"))
            .hasMessageContaining("Limit controls must follow a math operator");
    }

    @Test
    void leftRightPairsDelimiters() {
        final var leftRight = (ParseNode.LeftRight) only("\\left( x \\middle| y \\right)");
        assertThat(leftRight.left()).isEqualTo("(");
        assertThat(leftRight.right()).isEqualTo(")");
        assertThat(leftRight.body()).hasSize(3);
    }

    @Test
    void leftRightMisuse() {
        assertThatThrownBy(() -> parse("\\left( x"))
            .isInstanceOf(TexParseException.class);
        assertThatThrownBy(() -> parse("\\middle|"))
            .hasMessageContaining("\\middle without preceding \\left");
        assertThatThrownBy(() -> parse("\\left x \\right)"))
            .hasMessageContaining("Invalid delimiter");
    }

    @Test
    void environmentsMustMatch() {
        assertThatThrownBy(() -> parse("\\begin{matrix}a\\end{pmatrix}"))
            .hasMessageContaining("Mismatch: \\begin{matrix} matched by \\end{pmatrix}");
        assertThatThrownBy(() -> parse("\\begin{nosuch}a\\end{nosuch}"))
            .hasMessageContaining("No such environment: nosuch");
    }

    @Test
    void verbKeepsItsTextVerbatim() {
        final var verb = (ParseNode.Verb) only("\\verb|\\frac{a}|");
        assertThat(verb.body()).isEqualTo("\\frac{a}");
        assertThat(verb.star()).isFalse();
    }

    @Test
    void sqrtWithIndex() {
        final var sqrt = (ParseNode.Sqrt) only("\\sqrt[3]{x}");
        assertThat(sqrt.index()).isNotNull();
        assertThat(((ParseNode.Sqrt) only("\\sqrt x")).index()).isNull();
    }

    @Test
    void deepNestingIsAParseError() {
        final String deep = "{".repeat(Parser.MAX_NESTING + 10) + "x" + "}".repeat(Parser.MAX_NESTING + 10);
        assertThatThrownBy(() -> parse(deep))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Too deeply nested");
    }

    @Test
    void errorsCarryContextWindows() {
        final String input = "abcdefghijklmnopqrstuvwxyz\\nosuch abcdefghijklmnopqrstuvwxyz";
        assertThatThrownBy(() -> parse(input))
            .satisfies(e -> {
                final var ex = (TexParseException) e;
                assertThat(ex.position()).isEqualTo(26);
                assertThat(ex.getMessage()).contains("…lmnopqrstuvwxyz\\̲");
                assertThat(ex.getMessage()).endsWith("…");
            });
    }

    @Test
    void errorAtEndOfInput() {
        assertThatThrownBy(() -> parse("\\frac1"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("at end of input");
    }

    @ParameterizedTest
    @CsvSource({
        "\\displaystyle x, styling",
        "\\color{red} x, color",
        "\\mathbf{x}, font",
        "\\overline{x}, overline",
        "\\hat{x}, accent",
        "\\xrightarrow{f}, xarrow",
        "\\kern1em, kern",
        "\\rule{1em}{2em}, rule",
        "\\phantom{x}, phantom",
        "\\fbox{x}, enclose",
        "\\underbrace{x}, horizbrace",
        "\\mathrel{x}, mclass",
        "\\big(, delimsizing",
        "\\operatorname{sn}, operatorname",
        "\\raisebox{1em}{x}, raisebox",
        "\\smash{x}, smash",
        "\\mathchoice{a}{b}{c}{d}, mathchoice"
    })
    void commandFamiliesProduceTheirNodes(String expression, String type) {
        final List<ParseNode> nodes = parse(expression);
        assertThat(nodes).isNotEmpty();
        assertThat(nodes.get(0).type()).isEqualTo(type);
    }
}
