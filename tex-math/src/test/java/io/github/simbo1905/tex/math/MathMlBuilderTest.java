package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class MathMlBuilderTest extends TexMathTestBase {

    private static final Settings INLINE = Settings.defaults().withOutput(OutputFormat.MATHML);
    private static final Settings DISPLAY = INLINE.withDisplayMode(true);

    @Test
    void decimalPointJoinsItsDigits() {
        assertThat(render("3.14", INLINE)).contains("<mn>3.14</mn>").doesNotContain("<mi");
    }

    @Test
    void bracedCommaJoinsItsDigits() {
        assertThat(render("1{,}5", INLINE)).contains("<mn>1,5</mn>");
    }

    @Test
    void bareCommaStaysPunctuation() {
        final String mathml = render("1,5", INLINE);
        assertThat(mathml).contains("<mn>1</mn>", "<mn>5</mn>", "separator=\"true\"");
    }

    @Test
    void digitRunMergesIntoFollowingSuperscriptBase() {
        assertThat(render("12^2", INLINE)).contains("<msup><mn>12</mn><mn>2</mn></msup>");
        assertThat(render("1.5_0", INLINE)).contains("<msub><mn>1.5</mn><mn>0</mn></msub>");
    }

    @Test
    void adjacentTextRunsWithTheSameVariantMerge() {
        assertThat(render("\\text{ab}", INLINE)).contains("<mtext>ab</mtext>");
        assertThat(render("\\text{a}\\text{b}", INLINE)).contains("<mtext>ab</mtext>");
    }

    @Test
    void textRunsWithDifferentVariantsStayApart() {
        assertThat(render("\\text{a}\\textbf{b}", INLINE))
            .contains("<mtext>a</mtext><mtext mathvariant=\"bold\">b</mtext>");
    }

    @ParameterizedTest
    @CsvSource({
        "'\\sum_i^n', munderover, msubsup",
        "'\\sum_i', munder, msub",
        "'\\sum^n', mover, msup"
    })
    void limitsOperatorsStackOnlyInDisplayStyle(String expression, String display, String inline) {
        assertThat(render(expression, DISPLAY)).contains("<" + display + ">").doesNotContain("<" + inline + ">");
        assertThat(render(expression, INLINE)).contains("<" + inline + ">").doesNotContain("<" + display + ">");
    }

    @Test
    void nolimitsKeepsScriptsBesideTheOperator() {
        assertThat(render("\\sum\\nolimits_i^n", DISPLAY)).contains("<msubsup>").doesNotContain("<munderover>");
        assertThat(render("\\sum\\nolimits^n", DISPLAY)).contains("<msup>").doesNotContain("<mover>");
    }

    @Test
    void plainBaseNeverStacks() {
        assertThat(render("x_i^n", DISPLAY)).contains("<msubsup><mi>x</mi><mi>i</mi><mi>n</mi></msubsup>");
    }
}
