package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UnitsTest extends TexMathTestBase {

    private static final Options TEXT = Options.forSettings(Settings.defaults());

    @ParameterizedTest
    @CsvSource({
        "10, pt, 1.0",
        "18, mu, 1.0",
        "2,  em, 2.0",
        "1,  ex, 0.431",
        "1,  pc, 1.2",
        "1,  in, 7.227"
    })
    void convertsToEmAtTextSize(double number, String unit, double expected) {
        assertThat(Units.calculateSize(new Measurement(number, unit), TEXT)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void emInScriptStyleIsMeasuredAgainstTheTextFont() {
        final Options script = TEXT.havingStyle(Style.SCRIPT);
        assertThat(script.sizeMultiplier()).isEqualTo(0.7);
        assertThat(Units.calculateSize(Measurement.em(1), script)).isCloseTo(1 / 0.7, within(1e-9));
    }

    @Test
    void absoluteUnitsScaleWithSize() {
        final Options large = TEXT.havingSize(11);
        assertThat(Units.calculateSize(new Measurement(10, "pt"), large)).isCloseTo(1 / 2.488, within(1e-9));
    }

    @Test
    void resultIsCappedAtMaxSize() {
        final Options capped = Options.forSettings(Settings.defaults().withMaxSize(3));
        assertThat(Units.calculateSize(Measurement.em(50), capped)).isEqualTo(3.0);
    }

    @Test
    void unknownUnitIsRejected() {
        assertThat(Units.validUnit("zz")).isFalse();
        assertThat(Units.validUnit("mu")).isTrue();
        assertThatThrownBy(() -> Units.calculateSize(new Measurement(1, "zz"), TEXT))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Invalid unit: 'zz'");
    }

    @ParameterizedTest
    @CsvSource({
        "0.25,      0.25em",
        "2.0,       2em",
        "0.333333,  0.3333em",
        "0.27777,   0.2778em",
        "-0.00001,  0em",
        "-1.5,      -1.5em"
    })
    void makeEmRoundsToFourDecimals(double value, String expected) {
        assertThat(Units.makeEm(value)).isEqualTo(expected);
    }
}
