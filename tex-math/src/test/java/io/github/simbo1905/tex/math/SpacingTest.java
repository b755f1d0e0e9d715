package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpacingTest extends TexMathTestBase {

    @Test
    void normalTableGivesThinMediumAndThickSpaces() {
        assertThat(Spacing.between("mord", "mop", false)).isEqualTo(Spacing.THIN);
        assertThat(Spacing.between("mord", "mbin", false)).isEqualTo(Spacing.MEDIUM);
        assertThat(Spacing.between("mord", "mrel", false)).isEqualTo(Spacing.THICK);
        assertThat(Spacing.between("mpunct", "mord", false)).isEqualTo(Spacing.THIN);
    }

    @Test
    void noSpaceBetweenOrdinaryAtomsOrAfterOpen() {
        assertThat(Spacing.between("mord", "mord", false)).isNull();
        assertThat(Spacing.between("mopen", "mord", false)).isNull();
        assertThat(Spacing.between("mord", "mclose", false)).isNull();
    }

    @Test
    void tightTableKeepsOnlyOperatorSpaces() {
        assertThat(Spacing.between("mord", "mbin", true)).isNull();
        assertThat(Spacing.between("mord", "mrel", true)).isNull();
        assertThat(Spacing.between("mord", "mop", true)).isEqualTo(Spacing.THIN);
        assertThat(Spacing.between("mop", "mop", true)).isEqualTo(Spacing.THIN);
    }

    @Test
    void unknownClassesHaveNoSpace() {
        assertThat(Spacing.between("mspace", "mord", false)).isNull();
        assertThat(Spacing.between("mord", "nonsense", false)).isNull();
    }

    @Test
    void scriptStylesUseTheTightTable() {
        final Options text = Options.forSettings(Settings.defaults());
        assertThat(Spacing.useTight(text)).isFalse();
        assertThat(Spacing.useTight(text.havingCrampedStyle())).isFalse();
        assertThat(Spacing.useTight(text.havingStyle(Style.SCRIPT))).isTrue();
        assertThat(Spacing.useTight(text.havingStyle(Style.SCRIPTSCRIPT_CRAMPED))).isTrue();
    }

    @Test
    void spacesAreMathUnits() {
        assertThat(Spacing.THIN).isEqualTo(Measurement.mu(3));
        assertThat(Spacing.MEDIUM).isEqualTo(Measurement.mu(4));
        assertThat(Spacing.THICK).isEqualTo(Measurement.mu(5));
    }
}
