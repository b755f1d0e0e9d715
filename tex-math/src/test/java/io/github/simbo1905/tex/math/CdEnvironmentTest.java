package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CdEnvironmentTest extends TexMathTestBase {

    private static final Settings DISPLAY = Settings.defaults().withDisplayMode(true);

    private static final String SQUARE =
        "\\begin{CD} A @>a>> B \\\\ @VbVV @AAcA \\\\ C @= D \\end{CD}";

    @Test
    void diagramIsAnArrayOfObjectsAndArrows() {
        final ParseNode node = parse(SQUARE, DISPLAY).get(0);
        assertThat(node).isInstanceOf(ParseNode.Array.class);
        final var table = (ParseNode.Array) node;
        assertThat(table.colSeparationType()).isEqualTo("CD");
        assertThat(table.cols()).hasSize(3).containsOnly(new ParseNode.Align("c", 0.25, 0.25));
        assertThat(table.body().get(0)).hasSize(3);
        assertThat(table.body().get(1)).hasSize(3);
        assertThat(table.body().get(2)).hasSize(3);
    }

    @Test
    void verticalArrowsCarryTheirLabels() {
        final var table = (ParseNode.Array) parse(SQUARE, DISPLAY).get(0);
        final var down = (ParseNode.Styling) table.body().get(1).get(0);
        assertThat(down.style()).isEqualTo(Style.DISPLAY);
        assertThat(down.body()).singleElement().isInstanceOf(ParseNode.CdLabelParent.class);
        final var parent = (ParseNode.CdLabelParent) down.body().get(0);
        final var parts = (ParseNode.OrdGroup) parent.fragment();
        assertThat(parts.body()).hasSize(3);
        assertThat(((ParseNode.CdLabel) parts.body().get(0)).side()).isEqualTo("left");
        assertThat(((ParseNode.CdLabel) parts.body().get(2)).side()).isEqualTo("right");
    }

    @Test
    void objectCellsAreDisplayStyle() {
        final var table = (ParseNode.Array) parse(SQUARE, DISPLAY).get(0);
        final var first = (ParseNode.Styling) table.body().get(0).get(0);
        assertThat(first.style()).isEqualTo(Style.DISPLAY);
        assertThat(first.body()).singleElement().isInstanceOf(ParseNode.MathOrd.class);
    }

    @Test
    void diagramNeedsDisplayMode() {
        assertThatThrownBy(() -> parse(SQUARE))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("{CD} can be used only in display mode.");
    }

    @Test
    void unterminatedLabelIsReported() {
        assertThatThrownBy(() -> parse("\\begin{CD} A @>a B \\end{CD}", DISPLAY))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Missing a > character to complete a CD arrow.");
    }

    @Test
    void unknownArrowIsReported() {
        assertThatThrownBy(() -> parse("\\begin{CD} A @X B \\end{CD}", DISPLAY))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Expected one of \"<>AV=|.\" after @");
    }

    @Test
    void diagramRendersCentredArrows() {
        final String markup = render(SQUARE, DISPLAY);
        assertThat(markup).contains("cd-vert-arrow").contains("<mtable");
    }
}
