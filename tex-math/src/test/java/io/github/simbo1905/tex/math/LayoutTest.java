package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/// Box-tree measurements for fractions, radicals, delimiters and glue.
class LayoutTest extends TexMathTestBase {

    private static final Settings HTML_ONLY = Settings.defaults().withOutput(OutputFormat.HTML);

    static List<BoxNode> findAll(BoxNode root, String cssClass) {
        final List<BoxNode> found = new ArrayList<>();
        collect(root, cssClass, found);
        return found;
    }

    private static void collect(BoxNode node, String cssClass, List<BoxNode> found) {
        if (node.hasClass(cssClass)) {
            found.add(node);
        }
        for (final BoxNode child : node.children()) {
            collect(child, cssClass, found);
        }
    }

    static BoxNode find(BoxNode root, String cssClass) {
        final List<BoxNode> all = findAll(root, cssClass);
        assertThat(all).as("nodes with class %s", cssClass).isNotEmpty();
        return all.get(0);
    }

    private static BoxNode tree(String expression, Settings settings) {
        return TexMath.standard().renderToBoxTree(expression, settings);
    }

    @Test
    void fractionBarUsesDefaultRuleThickness() {
        final BoxNode line = find(tree("\\frac12", HTML_ONLY), "frac-line");
        assertThat(line.style("border-bottom-width")).isEqualTo("0.04em");
        assertThat(line.height()).isCloseTo(0.04, within(1e-9));
    }

    @Test
    void fractionBarHonoursMinRuleThickness() {
        final BoxNode line = find(tree("\\frac12", HTML_ONLY.withMinRuleThickness(0.1)), "frac-line");
        assertThat(line.style("border-bottom-width")).isEqualTo("0.1em");
        final BoxNode thin = find(tree("\\frac12", HTML_ONLY.withMinRuleThickness(0.01)), "frac-line");
        assertThat(thin.style("border-bottom-width")).isEqualTo("0.04em");
    }

    @Test
    void explicitBarSizeIsUsed() {
        final BoxNode line = find(tree("\\genfrac(){1pt}{}{a}{b}", HTML_ONLY), "frac-line");
        assertThat(line.style("border-bottom-width")).isEqualTo("0.1em");
    }

    @Test
    void binomHasNoBar() {
        assertThat(findAll(tree("\\binom12", HTML_ONLY), "frac-line")).isEmpty();
    }

    @Test
    void sqrtClearsItsBody() {
        final BoxNode sqrt = find(tree("\\sqrt{x}", HTML_ONLY), "sqrt");
        final double theta = 0.04;
        final double xHeight = 0.43056;
        // body height, clearance theta + theta/4, then the rule
        assertThat(sqrt.height()).isGreaterThanOrEqualTo(xHeight + theta + theta / 4 + theta - 1e-9);
    }

    @Test
    void displaySqrtClearsByQuarterXHeight() {
        final BoxNode sqrt = find(tree("\\sqrt{x}", HTML_ONLY.withDisplayMode(true)), "sqrt");
        assertThat(sqrt.height()).isGreaterThanOrEqualTo(0.43056 + 0.04 + 0.431 / 4 + 0.04 - 1e-9);
    }

    @Test
    void emptyLeftRightUsesSmallestDelimiter() {
        final Options options = Options.forSettings(Settings.defaults());
        final Delimiter.Candidate candidate = Delimiter.traverseSequence("(", 0.45,
            Delimiter.sequenceFor("("), options);
        assertThat(candidate).isEqualTo(new Delimiter.Small(Style.TEXT));
        final BoxNode.Span delim = Delimiter.leftRightDelim("(", 0, 0, options, Mode.MATH, List.of("mopen"));
        assertThat(delim.hasClass("mopen")).isTrue();
        assertThat(findAll(delim, "delimsizing")).isEmpty();
    }

    @Test
    void tallContentGetsLargerDelimiter() {
        final BoxNode small = find(tree("\\left(x\\right)", HTML_ONLY), "minner");
        assertThat(findAll(small, "delimsizing")).isEmpty();
        final BoxNode tall = find(tree("\\left(\\rule{1em}{2em}\\right)", HTML_ONLY), "minner");
        assertThat(findAll(tall, "delimsizing")).isNotEmpty();
    }

    @Test
    void veryTallContentGetsStackedDelimiter() {
        final BoxNode tall = find(tree("\\left(\\rule{1em}{8em}\\right)", HTML_ONLY), "minner");
        assertThat(findAll(tall, "mult")).isNotEmpty();
    }

    @Test
    void stackedDelimiterOvershootsByLessThanOneRepeat() {
        final Options options = Options.forSettings(Settings.defaults());
        final FontMetrics.CharacterMetrics repeat = FontMetrics.character("⎜", "Size4-Regular", Mode.MATH);
        final double repeatHeight = repeat.height() + repeat.depth();
        for (final double target : new double[]{3.1, 4.75, 6.0, 9.3}) {
            final BoxNode.Span delim = Delimiter.makeStackedDelim("(", target, false, options, Mode.MATH,
                List.of("mopen"));
            final double total = delim.height + delim.depth;
            assertThat(total).isGreaterThanOrEqualTo(target - 1e-6);
            assertThat(total).isLessThanOrEqualTo(target + repeatHeight + 1e-6);
        }
    }

    @Test
    void stackedBraceRepeatsEachHalf() {
        final Options options = Options.forSettings(Settings.defaults());
        final FontMetrics.CharacterMetrics repeat = FontMetrics.character("⎪", "Size4-Regular", Mode.MATH);
        final double repeatHeight = repeat.height() + repeat.depth();
        final BoxNode.Span delim = Delimiter.makeStackedDelim("\\{", 5.2, false, options, Mode.MATH,
            List.of("mopen"));
        final double total = delim.height + delim.depth;
        assertThat(total).isGreaterThanOrEqualTo(5.2 - 1e-6);
        assertThat(total).isLessThanOrEqualTo(5.2 + 2 * repeatHeight + 1e-6);
    }

    @Test
    void vcenterPutsTheBoxMidpointOnTheAxis() {
        final double axisHeight = Options.forSettings(Settings.defaults()).fontMetrics().axisHeight();
        for (final String expression : List.of("\\vcenter{\\rule{1em}{3em}}",
            "\\vcenter{\\rule[-2em]{1em}{2.5em}}", "\\vcenter{\\frac{1}{2}}")) {
            final BoxNode vlist = find(tree(expression, HTML_ONLY), "vlist-t");
            assertThat((vlist.height() - vlist.depth()) / 2).as(expression).isCloseTo(axisHeight, within(1e-9));
        }
        assertThat(render("\\vcenter{x}", Settings.defaults().withOutput(OutputFormat.MATHML)))
            .contains("<mpadded class=\"vcenter\"><mi>x</mi></mpadded>");
    }

    @Test
    void stackNeverDelimiterStopsAtLargestGlyph() {
        final Options options = Options.forSettings(Settings.defaults());
        final Delimiter.Candidate candidate = Delimiter.traverseSequence("\\langle", 100,
            Delimiter.sequenceFor("\\langle"), options);
        assertThat(candidate).isEqualTo(new Delimiter.Large(4));
    }

    @Test
    void bigSizesUseSizeFonts() {
        final String html = render("\\big( \\Big( \\bigg( \\Bigg(", HTML_ONLY);
        assertThat(html).contains("delimsizing size1", "delimsizing size2", "delimsizing size3",
            "delimsizing size4");
    }

    @Test
    void binaryOperatorGetsMediumSpace() {
        final String html = render("a+b", HTML_ONLY);
        assertThat(html).contains("class=\"mspace\" style=\"margin-right:0.2222em;\"");
    }

    @Test
    void relationGetsThickSpace() {
        final String html = render("a=b", HTML_ONLY);
        assertThat(html).contains("class=\"mspace\" style=\"margin-right:0.2778em;\"");
    }

    @Test
    void leadingBinaryBecomesOrdinary() {
        final BoxNode tree = tree("+a", HTML_ONLY);
        assertThat(findAll(tree, "mbin")).isEmpty();
        assertThat(findAll(tree, "mspace")).isEmpty();
    }

    @Test
    void scriptStyleDropsMediumSpace() {
        final BoxNode sup = tree("x^{a+b}", HTML_ONLY);
        assertThat(findAll(sup, "mspace")).isEmpty();
    }

    @Test
    void supSubShiftsAreLaidOutInAVList() {
        final BoxNode tree = tree("x^2_i", HTML_ONLY);
        assertThat(findAll(tree, "msupsub")).hasSize(1);
        assertThat(findAll(tree, "vlist-t2")).isNotEmpty();
    }

    @Test
    void displayOperatorUsesLargeGlyph() {
        final String display = render("\\sum", HTML_ONLY.withDisplayMode(true));
        final String inline = render("\\sum", HTML_ONLY);
        assertThat(display).contains("large-op");
        assertThat(inline).contains("small-op");
    }

    @Test
    void everyBaseHasAStrut() {
        final BoxNode tree = tree("a+b=c", HTML_ONLY);
        final List<BoxNode> bases = findAll(tree, "base");
        assertThat(bases).isNotEmpty();
        assertThat(bases).allSatisfy(base -> assertThat(base.children().get(0).hasClass("strut")).isTrue());
    }

    @Test
    void sizingCommandsUseSizeClasses() {
        final String html = render("\\Huge x", HTML_ONLY);
        assertThat(html).contains("sizing reset-size6 size11");
    }

    @Test
    void colourIsAppliedToGlyphs() {
        final String html = render("\\color{blue}x", HTML_ONLY);
        assertThat(html).contains("color:blue;");
    }
}
