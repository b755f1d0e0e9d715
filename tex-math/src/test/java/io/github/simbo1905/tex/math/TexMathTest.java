package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TexMathTest extends TexMathTestBase {

    private static final Settings DISPLAY = Settings.defaults().withDisplayMode(true);

    /// A caller-defined node with its own output.
    record Smiley(Mode mode, SourceLocation loc) implements ParseNode.ExtensionNode {
    }

    private static TexMath withSmiley() {
        return TexMath.builder()
            .defineMacro("\\RR", "\\mathbb{R}")
            .defineFunction(FunctionSpec.builder("smiley", "\\smiley")
                .handler((context, args, optArgs) -> new Smiley(context.mode(), context.loc())))
            .defineBuilders(Smiley.class,
                (group, options, html) -> BuildCommon.makeSpan(List.of("mord", "smiley"),
                    List.of(new BoxNode.Symbol("☺", 0.7, 0, 0, 0, 1, List.of())), options),
                (group, options, mathml) -> new MathDomNode.MathNode("mi",
                    List.of(new MathDomNode.TextNode("☺"))))
            .build();
    }

    @Test
    void defaultOutputCarriesMathmlAndHtml() {
        final String markup = render("x");
        assertThat(markup)
            .startsWith("<span class=\"katex\"><span class=\"katex-mathml\">"
                + "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">")
            .contains("<span class=\"katex-html\" aria-hidden=\"true\">")
            .endsWith("</span>");
    }

    @Test
    void mathmlKeepsTheSourceAsAnAnnotation() {
        final String markup = render("x^2");
        assertThat(markup)
            .contains("<msup><mi>x</mi><mn>2</mn></msup>")
            .contains("<annotation encoding=\"application/x-tex\">x^2</annotation>");
    }

    @Test
    void annotationIsEscaped() {
        assertThat(render("a<b")).contains(">a&lt;b</annotation>");
    }

    @Test
    void htmlOnlyAndMathmlOnlyOutputs() {
        final String html = render("x", Settings.defaults().withOutput(OutputFormat.HTML));
        assertThat(html).startsWith("<span class=\"katex\"><span class=\"katex-html\"").doesNotContain("<math");

        final String mathml = render("x", Settings.defaults().withOutput(OutputFormat.MATHML));
        assertThat(mathml).startsWith("<span class=\"katex\"><math").doesNotContain("katex-html")
            .doesNotContain("katex-mathml");
    }

    @Test
    void displayModeWrapsTheFormula() {
        assertThat(render("x", DISPLAY))
            .startsWith("<span class=\"katex-display\"><span class=\"katex\">")
            .contains("display=\"block\"");
        assertThat(render("x", DISPLAY.withLeqno(true).withFleqn(true)))
            .startsWith("<span class=\"katex-display leqno fleqn\">");
    }

    @Test
    void boxTreeIsWrappedInDisplayMode() {
        final BoxNode inline = TexMath.standard().renderToBoxTree("x", Settings.defaults());
        assertThat(inline.hasClass("katex")).isTrue();
        final BoxNode display = TexMath.standard().renderToBoxTree("x", DISPLAY.withLeqno(true));
        assertThat(display.hasClass("katex-display")).isTrue();
        assertThat(display.hasClass("leqno")).isTrue();
    }

    @Test
    void parseErrorsThrowByDefault() {
        assertThatThrownBy(() -> render("x^2^3"))
            .isInstanceOf(TexParseException.class)
            .hasMessageStartingWith("TeX parse error: Double superscript");
    }

    @Test
    void parseErrorsRenderInlineWhenNotThrowing() {
        final String markup = render("x^2^3",
            Settings.defaults().withThrowOnError(false).withErrorColor("#ff0000"));
        assertThat(markup)
            .startsWith("<span class=\"katex-error\" style=\"color:#ff0000;\" "
                + "title=\"TeX parse error: Double superscript at position 4")
            .endsWith("\">x^2^3</span>");
    }

    @Test
    void errorSourceIsEscaped() {
        final String markup = render("a<b^1^2", Settings.defaults().withThrowOnError(false));
        assertThat(markup).endsWith(">a&lt;b^1^2</span>");
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThatThrownBy(() -> TexMath.standard().renderToString(null, Settings.defaults()))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> TexMath.standard().renderToString("x", null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void tagWrapsTheWholeDisplayFormula() {
        final List<ParseNode> tree = parse("x\\tag{1}", DISPLAY);
        assertThat(tree).singleElement().isInstanceOf(ParseNode.Tag.class);
        final var tag = (ParseNode.Tag) tree.get(0);
        assertThat(tag.body()).singleElement().isInstanceOf(ParseNode.MathOrd.class);
        assertThat(tag.tag()).isNotEmpty();
        assertThat(render("x\\tag{1}", DISPLAY)).contains("class=\"tag\"");
    }

    @Test
    void starredTagIsLiteral() {
        assertThat(parse("x\\tag*{A}", DISPLAY)).singleElement().isInstanceOf(ParseNode.Tag.class);
    }

    @Test
    void tagNeedsDisplayMode() {
        assertThatThrownBy(() -> parse("x\\tag{1}"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("\\tag works only in display equations");
    }

    @Test
    void secondTagIsRejected() {
        assertThatThrownBy(() -> parse("x\\tag{1}\\tag{2}", DISPLAY))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Multiple \\tag");
    }

    @Test
    void settingsMacrosExpand() {
        final List<ParseNode> tree = parse("\\half", Settings.defaults().withMacro("\\half", "\\frac12"));
        assertThat(tree).singleElement().extracting(ParseNode::type).isEqualTo("genfrac");
    }

    @Test
    void builderAddsMacrosAndFunctions() {
        final TexMath tex = withSmiley();
        assertThat(tex.parse("\\RR", Settings.defaults())).singleElement()
            .isInstanceOf(ParseNode.Font.class);
        assertThat(tex.parse("\\smiley", Settings.defaults())).singleElement().isInstanceOf(Smiley.class);

        final String markup = tex.renderToString("a\\smiley");
        assertThat(markup).contains("class=\"mord smiley\"").contains("<mi>☺</mi>");
    }

    @Test
    void builderDoesNotChangeTheStandardRenderer() {
        withSmiley();
        assertThatThrownBy(() -> render("\\smiley"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Undefined control sequence: \\smiley");
    }

    @Test
    void duplicateFunctionIsRejected() {
        assertThatThrownBy(() -> TexMath.builder().defineFunction(FunctionSpec.builder("ord", "\\frac")
            .handler((context, args, optArgs) -> null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("\\frac");
    }
}
