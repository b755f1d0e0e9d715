package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// `\htmlClass`, `\htmlId`, `\htmlStyle` and `\htmlData`.
class HtmlExtensionTest extends TexMathTestBase {

    private static final Settings TRUSTED = Settings.defaults().withTrust(true).withOutput(OutputFormat.HTML);

    @Test
    void untrustedCommandsBecomePlaceholders() {
        for (final String expression : new String[]{"\\htmlClass{a}{x}", "\\htmlId{a}{x}",
            "\\htmlStyle{color:red}{x}", "\\htmlData{a=b}{x}"}) {
            assertThat(parse(expression)).as(expression).singleElement().isInstanceOf(ParseNode.Color.class);
        }
    }

    @Test
    void trustedCommandCarriesItsAttributes() {
        final var html = (ParseNode.Html) parse("\\htmlClass{foo}{x}", TRUSTED).get(0);
        assertThat(html.attributes()).containsExactly(Map.entry("class", "foo"));
        assertThat(html.body()).hasSize(1);
    }

    @Test
    void trustPolicySeesTheAttributes() {
        final Settings onlyOk = Settings.defaults().withTrust(context ->
            "\\htmlClass".equals(context.command()) && "ok".equals(context.attributes().get("class")));
        assertThat(parse("\\htmlClass{ok}{x}", onlyOk).get(0)).isInstanceOf(ParseNode.Html.class);
        assertThat(parse("\\htmlClass{bad}{x}", onlyOk).get(0)).isInstanceOf(ParseNode.Color.class);
        assertThat(parse("\\htmlId{ok}{x}", onlyOk).get(0)).isInstanceOf(ParseNode.Color.class);
        assertThat(onlyOk.isTrusted("\\htmlClass", Map.of("class", "ok"))).isTrue();
    }

    @Test
    void protocolPoliciesNeverTrustAttributeCommands() {
        final Settings https = Settings.defaults().withTrust(TrustPolicy.allowProtocols("https", "_relative"));
        assertThat(parse("\\htmlId{a}{x}", https).get(0)).isInstanceOf(ParseNode.Color.class);
    }

    @Test
    void classNamesFollowTheEnclosingClass() {
        assertThat(render("\\htmlClass{foo  bar}{x}", TRUSTED)).contains("<span class=\"enclosing foo bar\">");
    }

    @Test
    void idAndDataBecomeAttributes() {
        assertThat(render("\\htmlId{eq-1}{x}", TRUSTED)).contains("<span class=\"enclosing\" id=\"eq-1\">");
        assertThat(render("\\htmlData{foo=a, bar = b}{x}", TRUSTED))
            .contains("<span class=\"enclosing\" data-foo=\"a\" data-bar=\"b\">");
    }

    @Test
    void styleJoinsTheInlineStyle() {
        assertThat(render("\\htmlStyle{color: red; padding:1px}{x}", TRUSTED))
            .contains("<span class=\"enclosing\" style=\"color:red;padding:1px;\">");
    }

    @Test
    void attributeValuesAreEscaped() {
        assertThat(render("\\htmlId{a\"b}{x}", TRUSTED)).contains("id=\"a&quot;b\"");
    }

    @Test
    void malformedDataIsAParseError() {
        assertThatThrownBy(() -> parse("\\htmlData{foo}{x}", TRUSTED))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Error parsing key-value for \\htmlData");
        assertThatThrownBy(() -> parse("\\htmlData{a b=c}{x}", TRUSTED))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Invalid attribute name 'data-a b'");
    }

    @Test
    void strictErrorModeRejectsTheExtension() {
        assertThatThrownBy(() -> parse("\\htmlClass{foo}{x}", TRUSTED.withStrict(StrictMode.ERROR)))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("HTML extension is disabled on strict mode");
    }

    @Test
    void mathMlKeepsOnlyTheBody() {
        final String mathml = render("\\htmlClass{foo}{x}", TRUSTED.withOutput(OutputFormat.MATHML));
        assertThat(mathml).contains("<mi>x</mi>").doesNotContain("class=\"foo\"", "enclosing");
    }

    @Test
    void allowedInText() {
        assertThat(render("\\text{a \\htmlClass{foo}{b}}", TRUSTED)).contains("enclosing foo");
    }
}
