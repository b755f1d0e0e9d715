package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsTest extends TexMathTestBase {

    @Test
    void defaultsMatchAPlainRender() {
        final Settings settings = Settings.defaults();
        assertThat(settings.displayMode()).isFalse();
        assertThat(settings.output()).isEqualTo(OutputFormat.HTML_AND_MATHML);
        assertThat(settings.throwOnError()).isTrue();
        assertThat(settings.errorColor()).isEqualTo("#cc0000");
        assertThat(settings.maxExpand()).isEqualTo(Settings.DEFAULT_MAX_EXPAND);
        assertThat(settings.maxSize()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(settings.minRuleThickness()).isZero();
    }

    @Test
    void negativeSizesAreClampedToZero() {
        assertThat(Settings.defaults().withMinRuleThickness(-1).minRuleThickness()).isZero();
        assertThat(Settings.defaults().withMaxSize(-5).maxSize()).isZero();
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> Settings.defaults().withMaxExpand(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Settings.defaults().withMinRuleThickness(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Settings.defaults().withErrorColor(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void withCopiesLeaveTheOriginalAlone() {
        final Settings base = Settings.defaults();
        final Settings display = base.withDisplayMode(true).withLeqno(true);
        assertThat(base.displayMode()).isFalse();
        assertThat(display.displayMode()).isTrue();
        assertThat(display.leqno()).isTrue();
    }

    @Test
    void macroMapIsCopied() {
        final var macros = new java.util.HashMap<String, MacroDefinition>();
        macros.put("\\a", MacroDefinition.text("x"));
        final Settings settings = Settings.defaults().withMacros(macros);
        macros.put("\\b", MacroDefinition.text("y"));
        assertThat(settings.macros()).containsOnlyKeys("\\a");
    }

    @Test
    void strictIgnoreAcceptsSilently() {
        assertThat(parse("x%comment")).hasSize(1);
    }

    @Test
    void strictErrorRejectsIncompatibleInput() {
        final Settings settings = Settings.defaults().withStrict(StrictMode.ERROR);
        assertThatThrownBy(() -> parse("x%comment", settings))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("strict mode is 'error'")
            .hasMessageContaining("[commentAtEnd]");
    }

    @Test
    void strictWarnStillRenders() {
        final Settings settings = Settings.defaults().withStrict(StrictMode.WARN);
        assertThat(parse("x%comment", settings)).hasSize(1);
    }

    @Test
    void strictCallbackDecidesPerCode() {
        final List<String> seen = new ArrayList<>();
        final StrictPolicy policy = (code, message, token) -> {
            seen.add(code);
            return "commentAtEnd".equals(code) ? StrictMode.IGNORE : StrictMode.ERROR;
        };
        final Settings settings = Settings.defaults().withStrict(policy);
        assertThat(parse("x%comment", settings)).hasSize(1);
        assertThat(seen).containsExactly("commentAtEnd");
        assertThatThrownBy(() -> parse("\\kern1mu", settings))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("[mathVsTextUnits]");
        assertThat(seen).containsExactly("commentAtEnd", "mathVsTextUnits");
    }

    @Test
    void nullFromCallbackMeansWarn() {
        final Settings settings = Settings.defaults().withStrict((code, message, token) -> null);
        assertThat(settings.useStrictBehavior("any", "message", null)).isFalse();
    }

    @Test
    void failingCallbackCountsAsStrict() {
        final Settings settings = Settings.defaults().withStrict((code, message, token) -> {
            throw new IllegalStateException("boom");
        });
        assertThat(settings.useStrictBehavior("any", "message", null)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "https://example.com, https",
        "HTTP://example.com, http",
        "mailto:me@example.com, mailto",
        "relative/path, _relative",
        "#anchor, _relative",
        "  javascript:alert(1), javascript"
    })
    void protocolIsExtractedFromUrl(String url, String protocol) {
        assertThat(Settings.protocolFromUrl(url)).isEqualTo(protocol);
    }

    @Test
    void entityEncodedOrMalformedSchemeIsNotTrusted() {
        assertThat(Settings.protocolFromUrl("javascript&colon;alert(1)")).isNull();
        assertThat(Settings.protocolFromUrl("1http://x")).isNull();
        final Settings all = Settings.defaults().withTrust(true);
        assertThat(all.isTrusted("\\href", "javascript&#58;alert(1)")).isFalse();
    }

    @Test
    void trustPolicies() {
        assertThat(Settings.defaults().isTrusted("\\href", "https://example.com")).isFalse();
        assertThat(Settings.defaults().withTrust(true).isTrusted("\\href", "https://example.com")).isTrue();
        final Settings onlyHttps = Settings.defaults().withTrust(TrustPolicy.allowProtocols("https"));
        assertThat(onlyHttps.isTrusted("\\url", "https://example.com")).isTrue();
        assertThat(onlyHttps.isTrusted("\\url", "http://example.com")).isFalse();
        final Settings byCommand = Settings.defaults().withTrust(context -> "\\url".equals(context.command()));
        assertThat(byCommand.isTrusted("\\url", "x")).isTrue();
        assertThat(byCommand.isTrusted("\\href", "x")).isFalse();
    }

    @Test
    void untrustedLinkBecomesPlaceholder() {
        final ParseNode node = parse("\\href{https://example.com}{x}").get(0);
        assertThat(node).isInstanceOf(ParseNode.Color.class);
        final ParseNode trusted = parse("\\href{https://example.com}{x}", Settings.defaults().withTrust(true)).get(0);
        assertThat(trusted).isInstanceOf(ParseNode.Href.class);
        assertThat(((ParseNode.Href) trusted).href()).isEqualTo("https://example.com");
    }

    @Test
    void colorIsTextColorScopesColourToItsArgument() {
        final Settings settings = Settings.defaults().withColorIsTextColor(true);
        final List<ParseNode> nodes = parse("\\color{red}{x}y", settings);
        assertThat(nodes).hasSize(2);
        assertThat(((ParseNode.Color) nodes.get(0)).body()).hasSize(1);
    }

    @Test
    void maxSizeCapsUserSizes() {
        final String html = render("\\rule{100em}{1em}", Settings.defaults().withMaxSize(10)
            .withOutput(OutputFormat.HTML));
        assertThat(html).contains("width:10em");
    }
}
