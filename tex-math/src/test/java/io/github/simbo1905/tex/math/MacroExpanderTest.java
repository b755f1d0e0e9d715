package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MacroExpanderTest extends TexMathTestBase {

    private static MacroExpander gullet(String input, Settings settings) {
        return new MacroExpander(input, settings, Mode.MATH, Registry.standard());
    }

    /// Expands everything and returns the texts of the tokens reaching the parser.
    private static List<String> expandAll(MacroExpander gullet) {
        final List<String> out = new ArrayList<>();
        Token token = gullet.expandNextToken();
        while (!token.isEof()) {
            out.add(token.text());
            token = gullet.expandNextToken();
        }
        return out;
    }

    @Test
    void seededMacroSubstitutesArguments() {
        final var settings = Settings.defaults().withMacro("\\twice", "#1#1");
        assertThat(expandAll(gullet("\\twice x", settings))).containsExactly("x", "x");
    }

    @Test
    void bracedArgumentLosesOuterBraces() {
        final var settings = Settings.defaults().withMacro("\\pair", "(#1,#2)");
        assertThat(expandAll(gullet("\\pair{ab}c", settings)))
            .containsExactly("(", "a", "b", ",", "c", ")");
    }

    @Test
    void doubleHashBecomesSingleHash() {
        final var settings = Settings.defaults().withMacro("\\h", "#1##");
        assertThat(expandAll(gullet("\\h x", settings))).containsExactly("x", "#");
    }

    @Test
    void countsHighestParameter() {
        assertThat(MacroExpander.countParameters("no params")).isZero();
        assertThat(MacroExpander.countParameters("#1 and #2")).isEqualTo(2);
        assertThat(MacroExpander.countParameters("##1")).isZero();
    }

    @Test
    void selfReferenceStopsAtExpansionCeiling() {
        assertThatThrownBy(() -> parse("\\def\\foo{\\foo}\\foo"))
            .isInstanceOf(MacroExpansionException.class)
            .hasMessageContaining("Too many expansions");
    }

    @Test
    void maxExpandZeroRejectsAnyMacro() {
        final var settings = Settings.defaults().withMacro("\\one", "1").withMaxExpand(0);
        assertThatThrownBy(() -> parse("\\one", settings))
            .isInstanceOf(MacroExpansionException.class);
    }

    @Test
    void expansionCountIsTracked() {
        final var settings = Settings.defaults().withMacro("\\a", "\\b\\b").withMacro("\\b", "x");
        final MacroExpander gullet = gullet("\\a", settings);
        assertThat(expandAll(gullet)).containsExactly("x", "x");
        assertThat(gullet.expansionCount()).isEqualTo(3);
    }

    @Test
    void missingClosingBraceInArgument() {
        final var settings = Settings.defaults().withMacro("\\m", "#1");
        assertThatThrownBy(() -> expandAll(gullet("\\m{x", settings)))
            .isInstanceOf(MacroExpansionException.class)
            .hasMessageContaining("Unexpected end of input in a macro argument");
    }

    @Test
    void extraClosingBraceIsRejected() {
        final MacroExpander gullet = gullet("}", Settings.defaults());
        assertThatThrownBy(gullet::consumeArg)
            .isInstanceOf(MacroExpansionException.class)
            .hasMessageContaining("Extra }");
    }

    @Test
    void delimitedArgumentStopsAtDelimiter() {
        final MacroExpander gullet = gullet("ab.c", Settings.defaults());
        final MacroArgument arg = gullet.consumeArg(List.of("."));
        // stack order: last element is read first
        assertThat(arg.tokens()).extracting(Token::text).containsExactly("b", "a");
        assertThat(gullet.popToken().text()).isEqualTo("c");
    }

    @Test
    void expandMacroAsTextJoinsExpansion() {
        final var settings = Settings.defaults().withMacro("\\name", "\\alpha x");
        final MacroExpander gullet = gullet("", settings);
        assertThat(gullet.expandMacroAsText("\\name")).isEqualTo("\\alphax");
        assertThat(gullet.expandMacroAsText("\\nosuch")).isNull();
    }

    @Test
    void definedMeansMacroFunctionOrSymbol() {
        final MacroExpander gullet = gullet("", Settings.defaults());
        assertThat(gullet.isDefined("\\frac")).isTrue();
        assertThat(gullet.isDefined("\\alpha")).isTrue();
        assertThat(gullet.isDefined("\\bgroup")).isTrue();
        assertThat(gullet.isDefined("^")).isTrue();
        assertThat(gullet.isDefined("\\nosuchthing")).isFalse();
    }

    @Test
    void callbackMacroSeesFollowingToken() {
        final MacroDefinition peek = MacroDefinition.callback(context ->
            MacroDefinition.text("*".equals(context.future().text()) ? "S" : "N"));
        final var settings = Settings.defaults().withMacros(java.util.Map.of("\\peek", peek));
        assertThat(expandAll(gullet("\\peek*", settings))).containsExactly("S", "*");
        assertThat(expandAll(gullet("\\peek+", settings))).containsExactly("N", "+");
    }

    @Test
    void expansionRecordIsInReadingOrder() {
        final MacroDefinition fixed = new MacroDefinition.Expansion(
            List.of(new Token("a"), new Token("#"), new Token("1"), new Token("b")), 1);
        assertThatThrownBy(() -> new MacroDefinition.Expansion(List.of(), 10))
            .isInstanceOf(IllegalArgumentException.class);
        final var settings = Settings.defaults().withMacros(java.util.Map.of("\\f", fixed));
        assertThat(expandAll(gullet("\\f{x}", settings))).containsExactly("a", "x", "b");
    }

    @Test
    void expandableOnlyRejectsUndefinedControlSequence() {
        final MacroExpander gullet = gullet("\\undefinedthing", Settings.defaults());
        assertThatThrownBy(() -> gullet.expandOnce(true))
            .isInstanceOf(MacroExpansionException.class)
            .hasMessageContaining("Undefined control sequence");
    }

    @Test
    void definitionsAreScopedToGroups() {
        final List<ParseNode> nodes = parse("{\\def\\x{a}\\x}\\def\\y{b}\\y");
        assertThat(nodes).hasSize(2);
        assertThatThrownBy(() -> parse("{\\def\\x{a}}\\x"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Undefined control sequence: \\x");
    }

    @Test
    void gdefEscapesItsGroup() {
        final List<ParseNode> nodes = parse("{\\gdef\\x{a}}\\x");
        assertThat(nodes).hasSize(2);
        assertThat(nodes.get(1)).isInstanceOf(ParseNode.MathOrd.class);
    }

    @Test
    void delimitedDefinition() {
        final List<ParseNode> nodes = parse("\\def\\foo#1.{[#1]}\\foo xy.");
        assertThat(nodes).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("[", "x", "y", "]");
    }

    @Test
    void outOfOrderParameterIsRejected() {
        assertThatThrownBy(() -> parse("\\def\\foo#2{x}"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("out of order");
    }

    @Test
    void newcommandWithOptionalDefault() {
        final List<ParseNode> nodes = parse("\\newcommand\\f[2][d]{#1#2}\\f{x}\\f[y]{z}");
        assertThat(nodes).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("d", "x", "y", "z");
    }

    @Test
    void newcommandRefusesToRedefine() {
        assertThatThrownBy(() -> parse("\\newcommand\\frac{x}"))
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("attempting to redefine");
        assertThatThrownBy(() -> parse("\\renewcommand\\nosuch{x}"))
            .isInstanceOf(TexParseException.class);
    }

    @Test
    void letCopiesCurrentMeaning() {
        final List<ParseNode> nodes = parse("\\def\\a{x}\\let\\b=\\a\\def\\a{y}\\b\\a");
        assertThat(nodes).extracting(n -> ((ParseNode.SymbolNode) n).text()).containsExactly("x", "y");
    }

    @Test
    void globalDefinitionsPersistWithGlobalGroup() {
        final var settings = Settings.defaults().withGlobalGroup(true);
        final var parser = new Parser("\\def\\kept{k}", settings, Registry.standard());
        parser.parse();
        assertThat(parser.gullet().macros().get("\\kept")).isNotNull();
    }

    @Test
    void builtinMacrosExpand() {
        assertThat(parse("\\iff")).isNotEmpty();
        assertThat(parse("\\@firstoftwo{a}{b}")).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("a");
        assertThat(parse("\\@secondoftwo{a}{b}")).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("b");
        assertThat(parse("\\TextOrMath{t}{m}")).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("m");
    }

    @Test
    void charProducesCodePoint() {
        final List<ParseNode> nodes = parse("\\char\"41\\char65\\char'101");
        assertThat(nodes).extracting(n -> ((ParseNode.SymbolNode) n).text())
            .containsExactly("A", "A", "A");
    }

    @Test
    void bgroupAndEgroupDelimitGroups() {
        final List<ParseNode> nodes = parse("\\bgroup ab\\egroup");
        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0)).isInstanceOf(ParseNode.OrdGroup.class);
    }
}
