package io.github.simbo1905.tex.math;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// A node of the parse tree.
///
/// Every variant carries the mode it was parsed in and an optional source
/// location. Nodes are immutable; the parser builds copies where TeX would
/// adjust a node after the fact (limits on operators, for example).
public sealed interface ParseNode {

    Mode mode();

    SourceLocation loc();

    /// Lowercase kind name used in diagnostics, like `supsub` or `ordgroup`.
    default String type() {
        return getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    /// Nodes contributed by functions registered outside this package.
    non-sealed interface ExtensionNode extends ParseNode {
    }

    /// Leaf nodes that carry a single symbol's text.
    sealed interface SymbolNode extends ParseNode {
        String text();
    }

    // ========== Symbols ==========

    /// A symbol in one of the atom families: bin, rel, open, close, punct, inner.
    record Atom(Mode mode, SourceLocation loc, String family, String text) implements SymbolNode {
    }

    record MathOrd(Mode mode, SourceLocation loc, String text) implements SymbolNode {
    }

    record TextOrd(Mode mode, SourceLocation loc, String text) implements SymbolNode {
    }

    record SpacingSymbol(Mode mode, SourceLocation loc, String text) implements SymbolNode {
    }

    record AccentToken(Mode mode, SourceLocation loc, String text) implements SymbolNode {
    }

    record OpToken(Mode mode, SourceLocation loc, String text) implements SymbolNode {
    }

    // ========== Structure ==========

    /// A braced group, or `\begingroup...\endgroup` when `semisimple`.
    record OrdGroup(Mode mode, SourceLocation loc, List<ParseNode> body, boolean semisimple) implements ParseNode {
        public OrdGroup {
            body = List.copyOf(body);
        }

        public OrdGroup(Mode mode, SourceLocation loc, List<ParseNode> body) {
            this(mode, loc, body, false);
        }
    }

    /// A base with optional superscript and subscript; at least one script is present.
    record SupSub(Mode mode, SourceLocation loc, ParseNode base, ParseNode sup, ParseNode sub) implements ParseNode {
    }

    /// A parsed command that produces no output, such as `\relax` or `\def`.
    record Internal(Mode mode, SourceLocation loc) implements ParseNode {
    }

    /// An infix command such as `\over`, rewritten once its group is complete.
    record Infix(Mode mode, SourceLocation loc, String replaceWith, Measurement size, Token token)
        implements ParseNode {
    }

    /// The result of `\begin`/`\end` before the environment is assembled.
    record Environment(Mode mode, SourceLocation loc, String name, ParseNode nameGroup) implements ParseNode {
    }

    // ========== Argument payloads ==========

    record ColorToken(Mode mode, SourceLocation loc, String color) implements ParseNode {
    }

    record Size(Mode mode, SourceLocation loc, Measurement value, boolean isBlank) implements ParseNode {
    }

    record Url(Mode mode, SourceLocation loc, String url) implements ParseNode {
    }

    record Raw(Mode mode, SourceLocation loc, String string) implements ParseNode {
    }

    // ========== Styling ==========

    record Color(Mode mode, SourceLocation loc, String color, List<ParseNode> body) implements ParseNode {
        public Color {
            body = List.copyOf(body);
        }
    }

    record Styling(Mode mode, SourceLocation loc, Style style, List<ParseNode> body) implements ParseNode {
        public Styling {
            body = List.copyOf(body);
        }
    }

    /// Four alternative bodies, one per math style size.
    record MathChoice(Mode mode, SourceLocation loc, List<ParseNode> display, List<ParseNode> text,
                      List<ParseNode> script, List<ParseNode> scriptscript) implements ParseNode {
        public MathChoice {
            display = List.copyOf(display);
            text = List.copyOf(text);
            script = List.copyOf(script);
            scriptscript = List.copyOf(scriptscript);
        }

        List<ParseNode> choose(Style style) {
            switch (style.size()) {
                case 0:
                    return display;
                case 2:
                    return script;
                case 3:
                    return scriptscript;
                default:
                    return text;
            }
        }
    }

    /// A size switch; `size` is the level 1..11.
    record Sizing(Mode mode, SourceLocation loc, int size, List<ParseNode> body) implements ParseNode {
        public Sizing {
            body = List.copyOf(body);
        }
    }

    /// A math font such as `mathbf` applied to its body.
    record Font(Mode mode, SourceLocation loc, String font, ParseNode body) implements ParseNode {
    }

    /// Text-mode content; `font` is a text font command like `\textbf`, or null.
    record Text(Mode mode, SourceLocation loc, List<ParseNode> body, String font) implements ParseNode {
        public Text {
            body = List.copyOf(body);
        }
    }

    record Hbox(Mode mode, SourceLocation loc, List<ParseNode> body) implements ParseNode {
        public Hbox {
            body = List.copyOf(body);
        }
    }

    /// Forces an atom class on its body, as `\mathrel` does.
    record MClass(Mode mode, SourceLocation loc, String mclass, List<ParseNode> body, boolean isCharacterBox)
        implements ParseNode {
        public MClass {
            body = List.copyOf(body);
        }
    }

    record Pmb(Mode mode, SourceLocation loc, String mclass, List<ParseNode> body) implements ParseNode {
        public Pmb {
            body = List.copyOf(body);
        }
    }

    record Verb(Mode mode, SourceLocation loc, String body, boolean star) implements ParseNode {
    }

    /// Separate content for the box tree and the MathML tree.
    record HtmlMathMl(Mode mode, SourceLocation loc, List<ParseNode> html, List<ParseNode> mathml)
        implements ParseNode {
        public HtmlMathMl {
            html = List.copyOf(html);
            mathml = List.copyOf(mathml);
        }
    }

    // ========== Operators and fractions ==========

    /// A big operator, either a single symbol (`symbol`, with `name`) or a body.
    record Op(Mode mode, SourceLocation loc, boolean limits, boolean alwaysHandleSupSub, boolean suppressBaseShift,
              boolean parentIsSupSub, boolean symbol, String name, List<ParseNode> body) implements ParseNode {
        public Op {
            body = body == null ? null : List.copyOf(body);
        }

        Op withLimits(boolean newLimits) {
            return new Op(mode, loc, newLimits, true, suppressBaseShift, parentIsSupSub, symbol, name, body);
        }

        Op asSupSubBase() {
            return new Op(mode, loc, limits, alwaysHandleSupSub, suppressBaseShift, true, symbol, name, body);
        }
    }

    record OperatorName(Mode mode, SourceLocation loc, List<ParseNode> body, boolean alwaysHandleSupSub,
                        boolean limits, boolean parentIsSupSub) implements ParseNode {
        public OperatorName {
            body = List.copyOf(body);
        }

        OperatorName withLimits(boolean newLimits) {
            return new OperatorName(mode, loc, body, alwaysHandleSupSub, newLimits, parentIsSupSub);
        }

        OperatorName asSupSubBase() {
            return new OperatorName(mode, loc, body, alwaysHandleSupSub, limits, true);
        }
    }

    /// A generalized fraction. `size` is a forced style or null; `barSize` is an
    /// explicit rule thickness or null for the default.
    record Genfrac(Mode mode, SourceLocation loc, boolean continued, ParseNode numer, ParseNode denom,
                   boolean hasBarLine, String leftDelim, String rightDelim, Style size, Measurement barSize)
        implements ParseNode {
    }

    record Sqrt(Mode mode, SourceLocation loc, ParseNode body, ParseNode index) implements ParseNode {
    }

    // ========== Accents and decorations ==========

    record Accent(Mode mode, SourceLocation loc, String label, boolean isStretchy, boolean isShifty, ParseNode base)
        implements ParseNode {
    }

    record AccentUnder(Mode mode, SourceLocation loc, String label, boolean isStretchy, boolean isShifty,
                       ParseNode base) implements ParseNode {
    }

    record HorizBrace(Mode mode, SourceLocation loc, String label, boolean isOver, ParseNode base)
        implements ParseNode {
    }

    record Overline(Mode mode, SourceLocation loc, ParseNode body) implements ParseNode {
    }

    record Underline(Mode mode, SourceLocation loc, ParseNode body) implements ParseNode {
    }

    /// Boxes, strikes and colour boxes; colours are null when unused.
    record Enclose(Mode mode, SourceLocation loc, String label, String backgroundColor, String borderColor,
                   ParseNode body) implements ParseNode {
    }

    record XArrow(Mode mode, SourceLocation loc, String label, ParseNode body, ParseNode below)
        implements ParseNode {
    }

    // ========== Delimiters ==========

    /// `\big` and friends; `size` is 1..4 and `mclass` one of mopen, mclose, mrel, mord.
    record DelimSizing(Mode mode, SourceLocation loc, int size, String mclass, String delim) implements ParseNode {
    }

    record LeftRight(Mode mode, SourceLocation loc, List<ParseNode> body, String left, String right,
                     String rightColor) implements ParseNode {
        public LeftRight {
            body = List.copyOf(body);
        }
    }

    /// The `\right` half, folded into [LeftRight] by the parser.
    record LeftRightRight(Mode mode, SourceLocation loc, String delim, String color) implements ParseNode {
    }

    record Middle(Mode mode, SourceLocation loc, String delim) implements ParseNode {
    }

    // ========== Spacing and boxes ==========

    record Kern(Mode mode, SourceLocation loc, Measurement dimension) implements ParseNode {
    }

    record Rule(Mode mode, SourceLocation loc, Measurement shift, Measurement width, Measurement height)
        implements ParseNode {
    }

    record Phantom(Mode mode, SourceLocation loc, List<ParseNode> body) implements ParseNode {
        public Phantom {
            body = List.copyOf(body);
        }
    }

    record HPhantom(Mode mode, SourceLocation loc, ParseNode body) implements ParseNode {
    }

    record VPhantom(Mode mode, SourceLocation loc, ParseNode body) implements ParseNode {
    }

    record Smash(Mode mode, SourceLocation loc, ParseNode body, boolean smashHeight, boolean smashDepth)
        implements ParseNode {
    }

    /// `\llap`, `\rlap` and `\clap`; alignment is `llap`, `rlap` or `clap`.
    record Lap(Mode mode, SourceLocation loc, String alignment, ParseNode body) implements ParseNode {
    }

    record RaiseBox(Mode mode, SourceLocation loc, Measurement dy, ParseNode body) implements ParseNode {
    }

    /// `\vcenter`: the body centred on the math axis.
    record VCenter(Mode mode, SourceLocation loc, ParseNode body) implements ParseNode {
    }

    // ========== Links ==========

    record Href(Mode mode, SourceLocation loc, String href, List<ParseNode> body) implements ParseNode {
        public Href {
            body = List.copyOf(body);
        }
    }

    /// `\htmlClass`, `\htmlId`, `\htmlStyle` and `\htmlData`. Attribute order is kept.
    record Html(Mode mode, SourceLocation loc, Map<String, String> attributes, List<ParseNode> body)
        implements ParseNode {
        public Html {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            body = List.copyOf(body);
        }
    }

    record IncludeGraphics(Mode mode, SourceLocation loc, String alt, Measurement width, Measurement height,
                           Measurement totalHeight, String src) implements ParseNode {
    }

    // ========== Arrays and lines ==========

    /// A line break; `size` is the extra vertical gap, or null.
    record Cr(Mode mode, SourceLocation loc, boolean newLine, Measurement size) implements ParseNode {
    }

    /// A column specification entry: an alignment with optional gaps, or a rule separator.
    sealed interface AlignSpec permits Align, Separator {
    }

    /// `align` is `l`, `c` or `r`; gaps are in em or null for the default.
    record Align(String align, Double pregap, Double postgap) implements AlignSpec {
    }

    /// `|` for a solid rule, `:` for a dashed one.
    record Separator(String separator) implements AlignSpec {
    }

    /// An equation tag for one row: either automatically numbered or an explicit body.
    record RowTag(boolean numbered, List<ParseNode> body) {
        public RowTag {
            body = body == null ? null : List.copyOf(body);
        }
    }

    /// A table. `colSeparationType` is null or one of align, alignat, gather,
    /// small and CD. `rowGaps` holds one entry per row break (null for none),
    /// `hLinesBeforeRow` one entry per row plus one, each listing dashed flags.
    /// `tags` is null when rows carry no tags; otherwise one entry per row, null
    /// for an untagged row.
    record Array(Mode mode, SourceLocation loc, String colSeparationType, boolean hskipBeforeAndAfter,
                 boolean addJot, List<AlignSpec> cols, double arraystretch, List<List<ParseNode>> body,
                 List<Measurement> rowGaps, List<List<Boolean>> hLinesBeforeRow, List<RowTag> tags,
                 boolean leqno) implements ParseNode {
        public Array {
            cols = cols == null ? null : List.copyOf(cols);
            body = body.stream().map(List::copyOf).toList();
            rowGaps = java.util.Collections.unmodifiableList(new java.util.ArrayList<>(rowGaps));
            hLinesBeforeRow = hLinesBeforeRow.stream().map(List::copyOf).toList();
            tags = tags == null ? null : java.util.Collections.unmodifiableList(new java.util.ArrayList<>(tags));
        }
    }

    record Tag(Mode mode, SourceLocation loc, List<ParseNode> body, List<ParseNode> tag) implements ParseNode {
        public Tag {
            body = List.copyOf(body);
            tag = List.copyOf(tag);
        }
    }

    /// A label on a commutative diagram arrow; `side` is `left` or `right`.
    record CdLabel(Mode mode, SourceLocation loc, String side, ParseNode label) implements ParseNode {
    }

    record CdLabelParent(Mode mode, SourceLocation loc, ParseNode fragment) implements ParseNode {
    }

    // ========== Helpers ==========

    /// The body of a group as a list, or the node itself as a singleton.
    static List<ParseNode> ordArgument(ParseNode arg) {
        return arg instanceof OrdGroup group ? group.body() : List.of(arg);
    }

    /// Unwraps a single-element group.
    static ParseNode normalizeArgument(ParseNode arg) {
        if (arg instanceof OrdGroup group && group.body().size() == 1) {
            return group.body().get(0);
        }
        return arg;
    }

    /// Strips single-element groups and colours down to the node that decides
    /// the layout, like the letter under an accent.
    static ParseNode baseElem(ParseNode group) {
        if (group instanceof OrdGroup ord) {
            return ord.body().size() == 1 ? baseElem(ord.body().get(0)) : group;
        }
        if (group instanceof Color color) {
            return color.body().size() == 1 ? baseElem(color.body().get(0)) : group;
        }
        if (group instanceof Font font) {
            return baseElem(font.body());
        }
        return group;
    }

    /// True if the node reduces to a single character.
    static boolean isCharacterBox(ParseNode group) {
        final ParseNode base = baseElem(group);
        return base instanceof MathOrd || base instanceof TextOrd || base instanceof Atom;
    }

    /// The text of a symbol node.
    ///
    /// @throws TexParseException if `node` is not a symbol
    static String symbolText(ParseNode node) {
        if (node instanceof SymbolNode symbol) {
            return symbol.text();
        }
        throw new TexParseException("Expected node of symbol group type, but got "
            + (node == null ? "null" : "node of type " + node.type()), node);
    }
}
