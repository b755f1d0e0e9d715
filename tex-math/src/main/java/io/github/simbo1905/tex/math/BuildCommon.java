package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Factories for box-tree nodes shared by the group builders: glyph lookup and
/// font selection, spans sized from their children, rules and glue.
final class BuildCommon {

    /// Math font commands and the metric font each one draws from.
    record MathFont(String variant, String fontName) {
    }

    static final Map<String, MathFont> FONT_MAP = Map.ofEntries(
        Map.entry("mathbf", new MathFont("bold", "Main-Bold")),
        Map.entry("mathrm", new MathFont("normal", "Main-Regular")),
        Map.entry("textit", new MathFont("italic", "Main-Italic")),
        Map.entry("mathit", new MathFont("italic", "Main-Italic")),
        Map.entry("mathnormal", new MathFont("italic", "Math-Italic")),
        Map.entry("mathsfit", new MathFont("sans-serif-italic", "SansSerif-Italic")),
        Map.entry("mathbb", new MathFont("double-struck", "AMS-Regular")),
        Map.entry("mathcal", new MathFont("script", "Caligraphic-Regular")),
        Map.entry("mathfrak", new MathFont("fraktur", "Fraktur-Regular")),
        Map.entry("mathscr", new MathFont("script", "Script-Regular")),
        Map.entry("mathsf", new MathFont("sans-serif", "SansSerif-Regular")),
        Map.entry("mathtt", new MathFont("monospace", "Typewriter-Regular"))
    );

    private record StaticSvg(String pathName, double width, double height) {
    }

    private static final Map<String, StaticSvg> SVG_DATA = Map.of(
        "vec", new StaticSvg("vec", 0.471, 0.714),
        "oiintSize1", new StaticSvg("oiintSize1", 0.957, 0.499),
        "oiintSize2", new StaticSvg("oiintSize2", 1.472, 0.659),
        "oiiintSize1", new StaticSvg("oiiintSize1", 1.304, 0.499),
        "oiiintSize2", new StaticSvg("oiiintSize2", 1.98, 0.659)
    );

    private BuildCommon() {}

    /// A symbol name resolved to the glyph drawn for it, with its metrics or null.
    record Lookup(String value, FontMetrics.CharacterMetrics metrics) {
    }

    static Lookup lookupSymbol(String value, String fontName, Mode mode) {
        final Symbols.Symbol symbol = Symbols.get(mode, value);
        final String glyph = symbol != null && symbol.replace() != null ? symbol.replace() : value;
        return new Lookup(glyph, FontMetrics.character(glyph, fontName, mode));
    }

    /// A glyph in `fontName`. Glyphs without metrics are still emitted, with
    /// zero extents, and logged.
    static BoxNode.Symbol makeSymbol(String value, String fontName, Mode mode, Options options,
                                     List<String> classes) {
        final Lookup lookup = lookupSymbol(value, fontName, mode);
        final FontMetrics.CharacterMetrics metrics = lookup.metrics();
        final BoxNode.Symbol symbol;
        if (metrics != null) {
            double italic = metrics.italic();
            if (mode == Mode.TEXT || (options != null && "mathit".equals(options.font()))) {
                italic = 0;
            }
            symbol = new BoxNode.Symbol(lookup.value(), metrics.height(), metrics.depth(), italic, metrics.skew(),
                metrics.width(), classes);
        } else {
            LOG.log(Level.WARNING, () -> "No character metrics for '" + lookup.value() + "' in style '" + fontName
                + "' and mode '" + mode.label() + "'");
            symbol = new BoxNode.Symbol(lookup.value(), 0, 0, 0, 0, 0, classes);
        }
        if (options != null) {
            symbol.maxFontSize = options.sizeMultiplier();
            if (options.style().isTight()) {
                symbol.addClass("mtight");
            }
            final String color = options.getColor();
            if (color != null) {
                symbol.setStyle("color", color);
            }
        }
        return symbol;
    }

    /// Symbols of the relation, binary, delimiter and punctuation classes.
    static BoxNode.Symbol mathsym(String value, Mode mode, Options options, List<String> classes) {
        if ("boldsymbol".equals(options.font()) && lookupSymbol(value, "Main-Bold", mode).metrics() != null) {
            return makeSymbol(value, "Main-Bold", mode, options, concat(classes, "mathbf"));
        }
        final Symbols.Symbol symbol = Symbols.get(mode, value);
        if ("\\".equals(value) || (symbol != null && "main".equals(symbol.font()))) {
            return makeSymbol(value, "Main-Regular", mode, options, classes);
        }
        return makeSymbol(value, "AMS-Regular", mode, options, concat(classes, "amsrm"));
    }

    /// An ordinary symbol. `mathOrd` selects the italic default used for
    /// letters; otherwise the upright text default applies.
    static BoxNode makeOrd(String text, Mode mode, Options options, boolean mathOrd) {
        final List<String> classes = List.of("mord");
        final boolean isFont = mode == Mode.MATH || (mode == Mode.TEXT && !options.font().isEmpty());
        final String fontOrFamily = isFont ? options.font() : options.fontFamily();

        if (!fontOrFamily.isEmpty()) {
            final String fontName;
            final List<String> fontClasses;
            if ("boldsymbol".equals(fontOrFamily)) {
                if (mathOrd && lookupSymbol(text, "Math-BoldItalic", mode).metrics() != null) {
                    fontName = "Math-BoldItalic";
                    fontClasses = List.of("boldsymbol");
                } else {
                    fontName = "Main-Bold";
                    fontClasses = List.of("mathbf");
                }
            } else if (isFont) {
                final MathFont font = FONT_MAP.get(fontOrFamily);
                fontName = font == null ? "Main-Regular" : font.fontName();
                fontClasses = List.of(fontOrFamily);
            } else {
                fontName = textFontName(fontOrFamily, options.fontWeight(), options.fontShape());
                fontClasses = List.of(fontOrFamily, options.fontWeight(), options.fontShape());
            }
            if (lookupSymbol(text, fontName, mode).metrics() != null) {
                return makeSymbol(text, fontName, mode, options, concat(classes, fontClasses));
            }
            if (Symbols.isLigature(text) && fontName.startsWith("Typewriter")) {
                final List<BoxNode> parts = new ArrayList<>();
                for (int i = 0; i < text.length(); i++) {
                    parts.add(makeSymbol(text.substring(i, i + 1), fontName, mode, options,
                        concat(classes, fontClasses)));
                }
                return makeFragment(parts);
            }
        }

        if (mathOrd) {
            return makeSymbol(text, "Math-Italic", mode, options, concat(classes, "mathnormal"));
        }
        final Symbols.Symbol symbol = Symbols.get(mode, text);
        final String font = symbol == null ? null : symbol.font();
        if ("ams".equals(font)) {
            final String fontName = textFontName("amsrm", options.fontWeight(), options.fontShape());
            return makeSymbol(text, fontName, mode, options,
                concat(classes, List.of("amsrm", options.fontWeight(), options.fontShape())));
        }
        if (font == null || "main".equals(font)) {
            final String fontName = textFontName("textrm", options.fontWeight(), options.fontShape());
            return makeSymbol(text, fontName, mode, options,
                concat(classes, List.of(options.fontWeight(), options.fontShape())));
        }
        final String fontName = textFontName(font, options.fontWeight(), options.fontShape());
        return makeSymbol(text, fontName, mode, options,
            concat(classes, List.of(fontName, options.fontWeight(), options.fontShape())));
    }

    /// The metric font for a text family, weight and shape, e.g. `Main-BoldItalic`.
    static String textFontName(String family, String weight, String shape) {
        final String base = switch (family) {
            case "amsrm" -> "AMS";
            case "textrm" -> "Main";
            case "textsf" -> "SansSerif";
            case "texttt" -> "Typewriter";
            default -> family;
        };
        final String variant;
        if ("textbf".equals(weight) && "textit".equals(shape)) {
            variant = "BoldItalic";
        } else if ("textbf".equals(weight)) {
            variant = "Bold";
        } else if ("textit".equals(shape)) {
            variant = "Italic";
        } else {
            variant = "Regular";
        }
        return base + "-" + variant;
    }

    private static boolean canCombine(BoxNode.Symbol prev, BoxNode.Symbol next) {
        if (!prev.classes.equals(next.classes) || prev.skew != next.skew || prev.maxFontSize != next.maxFontSize) {
            return false;
        }
        // single-class ord and bin glyphs keep their own spans for spacing
        if (prev.classes.size() == 1 && ("mbin".equals(prev.classes.get(0)) || "mord".equals(prev.classes.get(0)))) {
            return false;
        }
        return prev.style.equals(next.style);
    }

    /// Merges adjacent compatible glyphs into one symbol, in place.
    static List<BoxNode> tryCombineChars(List<BoxNode> chars) {
        int i = 0;
        while (i < chars.size() - 1) {
            if (chars.get(i) instanceof BoxNode.Symbol prev && chars.get(i + 1) instanceof BoxNode.Symbol next
                && canCombine(prev, next)) {
                prev.text = prev.text + next.text;
                prev.height = Math.max(prev.height, next.height);
                prev.depth = Math.max(prev.depth, next.depth);
                prev.italic = next.italic;
                chars.remove(i + 1);
            } else {
                i++;
            }
        }
        return chars;
    }

    private static void sizeFromChildren(BoxNode node) {
        double height = 0;
        double depth = 0;
        double maxFontSize = 0;
        for (final BoxNode child : node.children()) {
            height = Math.max(height, child.height);
            depth = Math.max(depth, child.depth);
            maxFontSize = Math.max(maxFontSize, child.maxFontSize);
        }
        node.height = height;
        node.depth = depth;
        node.maxFontSize = maxFontSize;
    }

    private static void applyOptions(BoxNode node, Options options) {
        if (options == null) {
            return;
        }
        if (options.style().isTight()) {
            node.addClass("mtight");
        }
        final String color = options.getColor();
        if (color != null) {
            node.setStyle("color", color);
        }
    }

    /// A span whose extents are the maxima of its children's.
    static BoxNode.Span makeSpan(List<String> classes, List<? extends BoxNode> children, Options options) {
        final var span = new BoxNode.Span(classes, children);
        applyOptions(span, options);
        sizeFromChildren(span);
        return span;
    }

    static BoxNode.Span makeSpan(List<String> classes, List<? extends BoxNode> children) {
        return makeSpan(classes, children, null);
    }

    static BoxNode.Span makeSpan(String... classes) {
        return makeSpan(List.of(classes), List.of(), null);
    }

    /// A horizontal rule drawn as a bottom border at least `minRuleThickness` thick.
    static BoxNode.Span makeLineSpan(String className, Options options, Double thickness) {
        final BoxNode.Span line = makeSpan(List.of(className), List.of(), options);
        final double t = thickness != null && thickness > 0 ? thickness : options.fontMetrics().defaultRuleThickness();
        line.height = Math.max(t, options.minRuleThickness());
        line.setStyle("border-bottom-width", Units.makeEm(line.height));
        line.maxFontSize = 1.0;
        return line;
    }

    static BoxNode.Anchor makeAnchor(String href, List<String> classes, List<? extends BoxNode> children,
                                     Options options) {
        final var anchor = new BoxNode.Anchor(href, classes, children);
        applyOptions(anchor, options);
        sizeFromChildren(anchor);
        return anchor;
    }

    static BoxNode.Fragment makeFragment(List<? extends BoxNode> children) {
        final var fragment = new BoxNode.Fragment(children);
        sizeFromChildren(fragment);
        return fragment;
    }

    /// Gives a fragment a span of its own so it can carry classes.
    static BoxNode wrapFragment(BoxNode group, Options options) {
        if (group instanceof BoxNode.Fragment) {
            return makeSpan(List.of(), List.of(group), options);
        }
        return group;
    }

    /// Horizontal space of the given size as an `mspace` span.
    static BoxNode.Span makeGlue(Measurement measurement, Options options) {
        final BoxNode.Span rule = makeSpan(List.of("mspace"), List.of(), options);
        rule.setStyle("margin-right", Units.makeEm(Units.calculateSize(measurement, options)));
        return rule;
    }

    static BoxNode.Svg makeSvg(List<? extends BoxNode> children, Map<String, String> attributes) {
        return new BoxNode.Svg(children, attributes);
    }

    /// A fixed-size drawing such as the `\vec` arrow or the oint glyphs.
    static BoxNode.Span staticSvg(String value, Options options) {
        final StaticSvg data = Objects.requireNonNull(SVG_DATA.get(value), () -> "Unknown static SVG '" + value + "'");
        final var path = new BoxNode.Path(data.pathName(), SvgGeometry.path(data.pathName()));
        final var attrs = new java.util.LinkedHashMap<String, String>();
        attrs.put("width", Units.makeEm(data.width()));
        attrs.put("height", Units.makeEm(data.height()));
        attrs.put("style", "width:" + Units.makeEm(data.width()));
        attrs.put("viewBox", "0 0 " + (int) (1000 * data.width()) + " " + (int) (1000 * data.height()));
        attrs.put("preserveAspectRatio", "xMinYMin");
        final BoxNode.Span span = makeSpan(List.of("overlay"), List.of(makeSvg(List.of(path), attrs)), options);
        span.height = data.height();
        span.setStyle("height", Units.makeEm(data.height()));
        span.setStyle("width", Units.makeEm(data.width()));
        return span;
    }

    static List<String> concat(List<String> classes, String extra) {
        final var out = new ArrayList<>(classes);
        out.add(extra);
        return out;
    }

    static List<String> concat(List<String> classes, List<String> extra) {
        final var out = new ArrayList<>(classes);
        out.addAll(extra);
        return out;
    }
}
