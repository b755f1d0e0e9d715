package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Builds delimiters at a requested size.
///
/// A delimiter is drawn one of three ways: a `small` glyph from Main-Regular
/// shown at script-script, script or text style; a `large` glyph from one of
/// the four Size fonts; or a `stack` assembled from top, repeat, optional
/// middle and bottom pieces to any height. Each delimiter belongs to one of
/// three sequences that fix which of these it may use, and sizing walks its
/// sequence until a candidate is tall enough.
final class Delimiter {

    /// Heights of the four large sizes, in em.
    static final double[] SIZE_TO_MAX_HEIGHT = {0, 1.2, 1.8, 2.4, 3.0};

    private static final double LAP_IN_EMS = 0.008;
    private static final VList.Kern LAP = new VList.Kern(-LAP_IN_EMS);
    private static final int VB_PAD = 80;
    private static final double EM_PAD = 0.08;

    private static final Set<String> VERTS = Set.of("|", "\\lvert", "\\rvert", "\\vert");
    private static final Set<String> DOUBLE_VERTS = Set.of("\\|", "\\lVert", "\\rVert", "\\Vert");

    static final Set<String> STACK_LARGE = Set.of(
        "(", "\\lparen", ")", "\\rparen", "[", "\\lbrack", "]", "\\rbrack", "\\{", "\\lbrace", "\\}", "\\rbrace",
        "\\lfloor", "\\rfloor", "⌊", "⌋", "\\lceil", "\\rceil", "⌈", "⌉", "\\surd");

    static final Set<String> STACK_ALWAYS = Set.of(
        "\\uparrow", "\\downarrow", "\\updownarrow", "\\Uparrow", "\\Downarrow", "\\Updownarrow", "|", "\\|",
        "\\vert", "\\Vert", "\\lvert", "\\rvert", "\\lVert", "\\rVert", "\\lgroup", "\\rgroup", "⟮", "⟯",
        "\\lmoustache", "\\rmoustache", "⎰", "⎱");

    static final Set<String> STACK_NEVER = Set.of(
        "<", ">", "\\langle", "\\rangle", "/", "\\backslash", "\\lt", "\\gt");

    /// One candidate rendering in a sizing sequence.
    sealed interface Candidate permits Small, Large, Stack {
    }

    record Small(Style style) implements Candidate {
    }

    record Large(int size) implements Candidate {
    }

    record Stack() implements Candidate {
    }

    private static final List<Candidate> STACK_NEVER_SEQUENCE = List.of(
        new Small(Style.SCRIPTSCRIPT), new Small(Style.SCRIPT), new Small(Style.TEXT),
        new Large(1), new Large(2), new Large(3), new Large(4));

    private static final List<Candidate> STACK_ALWAYS_SEQUENCE = List.of(
        new Small(Style.SCRIPTSCRIPT), new Small(Style.SCRIPT), new Small(Style.TEXT), new Stack());

    private static final List<Candidate> STACK_LARGE_SEQUENCE = List.of(
        new Small(Style.SCRIPTSCRIPT), new Small(Style.SCRIPT), new Small(Style.TEXT),
        new Large(1), new Large(2), new Large(3), new Large(4), new Stack());

    private Delimiter() {}

    private static FontMetrics.CharacterMetrics metrics(String symbol, String font, Mode mode) {
        return BuildCommon.lookupSymbol(symbol, font, mode).metrics();
    }

    private static double totalHeight(FontMetrics.CharacterMetrics m) {
        return m == null ? 0 : m.height() + m.depth();
    }

    /// Wraps `delim` so it renders in `toStyle` at base size.
    private static BoxNode.Span styleWrap(BoxNode delim, Style toStyle, Options options, List<String> classes) {
        final Options newOptions = options.havingBaseStyle(toStyle);
        final BoxNode.Span span = BuildCommon.makeSpan(
            BuildCommon.concat(classes, newOptions.sizingClasses(options)), List.of(delim), options);
        final double multiplier = newOptions.sizeMultiplier() / options.sizeMultiplier();
        span.height *= multiplier;
        span.depth *= multiplier;
        span.maxFontSize = newOptions.sizeMultiplier();
        return span;
    }

    private static void centerSpan(BoxNode.Span span, Options options, Style style) {
        final Options newOptions = options.havingBaseStyle(style);
        final double shift = (1 - options.sizeMultiplier() / newOptions.sizeMultiplier())
            * options.fontMetrics().axisHeight();
        span.addClass("delimcenter");
        span.setStyle("top", Units.makeEm(shift));
        span.height -= shift;
        span.depth += shift;
    }

    private static BoxNode.Span makeSmallDelim(String delim, Style style, boolean center, Options options,
                                               Mode mode, List<String> classes) {
        final BoxNode.Symbol text = BuildCommon.makeSymbol(delim, "Main-Regular", mode, options, List.of());
        final BoxNode.Span span = styleWrap(text, style, options, classes);
        if (center) {
            centerSpan(span, options, style);
        }
        return span;
    }

    private static BoxNode.Span makeLargeDelim(String delim, int size, boolean center, Options options,
                                               Mode mode, List<String> classes) {
        final BoxNode.Symbol inner = BuildCommon.makeSymbol(delim, "Size" + size + "-Regular", mode, options,
            List.of());
        final BoxNode.Span span = styleWrap(
            BuildCommon.makeSpan(List.of("delimsizing", "size" + size), List.of(inner), options),
            Style.TEXT, options, classes);
        if (center) {
            centerSpan(span, options, Style.TEXT);
        }
        return span;
    }

    private static VList.Elem makeGlyphSpan(String symbol, String font, Mode mode) {
        final String sizeClass = "Size1-Regular".equals(font) ? "delim-size1" : "delim-size4";
        final BoxNode.Span corner = BuildCommon.makeSpan(List.of("delimsizinginner", sizeClass),
            List.of(BuildCommon.makeSpan(List.of(),
                List.of(BuildCommon.makeSymbol(symbol, font, mode, null, List.of())))));
        return new VList.Elem(corner);
    }

    /// The repeat piece, drawn as a bar `height` em tall.
    private static VList.Elem makeInner(String ch, double height, Options options) {
        FontMetrics.CharacterMetrics m = FontMetrics.character(ch, "Size4-Regular", Mode.MATH);
        if (m == null) {
            m = FontMetrics.character(ch, "Size1-Regular", Mode.MATH);
        }
        final double width = m == null ? 0 : m.width();
        final long viewBoxHeight = Math.round(1000 * height);
        final var path = new BoxNode.Path("inner", SvgGeometry.innerPath(ch, viewBoxHeight));
        final var attrs = new LinkedHashMap<String, String>();
        attrs.put("width", Units.makeEm(width));
        attrs.put("height", Units.makeEm(height));
        attrs.put("style", "width:" + Units.makeEm(width));
        attrs.put("viewBox", "0 0 " + SvgGeometry.fmt(1000 * width) + " " + viewBoxHeight);
        attrs.put("preserveAspectRatio", "xMinYMin");
        final BoxNode.Span span = BuildCommon.makeSpan(List.of(),
            List.of(BuildCommon.makeSvg(List.of(path), attrs)), options);
        span.height = height;
        span.setStyle("height", Units.makeEm(height));
        span.setStyle("width", Units.makeEm(width));
        return new VList.Elem(span);
    }

    /// The glyph pieces a stacked delimiter is assembled from.
    private record Pieces(String top, String repeat, String bottom, String middle, String font, String svgLabel,
                          int viewBoxWidth) {
    }

    private static Pieces pieces(String delim) {
        return switch (delim) {
            case "\\uparrow" -> new Pieces(delim, "⏐", "⏐", null, "Size1-Regular", null, 0);
            case "\\Uparrow" -> new Pieces(delim, "‖", "‖", null, "Size1-Regular", null, 0);
            case "\\downarrow" -> new Pieces("⏐", "⏐", delim, null, "Size1-Regular", null, 0);
            case "\\Downarrow" -> new Pieces("‖", "‖", delim, null, "Size1-Regular", null, 0);
            case "\\updownarrow" -> new Pieces("\\uparrow", "⏐", "\\downarrow", null, "Size1-Regular", null, 0);
            case "\\Updownarrow" -> new Pieces("\\Uparrow", "‖", "\\Downarrow", null, "Size1-Regular", null, 0);
            case "|", "\\lvert", "\\rvert", "\\vert" -> new Pieces(delim, "∣", delim, null, "Size1-Regular",
                "vert", 333);
            case "\\|", "\\lVert", "\\rVert", "\\Vert" -> new Pieces(delim, "∥", delim, null, "Size1-Regular",
                "doublevert", 556);
            case "[", "\\lbrack" -> new Pieces("⎡", "⎢", "⎣", null, "Size4-Regular", "lbrack", 667);
            case "]", "\\rbrack" -> new Pieces("⎤", "⎥", "⎦", null, "Size4-Regular", "rbrack", 667);
            case "\\lfloor", "⌊" -> new Pieces("⎢", "⎢", "⎣", null, "Size4-Regular", "lfloor", 667);
            case "\\lceil", "⌈" -> new Pieces("⎡", "⎢", "⎢", null, "Size4-Regular", "lceil", 667);
            case "\\rfloor", "⌋" -> new Pieces("⎥", "⎥", "⎦", null, "Size4-Regular", "rfloor", 667);
            case "\\rceil", "⌉" -> new Pieces("⎤", "⎥", "⎥", null, "Size4-Regular", "rceil", 667);
            case "(", "\\lparen" -> new Pieces("⎛", "⎜", "⎝", null, "Size4-Regular", null, 0);
            case ")", "\\rparen" -> new Pieces("⎞", "⎟", "⎠", null, "Size4-Regular", null, 0);
            case "\\{", "\\lbrace" -> new Pieces("⎧", "⎪", "⎩", "⎨", "Size4-Regular", null, 0);
            case "\\}", "\\rbrace" -> new Pieces("⎫", "⎪", "⎭", "⎬", "Size4-Regular", null, 0);
            case "\\lgroup", "⟮" -> new Pieces("⎧", "⎪", "⎩", null, "Size4-Regular", null, 0);
            case "\\rgroup", "⟯" -> new Pieces("⎫", "⎪", "⎭", null, "Size4-Regular", null, 0);
            case "\\lmoustache", "⎰" -> new Pieces("⎧", "⎪", "⎭", null, "Size4-Regular", null, 0);
            case "\\rmoustache", "⎱" -> new Pieces("⎫", "⎪", "⎩", null, "Size4-Regular", null, 0);
            default -> new Pieces(delim, delim, delim, null, "Size1-Regular", null, 0);
        };
    }

    /// A delimiter at least `heightTotal` em tall built from repeated pieces.
    static BoxNode.Span makeStackedDelim(String delim, double heightTotal, boolean center, Options options,
                                         Mode mode, List<String> classes) {
        final Pieces p = pieces(delim);
        final double topHeight = totalHeight(metrics(p.top(), p.font(), mode));
        final double repeatHeight = totalHeight(metrics(p.repeat(), p.font(), mode));
        final double bottomHeight = totalHeight(metrics(p.bottom(), p.font(), mode));
        double middleHeight = 0;
        int middleFactor = 1;
        if (p.middle() != null) {
            middleHeight = totalHeight(metrics(p.middle(), p.font(), mode));
            middleFactor = 2;
        }

        final double minHeight = topHeight + bottomHeight + middleHeight;
        final int repeatCount = repeatHeight <= 0 ? 0
            : (int) Math.max(0, Math.ceil((heightTotal - minHeight) / (middleFactor * repeatHeight)));
        final double realHeightTotal = minHeight + repeatCount * middleFactor * repeatHeight;

        double axisHeight = options.fontMetrics().axisHeight();
        if (center) {
            axisHeight *= options.sizeMultiplier();
        }
        final double depth = realHeightTotal / 2 - axisHeight;
        LOG.finer(() -> "stacked delimiter " + delim + " repeats=" + repeatCount + " height=" + realHeightTotal);

        final List<VList.Child> stack = new ArrayList<>();
        if (p.svgLabel() != null) {
            final double midHeight = realHeightTotal - topHeight - bottomHeight;
            final long viewBoxHeight = Math.round(realHeightTotal * 1000);
            final var path = new BoxNode.Path(p.svgLabel(),
                SvgGeometry.tallDelim(p.svgLabel(), Math.round(midHeight * 1000)));
            final String width = String.format(java.util.Locale.ROOT, "%.3fem", p.viewBoxWidth() / 1000.0);
            final String height = String.format(java.util.Locale.ROOT, "%.3fem", viewBoxHeight / 1000.0);
            final var attrs = new LinkedHashMap<String, String>();
            attrs.put("width", width);
            attrs.put("height", height);
            attrs.put("viewBox", "0 0 " + p.viewBoxWidth() + " " + viewBoxHeight);
            final BoxNode.Span wrapper = BuildCommon.makeSpan(List.of(),
                List.of(BuildCommon.makeSvg(List.of(path), attrs)), options);
            wrapper.height = viewBoxHeight / 1000.0;
            wrapper.setStyle("width", width);
            wrapper.setStyle("height", height);
            stack.add(new VList.Elem(wrapper));
        } else {
            stack.add(makeGlyphSpan(p.bottom(), p.font(), mode));
            stack.add(LAP);
            if (p.middle() == null) {
                final double innerHeight = realHeightTotal - topHeight - bottomHeight + 2 * LAP_IN_EMS;
                stack.add(makeInner(p.repeat(), innerHeight, options));
            } else {
                final double innerHeight = (realHeightTotal - topHeight - bottomHeight - middleHeight) / 2
                    + 2 * LAP_IN_EMS;
                stack.add(makeInner(p.repeat(), innerHeight, options));
                stack.add(LAP);
                stack.add(makeGlyphSpan(p.middle(), p.font(), mode));
                stack.add(LAP);
                stack.add(makeInner(p.repeat(), innerHeight, options));
            }
            stack.add(LAP);
            stack.add(makeGlyphSpan(p.top(), p.font(), mode));
        }

        final Options newOptions = options.havingBaseStyle(Style.TEXT);
        final BoxNode.Span inner = VList.bottom(depth, stack).build();
        return styleWrap(BuildCommon.makeSpan(List.of("delimsizing", "mult"), List.of(inner), newOptions),
            Style.TEXT, options, classes);
    }

    /// The radical sign, its advance width and the thickness of its vinculum.
    record SqrtImage(BoxNode.Span span, double advanceWidth, double ruleWidth) {
    }

    private static BoxNode.Span sqrtSvg(String sqrtName, double height, long viewBoxHeight, double extraVinculum,
                                        Options options) {
        final var path = new BoxNode.Path(sqrtName,
            SvgGeometry.squareRootPath(sqrtName, extraVinculum, viewBoxHeight));
        final var attrs = new LinkedHashMap<String, String>();
        attrs.put("width", "400em");
        attrs.put("height", Units.makeEm(height));
        attrs.put("viewBox", "0 0 400000 " + viewBoxHeight);
        attrs.put("preserveAspectRatio", "xMinYMin slice");
        return BuildCommon.makeSpan(List.of("hide-tail"), List.of(BuildCommon.makeSvg(List.of(path), attrs)),
            options);
    }

    /// A radical sign tall enough to cover `height` em of body.
    static SqrtImage makeSqrtImage(double height, Options options) {
        final Options newOptions = options.havingBaseSizing();
        final Candidate delim = traverseSequence("\\surd", height * newOptions.sizeMultiplier(),
            STACK_LARGE_SEQUENCE, newOptions);
        double sizeMultiplier = newOptions.sizeMultiplier();
        final double extraVinculum = Math.max(0,
            options.minRuleThickness() - options.fontMetrics().sqrtRuleThickness());

        final BoxNode.Span span;
        final double spanHeight;
        final double texHeight;
        final double advanceWidth;
        if (delim instanceof Small) {
            final long viewBoxHeight = 1000 + Math.round(1000 * extraVinculum) + VB_PAD;
            if (height < 1.0) {
                sizeMultiplier = 1.0;
            } else if (height < 1.4) {
                sizeMultiplier = 0.7;
            }
            spanHeight = (1.0 + extraVinculum + EM_PAD) / sizeMultiplier;
            texHeight = (1.0 + extraVinculum) / sizeMultiplier;
            span = sqrtSvg("sqrtMain", spanHeight, viewBoxHeight, extraVinculum, options);
            span.setStyle("min-width", "0.853em");
            advanceWidth = 0.833 / sizeMultiplier;
        } else if (delim instanceof Large large) {
            final long viewBoxHeight = Math.round((1000 + VB_PAD) * SIZE_TO_MAX_HEIGHT[large.size()]);
            texHeight = (SIZE_TO_MAX_HEIGHT[large.size()] + extraVinculum) / sizeMultiplier;
            spanHeight = (SIZE_TO_MAX_HEIGHT[large.size()] + extraVinculum + EM_PAD) / sizeMultiplier;
            span = sqrtSvg("sqrtSize" + large.size(), spanHeight, viewBoxHeight, extraVinculum, options);
            span.setStyle("min-width", "1.02em");
            advanceWidth = 1.0 / sizeMultiplier;
        } else {
            spanHeight = height + extraVinculum + EM_PAD;
            texHeight = height + extraVinculum;
            final long viewBoxHeight = Math.round(1000 * height + extraVinculum) + VB_PAD;
            span = sqrtSvg("sqrtTall", spanHeight, viewBoxHeight, extraVinculum, options);
            span.setStyle("min-width", "0.742em");
            advanceWidth = 1.056;
        }
        span.height = texHeight;
        span.setStyle("height", Units.makeEm(spanHeight));
        return new SqrtImage(span, advanceWidth,
            (options.fontMetrics().sqrtRuleThickness() + extraVinculum) * sizeMultiplier);
    }

    private static String normalize(String delim) {
        return switch (delim) {
            case "<", "\\lt", "⟨" -> "\\langle";
            case ">", "\\gt", "⟩" -> "\\rangle";
            default -> delim;
        };
    }

    /// A delimiter at one of the four `\big` sizes.
    ///
    /// @throws TexParseException if `delim` cannot be sized
    static BoxNode.Span sizedDelim(String delim, int size, Options options, Mode mode, List<String> classes) {
        final String d = normalize(delim);
        if (STACK_LARGE.contains(d) || STACK_NEVER.contains(d)) {
            return makeLargeDelim(d, size, false, options, mode, classes);
        }
        if (STACK_ALWAYS.contains(d)) {
            return makeStackedDelim(d, SIZE_TO_MAX_HEIGHT[size], false, options, mode, classes);
        }
        throw new TexParseException("Illegal delimiter: '" + delim + "'");
    }

    private static String candidateFont(Candidate candidate) {
        if (candidate instanceof Small) {
            return "Main-Regular";
        } else if (candidate instanceof Large large) {
            return "Size" + large.size() + "-Regular";
        }
        return "Size4-Regular";
    }

    /// The first candidate whose glyph is taller than `height`, or the last
    /// candidate when none is.
    static Candidate traverseSequence(String delim, double height, List<Candidate> sequence, Options options) {
        // script styles skip the candidates smaller than themselves
        final int start = Math.min(2, 3 - options.style().size());
        for (int i = start; i < sequence.size(); i++) {
            final Candidate candidate = sequence.get(i);
            if (candidate instanceof Stack) {
                break;
            }
            final FontMetrics.CharacterMetrics m = metrics(delim, candidateFont(candidate), Mode.MATH);
            if (m == null) {
                continue;
            }
            double heightDepth = m.height() + m.depth();
            if (candidate instanceof Small small) {
                heightDepth *= options.havingBaseStyle(small.style()).sizeMultiplier();
            }
            if (heightDepth > height) {
                return candidate;
            }
        }
        return sequence.get(sequence.size() - 1);
    }

    static List<Candidate> sequenceFor(String delim) {
        if (STACK_NEVER.contains(delim)) {
            return STACK_NEVER_SEQUENCE;
        } else if (STACK_LARGE.contains(delim)) {
            return STACK_LARGE_SEQUENCE;
        }
        return STACK_ALWAYS_SEQUENCE;
    }

    /// A delimiter whose height plus depth is at least `height`, when the
    /// sequence allows one.
    static BoxNode.Span customSizedDelim(String delim, double height, boolean center, Options options, Mode mode,
                                         List<String> classes) {
        final String d = normalize(delim);
        final Candidate candidate = traverseSequence(d, height, sequenceFor(d), options);
        if (candidate instanceof Small small) {
            return makeSmallDelim(d, small.style(), center, options, mode, classes);
        } else if (candidate instanceof Large large) {
            return makeLargeDelim(d, large.size(), center, options, mode, classes);
        }
        return makeStackedDelim(d, height, center, options, mode, classes);
    }

    /// A delimiter for `\left`/`\right` around content of the given extents,
    /// sized symmetrically about the math axis.
    static BoxNode.Span leftRightDelim(String delim, double height, double depth, Options options, Mode mode,
                                       List<String> classes) {
        final double axisHeight = options.fontMetrics().axisHeight() * options.sizeMultiplier();
        final double delimiterFactor = 901;
        final double delimiterExtend = 5.0 / options.fontMetrics().ptPerEm();
        final double maxDistFromAxis = Math.max(height - axisHeight, depth + axisHeight);
        final double totalHeight = Math.max(maxDistFromAxis / 500 * delimiterFactor,
            2 * maxDistFromAxis - delimiterExtend);
        return customSizedDelim(delim, totalHeight, true, options, mode, classes);
    }
}
