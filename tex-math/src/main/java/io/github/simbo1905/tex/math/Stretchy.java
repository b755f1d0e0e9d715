package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Elements that stretch to the width of their content: wide accents, over
/// and under arrows, braces, extensible arrows and the enclosure shapes.
final class Stretchy {

    private static final Map<String, String> CODE_POINTS = Map.ofEntries(
        Map.entry("widehat", "^"),
        Map.entry("widecheck", "ˇ"),
        Map.entry("widetilde", "~"),
        Map.entry("utilde", "~"),
        Map.entry("overleftarrow", "←"),
        Map.entry("underleftarrow", "←"),
        Map.entry("xleftarrow", "←"),
        Map.entry("overrightarrow", "→"),
        Map.entry("underrightarrow", "→"),
        Map.entry("xrightarrow", "→"),
        Map.entry("underbrace", "⏟"),
        Map.entry("overbrace", "⏞"),
        Map.entry("overgroup", "⏠"),
        Map.entry("undergroup", "⏡"),
        Map.entry("overleftrightarrow", "↔"),
        Map.entry("underleftrightarrow", "↔"),
        Map.entry("xleftrightarrow", "↔"),
        Map.entry("Overrightarrow", "⇒"),
        Map.entry("xRightarrow", "⇒"),
        Map.entry("overleftharpoon", "↼"),
        Map.entry("xleftharpoonup", "↼"),
        Map.entry("overrightharpoon", "⇀"),
        Map.entry("xrightharpoonup", "⇀"),
        Map.entry("xLeftarrow", "⇐"),
        Map.entry("xLeftrightarrow", "⇔"),
        Map.entry("xhookleftarrow", "↩"),
        Map.entry("xhookrightarrow", "↪"),
        Map.entry("xmapsto", "↦"),
        Map.entry("xrightharpoondown", "⇁"),
        Map.entry("xleftharpoondown", "↽"),
        Map.entry("xrightleftharpoons", "⇌"),
        Map.entry("xleftrightharpoons", "⇋"),
        Map.entry("xtwoheadleftarrow", "↞"),
        Map.entry("xtwoheadrightarrow", "↠"),
        Map.entry("xlongequal", "="),
        Map.entry("xtofrom", "⇄"),
        Map.entry("xrightleftarrows", "⇄"),
        Map.entry("xrightequilibrium", "⇌"),
        Map.entry("xleftequilibrium", "⇋"),
        Map.entry("cdrightarrow", "→"),
        Map.entry("cdleftarrow", "←"),
        Map.entry("cdlongequal", "=")
    );

    /// Drawing data: the paths, the minimum width in em, the viewBox height
    /// and, for single-path images, the alignment that keeps the arrow head.
    private record Image(List<String> paths, double minWidth, int viewBoxHeight, String align) {
        Image(List<String> paths, double minWidth, int viewBoxHeight) {
            this(paths, minWidth, viewBoxHeight, "xMinYMin");
        }
    }

    private static final Map<String, Image> IMAGES = Map.ofEntries(
        Map.entry("overrightarrow", new Image(List.of("rightarrow"), 0.888, 522, "xMaxYMin")),
        Map.entry("overleftarrow", new Image(List.of("leftarrow"), 0.888, 522, "xMinYMin")),
        Map.entry("underrightarrow", new Image(List.of("rightarrow"), 0.888, 522, "xMaxYMin")),
        Map.entry("underleftarrow", new Image(List.of("leftarrow"), 0.888, 522, "xMinYMin")),
        Map.entry("xrightarrow", new Image(List.of("rightarrow"), 1.469, 522, "xMaxYMin")),
        Map.entry("cdrightarrow", new Image(List.of("rightarrow"), 3.0, 522, "xMaxYMin")),
        Map.entry("xleftarrow", new Image(List.of("leftarrow"), 1.469, 522, "xMinYMin")),
        Map.entry("cdleftarrow", new Image(List.of("leftarrow"), 3.0, 522, "xMinYMin")),
        Map.entry("Overrightarrow", new Image(List.of("doublerightarrow"), 0.888, 560, "xMaxYMin")),
        Map.entry("xRightarrow", new Image(List.of("doublerightarrow"), 1.526, 560, "xMaxYMin")),
        Map.entry("xLeftarrow", new Image(List.of("doubleleftarrow"), 1.526, 560, "xMinYMin")),
        Map.entry("overleftharpoon", new Image(List.of("leftharpoon"), 0.888, 522, "xMinYMin")),
        Map.entry("xleftharpoonup", new Image(List.of("leftharpoon"), 0.888, 522, "xMinYMin")),
        Map.entry("xleftharpoondown", new Image(List.of("leftharpoondown"), 0.888, 522, "xMinYMin")),
        Map.entry("overrightharpoon", new Image(List.of("rightharpoon"), 0.888, 522, "xMaxYMin")),
        Map.entry("xrightharpoonup", new Image(List.of("rightharpoon"), 0.888, 522, "xMaxYMin")),
        Map.entry("xrightharpoondown", new Image(List.of("rightharpoondown"), 0.888, 522, "xMaxYMin")),
        Map.entry("xlongequal", new Image(List.of("longequal"), 0.888, 334, "xMinYMin")),
        Map.entry("cdlongequal", new Image(List.of("longequal"), 3.0, 334, "xMinYMin")),
        Map.entry("xtwoheadleftarrow", new Image(List.of("twoheadleftarrow"), 0.888, 334, "xMinYMin")),
        Map.entry("xtwoheadrightarrow", new Image(List.of("twoheadrightarrow"), 0.888, 334, "xMaxYMin")),
        Map.entry("overleftrightarrow", new Image(List.of("leftarrow", "rightarrow"), 0.888, 522)),
        Map.entry("overbrace", new Image(List.of("leftbrace", "midbrace", "rightbrace"), 1.6, 548)),
        Map.entry("underbrace", new Image(List.of("leftbraceunder", "midbraceunder", "rightbraceunder"), 1.6, 548)),
        Map.entry("underleftrightarrow", new Image(List.of("leftarrow", "rightarrow"), 0.888, 522)),
        Map.entry("xleftrightarrow", new Image(List.of("leftarrow", "rightarrow"), 1.75, 522)),
        Map.entry("xLeftrightarrow", new Image(List.of("doubleleftarrow", "doublerightarrow"), 1.75, 560)),
        Map.entry("xrightleftharpoons", new Image(List.of("leftharpoondownplus", "rightharpoonplus"), 1.75, 716)),
        Map.entry("xleftrightharpoons", new Image(List.of("leftharpoonplus", "rightharpoonplus"), 1.75, 716)),
        Map.entry("xhookleftarrow", new Image(List.of("leftarrow", "righthook"), 1.08, 522)),
        Map.entry("xhookrightarrow", new Image(List.of("lefthook", "rightarrow"), 1.08, 522)),
        Map.entry("overlinesegment", new Image(List.of("leftlinesegment", "rightlinesegment"), 0.888, 522)),
        Map.entry("underlinesegment", new Image(List.of("leftlinesegment", "rightlinesegment"), 0.888, 522)),
        Map.entry("overgroup", new Image(List.of("leftgroup", "rightgroup"), 0.888, 342)),
        Map.entry("undergroup", new Image(List.of("leftgroupunder", "rightgroupunder"), 0.888, 342)),
        Map.entry("xmapsto", new Image(List.of("leftmapsto", "rightarrow"), 1.5, 522)),
        Map.entry("xtofrom", new Image(List.of("leftToFrom", "rightToFrom"), 1.75, 528)),
        Map.entry("xrightleftarrows", new Image(List.of("baraboveleftarrow", "rightarrowabovebar"), 1.75, 901)),
        Map.entry("xrightequilibrium",
            new Image(List.of("baraboveshortleftharpoon", "rightharpoonaboveshortbar"), 1.75, 716)),
        Map.entry("xleftequilibrium",
            new Image(List.of("shortbaraboveleftharpoon", "shortrightharpoonabovebar"), 1.75, 716))
    );

    private Stretchy() {}

    private static String strip(String label) {
        int start = 0;
        while (start < label.length() && label.charAt(start) == '\\') {
            start++;
        }
        return label.substring(start);
    }

    static boolean hasImage(String label) {
        return IMAGES.containsKey(strip(label));
    }

    /// A stretchy `mo` for the MathML tree.
    static MathDomNode.MathNode mathMlNode(String label) {
        final var node = new MathDomNode.MathNode("mo",
            List.of(new MathDomNode.TextNode(CODE_POINTS.getOrDefault(strip(label), ""))));
        node.setAttribute("stretchy", "true");
        return node;
    }

    private static int groupLength(ParseNode base) {
        return base instanceof ParseNode.OrdGroup group ? group.body().size() : 1;
    }

    private static Map<String, String> svgAttrs(String width, double height, String viewBox, String aspect) {
        final var attrs = new LinkedHashMap<String, String>();
        attrs.put("width", width);
        attrs.put("height", Units.makeEm(height));
        attrs.put("viewBox", viewBox);
        attrs.put("preserveAspectRatio", aspect);
        return attrs;
    }

    /// The drawing for a stretchy `label` over or under `base`. The result has
    /// zero depth; callers place it relative to the baseline.
    static BoxNode.Span svgSpan(String rawLabel, ParseNode base, Options options) {
        final String label = strip(rawLabel);
        final BoxNode.Span span;
        double minWidth = 0;
        final double height;

        if (label.equals("widehat") || label.equals("widecheck") || label.equals("widetilde")
            || label.equals("utilde")) {
            final int numChars = base == null ? 1 : groupLength(base);
            final boolean hat = label.equals("widehat") || label.equals("widecheck");
            final int viewBoxWidth;
            final int viewBoxHeight;
            final String pathName;
            if (numChars > 5) {
                viewBoxHeight = hat ? 420 : 312;
                viewBoxWidth = hat ? 2364 : 2340;
                height = hat ? 0.42 : 0.34;
                pathName = (hat ? label : "tilde") + "4";
            } else {
                final int imgIndex = new int[] {1, 1, 2, 2, 3, 3}[numChars];
                if (hat) {
                    viewBoxWidth = new int[] {0, 1062, 2364, 2364, 2364}[imgIndex];
                    viewBoxHeight = new int[] {0, 239, 300, 360, 420}[imgIndex];
                    height = new double[] {0, 0.24, 0.3, 0.3, 0.36, 0.42}[imgIndex];
                    pathName = label + imgIndex;
                } else {
                    viewBoxWidth = new int[] {0, 600, 1033, 2339, 2340}[imgIndex];
                    viewBoxHeight = new int[] {0, 260, 286, 306, 312}[imgIndex];
                    height = new double[] {0, 0.26, 0.286, 0.3, 0.306, 0.34}[imgIndex];
                    pathName = "tilde" + imgIndex;
                }
            }
            final var path = new BoxNode.Path(pathName, SvgGeometry.path(pathName));
            span = BuildCommon.makeSpan(List.of(), List.of(BuildCommon.makeSvg(List.of(path),
                svgAttrs("100%", height, "0 0 " + viewBoxWidth + " " + viewBoxHeight, "none"))), options);
        } else {
            final Image image = IMAGES.get(label);
            if (image == null) {
                throw new TexParseException("Unknown stretchy element '" + rawLabel + "'");
            }
            minWidth = image.minWidth();
            height = image.viewBoxHeight() / 1000.0;
            final int n = image.paths().size();
            final List<String> widthClasses;
            final List<String> aligns;
            switch (n) {
                case 1 -> {
                    widthClasses = List.of("hide-tail");
                    aligns = List.of(image.align());
                }
                case 2 -> {
                    widthClasses = List.of("halfarrow-left", "halfarrow-right");
                    aligns = List.of("xMinYMin", "xMaxYMin");
                }
                case 3 -> {
                    widthClasses = List.of("brace-left", "brace-center", "brace-right");
                    aligns = List.of("xMinYMin", "xMidYMin", "xMaxYMin");
                }
                default -> throw new IllegalStateException("stretchy image with " + n + " paths");
            }
            final List<BoxNode> spans = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                final String pathName = image.paths().get(i);
                final var path = new BoxNode.Path(pathName, SvgGeometry.path(pathName));
                final BoxNode.Span part = BuildCommon.makeSpan(List.of(widthClasses.get(i)),
                    List.of(BuildCommon.makeSvg(List.of(path), svgAttrs("400em", height,
                        "0 0 400000 " + image.viewBoxHeight(), aligns.get(i) + " slice"))), options);
                if (n > 1) {
                    part.setStyle("height", Units.makeEm(height));
                }
                spans.add(part);
            }
            span = n == 1 ? (BoxNode.Span) spans.get(0) : BuildCommon.makeSpan(List.of("stretchy"), spans, options);
        }

        span.height = height;
        span.depth = 0;
        span.setStyle("height", Units.makeEm(height));
        if (minWidth > 0) {
            span.setStyle("min-width", Units.makeEm(minWidth));
        }
        return span;
    }

    /// The box or strike lines drawn around `inner` by `\fbox`, `\colorbox`,
    /// `\cancel` and their relatives.
    static BoxNode.Span encloseSpan(BoxNode inner, String label, double topPad, double bottomPad, Options options) {
        final double totalHeight = inner.height + inner.depth + topPad + bottomPad;
        final BoxNode.Span img;
        if (label.contains("fbox") || label.contains("color") || label.contains("angl")) {
            img = BuildCommon.makeSpan(List.of("stretchy", label), List.of(), options);
            if ("fbox".equals(label) && options.color() != null) {
                img.setStyle("border-color", options.getColor());
            }
        } else {
            final List<BoxNode> lines = new ArrayList<>();
            if (label.equals("bcancel") || label.equals("xcancel")) {
                lines.add(new BoxNode.Line(lineAttrs("0", "0", "100%", "100%")));
            }
            if (label.equals("cancel") || label.equals("xcancel")) {
                lines.add(new BoxNode.Line(lineAttrs("0", "100%", "100%", "0")));
            }
            final var attrs = new LinkedHashMap<String, String>();
            attrs.put("width", "100%");
            attrs.put("height", Units.makeEm(totalHeight));
            img = BuildCommon.makeSpan(List.of(), List.of(BuildCommon.makeSvg(lines, attrs)), options);
        }
        img.height = totalHeight;
        img.setStyle("height", Units.makeEm(totalHeight));
        return img;
    }

    private static Map<String, String> lineAttrs(String x1, String y1, String x2, String y2) {
        final var attrs = new LinkedHashMap<String, String>();
        attrs.put("x1", x1);
        attrs.put("y1", y1);
        attrs.put("x2", x2);
        attrs.put("y2", y2);
        attrs.put("stroke-width", "0.046em");
        return attrs;
    }
}
