package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// A node of the HTML box tree.
///
/// Nodes carry CSS classes, inline style declarations (keys are CSS property
/// names such as `margin-right`), attributes, and the extents the layout
/// needs: `height` above the baseline, `depth` below it, `width`, and the
/// largest font size multiplier inside. Builders fill nodes in bottom-up and
/// parents only read them once a child is attached.
public abstract sealed class BoxNode
    permits BoxNode.Span, BoxNode.Anchor, BoxNode.Img, BoxNode.Symbol, BoxNode.Svg, BoxNode.Path, BoxNode.Line,
    BoxNode.Fragment {

    private static final Pattern INVALID_ATTRIBUTE_NAME = Pattern.compile("[\\s\"'>/=\\x00-\\x1f]");

    final List<String> classes = new ArrayList<>();
    final Map<String, String> style = new LinkedHashMap<>();
    final Map<String, String> attributes = new LinkedHashMap<>();
    double height;
    double depth;
    double width;
    double maxFontSize;

    BoxNode(List<String> classes) {
        for (final String c : classes) {
            if (c != null && !c.isEmpty()) {
                this.classes.add(c);
            }
        }
    }

    public List<String> classes() {
        return classes;
    }

    public boolean hasClass(String name) {
        return classes.contains(name);
    }

    public BoxNode addClass(String name) {
        if (!classes.contains(name)) {
            classes.add(name);
        }
        return this;
    }

    public Map<String, String> style() {
        return style;
    }

    public String style(String property) {
        return style.get(property);
    }

    public BoxNode setStyle(String property, String value) {
        if (value == null) {
            style.remove(property);
        } else {
            style.put(property, value);
        }
        return this;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    /// @throws TexParseException if the name could break out of the tag
    public BoxNode setAttribute(String name, String value) {
        if (INVALID_ATTRIBUTE_NAME.matcher(name).find()) {
            throw new TexParseException("Invalid attribute name '" + name + "'");
        }
        attributes.put(name, value);
        return this;
    }

    public double height() {
        return height;
    }

    public double depth() {
        return depth;
    }

    public double width() {
        return width;
    }

    public double maxFontSize() {
        return maxFontSize;
    }

    public List<BoxNode> children() {
        return List.of();
    }

    /// Serializes this subtree to HTML.
    public final String toMarkup() {
        final var sb = new StringBuilder();
        writeMarkup(sb);
        return sb.toString();
    }

    abstract void writeMarkup(StringBuilder sb);

    final void openTag(StringBuilder sb, String tag) {
        sb.append('<').append(tag);
        if (!classes.isEmpty()) {
            sb.append(" class=\"").append(escape(String.join(" ", classes))).append('"');
        }
        final String styles = styleText();
        if (!styles.isEmpty()) {
            sb.append(" style=\"").append(escape(styles)).append('"');
        }
        writeAttributes(sb);
        sb.append('>');
    }

    final String styleText() {
        final var sb = new StringBuilder();
        style.forEach((k, v) -> sb.append(k).append(':').append(v).append(';'));
        return sb.toString();
    }

    final void writeAttributes(StringBuilder sb) {
        attributes.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(escape(v)).append('"'));
    }

    static String escape(String text) {
        final var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /// A `span` container.
    public static final class Span extends BoxNode {
        final List<BoxNode> children;
        /// Set on a `\middle` delimiter until its `\left...\right` resizes it.
        DelimiterFunctions.MiddleMark middle;

        Span(List<String> classes, List<? extends BoxNode> children) {
            super(classes);
            this.children = new ArrayList<>(children);
        }

        @Override
        public List<BoxNode> children() {
            return children;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            openTag(sb, "span");
            for (final BoxNode child : children) {
                child.writeMarkup(sb);
            }
            sb.append("</span>");
        }
    }

    /// A link.
    public static final class Anchor extends BoxNode {
        final List<BoxNode> children;

        Anchor(String href, List<String> classes, List<? extends BoxNode> children) {
            super(classes);
            this.children = new ArrayList<>(children);
            setAttribute("href", href);
        }

        @Override
        public List<BoxNode> children() {
            return children;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            openTag(sb, "a");
            for (final BoxNode child : children) {
                child.writeMarkup(sb);
            }
            sb.append("</a>");
        }
    }

    /// An image.
    public static final class Img extends BoxNode {
        final String src;
        final String alt;

        Img(String src, String alt) {
            super(List.of("mord"));
            this.src = src;
            this.alt = alt;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            sb.append("<img src=\"").append(escape(src)).append("\" alt=\"").append(escape(alt)).append('"');
            final String styles = styleText();
            if (!styles.isEmpty()) {
                sb.append(" style=\"").append(escape(styles)).append('"');
            }
            sb.append("/>");
        }
    }

    /// A glyph. Written bare when it has no classes or styles.
    public static final class Symbol extends BoxNode {
        String text;
        double italic;
        double skew;

        Symbol(String text, double height, double depth, double italic, double skew, double width,
               List<String> classes) {
            super(classes);
            this.text = text;
            this.height = height;
            this.depth = depth;
            this.italic = italic;
            this.skew = skew;
            this.width = width;
            if (!text.isEmpty()) {
                final UnicodeData.Script script = UnicodeData.scriptFromCodepoint(text.codePointAt(0));
                if (script != null) {
                    this.classes.add(script.cssName() + "_fallback");
                }
            }
        }

        public String text() {
            return text;
        }

        public double italic() {
            return italic;
        }

        public double skew() {
            return skew;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            String styles = styleText();
            if (italic > 0) {
                styles = "margin-right:" + Units.makeEm(italic) + ";" + styles;
            }
            if (classes.isEmpty() && styles.isEmpty()) {
                sb.append(escape(text));
                return;
            }
            sb.append("<span");
            if (!classes.isEmpty()) {
                sb.append(" class=\"").append(escape(String.join(" ", classes))).append('"');
            }
            if (!styles.isEmpty()) {
                sb.append(" style=\"").append(escape(styles)).append('"');
            }
            sb.append('>').append(escape(text)).append("</span>");
        }
    }

    /// An inline SVG drawing of paths and lines.
    public static final class Svg extends BoxNode {
        final List<BoxNode> children;

        Svg(List<? extends BoxNode> children, Map<String, String> attributes) {
            super(List.of());
            this.children = new ArrayList<>(children);
            attributes.forEach(this::setAttribute);
        }

        @Override
        public List<BoxNode> children() {
            return children;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\"");
            writeAttributes(sb);
            sb.append('>');
            for (final BoxNode child : children) {
                child.writeMarkup(sb);
            }
            sb.append("</svg>");
        }
    }

    /// An SVG path.
    public static final class Path extends BoxNode {
        final String pathName;
        final String data;

        Path(String pathName, String data) {
            super(List.of());
            this.pathName = pathName;
            this.data = data;
        }

        public String pathName() {
            return pathName;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            sb.append("<path d=\"").append(escape(data)).append("\"/>");
        }
    }

    /// An SVG line.
    public static final class Line extends BoxNode {
        Line(Map<String, String> attributes) {
            super(List.of());
            attributes.forEach(this::setAttribute);
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            sb.append("<line");
            writeAttributes(sb);
            sb.append("/>");
        }
    }

    /// A classless run of nodes written back to back.
    public static final class Fragment extends BoxNode {
        final List<BoxNode> children;

        Fragment(List<? extends BoxNode> children) {
            super(List.of());
            this.children = new ArrayList<>(children);
        }

        @Override
        public List<BoxNode> children() {
            return children;
        }

        @Override
        void writeMarkup(StringBuilder sb) {
            for (final BoxNode child : children) {
                child.writeMarkup(sb);
            }
        }
    }
}
