package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A node of the MathML tree.
public sealed interface MathDomNode permits MathDomNode.MathNode, MathDomNode.TextNode, MathDomNode.SpaceNode {

    void writeMarkup(StringBuilder sb);

    /// The plain text content, used for operator names and `\operatorname`.
    String toText();

    default String toMarkup() {
        final var sb = new StringBuilder();
        writeMarkup(sb);
        return sb.toString();
    }

    /// An element such as `mi`, `mrow` or `mfrac`.
    final class MathNode implements MathDomNode {
        private final String type;
        private final List<MathDomNode> children;
        private final List<String> classes = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public MathNode(String type, List<? extends MathDomNode> children) {
            this.type = type;
            this.children = new ArrayList<>(children);
        }

        public MathNode(String type) {
            this(type, List.of());
        }

        public String type() {
            return type;
        }

        public List<MathDomNode> children() {
            return children;
        }

        public List<String> classes() {
            return classes;
        }

        public MathNode setAttribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public String attribute(String name) {
            return attributes.get(name);
        }

        /// A copy of this element under another tag name.
        public MathNode withType(String newType) {
            final var copy = new MathNode(newType, children);
            copy.classes.addAll(classes);
            copy.attributes.putAll(attributes);
            return copy;
        }

        @Override
        public void writeMarkup(StringBuilder sb) {
            sb.append('<').append(type);
            attributes.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(BoxNode.escape(v)).append('"'));
            if (!classes.isEmpty()) {
                sb.append(" class=\"").append(BoxNode.escape(String.join(" ", classes))).append('"');
            }
            sb.append('>');
            for (final MathDomNode child : children) {
                child.writeMarkup(sb);
            }
            sb.append("</").append(type).append('>');
        }

        @Override
        public String toText() {
            final var sb = new StringBuilder();
            for (final MathDomNode child : children) {
                sb.append(child.toText());
            }
            return sb.toString();
        }
    }

    /// Character data.
    record TextNode(String text) implements MathDomNode {
        @Override
        public void writeMarkup(StringBuilder sb) {
            sb.append(BoxNode.escape(text));
        }

        @Override
        public String toText() {
            return text;
        }
    }

    /// Horizontal space in em. Widths matching a Unicode space character are
    /// written as that character in an `mtext`.
    record SpaceNode(double width) implements MathDomNode {
        private String character() {
            if (width >= 0.05555 && width <= 0.05556) {
                return "\u200a";
            } else if (width >= 0.1666 && width <= 0.1667) {
                return "\u2009";
            } else if (width >= 0.2222 && width <= 0.2223) {
                return "\u2005";
            } else if (width >= 0.2777 && width <= 0.2778) {
                return "\u2005\u200a";
            } else if (width >= -0.05556 && width <= -0.05555) {
                return "\u200a\u2063";
            } else if (width >= -0.1667 && width <= -0.1666) {
                return "\u2009\u2063";
            } else if (width >= -0.2223 && width <= -0.2222) {
                return "\u205f\u2063";
            } else if (width >= -0.2778 && width <= -0.2777) {
                return "\u2005\u2063";
            }
            return null;
        }

        @Override
        public void writeMarkup(StringBuilder sb) {
            final String character = character();
            if (character != null) {
                sb.append("<mtext>").append(character).append("</mtext>");
            } else {
                sb.append("<mspace width=\"").append(Units.makeEm(width)).append("\"/>");
            }
        }

        @Override
        public String toText() {
            final String character = character();
            return character != null ? character : " ";
        }
    }
}
