package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Converts a parse tree into presentation MathML.
///
/// Adjacent `mtext` runs and digit runs are merged so numbers such as
/// `3.14` come out as one `mn`.
public final class MathMlBuilder {

    private final Registry registry;

    MathMlBuilder(Registry registry) {
        this.registry = registry;
    }

    /// A text node for `text`, with the symbol table's replacement glyph
    /// except for typewriter ligatures.
    public static MathDomNode.TextNode makeText(String text, Mode mode, Options options) {
        final Symbols.Symbol symbol = Symbols.get(mode, text);
        if (symbol != null && symbol.replace() != null && text.charAt(0) != 0xD835
            && !(Symbols.isLigature(text) && options != null
            && (options.fontFamily().contains("tt") || options.font().contains("tt")))) {
            return new MathDomNode.TextNode(symbol.replace());
        }
        return new MathDomNode.TextNode(text);
    }

    public static MathDomNode.TextNode makeText(String text, Mode mode) {
        return makeText(text, mode, null);
    }

    /// Wraps `body` in an `mrow` unless it is a single node.
    public static MathDomNode makeRow(List<MathDomNode> body) {
        if (body.size() == 1) {
            return body.get(0);
        }
        return new MathDomNode.MathNode("mrow", body);
    }

    /// The `mathvariant` for a symbol under the current font, or null for the
    /// default.
    public static String variant(ParseNode.SymbolNode group, Options options) {
        final String weight = options.fontWeight();
        final String shape = options.fontShape();
        if ("texttt".equals(options.fontFamily())) {
            return "monospace";
        } else if ("textsf".equals(options.fontFamily())) {
            if ("textit".equals(shape) && "textbf".equals(weight)) {
                return "sans-serif-bold-italic";
            } else if ("textit".equals(shape)) {
                return "sans-serif-italic";
            } else if ("textbf".equals(weight)) {
                return "bold-sans-serif";
            }
            return "sans-serif";
        } else if ("textit".equals(shape) && "textbf".equals(weight)) {
            return "bold-italic";
        } else if ("textit".equals(shape)) {
            return "italic";
        } else if ("textbf".equals(weight)) {
            return "bold";
        }

        final String font = options.font();
        if (font.isEmpty() || "mathnormal".equals(font)) {
            return null;
        }
        switch (font) {
            case "mathit":
                return "italic";
            case "boldsymbol":
                return group instanceof ParseNode.TextOrd ? "bold" : "bold-italic";
            case "mathbf":
                return "bold";
            case "mathbb":
                return "double-struck";
            case "mathsfit":
                return "sans-serif-italic";
            case "mathfrak":
                return "fraktur";
            case "mathscr":
            case "mathcal":
                return "script";
            case "mathsf":
                return "sans-serif";
            case "mathtt":
                return "monospace";
            default:
                break;
        }
        String text = group.text();
        if ("\\imath".equals(text) || "\\jmath".equals(text)) {
            return null;
        }
        final Symbols.Symbol symbol = Symbols.get(group.mode(), text);
        if (symbol != null && symbol.replace() != null) {
            text = symbol.replace();
        }
        final BuildCommon.MathFont mathFont = BuildCommon.FONT_MAP.get(font);
        if (mathFont != null && FontMetrics.character(text, mathFont.fontName(), group.mode()) != null) {
            return mathFont.variant();
        }
        return null;
    }

    private static boolean isType(MathDomNode node, String type) {
        return node instanceof MathDomNode.MathNode mathNode && mathNode.type().equals(type);
    }

    private static String singleText(MathDomNode.MathNode node) {
        if (node.children().size() == 1 && node.children().get(0) instanceof MathDomNode.TextNode text) {
            return text.text();
        }
        return null;
    }

    /// A `.` identifier or a separator comma, both of which join digit runs.
    private static boolean isNumberPunctuation(MathDomNode group) {
        if (!(group instanceof MathDomNode.MathNode node)) {
            return false;
        }
        if (node.type().equals("mi") && ".".equals(singleText(node))) {
            return true;
        }
        return node.type().equals("mo") && "true".equals(node.attribute("separator"))
            && "0em".equals(node.attribute("lspace")) && "0em".equals(node.attribute("rspace"))
            && ",".equals(singleText(node));
    }

    public List<MathDomNode> buildExpression(List<ParseNode> expression, Options options) {
        return buildExpression(expression, options, false);
    }

    /// Builds a list of nodes. Inside an ord group a lone operator loses its
    /// surrounding space.
    public List<MathDomNode> buildExpression(List<ParseNode> expression, Options options, boolean isOrdGroup) {
        if (expression.size() == 1) {
            final MathDomNode group = buildGroup(expression.get(0), options);
            if (isOrdGroup && group instanceof MathDomNode.MathNode node && node.type().equals("mo")) {
                node.setAttribute("lspace", "0em");
                node.setAttribute("rspace", "0em");
            }
            final List<MathDomNode> single = new ArrayList<>();
            single.add(group);
            return single;
        }

        final List<MathDomNode> groups = new ArrayList<>();
        MathDomNode lastGroup = null;
        for (final ParseNode expr : expression) {
            final MathDomNode group = buildGroup(expr, options);
            if (group instanceof MathDomNode.MathNode node && lastGroup instanceof MathDomNode.MathNode last) {
                if (node.type().equals("mtext") && last.type().equals("mtext")
                    && Objects.equals(node.attribute("mathvariant"), last.attribute("mathvariant"))) {
                    last.children().addAll(node.children());
                    continue;
                } else if (node.type().equals("mn") && last.type().equals("mn")) {
                    last.children().addAll(node.children());
                    continue;
                } else if (isNumberPunctuation(node) && last.type().equals("mn")) {
                    last.children().addAll(node.children());
                    continue;
                } else if (node.type().equals("mn") && isNumberPunctuation(last)) {
                    node.children().addAll(0, last.children());
                    groups.remove(groups.size() - 1);
                } else if ((node.type().equals("msup") || node.type().equals("msub")) && !node.children().isEmpty()
                    && (last.type().equals("mn") || isNumberPunctuation(last))) {
                    if (node.children().get(0) instanceof MathDomNode.MathNode base && base.type().equals("mn")) {
                        base.children().addAll(0, last.children());
                        groups.remove(groups.size() - 1);
                    }
                } else if (last.type().equals("mi") && "\u0338".equals(singleText(last))
                    && (node.type().equals("mo") || node.type().equals("mi") || node.type().equals("mn"))
                    && !node.children().isEmpty()
                    && node.children().get(0) instanceof MathDomNode.TextNode child && !child.text().isEmpty()) {
                    // overlay the long solidus on the following character
                    final String text = child.text();
                    node.children().set(0, new MathDomNode.TextNode(text.charAt(0) + "\u0338" + text.substring(1)));
                    groups.remove(groups.size() - 1);
                }
            }
            groups.add(group);
            lastGroup = group;
        }
        return groups;
    }

    public MathDomNode buildExpressionRow(List<ParseNode> expression, Options options, boolean isOrdGroup) {
        return makeRow(buildExpression(expression, options, isOrdGroup));
    }

    public MathDomNode buildExpressionRow(List<ParseNode> expression, Options options) {
        return buildExpressionRow(expression, options, false);
    }

    public MathDomNode buildGroup(ParseNode group, Options options) {
        if (group == null) {
            return new MathDomNode.MathNode("mrow");
        }
        return registry.buildMathMl(group, options, this);
    }

    /// The `math` element for a whole formula, with the source as an
    /// annotation.
    MathDomNode.MathNode buildMathMl(List<ParseNode> tree, String texExpression, Options options,
                                     boolean displayMode) {
        final List<MathDomNode> expression = buildExpression(tree, options);
        final MathDomNode wrapper;
        if (expression.size() == 1 && (isType(expression.get(0), "mrow") || isType(expression.get(0), "mtable"))) {
            wrapper = expression.get(0);
        } else {
            wrapper = new MathDomNode.MathNode("mrow", expression);
        }
        final var annotation = new MathDomNode.MathNode("annotation",
            List.of(new MathDomNode.TextNode(texExpression)));
        annotation.setAttribute("encoding", "application/x-tex");
        final var semantics = new MathDomNode.MathNode("semantics", List.of(wrapper, annotation));
        final var math = new MathDomNode.MathNode("math", List.of(semantics));
        math.setAttribute("xmlns", "http://www.w3.org/1998/Math/MathML");
        if (displayMode) {
            math.setAttribute("display", "block");
        }
        return math;
    }
}
