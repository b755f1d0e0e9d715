package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Converts a parse tree into the HTML box tree.
///
/// Each node is built by the builder its class is registered with. A
/// [Grouping#REAL] or [Grouping#ROOT] expression also gets inter-atom glue,
/// after binary operators in non-binary positions are demoted to ordinary
/// atoms.
public final class HtmlBuilder {

    /// How an expression relates to its enclosing group.
    public enum Grouping {
        /// Part of a larger group; the parent handles spacing.
        PARTIAL,
        /// A complete group.
        REAL,
        /// The top-level expression, where `\\` resets the spacing context.
        ROOT
    }

    private static final Set<String> BIN_LEFT_CANCELLER = Set.of("leftmost", "mbin", "mopen", "mrel", "mop", "mpunct");
    private static final Set<String> BIN_RIGHT_CANCELLER = Set.of("rightmost", "mrel", "mclose", "mpunct");

    private final Registry registry;

    HtmlBuilder(Registry registry) {
        this.registry = registry;
    }

    /// Builds `group`, wrapping it in sizing classes when `options` is at a
    /// different size from `baseOptions`.
    public BoxNode buildGroup(ParseNode group, Options options, Options baseOptions) {
        if (group == null) {
            return BuildCommon.makeSpan();
        }
        BoxNode node = registry.buildHtml(group, options, this);
        if (baseOptions != null && options.size() != baseOptions.size()) {
            node = BuildCommon.makeSpan(options.sizingClasses(baseOptions), List.of(node), options);
            final double multiplier = options.sizeMultiplier() / baseOptions.sizeMultiplier();
            node.height *= multiplier;
            node.depth *= multiplier;
        }
        return node;
    }

    public BoxNode buildGroup(ParseNode group, Options options) {
        return buildGroup(group, options, null);
    }

    public List<BoxNode> buildExpression(List<ParseNode> expression, Options options, Grouping grouping) {
        return buildExpression(expression, options, grouping, null, null);
    }

    /// Builds a list of nodes. `leftType` and `rightType` name the atom
    /// classes just outside the expression, for spacing; null means the edge.
    public List<BoxNode> buildExpression(List<ParseNode> expression, Options options, Grouping grouping,
                                         String leftType, String rightType) {
        final List<BoxNode> groups = new ArrayList<>();
        for (final ParseNode expr : expression) {
            final BoxNode output = buildGroup(expr, options);
            if (output instanceof BoxNode.Fragment fragment) {
                groups.addAll(fragment.children());
            } else {
                groups.add(output);
            }
        }
        BuildCommon.tryCombineChars(groups);
        if (grouping == Grouping.PARTIAL) {
            return groups;
        }

        Options glueOptions = options;
        if (expression.size() == 1) {
            final ParseNode only = expression.get(0);
            if (only instanceof ParseNode.Sizing sizing) {
                glueOptions = options.havingSize(sizing.size());
            } else if (only instanceof ParseNode.Styling styling) {
                glueOptions = options.havingStyle(styling.style());
            }
        }

        final BoxNode dummyPrev = BuildCommon.makeSpan(List.of(leftType == null ? "leftmost" : leftType),
            List.of(), options);
        final BoxNode dummyNext = BuildCommon.makeSpan(List.of(rightType == null ? "rightmost" : rightType),
            List.of(), options);
        final boolean isRoot = grouping == Grouping.ROOT;

        traverseNonSpaceNodes(groups, (node, prev) -> {
            final String prevType = firstClass(prev);
            final String type = firstClass(node);
            if ("mbin".equals(prevType) && BIN_RIGHT_CANCELLER.contains(type)) {
                prev.classes.set(0, "mord");
            } else if ("mbin".equals(type) && BIN_LEFT_CANCELLER.contains(prevType)) {
                node.classes.set(0, "mord");
            }
            return null;
        }, new Cursor(dummyPrev), dummyNext, isRoot);

        final boolean tight = Spacing.useTight(glueOptions);
        final Options glue = glueOptions;
        traverseNonSpaceNodes(groups, (node, prev) -> {
            final String prevType = typeOfDomTree(prev, null);
            final String type = typeOfDomTree(node, null);
            if (prevType == null || type == null) {
                return null;
            }
            final Measurement space = Spacing.between(prevType, type, tight);
            return space == null ? null : BuildCommon.makeGlue(space, glue);
        }, new Cursor(dummyPrev), dummyNext, isRoot);

        return groups;
    }

    private static String firstClass(BoxNode node) {
        return node.classes.isEmpty() ? "" : node.classes.get(0);
    }

    /// One level of the traversal: a list being walked and the walk position.
    private static final class Frame {
        final List<BoxNode> nodes;
        int index;

        Frame(List<BoxNode> nodes) {
            this.nodes = nodes;
        }
    }

    /// The previous non-space node, and where glue placed after it goes.
    private static final class Cursor {
        BoxNode node;
        Frame frame;
        int index;

        Cursor(BoxNode node) {
            this.node = node;
        }

        void insertAfter(BoxNode inserted) {
            frame.nodes.add(index + 1, inserted);
            frame.index++;
        }
    }

    /// Visits non-space nodes depth first through fragments, links and
    /// enclosing spans, calling `callback(node, previous)` and inserting any
    /// node it returns between the two.
    private static void traverseNonSpaceNodes(List<BoxNode> nodes, BiFunction<BoxNode, BoxNode, BoxNode> callback,
                                              Cursor prev, BoxNode next, boolean isRoot) {
        if (next != null) {
            nodes.add(next);
        }
        final Frame frame = new Frame(nodes);
        for (; frame.index < nodes.size(); frame.index++) {
            final BoxNode node = nodes.get(frame.index);
            final List<BoxNode> partial = partialGroupChildren(node);
            if (partial != null) {
                traverseNonSpaceNodes(partial, callback, prev, null, isRoot);
                continue;
            }
            final boolean nonspace = !node.hasClass("mspace");
            if (nonspace) {
                final BoxNode result = callback.apply(node, prev.node);
                if (result != null) {
                    if (prev.frame != null) {
                        prev.insertAfter(result);
                    } else {
                        nodes.add(0, result);
                        frame.index++;
                    }
                }
                prev.node = node;
            } else if (isRoot && node.hasClass("newline")) {
                prev.node = BuildCommon.makeSpan("leftmost");
            }
            prev.frame = frame;
            prev.index = frame.index;
        }
        if (next != null) {
            nodes.remove(nodes.size() - 1);
        }
    }

    private static List<BoxNode> partialGroupChildren(BoxNode node) {
        if (node instanceof BoxNode.Fragment || node instanceof BoxNode.Anchor
            || (node instanceof BoxNode.Span && node.hasClass("enclosing"))) {
            return node.children();
        }
        return null;
    }

    private static BoxNode outermostNode(BoxNode node, String side) {
        final List<BoxNode> partial = partialGroupChildren(node);
        if (partial != null && !partial.isEmpty()) {
            if ("right".equals(side)) {
                return outermostNode(partial.get(partial.size() - 1), "right");
            } else if ("left".equals(side)) {
                return outermostNode(partial.get(0), "left");
            }
        }
        return node;
    }

    /// The atom class of `node`, looking through to its leftmost or rightmost
    /// leaf when `side` is given; null when it has none.
    public static String typeOfDomTree(BoxNode node, String side) {
        if (node == null) {
            return null;
        }
        final BoxNode target = side == null ? node : outermostNode(node, side);
        final String first = firstClass(target);
        return Spacing.CLASSES.contains(first) ? first : null;
    }

    /// An empty delimiter of the `\nulldelimiterspace` width.
    public static BoxNode.Span makeNullDelimiter(Options options, List<String> classes) {
        final List<String> more = BuildCommon.concat(classes, "nulldelimiter");
        return BuildCommon.makeSpan(BuildCommon.concat(more, options.baseSizingClasses()), List.of());
    }

    /// A line-unbreakable run with a strut giving it its full height.
    private static BoxNode.Span unbreakable(List<BoxNode> children, Options options) {
        final BoxNode.Span body = BuildCommon.makeSpan(List.of("base"), children, options);
        final BoxNode.Span strut = BuildCommon.makeSpan("strut");
        strut.setStyle("height", Units.makeEm(body.height + body.depth));
        if (body.depth != 0) {
            strut.setStyle("vertical-align", Units.makeEm(-body.depth));
        }
        body.children.add(0, strut);
        return body;
    }

    /// The `katex-html` span for a whole formula. Breaks are allowed after
    /// binary operators and relations unless `\nobreak` follows.
    BoxNode.Span buildHtml(List<ParseNode> tree, Options options) {
        List<ParseNode> body = tree;
        List<ParseNode> tag = null;
        if (tree.size() == 1 && tree.get(0) instanceof ParseNode.Tag tagged) {
            tag = tagged.tag();
            body = tagged.body();
        }

        final List<BoxNode> expression = buildExpression(body, options, Grouping.ROOT);
        BoxNode eqnNum = null;
        if (expression.size() == 2 && expression.get(1).hasClass("tag")) {
            eqnNum = expression.remove(1);
        }

        final List<BoxNode> children = new ArrayList<>();
        List<BoxNode> parts = new ArrayList<>();
        for (int i = 0; i < expression.size(); i++) {
            final BoxNode current = expression.get(i);
            parts.add(current);
            if (current.hasClass("mbin") || current.hasClass("mrel") || current.hasClass("allowbreak")) {
                boolean nobreak = false;
                while (i < expression.size() - 1 && expression.get(i + 1).hasClass("mspace")
                    && !expression.get(i + 1).hasClass("newline")) {
                    i++;
                    parts.add(expression.get(i));
                    if (expression.get(i).hasClass("nobreak")) {
                        nobreak = true;
                    }
                }
                if (!nobreak) {
                    children.add(unbreakable(parts, options));
                    parts = new ArrayList<>();
                }
            } else if (current.hasClass("newline")) {
                parts.remove(parts.size() - 1);
                if (!parts.isEmpty()) {
                    children.add(unbreakable(parts, options));
                    parts = new ArrayList<>();
                }
                children.add(current);
            }
        }
        if (!parts.isEmpty()) {
            children.add(unbreakable(parts, options));
        }

        BoxNode.Span tagChild = null;
        if (tag != null) {
            tagChild = unbreakable(buildExpression(tag, options, Grouping.REAL), options);
            tagChild.classes.clear();
            tagChild.classes.add("tag");
            children.add(tagChild);
        } else if (eqnNum != null) {
            children.add(eqnNum);
        }

        final BoxNode.Span htmlNode = BuildCommon.makeSpan(List.of("katex-html"), children);
        htmlNode.setAttribute("aria-hidden", "true");

        if (tagChild != null) {
            final BoxNode strut = tagChild.children.get(0);
            strut.setStyle("height", Units.makeEm(htmlNode.height + htmlNode.depth));
            if (htmlNode.depth != 0) {
                strut.setStyle("vertical-align", Units.makeEm(-htmlNode.depth));
            }
        }
        final int lines = children.size();
        LOG.finer(() -> "html built: " + lines + " breakable parts");
        return htmlNode;
    }
}
