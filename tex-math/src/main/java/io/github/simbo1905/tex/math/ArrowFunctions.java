package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Extensible arrows that stretch to fit the text written over and under them.
final class ArrowFunctions {

    private ArrowFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("xArrow",
                "\\xleftarrow", "\\xrightarrow", "\\xLeftarrow", "\\xRightarrow",
                "\\xleftrightarrow", "\\xLeftrightarrow", "\\xhookleftarrow",
                "\\xhookrightarrow", "\\xmapsto", "\\xrightharpoondown",
                "\\xrightharpoonup", "\\xleftharpoondown", "\\xleftharpoonup",
                "\\xrightleftharpoons", "\\xleftrightharpoons", "\\xlongequal",
                "\\xtwoheadrightarrow", "\\xtwoheadleftarrow", "\\xtofrom",
                "\\xrightleftarrows", "\\xrightequilibrium", "\\xleftequilibrium",
                // used inside CD
                "\\\\cdrightarrow", "\\\\cdleftarrow", "\\\\cdlongequal")
            .numArgs(1)
            .numOptionalArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.XArrow(context.mode(), context.loc(),
                context.funcName(), args.get(0), optArgs.get(0))));

        builder.defineBuilders(ParseNode.XArrow.class, ArrowFunctions::html, ArrowFunctions::mathml);
    }

    private static BoxNode html(ParseNode.XArrow group, Options options, HtmlBuilder html) {
        final Style style = options.style();
        final String padClass = (group.label().startsWith("\\x") ? "x" : "cd") + "-arrow-pad";

        final BoxNode upperGroup = BuildCommon.wrapFragment(
            html.buildGroup(group.body(), options.havingStyle(style.sup()), options), options);
        upperGroup.addClass(padClass);

        BoxNode lowerGroup = null;
        if (group.below() != null) {
            lowerGroup = BuildCommon.wrapFragment(
                html.buildGroup(group.below(), options.havingStyle(style.sub()), options), options);
            lowerGroup.addClass(padClass);
        }

        final BoxNode.Span arrowBody = Stretchy.svgSpan(group.label(), null, options);
        final double axisHeight = options.fontMetrics().axisHeight();
        // the arrow sits on the math axis
        final double arrowShift = -axisHeight + 0.5 * arrowBody.height;
        double upperShift = -axisHeight - 0.5 * arrowBody.height - 0.111;
        if (upperGroup.depth > 0.25 || "\\xleftequilibrium".equals(group.label())) {
            upperShift -= upperGroup.depth;
        }

        final List<VList.Elem> children = new ArrayList<>();
        children.add(new VList.Elem(upperGroup, upperShift));
        children.add(new VList.Elem(arrowBody, arrowShift).withWrapper(List.of("svg-align"), Map.of()));
        if (lowerGroup != null) {
            final double lowerShift = -axisHeight + lowerGroup.height + 0.5 * arrowBody.height + 0.111;
            children.add(new VList.Elem(lowerGroup, lowerShift));
        }
        final BoxNode.Span vlist = VList.individualShift(children).build();
        return BuildCommon.makeSpan(List.of("mrel", "x-arrow"), List.of(vlist), options);
    }

    private static MathDomNode.MathNode padded(MathDomNode group) {
        final var node = new MathDomNode.MathNode("mpadded", group == null ? List.of() : List.of(group));
        node.setAttribute("width", "+0.6em");
        node.setAttribute("lspace", "0.3em");
        return node;
    }

    private static MathDomNode mathml(ParseNode.XArrow group, Options options, MathMlBuilder mathml) {
        final MathDomNode.MathNode arrow = Stretchy.mathMlNode(group.label());
        arrow.setAttribute("minsize", group.label().startsWith("\\x") ? "1.75em" : "3.0em");
        if (group.body() != null) {
            final var upper = padded(mathml.buildGroup(group.body(), options));
            if (group.below() != null) {
                final var lower = padded(mathml.buildGroup(group.below(), options));
                return new MathDomNode.MathNode("munderover", List.of(arrow, lower, upper));
            }
            return new MathDomNode.MathNode("mover", List.of(arrow, upper));
        }
        if (group.below() != null) {
            return new MathDomNode.MathNode("munder", List.of(arrow, padded(mathml.buildGroup(group.below(), options))));
        }
        return new MathDomNode.MathNode("mover", List.of(arrow, padded(null)));
    }
}
