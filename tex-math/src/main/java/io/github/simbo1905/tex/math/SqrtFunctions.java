package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;

/// Square roots and `\sqrt[n]{...}` radicals.
final class SqrtFunctions {

    private SqrtFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("sqrt", "\\sqrt")
            .numArgs(1)
            .numOptionalArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.Sqrt(context.mode(), context.loc(), args.get(0),
                optArgs.get(0))));

        builder.defineBuilders(ParseNode.Sqrt.class, SqrtFunctions::html, (group, options, mathml) -> {
            if (group.index() != null) {
                return new MathDomNode.MathNode("mroot", List.of(mathml.buildGroup(group.body(), options),
                    mathml.buildGroup(group.index(), options)));
            }
            return new MathDomNode.MathNode("msqrt", List.of(mathml.buildGroup(group.body(), options)));
        });
    }

    private static BoxNode html(ParseNode.Sqrt group, Options options, HtmlBuilder html) {
        BoxNode inner = html.buildGroup(group.body(), options.havingCrampedStyle());
        if (inner.height == 0) {
            // an empty body still gets a radical of x-height
            inner.height = options.fontMetrics().xHeight();
        }
        inner = BuildCommon.wrapFragment(inner, options);

        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
        final double theta = metrics.defaultRuleThickness();
        double phi = theta;
        if (options.style().id() < Style.TEXT.id()) {
            phi = metrics.xHeight();
        }
        double lineClearance = theta + phi / 4;
        final double minDelimiterHeight = inner.height + inner.depth + lineClearance + theta;

        final Delimiter.SqrtImage image = Delimiter.makeSqrtImage(minDelimiterHeight, options);
        final BoxNode.Span img = image.span();
        final double ruleWidth = image.ruleWidth();

        final double delimDepth = img.height - ruleWidth;
        if (delimDepth > inner.height + inner.depth + lineClearance) {
            // centre the body under the vinculum
            lineClearance = (lineClearance + delimDepth - inner.height - inner.depth) / 2;
        }
        final double imgShift = img.height - inner.height - lineClearance - ruleWidth;
        inner.setStyle("padding-left", Units.makeEm(image.advanceWidth()));

        final BoxNode.Span body = VList.firstBaseline(List.of(
            new VList.Elem(inner).withWrapper(List.of("svg-align"), Map.of()),
            new VList.Kern(-(inner.height + imgShift)),
            new VList.Elem(img),
            new VList.Kern(ruleWidth))).build();

        if (group.index() == null) {
            return BuildCommon.makeSpan(List.of("mord", "sqrt"), List.of(body), options);
        }

        final Options newOptions = options.havingStyle(Style.SCRIPTSCRIPT);
        final BoxNode rootm = html.buildGroup(group.index(), newOptions, options);
        // raise the index 60% of the radical's height
        final double toShift = 0.6 * (body.height - body.depth);
        final BoxNode.Span rootVList = VList.shift(-toShift, List.of(new VList.Elem(rootm))).build();
        final BoxNode.Span rootWrap = BuildCommon.makeSpan(List.of("root"), List.of(rootVList));
        return BuildCommon.makeSpan(List.of("mord", "sqrt"), List.of(rootWrap, body), options);
    }
}
