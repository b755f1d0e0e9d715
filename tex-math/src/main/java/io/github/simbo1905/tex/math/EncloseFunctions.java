package io.github.simbo1905.tex.math;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Boxes and strike-outs drawn around their content: `\fbox`, `\colorbox`,
/// `\fcolorbox`, the `\cancel` family, `\sout`, `\angl` and `\phase`.
final class EncloseFunctions {

    private EncloseFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("enclose", "\\colorbox")
            .numArgs(2)
            .allowedInText(true)
            .argTypes(ArgType.COLOR, ArgType.TEXT)
            .handler((context, args, optArgs) -> new ParseNode.Enclose(context.mode(), context.loc(),
                context.funcName(), ((ParseNode.ColorToken) args.get(0)).color(), null, args.get(1))));

        builder.defineFunction(FunctionSpec.builder("enclose", "\\fcolorbox")
            .numArgs(3)
            .allowedInText(true)
            .argTypes(ArgType.COLOR, ArgType.COLOR, ArgType.TEXT)
            .handler((context, args, optArgs) -> new ParseNode.Enclose(context.mode(), context.loc(),
                context.funcName(), ((ParseNode.ColorToken) args.get(1)).color(),
                ((ParseNode.ColorToken) args.get(0)).color(), args.get(2))));

        builder.defineFunction(FunctionSpec.builder("enclose", "\\fbox")
            .numArgs(1)
            .argTypes(ArgType.HBOX)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Enclose(context.mode(), context.loc(), "\\fbox",
                null, null, args.get(0))));

        builder.defineFunction(FunctionSpec.builder("enclose", "\\cancel", "\\bcancel", "\\xcancel", "\\sout",
                "\\phase")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.Enclose(context.mode(), context.loc(),
                context.funcName(), null, null, args.get(0))));

        builder.defineFunction(FunctionSpec.builder("enclose", "\\angl")
            .numArgs(1)
            .argTypes(ArgType.HBOX)
            .allowedInText(false)
            .handler((context, args, optArgs) -> new ParseNode.Enclose(context.mode(), context.loc(), "\\angl",
                null, null, args.get(0))));

        builder.defineBuilders(ParseNode.Enclose.class, EncloseFunctions::html, EncloseFunctions::mathml);
    }

    private static BoxNode html(ParseNode.Enclose group, Options options, HtmlBuilder html) {
        final BoxNode inner = BuildCommon.wrapFragment(html.buildGroup(group.body(), options), options);
        final String label = group.label().substring(1);
        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
        double scale = options.sizeMultiplier();
        final boolean isSingleChar = ParseNode.isCharacterBox(group.body());
        final BoxNode img;
        final double imgShift;

        if ("sout".equals(label)) {
            img = BuildCommon.makeSpan("stretchy", "sout");
            img.height = metrics.defaultRuleThickness() / scale;
            imgShift = -0.5 * metrics.xHeight();
        } else if ("phase".equals(label)) {
            final double lineWeight = Units.calculateSize(new Measurement(0.6, "pt"), options);
            final double clearance = Units.calculateSize(new Measurement(0.35, "ex"), options);
            // the angle keeps its stroke width whatever the size
            final Options newOptions = options.havingBaseSizing();
            scale = scale / newOptions.sizeMultiplier();
            final double angleHeight = inner.height + inner.depth + lineWeight + clearance;
            inner.setStyle("padding-left", Units.makeEm(angleHeight / 2 + lineWeight));
            final int viewBoxHeight = (int) Math.floor(1000 * angleHeight * scale);
            final var attrs = new LinkedHashMap<String, String>();
            attrs.put("width", "400em");
            attrs.put("height", Units.makeEm(viewBoxHeight / 1000.0));
            attrs.put("viewBox", "0 0 400000 " + viewBoxHeight);
            attrs.put("preserveAspectRatio", "xMinYMin slice");
            final BoxNode.Svg svg = BuildCommon.makeSvg(
                List.of(new BoxNode.Path("phase", SvgGeometry.phasePath(viewBoxHeight))), attrs);
            img = BuildCommon.makeSpan(List.of("hide-tail"), List.of(svg), options);
            img.setStyle("height", Units.makeEm(angleHeight));
            imgShift = inner.depth + lineWeight + clearance;
        } else {
            if (label.contains("cancel")) {
                if (!isSingleChar) {
                    inner.addClass("cancel-pad");
                }
            } else if ("angl".equals(label)) {
                inner.addClass("anglpad");
            } else {
                inner.addClass("boxpad");
            }

            double topPad;
            double bottomPad;
            double ruleThickness = 0;
            if (label.contains("box")) {
                ruleThickness = Math.max(metrics.fboxrule(), options.minRuleThickness());
                topPad = metrics.fboxsep() + ("colorbox".equals(label) ? 0 : ruleThickness);
                bottomPad = topPad;
            } else if ("angl".equals(label)) {
                ruleThickness = Math.max(metrics.defaultRuleThickness(), options.minRuleThickness());
                // three rule widths of gap plus the rule
                topPad = 4 * ruleThickness;
                bottomPad = Math.max(0, 0.25 - inner.depth);
            } else {
                topPad = isSingleChar ? 0.2 : 0;
                bottomPad = topPad;
            }

            img = Stretchy.encloseSpan(inner, label, topPad, bottomPad, options);
            if (label.contains("fbox") || label.contains("boxed") || label.contains("fcolorbox")) {
                img.setStyle("border-style", "solid");
                img.setStyle("border-width", Units.makeEm(ruleThickness));
            } else if ("angl".equals(label) && ruleThickness != 0.049) {
                img.setStyle("border-top-width", Units.makeEm(ruleThickness));
                img.setStyle("border-right-width", Units.makeEm(ruleThickness));
            }
            imgShift = inner.depth + bottomPad;

            if (group.backgroundColor() != null) {
                img.setStyle("background-color", group.backgroundColor());
                if (group.borderColor() != null) {
                    img.setStyle("border-color", group.borderColor());
                }
            }
        }

        final BoxNode.Span vlist;
        if (group.backgroundColor() != null) {
            // the colour goes behind the content
            vlist = VList.individualShift(List.of(
                new VList.Elem(img, imgShift),
                new VList.Elem(inner, 0))).build();
        } else {
            final List<String> wrapperClasses = label.contains("cancel") || label.contains("phase")
                ? List.of("svg-align") : List.of();
            vlist = VList.individualShift(List.of(
                new VList.Elem(inner, 0),
                new VList.Elem(img, imgShift).withWrapper(wrapperClasses, Map.of()))).build();
        }

        if (label.contains("cancel")) {
            // strike lines add no height
            vlist.height = inner.height;
            vlist.depth = inner.depth;
            if (!isSingleChar) {
                return BuildCommon.makeSpan(List.of("mord", "cancel-lap"), List.of(vlist), options);
            }
        }
        return BuildCommon.makeSpan(List.of("mord"), List.of(vlist), options);
    }

    private static MathDomNode mathml(ParseNode.Enclose group, Options options, MathMlBuilder mathml) {
        final String label = group.label();
        final var node = new MathDomNode.MathNode(label.contains("colorbox") ? "mpadded" : "menclose",
            List.of(mathml.buildGroup(group.body(), options)));
        switch (label) {
            case "\\cancel" -> node.setAttribute("notation", "updiagonalstrike");
            case "\\bcancel" -> node.setAttribute("notation", "downdiagonalstrike");
            case "\\xcancel" -> node.setAttribute("notation", "updiagonalstrike downdiagonalstrike");
            case "\\phase" -> node.setAttribute("notation", "phasorangle");
            case "\\sout" -> node.setAttribute("notation", "horizontalstrike");
            case "\\fbox" -> node.setAttribute("notation", "box");
            case "\\angl" -> node.setAttribute("notation", "actuarial");
            case "\\colorbox", "\\fcolorbox" -> {
                final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
                // menclose has no notation for a padded colour box
                final double fboxsep = metrics.fboxsep() * metrics.ptPerEm();
                node.setAttribute("width", "+" + (2 * fboxsep) + "pt");
                node.setAttribute("height", "+" + (2 * fboxsep) + "pt");
                node.setAttribute("lspace", fboxsep + "pt");
                node.setAttribute("voffset", fboxsep + "pt");
                if ("\\fcolorbox".equals(label)) {
                    final double thickness = Math.max(metrics.fboxrule(), options.minRuleThickness());
                    final String border = group.borderColor() != null ? group.borderColor() : "black";
                    node.setAttribute("style", "border: " + thickness + "em solid " + border);
                }
            }
            default -> { }
        }
        if (group.backgroundColor() != null) {
            node.setAttribute("mathbackground", group.backgroundColor());
        }
        return node;
    }
}
