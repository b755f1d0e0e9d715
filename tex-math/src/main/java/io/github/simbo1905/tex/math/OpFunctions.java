package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Large operators, named functions such as `\sin`, `\mathop` and
/// `\operatorname`, and the placement of their limits.
final class OpFunctions {

    /// Operators without a display-size variant.
    private static final List<String> NO_SUCCESSOR = List.of("\\smallint");

    private static final Map<String, String> SINGLE_CHAR_BIG_OPS = Map.ofEntries(
        Map.entry("∏", "\\prod"),
        Map.entry("∐", "\\coprod"),
        Map.entry("∑", "\\sum"),
        Map.entry("⋀", "\\bigwedge"),
        Map.entry("⋁", "\\bigvee"),
        Map.entry("⋂", "\\bigcap"),
        Map.entry("⋃", "\\bigcup"),
        Map.entry("⨀", "\\bigodot"),
        Map.entry("⨁", "\\bigoplus"),
        Map.entry("⨂", "\\bigotimes"),
        Map.entry("⨄", "\\biguplus"),
        Map.entry("⨆", "\\bigsqcup")
    );

    private static final Map<String, String> SINGLE_CHAR_INTEGRALS = Map.of(
        "∫", "\\int",
        "∬", "\\iint",
        "∭", "\\iiint",
        "∮", "\\oint",
        "∯", "\\oiint",
        "∰", "\\oiiint"
    );

    private OpFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("op", "\\coprod", "\\bigvee", "\\bigwedge", "\\biguplus",
                "\\bigcap", "\\bigcup", "\\intop", "\\prod", "\\sum", "\\bigotimes", "\\bigoplus", "\\bigodot",
                "\\bigsqcup", "\\smallint", "∏", "∐", "∑", "⋀", "⋁", "⋂", "⋃",
                "⨀", "⨁", "⨂", "⨄", "⨆")
            .handler((context, args, optArgs) -> op(context, true, true)));

        builder.defineFunction(FunctionSpec.builder("op", "\\mathop")
            .numArgs(1)
            .primitive(true)
            .handler((context, args, optArgs) -> new ParseNode.Op(context.mode(), context.loc(), false, false,
                false, false, false, null, ParseNode.ordArgument(args.get(0)))));

        builder.defineFunction(FunctionSpec.builder("op", "\\arcsin", "\\arccos", "\\arctan", "\\arctg",
                "\\arcctg", "\\arg", "\\ch", "\\cos", "\\cosec", "\\cosh", "\\cot", "\\cotg", "\\coth", "\\csc",
                "\\ctg", "\\cth", "\\deg", "\\dim", "\\exp", "\\hom", "\\ker", "\\lg", "\\ln", "\\log", "\\sec",
                "\\sin", "\\sinh", "\\sh", "\\tan", "\\tanh", "\\tg", "\\th")
            .handler((context, args, optArgs) -> op(context, false, false)));

        builder.defineFunction(FunctionSpec.builder("op", "\\det", "\\gcd", "\\inf", "\\lim", "\\max", "\\min",
                "\\Pr", "\\sup")
            .handler((context, args, optArgs) -> op(context, true, false)));

        builder.defineFunction(FunctionSpec.builder("op", "\\int", "\\iint", "\\iiint", "\\oint", "\\oiint",
                "\\oiiint", "∫", "∬", "∭", "∮", "∯", "∰")
            .handler((context, args, optArgs) -> op(context, false, true)));

        builder.defineBuilders(ParseNode.Op.class,
            (group, options, html) -> opHtml(group, null, null, false, options, html),
            OpFunctions::opMathMl);

        builder.defineFunction(FunctionSpec.builder("operatorname", "\\operatorname@", "\\operatornamewithlimits")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.OperatorName(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)), "\\operatornamewithlimits".equals(context.funcName()),
                false, false)));

        builder.defineBuilders(ParseNode.OperatorName.class,
            (group, options, html) -> operatorNameHtml(group, null, null, false, options, html),
            OpFunctions::operatorNameMathMl);
    }

    private static ParseNode op(FunctionContext context, boolean limits, boolean symbol) {
        String name = context.funcName();
        if (name.length() == 1) {
            if (symbol && limits) {
                name = SINGLE_CHAR_BIG_OPS.getOrDefault(name, name);
            } else if (symbol) {
                name = SINGLE_CHAR_INTEGRALS.getOrDefault(name, name);
            }
        }
        return new ParseNode.Op(context.mode(), context.loc(), limits, false, false, false, symbol, name, null);
    }

    static boolean isOiint(String name) {
        return "\\oiint".equals(name) || "\\oiiint".equals(name);
    }

    private static boolean isLarge(ParseNode.Op group, Options options) {
        return options.style().size() == Style.DISPLAY.size() && group.symbol()
            && !NO_SUCCESSOR.contains(group.name());
    }

    /// The italic slant of a symbol operator's glyph at the current size.
    static double symbolSlant(ParseNode.Op group, Options options) {
        String name = group.name();
        if ("\\oiint".equals(name)) {
            name = "\\iint";
        } else if ("\\oiiint".equals(name)) {
            name = "\\iiint";
        }
        final String fontName = isLarge(group, options) ? "Size2-Regular" : "Size1-Regular";
        final FontMetrics.CharacterMetrics metrics = BuildCommon.lookupSymbol(name, fontName, Mode.MATH).metrics();
        return metrics == null ? 0 : metrics.italic();
    }

    /// Builds an operator; with `hasLimits` the scripts are stacked above
    /// and below it.
    static BoxNode opHtml(ParseNode.Op group, ParseNode supGroup, ParseNode subGroup, boolean hasLimits,
                          Options options, HtmlBuilder html) {
        final Style style = options.style();
        final boolean large = isLarge(group, options);
        BoxNode base;
        double slant = 0;
        boolean symbolBase = false;

        if (group.symbol()) {
            final String fontName = large ? "Size2-Regular" : "Size1-Regular";
            final String stash = isOiint(group.name()) ? group.name().substring(1) : "";
            final String glyph = stash.isEmpty() ? group.name() : "oiint".equals(stash) ? "\\iint" : "\\iiint";
            final BoxNode.Symbol symbol = BuildCommon.makeSymbol(glyph, fontName, Mode.MATH, options,
                List.of("mop", "op-symbol", large ? "large-op" : "small-op"));
            slant = symbol.italic();
            symbolBase = true;
            if (stash.isEmpty()) {
                base = symbol;
            } else {
                final BoxNode oval = BuildCommon.staticSvg(stash + "Size" + (large ? "2" : "1"), options);
                base = VList.individualShift(List.of(new VList.Elem(symbol, 0),
                    new VList.Elem(oval, large ? 0.08 : 0))).build();
                base.classes.add(0, "mop");
            }
        } else if (group.body() != null) {
            final List<BoxNode> inner = html.buildExpression(group.body(), options, HtmlBuilder.Grouping.REAL);
            if (inner.size() == 1 && inner.get(0) instanceof BoxNode.Symbol symbol) {
                if (symbol.classes.isEmpty()) {
                    symbol.classes.add("mop");
                } else {
                    symbol.classes.set(0, "mop");
                }
                base = symbol;
                slant = symbol.italic();
                symbolBase = true;
            } else {
                base = BuildCommon.makeSpan(List.of("mop"), inner, options);
            }
        } else {
            final List<BoxNode> output = new ArrayList<>();
            final String name = group.name();
            for (int i = 1; i < name.length(); i++) {
                output.add(BuildCommon.mathsym(name.substring(i, i + 1), group.mode(), options, List.of()));
            }
            base = BuildCommon.makeSpan(List.of("mop"), output, options);
        }

        double baseShift = 0;
        if (symbolBase && !group.suppressBaseShift()) {
            // centre the operator on the math axis
            baseShift = (base.height - base.depth) / 2 - options.fontMetrics().axisHeight();
        } else {
            slant = 0;
        }

        if (hasLimits) {
            return assembleSupSub(base, supGroup, subGroup, options, style, slant, baseShift, html);
        }
        if (baseShift != 0) {
            base.setStyle("position", "relative");
            base.setStyle("top", Units.makeEm(baseShift));
        }
        return base;
    }

    private static MathDomNode opMathMl(ParseNode.Op group, Options options, MathMlBuilder mathml) {
        if (group.symbol()) {
            final var node = new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText(group.name(), group.mode())));
            if (NO_SUCCESSOR.contains(group.name())) {
                node.setAttribute("largeop", "false");
            }
            return node;
        }
        if (group.body() != null) {
            return new MathDomNode.MathNode("mo", mathml.buildExpression(group.body(), options));
        }
        final var identifier = new MathDomNode.MathNode("mi",
            List.of(new MathDomNode.TextNode(group.name().substring(1))));
        final var operator = new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText("\u2061", Mode.TEXT)));
        return new MathDomNode.MathNode("mrow", List.of(identifier, operator));
    }

    /// Stacks limits over and under an operator, offsetting them by the
    /// glyph's italic slant.
    static BoxNode assembleSupSub(BoxNode opBase, ParseNode supGroup, ParseNode subGroup, Options options,
                                  Style style, double slant, double baseShift, HtmlBuilder html) {
        final BoxNode base = BuildCommon.makeSpan(List.of(), List.of(opBase));
        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
        final boolean subIsSingleCharacter = subGroup != null && ParseNode.isCharacterBox(subGroup);

        BoxNode sup = null;
        double supKern = 0;
        if (supGroup != null) {
            sup = html.buildGroup(supGroup, options.havingStyle(style.sup()), options);
            supKern = Math.max(metrics.bigOpSpacing1(), metrics.bigOpSpacing3() - sup.depth);
        }
        BoxNode sub = null;
        double subKern = 0;
        if (subGroup != null) {
            sub = html.buildGroup(subGroup, options.havingStyle(style.sub()), options);
            subKern = Math.max(metrics.bigOpSpacing2(), metrics.bigOpSpacing4() - sub.height);
        }

        final BoxNode finalGroup;
        if (sup != null && sub != null) {
            final double bottom = metrics.bigOpSpacing5() + sub.height + sub.depth + subKern + base.depth + baseShift;
            finalGroup = VList.bottom(bottom, List.of(
                new VList.Kern(metrics.bigOpSpacing5()),
                new VList.Elem(sub).withMarginLeft(Units.makeEm(-slant)),
                new VList.Kern(subKern),
                new VList.Elem(base),
                new VList.Kern(supKern),
                new VList.Elem(sup).withMarginLeft(Units.makeEm(slant)),
                new VList.Kern(metrics.bigOpSpacing5()))).build();
        } else if (sub != null) {
            final double top = base.height - baseShift;
            finalGroup = VList.top(top, List.of(
                new VList.Kern(metrics.bigOpSpacing5()),
                new VList.Elem(sub).withMarginLeft(Units.makeEm(-slant)),
                new VList.Kern(subKern),
                new VList.Elem(base))).build();
        } else if (sup != null) {
            final double bottom = base.depth + baseShift;
            finalGroup = VList.bottom(bottom, List.of(
                new VList.Elem(base),
                new VList.Kern(supKern),
                new VList.Elem(sup).withMarginLeft(Units.makeEm(slant)),
                new VList.Kern(metrics.bigOpSpacing5()))).build();
        } else {
            return base;
        }

        final List<BoxNode> parts = new ArrayList<>();
        if (sub != null && slant != 0 && !subIsSingleCharacter) {
            // keeps a slanted integral's lower limit from overlapping what precedes it
            final BoxNode.Span spacer = BuildCommon.makeSpan(List.of("mspace"), List.of(), options);
            spacer.setStyle("margin-right", Units.makeEm(slant));
            parts.add(spacer);
        }
        parts.add(finalGroup);
        return BuildCommon.makeSpan(List.of("mop", "op-limits"), parts, options);
    }

    // ========== \operatorname ==========

    static BoxNode operatorNameHtml(ParseNode.OperatorName group, ParseNode supGroup, ParseNode subGroup,
                                    boolean hasLimits, Options options, HtmlBuilder html) {
        final BoxNode base;
        if (!group.body().isEmpty()) {
            final List<ParseNode> body = new ArrayList<>();
            for (final ParseNode child : group.body()) {
                if (child instanceof ParseNode.SymbolNode symbol) {
                    body.add(new ParseNode.TextOrd(child.mode(), child.loc(), symbol.text()));
                } else {
                    body.add(child);
                }
            }
            final List<BoxNode> expression = html.buildExpression(body, options.withFont("mathrm"),
                HtmlBuilder.Grouping.REAL);
            for (final BoxNode child : expression) {
                if (child instanceof BoxNode.Symbol symbol) {
                    symbol.text = symbol.text.replaceFirst("\u2212", "-").replaceFirst("\u2217", "*");
                }
            }
            base = BuildCommon.makeSpan(List.of("mop"), expression, options);
        } else {
            base = BuildCommon.makeSpan(List.of("mop"), List.of(), options);
        }
        if (hasLimits) {
            return assembleSupSub(base, supGroup, subGroup, options, options.style(), 0, 0, html);
        }
        return base;
    }

    private static MathDomNode operatorNameMathMl(ParseNode.OperatorName group, Options options,
                                                  MathMlBuilder mathml) {
        List<MathDomNode> expression = mathml.buildExpression(group.body(), options.withFont("mathrm"));
        boolean isAllString = true;
        for (final MathDomNode node : expression) {
            if (node instanceof MathDomNode.SpaceNode) {
                continue;
            }
            if (!(node instanceof MathDomNode.MathNode math)) {
                isAllString = false;
                continue;
            }
            switch (math.type()) {
                case "mi", "mn", "mspace", "mtext" -> { }
                case "mo" -> {
                    if (math.children().size() == 1 && math.children().get(0) instanceof MathDomNode.TextNode text) {
                        math.children().set(0, new MathDomNode.TextNode(
                            text.text().replaceFirst("\u2212", "-").replaceFirst("\u2217", "*")));
                    } else {
                        isAllString = false;
                    }
                }
                default -> isAllString = false;
            }
        }
        if (isAllString) {
            final var word = new StringBuilder();
            for (final MathDomNode node : expression) {
                word.append(node.toText());
            }
            expression = List.of(new MathDomNode.TextNode(word.toString()));
        }
        final var identifier = new MathDomNode.MathNode("mi", expression);
        identifier.setAttribute("mathvariant", "normal");
        final var operator = new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText("\u2061", Mode.TEXT)));
        return new MathDomNode.MathNode("mrow", List.of(identifier, operator));
    }
}
