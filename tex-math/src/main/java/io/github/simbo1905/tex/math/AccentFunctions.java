package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;
import java.util.Set;

/// Accents over and under a base, horizontal braces, `\overline` and
/// `\\underline`.
final class AccentFunctions {

    private static final Set<String> NON_STRETCHY = Set.of("\\acute", "\\grave", "\\ddot", "\\tilde", "\\bar",
        "\\breve", "\\check", "\\hat", "\\vec", "\\dot", "\\mathring");

    private static final Set<String> SHIFTY_STRETCHY = Set.of("\\widehat", "\\widetilde", "\\widecheck");

    private AccentFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("accent", "\\acute", "\\grave", "\\ddot", "\\tilde", "\\bar",
                "\\breve", "\\check", "\\hat", "\\vec", "\\dot", "\\mathring", "\\widecheck", "\\widehat",
                "\\widetilde", "\\overrightarrow", "\\overleftarrow", "\\Overrightarrow", "\\overleftrightarrow",
                "\\overgroup", "\\overlinesegment", "\\overleftharpoon", "\\overrightharpoon")
            .numArgs(1)
            .handler((context, args, optArgs) -> {
                final ParseNode base = ParseNode.normalizeArgument(args.get(0));
                final String name = context.funcName();
                final boolean isStretchy = !NON_STRETCHY.contains(name);
                final boolean isShifty = !isStretchy || SHIFTY_STRETCHY.contains(name);
                return new ParseNode.Accent(context.mode(), context.loc(), name, isStretchy, isShifty, base);
            }));

        builder.defineFunction(FunctionSpec.builder("accent", "\\'", "\\`", "\\^", "\\~", "\\=", "\\u", "\\.",
                "\\\"", "\\c", "\\r", "\\H", "\\v", "\\textcircled")
            .numArgs(1)
            .allowedInText(true)
            .argTypes(ArgType.PRIMITIVE)
            .handler((context, args, optArgs) -> {
                final String name = context.funcName();
                Mode mode = context.mode();
                if (mode == Mode.MATH) {
                    context.parser().settings().reportNonstrict("mathVsTextAccents",
                        "LaTeX's accent " + name + " works only in text mode", context.token());
                    mode = Mode.TEXT;
                }
                return new ParseNode.Accent(mode, context.loc(), name, false, true, args.get(0));
            }));

        builder.defineBuilders(ParseNode.Accent.class,
            (group, options, html) -> accentHtml(group, null, options, html),
            AccentFunctions::accentMathMl);

        builder.defineFunction(FunctionSpec.builder("accentUnder", "\\underleftarrow", "\\underrightarrow",
                "\\underleftrightarrow", "\\undergroup", "\\underlinesegment", "\\utilde")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.AccentUnder(context.mode(), context.loc(),
                context.funcName(), true, false, args.get(0))));

        builder.defineBuilders(ParseNode.AccentUnder.class, AccentFunctions::accentUnderHtml,
            (group, options, mathml) -> {
                final var node = new MathDomNode.MathNode("munder",
                    List.of(mathml.buildGroup(group.base(), options), Stretchy.mathMlNode(group.label())));
                node.setAttribute("accentunder", "true");
                return node;
            });

        builder.defineFunction(FunctionSpec.builder("horizBrace", "\\overbrace", "\\underbrace")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.HorizBrace(context.mode(), context.loc(),
                context.funcName(), context.funcName().startsWith("\\over"), args.get(0))));

        builder.defineBuilders(ParseNode.HorizBrace.class,
            (group, options, html) -> horizBraceHtml(group, null, options, html),
            (group, options, mathml) -> new MathDomNode.MathNode(group.isOver() ? "mover" : "munder",
                List.of(mathml.buildGroup(group.base(), options), Stretchy.mathMlNode(group.label()))));

        builder.defineFunction(FunctionSpec.builder("overline", "\\overline")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.Overline(context.mode(), context.loc(),
                args.get(0))));

        builder.defineBuilders(ParseNode.Overline.class, AccentFunctions::overlineHtml,
            (group, options, mathml) -> {
                final var operator = new MathDomNode.MathNode("mo",
                    List.of(new MathDomNode.TextNode("‾")));
                operator.setAttribute("stretchy", "true");
                final var node = new MathDomNode.MathNode("mover",
                    List.of(mathml.buildGroup(group.body(), options), operator));
                node.setAttribute("accent", "true");
                return node;
            });

        builder.defineFunction(FunctionSpec.builder("underline", "\\underline")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Underline(context.mode(), context.loc(),
                args.get(0))));

        builder.defineBuilders(ParseNode.Underline.class, AccentFunctions::underlineHtml,
            (group, options, mathml) -> {
                final var operator = new MathDomNode.MathNode("mo",
                    List.of(new MathDomNode.TextNode("‾")));
                operator.setAttribute("stretchy", "true");
                final var node = new MathDomNode.MathNode("munder",
                    List.of(mathml.buildGroup(group.body(), options), operator));
                node.setAttribute("accentunder", "true");
                return node;
            });
    }

    /// Builds an accent. When `supSub` is given the accent is the base of
    /// those scripts, which are laid out against the unaccented character.
    static BoxNode accentHtml(ParseNode.Accent group, ParseNode.SupSub supSub, Options options,
                              HtmlBuilder html) {
        BoxNode supSubGroup = null;
        if (supSub != null) {
            supSubGroup = html.buildGroup(
                new ParseNode.SupSub(supSub.mode(), supSub.loc(), group.base(), supSub.sup(), supSub.sub()),
                options);
        }

        final BoxNode body = html.buildGroup(group.base(), options.havingCrampedStyle());
        final boolean mustShift = group.isShifty() && ParseNode.isCharacterBox(group.base());

        double skew = 0;
        if (mustShift) {
            final BoxNode baseChar = html.buildGroup(ParseNode.baseElem(group.base()), options.havingCrampedStyle());
            if (baseChar instanceof BoxNode.Symbol symbol) {
                skew = symbol.skew();
            }
        }

        final boolean accentBelow = "\\c".equals(group.label());
        double clearance = accentBelow
            ? body.height + body.depth
            : Math.min(body.height, options.fontMetrics().xHeight());

        final BoxNode accentBody;
        if (!group.isStretchy()) {
            final BoxNode accent;
            final double width;
            if ("\\vec".equals(group.label())) {
                accent = BuildCommon.staticSvg("vec", options);
                width = 0.471;
            } else {
                accent = BuildCommon.makeOrd(group.label(), group.mode(), options, false);
                if (accent instanceof BoxNode.Symbol symbol) {
                    symbol.italic = 0;
                }
                width = accent.width;
                if (accentBelow) {
                    clearance += accent.depth;
                }
            }

            final BoxNode.Span accentSpan = BuildCommon.makeSpan(List.of("accent-body"), List.of(accent));
            final boolean accentFull = "\\textcircled".equals(group.label());
            if (accentFull) {
                accentSpan.addClass("accent-full");
                clearance = body.height;
            }
            double left = skew;
            if (!accentFull) {
                left -= width / 2;
            }
            accentSpan.setStyle("left", Units.makeEm(left));
            if (accentFull) {
                accentSpan.setStyle("top", ".2em");
            }
            accentBody = VList.firstBaseline(List.of(
                new VList.Elem(body),
                new VList.Kern(-clearance),
                new VList.Elem(accentSpan))).build();
        } else {
            final BoxNode svg = Stretchy.svgSpan(group.label(), group.base(), options);
            Map<String, String> wrapperStyle = Map.of();
            if (skew > 0) {
                wrapperStyle = VList.style("width", "calc(100% - " + Units.makeEm(2 * skew) + ")");
                wrapperStyle.put("margin-left", Units.makeEm(2 * skew));
            }
            accentBody = VList.firstBaseline(List.of(
                new VList.Elem(body),
                new VList.Elem(svg).withWrapper(List.of("svg-align"), wrapperStyle))).build();
        }

        final BoxNode.Span accentWrap = BuildCommon.makeSpan(List.of("mord", "accent"), List.of(accentBody),
            options);

        if (supSubGroup != null) {
            final List<BoxNode> children = supSubGroup.children();
            if (!children.isEmpty()) {
                children.set(0, accentWrap);
            }
            supSubGroup.height = Math.max(accentWrap.height, supSubGroup.height);
            if (!supSubGroup.classes.isEmpty()) {
                supSubGroup.classes.set(0, "mord");
            }
            return supSubGroup;
        }
        return accentWrap;
    }

    private static MathDomNode accentMathMl(ParseNode.Accent group, Options options, MathMlBuilder mathml) {
        final MathDomNode accent = group.isStretchy()
            ? Stretchy.mathMlNode(group.label())
            : new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText(group.label(), group.mode())));
        final var node = new MathDomNode.MathNode("mover", List.of(mathml.buildGroup(group.base(), options), accent));
        node.setAttribute("accent", "true");
        return node;
    }

    private static BoxNode accentUnderHtml(ParseNode.AccentUnder group, Options options, HtmlBuilder html) {
        final BoxNode inner = html.buildGroup(group.base(), options);
        final BoxNode accent = Stretchy.svgSpan(group.label(), group.base(), options);
        final double kern = "\\utilde".equals(group.label()) ? 0.12 : 0;
        final BoxNode vlist = VList.top(inner.height, List.of(
            new VList.Elem(accent).withWrapper(List.of("svg-align"), Map.of()),
            new VList.Kern(kern),
            new VList.Elem(inner))).build();
        return BuildCommon.makeSpan(List.of("mord", "accentunder"), List.of(vlist), options);
    }

    /// Builds a brace. When `supSub` is given its one script is set above
    /// or below the brace, as for an operator with limits.
    static BoxNode horizBraceHtml(ParseNode.HorizBrace group, ParseNode.SupSub supSub, Options options,
                                  HtmlBuilder html) {
        final Style style = options.style();
        BoxNode scriptGroup = null;
        if (supSub != null) {
            if (supSub.sup() != null) {
                scriptGroup = html.buildGroup(supSub.sup(), options.havingStyle(style.sup()), options);
            } else {
                scriptGroup = html.buildGroup(supSub.sub(), options.havingStyle(style.sub()), options);
            }
        }

        final BoxNode body = html.buildGroup(group.base(), options.havingBaseStyle(Style.DISPLAY));
        final BoxNode brace = Stretchy.svgSpan(group.label(), group.base(), options);
        final List<String> classes = List.of("mord", group.isOver() ? "mover" : "munder");

        BoxNode vlist;
        if (group.isOver()) {
            vlist = VList.firstBaseline(List.of(
                new VList.Elem(body),
                new VList.Kern(0.1),
                new VList.Elem(brace).withWrapper(List.of("svg-align"), Map.of()))).build();
        } else {
            vlist = VList.bottom(body.depth + 0.1 + brace.height, List.of(
                new VList.Elem(brace).withWrapper(List.of("svg-align"), Map.of()),
                new VList.Kern(0.1),
                new VList.Elem(body))).build();
        }

        if (scriptGroup != null) {
            final BoxNode braced = BuildCommon.makeSpan(classes, List.of(vlist), options);
            if (group.isOver()) {
                vlist = VList.firstBaseline(List.of(
                    new VList.Elem(braced),
                    new VList.Kern(0.2),
                    new VList.Elem(scriptGroup))).build();
            } else {
                vlist = VList.bottom(braced.depth + 0.2 + scriptGroup.height + scriptGroup.depth, List.of(
                    new VList.Elem(scriptGroup),
                    new VList.Kern(0.2),
                    new VList.Elem(braced))).build();
            }
        }
        return BuildCommon.makeSpan(classes, List.of(vlist), options);
    }

    private static BoxNode overlineHtml(ParseNode.Overline group, Options options, HtmlBuilder html) {
        final BoxNode inner = html.buildGroup(group.body(), options.havingCrampedStyle());
        final BoxNode line = BuildCommon.makeLineSpan("overline-line", options, null);
        final double ruleWidth = line.height;
        final BoxNode vlist = VList.firstBaseline(List.of(
            new VList.Elem(inner),
            new VList.Kern(3 * ruleWidth),
            new VList.Elem(line),
            new VList.Kern(ruleWidth))).build();
        return BuildCommon.makeSpan(List.of("mord", "overline"), List.of(vlist), options);
    }

    private static BoxNode underlineHtml(ParseNode.Underline group, Options options, HtmlBuilder html) {
        final BoxNode inner = html.buildGroup(group.body(), options);
        final BoxNode line = BuildCommon.makeLineSpan("underline-line", options, null);
        final double ruleWidth = line.height;
        final BoxNode vlist = VList.top(inner.height, List.of(
            new VList.Kern(ruleWidth),
            new VList.Elem(line),
            new VList.Kern(3 * ruleWidth),
            new VList.Elem(inner))).build();
        return BuildCommon.makeSpan(List.of("mord", "underline"), List.of(vlist), options);
    }
}
