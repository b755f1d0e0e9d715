package io.github.simbo1905.tex.math;

import java.util.List;

/// Explicit space, rules, phantoms, smashing, overlapping boxes, `\raisebox`
/// and `\vcenter`.
final class SpacingFunctions {

    private SpacingFunctions() {}

    static void register(Registry.Builder builder) {
        registerKern(builder);
        registerRule(builder);
        registerPhantoms(builder);
        registerSmash(builder);
        registerLap(builder);
        registerRaiseBox(builder);
        registerVCenter(builder);
    }

    private static void registerKern(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("kern", "\\kern", "\\mkern", "\\hskip", "\\mskip")
            .numArgs(1)
            .argTypes(ArgType.SIZE)
            .primitive(true)
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                final Measurement size = ((ParseNode.Size) args.get(0)).value();
                final String name = context.funcName();
                final Settings settings = context.parser().settings();
                final boolean mathFunction = name.charAt(1) == 'm';
                final boolean muUnit = "mu".equals(size.unit());
                if (mathFunction) {
                    if (!muUnit) {
                        settings.reportNonstrict("mathVsTextUnits", "LaTeX's " + name + " supports only mu units, "
                            + "not " + size.unit() + " units", context.token());
                    }
                    if (context.mode() != Mode.MATH) {
                        settings.reportNonstrict("mathVsTextUnits", "LaTeX's " + name + " works only in math mode",
                            context.token());
                    }
                } else if (muUnit) {
                    settings.reportNonstrict("mathVsTextUnits", "LaTeX's " + name + " doesn't support mu units",
                        context.token());
                }
                return new ParseNode.Kern(context.mode(), context.loc(), size);
            }));

        builder.defineBuilders(ParseNode.Kern.class,
            (group, options, html) -> BuildCommon.makeGlue(group.dimension(), options),
            (group, options, mathml) -> new MathDomNode.SpaceNode(Units.calculateSize(group.dimension(), options)));
    }

    private static void registerRule(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("rule", "\\rule")
            .numArgs(2)
            .numOptionalArgs(1)
            .allowedInText(true)
            .argTypes(ArgType.SIZE, ArgType.SIZE, ArgType.SIZE)
            .handler((context, args, optArgs) -> {
                final ParseNode shift = optArgs.get(0);
                return new ParseNode.Rule(context.mode(), context.loc(),
                    shift == null ? null : ((ParseNode.Size) shift).value(),
                    ((ParseNode.Size) args.get(0)).value(), ((ParseNode.Size) args.get(1)).value());
            }));

        builder.defineBuilders(ParseNode.Rule.class, (group, options, html) -> {
            final BoxNode rule = BuildCommon.makeSpan(List.of("mord", "rule"), List.of(), options);
            final double width = Units.calculateSize(group.width(), options);
            final double height = Units.calculateSize(group.height(), options);
            final double shift = group.shift() == null ? 0 : Units.calculateSize(group.shift(), options);
            rule.setStyle("border-right-width", Units.makeEm(width));
            rule.setStyle("border-top-width", Units.makeEm(height));
            rule.setStyle("bottom", Units.makeEm(shift));
            rule.width = width;
            rule.height = height + shift;
            rule.depth = -shift;
            // keeps the strut tall enough for the rule
            rule.maxFontSize = height * 1.125 * options.sizeMultiplier();
            return rule;
        }, (group, options, mathml) -> {
            final double width = Units.calculateSize(group.width(), options);
            final double height = Units.calculateSize(group.height(), options);
            final double shift = group.shift() == null ? 0 : Units.calculateSize(group.shift(), options);
            final String color = options.color() != null && options.getColor() != null ? options.getColor() : "black";
            final var rule = new MathDomNode.MathNode("mspace");
            rule.setAttribute("mathbackground", color);
            rule.setAttribute("width", Units.makeEm(width));
            rule.setAttribute("height", Units.makeEm(height));
            final var wrapper = new MathDomNode.MathNode("mpadded", List.of(rule));
            if (shift >= 0) {
                wrapper.setAttribute("height", Units.makeEm(shift));
            } else {
                wrapper.setAttribute("height", Units.makeEm(shift));
                wrapper.setAttribute("depth", Units.makeEm(-shift));
            }
            wrapper.setAttribute("voffset", Units.makeEm(shift));
            return wrapper;
        });
    }

    private static void registerPhantoms(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("phantom", "\\phantom")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Phantom(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)))));

        builder.defineBuilders(ParseNode.Phantom.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.body(), options.withPhantom(), HtmlBuilder.Grouping.PARTIAL)),
            (group, options, mathml) -> new MathDomNode.MathNode("mphantom",
                mathml.buildExpression(group.body(), options)));

        builder.defineFunction(FunctionSpec.builder("hphantom", "\\hphantom")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.HPhantom(context.mode(), context.loc(),
                args.get(0))));

        builder.defineBuilders(ParseNode.HPhantom.class, (group, options, html) -> {
            final BoxNode node = BuildCommon.makeSpan(List.of(),
                List.of(html.buildGroup(group.body(), options.withPhantom())));
            flatten(node, true, true);
            final BoxNode vlist = VList.firstBaseline(List.of(new VList.Elem(node))).build();
            return BuildCommon.makeSpan(List.of("mord"), List.of(vlist), options);
        }, (group, options, mathml) -> {
            final var phantom = new MathDomNode.MathNode("mphantom",
                mathml.buildExpression(ParseNode.ordArgument(group.body()), options));
            final var node = new MathDomNode.MathNode("mpadded", List.of(phantom));
            node.setAttribute("height", "0px");
            node.setAttribute("depth", "0px");
            return node;
        });

        builder.defineFunction(FunctionSpec.builder("vphantom", "\\vphantom")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.VPhantom(context.mode(), context.loc(),
                args.get(0))));

        builder.defineBuilders(ParseNode.VPhantom.class, (group, options, html) -> {
            final BoxNode inner = BuildCommon.makeSpan(List.of("inner"),
                List.of(html.buildGroup(group.body(), options.withPhantom())));
            final BoxNode fix = BuildCommon.makeSpan("fix");
            return BuildCommon.makeSpan(List.of("mord", "rlap"), List.of(inner, fix), options);
        }, (group, options, mathml) -> {
            final var phantom = new MathDomNode.MathNode("mphantom",
                mathml.buildExpression(ParseNode.ordArgument(group.body()), options));
            final var node = new MathDomNode.MathNode("mpadded", List.of(phantom));
            node.setAttribute("width", "0px");
            return node;
        });
    }

    /// Zeroes the height and/or depth of a node and its direct children.
    private static void flatten(BoxNode node, boolean height, boolean depth) {
        if (height) {
            node.height = 0;
        }
        if (depth) {
            node.depth = 0;
        }
        for (final BoxNode child : node.children()) {
            if (height) {
                child.height = 0;
            }
            if (depth) {
                child.depth = 0;
            }
        }
    }

    private static void registerSmash(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("smash", "\\smash")
            .numArgs(1)
            .numOptionalArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                boolean smashHeight = false;
                boolean smashDepth = false;
                final ParseNode tbArg = optArgs.get(0);
                if (tbArg instanceof ParseNode.OrdGroup group) {
                    for (final ParseNode node : group.body()) {
                        final String letter = node instanceof ParseNode.SymbolNode symbol ? symbol.text() : "";
                        if ("t".equals(letter)) {
                            smashHeight = true;
                        } else if ("b".equals(letter)) {
                            smashDepth = true;
                        } else {
                            smashHeight = false;
                            smashDepth = false;
                            break;
                        }
                    }
                } else {
                    smashHeight = true;
                    smashDepth = true;
                }
                return new ParseNode.Smash(context.mode(), context.loc(), args.get(0), smashHeight, smashDepth);
            }));

        builder.defineBuilders(ParseNode.Smash.class, (group, options, html) -> {
            final BoxNode node = BuildCommon.makeSpan(List.of(), List.of(html.buildGroup(group.body(), options)));
            if (!group.smashHeight() && !group.smashDepth()) {
                return node;
            }
            flatten(node, group.smashHeight(), group.smashDepth());
            final BoxNode smashed = VList.firstBaseline(List.of(new VList.Elem(node))).build();
            return BuildCommon.makeSpan(List.of("mord"), List.of(smashed), options);
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mpadded", List.of(mathml.buildGroup(group.body(), options)));
            if (group.smashHeight()) {
                node.setAttribute("height", "0px");
            }
            if (group.smashDepth()) {
                node.setAttribute("depth", "0px");
            }
            return node;
        });
    }

    private static void registerLap(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("lap", "\\mathllap", "\\mathrlap", "\\mathclap")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Lap(context.mode(), context.loc(),
                context.funcName().substring(5), args.get(0))));

        builder.defineBuilders(ParseNode.Lap.class, (group, options, html) -> {
            BoxNode inner;
            if ("clap".equals(group.alignment())) {
                inner = BuildCommon.makeSpan(List.of(), List.of(html.buildGroup(group.body(), options)));
                inner = BuildCommon.makeSpan(List.of("inner"), List.of(inner), options);
            } else {
                inner = BuildCommon.makeSpan(List.of("inner"), List.of(html.buildGroup(group.body(), options)));
            }
            final BoxNode fix = BuildCommon.makeSpan("fix");
            final BoxNode.Span node = BuildCommon.makeSpan(List.of(group.alignment()), List.of(inner, fix), options);
            final BoxNode strut = BuildCommon.makeSpan("strut");
            strut.setStyle("height", Units.makeEm(node.height + node.depth));
            if (node.depth != 0) {
                strut.setStyle("vertical-align", Units.makeEm(-node.depth));
            }
            node.children.add(0, strut);
            final BoxNode thinbox = BuildCommon.makeSpan(List.of("thinbox"), List.of(node), options);
            return BuildCommon.makeSpan(List.of("mord", "vbox"), List.of(thinbox), options);
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mpadded", List.of(mathml.buildGroup(group.body(), options)));
            if (!"rlap".equals(group.alignment())) {
                final String offset = "llap".equals(group.alignment()) ? "-1" : "-0.5";
                node.setAttribute("lspace", offset + "width");
            }
            node.setAttribute("width", "0px");
            return node;
        });
    }

    private static void registerRaiseBox(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("raisebox", "\\raisebox")
            .numArgs(2)
            .argTypes(ArgType.SIZE, ArgType.HBOX)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.RaiseBox(context.mode(), context.loc(),
                ((ParseNode.Size) args.get(0)).value(), args.get(1))));

        builder.defineBuilders(ParseNode.RaiseBox.class, (group, options, html) -> {
            final BoxNode body = html.buildGroup(group.body(), options);
            final double dy = Units.calculateSize(group.dy(), options);
            return VList.shift(-dy, List.of(new VList.Elem(body))).build();
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mpadded", List.of(mathml.buildGroup(group.body(), options)));
            node.setAttribute("voffset", group.dy().number() + group.dy().unit());
            return node;
        });
    }

    private static void registerVCenter(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("vcenter", "\\vcenter")
            .numArgs(1)
            .argTypes(ArgType.ORIGINAL)
            .allowedInText(false)
            .handler((context, args, optArgs) -> new ParseNode.VCenter(context.mode(), context.loc(), args.get(0))));

        builder.defineBuilders(ParseNode.VCenter.class, (group, options, html) -> {
            final BoxNode body = html.buildGroup(group.body(), options);
            final double axisHeight = options.fontMetrics().axisHeight();
            // equal extent above and below the axis
            final double dy = 0.5 * ((body.height() - axisHeight) - (body.depth() + axisHeight));
            return VList.shift(dy, List.of(new VList.Elem(body))).build();
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mpadded", List.of(mathml.buildGroup(group.body(), options)));
            node.classes().add("vcenter");
            return node;
        });
    }
}
