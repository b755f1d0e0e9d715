package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;

/// Style switches (`\displaystyle`...), size switches (`\tiny`...`\Huge`)
/// and colour (`\textcolor`, `\color`).
final class StyleFunctions {

    private static final Map<String, Style> STYLES = Map.of(
        "\\displaystyle", Style.DISPLAY,
        "\\textstyle", Style.TEXT,
        "\\scriptstyle", Style.SCRIPT,
        "\\scriptscriptstyle", Style.SCRIPTSCRIPT
    );

    private static final List<String> SIZE_FUNCS = List.of("\\tiny", "\\sixptsize", "\\scriptsize",
        "\\footnotesize", "\\small", "\\normalsize", "\\large", "\\Large", "\\LARGE", "\\huge", "\\Huge");

    private StyleFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("styling", STYLES.keySet().toArray(new String[0]))
            .allowedInText(true)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final List<ParseNode> body = context.parser().parseExpression(true, context.breakOnTokenText());
                return new ParseNode.Styling(context.mode(), context.loc(), STYLES.get(context.funcName()), body);
            }));

        builder.defineBuilders(ParseNode.Styling.class,
            (group, options, html) -> sizingGroup(group.body(), options.havingStyle(group.style()).withFont(""),
                options, html),
            (group, options, mathml) -> {
                final Options newOptions = options.havingStyle(group.style());
                final var node = new MathDomNode.MathNode("mstyle", mathml.buildExpression(group.body(), newOptions));
                final Style style = group.style();
                node.setAttribute("scriptlevel", String.valueOf(Math.max(0, style.size() - 1)));
                node.setAttribute("displaystyle", style.size() == Style.DISPLAY.size() ? "true" : "false");
                return node;
            });

        builder.defineFunction(FunctionSpec.builder("sizing", SIZE_FUNCS.toArray(new String[0]))
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                final List<ParseNode> body = context.parser().parseExpression(false, context.breakOnTokenText());
                return new ParseNode.Sizing(context.mode(), context.loc(), SIZE_FUNCS.indexOf(context.funcName()) + 1,
                    body);
            }));

        builder.defineBuilders(ParseNode.Sizing.class,
            (group, options, html) -> sizingGroup(group.body(), options.havingSize(group.size()), options, html),
            (group, options, mathml) -> {
                final Options newOptions = options.havingSize(group.size());
                final var node = new MathDomNode.MathNode("mstyle", mathml.buildExpression(group.body(), newOptions));
                node.setAttribute("mathsize", Units.makeEm(newOptions.sizeMultiplier()));
                return node;
            });

        builder.defineFunction(FunctionSpec.builder("mathchoice", "\\mathchoice")
            .numArgs(4)
            .primitive(true)
            .handler((context, args, optArgs) -> new ParseNode.MathChoice(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)), ParseNode.ordArgument(args.get(1)),
                ParseNode.ordArgument(args.get(2)), ParseNode.ordArgument(args.get(3)))));

        builder.defineBuilders(ParseNode.MathChoice.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.choose(options.style()), options, HtmlBuilder.Grouping.PARTIAL)),
            (group, options, mathml) -> mathml.buildExpressionRow(group.choose(options.style()), options));

        builder.defineFunction(FunctionSpec.builder("color", "\\textcolor")
            .numArgs(2)
            .allowedInText(true)
            .argTypes(ArgType.COLOR, ArgType.ORIGINAL)
            .handler((context, args, optArgs) -> new ParseNode.Color(context.mode(), context.loc(),
                ((ParseNode.ColorToken) args.get(0)).color(), ParseNode.ordArgument(args.get(1)))));

        builder.defineFunction(FunctionSpec.builder("color", "\\color")
            .numArgs(1)
            .allowedInText(true)
            .argTypes(ArgType.COLOR)
            .handler((context, args, optArgs) -> {
                final String color = ((ParseNode.ColorToken) args.get(0)).color();
                // \right picks this up to colour its delimiter
                context.parser().gullet().macros().set("\\current@color", MacroDefinition.text(color));
                final List<ParseNode> body = context.parser().parseExpression(true, context.breakOnTokenText());
                return new ParseNode.Color(context.mode(), context.loc(), color, body);
            }));

        builder.defineBuilders(ParseNode.Color.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.body(), options.withColor(group.color()), HtmlBuilder.Grouping.PARTIAL)),
            (group, options, mathml) -> {
                final var node = new MathDomNode.MathNode("mstyle",
                    mathml.buildExpression(group.body(), options.withColor(group.color())));
                node.setAttribute("mathcolor", group.color());
                return node;
            });
    }

    /// Builds `body` at a new size or style, tagging each child with the
    /// classes that resize it from `baseOptions`.
    static BoxNode sizingGroup(List<ParseNode> body, Options options, Options baseOptions, HtmlBuilder html) {
        final List<BoxNode> inner = html.buildExpression(body, options, HtmlBuilder.Grouping.PARTIAL);
        final double multiplier = options.sizeMultiplier() / baseOptions.sizeMultiplier();
        for (final BoxNode node : inner) {
            final int pos = node.classes.indexOf("sizing");
            if (pos < 0) {
                node.classes.addAll(options.sizingClasses(baseOptions));
            } else if (pos + 1 < node.classes.size()
                && node.classes.get(pos + 1).equals("reset-size" + options.size())) {
                // a nested size switch resets straight to the outer size
                node.classes.set(pos + 1, "reset-size" + baseOptions.size());
            }
            node.height *= multiplier;
            node.depth *= multiplier;
        }
        return BuildCommon.makeFragment(inner);
    }
}
