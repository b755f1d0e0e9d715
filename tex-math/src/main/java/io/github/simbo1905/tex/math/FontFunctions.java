package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;

/// Math fonts (`\mathbf`...), the old-style switches (`\bf`...), bold
/// symbols, text-mode boxes (`\text`, `\textbf`...) and poor man's bold.
final class FontFunctions {

    private static final Map<String, String> FONT_ALIASES = Map.of(
        "\\Bbb", "\\mathbb",
        "\\bold", "\\mathbf",
        "\\frak", "\\mathfrak",
        "\\bm", "\\boldsymbol"
    );

    private static final Map<String, String> TEXT_FONT_FAMILIES = Map.of(
        "\\textrm", "textrm",
        "\\textsf", "textsf",
        "\\texttt", "texttt",
        "\\textnormal", "textrm"
    );

    private static final Map<String, String> TEXT_FONT_WEIGHTS = Map.of(
        "\\textbf", "textbf",
        "\\textmd", "textmd"
    );

    private static final Map<String, String> TEXT_FONT_SHAPES = Map.of(
        "\\textit", "textit",
        "\\textup", "textup"
    );

    private FontFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("font", "\\mathrm", "\\mathit", "\\mathbf", "\\mathnormal",
                "\\mathsfit", "\\mathbb", "\\mathcal", "\\mathfrak", "\\mathscr", "\\mathsf", "\\mathtt", "\\Bbb",
                "\\bold", "\\frak")
            .numArgs(1)
            .allowedInArgument(true)
            .handler((context, args, optArgs) -> {
                final String func = FONT_ALIASES.getOrDefault(context.funcName(), context.funcName());
                return new ParseNode.Font(context.mode(), context.loc(), func.substring(1),
                    ParseNode.normalizeArgument(args.get(0)));
            }));

        builder.defineFunction(FunctionSpec.builder("mclass", "\\boldsymbol", "\\bm")
            .numArgs(1)
            .handler((context, args, optArgs) -> {
                final ParseNode body = args.get(0);
                return new ParseNode.MClass(context.mode(), context.loc(), StructureFunctions.binrelClass(body),
                    List.of(new ParseNode.Font(context.mode(), context.loc(), "boldsymbol", body)),
                    ParseNode.isCharacterBox(body));
            }));

        builder.defineFunction(FunctionSpec.builder("font", "\\rm", "\\sf", "\\tt", "\\bf", "\\it", "\\cal")
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                final List<ParseNode> body = context.parser().parseExpression(true, context.breakOnTokenText());
                return new ParseNode.Font(context.mode(), context.loc(), "math" + context.funcName().substring(1),
                    new ParseNode.OrdGroup(context.mode(), context.loc(), body));
            }));

        builder.defineBuilders(ParseNode.Font.class,
            (group, options, html) -> html.buildGroup(group.body(), options.withFont(group.font())),
            (group, options, mathml) -> mathml.buildGroup(group.body(), options.withFont(group.font())));

        builder.defineFunction(FunctionSpec.builder("text", "\\text", "\\textrm", "\\textsf", "\\texttt",
                "\\textnormal", "\\textbf", "\\textmd", "\\textit", "\\textup", "\\emph")
            .numArgs(1)
            .argTypes(ArgType.TEXT)
            .allowedInArgument(true)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Text(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)), context.funcName())));

        builder.defineBuilders(ParseNode.Text.class,
            (group, options, html) -> {
                final Options newOptions = textOptions(group, options);
                return BuildCommon.makeSpan(List.of("mord", "text"),
                    html.buildExpression(group.body(), newOptions, HtmlBuilder.Grouping.REAL), newOptions);
            },
            (group, options, mathml) -> mathml.buildExpressionRow(group.body(), textOptions(group, options)));

        builder.defineFunction(FunctionSpec.builder("pmb", "\\pmb")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.Pmb(context.mode(), context.loc(),
                StructureFunctions.binrelClass(args.get(0)), ParseNode.ordArgument(args.get(0)))));

        builder.defineBuilders(ParseNode.Pmb.class,
            (group, options, html) -> {
                final BoxNode node = BuildCommon.makeSpan(List.of(group.mclass()),
                    html.buildExpression(group.body(), options, HtmlBuilder.Grouping.REAL), options);
                node.setStyle("text-shadow", "0.02em 0.01em 0.04px");
                return node;
            },
            (group, options, mathml) -> {
                final var node = new MathDomNode.MathNode("mstyle", mathml.buildExpression(group.body(), options));
                node.setAttribute("style", "text-shadow: 0.02em 0.01em 0.04px");
                return node;
            });
    }

    /// The options a text box's font command selects.
    private static Options textOptions(ParseNode.Text group, Options options) {
        final String font = group.font();
        if (font == null || "\\text".equals(font)) {
            return options;
        }
        if (TEXT_FONT_FAMILIES.containsKey(font)) {
            return options.withTextFontFamily(TEXT_FONT_FAMILIES.get(font));
        }
        if (TEXT_FONT_WEIGHTS.containsKey(font)) {
            return options.withTextFontWeight(TEXT_FONT_WEIGHTS.get(font));
        }
        if ("\\emph".equals(font)) {
            return "textit".equals(options.fontShape())
                ? options.withTextFontShape("textup")
                : options.withTextFontShape("textit");
        }
        return options.withTextFontShape(TEXT_FONT_SHAPES.get(font));
    }
}
