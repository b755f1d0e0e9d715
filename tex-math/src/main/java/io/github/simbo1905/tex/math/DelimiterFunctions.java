package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;
import java.util.Set;

/// Explicitly sized delimiters (`\big` and friends) and the
/// `\left...\middle...\right` construction that sizes them to its content.
final class DelimiterFunctions {

    private record SizeClass(String mclass, int size) {
    }

    private static final Map<String, SizeClass> DELIMITER_SIZES = Map.ofEntries(
        Map.entry("\\bigl", new SizeClass("mopen", 1)),
        Map.entry("\\Bigl", new SizeClass("mopen", 2)),
        Map.entry("\\biggl", new SizeClass("mopen", 3)),
        Map.entry("\\Biggl", new SizeClass("mopen", 4)),
        Map.entry("\\bigr", new SizeClass("mclose", 1)),
        Map.entry("\\Bigr", new SizeClass("mclose", 2)),
        Map.entry("\\biggr", new SizeClass("mclose", 3)),
        Map.entry("\\Biggr", new SizeClass("mclose", 4)),
        Map.entry("\\bigm", new SizeClass("mrel", 1)),
        Map.entry("\\Bigm", new SizeClass("mrel", 2)),
        Map.entry("\\biggm", new SizeClass("mrel", 3)),
        Map.entry("\\Biggm", new SizeClass("mrel", 4)),
        Map.entry("\\big", new SizeClass("mord", 1)),
        Map.entry("\\Big", new SizeClass("mord", 2)),
        Map.entry("\\bigg", new SizeClass("mord", 3)),
        Map.entry("\\Bigg", new SizeClass("mord", 4))
    );

    private static final Set<String> DELIMITERS = Set.of(
        "(", "\\lparen", ")", "\\rparen",
        "[", "\\lbrack", "]", "\\rbrack",
        "\\{", "\\lbrace", "\\}", "\\rbrace",
        "\\lfloor", "\\rfloor", "⌊", "⌋",
        "\\lceil", "\\rceil", "⌈", "⌉",
        "<", ">", "\\langle", "⟨", "\\rangle", "⟩", "\\lt", "\\gt",
        "\\lvert", "\\rvert", "\\lVert", "\\rVert",
        "\\lgroup", "\\rgroup", "⟮", "⟯",
        "\\lmoustache", "\\rmoustache", "⎰", "⎱",
        "/", "\\backslash",
        "|", "\\vert", "\\|", "\\Vert",
        "\\uparrow", "\\Uparrow",
        "\\downarrow", "\\Downarrow",
        "\\updownarrow", "\\Updownarrow",
        "."
    );

    /// A `\middle` delimiter waiting to be sized, with the options it was built under.
    record MiddleMark(String delim, Options options) {
    }

    private DelimiterFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("delimsizing", DELIMITER_SIZES.keySet().toArray(new String[0]))
            .numArgs(1)
            .argTypes(ArgType.PRIMITIVE)
            .handler((context, args, optArgs) -> {
                final SizeClass sizeClass = DELIMITER_SIZES.get(context.funcName());
                return new ParseNode.DelimSizing(context.mode(), context.loc(), sizeClass.size(),
                    sizeClass.mclass(), checkDelimiter(args.get(0), context));
            }));

        builder.defineBuilders(ParseNode.DelimSizing.class, (group, options, html) -> {
            if (".".equals(group.delim())) {
                // an empty delimiter still takes part in spacing
                return BuildCommon.makeSpan(group.mclass());
            }
            return Delimiter.sizedDelim(group.delim(), group.size(), options, group.mode(),
                List.of(group.mclass()));
        }, (group, options, mathml) -> {
            final var node = ".".equals(group.delim())
                ? new MathDomNode.MathNode("mo")
                : new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText(group.delim(), group.mode())));
            final boolean fence = "mopen".equals(group.mclass()) || "mclose".equals(group.mclass());
            node.setAttribute("fence", fence ? "true" : "false");
            node.setAttribute("stretchy", "true");
            final String size = Units.makeEm(Delimiter.SIZE_TO_MAX_HEIGHT[group.size()]);
            node.setAttribute("minsize", size);
            node.setAttribute("maxsize", size);
            return node;
        });

        builder.defineFunction(FunctionSpec.builder("leftright-right", "\\right")
            .numArgs(1)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final MacroDefinition color = context.parser().gullet().macros().get("\\current@color");
                final String rightColor = color instanceof MacroDefinition.Text text ? text.body() : null;
                return new ParseNode.LeftRightRight(context.mode(), context.loc(),
                    checkDelimiter(args.get(0), context), rightColor);
            }));

        builder.defineBuilders(ParseNode.LeftRightRight.class, (group, options, html) -> {
            throw new TexParseException("\\right must follow \\left", group);
        }, (group, options, mathml) -> {
            throw new TexParseException("\\right must follow \\left", group);
        });

        builder.defineFunction(FunctionSpec.builder("leftright", "\\left")
            .numArgs(1)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final String left = checkDelimiter(args.get(0), context);
                final Parser parser = context.parser();
                parser.enterLeftRight();
                final List<ParseNode> body;
                try {
                    body = parser.parseExpression(false, null);
                } finally {
                    parser.exitLeftRight();
                }
                parser.expect("\\right", false);
                final ParseNode right = parser.parseFunction(null, null);
                if (!(right instanceof ParseNode.LeftRightRight rightNode)) {
                    throw new TexParseException("Expected \\right after \\left", context.token());
                }
                return new ParseNode.LeftRight(parser.mode(), context.loc(), body, left, rightNode.delim(),
                    rightNode.color());
            }));

        builder.defineBuilders(ParseNode.LeftRight.class, DelimiterFunctions::leftRightHtml,
            DelimiterFunctions::leftRightMathMl);

        builder.defineFunction(FunctionSpec.builder("middle", "\\middle")
            .numArgs(1)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final String delim = checkDelimiter(args.get(0), context);
                if (context.parser().leftrightDepth() <= 0) {
                    throw new TexParseException("\\middle without preceding \\left", context.token());
                }
                return new ParseNode.Middle(context.mode(), context.loc(), delim);
            }));

        builder.defineBuilders(ParseNode.Middle.class, (group, options, html) -> {
            if (".".equals(group.delim())) {
                return HtmlBuilder.makeNullDelimiter(options, List.of());
            }
            final BoxNode.Span middle = Delimiter.sizedDelim(group.delim(), 1, options, group.mode(), List.of());
            middle.middle = new MiddleMark(group.delim(), options);
            return middle;
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mo",
                List.of(MathMlBuilder.makeText(group.delim(), group.mode())));
            node.setAttribute("fence", "true");
            node.setAttribute("lspace", "0.05em");
            node.setAttribute("rspace", "0.05em");
            return node;
        });
    }

    /// The delimiter text of `delim`.
    ///
    /// @throws TexParseException if it is not a symbol usable as a delimiter
    private static String checkDelimiter(ParseNode delim, FunctionContext context) {
        final ParseNode node = ParseNode.normalizeArgument(delim);
        if (!(node instanceof ParseNode.SymbolNode symbol)) {
            throw new TexParseException("Invalid delimiter type '" + node.type() + "'", context.token());
        }
        if (!DELIMITERS.contains(symbol.text())) {
            throw new TexParseException("Invalid delimiter '" + symbol.text() + "' after '" + context.funcName()
                + "'", context.token());
        }
        return symbol.text();
    }

    private static BoxNode leftRightHtml(ParseNode.LeftRight group, Options options, HtmlBuilder html) {
        final List<BoxNode> inner = html.buildExpression(group.body(), options, HtmlBuilder.Grouping.REAL,
            "mopen", "mclose");

        double innerHeight = 0;
        double innerDepth = 0;
        boolean hadMiddle = false;
        for (final BoxNode node : inner) {
            if (node instanceof BoxNode.Span span && span.middle != null) {
                hadMiddle = true;
            } else {
                innerHeight = Math.max(node.height, innerHeight);
                innerDepth = Math.max(node.depth, innerDepth);
            }
        }
        innerHeight *= options.sizeMultiplier();
        innerDepth *= options.sizeMultiplier();

        final BoxNode leftDelim = ".".equals(group.left())
            ? HtmlBuilder.makeNullDelimiter(options, List.of("mopen"))
            : Delimiter.leftRightDelim(group.left(), innerHeight, innerDepth, options, group.mode(),
                List.of("mopen"));
        inner.add(0, leftDelim);

        if (hadMiddle) {
            for (int i = 1; i < inner.size(); i++) {
                if (inner.get(i) instanceof BoxNode.Span span && span.middle != null) {
                    final MiddleMark mark = span.middle;
                    inner.set(i, Delimiter.leftRightDelim(mark.delim(), innerHeight, innerDepth, mark.options(),
                        group.mode(), List.of()));
                }
            }
        }

        final BoxNode rightDelim;
        if (".".equals(group.right())) {
            rightDelim = HtmlBuilder.makeNullDelimiter(options, List.of("mclose"));
        } else {
            final Options colorOptions = group.rightColor() != null ? options.withColor(group.rightColor()) : options;
            rightDelim = Delimiter.leftRightDelim(group.right(), innerHeight, innerDepth, colorOptions, group.mode(),
                List.of("mclose"));
        }
        inner.add(rightDelim);
        return BuildCommon.makeSpan(List.of("minner"), inner, options);
    }

    private static MathDomNode leftRightMathMl(ParseNode.LeftRight group, Options options, MathMlBuilder mathml) {
        final List<MathDomNode> inner = mathml.buildExpression(group.body(), options);
        if (!".".equals(group.left())) {
            final var left = new MathDomNode.MathNode("mo", List.of(MathMlBuilder.makeText(group.left(), group.mode())));
            left.setAttribute("fence", "true");
            inner.add(0, left);
        }
        if (!".".equals(group.right())) {
            final var right = new MathDomNode.MathNode("mo",
                List.of(MathMlBuilder.makeText(group.right(), group.mode())));
            right.setAttribute("fence", "true");
            if (group.rightColor() != null) {
                right.setAttribute("mathcolor", group.rightColor());
            }
            inner.add(right);
        }
        return MathMlBuilder.makeRow(inner);
    }
}
