package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;

/// Commands that shape the parse rather than draw anything of their own:
/// environments, line breaks, `\relax`, math inside text, forced atom
/// classes, verbatim text and equation tags.
final class StructureFunctions {

    private StructureFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("environment", "\\begin", "\\end")
            .numArgs(1)
            .argTypes(ArgType.TEXT)
            .handler(StructureFunctions::environment));

        builder.defineFunction(FunctionSpec.builder("cr", "\\\\")
            .allowedInText(true)
            .handler(StructureFunctions::lineBreak));
        builder.defineBuilders(ParseNode.Cr.class, (group, options, html) -> {
            final BoxNode.Span span = BuildCommon.makeSpan(List.of("mspace"), List.of(), options);
            if (group.newLine()) {
                span.addClass("newline");
                if (group.size() != null) {
                    span.setStyle("margin-top", Units.makeEm(Units.calculateSize(group.size(), options)));
                }
            }
            return span;
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mspace");
            if (group.newLine()) {
                node.setAttribute("linebreak", "newline");
                if (group.size() != null) {
                    node.setAttribute("height", Units.makeEm(Units.calculateSize(group.size(), options)));
                }
            }
            return node;
        });

        builder.defineFunction(FunctionSpec.builder("internal", "\\relax")
            .allowedInText(true)
            .allowedInArgument(true)
            .handler((context, args, optArgs) -> new ParseNode.Internal(context.mode(), context.loc())));
        builder.defineBuilders(ParseNode.Internal.class,
            (group, options, html) -> BuildCommon.makeFragment(List.of()),
            (group, options, mathml) -> new MathDomNode.MathNode("mrow"));

        builder.defineFunction(FunctionSpec.builder("styling", "\\(", "$")
            .allowedInText(true)
            .allowedInMath(false)
            .handler(StructureFunctions::mathInText));
        builder.defineFunction(FunctionSpec.builder("text", "\\)", "\\]")
            .allowedInText(true)
            .allowedInMath(false)
            .handler((context, args, optArgs) -> {
                throw new TexParseException("Mismatched " + context.funcName(), context.token());
            }));

        builder.defineFunction(FunctionSpec.builder("mclass", "\\mathord", "\\mathbin", "\\mathrel", "\\mathopen",
                "\\mathclose", "\\mathpunct", "\\mathinner")
            .numArgs(1)
            .primitive(true)
            .handler((context, args, optArgs) -> new ParseNode.MClass(context.mode(), context.loc(),
                "m" + context.funcName().substring(5), ParseNode.ordArgument(args.get(0)),
                ParseNode.isCharacterBox(args.get(0)))));
        builder.defineFunction(FunctionSpec.builder("mclass", "\\@binrel")
            .numArgs(2)
            .handler((context, args, optArgs) -> new ParseNode.MClass(context.mode(), context.loc(),
                binrelClass(args.get(0)), ParseNode.ordArgument(args.get(1)),
                ParseNode.isCharacterBox(args.get(1)))));
        builder.defineFunction(FunctionSpec.builder("mclass", "\\stackrel", "\\overset", "\\underset")
            .numArgs(2)
            .handler(StructureFunctions::stacked));
        builder.defineBuilders(ParseNode.MClass.class,
            (group, options, html) -> BuildCommon.makeSpan(List.of(group.mclass()),
                html.buildExpression(group.body(), options, HtmlBuilder.Grouping.REAL), options),
            StructureFunctions::mclassMathMl);

        builder.defineFunction(FunctionSpec.builder("hbox", "\\hbox")
            .numArgs(1)
            .argTypes(ArgType.TEXT)
            .allowedInText(true)
            .primitive(true)
            .handler((context, args, optArgs) -> new ParseNode.Hbox(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)))));
        builder.defineBuilders(ParseNode.Hbox.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.body(), options, HtmlBuilder.Grouping.PARTIAL)),
            (group, options, mathml) -> new MathDomNode.MathNode("mrow",
                mathml.buildExpression(group.body(), options)));

        builder.defineFunction(FunctionSpec.builder("htmlmathml", "\\html@mathml")
            .numArgs(2)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.HtmlMathMl(context.mode(), context.loc(),
                ParseNode.ordArgument(args.get(0)), ParseNode.ordArgument(args.get(1)))));
        builder.defineBuilders(ParseNode.HtmlMathMl.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.html(), options, HtmlBuilder.Grouping.PARTIAL)),
            (group, options, mathml) -> mathml.buildExpressionRow(group.mathml(), options));

        // the lexer reads \verb whole; reaching the function means the delimiter never closed
        builder.defineFunction(FunctionSpec.builder("verb", "\\verb")
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                throw new TexParseException("\\verb ended by end of line instead of matching delimiter",
                    context.token());
            }));
        builder.defineBuilders(ParseNode.Verb.class, StructureFunctions::verbHtml, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mtext", List.of(new MathDomNode.TextNode(verbText(group))));
            node.setAttribute("mathvariant", "monospace");
            return node;
        });

        builder.defineBuilders(ParseNode.Tag.class,
            (group, options, html) -> BuildCommon.makeFragment(
                html.buildExpression(group.body(), options, HtmlBuilder.Grouping.PARTIAL)),
            StructureFunctions::tagMathMl);
    }

    // ========== Environments ==========

    private static ParseNode environment(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final ParseNode nameGroup = args.get(0);
        if (!(nameGroup instanceof ParseNode.OrdGroup group)) {
            throw new TexParseException("Invalid environment name", nameGroup);
        }
        final var envName = new StringBuilder();
        for (final ParseNode node : group.body()) {
            if (!(node instanceof ParseNode.TextOrd ord)) {
                throw new TexParseException("Invalid environment name", nameGroup);
            }
            envName.append(ord.text());
        }
        final String name = envName.toString();
        final Parser parser = context.parser();
        if (!"\\begin".equals(context.funcName())) {
            return new ParseNode.Environment(parser.mode(), context.loc(), name, nameGroup);
        }

        final EnvironmentSpec env = parser.registry().environment(name);
        if (env == null) {
            throw new TexParseException("No such environment: " + name, nameGroup);
        }
        StructuredLog.finer(TexLogging.LOG, "environment", "name", name);
        final Parser.Arguments arguments = parser.parseArguments("\\begin{" + name + "}", env.asArguments());
        final var envContext = new EnvironmentContext(name, parser, parser.mode());
        final ParseNode result = env.handler().handle(envContext, arguments.args(), arguments.optArgs());
        parser.expect("\\end", false);
        final Token endNameToken = parser.fetch();
        final ParseNode end = parser.parseFunction(null, null);
        if (!(end instanceof ParseNode.Environment endEnv)) {
            throw new TexParseException("Expected \\end after environment " + name, endNameToken);
        }
        if (!endEnv.name().equals(name)) {
            throw new TexParseException("Mismatch: \\begin{" + name + "} matched by \\end{" + endEnv.name() + "}",
                endNameToken);
        }
        return result;
    }

    // ========== Line breaks ==========

    private static ParseNode lineBreak(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final Parser parser = context.parser();
        Measurement size = null;
        if ("[".equals(parser.gullet().future().text())) {
            final ParseNode sizeNode = parser.parseSizeGroup(true);
            if (sizeNode instanceof ParseNode.Size parsed) {
                size = parsed.value();
            }
        }
        final Settings settings = parser.settings();
        final boolean newLine = !settings.displayMode() || !settings.useStrictBehavior("newLineInDisplayMode",
            "In LaTeX, \\\\ or \\newline does nothing in display mode", context.token());
        return new ParseNode.Cr(parser.mode(), context.loc(), newLine, size);
    }

    // ========== Math in text ==========

    private static ParseNode mathInText(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final Parser parser = context.parser();
        final Mode outerMode = parser.mode();
        parser.switchMode(Mode.MATH);
        final String close = "\\(".equals(context.funcName()) ? "\\)" : "$";
        final List<ParseNode> body = parser.parseExpression(false, close);
        parser.expect(close);
        parser.switchMode(outerMode);
        return new ParseNode.Styling(parser.mode(), context.loc(), Style.TEXT, body);
    }

    // ========== Atom classes ==========

    /// `mbin` or `mrel` when `arg` is a single binary or relation atom, else `mord`.
    static String binrelClass(ParseNode arg) {
        ParseNode atom = arg;
        if (arg instanceof ParseNode.OrdGroup group && !group.body().isEmpty()) {
            atom = group.body().get(0);
        }
        if (atom instanceof ParseNode.Atom a && ("bin".equals(a.family()) || "rel".equals(a.family()))) {
            return "m" + a.family();
        }
        return "mord";
    }

    private static ParseNode stacked(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final ParseNode shiftedArg = args.get(0);
        final ParseNode baseArg = args.get(1);
        final String funcName = context.funcName();
        final boolean stackrel = "\\stackrel".equals(funcName);
        final String mclass = stackrel ? "mrel" : binrelClass(baseArg);
        final var baseOp = new ParseNode.Op(baseArg.mode(), null, true, true, !stackrel, false, false, null,
            ParseNode.ordArgument(baseArg));
        final boolean under = "\\underset".equals(funcName);
        final var supsub = new ParseNode.SupSub(shiftedArg.mode(), null, baseOp,
            under ? null : shiftedArg, under ? shiftedArg : null);
        return new ParseNode.MClass(context.mode(), context.loc(), mclass, List.of(supsub),
            ParseNode.isCharacterBox(supsub));
    }

    private static MathDomNode mclassMathMl(ParseNode.MClass group, Options options, MathMlBuilder mathml) {
        final List<MathDomNode> inner = mathml.buildExpression(group.body(), options);
        final MathDomNode.MathNode node;
        if ("minner".equals(group.mclass())) {
            node = new MathDomNode.MathNode("mpadded", inner);
        } else if ("mord".equals(group.mclass())) {
            node = group.isCharacterBox() && inner.get(0) instanceof MathDomNode.MathNode only
                ? only.withType("mi")
                : new MathDomNode.MathNode("mi", inner);
        } else {
            node = group.isCharacterBox() && inner.get(0) instanceof MathDomNode.MathNode only
                ? only.withType("mo")
                : new MathDomNode.MathNode("mo", inner);
        }
        switch (group.mclass()) {
            case "mbin" -> {
                node.setAttribute("lspace", "0.22em");
                node.setAttribute("rspace", "0.22em");
            }
            case "mpunct" -> {
                node.setAttribute("lspace", "0em");
                node.setAttribute("rspace", "0.17em");
            }
            case "mopen", "mclose" -> {
                node.setAttribute("lspace", "0em");
                node.setAttribute("rspace", "0em");
            }
            case "minner" -> {
                node.setAttribute("lspace", "0.0556em");
                node.setAttribute("width", "+0.1111em");
            }
            default -> { }
        }
        return node;
    }

    // ========== Verbatim ==========

    /// `\verb*` shows spaces as an open box; `\verb` keeps them unbreakable.
    private static String verbText(ParseNode.Verb group) {
        return group.body().replace(" ", group.star() ? "\u2423" : "\u00a0");
    }

    private static BoxNode verbHtml(ParseNode.Verb group, Options options, HtmlBuilder html) {
        final String text = verbText(group);
        final Options newOptions = options.havingStyle(options.style().text());
        final List<BoxNode> body = new ArrayList<>();
        text.codePoints().forEach(cp -> {
            final String c = cp == '~' ? "\\textasciitilde" : new String(Character.toChars(cp));
            body.add(BuildCommon.makeSymbol(c, "Typewriter-Regular", group.mode(), newOptions,
                List.of("mord", "texttt")));
        });
        return BuildCommon.makeSpan(BuildCommon.concat(List.of("mord", "text"), newOptions.sizingClasses(options)),
            BuildCommon.tryCombineChars(body), newOptions);
    }

    // ========== Tags ==========

    private static MathDomNode.MathNode tagPad() {
        final var pad = new MathDomNode.MathNode("mtd");
        pad.setAttribute("width", "50%");
        return pad;
    }

    private static MathDomNode tagMathMl(ParseNode.Tag group, Options options, MathMlBuilder mathml) {
        final var row = new MathDomNode.MathNode("mtr", List.of(
            tagPad(),
            new MathDomNode.MathNode("mtd", List.of(mathml.buildExpressionRow(group.body(), options))),
            tagPad(),
            new MathDomNode.MathNode("mtd", List.of(mathml.buildExpressionRow(group.tag(), options)))));
        final var table = new MathDomNode.MathNode("mtable", List.of(row));
        table.setAttribute("width", "100%");
        return table;
    }
}
