package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Fractions and binomials: `\frac` and its relatives, `\genfrac`, and the
/// infix forms `\over`, `\choose`, `\atop`, `\brace`, `\brack` and `\above`.
final class GenfracFunctions {

    private static final Map<String, String> INFIX_REPLACEMENTS = Map.of(
        "\\over", "\\frac",
        "\\choose", "\\binom",
        "\\atop", "\\\\atopfrac",
        "\\brace", "\\\\bracefrac",
        "\\brack", "\\\\brackfrac"
    );

    private static final Style[] GENFRAC_STYLES = {Style.DISPLAY, Style.TEXT, Style.SCRIPT, Style.SCRIPTSCRIPT};

    private GenfracFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("genfrac", "\\dfrac", "\\frac", "\\tfrac", "\\dbinom",
                "\\binom", "\\tbinom", "\\\\atopfrac", "\\\\bracefrac", "\\\\brackfrac")
            .numArgs(2)
            .allowedInArgument(true)
            .handler((context, args, optArgs) -> frac(context, args.get(0), args.get(1))));

        builder.defineFunction(FunctionSpec.builder("genfrac", "\\cfrac")
            .numArgs(2)
            .handler((context, args, optArgs) -> new ParseNode.Genfrac(context.mode(), context.loc(), true,
                args.get(0), args.get(1), true, null, null, Style.DISPLAY, null)));

        builder.defineFunction(FunctionSpec.builder("infix", "\\over", "\\choose", "\\atop", "\\brace", "\\brack")
            .infix(true)
            .handler((context, args, optArgs) -> new ParseNode.Infix(context.mode(), context.loc(),
                INFIX_REPLACEMENTS.get(context.funcName()), null, context.token())));

        builder.defineFunction(FunctionSpec.builder("genfrac", "\\genfrac")
            .numArgs(6)
            .allowedInArgument(true)
            .argTypes(ArgType.MATH, ArgType.MATH, ArgType.SIZE, ArgType.TEXT, ArgType.MATH, ArgType.MATH)
            .handler((context, args, optArgs) -> genfrac(context, args)));

        builder.defineFunction(FunctionSpec.builder("infix", "\\above")
            .numArgs(1)
            .argTypes(ArgType.SIZE)
            .infix(true)
            .handler((context, args, optArgs) -> new ParseNode.Infix(context.mode(), context.loc(),
                "\\\\abovefrac", ((ParseNode.Size) args.get(0)).value(), context.token())));

        builder.defineFunction(FunctionSpec.builder("genfrac", "\\\\abovefrac")
            .numArgs(3)
            .argTypes(ArgType.MATH, ArgType.SIZE, ArgType.MATH)
            .handler((context, args, optArgs) -> {
                if (!(args.get(1) instanceof ParseNode.Infix infix)) {
                    throw new TexParseException("Expected infix node for \\above", args.get(1));
                }
                final Measurement barSize = infix.size();
                final boolean hasBarLine = barSize != null && barSize.number() > 0;
                return new ParseNode.Genfrac(context.mode(), context.loc(), false, args.get(0), args.get(2),
                    hasBarLine, null, null, null, barSize);
            }));

        builder.defineBuilders(ParseNode.Genfrac.class, GenfracFunctions::html, GenfracFunctions::mathml);
    }

    private static ParseNode frac(FunctionContext context, ParseNode numer, ParseNode denom) {
        final String name = context.funcName();
        boolean hasBarLine = false;
        String leftDelim = null;
        String rightDelim = null;
        switch (name) {
            case "\\dfrac", "\\frac", "\\tfrac" -> hasBarLine = true;
            case "\\\\atopfrac" -> { }
            case "\\dbinom", "\\binom", "\\tbinom" -> {
                leftDelim = "(";
                rightDelim = ")";
            }
            case "\\\\bracefrac" -> {
                leftDelim = "\\{";
                rightDelim = "\\}";
            }
            case "\\\\brackfrac" -> {
                leftDelim = "[";
                rightDelim = "]";
            }
            default -> throw new TexParseException("Unrecognized genfrac command", context.token());
        }
        Style size = null;
        if ("\\dfrac".equals(name) || "\\dbinom".equals(name)) {
            size = Style.DISPLAY;
        } else if ("\\tfrac".equals(name) || "\\tbinom".equals(name)) {
            size = Style.TEXT;
        }
        return new ParseNode.Genfrac(context.mode(), context.loc(), false, numer, denom, hasBarLine, leftDelim,
            rightDelim, size, null);
    }

    private static String delimFromValue(String delim) {
        return delim.isEmpty() || ".".equals(delim) ? null : delim;
    }

    private static ParseNode genfrac(FunctionContext context, List<ParseNode> args) {
        final ParseNode leftNode = ParseNode.normalizeArgument(args.get(0));
        final String leftDelim = leftNode instanceof ParseNode.Atom atom && "open".equals(atom.family())
            ? delimFromValue(atom.text()) : null;
        final ParseNode rightNode = ParseNode.normalizeArgument(args.get(1));
        final String rightDelim = rightNode instanceof ParseNode.Atom atom && "close".equals(atom.family())
            ? delimFromValue(atom.text()) : null;

        final ParseNode.Size barNode = (ParseNode.Size) args.get(2);
        final boolean hasBarLine;
        Measurement barSize = null;
        if (barNode.isBlank()) {
            hasBarLine = true;
        } else {
            barSize = barNode.value();
            hasBarLine = barSize.number() > 0;
        }

        Style size = null;
        ParseNode styleArg = args.get(3);
        if (styleArg instanceof ParseNode.OrdGroup group) {
            styleArg = group.body().isEmpty() ? null : group.body().get(0);
        }
        if (styleArg != null) {
            final String text = ParseNode.symbolText(styleArg);
            try {
                final int index = Integer.parseInt(text);
                if (index >= 0 && index < GENFRAC_STYLES.length) {
                    size = GENFRAC_STYLES[index];
                }
            } catch (NumberFormatException e) {
                throw new TexParseException("Invalid \\genfrac style '" + text + "'", styleArg);
            }
        }
        return new ParseNode.Genfrac(context.mode(), context.loc(), false, args.get(4), args.get(5), hasBarLine,
            leftDelim, rightDelim, size, barSize);
    }

    /// The style a fraction is set in, given its forced size.
    private static Style adjustStyle(Style size, Style original) {
        if (size == null) {
            return original;
        }
        if (size == Style.DISPLAY) {
            return original.id() >= Style.SCRIPT.id() ? original.text() : Style.DISPLAY;
        }
        if (size == Style.TEXT && original.size() == Style.DISPLAY.size()) {
            return Style.TEXT;
        }
        if (size == Style.SCRIPT || size == Style.SCRIPTSCRIPT) {
            return size;
        }
        return original;
    }

    private static BoxNode html(ParseNode.Genfrac group, Options options, HtmlBuilder html) {
        final Style style = adjustStyle(group.size(), options.style());
        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();

        final BoxNode numerm = html.buildGroup(group.numer(), options.havingStyle(style.fracNum()), options);
        if (group.continued()) {
            // \cfrac puts a strut in the numerator
            numerm.height = Math.max(numerm.height, 8.5 / metrics.ptPerEm());
            numerm.depth = Math.max(numerm.depth, 3.5 / metrics.ptPerEm());
        }
        final BoxNode denomm = html.buildGroup(group.denom(), options.havingStyle(style.fracDen()), options);

        BoxNode rule = null;
        double ruleWidth = 0;
        double ruleSpacing = metrics.defaultRuleThickness();
        if (group.hasBarLine()) {
            if (group.barSize() != null) {
                rule = BuildCommon.makeLineSpan("frac-line", options, Units.calculateSize(group.barSize(), options));
            } else {
                rule = BuildCommon.makeLineSpan("frac-line", options, null);
            }
            ruleWidth = rule.height;
            ruleSpacing = rule.height;
        }

        double numShift;
        double denomShift;
        final double clearance;
        if (style.size() == Style.DISPLAY.size() || group.size() == Style.DISPLAY) {
            numShift = metrics.num1();
            clearance = ruleWidth > 0 ? 3 * ruleSpacing : 7 * ruleSpacing;
            denomShift = metrics.denom1();
        } else {
            if (ruleWidth > 0) {
                numShift = metrics.num2();
                clearance = ruleSpacing;
            } else {
                numShift = metrics.num3();
                clearance = 3 * ruleSpacing;
            }
            denomShift = metrics.denom2();
        }

        final BoxNode.Span frac;
        if (rule == null) {
            // rule 15c
            final double candidateClearance = (numShift - numerm.depth) - (denomm.height - denomShift);
            if (candidateClearance < clearance) {
                numShift += 0.5 * (clearance - candidateClearance);
                denomShift += 0.5 * (clearance - candidateClearance);
            }
            frac = VList.individualShift(List.of(
                new VList.Elem(denomm, denomShift),
                new VList.Elem(numerm, -numShift))).build();
        } else {
            // rule 15d
            final double axisHeight = metrics.axisHeight();
            if ((numShift - numerm.depth) - (axisHeight + 0.5 * ruleWidth) < clearance) {
                numShift += clearance - ((numShift - numerm.depth) - (axisHeight + 0.5 * ruleWidth));
            }
            if ((axisHeight - 0.5 * ruleWidth) - (denomm.height - denomShift) < clearance) {
                denomShift += clearance - ((axisHeight - 0.5 * ruleWidth) - (denomm.height - denomShift));
            }
            final double midShift = -(axisHeight - 0.5 * ruleWidth);
            frac = VList.individualShift(List.of(
                new VList.Elem(denomm, denomShift),
                new VList.Elem(rule, midShift),
                new VList.Elem(numerm, -numShift))).build();
        }

        final Options newOptions = options.havingStyle(style);
        frac.height *= newOptions.sizeMultiplier() / options.sizeMultiplier();
        frac.depth *= newOptions.sizeMultiplier() / options.sizeMultiplier();

        // rule 15e
        final double delimSize;
        if (style.size() == Style.DISPLAY.size()) {
            delimSize = metrics.delim1();
        } else if (style.size() == Style.SCRIPTSCRIPT.size()) {
            delimSize = options.havingStyle(Style.SCRIPT).fontMetrics().delim2();
        } else {
            delimSize = metrics.delim2();
        }

        final BoxNode leftDelim = group.leftDelim() == null
            ? HtmlBuilder.makeNullDelimiter(options, List.of("mopen"))
            : Delimiter.customSizedDelim(group.leftDelim(), delimSize, true, newOptions, group.mode(),
                List.of("mopen"));
        final BoxNode rightDelim;
        if (group.continued()) {
            rightDelim = BuildCommon.makeSpan();
        } else if (group.rightDelim() == null) {
            rightDelim = HtmlBuilder.makeNullDelimiter(options, List.of("mclose"));
        } else {
            rightDelim = Delimiter.customSizedDelim(group.rightDelim(), delimSize, true, newOptions, group.mode(),
                List.of("mclose"));
        }

        final List<String> classes = new ArrayList<>();
        classes.add("mord");
        classes.addAll(newOptions.sizingClasses(options));
        return BuildCommon.makeSpan(classes,
            List.of(leftDelim, BuildCommon.makeSpan(List.of("mfrac"), List.of(frac)), rightDelim), options);
    }

    private static MathDomNode mathml(ParseNode.Genfrac group, Options options, MathMlBuilder mathml) {
        MathDomNode.MathNode node = new MathDomNode.MathNode("mfrac",
            List.of(mathml.buildGroup(group.numer(), options), mathml.buildGroup(group.denom(), options)));
        if (!group.hasBarLine()) {
            node.setAttribute("linethickness", "0px");
        } else if (group.barSize() != null) {
            node.setAttribute("linethickness", Units.makeEm(Units.calculateSize(group.barSize(), options)));
        }

        final Style style = adjustStyle(group.size(), options.style());
        if (style.size() != options.style().size()) {
            node = new MathDomNode.MathNode("mstyle", List.of(node));
            node.setAttribute("displaystyle", style.size() == Style.DISPLAY.size() ? "true" : "false");
            node.setAttribute("scriptlevel", "0");
        }

        if (group.leftDelim() == null && group.rightDelim() == null) {
            return node;
        }
        final List<MathDomNode> withDelims = new ArrayList<>();
        if (group.leftDelim() != null) {
            withDelims.add(fence(group.leftDelim(), options));
        }
        withDelims.add(node);
        if (group.rightDelim() != null) {
            withDelims.add(fence(group.rightDelim(), options));
        }
        return MathMlBuilder.makeRow(withDelims);
    }

    private static MathDomNode fence(String delim, Options options) {
        final var op = new MathDomNode.MathNode("mo",
            List.of(MathMlBuilder.makeText(delim.replace("\\", ""), Mode.MATH, options)));
        op.setAttribute("fence", "true");
        return op;
    }
}
