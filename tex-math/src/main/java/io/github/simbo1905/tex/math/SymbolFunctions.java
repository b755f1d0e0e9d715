package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Builders for leaf symbols and plain groups: letters, digits, atoms of the
/// operator families, spaces, and `{...}` groups.
final class SymbolFunctions {

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final Pattern STARTS_WITH_DIGIT = Pattern.compile("^[0-9]");

    /// Default `mathvariant` of each token element; an explicit attribute is
    /// only written when the variant differs.
    private static final Map<String, String> DEFAULT_VARIANT = Map.of(
        "mi", "italic",
        "mn", "normal",
        "mtext", "normal"
    );

    /// Spaces drawn as a glyph, and the class each adds.
    private static final Map<String, String> REGULAR_SPACE = Map.of(
        " ", "",
        "\\ ", "",
        "~", "nobreak",
        "\\space", "",
        "\\nobreakspace", "nobreak"
    );

    /// Zero-width break controls.
    private static final Map<String, String> CSS_SPACE = Map.of(
        "\\nobreak", "nobreak",
        "\\allowbreak", "allowbreak"
    );

    private SymbolFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineBuilders(ParseNode.MathOrd.class,
            (group, options, html) -> BuildCommon.makeOrd(group.text(), group.mode(), options, true),
            (group, options, mathml) -> mathOrd(group, options));

        builder.defineBuilders(ParseNode.TextOrd.class,
            (group, options, html) -> BuildCommon.makeOrd(group.text(), group.mode(), options, false),
            (group, options, mathml) -> textOrd(group, options));

        builder.defineBuilders(ParseNode.Atom.class,
            (group, options, html) -> BuildCommon.mathsym(group.text(), group.mode(), options,
                List.of("m" + group.family())),
            (group, options, mathml) -> atom(group, options));

        // bare accent and operator glyphs that reached the output without their command
        builder.defineBuilders(ParseNode.AccentToken.class,
            (group, options, html) -> BuildCommon.mathsym(group.text(), group.mode(), options, List.of("mord")),
            (group, options, mathml) -> new MathDomNode.MathNode("mo",
                List.of(MathMlBuilder.makeText(group.text(), group.mode()))));
        builder.defineBuilders(ParseNode.OpToken.class,
            (group, options, html) -> BuildCommon.mathsym(group.text(), group.mode(), options, List.of("mop")),
            (group, options, mathml) -> new MathDomNode.MathNode("mo",
                List.of(MathMlBuilder.makeText(group.text(), group.mode()))));

        builder.defineBuilders(ParseNode.SpacingSymbol.class,
            SymbolFunctions::spacingHtml,
            (group, options, mathml) -> spacingMathMl(group));

        // \char expands to \@char{code}
        builder.defineFunction(FunctionSpec.builder("textord", "\\@char")
            .numArgs(1)
            .allowedInText(true)
            .handler((context, args, optArgs) -> new ParseNode.TextOrd(context.parser().mode(), context.loc(),
                charFromCode(args.get(0)))));

        builder.defineBuilders(ParseNode.OrdGroup.class,
            (group, options, html) -> group.semisimple()
                ? BuildCommon.makeFragment(html.buildExpression(group.body(), options, HtmlBuilder.Grouping.PARTIAL))
                : BuildCommon.makeSpan(List.of("mord"),
                    html.buildExpression(group.body(), options, HtmlBuilder.Grouping.REAL), options),
            (group, options, mathml) -> mathml.buildExpressionRow(group.body(), options, true));
    }

    private static String charFromCode(ParseNode arg) {
        final var number = new StringBuilder();
        for (final ParseNode node : ParseNode.ordArgument(arg)) {
            if (!(node instanceof ParseNode.TextOrd ord)) {
                throw new TexParseException("Expected node of type textord, but got node of type " + node.type(),
                    node);
            }
            number.append(ord.text());
        }
        if (!DIGITS.matcher(number).find()) {
            throw new TexParseException("\\@char has non-numeric argument " + number);
        }
        final int code;
        try {
            code = Integer.parseInt(number.toString());
        } catch (NumberFormatException e) {
            throw new TexParseException("\\@char with invalid code point " + number);
        }
        if (code >= 0x10ffff) {
            throw new TexParseException("\\@char with invalid code point " + number);
        }
        return new String(Character.toChars(code));
    }

    private static void setVariant(MathDomNode.MathNode node, String variant) {
        if (!variant.equals(DEFAULT_VARIANT.getOrDefault(node.type(), ""))) {
            node.setAttribute("mathvariant", variant);
        }
    }

    private static MathDomNode mathOrd(ParseNode.MathOrd group, Options options) {
        final String type = DIGITS.matcher(group.text()).matches() ? "mn" : "mi";
        final var node = new MathDomNode.MathNode(type,
            List.of(MathMlBuilder.makeText(group.text(), group.mode(), options)));
        final String variant = MathMlBuilder.variant(group, options);
        setVariant(node, variant != null ? variant : DEFAULT_VARIANT.get(type));
        return node;
    }

    private static MathDomNode textOrd(ParseNode.TextOrd group, Options options) {
        final MathDomNode.TextNode text = MathMlBuilder.makeText(group.text(), group.mode(), options);
        final String variant = MathMlBuilder.variant(group, options);
        final String type;
        if (group.mode() == Mode.TEXT) {
            type = "mtext";
        } else if (STARTS_WITH_DIGIT.matcher(group.text()).find()) {
            type = "mn";
        } else if ("\\prime".equals(group.text())) {
            type = "mo";
        } else {
            type = "mi";
        }
        final var node = new MathDomNode.MathNode(type, List.of(text));
        setVariant(node, variant != null ? variant : "normal");
        return node;
    }

    private static MathDomNode atom(ParseNode.Atom group, Options options) {
        final var node = new MathDomNode.MathNode("mo",
            List.of(MathMlBuilder.makeText(group.text(), group.mode())));
        switch (group.family()) {
            case "bin" -> {
                final String variant = MathMlBuilder.variant(group, options);
                if ("bold-italic".equals(variant)) {
                    node.setAttribute("mathvariant", variant);
                }
            }
            case "punct" -> node.setAttribute("separator", "true");
            case "open", "close" -> node.setAttribute("stretchy", "false");
            default -> { }
        }
        return node;
    }

    private static BoxNode spacingHtml(ParseNode.SpacingSymbol group, Options options, HtmlBuilder html) {
        final String className = REGULAR_SPACE.get(group.text());
        if (className != null) {
            if (group.mode() == Mode.TEXT) {
                final BoxNode ord = BuildCommon.makeOrd(group.text(), group.mode(), options, false);
                if (!className.isEmpty()) {
                    ord.addClass(className);
                }
                return ord;
            }
            return BuildCommon.makeSpan(List.of("mspace", className),
                List.of(BuildCommon.mathsym(group.text(), group.mode(), options, List.of())), options);
        }
        final String css = CSS_SPACE.get(group.text());
        if (css != null) {
            return BuildCommon.makeSpan(List.of("mspace", css), List.of(), options);
        }
        throw new TexParseException("Unknown type of space \"" + group.text() + "\"", group);
    }

    private static MathDomNode spacingMathMl(ParseNode.SpacingSymbol group) {
        if (REGULAR_SPACE.containsKey(group.text())) {
            return new MathDomNode.MathNode("mtext", List.of(new MathDomNode.TextNode("\u00a0")));
        }
        if (CSS_SPACE.containsKey(group.text())) {
            return new MathDomNode.MathNode("mspace");
        }
        throw new TexParseException("Unknown type of space \"" + group.text() + "\"", group);
    }
}
