package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Commands that reference outside resources (`\href`, `\\url` and
/// `\includegraphics`) or write raw markup attributes (`\htmlClass`,
/// `\htmlId`, `\htmlStyle` and `\htmlData`). Each one is gated by the
/// trust policy.
final class LinkFunctions {

    private static final Pattern BARE_NUMBER = Pattern.compile("^[-+]? *(\\d+(\\.\\d*)?|\\.\\d+)$");
    private static final Pattern SIZE = Pattern.compile("([-+]?) *(\\d+(?:\\.\\d*)?|\\.\\d+) *([a-z]{2})");
    private static final Pattern INVALID_ATTRIBUTE_NAME = Pattern.compile("[\\s\"'>/=\\x00-\\x1f]");

    private LinkFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("href", "\\href")
            .numArgs(2)
            .argTypes(ArgType.URL, ArgType.ORIGINAL)
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                final String href = ((ParseNode.Url) args.get(0)).url();
                context.parser().settings().checkTrusted("\\href", href, context.token());
                return new ParseNode.Href(context.mode(), context.loc(), href, ParseNode.ordArgument(args.get(1)));
            }));

        builder.defineFunction(FunctionSpec.builder("href", "\\url")
            .numArgs(1)
            .argTypes(ArgType.URL)
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                final String href = ((ParseNode.Url) args.get(0)).url();
                context.parser().settings().checkTrusted("\\url", href, context.token());
                final List<ParseNode> chars = new ArrayList<>();
                href.codePoints().forEach(cp -> {
                    final String c = cp == '~' ? "\\textasciitilde" : new String(Character.toChars(cp));
                    chars.add(new ParseNode.TextOrd(Mode.TEXT, null, c));
                });
                final var body = new ParseNode.Text(context.mode(), context.loc(), chars, "\\texttt");
                return new ParseNode.Href(context.mode(), context.loc(), href, List.of(body));
            }));

        builder.defineBuilders(ParseNode.Href.class,
            (group, options, html) -> BuildCommon.makeAnchor(group.href(), List.of(),
                html.buildExpression(group.body(), options, HtmlBuilder.Grouping.PARTIAL), options),
            (group, options, mathml) -> {
                final MathDomNode row = mathml.buildExpressionRow(group.body(), options);
                final MathDomNode.MathNode node = row instanceof MathDomNode.MathNode math
                    ? math : new MathDomNode.MathNode("mrow", List.of(row));
                node.setAttribute("href", group.href());
                return node;
            });

        builder.defineFunction(FunctionSpec.builder("html", "\\htmlClass", "\\htmlId", "\\htmlStyle", "\\htmlData")
            .numArgs(2)
            .argTypes(ArgType.RAW, ArgType.ORIGINAL)
            .allowedInText(true)
            .handler(LinkFunctions::htmlExtension));

        builder.defineBuilders(ParseNode.Html.class, (group, options, html) -> {
            final List<String> classes = new ArrayList<>();
            classes.add("enclosing");
            final String cls = group.attributes().get("class");
            if (cls != null) {
                for (final String name : cls.trim().split("\\s+")) {
                    if (!name.isEmpty()) {
                        classes.add(name);
                    }
                }
            }
            final BoxNode.Span span = BuildCommon.makeSpan(classes,
                html.buildExpression(group.body(), options, HtmlBuilder.Grouping.PARTIAL), options);
            group.attributes().forEach((name, value) -> {
                if ("style".equals(name)) {
                    addStyle(span, value);
                } else if (!"class".equals(name)) {
                    span.setAttribute(name, value);
                }
            });
            return span;
        }, (group, options, mathml) -> mathml.buildExpressionRow(group.body(), options));

        builder.defineFunction(FunctionSpec.builder("includegraphics", "\\includegraphics")
            .numArgs(1)
            .numOptionalArgs(1)
            .argTypes(ArgType.RAW, ArgType.URL)
            .allowedInText(false)
            .handler(LinkFunctions::includeGraphics));

        builder.defineBuilders(ParseNode.IncludeGraphics.class, (group, options, html) -> {
            final double height = Units.calculateSize(group.height(), options);
            double depth = 0;
            if (group.totalHeight().number() > 0) {
                depth = Units.calculateSize(group.totalHeight(), options) - height;
            }
            double width = 0;
            if (group.width().number() > 0) {
                width = Units.calculateSize(group.width(), options);
            }
            final var node = new BoxNode.Img(group.src(), group.alt());
            node.setStyle("height", Units.makeEm(height + depth));
            if (width > 0) {
                node.setStyle("width", Units.makeEm(width));
            }
            if (depth > 0) {
                node.setStyle("vertical-align", Units.makeEm(-depth));
            }
            node.height = height;
            node.depth = depth;
            return node;
        }, (group, options, mathml) -> {
            final var node = new MathDomNode.MathNode("mglyph");
            node.setAttribute("alt", group.alt());
            node.setAttribute("src", group.src());
            final double height = Units.calculateSize(group.height(), options);
            double depth = 0;
            if (group.totalHeight().number() > 0) {
                depth = Units.calculateSize(group.totalHeight(), options) - height;
                node.setAttribute("valign", Units.makeEm(-depth));
            }
            node.setAttribute("height", Units.makeEm(height + depth));
            if (group.width().number() > 0) {
                node.setAttribute("width", Units.makeEm(Units.calculateSize(group.width(), options)));
            }
            return node;
        });
    }

    private static ParseNode htmlExtension(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final Settings settings = context.parser().settings();
        settings.reportNonstrict("htmlExtension", "HTML extension is disabled on strict mode", context.token());
        final String value = ((ParseNode.Raw) args.get(0)).string();
        final Map<String, String> attributes = new LinkedHashMap<>();
        switch (context.funcName()) {
            case "\\htmlClass" -> attributes.put("class", value);
            case "\\htmlId" -> attributes.put("id", value);
            case "\\htmlStyle" -> attributes.put("style", value);
            case "\\htmlData" -> {
                for (final String pair : value.split(",")) {
                    final int eq = pair.indexOf('=');
                    if (eq < 0) {
                        throw new TexParseException("Error parsing key-value for \\htmlData", context.token());
                    }
                    final String key = pair.substring(0, eq).trim();
                    if (key.isEmpty() || INVALID_ATTRIBUTE_NAME.matcher(key).find()) {
                        throw new TexParseException("Invalid attribute name 'data-" + key + "'", context.token());
                    }
                    attributes.put("data-" + key, pair.substring(eq + 1).trim());
                }
            }
            default -> throw new IllegalStateException("Unrecognized html command " + context.funcName());
        }
        settings.checkTrusted(context.funcName(), attributes, context.token());
        return new ParseNode.Html(context.mode(), context.loc(), attributes, ParseNode.ordArgument(args.get(1)));
    }

    /// Adds `name: value` declarations to the span's inline style, after any
    /// the options already set. Text without a colon is ignored.
    private static void addStyle(BoxNode.Span span, String declarations) {
        for (final String declaration : declarations.split(";")) {
            final int colon = declaration.indexOf(':');
            if (colon > 0) {
                span.setStyle(declaration.substring(0, colon).trim(), declaration.substring(colon + 1).trim());
            }
        }
    }

    private static ParseNode includeGraphics(FunctionContext context, List<ParseNode> args,
                                             List<ParseNode> optArgs) {
        Measurement width = Measurement.em(0);
        // character sized by default
        Measurement height = Measurement.em(0.9);
        Measurement totalHeight = Measurement.em(0);
        String alt = "";

        if (optArgs.get(0) instanceof ParseNode.Raw raw) {
            for (final String attribute : raw.string().split(",")) {
                final int eq = attribute.indexOf('=');
                if (eq < 0) {
                    continue;
                }
                final String key = attribute.substring(0, eq).trim();
                final String value = attribute.substring(eq + 1).trim();
                switch (key) {
                    case "alt" -> alt = value;
                    case "width" -> width = sizeData(value);
                    case "height" -> height = sizeData(value);
                    case "totalheight" -> totalHeight = sizeData(value);
                    default -> throw new TexParseException("Invalid key: '" + key + "' in \\includegraphics.",
                        context.token());
                }
            }
        }

        final String src = ((ParseNode.Url) args.get(0)).url();
        if (alt.isEmpty()) {
            alt = src.replaceAll("^.*[\\\\/]", "");
            final int dot = alt.lastIndexOf('.');
            if (dot >= 0) {
                alt = alt.substring(0, dot);
            }
        }
        context.parser().settings().checkTrusted("\\includegraphics", src, context.token());
        return new ParseNode.IncludeGraphics(context.mode(), context.loc(), alt, width, height, totalHeight, src);
    }

    /// Reads an `\includegraphics` length; a bare number is in big points.
    static Measurement sizeData(String text) {
        if (BARE_NUMBER.matcher(text).matches()) {
            return new Measurement(Double.parseDouble(text.replace(" ", "")), "bp");
        }
        final Matcher match = SIZE.matcher(text);
        if (!match.find()) {
            throw new TexParseException("Invalid size: '" + text + "' in \\includegraphics");
        }
        final var measurement = new Measurement(Double.parseDouble(match.group(1) + match.group(2)),
            match.group(3));
        if (!Units.validUnit(measurement)) {
            throw new TexParseException("Invalid unit: '" + measurement.unit() + "' in \\includegraphics.");
        }
        return measurement;
    }
}
