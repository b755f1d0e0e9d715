package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// The `CD` environment for commutative diagrams.
///
/// Rows are read as plain expressions and then split on `@`: each `@` starts
/// an arrow named by the character after it (`> < V A = | .`). The labelled
/// arrows `@>a>b>` read two labels, each ended by a repeat of the arrow
/// character. The result is an ordinary [ParseNode.Array] with CD spacing.
final class CdEnvironment {

    private CdEnvironment() {}

    private static final String ARROW_CHARS = "<>AV=|.";

    static void register(Registry.Builder builder) {
        builder.defineEnvironment(EnvironmentSpec.of(CdEnvironment::cd, "CD"));

        builder.defineFunction(FunctionSpec.builder("cdlabel", "\\\\cdleft", "\\\\cdright")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.CdLabel(context.mode(), context.loc(),
                context.funcName().substring(4), args.get(0))));
        builder.defineBuilders(ParseNode.CdLabel.class, CdEnvironment::labelHtml, CdEnvironment::labelMathMl);

        builder.defineFunction(FunctionSpec.builder("cdlabelparent", "\\\\cdparent")
            .numArgs(1)
            .handler((context, args, optArgs) -> new ParseNode.CdLabelParent(context.mode(), context.loc(),
                args.get(0))));
        builder.defineBuilders(ParseNode.CdLabelParent.class, (group, options, html) -> {
            final BoxNode parent = BuildCommon.wrapFragment(html.buildGroup(group.fragment(), options), options);
            parent.addClass("cd-vert-arrow");
            return parent;
        }, (group, options, mathml) -> new MathDomNode.MathNode("mrow",
            List.of(mathml.buildGroup(group.fragment(), options))));
    }

    private static ParseNode cd(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        if (!context.parser().settings().displayMode()) {
            throw new TexParseException("{" + context.envName() + "} can be used only in display mode.");
        }
        return parseCd(context.parser());
    }

    static ParseNode.Array parseCd(Parser parser) {
        final MacroExpander gullet = parser.gullet();
        final List<List<ParseNode>> parsedRows = new ArrayList<>();
        gullet.beginGroup();
        gullet.macros().set("\\cr", MacroDefinition.text("\\\\\\relax"));
        gullet.beginGroup();
        while (true) {
            parsedRows.add(parser.parseExpression(false, "\\\\"));
            gullet.endGroup();
            gullet.beginGroup();
            final Token next = parser.fetch();
            if ("&".equals(next.text()) || "\\\\".equals(next.text())) {
                parser.consume();
            } else if ("\\end".equals(next.text())) {
                if (parsedRows.get(parsedRows.size() - 1).isEmpty()) {
                    parsedRows.remove(parsedRows.size() - 1);
                }
                break;
            } else {
                throw new TexParseException("Expected \\\\ or \\cr or \\end", next);
            }
        }

        List<ParseNode> row = new ArrayList<>();
        final List<List<ParseNode>> body = new ArrayList<>();
        body.add(row);
        for (int i = 0; i < parsedRows.size(); i++) {
            final List<ParseNode> rowNodes = parsedRows.get(i);
            List<ParseNode> cell = new ArrayList<>();
            for (int j = 0; j < rowNodes.size(); j++) {
                if (!isStartOfArrow(rowNodes.get(j))) {
                    cell.add(rowNodes.get(j));
                    continue;
                }
                row.add(displayCell(cell));
                j += 1;
                if (j >= rowNodes.size()) {
                    throw new TexParseException("Expected one of \"" + ARROW_CHARS + "\" after @", rowNodes.get(j - 1));
                }
                final String arrowChar = arrowText(rowNodes.get(j));
                final List<List<ParseNode>> labels = List.of(new ArrayList<>(), new ArrayList<>());
                if ("=|.".contains(arrowChar)) {
                    // no labels
                } else if ("<>AV".contains(arrowChar)) {
                    for (int labelNum = 0; labelNum < 2; labelNum++) {
                        boolean inLabel = true;
                        for (int k = j + 1; k < rowNodes.size(); k++) {
                            if (isLabelEnd(rowNodes.get(k), arrowChar)) {
                                inLabel = false;
                                j = k;
                                break;
                            }
                            if (isStartOfArrow(rowNodes.get(k))) {
                                throw new TexParseException("Missing a " + arrowChar
                                    + " character to complete a CD arrow.", rowNodes.get(k));
                            }
                            labels.get(labelNum).add(rowNodes.get(k));
                        }
                        if (inLabel) {
                            throw new TexParseException("Missing a " + arrowChar
                                + " character to complete a CD arrow.", rowNodes.get(j));
                        }
                    }
                } else {
                    throw new TexParseException("Expected one of \"" + ARROW_CHARS + "\" after @", rowNodes.get(j));
                }
                final ParseNode arrow = cdArrow(arrowChar, labels, parser);
                row.add(new ParseNode.Styling(Mode.MATH, null, Style.DISPLAY, List.of(arrow)));
                cell = new ArrayList<>();
            }
            if (i % 2 == 0) {
                row.add(displayCell(cell));
            } else if (!row.isEmpty()) {
                // arrow rows start with an empty cell before the first arrow
                row.remove(0);
            }
            row = new ArrayList<>();
            body.add(row);
        }

        gullet.endGroup();
        gullet.endGroup();

        final List<ParseNode.AlignSpec> cols = Collections.nCopies(body.get(0).size(),
            new ParseNode.Align("c", 0.25, 0.25));
        final List<List<Boolean>> hLinesBeforeRow = Collections.nCopies(body.size() + 1, List.of());
        StructuredLog.finer(LOG, "cd", "rows", body.size(), "cols", cols.size());
        return new ParseNode.Array(Mode.MATH, null, "CD", false, true, cols, 1, body,
            Collections.singletonList(null), hLinesBeforeRow, null, false);
    }

    private static ParseNode displayCell(List<ParseNode> body) {
        return new ParseNode.Styling(Mode.MATH, null, Style.DISPLAY, body);
    }

    private static boolean isStartOfArrow(ParseNode node) {
        return node instanceof ParseNode.TextOrd ord && "@".equals(ord.text());
    }

    private static boolean isLabelEnd(ParseNode node, String endChar) {
        return (node instanceof ParseNode.MathOrd || node instanceof ParseNode.Atom)
            && endChar.equals(((ParseNode.SymbolNode) node).text());
    }

    private static String arrowText(ParseNode node) {
        if (node instanceof ParseNode.SymbolNode symbol) {
            return symbol.text();
        }
        throw new TexParseException("Expected one of \"" + ARROW_CHARS + "\" after @", node);
    }

    /// Builds one arrow through the registered functions so that it lays out
    /// like the equivalent explicit command.
    private static ParseNode cdArrow(String arrowChar, List<List<ParseNode>> labels, Parser parser) {
        final ParseNode label0 = new ParseNode.OrdGroup(Mode.MATH, null, labels.get(0));
        final ParseNode label1 = new ParseNode.OrdGroup(Mode.MATH, null, labels.get(1));
        switch (arrowChar) {
            case ">":
                return parser.callFunction("\\\\cdrightarrow", List.of(label0), List.of(label1), null, null);
            case "<":
                return parser.callFunction("\\\\cdleftarrow", List.of(label0), List.of(label1), null, null);
            case "V":
            case "A": {
                final String name = "V".equals(arrowChar) ? "\\downarrow" : "\\uparrow";
                final ParseNode leftLabel = parser.callFunction("\\\\cdleft", List.of(label0), List.of(), null,
                    null);
                final ParseNode bareArrow = new ParseNode.Atom(Mode.MATH, null, "rel", name);
                final ParseNode sizedArrow = parser.callFunction("\\Big", List.of(bareArrow), List.of(), null, null);
                final ParseNode rightLabel = parser.callFunction("\\\\cdright", List.of(label1), List.of(), null,
                    null);
                final ParseNode arrowGroup = new ParseNode.OrdGroup(Mode.MATH, null,
                    List.of(leftLabel, sizedArrow, rightLabel));
                return parser.callFunction("\\\\cdparent", List.of(arrowGroup), List.of(), null, null);
            }
            case "=":
                return parser.callFunction("\\\\cdlongequal", Arrays.asList((ParseNode) null),
                    Arrays.asList((ParseNode) null), null, null);
            case "|": {
                final ParseNode arrow = new ParseNode.TextOrd(Mode.MATH, null, "\\Vert");
                return parser.callFunction("\\Big", List.of(arrow), List.of(), null, null);
            }
            default:
                return new ParseNode.TextOrd(Mode.MATH, null, " ");
        }
    }

    // ========== Labels ==========

    private static BoxNode labelHtml(ParseNode.CdLabel group, Options options, HtmlBuilder html) {
        final Options newOptions = options.havingStyle(options.style().sup());
        final BoxNode label = BuildCommon.wrapFragment(html.buildGroup(group.label(), newOptions, options), options);
        label.addClass("cd-label-" + group.side());
        label.setStyle("bottom", Units.makeEm(0.8 - label.depth));
        // labels must not change the height of the arrow row
        label.height = 0;
        label.depth = 0;
        return label;
    }

    private static MathDomNode labelMathMl(ParseNode.CdLabel group, Options options, MathMlBuilder mathml) {
        final var row = new MathDomNode.MathNode("mrow", List.of(mathml.buildGroup(group.label(), options)));
        final var padded = new MathDomNode.MathNode("mpadded", List.of(row));
        padded.setAttribute("width", "0");
        if ("left".equals(group.side())) {
            padded.setAttribute("lspace", "-1width");
        }
        padded.setAttribute("voffset", "0.7em");
        final var style = new MathDomNode.MathNode("mstyle", List.of(padded));
        style.setAttribute("displaystyle", "false");
        style.setAttribute("scriptlevel", "1");
        return style;
    }
}
