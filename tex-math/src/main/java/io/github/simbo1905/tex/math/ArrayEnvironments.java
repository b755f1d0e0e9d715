package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Tabular environments: `array`, the matrix family, `cases`, the amsmath
/// alignments and `subarray`.
///
/// All of them read their body with [#parseArray], which splits cells on `&`
/// and rows on `\\` (or `\cr`), and produce a [ParseNode.Array]. Delimited
/// matrices and `cases` wrap that table in a [ParseNode.LeftRight].
final class ArrayEnvironments {

    private ArrayEnvironments() {}

    private static final Map<String, String> MATHML_ALIGN = Map.of("c", "center ", "l", "left ", "r", "right ");

    /// How a table body is read. Unset fields keep the plain `array` behaviour.
    static final class ArrayConfig {
        boolean hskipBeforeAndAfter;
        boolean addJot;
        List<ParseNode.AlignSpec> cols;
        Double arraystretch;
        String colSeparationType;
        /// null for environments that never number rows.
        Boolean autoTag;
        boolean singleRow;
        boolean emptySingleRow;
        Integer maxNumCols;
        boolean leqno;
    }

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("text", "\\hline", "\\hdashline")
            .allowedInText(true)
            .handler((context, args, optArgs) -> {
                throw new TexParseException(context.funcName() + " valid only within array environment",
                    context.token());
            }));

        builder.defineEnvironment(new EnvironmentSpec(List.of("array", "darray"), 1, 0, null, false,
            ArrayEnvironments::array));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::matrix, "matrix", "pmatrix", "bmatrix",
            "Bmatrix", "vmatrix", "Vmatrix", "matrix*", "pmatrix*", "bmatrix*", "Bmatrix*", "vmatrix*",
            "Vmatrix*"));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::smallmatrix, "smallmatrix"));
        builder.defineEnvironment(new EnvironmentSpec(List.of("subarray"), 1, 0, null, false,
            ArrayEnvironments::subarray));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::cases, "cases", "dcases", "rcases",
            "drcases"));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::aligned, "align", "align*", "aligned",
            "split"));
        builder.defineEnvironment(new EnvironmentSpec(List.of("alignat", "alignat*", "alignedat"), 1, 0, null,
            false, ArrayEnvironments::aligned));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::gathered, "gathered", "gather",
            "gather*"));
        builder.defineEnvironment(EnvironmentSpec.of(ArrayEnvironments::equation, "equation", "equation*"));

        builder.defineBuilders(ParseNode.Array.class, ArrayEnvironments::arrayHtml, ArrayEnvironments::arrayMathMl);
    }

    // ========== Parsing ==========

    /// Reads rows and cells up to `\end`. Each cell is parsed in its own
    /// macro group and wrapped in an [ParseNode.OrdGroup], then in a
    /// [ParseNode.Styling] when `style` is given.
    static ParseNode.Array parseArray(Parser parser, ArrayConfig config, Style style) {
        final MacroExpander gullet = parser.gullet();
        gullet.beginGroup();
        if (!config.singleRow) {
            // \cr is only a row break inside tables
            gullet.macros().set("\\cr", MacroDefinition.text("\\\\\\relax"));
        }

        double arraystretch;
        if (config.arraystretch != null) {
            arraystretch = config.arraystretch;
        } else {
            final String stretch = gullet.expandMacroAsText("\\arraystretch");
            if (stretch == null) {
                arraystretch = 1;
            } else {
                try {
                    arraystretch = Double.parseDouble(stretch.trim());
                } catch (NumberFormatException e) {
                    arraystretch = 0;
                }
                if (!(arraystretch > 0)) {
                    throw new TexParseException("Invalid \\arraystretch: " + stretch);
                }
            }
        }

        gullet.beginGroup();
        List<ParseNode> row = new ArrayList<>();
        final List<List<ParseNode>> body = new ArrayList<>();
        body.add(row);
        final List<Measurement> rowGaps = new ArrayList<>();
        final List<List<Boolean>> hLinesBeforeRow = new ArrayList<>();
        final List<ParseNode.RowTag> tags = config.autoTag != null ? new ArrayList<>() : null;

        beginRow(gullet, config);
        hLinesBeforeRow.add(readHLines(parser));

        while (true) {
            final List<ParseNode> cellBody = parser.parseExpression(false, config.singleRow ? "\\end" : "\\\\");
            gullet.endGroup();
            gullet.beginGroup();
            ParseNode cell = new ParseNode.OrdGroup(parser.mode(), null, cellBody);
            if (style != null) {
                cell = new ParseNode.Styling(parser.mode(), null, style, List.of(cell));
            }
            row.add(cell);

            final Token next = parser.fetch();
            if ("&".equals(next.text())) {
                if (config.maxNumCols != null && row.size() == config.maxNumCols) {
                    if (config.singleRow || config.colSeparationType != null) {
                        throw new TexParseException("Too many tab characters: &", next);
                    }
                    parser.settings().reportNonstrict("textEnv",
                        "Too few columns specified in the {array} column argument.", next);
                }
                parser.consume();
            } else if ("\\end".equals(next.text())) {
                endRow(parser, config, tags);
                if (row.size() == 1 && cellBody.isEmpty() && (body.size() > 1 || !config.emptySingleRow)) {
                    body.remove(body.size() - 1);
                    if (tags != null && tags.size() > body.size()) {
                        tags.remove(tags.size() - 1);
                    }
                }
                if (hLinesBeforeRow.size() < body.size() + 1) {
                    hLinesBeforeRow.add(List.of());
                }
                break;
            } else if ("\\\\".equals(next.text())) {
                parser.consume();
                ParseNode size = null;
                if (!" ".equals(gullet.future().text())) {
                    size = parser.parseSizeGroup(true);
                }
                rowGaps.add(size instanceof ParseNode.Size s ? s.value() : null);
                endRow(parser, config, tags);
                hLinesBeforeRow.add(readHLines(parser));
                row = new ArrayList<>();
                body.add(row);
                beginRow(gullet, config);
            } else {
                throw new TexParseException("Expected & or \\\\ or \\cr or \\end", next);
            }
        }

        gullet.endGroup();
        gullet.endGroup();
        StructuredLog.finer(LOG, "array", "rows", body.size(), "separation", config.colSeparationType);
        return new ParseNode.Array(parser.mode(), null, config.colSeparationType, config.hskipBeforeAndAfter,
            config.addJot, config.cols, arraystretch, body, rowGaps, hLinesBeforeRow, tags, config.leqno);
    }

    private static void beginRow(MacroExpander gullet, ArrayConfig config) {
        if (Boolean.TRUE.equals(config.autoTag)) {
            gullet.macros().set("\\@eqnsw", MacroDefinition.text("1"), true);
        }
    }

    /// Records the finished row's tag: an explicit `\tag`, an automatic number, or none.
    private static void endRow(Parser parser, ArrayConfig config, List<ParseNode.RowTag> tags) {
        if (tags == null) {
            return;
        }
        final var macros = parser.gullet().macros();
        if (macros.get("\\df@tag") != null) {
            tags.add(new ParseNode.RowTag(false, parser.subparse(List.of(new Token("\\df@tag")))));
            macros.set("\\df@tag", null, true);
        } else if (Boolean.TRUE.equals(config.autoTag)
            && MacroDefinition.text("1").equals(macros.get("\\@eqnsw"))) {
            tags.add(new ParseNode.RowTag(true, null));
        } else {
            tags.add(null);
        }
    }

    /// Reads `\hline` and `\hdashline` at the start of a row; true marks a dashed line.
    private static List<Boolean> readHLines(Parser parser) {
        final List<Boolean> hlineInfo = new ArrayList<>();
        parser.consumeSpaces();
        String next = parser.fetch().text();
        if ("\\relax".equals(next)) {
            parser.consume();
            parser.consumeSpaces();
            next = parser.fetch().text();
        }
        while ("\\hline".equals(next) || "\\hdashline".equals(next)) {
            parser.consume();
            hlineInfo.add("\\hdashline".equals(next));
            parser.consumeSpaces();
            next = parser.fetch().text();
        }
        return hlineInfo;
    }

    /// Environments whose names start with `d` set their cells in display style.
    private static Style cellStyle(String envName) {
        return envName.startsWith("d") ? Style.DISPLAY : Style.TEXT;
    }

    private static void requireDisplayMode(EnvironmentContext context) {
        if (!context.parser().settings().displayMode()) {
            throw new TexParseException("{" + context.envName() + "} can be used only in display mode.");
        }
    }

    /// Numbered unless starred; the `...ed` inner forms never number.
    private static Boolean autoTag(String envName) {
        if (!envName.contains("ed")) {
            return !envName.contains("*");
        }
        return null;
    }

    // ========== Environments ==========

    private static ParseNode array(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final List<ParseNode> colalign = args.get(0) instanceof ParseNode.SymbolNode
            ? List.of(args.get(0)) : ParseNode.ordArgument(args.get(0));
        final List<ParseNode.AlignSpec> cols = new ArrayList<>();
        for (final ParseNode node : colalign) {
            final String ca = ParseNode.symbolText(node);
            if ("lcr".contains(ca) && ca.length() == 1) {
                cols.add(new ParseNode.Align(ca, null, null));
            } else if ("|".equals(ca) || ":".equals(ca)) {
                cols.add(new ParseNode.Separator(ca));
            } else {
                throw new TexParseException("Unknown column alignment: " + ca, node);
            }
        }
        final var config = new ArrayConfig();
        config.cols = cols;
        config.hskipBeforeAndAfter = true;
        config.maxNumCols = cols.size();
        return parseArray(context.parser(), config, cellStyle(context.envName()));
    }

    private static ParseNode matrix(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final String envName = context.envName();
        final Parser parser = context.parser();
        final String[] delimiters = switch (envName.replace("*", "")) {
            case "pmatrix" -> new String[]{"(", ")"};
            case "bmatrix" -> new String[]{"[", "]"};
            case "Bmatrix" -> new String[]{"\\{", "\\}"};
            case "vmatrix" -> new String[]{"|", "|"};
            case "Vmatrix" -> new String[]{"\\Vert", "\\Vert"};
            default -> null;
        };
        String colAlign = "c";
        if (envName.endsWith("*")) {
            parser.consumeSpaces();
            if ("[".equals(parser.fetch().text())) {
                parser.consume();
                parser.consumeSpaces();
                final Token alignToken = parser.fetch();
                colAlign = alignToken.text();
                if (colAlign.length() != 1 || !"lcr".contains(colAlign)) {
                    throw new TexParseException("Expected l or c or r", alignToken);
                }
                parser.consume();
                parser.consumeSpaces();
                parser.expect("]");
            }
        }
        final var config = new ArrayConfig();
        config.cols = List.of(new ParseNode.Align(colAlign, null, null));
        final ParseNode.Array parsed = parseArray(parser, config, cellStyle(envName));
        final int numCols = parsed.body().stream().mapToInt(List::size).max().orElse(0);
        final ParseNode.Array res = withCols(parsed, Collections.nCopies(numCols,
            new ParseNode.Align(colAlign, null, null)), parsed.colSeparationType());
        if (delimiters == null) {
            return res;
        }
        return new ParseNode.LeftRight(context.mode(), null, List.of(res), delimiters[0], delimiters[1], null);
    }

    private static ParseNode smallmatrix(EnvironmentContext context, List<ParseNode> args,
                                         List<ParseNode> optArgs) {
        final var config = new ArrayConfig();
        config.arraystretch = 0.5;
        final ParseNode.Array res = parseArray(context.parser(), config, Style.SCRIPT);
        return withCols(res, res.cols(), "small");
    }

    private static ParseNode subarray(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final List<ParseNode> colalign = args.get(0) instanceof ParseNode.SymbolNode
            ? List.of(args.get(0)) : ParseNode.ordArgument(args.get(0));
        final List<ParseNode.AlignSpec> cols = new ArrayList<>();
        for (final ParseNode node : colalign) {
            final String ca = ParseNode.symbolText(node);
            if (ca.length() == 1 && "lc".contains(ca)) {
                cols.add(new ParseNode.Align(ca, null, null));
            } else {
                throw new TexParseException("Unknown column alignment: " + ca, node);
            }
        }
        if (cols.size() > 1) {
            throw new TexParseException("{subarray} can contain only one column");
        }
        final var config = new ArrayConfig();
        config.cols = cols;
        config.arraystretch = 0.5;
        final ParseNode.Array res = parseArray(context.parser(), config, Style.SCRIPT);
        if (!res.body().isEmpty() && res.body().get(0).size() > 1) {
            throw new TexParseException("{subarray} can contain only one column");
        }
        return res;
    }

    private static ParseNode cases(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final var config = new ArrayConfig();
        config.arraystretch = 1.2;
        config.cols = List.of(new ParseNode.Align("l", 0.0, 1.0), new ParseNode.Align("l", 0.0, 0.0));
        final ParseNode.Array res = parseArray(context.parser(), config, cellStyle(context.envName()));
        final boolean right = context.envName().contains("r");
        return new ParseNode.LeftRight(context.mode(), null, List.of(res), right ? "." : "\\{", right ? "\\}" : ".",
            null);
    }

    /// `align`, `aligned`, `split` and the `alignat` forms: cells alternate
    /// right- and left-aligned, and every left cell starts with an empty group
    /// so a leading relation keeps its spacing.
    private static ParseNode aligned(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final String envName = context.envName();
        if (!envName.contains("ed")) {
            requireDisplayMode(context);
        }
        final boolean isSplit = "split".equals(envName);
        final var config = new ArrayConfig();
        config.cols = List.of();
        config.addJot = true;
        config.autoTag = isSplit ? null : autoTag(envName);
        config.emptySingleRow = true;
        config.colSeparationType = envName.contains("at") ? "alignat" : "align";
        config.maxNumCols = isSplit ? 2 : null;
        config.leqno = context.parser().settings().leqno();
        final ParseNode.Array res = parseArray(context.parser(), config, Style.DISPLAY);

        int numMaths = 0;
        int numCols = 0;
        if (!args.isEmpty() && args.get(0) instanceof ParseNode.OrdGroup group) {
            final var arg0 = new StringBuilder();
            for (final ParseNode node : group.body()) {
                if (!(node instanceof ParseNode.TextOrd ord)) {
                    throw new TexParseException("Expected node of type textord, but got node of type "
                        + node.type(), node);
                }
                arg0.append(ord.text());
            }
            try {
                numMaths = Integer.parseInt(arg0.toString());
            } catch (NumberFormatException e) {
                throw new TexParseException("Invalid number of columns: " + arg0, group);
            }
            numCols = numMaths * 2;
        }
        final boolean isAligned = numCols == 0;

        final var emptyGroup = new ParseNode.OrdGroup(context.mode(), null, List.of());
        final List<List<ParseNode>> body = new ArrayList<>();
        for (final List<ParseNode> row : res.body()) {
            final List<ParseNode> newRow = new ArrayList<>(row);
            for (int i = 1; i < newRow.size(); i += 2) {
                final var styling = (ParseNode.Styling) newRow.get(i);
                final var ordgroup = (ParseNode.OrdGroup) styling.body().get(0);
                final List<ParseNode> cellBody = new ArrayList<>();
                cellBody.add(emptyGroup);
                cellBody.addAll(ordgroup.body());
                newRow.set(i, new ParseNode.Styling(styling.mode(), styling.loc(), styling.style(),
                    List.of(new ParseNode.OrdGroup(ordgroup.mode(), ordgroup.loc(), cellBody))));
            }
            if (!isAligned) {
                final double curMaths = newRow.size() / 2.0;
                if (numMaths < curMaths) {
                    throw new TexParseException("Too many math in a row: expected " + numMaths + ", but got "
                        + formatCount(curMaths), newRow.get(0));
                }
            } else if (numCols < newRow.size()) {
                numCols = newRow.size();
            }
            body.add(newRow);
        }

        final List<ParseNode.AlignSpec> cols = new ArrayList<>();
        for (int i = 0; i < numCols; ++i) {
            String align = "r";
            double pregap = 0;
            if (i % 2 == 1) {
                align = "l";
            } else if (i > 0 && isAligned) {
                pregap = 1;
            }
            cols.add(new ParseNode.Align(align, pregap, 0.0));
        }
        return new ParseNode.Array(res.mode(), res.loc(), isAligned ? "align" : "alignat",
            res.hskipBeforeAndAfter(), res.addJot(), cols, res.arraystretch(), body, res.rowGaps(),
            res.hLinesBeforeRow(), res.tags(), res.leqno());
    }

    private static String formatCount(double count) {
        return count == Math.rint(count) ? Integer.toString((int) count) : Double.toString(count);
    }

    private static ParseNode gathered(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        if ("gather".equals(context.envName()) || "gather*".equals(context.envName())) {
            requireDisplayMode(context);
        }
        final var config = new ArrayConfig();
        config.cols = List.of(new ParseNode.Align("c", null, null));
        config.addJot = true;
        config.colSeparationType = "gather";
        config.autoTag = autoTag(context.envName());
        config.emptySingleRow = true;
        config.leqno = context.parser().settings().leqno();
        return parseArray(context.parser(), config, Style.DISPLAY);
    }

    private static ParseNode equation(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        requireDisplayMode(context);
        final var config = new ArrayConfig();
        config.autoTag = autoTag(context.envName());
        config.emptySingleRow = true;
        config.singleRow = true;
        config.maxNumCols = 1;
        config.leqno = context.parser().settings().leqno();
        return parseArray(context.parser(), config, Style.DISPLAY);
    }

    private static ParseNode.Array withCols(ParseNode.Array array, List<ParseNode.AlignSpec> cols,
                                            String colSeparationType) {
        return new ParseNode.Array(array.mode(), array.loc(), colSeparationType, array.hskipBeforeAndAfter(),
            array.addJot(), cols, array.arraystretch(), array.body(), array.rowGaps(), array.hLinesBeforeRow(),
            array.tags(), array.leqno());
    }

    // ========== Box tree ==========

    private record BuiltRow(List<BoxNode> cells, double height, double depth, double pos) {
    }

    private record HLine(double pos, boolean dashed) {
    }

    static BoxNode arrayHtml(ParseNode.Array group, Options options, HtmlBuilder html) {
        final int nr = group.body().size();
        final List<List<Boolean>> hLinesBeforeRow = group.hLinesBeforeRow();
        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
        final double ruleThickness = Math.max(metrics.arrayRuleWidth(), options.minRuleThickness());
        final double pt = 1 / metrics.ptPerEm();

        double arraycolsep = 5 * pt;
        if ("small".equals(group.colSeparationType())) {
            final double localMultiplier = options.havingStyle(Style.SCRIPT).sizeMultiplier();
            arraycolsep = 0.2778 * (localMultiplier / options.sizeMultiplier());
        }
        final double baselineskip = "CD".equals(group.colSeparationType())
            ? Units.calculateSize(new Measurement(3, "ex"), options)
            : 12 * pt;
        final double jot = 3 * pt;
        final double arrayskip = group.arraystretch() * baselineskip;
        final double arstrutHeight = 0.7 * arrayskip;
        final double arstrutDepth = 0.3 * arrayskip;

        final List<HLine> hlines = new ArrayList<>();
        double totalHeight = 0;
        totalHeight = placeHLines(hLinesBeforeRow.get(0), totalHeight, hlines);

        int nc = 0;
        final List<BuiltRow> rows = new ArrayList<>();
        for (int r = 0; r < nr; ++r) {
            final List<ParseNode> inrow = group.body().get(r);
            double height = arstrutHeight;
            double depth = arstrutDepth;
            nc = Math.max(nc, inrow.size());
            final List<BoxNode> outrow = new ArrayList<>();
            for (final ParseNode cell : inrow) {
                final BoxNode elt = html.buildGroup(cell, options);
                depth = Math.max(depth, elt.depth);
                height = Math.max(height, elt.height);
                outrow.add(elt);
            }
            final Measurement rowGap = r < group.rowGaps().size() ? group.rowGaps().get(r) : null;
            double gap = 0;
            if (rowGap != null) {
                gap = Units.calculateSize(rowGap, options);
                if (gap > 0) {
                    gap += arstrutDepth;
                    depth = Math.max(depth, gap);
                    gap = 0;
                }
            }
            if (group.addJot()) {
                depth += jot;
            }
            totalHeight += height;
            rows.add(new BuiltRow(outrow, height, depth, totalHeight));
            totalHeight += depth + gap;
            totalHeight = placeHLines(r + 1 < hLinesBeforeRow.size() ? hLinesBeforeRow.get(r + 1) : List.of(),
                totalHeight, hlines);
        }

        final double offset = totalHeight / 2 + metrics.axisHeight();
        final List<ParseNode.AlignSpec> colDescriptions = group.cols() == null ? List.of() : group.cols();
        final List<BoxNode> cols = new ArrayList<>();

        final List<VList.Elem> tagSpans = new ArrayList<>();
        if (group.tags() != null && group.tags().stream().anyMatch(t -> t != null)) {
            for (int r = 0; r < nr; ++r) {
                final BuiltRow rw = rows.get(r);
                final ParseNode.RowTag tag = r < group.tags().size() ? group.tags().get(r) : null;
                final BoxNode.Span tagSpan;
                if (tag == null) {
                    tagSpan = BuildCommon.makeSpan(List.of(), List.of(), options);
                } else if (tag.numbered()) {
                    tagSpan = BuildCommon.makeSpan(List.of("eqn-num"), List.of(), options);
                } else {
                    tagSpan = BuildCommon.makeSpan(List.of(),
                        html.buildExpression(tag.body(), options, HtmlBuilder.Grouping.REAL), options);
                }
                tagSpan.depth = rw.depth();
                tagSpan.height = rw.height();
                tagSpans.add(new VList.Elem(tagSpan, rw.pos() - offset));
            }
        }

        for (int c = 0, colDescrNum = 0; c < nc || colDescrNum < colDescriptions.size(); ++c, ++colDescrNum) {
            ParseNode.AlignSpec colDescr = colDescrNum < colDescriptions.size()
                ? colDescriptions.get(colDescrNum) : null;
            boolean firstSeparator = true;
            while (colDescr instanceof ParseNode.Separator separator) {
                if (!firstSeparator) {
                    final BoxNode.Span colSep = BuildCommon.makeSpan("arraycolsep");
                    colSep.setStyle("width", Units.makeEm(metrics.doubleRuleSep()));
                    cols.add(colSep);
                }
                final String lineType = switch (separator.separator()) {
                    case "|" -> "solid";
                    case ":" -> "dashed";
                    default -> throw new TexParseException("Invalid separator type: " + separator.separator());
                };
                final BoxNode.Span rule = BuildCommon.makeSpan(List.of("vertical-separator"), List.of(), options);
                rule.setStyle("height", Units.makeEm(totalHeight));
                rule.setStyle("border-right-width", Units.makeEm(ruleThickness));
                rule.setStyle("border-right-style", lineType);
                rule.setStyle("margin", "0 " + Units.makeEm(-ruleThickness / 2));
                final double shift = totalHeight - offset;
                if (shift != 0) {
                    rule.setStyle("vertical-align", Units.makeEm(-shift));
                }
                cols.add(rule);
                colDescrNum++;
                colDescr = colDescrNum < colDescriptions.size() ? colDescriptions.get(colDescrNum) : null;
                firstSeparator = false;
            }
            if (c >= nc) {
                continue;
            }
            final ParseNode.Align align = colDescr instanceof ParseNode.Align a ? a : null;

            if (c > 0 || group.hskipBeforeAndAfter()) {
                final double sepwidth = align != null && align.pregap() != null ? align.pregap() : arraycolsep;
                if (sepwidth != 0) {
                    final BoxNode.Span colSep = BuildCommon.makeSpan("arraycolsep");
                    colSep.setStyle("width", Units.makeEm(sepwidth));
                    cols.add(colSep);
                }
            }

            final List<VList.Elem> col = new ArrayList<>();
            for (final BuiltRow row : rows) {
                if (c >= row.cells().size()) {
                    continue;
                }
                final BoxNode elem = row.cells().get(c);
                elem.depth = row.depth();
                elem.height = row.height();
                col.add(new VList.Elem(elem, row.pos() - offset));
            }
            if (!col.isEmpty()) {
                final BoxNode.Span vlist = VList.individualShift(col).build();
                cols.add(BuildCommon.makeSpan(List.of("col-align-" + (align != null ? align.align() : "c")),
                    List.of(vlist)));
            }

            if (c < nc - 1 || group.hskipBeforeAndAfter()) {
                final double sepwidth = align != null && align.postgap() != null ? align.postgap() : arraycolsep;
                if (sepwidth != 0) {
                    final BoxNode.Span colSep = BuildCommon.makeSpan("arraycolsep");
                    colSep.setStyle("width", Units.makeEm(sepwidth));
                    cols.add(colSep);
                }
            }
        }

        BoxNode body = BuildCommon.makeSpan(List.of("mtable"), cols);
        if (!hlines.isEmpty()) {
            final BoxNode.Span line = BuildCommon.makeLineSpan("hline", options, ruleThickness);
            final BoxNode.Span dashes = BuildCommon.makeLineSpan("hdashline", options, ruleThickness);
            final List<VList.Elem> vListElems = new ArrayList<>();
            vListElems.add(new VList.Elem(body, 0));
            for (int i = hlines.size() - 1; i >= 0; i--) {
                final HLine hline = hlines.get(i);
                vListElems.add(new VList.Elem(hline.dashed() ? dashes : line, hline.pos() - offset));
            }
            body = VList.individualShift(vListElems).build();
        }

        if (tagSpans.isEmpty()) {
            return BuildCommon.makeSpan(List.of("mord"), List.of(body), options);
        }
        final BoxNode.Span eqnNumCol = BuildCommon.makeSpan(List.of("tag"),
            List.of(VList.individualShift(tagSpans).build()), options);
        return BuildCommon.makeFragment(List.of(body, eqnNumCol));
    }

    /// Records the lines drawn in one inter-row gap; consecutive lines sit 0.25em apart.
    private static double placeHLines(List<Boolean> hlinesInGap, double totalHeight, List<HLine> hlines) {
        double pos = totalHeight;
        for (int i = 0; i < hlinesInGap.size(); ++i) {
            if (i > 0) {
                pos += 0.25;
            }
            hlines.add(new HLine(pos, hlinesInGap.get(i)));
        }
        return pos;
    }

    // ========== MathML ==========

    static MathDomNode arrayMathMl(ParseNode.Array group, Options options, MathMlBuilder mathml) {
        final List<MathDomNode> tbl = new ArrayList<>();
        for (int i = 0; i < group.body().size(); i++) {
            final List<MathDomNode> row = new ArrayList<>();
            for (final ParseNode cell : group.body().get(i)) {
                row.add(new MathDomNode.MathNode("mtd", List.of(mathml.buildGroup(cell, options))));
            }
            if (group.tags() != null && i < group.tags().size() && group.tags().get(i) != null) {
                final var glue = new MathDomNode.MathNode("mtd");
                glue.classes().add("mtr-glue");
                final var tag = new MathDomNode.MathNode("mtd");
                tag.classes().add("mml-eqn-num");
                row.add(0, glue);
                row.add(glue);
                if (group.leqno()) {
                    row.add(0, tag);
                } else {
                    row.add(tag);
                }
            }
            tbl.add(new MathDomNode.MathNode("mtr", row));
        }

        MathDomNode.MathNode table = new MathDomNode.MathNode("mtable", tbl);
        final double gap = group.arraystretch() == 0.5
            ? 0.1
            : 0.16 + group.arraystretch() - 1 + (group.addJot() ? 0.09 : 0);
        table.setAttribute("rowspacing", Units.makeEm(gap));

        final var menclose = new StringBuilder();
        if (group.cols() != null && !group.cols().isEmpty()) {
            final List<ParseNode.AlignSpec> cols = group.cols();
            final var columnLines = new StringBuilder();
            final var align = new StringBuilder();
            boolean prevTypeWasAlign = false;
            int iStart = 0;
            int iEnd = cols.size();
            if (cols.get(0) instanceof ParseNode.Separator) {
                menclose.append("top ");
                iStart = 1;
            }
            if (cols.get(cols.size() - 1) instanceof ParseNode.Separator) {
                menclose.append("bottom ");
                iEnd -= 1;
            }
            for (int i = iStart; i < iEnd; i++) {
                if (cols.get(i) instanceof ParseNode.Align a) {
                    align.append(MATHML_ALIGN.get(a.align()));
                    if (prevTypeWasAlign) {
                        columnLines.append("none ");
                    }
                    prevTypeWasAlign = true;
                } else if (cols.get(i) instanceof ParseNode.Separator s && prevTypeWasAlign) {
                    columnLines.append("|".equals(s.separator()) ? "solid " : "dashed ");
                    prevTypeWasAlign = false;
                }
            }
            table.setAttribute("columnalign", align.toString().trim());
            if (columnLines.indexOf("s") >= 0 || columnLines.indexOf("d") >= 0) {
                table.setAttribute("columnlines", columnLines.toString().trim());
            }
        }

        final String separation = group.colSeparationType();
        if ("align".equals(separation)) {
            final int numCols = group.cols() == null ? 0 : group.cols().size();
            final var spacing = new StringBuilder();
            for (int i = 1; i < numCols; i++) {
                spacing.append(i % 2 == 1 ? "0em " : "1em ");
            }
            table.setAttribute("columnspacing", spacing.toString().trim());
        } else if ("alignat".equals(separation) || "gather".equals(separation)) {
            table.setAttribute("columnspacing", "0em");
        } else if ("small".equals(separation)) {
            table.setAttribute("columnspacing", "0.2778em");
        } else if ("CD".equals(separation)) {
            table.setAttribute("columnspacing", "0.5em");
        } else {
            table.setAttribute("columnspacing", "1em");
        }

        final List<List<Boolean>> hlines = group.hLinesBeforeRow();
        if (!hlines.get(0).isEmpty()) {
            menclose.append("left ");
        }
        if (!hlines.get(hlines.size() - 1).isEmpty()) {
            menclose.append("right ");
        }
        final var rowLines = new StringBuilder();
        for (int i = 1; i < hlines.size() - 1; i++) {
            if (hlines.get(i).isEmpty()) {
                rowLines.append("none ");
            } else {
                rowLines.append(hlines.get(i).get(0) ? "dashed " : "solid ");
            }
        }
        if (rowLines.indexOf("s") >= 0 || rowLines.indexOf("d") >= 0) {
            table.setAttribute("rowlines", rowLines.toString().trim());
        }

        if (menclose.length() > 0) {
            table = new MathDomNode.MathNode("menclose", List.of(table));
            table.setAttribute("notation", menclose.toString().trim());
        }
        if (group.arraystretch() < 1) {
            table = new MathDomNode.MathNode("mstyle", List.of(table));
            table.setAttribute("scriptlevel", "1");
        }
        return table;
    }
}
