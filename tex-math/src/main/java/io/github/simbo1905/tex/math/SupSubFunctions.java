package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.List;

/// Layout of superscripts and subscripts, following TeX's rule 18.
///
/// Operators with limits, accents over a single character and horizontal
/// braces place their own scripts; the builders here hand those cases over.
final class SupSubFunctions {

    private SupSubFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineBuilders(ParseNode.SupSub.class, SupSubFunctions::html, SupSubFunctions::mathml);
    }

    private static boolean isDisplay(Options options) {
        return options.style().size() == Style.DISPLAY.size();
    }

    private static BoxNode html(ParseNode.SupSub group, Options options, HtmlBuilder html) {
        final ParseNode baseNode = group.base();
        if (baseNode instanceof ParseNode.Op op && op.limits()
            && (isDisplay(options) || op.alwaysHandleSupSub())) {
            return OpFunctions.opHtml(op, group.sup(), group.sub(), true, options, html);
        }
        if (baseNode instanceof ParseNode.OperatorName name && name.alwaysHandleSupSub()
            && (isDisplay(options) || name.limits())) {
            return OpFunctions.operatorNameHtml(name, group.sup(), group.sub(), true, options, html);
        }
        if (baseNode instanceof ParseNode.Accent accent && ParseNode.isCharacterBox(accent.base())) {
            return AccentFunctions.accentHtml(accent, group, options, html);
        }
        if (baseNode instanceof ParseNode.HorizBrace brace && (group.sub() == null) == brace.isOver()) {
            return AccentFunctions.horizBraceHtml(brace, group, options, html);
        }

        final BoxNode base = html.buildGroup(baseNode, options);
        final FontMetrics.GlobalMetrics metrics = options.fontMetrics();
        final boolean characterBase = baseNode != null && ParseNode.isCharacterBox(baseNode);

        BoxNode supm = null;
        BoxNode subm = null;
        double supShift = 0;
        double subShift = 0;
        if (group.sup() != null) {
            final Options newOptions = options.havingStyle(options.style().sup());
            supm = html.buildGroup(group.sup(), newOptions, options);
            if (!characterBase) {
                supShift = base.height - newOptions.fontMetrics().supDrop()
                    * newOptions.sizeMultiplier() / options.sizeMultiplier();
            }
        }
        if (group.sub() != null) {
            final Options newOptions = options.havingStyle(options.style().sub());
            subm = html.buildGroup(group.sub(), newOptions, options);
            if (!characterBase) {
                subShift = base.depth + newOptions.fontMetrics().subDrop()
                    * newOptions.sizeMultiplier() / options.sizeMultiplier();
            }
        }

        final double minSupShift;
        if (options.style() == Style.DISPLAY) {
            minSupShift = metrics.sup1();
        } else if (options.style().cramped()) {
            minSupShift = metrics.sup3();
        } else {
            minSupShift = metrics.sup2();
        }

        // \scriptspace is 0.5pt at every size
        final String marginRight = Units.makeEm(0.5 / metrics.ptPerEm() / options.sizeMultiplier());
        String marginLeft = null;
        if (subm != null) {
            if (base instanceof BoxNode.Symbol symbol) {
                marginLeft = Units.makeEm(-symbol.italic());
            } else if (baseNode instanceof ParseNode.Op op && OpFunctions.isOiint(op.name())) {
                marginLeft = Units.makeEm(-OpFunctions.symbolSlant(op, options));
            }
        }

        final VList vlist;
        if (supm != null && subm != null) {
            supShift = Math.max(Math.max(supShift, minSupShift), supm.depth + 0.25 * metrics.xHeight());
            subShift = Math.max(subShift, metrics.sub2());
            final double ruleWidth = metrics.defaultRuleThickness();
            // rule 18e
            final double maxWidth = 4 * ruleWidth;
            if ((supShift - supm.depth) - (subm.height - subShift) < maxWidth) {
                subShift = maxWidth - (supShift - supm.depth) + subm.height;
                final double psi = 0.8 * metrics.xHeight() - (supShift - supm.depth);
                if (psi > 0) {
                    supShift += psi;
                    subShift -= psi;
                }
            }
            vlist = VList.individualShift(List.of(
                new VList.Elem(subm, subShift).withMarginRight(marginRight).withMarginLeft(marginLeft),
                new VList.Elem(supm, -supShift).withMarginRight(marginRight)));
        } else if (subm != null) {
            // rule 18b
            subShift = Math.max(Math.max(subShift, metrics.sub1()), subm.height - 0.8 * metrics.xHeight());
            vlist = VList.shift(subShift, List.of(
                new VList.Elem(subm).withMarginLeft(marginLeft).withMarginRight(marginRight)));
        } else if (supm != null) {
            // rules 18c and 18d
            supShift = Math.max(Math.max(supShift, minSupShift), supm.depth + 0.25 * metrics.xHeight());
            vlist = VList.shift(-supShift, List.of(new VList.Elem(supm).withMarginRight(marginRight)));
        } else {
            throw new IllegalStateException("supsub must have either sup or sub.");
        }

        final String mclass = HtmlBuilder.typeOfDomTree(base, "right");
        return BuildCommon.makeSpan(List.of(mclass == null ? "mord" : mclass),
            List.of(base, BuildCommon.makeSpan(List.of("msupsub"), List.of(vlist.build()))), options);
    }

    private static boolean opLimits(ParseNode base, Options options, boolean bothScripts) {
        if (base instanceof ParseNode.Op op) {
            return op.limits() && (options.style() == Style.DISPLAY || (!bothScripts && op.alwaysHandleSupSub()));
        }
        if (base instanceof ParseNode.OperatorName name) {
            return name.alwaysHandleSupSub() && (name.limits() || options.style() == Style.DISPLAY);
        }
        return false;
    }

    private static MathDomNode mathml(ParseNode.SupSub group, Options options, MathMlBuilder mathml) {
        boolean isBrace = false;
        boolean isOver = false;
        if (group.base() instanceof ParseNode.HorizBrace brace && (group.sup() != null) == brace.isOver()) {
            isBrace = true;
            isOver = brace.isOver();
        }

        ParseNode base = group.base();
        if (base instanceof ParseNode.Op op) {
            base = op.asSupSubBase();
        } else if (base instanceof ParseNode.OperatorName name) {
            base = name.asSupSubBase();
        }

        final List<MathDomNode> children = new ArrayList<>();
        children.add(mathml.buildGroup(base, options));
        if (group.sub() != null) {
            children.add(mathml.buildGroup(group.sub(), options));
        }
        if (group.sup() != null) {
            children.add(mathml.buildGroup(group.sup(), options));
        }

        final String type;
        if (isBrace) {
            type = isOver ? "mover" : "munder";
        } else if (group.sub() == null) {
            type = opLimits(base, options, false) ? "mover" : "msup";
        } else if (group.sup() == null) {
            type = opLimits(base, options, false) ? "munder" : "msub";
        } else {
            type = opLimits(base, options, true) ? "munderover" : "msubsup";
        }
        return new MathDomNode.MathNode(type, children);
    }
}
