package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A vertical list: boxes and kerns stacked bottom to top against a shared
/// baseline.
///
/// The list is positioned one of five ways. `individualShift` gives each
/// element its own baseline shift; `top` fixes the top edge; `bottom` fixes
/// the bottom edge; `shift` moves the first element's baseline; and
/// `firstBaseline` puts the first element on the baseline.
///
/// Laid out, the result is a `vlist-t` table whose height is the highest
/// running position and whose depth is minus the lowest.
final class VList {

    enum PositionType { INDIVIDUAL_SHIFT, TOP, BOTTOM, SHIFT, FIRST_BASELINE }

    sealed interface Child permits Elem, Kern {
    }

    /// A box in the list. `shift` is only read for `individualShift` lists.
    record Elem(BoxNode elem, double shift, String marginLeft, String marginRight, List<String> wrapperClasses,
                Map<String, String> wrapperStyle) implements Child {

        Elem(BoxNode elem) {
            this(elem, 0, null, null, List.of(), Map.of());
        }

        Elem(BoxNode elem, double shift) {
            this(elem, shift, null, null, List.of(), Map.of());
        }

        Elem withMarginLeft(String margin) {
            return new Elem(elem, shift, margin, marginRight, wrapperClasses, wrapperStyle);
        }

        Elem withMarginRight(String margin) {
            return new Elem(elem, shift, marginLeft, margin, wrapperClasses, wrapperStyle);
        }

        Elem withWrapper(List<String> classes, Map<String, String> style) {
            return new Elem(elem, shift, marginLeft, marginRight, classes, style);
        }
    }

    record Kern(double size) implements Child {
    }

    private final PositionType positionType;
    private final double positionData;
    private final List<Child> children;

    private VList(PositionType positionType, double positionData, List<Child> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("a vertical list needs at least one child");
        }
        this.positionType = positionType;
        this.positionData = positionData;
        this.children = List.copyOf(children);
    }

    /// Each element sits at its own shift; only [Elem] children are allowed.
    static VList individualShift(List<Elem> children) {
        return new VList(PositionType.INDIVIDUAL_SHIFT, 0, new ArrayList<>(children));
    }

    static VList top(double top, List<Child> children) {
        return new VList(PositionType.TOP, top, children);
    }

    static VList bottom(double bottom, List<Child> children) {
        return new VList(PositionType.BOTTOM, bottom, children);
    }

    static VList shift(double shift, List<Child> children) {
        return new VList(PositionType.SHIFT, shift, children);
    }

    static VList firstBaseline(List<Child> children) {
        return new VList(PositionType.FIRST_BASELINE, 0, children);
    }

    private record Positioned(List<Child> children, double depth) {
    }

    /// Normalizes the list to kerns between elements plus the starting depth.
    private Positioned position() {
        switch (positionType) {
            case INDIVIDUAL_SHIFT -> {
                final List<Child> out = new ArrayList<>();
                final Elem first = (Elem) children.get(0);
                out.add(first);
                final double depth = -first.shift() - first.elem().depth;
                double currPos = depth;
                for (int i = 1; i < children.size(); i++) {
                    final Elem child = (Elem) children.get(i);
                    final Elem prev = (Elem) children.get(i - 1);
                    final double diff = -child.shift() - currPos - child.elem().depth;
                    final double size = diff - (prev.elem().height + prev.elem().depth);
                    currPos += diff;
                    out.add(new Kern(size));
                    out.add(child);
                }
                return new Positioned(out, depth);
            }
            case TOP -> {
                double bottom = positionData;
                for (final Child child : children) {
                    if (child instanceof Kern kern) {
                        bottom -= kern.size();
                    } else if (child instanceof Elem elem) {
                        bottom -= elem.elem().height + elem.elem().depth;
                    }
                }
                return new Positioned(children, bottom);
            }
            case BOTTOM -> {
                return new Positioned(children, -positionData);
            }
            default -> {
                if (!(children.get(0) instanceof Elem first)) {
                    throw new IllegalStateException("First child must have type \"elem\".");
                }
                if (positionType == PositionType.SHIFT) {
                    return new Positioned(children, -first.elem().depth - positionData);
                }
                return new Positioned(children, -first.elem().depth);
            }
        }
    }

    /// Lays the list out as a `vlist-t` span.
    BoxNode.Span build() {
        final Positioned positioned = position();
        final List<Child> items = positioned.children();
        final double depth = positioned.depth();

        // taller than every child
        double pstrutSize = 0;
        for (final Child child : items) {
            if (child instanceof Elem elem) {
                pstrutSize = Math.max(pstrutSize, Math.max(elem.elem().maxFontSize, elem.elem().height));
            }
        }
        pstrutSize += 2;
        final BoxNode.Span pstrut = BuildCommon.makeSpan("pstrut");
        pstrut.setStyle("height", Units.makeEm(pstrutSize));

        final List<BoxNode> realChildren = new ArrayList<>();
        double minPos = depth;
        double maxPos = depth;
        double currPos = depth;
        for (final Child child : items) {
            if (child instanceof Kern kern) {
                currPos += kern.size();
            } else if (child instanceof Elem elem) {
                final BoxNode box = elem.elem();
                final BoxNode.Span wrap = BuildCommon.makeSpan(elem.wrapperClasses(), List.of(pstrut, box));
                elem.wrapperStyle().forEach(wrap::setStyle);
                wrap.setStyle("top", Units.makeEm(-pstrutSize - currPos - box.depth));
                if (elem.marginLeft() != null) {
                    wrap.setStyle("margin-left", elem.marginLeft());
                }
                if (elem.marginRight() != null) {
                    wrap.setStyle("margin-right", elem.marginRight());
                }
                realChildren.add(wrap);
                currPos += box.height + box.depth;
            }
            minPos = Math.min(minPos, currPos);
            maxPos = Math.max(maxPos, currPos);
        }

        final BoxNode.Span vlist = BuildCommon.makeSpan(List.of("vlist"), realChildren);
        vlist.setStyle("height", Units.makeEm(maxPos));

        final List<BoxNode> rows;
        if (minPos < 0) {
            final BoxNode.Span depthStrut = BuildCommon.makeSpan(List.of("vlist"),
                List.of(BuildCommon.makeSpan()));
            depthStrut.setStyle("height", Units.makeEm(-minPos));
            final BoxNode.Span topStrut = BuildCommon.makeSpan(List.of("vlist-s"),
                List.of(new BoxNode.Symbol("\u200b", 0, 0, 0, 0, 0, List.of())));
            rows = List.of(
                BuildCommon.makeSpan(List.of("vlist-r"), List.of(vlist, topStrut)),
                BuildCommon.makeSpan(List.of("vlist-r"), List.of(depthStrut)));
        } else {
            rows = List.of(BuildCommon.makeSpan(List.of("vlist-r"), List.of(vlist)));
        }

        final BoxNode.Span table = BuildCommon.makeSpan(List.of("vlist-t"), rows);
        if (rows.size() == 2) {
            table.addClass("vlist-t2");
        }
        table.height = maxPos;
        table.depth = -minPos;
        return table;
    }

    static Map<String, String> style(String property, String value) {
        final var map = new LinkedHashMap<String, String>();
        map.put(property, value);
        return map;
    }
}
