package io.github.simbo1905.tex.math;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/// Vertical list layout over generated box stacks. Each box has depth half
/// its height.
class VListPropertyTest extends TexMathLoggingConfig {
    private static BoxNode box(double height) {
        return new BoxNode.Symbol("x", height, height / 2, 0, 0, 0.5, List.of());
    }

    private static List<VList.Child> elems(List<Double> heights) {
        final List<VList.Child> out = new ArrayList<>();
        for (final double h : heights) {
            out.add(new VList.Elem(box(h)));
        }
        return out;
    }

    private static double elemTotal(VList.Elem elem) {
        return elem.elem().height() + elem.elem().depth();
    }

    private static double total(List<Double> heights) {
        return heights.stream().mapToDouble(h -> h * 1.5).sum();
    }

    @Property(tries = 200)
    void firstBaselineSitsTheFirstBoxOnTheBaseline(
        @ForAll @Size(min = 1, max = 6) List<@DoubleRange(min = 0, max = 3) Double> heights) {
        final BoxNode.Span table = VList.firstBaseline(elems(heights)).build();
        final double firstDepth = heights.get(0) / 2;
        assertThat(table.depth()).isCloseTo(firstDepth, within(1e-9));
        assertThat(table.height()).isCloseTo(total(heights) - firstDepth, within(1e-9));
    }

    @Property(tries = 200)
    void topFixesTheHighestPoint(
        @ForAll @Size(min = 1, max = 6) List<@DoubleRange(min = 0, max = 3) Double> heights,
        @ForAll @DoubleRange(min = -2, max = 4) double top) {
        final BoxNode.Span table = VList.top(top, elems(heights)).build();
        assertThat(table.height()).isCloseTo(top, within(1e-9));
        assertThat(table.height() + table.depth()).isCloseTo(total(heights), within(1e-9));
    }

    @Property(tries = 200)
    void bottomFixesTheLowestPoint(
        @ForAll @Size(min = 1, max = 6) List<@DoubleRange(min = 0, max = 3) Double> heights,
        @ForAll @DoubleRange(min = 0, max = 2) double bottom) {
        final BoxNode.Span table = VList.bottom(bottom, elems(heights)).build();
        assertThat(table.depth()).isCloseTo(bottom, within(1e-9));
        assertThat(table.height()).isCloseTo(Math.max(total(heights) - bottom, -bottom), within(1e-9));
    }

    @Property(tries = 200)
    void shiftLowersTheFirstBaseline(
        @ForAll @Size(min = 1, max = 6) List<@DoubleRange(min = 0, max = 3) Double> heights,
        @ForAll @DoubleRange(min = 0, max = 2) double shift) {
        final BoxNode.Span plain = VList.firstBaseline(elems(heights)).build();
        final BoxNode.Span shifted = VList.shift(shift, elems(heights)).build();
        assertThat(shifted.height()).isCloseTo(plain.height() - shift, within(1e-9));
        assertThat(shifted.depth()).isCloseTo(plain.depth() + shift, within(1e-9));
    }

    @Property(tries = 200)
    void heightAndDepthCoverAllRunningPositions(
        @ForAll @Size(min = 1, max = 6) List<@DoubleRange(min = 0, max = 3) Double> heights,
        @ForAll @DoubleRange(min = -1, max = 1) double kern) {
        final List<VList.Child> children = new ArrayList<>();
        for (final VList.Child elem : elems(heights)) {
            if (!children.isEmpty()) {
                children.add(new VList.Kern(kern));
            }
            children.add(elem);
        }
        final BoxNode.Span table = VList.bottom(0, children).build();

        double pos = 0;
        double min = 0;
        double max = 0;
        for (final VList.Child child : children) {
            pos += child instanceof VList.Kern k ? k.size() : elemTotal((VList.Elem) child);
            min = Math.min(min, pos);
            max = Math.max(max, pos);
        }
        assertThat(table.height()).isCloseTo(max, within(1e-9));
        assertThat(table.depth()).isCloseTo(-min, within(1e-9));
        assertThat(table.hasClass("vlist-t2")).isEqualTo(min < 0);
    }

    @Property(tries = 100)
    void individualShiftPlacesEachBaselineWhereAsked(
        @ForAll @DoubleRange(min = 0.1, max = 1) double lower,
        @ForAll @DoubleRange(min = 0.1, max = 1) double upper) {
        final BoxNode sub = box(0.4);
        final BoxNode sup = box(0.4);
        final BoxNode.Span table = VList.individualShift(List.of(
            new VList.Elem(sub, lower),
            new VList.Elem(sup, -upper - 0.6))).build();
        // a box with baseline at b spans [b - depth, b + height]
        final double bottom = -lower - 0.2;
        final double top = upper + 0.6 + 0.4;
        assertThat(table.depth()).isCloseTo(Math.max(-bottom, 0), within(1e-9));
        assertThat(table.height()).isCloseTo(Math.max(top, bottom), within(1e-9));
    }

    @Example
    void emptyListIsRejected() {
        assertThatThrownBy(() -> VList.firstBaseline(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void shiftNeedsAnElementFirst() {
        assertThatThrownBy(() -> VList.shift(0.5, List.of(new VList.Kern(1), new VList.Elem(box(1)))).build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("First child must have type");
    }
}
