package io.github.simbo1905.tex.math;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Set;

/// Unit conversion. Every length ends up in em of the current font size.
final class Units {

    /// Points per unit for the absolute TeX units.
    static final Map<String, Double> PT_PER_UNIT = Map.ofEntries(
        Map.entry("pt", 1.0),
        Map.entry("mm", 7227.0 / 2540),
        Map.entry("cm", 7227.0 / 254),
        Map.entry("in", 72.27),
        Map.entry("bp", 803.0 / 800),
        Map.entry("pc", 12.0),
        Map.entry("dd", 1238.0 / 1157),
        Map.entry("cc", 14856.0 / 1157),
        Map.entry("nd", 685.0 / 642),
        Map.entry("nc", 1370.0 / 107),
        Map.entry("sp", 1.0 / 65536),
        Map.entry("px", 803.0 / 800));

    /// Units whose size depends on the current font.
    static final Set<String> RELATIVE_UNITS = Set.of("ex", "em", "mu");

    private Units() {}

    static boolean validUnit(String unit) {
        return PT_PER_UNIT.containsKey(unit) || RELATIVE_UNITS.contains(unit);
    }

    static boolean validUnit(Measurement measurement) {
        return validUnit(measurement.unit());
    }

    /// Converts a measurement to em in `options`, capped at the options' `maxSize`.
    ///
    /// @throws TexParseException for an unknown unit
    static double calculateSize(Measurement size, Options options) {
        final double scale;
        final Double ptPerUnit = PT_PER_UNIT.get(size.unit());
        if (ptPerUnit != null) {
            scale = ptPerUnit / options.fontMetrics().ptPerEm() / options.sizeMultiplier();
        } else if ("mu".equals(size.unit())) {
            scale = options.fontMetrics().cssEmPerMu();
        } else {
            final Options unitOptions = options.style().isTight()
                ? options.havingStyle(options.style().text())
                : options;
            double s;
            if ("ex".equals(size.unit())) {
                s = unitOptions.fontMetrics().xHeight();
            } else if ("em".equals(size.unit())) {
                s = unitOptions.fontMetrics().quad();
            } else {
                throw new TexParseException("Invalid unit: '" + size.unit() + "'");
            }
            if (unitOptions != options) {
                s *= unitOptions.sizeMultiplier() / options.sizeMultiplier();
            }
            scale = s;
        }
        return Math.min(size.number() * scale, options.maxSize());
    }

    /// Formats an em length rounded to four decimals, like `0.25em`.
    static String makeEm(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            return (Double.isNaN(n) ? "0" : n > 0 ? "1e9" : "-1e9") + "em";
        }
        final String text = BigDecimal.valueOf(n).setScale(4, RoundingMode.HALF_UP)
            .stripTrailingZeros().toPlainString();
        return ("-0".equals(text) ? "0" : text) + "em";
    }
}
