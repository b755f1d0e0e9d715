package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Map;

/// Inter-atom glue between the eight spacing classes.
final class Spacing {

    /// The spacing classes as they appear in CSS: ord, op, bin, rel, open,
    /// close, punct and inner.
    static final List<String> CLASSES =
        List.of("mord", "mop", "mbin", "mrel", "mopen", "mclose", "mpunct", "minner");

    static final Measurement THIN = Measurement.mu(3);
    static final Measurement MEDIUM = Measurement.mu(4);
    static final Measurement THICK = Measurement.mu(5);

    private static final Map<String, Map<String, Measurement>> NORMAL = Map.of(
        "mord", Map.of("mop", THIN, "mbin", MEDIUM, "mrel", THICK, "minner", THIN),
        "mop", Map.of("mord", THIN, "mop", THIN, "mrel", THICK, "minner", THIN),
        "mbin", Map.of("mord", MEDIUM, "mop", MEDIUM, "mopen", MEDIUM, "minner", MEDIUM),
        "mrel", Map.of("mord", THICK, "mop", THICK, "mopen", THICK, "minner", THICK),
        "mopen", Map.of(),
        "mclose", Map.of("mop", THIN, "mbin", MEDIUM, "mrel", THICK, "minner", THIN),
        "mpunct", Map.of("mord", THIN, "mop", THIN, "mrel", THICK, "mopen", THIN, "mclose", THIN,
            "mpunct", THIN, "minner", THIN),
        "minner", Map.of("mord", THIN, "mop", THIN, "mbin", MEDIUM, "mrel", THICK, "mopen", THIN,
            "mpunct", THIN, "minner", THIN));

    private static final Map<String, Map<String, Measurement>> TIGHT = Map.of(
        "mord", Map.of("mop", THIN),
        "mop", Map.of("mord", THIN, "mop", THIN),
        "mbin", Map.of(),
        "mrel", Map.of(),
        "mopen", Map.of(),
        "mclose", Map.of("mop", THIN),
        "mpunct", Map.of(),
        "minner", Map.of("mop", THIN));

    private Spacing() {}

    /// Glue between a left atom of class `left` and a right atom of class
    /// `right`, or null for none.
    static Measurement between(String left, String right, boolean tight) {
        final Map<String, Measurement> row = (tight ? TIGHT : NORMAL).get(left);
        return row == null ? null : row.get(right);
    }

    /// Script and scriptscript styles use the tight table.
    static boolean useTight(Options options) {
        return options.style().isTight();
    }
}
