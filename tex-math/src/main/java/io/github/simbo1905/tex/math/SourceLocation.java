package io.github.simbo1905.tex.math;

import java.util.Objects;

/// A half-open `[start, end)` span of the original input string.
public record SourceLocation(String input, int start, int end) {

    public SourceLocation {
        Objects.requireNonNull(input, "input must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /// Merges the spans of two locations from the same input, or returns null
    /// when either is missing or they come from different inputs.
    public static SourceLocation range(SourceLocation first, SourceLocation second) {
        if (second == null) {
            return first;
        }
        if (first == null || !first.input.equals(second.input)) {
            return null;
        }
        return new SourceLocation(first.input, first.start, second.end);
    }

    /// The source text covered by this span.
    public String text() {
        return input.substring(start, Math.min(end, input.length()));
    }
}
