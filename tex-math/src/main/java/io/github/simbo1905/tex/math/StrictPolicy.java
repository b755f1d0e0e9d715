package io.github.simbo1905.tex.math;

import java.util.Objects;

/// Decides per diagnostic how a LaTeX-incompatibility is handled.
/// A callback may return a different mode for each `code`; returning `null`
/// falls back to [StrictMode#WARN].
@FunctionalInterface
public interface StrictPolicy {

    StrictMode decide(String code, String message, Token token);

    StrictPolicy IGNORE = constant(StrictMode.IGNORE);
    StrictPolicy WARN = constant(StrictMode.WARN);
    StrictPolicy ERROR = constant(StrictMode.ERROR);

    static StrictPolicy constant(StrictMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return new Constant(mode);
    }

    /// A fixed policy; kept as a record so settings print readably.
    record Constant(StrictMode mode) implements StrictPolicy {
        public Constant {
            Objects.requireNonNull(mode, "mode must not be null");
        }

        @Override
        public StrictMode decide(String code, String message, Token token) {
            return mode;
        }
    }
}
