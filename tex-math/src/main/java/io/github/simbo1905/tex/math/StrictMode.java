package io.github.simbo1905.tex.math;

/// How LaTeX-incompatible but renderable input is treated.
public enum StrictMode {
    /// Accept silently.
    IGNORE,
    /// Accept and log a warning.
    WARN,
    /// Reject with a [TexParseException].
    ERROR
}
