package io.github.simbo1905.tex.math;

/// How the parser reads one argument of a function or environment.
public enum ArgType {
    /// A colour name or hex code.
    COLOR,
    /// A length such as `1.5em`.
    SIZE,
    /// A URL, read with `%` and `~` treated as ordinary characters.
    URL,
    /// The unexpanded argument text.
    RAW,
    /// A group parsed in the current mode.
    ORIGINAL,
    /// A text-mode group wrapped in text style.
    HBOX,
    /// A single group or symbol, not necessarily braced.
    PRIMITIVE,
    MATH,
    TEXT
}
