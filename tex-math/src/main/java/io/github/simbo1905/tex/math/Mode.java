package io.github.simbo1905.tex.math;

/// Parsing mode. Every parse node records the mode it was parsed in.
public enum Mode {
    MATH,
    TEXT;

    /// Lower-case name as used in symbol tables and error messages.
    public String label() {
        return this == MATH ? "math" : "text";
    }
}
