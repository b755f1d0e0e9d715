package io.github.simbo1905.tex.math;

import java.util.Objects;

/// A length as written in the source: a number and a TeX unit.
public record Measurement(double number, String unit) {

    public Measurement {
        Objects.requireNonNull(unit, "unit must not be null");
    }

    public static Measurement em(double number) {
        return new Measurement(number, "em");
    }

    public static Measurement mu(double number) {
        return new Measurement(number, "mu");
    }
}
