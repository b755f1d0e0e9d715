package io.github.simbo1905.tex.math;

/// Which trees the rendered markup contains.
public enum OutputFormat {
    HTML,
    MATHML,
    HTML_AND_MATHML
}
