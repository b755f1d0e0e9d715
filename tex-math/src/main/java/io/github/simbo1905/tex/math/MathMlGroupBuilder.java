package io.github.simbo1905.tex.math;

/// Builds the MathML tree for one kind of parse node. Children are built back
/// through `mathml`.
@FunctionalInterface
public interface MathMlGroupBuilder<N extends ParseNode> {
    MathDomNode build(N group, Options options, MathMlBuilder mathml);
}
