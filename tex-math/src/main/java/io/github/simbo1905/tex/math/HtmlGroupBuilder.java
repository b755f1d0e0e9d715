package io.github.simbo1905.tex.math;

/// Builds the box tree for one kind of parse node. Children are built back
/// through `html`.
@FunctionalInterface
public interface HtmlGroupBuilder<N extends ParseNode> {
    BoxNode build(N group, Options options, HtmlBuilder html);
}
