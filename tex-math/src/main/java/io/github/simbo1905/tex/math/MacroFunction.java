package io.github.simbo1905.tex.math;

/// A macro computed from the expansion state, for example one that peeks at the
/// next token. Returns a [MacroDefinition.Text] or [MacroDefinition.Expansion].
@FunctionalInterface
public interface MacroFunction {
    MacroDefinition expand(MacroContext context);
}
