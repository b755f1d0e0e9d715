package io.github.simbo1905.tex.math;

import java.util.List;

/// Parses the body of an environment after `\begin{name}` and its arguments.
@FunctionalInterface
public interface EnvironmentHandler {
    ParseNode handle(EnvironmentContext context, List<ParseNode> args, List<ParseNode> optArgs);
}
