package io.github.simbo1905.tex.math;

import java.util.List;

/// Turns a parsed command invocation into a parse node.
///
/// `optArgs` holds one entry per optional argument, null where it was absent.
@FunctionalInterface
public interface FunctionHandler {
    ParseNode handle(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs);
}
