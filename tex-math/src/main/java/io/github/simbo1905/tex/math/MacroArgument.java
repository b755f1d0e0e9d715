package io.github.simbo1905.tex.math;

import java.util.List;

/// A consumed macro argument.
///
/// @param tokens the argument in stack order (last token is read first), outer braces removed
/// @param start  the first token consumed
/// @param end    the last token consumed
public record MacroArgument(List<Token> tokens, Token start, Token end) {
    public MacroArgument {
        tokens = List.copyOf(tokens);
    }
}
