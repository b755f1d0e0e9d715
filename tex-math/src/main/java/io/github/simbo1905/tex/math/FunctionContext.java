package io.github.simbo1905.tex.math;

/// What a function handler sees of the call site.
///
/// @param funcName         the command name, like `\frac`
/// @param parser           the live parser, for handlers that read further input
/// @param token            the command token, or null for synthesized calls
/// @param breakOnTokenText the token that ends the enclosing expression, or null
public record FunctionContext(String funcName, Parser parser, Token token, String breakOnTokenText) {

    public Mode mode() {
        return parser.mode();
    }

    public SourceLocation loc() {
        return token == null ? null : token.loc();
    }
}
