package io.github.simbo1905.tex.math;

import java.util.Objects;

/// A lexed token: its text, where it came from, and the two expansion flags.
///
/// Tokens are values. Setting a flag produces a new token so that a token shared
/// between several stack positions is never changed behind another user's back.
public record Token(String text, SourceLocation loc, boolean noExpand, boolean treatAsRelax) {

    public Token {
        Objects.requireNonNull(text, "text must not be null");
    }

    public Token(String text, SourceLocation loc) {
        this(text, loc, false, false);
    }

    public Token(String text) {
        this(text, null, false, false);
    }

    /// Returns a token covering this token through `endToken`, with new text.
    public Token range(Token endToken, String newText) {
        return new Token(newText, SourceLocation.range(loc, endToken.loc));
    }

    public Token withNoExpand() {
        return noExpand ? this : new Token(text, loc, true, treatAsRelax);
    }

    public Token withTreatAsRelax() {
        return treatAsRelax ? this : new Token(text, loc, noExpand, true);
    }

    /// The lexer never produces a multi-letter token without a leading backslash,
    /// so the literal text `EOF` only ever marks end of input.
    public boolean isEof() {
        return "EOF".equals(text);
    }
}
