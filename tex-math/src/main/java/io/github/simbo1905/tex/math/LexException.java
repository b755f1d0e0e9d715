package io.github.simbo1905.tex.math;

/// Raised by the lexer for input it cannot split into tokens.
public class LexException extends TexParseException {

    private static final long serialVersionUID = 1L;

    public LexException(String message, SourceLocation location) {
        super(message, location);
    }
}
