package io.github.simbo1905.tex.math;

/// Raised by the macro expander: runaway expansion, malformed arguments or
/// placeholders, and undefined names in expandable-only contexts.
public class MacroExpansionException extends TexParseException {

    private static final long serialVersionUID = 1L;

    public MacroExpansionException(String message) {
        super(message);
    }

    public MacroExpansionException(String message, Token token) {
        super(message, token);
    }
}
