package io.github.simbo1905.tex.math;

/// Exception thrown when TeX input cannot be turned into a parse tree.
///
/// The message carries the offending span with 15 characters of context on
/// each side and the span itself underlined with U+0332, for example
/// `TeX parse error: Double superscript at position 4: x^2^̲3`.
/// Subclasses narrow the stage that failed.
public class TexParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int CONTEXT = 15;

    private final String rawMessage;
    private final int position;
    private final int length;
    private final transient SourceLocation location;

    /// Creates an exception with no source position.
    public TexParseException(String message) {
        this(message, (SourceLocation) null);
    }

    /// Creates an exception pointing at the given token, which may be null.
    public TexParseException(String message, Token token) {
        this(message, token == null ? null : token.loc());
    }

    /// Creates an exception pointing at a parse node's source span.
    public TexParseException(String message, ParseNode node) {
        this(message, node == null ? null : node.loc());
    }

    /// Creates an exception pointing at the given span, which may be null.
    public TexParseException(String message, SourceLocation location) {
        super(formatMessage(message, location));
        this.rawMessage = message;
        this.location = location;
        this.position = location == null ? -1 : location.start();
        this.length = location == null ? -1 : location.end() - location.start();
    }

    /// Creates an exception that wraps a lower-level cause.
    public TexParseException(String message, Throwable cause) {
        super(formatMessage(message, null), cause);
        this.rawMessage = message;
        this.location = null;
        this.position = -1;
        this.length = -1;
    }

    /// The message without position or context decoration.
    public String rawMessage() {
        return rawMessage;
    }

    /// Zero-based start offset of the offending span, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Length of the offending span, or -1 if unknown.
    public int length() {
        return length;
    }

    /// The offending span, or null if unknown.
    public SourceLocation location() {
        return location;
    }

    static String formatMessage(String message, SourceLocation loc) {
        final var sb = new StringBuilder("TeX parse error: ").append(message);
        if (loc == null) {
            return sb.toString();
        }
        final String input = loc.input();
        final int start = Math.min(loc.start(), input.length());
        final int end = Math.min(loc.end(), input.length());
        if (start == input.length()) {
            sb.append(" at end of input: ");
        } else {
            sb.append(" at position ").append(start + 1).append(": ");
        }
        if (start > CONTEXT) {
            sb.append('…').append(input, start - CONTEXT, start);
        } else {
            sb.append(input, 0, start);
        }
        for (int i = start; i < end; i++) {
            sb.append(input.charAt(i)).append('̲');
        }
        if (end + CONTEXT < input.length()) {
            sb.append(input, end, end + CONTEXT).append('…');
        } else {
            sb.append(input, end, input.length());
        }
        return sb.toString();
    }
}
