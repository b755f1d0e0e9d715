package io.github.simbo1905.tex.math;

/// Raised when a command that loads or links an external resource, or adds
/// raw markup attributes, is not trusted by the configured [TrustPolicy]. The parser replaces the
/// command with an unsupported-command placeholder instead of failing.
public class TrustException extends TexParseException {

    private static final long serialVersionUID = 1L;

    private final transient TrustContext context;

    public TrustException(TrustContext context, Token token) {
        super("Untrusted " + context.command() + " target: "
            + (context.url() != null ? context.url() : context.attributes()), token);
        this.context = context;
    }

    public TrustContext context() {
        return context;
    }
}
