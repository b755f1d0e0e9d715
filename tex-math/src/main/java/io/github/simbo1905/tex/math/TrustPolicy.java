package io.github.simbo1905.tex.math;

/// Gates `\href`, `\\url` and `\includegraphics` targets and the `\html*` attribute commands.
@FunctionalInterface
public interface TrustPolicy {

    boolean isTrusted(TrustContext context);

    TrustPolicy NONE = context -> false;
    TrustPolicy ALL = context -> true;

    /// Trusts only the listed protocols, for example `allowProtocols("https", "_relative")`.
    static TrustPolicy allowProtocols(String... protocols) {
        final var allowed = java.util.Set.of(protocols);
        return context -> context.protocol() != null && allowed.contains(context.protocol());
    }
}
