package io.github.simbo1905.tex.math;

import java.util.Map;
import java.util.Objects;

/// What a [TrustPolicy] is asked about.
///
/// Link commands fill in the URL and its protocol (`_relative` for relative
/// URLs). The HTML extension commands have no URL; they pass the markup
/// attributes they would add instead.
public record TrustContext(String command, String url, String protocol, Map<String, String> attributes) {
    public TrustContext {
        Objects.requireNonNull(command, "command must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public TrustContext(String command, String url, String protocol) {
        this(command, Objects.requireNonNull(url, "url must not be null"), protocol, Map.of());
    }

    public static TrustContext forAttributes(String command, Map<String, String> attributes) {
        return new TrustContext(command, null, null, attributes);
    }
}
