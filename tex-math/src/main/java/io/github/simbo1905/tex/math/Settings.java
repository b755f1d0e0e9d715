package io.github.simbo1905.tex.math;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Render configuration. Every option is independently toggleable through the
/// `withX` copy methods; [#defaults()] matches the behaviour of a plain render.
///
/// @param displayMode      block layout (`\displaystyle`) instead of inline
/// @param output           which trees the markup contains
/// @param leqno            equation tags on the left
/// @param fleqn            display math flush left
/// @param throwOnError     when false, parse errors render as coloured source text
/// @param errorColor       colour for error text and unsupported commands
/// @param macros           macros seeded into the namespace before parsing
/// @param minRuleThickness lower bound in em for fraction bars and rules, never negative
/// @param colorIsTextColor make `\color` behave like `\textcolor`
/// @param strict           policy for LaTeX-incompatible input
/// @param trust            policy for commands that reference URLs
/// @param maxSize          upper bound in em for user-specified sizes, never negative
/// @param maxExpand        macro expansion ceiling
/// @param globalGroup      keep top-level definitions after the render
public record Settings(
    boolean displayMode,
    OutputFormat output,
    boolean leqno,
    boolean fleqn,
    boolean throwOnError,
    String errorColor,
    Map<String, MacroDefinition> macros,
    double minRuleThickness,
    boolean colorIsTextColor,
    StrictPolicy strict,
    TrustPolicy trust,
    double maxSize,
    int maxExpand,
    boolean globalGroup
) {
    /// Default expansion ceiling.
    public static final int DEFAULT_MAX_EXPAND = 1000;

    private static final Pattern PROTOCOL =
        Pattern.compile("^[\\x00-\\x20]*([^\\\\/#?]*?)(:|&#0*58|&#x0*3a|&colon)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z\\d+\\-.]*$");

    public Settings {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(errorColor, "errorColor must not be null");
        Objects.requireNonNull(macros, "macros must not be null");
        Objects.requireNonNull(strict, "strict must not be null");
        Objects.requireNonNull(trust, "trust must not be null");
        if (Double.isNaN(minRuleThickness)) {
            throw new IllegalArgumentException("minRuleThickness must be a number");
        }
        if (Double.isNaN(maxSize)) {
            throw new IllegalArgumentException("maxSize must be a number");
        }
        if (maxExpand < 0) {
            throw new IllegalArgumentException("maxExpand must be >= 0");
        }
        minRuleThickness = Math.max(0.0, minRuleThickness);
        maxSize = Math.max(0.0, maxSize);
        macros = Map.copyOf(macros);
    }

    public static Settings defaults() {
        return new Settings(false, OutputFormat.HTML_AND_MATHML, false, false, true, "#cc0000",
            Map.of(), 0.0, false, StrictPolicy.IGNORE, TrustPolicy.NONE,
            Double.POSITIVE_INFINITY, DEFAULT_MAX_EXPAND, false);
    }

    public Settings withDisplayMode(boolean value) {
        return new Settings(value, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withOutput(OutputFormat value) {
        return new Settings(displayMode, value, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withLeqno(boolean value) {
        return new Settings(displayMode, output, value, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withFleqn(boolean value) {
        return new Settings(displayMode, output, leqno, value, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withThrowOnError(boolean value) {
        return new Settings(displayMode, output, leqno, fleqn, value, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withErrorColor(String value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, value, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withMacros(Map<String, MacroDefinition> value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, value, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    /// Adds one macro whose body is TeX source.
    public Settings withMacro(String name, String body) {
        final var copy = new LinkedHashMap<>(macros);
        copy.put(name, new MacroDefinition.Text(body));
        return withMacros(copy);
    }

    public Settings withMinRuleThickness(double value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, value,
            colorIsTextColor, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withColorIsTextColor(boolean value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            value, strict, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withStrict(StrictPolicy value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, value, trust, maxSize, maxExpand, globalGroup);
    }

    public Settings withStrict(StrictMode value) {
        return withStrict(StrictPolicy.constant(value));
    }

    public Settings withTrust(TrustPolicy value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, value, maxSize, maxExpand, globalGroup);
    }

    public Settings withTrust(boolean value) {
        return withTrust(value ? TrustPolicy.ALL : TrustPolicy.NONE);
    }

    public Settings withMaxSize(double value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, value, maxExpand, globalGroup);
    }

    public Settings withMaxExpand(int value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, value, globalGroup);
    }

    public Settings withGlobalGroup(boolean value) {
        return new Settings(displayMode, output, leqno, fleqn, throwOnError, errorColor, macros, minRuleThickness,
            colorIsTextColor, strict, trust, maxSize, maxExpand, value);
    }

    /// Reports LaTeX-incompatible input. Depending on the strict policy this
    /// does nothing, logs a warning, or throws.
    public void reportNonstrict(String code, String message, Token token) {
        final StrictMode mode = decide(code, message, token);
        switch (mode) {
            case IGNORE -> { }
            case ERROR -> throw new TexParseException(
                "LaTeX-incompatible input and strict mode is 'error': " + message + " [" + code + "]", token);
            case WARN -> LOG.warning(() ->
                "LaTeX-incompatible input and strict mode is 'warn': " + message + " [" + code + "]");
        }
    }

    /// Like [#reportNonstrict] but returns whether strict (LaTeX) behaviour
    /// should be used instead of throwing. A failing callback counts as `ERROR`.
    public boolean useStrictBehavior(String code, String message, Token token) {
        StrictMode mode;
        try {
            mode = decide(code, message, token);
        } catch (RuntimeException e) {
            LOG.fine(() -> "strict callback failed for " + code + ": " + e);
            mode = StrictMode.ERROR;
        }
        if (mode == StrictMode.WARN) {
            LOG.warning(() -> "LaTeX-incompatible input and strict mode is 'warn': " + message + " [" + code + "]");
            return false;
        }
        return mode == StrictMode.ERROR;
    }

    private StrictMode decide(String code, String message, Token token) {
        final StrictMode mode = strict.decide(code, message, token);
        return mode == null ? StrictMode.WARN : mode;
    }

    /// Whether `command` may reference `url`. URLs with a malformed scheme are never trusted.
    public boolean isTrusted(String command, String url) {
        final String protocol = protocolFromUrl(url);
        if (protocol == null) {
            return false;
        }
        return trust.isTrusted(new TrustContext(command, url, protocol));
    }

    /// Throws [TrustException] unless `command` may reference `url`.
    void checkTrusted(String command, String url, Token token) {
        if (!isTrusted(command, url)) {
            throw new TrustException(new TrustContext(command, url, protocolFromUrl(url)), token);
        }
    }

    /// Whether an HTML extension command may add `attributes` to the output.
    public boolean isTrusted(String command, Map<String, String> attributes) {
        return trust.isTrusted(TrustContext.forAttributes(command, attributes));
    }

    /// Throws [TrustException] unless `command` may add `attributes`.
    void checkTrusted(String command, Map<String, String> attributes, Token token) {
        if (!isTrusted(command, attributes)) {
            throw new TrustException(TrustContext.forAttributes(command, attributes), token);
        }
    }

    /// Returns the lower-cased scheme of `url`, `_relative` when there is none,
    /// or null when the scheme is malformed or HTML-entity encoded.
    static String protocolFromUrl(String url) {
        final var m = PROTOCOL.matcher(url);
        if (!m.find()) {
            return "_relative";
        }
        if (!":".equals(m.group(2))) {
            return null;
        }
        if (!SCHEME.matcher(m.group(1)).matches()) {
            return null;
        }
        return m.group(1).toLowerCase(java.util.Locale.ROOT);
    }
}
