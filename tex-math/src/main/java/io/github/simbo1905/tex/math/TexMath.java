package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Renders TeX math to HTML and MathML markup.
///
/// Usage examples:
/// ```java
/// // Built-in commands only
/// String html = TexMath.standard().renderToString("x^2 + \\frac{1}{2}");
///
/// // Display mode, MathML only
/// Settings settings = Settings.defaults().withDisplayMode(true).withOutput(OutputFormat.MATHML);
/// String mathml = TexMath.standard().renderToString("\\sum_{i=1}^n i", settings);
///
/// // With caller-supplied macros and commands
/// TexMath tex = TexMath.builder()
///     .defineMacro("\\RR", "\\mathbb{R}")
///     .build();
/// ```
///
/// Instances are immutable and may be shared between threads; each render
/// owns its parser, macro namespace and builders.
public final class TexMath {

    private static final TexMath STANDARD = new TexMath(Registry.standard());

    private final Registry registry;

    private TexMath(Registry registry) {
        this.registry = registry;
    }

    /// The renderer with only the built-in commands, environments and macros.
    public static TexMath standard() {
        return STANDARD;
    }

    /// A builder seeded with the built-ins, for adding caller-defined commands.
    public static Builder builder() {
        return new Builder(Registry.standard().toBuilder());
    }

    public Registry registry() {
        return registry;
    }

    /// Renders with default settings.
    ///
    /// @throws TexParseException if the input is not valid TeX
    public String renderToString(String expression) {
        return renderToString(expression, Settings.defaults());
    }

    /// Renders `expression` to markup. With `throwOnError` off, a parse error
    /// becomes a `katex-error` span showing the source in `errorColor`.
    ///
    /// @throws NullPointerException if an argument is null
    /// @throws TexParseException if the input is not valid TeX and `throwOnError` is set
    public String renderToString(String expression, Settings settings) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        final long start = System.nanoTime();
        String markup;
        try {
            final List<ParseNode> tree = parse(expression, settings);
            markup = buildMarkup(tree, expression, settings);
        } catch (TexParseException e) {
            if (settings.throwOnError()) {
                throw e;
            }
            LOG.fine(() -> "render error rendered inline: " + e.rawMessage());
            markup = renderError(e, expression, settings).toMarkup();
        }
        StructuredLog.fine(LOG, "render", "length", expression.length(), "output", settings.output(),
            "micros", (System.nanoTime() - start) / 1000);
        return markup;
    }

    /// Parses `expression` into its tree. A `\tag` outside any environment
    /// wraps the whole tree in a [ParseNode.Tag].
    ///
    /// @throws TexParseException if the input is not valid TeX
    public List<ParseNode> parse(String expression, Settings settings) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        final var parser = new Parser(expression, settings, registry);
        final var macros = parser.gullet().macros();
        macros.set("\\df@tag", null, true);
        List<ParseNode> tree = parser.parse();
        if (macros.get("\\df@tag") != null) {
            if (!settings.displayMode()) {
                throw new TexParseException("\\tag works only in display equations");
            }
            tree = List.of(new ParseNode.Tag(Mode.TEXT, null, tree,
                parser.subparse(List.of(new Token("\\df@tag")))));
        }
        return tree;
    }

    /// The HTML box tree for `expression`: the `katex` span, wrapped in
    /// `katex-display` in display mode. MathML is not included.
    ///
    /// @throws TexParseException if the input is not valid TeX
    public BoxNode renderToBoxTree(String expression, Settings settings) {
        final List<ParseNode> tree = parse(expression, settings);
        final Options options = Options.forSettings(settings);
        final BoxNode.Span htmlNode = new HtmlBuilder(registry).buildHtml(tree, options);
        return displayWrap(BuildCommon.makeSpan(List.of("katex"), List.of(htmlNode)), settings);
    }

    private String buildMarkup(List<ParseNode> tree, String expression, Settings settings) {
        final Options options = Options.forSettings(settings);
        final var sb = new StringBuilder();
        final boolean display = settings.displayMode();
        if (display) {
            sb.append("<span class=\"katex-display");
            if (settings.leqno()) {
                sb.append(" leqno");
            }
            if (settings.fleqn()) {
                sb.append(" fleqn");
            }
            sb.append("\">");
        }
        sb.append("<span class=\"katex\">");
        if (settings.output() != OutputFormat.HTML) {
            final MathDomNode.MathNode math = new MathMlBuilder(registry)
                .buildMathMl(tree, expression, options, display);
            if (settings.output() == OutputFormat.MATHML) {
                math.writeMarkup(sb);
            } else {
                sb.append("<span class=\"katex-mathml\">");
                math.writeMarkup(sb);
                sb.append("</span>");
            }
        }
        if (settings.output() != OutputFormat.MATHML) {
            sb.append(new HtmlBuilder(registry).buildHtml(tree, options).toMarkup());
        }
        sb.append("</span>");
        if (display) {
            sb.append("</span>");
        }
        return sb.toString();
    }

    private static BoxNode displayWrap(BoxNode node, Settings settings) {
        if (!settings.displayMode()) {
            return node;
        }
        final BoxNode.Span wrapper = BuildCommon.makeSpan(List.of("katex-display"), List.of(node));
        if (settings.leqno()) {
            wrapper.addClass("leqno");
        }
        if (settings.fleqn()) {
            wrapper.addClass("fleqn");
        }
        return wrapper;
    }

    private static BoxNode renderError(TexParseException error, String expression, Settings settings) {
        final BoxNode.Span node = BuildCommon.makeSpan(List.of("katex-error"),
            List.of(new BoxNode.Symbol(expression, 0, 0, 0, 0, 0, List.of())));
        node.setAttribute("title", error.getMessage());
        node.setStyle("color", settings.errorColor());
        return node;
    }

    /// Collects caller-defined commands on top of the built-ins.
    public static final class Builder {
        private final Registry.Builder registry;

        private Builder(Registry.Builder registry) {
            this.registry = registry;
        }

        public Builder defineMacro(String name, String body) {
            registry.defineMacro(name, body);
            return this;
        }

        public Builder defineMacro(String name, MacroDefinition definition) {
            registry.defineMacro(name, definition);
            return this;
        }

        /// @throws IllegalArgumentException if a name is already a function
        public Builder defineFunction(FunctionSpec spec) {
            registry.defineFunction(spec);
            return this;
        }

        public Builder defineEnvironment(EnvironmentSpec spec) {
            registry.defineEnvironment(spec);
            return this;
        }

        /// Output builders for a node class introduced by [#defineFunction].
        public <N extends ParseNode> Builder defineBuilders(Class<N> type, HtmlGroupBuilder<N> html,
                                                            MathMlGroupBuilder<N> mathml) {
            registry.defineBuilders(type, html, mathml);
            return this;
        }

        public TexMath build() {
            return new TexMath(registry.build());
        }
    }
}
