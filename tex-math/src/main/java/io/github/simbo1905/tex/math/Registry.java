package io.github.simbo1905.tex.math;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// The command table: functions, environments, built-in macros and the two
/// builders for each parse node class.
///
/// A registry is immutable once built and may be shared between renders and
/// threads. Extensions start from [#standard()] through [#toBuilder()].
public final class Registry {

    private final Map<String, FunctionSpec> functions;
    private final Map<String, EnvironmentSpec> environments;
    private final Map<String, MacroDefinition> macros;
    private final Map<Class<?>, HtmlGroupBuilder<?>> htmlBuilders;
    private final Map<Class<?>, MathMlGroupBuilder<?>> mathmlBuilders;

    private Registry(Builder builder) {
        this.functions = Collections.unmodifiableMap(new HashMap<>(builder.functions));
        this.environments = Collections.unmodifiableMap(new HashMap<>(builder.environments));
        this.macros = Collections.unmodifiableMap(new HashMap<>(builder.macros));
        this.htmlBuilders = Collections.unmodifiableMap(new HashMap<>(builder.htmlBuilders));
        this.mathmlBuilders = Collections.unmodifiableMap(new HashMap<>(builder.mathmlBuilders));
    }

    private static final class Standard {
        static final Registry INSTANCE = create();

        private static Registry create() {
            final Builder builder = builder();
            SymbolFunctions.register(builder);
            StructureFunctions.register(builder);
            SupSubFunctions.register(builder);
            OpFunctions.register(builder);
            GenfracFunctions.register(builder);
            SqrtFunctions.register(builder);
            AccentFunctions.register(builder);
            DelimiterFunctions.register(builder);
            StyleFunctions.register(builder);
            FontFunctions.register(builder);
            SpacingFunctions.register(builder);
            EncloseFunctions.register(builder);
            ArrowFunctions.register(builder);
            LinkFunctions.register(builder);
            DefinitionFunctions.register(builder);
            ArrayEnvironments.register(builder);
            CdEnvironment.register(builder);
            BuiltinMacros.register(builder);
            final Registry registry = builder.build();
            LOG.fine(() -> "standard registry: " + registry.functions.size() + " functions, "
                + registry.environments.size() + " environments, " + registry.macros.size() + " macros");
            return registry;
        }
    }

    /// The built-in commands, environments and macros.
    public static Registry standard() {
        return Standard.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// A builder seeded with this registry's contents.
    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.functions.putAll(functions);
        builder.environments.putAll(environments);
        builder.macros.putAll(macros);
        builder.htmlBuilders.putAll(htmlBuilders);
        builder.mathmlBuilders.putAll(mathmlBuilders);
        return builder;
    }

    public FunctionSpec function(String name) {
        return functions.get(name);
    }

    public EnvironmentSpec environment(String name) {
        return environments.get(name);
    }

    public Map<String, MacroDefinition> macros() {
        return macros;
    }

    /// Builds the box tree for `group` with the builder registered for its class.
    ///
    /// @throws TexParseException if no builder is registered
    BoxNode buildHtml(ParseNode group, Options options, HtmlBuilder html) {
        @SuppressWarnings("unchecked")
        final var builder = (HtmlGroupBuilder<ParseNode>) htmlBuilders.get(group.getClass());
        if (builder == null) {
            throw new TexParseException("Got group of unknown type: '" + group.type() + "'", group);
        }
        return builder.build(group, options, html);
    }

    /// Builds the MathML tree for `group` with the builder registered for its class.
    ///
    /// @throws TexParseException if no builder is registered
    MathDomNode buildMathMl(ParseNode group, Options options, MathMlBuilder mathml) {
        @SuppressWarnings("unchecked")
        final var builder = (MathMlGroupBuilder<ParseNode>) mathmlBuilders.get(group.getClass());
        if (builder == null) {
            throw new TexParseException("Got group of unknown type: '" + group.type() + "'", group);
        }
        return builder.build(group, options, mathml);
    }

    /// Accumulates registrations. Functions, environments and builders may be
    /// registered once per name or class; macros may be redefined.
    public static final class Builder {
        private final Map<String, FunctionSpec> functions = new HashMap<>();
        private final Map<String, EnvironmentSpec> environments = new HashMap<>();
        private final Map<String, MacroDefinition> macros = new HashMap<>();
        private final Map<Class<?>, HtmlGroupBuilder<?>> htmlBuilders = new HashMap<>();
        private final Map<Class<?>, MathMlGroupBuilder<?>> mathmlBuilders = new HashMap<>();

        private Builder() {}

        /// @throws IllegalArgumentException if any of the names is already a function
        public Builder defineFunction(FunctionSpec spec) {
            Objects.requireNonNull(spec, "spec must not be null");
            for (final String name : spec.names()) {
                if (functions.containsKey(name)) {
                    throw new IllegalArgumentException("Function " + name + " is already defined");
                }
            }
            for (final String name : spec.names()) {
                functions.put(name, spec);
            }
            return this;
        }

        /// @throws IllegalArgumentException if any of the names is already an environment
        public Builder defineEnvironment(EnvironmentSpec spec) {
            Objects.requireNonNull(spec, "spec must not be null");
            for (final String name : spec.names()) {
                if (environments.containsKey(name)) {
                    throw new IllegalArgumentException("Environment " + name + " is already defined");
                }
            }
            for (final String name : spec.names()) {
                environments.put(name, spec);
            }
            return this;
        }

        public Builder defineMacro(String name, MacroDefinition definition) {
            macros.put(Objects.requireNonNull(name, "name must not be null"),
                Objects.requireNonNull(definition, "definition must not be null"));
            return this;
        }

        public Builder defineMacro(String name, String body) {
            return defineMacro(name, MacroDefinition.text(body));
        }

        /// Registers the output builders for a parse node class.
        ///
        /// @throws IllegalArgumentException if the class already has builders
        public <N extends ParseNode> Builder defineBuilders(Class<N> type, HtmlGroupBuilder<N> html,
                                                            MathMlGroupBuilder<N> mathml) {
            Objects.requireNonNull(type, "type must not be null");
            if (htmlBuilders.containsKey(type) || mathmlBuilders.containsKey(type)) {
                throw new IllegalArgumentException("Builders for " + type.getSimpleName() + " are already defined");
            }
            htmlBuilders.put(type, Objects.requireNonNull(html, "html builder must not be null"));
            mathmlBuilders.put(type, Objects.requireNonNull(mathml, "mathml builder must not be null"));
            return this;
        }

        public Registry build() {
            return new Registry(this);
        }
    }
}
