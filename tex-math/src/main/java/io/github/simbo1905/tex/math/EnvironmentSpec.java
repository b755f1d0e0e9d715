package io.github.simbo1905.tex.math;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// An environment registration for `\begin{name}...\end{name}`.
public record EnvironmentSpec(
    List<String> names,
    int numArgs,
    int numOptionalArgs,
    List<ArgType> argTypes,
    boolean allowedInText,
    EnvironmentHandler handler
) {

    public EnvironmentSpec {
        names = List.copyOf(names);
        Objects.requireNonNull(handler, "handler must not be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("an environment needs at least one name");
        }
        argTypes = argTypes == null ? null : List.copyOf(argTypes);
    }

    /// An environment without arguments.
    public static EnvironmentSpec of(EnvironmentHandler handler, String... names) {
        return new EnvironmentSpec(Arrays.asList(names), 0, 0, null, false, handler);
    }

    /// The spec as a function spec, so the parser can read its arguments the same way.
    FunctionSpec asArguments() {
        return new FunctionSpec("environment", names, numArgs, numOptionalArgs, argTypes, false, allowedInText,
            true, false, false, (context, args, optArgs) -> null);
    }
}
