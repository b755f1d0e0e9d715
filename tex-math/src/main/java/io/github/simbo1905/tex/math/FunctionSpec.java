package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A command registration: its names, arguments, where it may appear and the
/// handler that builds its parse node.
///
/// @param type              a short kind name for diagnostics, like `genfrac`
/// @param argTypes          types for optional then required arguments; null
///                          means every argument is read in the current mode
/// @param allowedInArgument whether the command may stand alone as an argument,
///                          as in `\frac\alpha\beta`
/// @param infix             whether the command splits its enclosing group, like `\over`
/// @param primitive         whether untyped arguments are read as single groups
///                          and the command cannot be expanded
public record FunctionSpec(
    String type,
    List<String> names,
    int numArgs,
    int numOptionalArgs,
    List<ArgType> argTypes,
    boolean allowedInArgument,
    boolean allowedInText,
    boolean allowedInMath,
    boolean infix,
    boolean primitive,
    FunctionHandler handler
) {

    public FunctionSpec {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("a function needs at least one name");
        }
        if (numArgs < 0 || numOptionalArgs < 0) {
            throw new IllegalArgumentException("argument counts must not be negative");
        }
        if (argTypes != null) {
            argTypes = List.copyOf(argTypes);
            if (argTypes.size() > numArgs + numOptionalArgs) {
                throw new IllegalArgumentException("more argument types than arguments for " + names.get(0));
            }
        }
    }

    /// The type of argument `i` counting optional arguments first, or null.
    ArgType argType(int i) {
        return argTypes != null && i < argTypes.size() ? argTypes.get(i) : null;
    }

    public static Builder builder(String type, String... names) {
        return new Builder(type, Arrays.asList(names));
    }

    /// Fluent construction; defaults to a math-only command without arguments.
    public static final class Builder {
        private final String type;
        private final List<String> names;
        private int numArgs;
        private int numOptionalArgs;
        private List<ArgType> argTypes;
        private boolean allowedInArgument;
        private boolean allowedInText;
        private boolean allowedInMath = true;
        private boolean infix;
        private boolean primitive;

        private Builder(String type, List<String> names) {
            this.type = type;
            this.names = new ArrayList<>(names);
        }

        public Builder numArgs(int value) {
            this.numArgs = value;
            return this;
        }

        public Builder numOptionalArgs(int value) {
            this.numOptionalArgs = value;
            return this;
        }

        public Builder argTypes(ArgType... value) {
            this.argTypes = Arrays.asList(value);
            return this;
        }

        public Builder allowedInArgument(boolean value) {
            this.allowedInArgument = value;
            return this;
        }

        public Builder allowedInText(boolean value) {
            this.allowedInText = value;
            return this;
        }

        public Builder allowedInMath(boolean value) {
            this.allowedInMath = value;
            return this;
        }

        public Builder infix(boolean value) {
            this.infix = value;
            return this;
        }

        public Builder primitive(boolean value) {
            this.primitive = value;
            return this;
        }

        public FunctionSpec handler(FunctionHandler handler) {
            return new FunctionSpec(type, names, numArgs, numOptionalArgs, argTypes, allowedInArgument,
                allowedInText, allowedInMath, infix, primitive, handler);
        }
    }
}
