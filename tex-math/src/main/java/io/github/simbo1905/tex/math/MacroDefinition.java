package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Objects;

/// What a macro name expands to.
public sealed interface MacroDefinition {

    /// TeX source lexed on every use. Its arity is the highest `#n` present,
    /// ignoring `##` escapes.
    record Text(String body) implements MacroDefinition {
        public Text {
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /// A fixed token list in reading order with a declared arity.
    ///
    /// @param tokens       replacement tokens, `#` followed by a digit marks a parameter
    /// @param numArgs      number of parameters, 0 to 9
    /// @param delimiters   null for undelimited parameters, else `numArgs + 1` token-text
    ///                     lists: the text required before `#1`, then the text ending each parameter
    /// @param unexpandable stop expandable-only contexts from expanding the result, as for
    ///                     `\let` copies of primitives
    record Expansion(List<Token> tokens, int numArgs, List<List<String>> delimiters, boolean unexpandable)
        implements MacroDefinition {
        public Expansion {
            tokens = List.copyOf(tokens);
            if (numArgs < 0 || numArgs > 9) {
                throw new IllegalArgumentException("numArgs must be between 0 and 9, got " + numArgs);
            }
            if (delimiters != null) {
                if (delimiters.size() != numArgs + 1) {
                    throw new IllegalArgumentException("The length of delimiters doesn't match the number of args!");
                }
                delimiters = delimiters.stream().map(List::copyOf).toList();
            }
        }

        public Expansion(List<Token> tokens, int numArgs) {
            this(tokens, numArgs, null, false);
        }
    }

    /// Computed on every use from the live expansion state.
    record Callback(MacroFunction function) implements MacroDefinition {
        public Callback {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    static MacroDefinition text(String body) {
        return new Text(body);
    }

    static MacroDefinition callback(MacroFunction function) {
        return new Callback(function);
    }
}
