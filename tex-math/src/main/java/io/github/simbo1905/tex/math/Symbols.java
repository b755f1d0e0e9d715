package io.github.simbo1905.tex.math;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// The symbol table: for each mode, the font, group and replacement glyph of
/// every character and symbol command.
final class Symbols {

    private static final String RESOURCE = "symbols.json";

    /// Groups that map straight onto a TeX atom class.
    static final Set<String> ATOMS = Set.of("bin", "close", "inner", "open", "punct", "rel");

    /// A symbol entry. `replace` is the glyph to render, or null when the name is
    /// its own glyph.
    record Symbol(String font, String group, String replace) {
        boolean isAtom() {
            return ATOMS.contains(group);
        }
    }

    private Symbols() {}

    private static final class Data {
        static final Map<String, Symbol> MATH;
        static final Map<String, Symbol> TEXT;
        static final Set<String> LIGATURES;

        static {
            final var mapper = new ObjectMapper();
            try (InputStream in = Symbols.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + RESOURCE);
                }
                final JsonNode root = mapper.readTree(in);
                MATH = readMode(root.get("math"));
                TEXT = readMode(root.get("text"));
                final Set<String> ligatures = new HashSet<>();
                root.get("ligatures").forEach(node -> ligatures.add(node.asText()));
                LIGATURES = Set.copyOf(ligatures);
                LOG.fine(() -> "loaded " + MATH.size() + " math and " + TEXT.size() + " text symbols");
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + RESOURCE, e);
            }
        }

        private static Map<String, Symbol> readMode(JsonNode node) {
            final Map<String, Symbol> result = new HashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                final var entry = it.next();
                final JsonNode value = entry.getValue();
                final JsonNode replace = value.get("replace");
                result.put(entry.getKey(), new Symbol(
                    value.get("font").asText(),
                    value.get("group").asText(),
                    replace == null || replace.isNull() ? null : replace.asText()));
            }
            return Map.copyOf(result);
        }
    }

    static Symbol get(Mode mode, String name) {
        return (mode == Mode.MATH ? Data.MATH : Data.TEXT).get(name);
    }

    static boolean contains(Mode mode, String name) {
        return get(mode, name) != null;
    }

    /// Text-mode sequences that combine into a single glyph, like `--`.
    static boolean isLigature(String text) {
        return Data.LIGATURES.contains(text);
    }
}
