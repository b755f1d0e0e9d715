package io.github.simbo1905.tex.math;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Static glyph metrics keyed by font name and code point, plus the TeX font
/// parameters (sigma and xi values) for the three size classes.
///
/// Data is read once from `fontMetrics.json` on first use.
final class FontMetrics {

    private static final String RESOURCE = "fontMetrics.json";

    /// Per-glyph metrics in em.
    record CharacterMetrics(double depth, double height, double italic, double skew, double width) {
    }

    /// TeX font parameters for one size class, in em.
    record GlobalMetrics(
        double slant,
        double space,
        double stretch,
        double shrink,
        double xHeight,
        double quad,
        double extraSpace,
        double num1,
        double num2,
        double num3,
        double denom1,
        double denom2,
        double sup1,
        double sup2,
        double sup3,
        double sub1,
        double sub2,
        double supDrop,
        double subDrop,
        double delim1,
        double delim2,
        double axisHeight,
        double defaultRuleThickness,
        double bigOpSpacing1,
        double bigOpSpacing2,
        double bigOpSpacing3,
        double bigOpSpacing4,
        double bigOpSpacing5,
        double sqrtRuleThickness,
        double ptPerEm,
        double doubleRuleSep,
        double arrayRuleWidth,
        double fboxsep,
        double fboxrule
    ) {
        /// One math unit is 1/18 of a quad.
        double cssEmPerMu() {
            return quad / 18;
        }
    }

    private FontMetrics() {}

    private static final class Data {
        static final Map<String, Map<Integer, CharacterMetrics>> CHARACTERS;
        static final GlobalMetrics[] GLOBALS = new GlobalMetrics[3];

        static {
            final var mapper = new ObjectMapper();
            try (InputStream in = FontMetrics.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + RESOURCE);
                }
                final JsonNode root = mapper.readTree(in);
                CHARACTERS = readCharacters(root.get("characters"));
                final JsonNode sigmas = root.get("sigmas");
                for (int i = 0; i < GLOBALS.length; i++) {
                    GLOBALS[i] = readGlobals(sigmas, i);
                }
                LOG.fine(() -> "loaded metrics for " + CHARACTERS.size() + " fonts");
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + RESOURCE, e);
            }
        }

        private static Map<String, Map<Integer, CharacterMetrics>> readCharacters(JsonNode fonts) {
            final Map<String, Map<Integer, CharacterMetrics>> result = new HashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> it = fonts.fields();
            while (it.hasNext()) {
                final var font = it.next();
                final Map<Integer, CharacterMetrics> glyphs = new HashMap<>();
                final Iterator<Map.Entry<String, JsonNode>> glyphIt = font.getValue().fields();
                while (glyphIt.hasNext()) {
                    final var glyph = glyphIt.next();
                    final JsonNode v = glyph.getValue();
                    glyphs.put(Integer.parseInt(glyph.getKey()), new CharacterMetrics(
                        v.get(0).asDouble(), v.get(1).asDouble(), v.get(2).asDouble(),
                        v.get(3).asDouble(), v.get(4).asDouble()));
                }
                result.put(font.getKey(), Map.copyOf(glyphs));
            }
            return Map.copyOf(result);
        }

        private static GlobalMetrics readGlobals(JsonNode s, int i) {
            return new GlobalMetrics(
                s.get("slant").get(i).asDouble(),
                s.get("space").get(i).asDouble(),
                s.get("stretch").get(i).asDouble(),
                s.get("shrink").get(i).asDouble(),
                s.get("xHeight").get(i).asDouble(),
                s.get("quad").get(i).asDouble(),
                s.get("extraSpace").get(i).asDouble(),
                s.get("num1").get(i).asDouble(),
                s.get("num2").get(i).asDouble(),
                s.get("num3").get(i).asDouble(),
                s.get("denom1").get(i).asDouble(),
                s.get("denom2").get(i).asDouble(),
                s.get("sup1").get(i).asDouble(),
                s.get("sup2").get(i).asDouble(),
                s.get("sup3").get(i).asDouble(),
                s.get("sub1").get(i).asDouble(),
                s.get("sub2").get(i).asDouble(),
                s.get("supDrop").get(i).asDouble(),
                s.get("subDrop").get(i).asDouble(),
                s.get("delim1").get(i).asDouble(),
                s.get("delim2").get(i).asDouble(),
                s.get("axisHeight").get(i).asDouble(),
                s.get("defaultRuleThickness").get(i).asDouble(),
                s.get("bigOpSpacing1").get(i).asDouble(),
                s.get("bigOpSpacing2").get(i).asDouble(),
                s.get("bigOpSpacing3").get(i).asDouble(),
                s.get("bigOpSpacing4").get(i).asDouble(),
                s.get("bigOpSpacing5").get(i).asDouble(),
                s.get("sqrtRuleThickness").get(i).asDouble(),
                s.get("ptPerEm").get(i).asDouble(),
                s.get("doubleRuleSep").get(i).asDouble(),
                s.get("arrayRuleWidth").get(i).asDouble(),
                s.get("fboxsep").get(i).asDouble(),
                s.get("fboxrule").get(i).asDouble());
        }
    }

    static boolean hasFont(String font) {
        return Data.CHARACTERS.containsKey(font);
    }

    /// Parameters for size level 1..11: sizes 5 and up use the text column,
    /// 3 and 4 the script column, smaller sizes the scriptscript column.
    static GlobalMetrics global(int size) {
        final int index = size >= 5 ? 0 : size >= 3 ? 1 : 2;
        return Data.GLOBALS[index];
    }

    /// Looks up the metrics of the first character of `character` in `font`.
    ///
    /// Accented letters fall back to their base letter. In text mode a code
    /// point from a supported script borrows the metrics of `M`. Returns null
    /// when nothing matches.
    ///
    /// @throws IllegalArgumentException if the font is unknown
    static CharacterMetrics character(String character, String font, Mode mode) {
        final Map<Integer, CharacterMetrics> glyphs = Data.CHARACTERS.get(font);
        if (glyphs == null) {
            throw new IllegalArgumentException("Font metrics not found for font: " + font + ".");
        }
        final int ch = character.codePointAt(0);
        CharacterMetrics metrics = glyphs.get(ch);
        if (metrics == null) {
            final int base = baseLetter(ch);
            if (base != ch) {
                metrics = glyphs.get(base);
            }
        }
        if (metrics == null && mode == Mode.TEXT && UnicodeData.supportedCodepoint(ch)) {
            metrics = glyphs.get((int) 'M');
        }
        return metrics;
    }

    private static int baseLetter(int codepoint) {
        if (codepoint < 0xc0) {
            return codepoint;
        }
        final String decomposed = Normalizer.normalize(new String(Character.toChars(codepoint)), Normalizer.Form.NFD);
        return decomposed.codePointAt(0);
    }
}
