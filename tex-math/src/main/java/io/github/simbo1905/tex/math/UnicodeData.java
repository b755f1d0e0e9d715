package io.github.simbo1905.tex.math;

import java.util.Map;

/// Unicode tables used by the lexer, parser and builders.
final class UnicodeData {

    private UnicodeData() {}

    /// Scripts whose glyphs are rendered through a fallback font.
    enum Script {
        LATIN(new int[][]{{0x0100, 0x024f}, {0x0300, 0x036f}}),
        CYRILLIC(new int[][]{{0x0400, 0x04ff}}),
        ARMENIAN(new int[][]{{0x0530, 0x058f}}),
        BRAHMIC(new int[][]{{0x0900, 0x109f}}),
        GEORGIAN(new int[][]{{0x10a0, 0x10ff}}),
        CJK(new int[][]{{0x3000, 0x30ff}, {0x4e00, 0x9faf}, {0xff00, 0xff60}}),
        HANGUL(new int[][]{{0xac00, 0xd7af}});

        private final int[][] ranges;

        Script(int[][] ranges) {
            this.ranges = ranges;
        }

        boolean contains(int codepoint) {
            for (final int[] range : ranges) {
                if (codepoint >= range[0] && codepoint <= range[1]) {
                    return true;
                }
            }
            return false;
        }

        String cssName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    static Script scriptFromCodepoint(int codepoint) {
        for (final Script script : Script.values()) {
            if (script.contains(codepoint)) {
                return script;
            }
        }
        return null;
    }

    static boolean supportedCodepoint(int codepoint) {
        return scriptFromCodepoint(codepoint) != null;
    }

    /// Unicode superscript characters and the plain text they stand for.
    static final Map<Character, String> SUPERSCRIPTS = Map.ofEntries(
        Map.entry('⁰', "0"), Map.entry('¹', "1"), Map.entry('²', "2"), Map.entry('³', "3"),
        Map.entry('⁴', "4"), Map.entry('⁵', "5"), Map.entry('⁶', "6"), Map.entry('⁷', "7"),
        Map.entry('⁸', "8"), Map.entry('⁹', "9"), Map.entry('⁺', "+"), Map.entry('⁻', "-"),
        Map.entry('⁼', "="), Map.entry('⁽', "("), Map.entry('⁾', ")"), Map.entry('ⁿ', "n"),
        Map.entry('ⁱ', "i"), Map.entry('ᵃ', "a"), Map.entry('ᵇ', "b"), Map.entry('ᶜ', "c"),
        Map.entry('ᵈ', "d"), Map.entry('ᵉ', "e"), Map.entry('ᶠ', "f"), Map.entry('ᵍ', "g"),
        Map.entry('ʰ', "h"), Map.entry('ʲ', "j"), Map.entry('ᵏ', "k"), Map.entry('ˡ', "l"),
        Map.entry('ᵐ', "m"), Map.entry('ᵒ', "o"), Map.entry('ᵖ', "p"), Map.entry('ʳ', "r"),
        Map.entry('ˢ', "s"), Map.entry('ᵗ', "t"), Map.entry('ᵘ', "u"), Map.entry('ᵛ', "v"),
        Map.entry('ʷ', "w"), Map.entry('ˣ', "x"), Map.entry('ʸ', "y"), Map.entry('ᶻ', "z"),
        Map.entry('ᴬ', "A"), Map.entry('ᴮ', "B"), Map.entry('ᴰ', "D"), Map.entry('ᴱ', "E"),
        Map.entry('ᴳ', "G"), Map.entry('ᴴ', "H"), Map.entry('ᴵ', "I"), Map.entry('ᴶ', "J"),
        Map.entry('ᴷ', "K"), Map.entry('ᴸ', "L"), Map.entry('ᴹ', "M"), Map.entry('ᴺ', "N"),
        Map.entry('ᴼ', "O"), Map.entry('ᴾ', "P"), Map.entry('ᴿ', "R"), Map.entry('ᵀ', "T"),
        Map.entry('ᵁ', "U"), Map.entry('ⱽ', "V"), Map.entry('ᵂ', "W"), Map.entry('ᵝ', "β"),
        Map.entry('ᵞ', "γ"), Map.entry('ᵟ', "δ"), Map.entry('ᵠ', "ϕ"), Map.entry('ᵡ', "χ"),
        Map.entry('ᶿ', "θ"));

    /// Unicode subscript characters and the plain text they stand for.
    static final Map<Character, String> SUBSCRIPTS = Map.ofEntries(
        Map.entry('₀', "0"), Map.entry('₁', "1"), Map.entry('₂', "2"), Map.entry('₃', "3"),
        Map.entry('₄', "4"), Map.entry('₅', "5"), Map.entry('₆', "6"), Map.entry('₇', "7"),
        Map.entry('₈', "8"), Map.entry('₉', "9"), Map.entry('₊', "+"), Map.entry('₋', "-"),
        Map.entry('₌', "="), Map.entry('₍', "("), Map.entry('₎', ")"), Map.entry('ₐ', "a"),
        Map.entry('ₑ', "e"), Map.entry('ₕ', "h"), Map.entry('ᵢ', "i"), Map.entry('ⱼ', "j"),
        Map.entry('ₖ', "k"), Map.entry('ₗ', "l"), Map.entry('ₘ', "m"), Map.entry('ₙ', "n"),
        Map.entry('ₒ', "o"), Map.entry('ₚ', "p"), Map.entry('ᵣ', "r"), Map.entry('ₛ', "s"),
        Map.entry('ₜ', "t"), Map.entry('ᵤ', "u"), Map.entry('ᵥ', "v"), Map.entry('ₓ', "x"),
        Map.entry('ᵦ', "β"), Map.entry('ᵧ', "γ"), Map.entry('ᵨ', "ρ"), Map.entry('ᵩ', "ϕ"),
        Map.entry('ᵪ', "χ"));

    /// A combining accent and the commands applying it in text and math mode.
    /// `math` is null where only a text accent exists.
    record CombiningAccent(String text, String math) {
    }

    static final Map<Character, CombiningAccent> COMBINING_ACCENTS = Map.ofEntries(
        Map.entry('\u0301', new CombiningAccent("\\'", "\\acute")),
        Map.entry('\u0300', new CombiningAccent("\\`", "\\grave")),
        Map.entry('\u0308', new CombiningAccent("\\\"", "\\ddot")),
        Map.entry('\u0303', new CombiningAccent("\\~", "\\tilde")),
        Map.entry('\u0304', new CombiningAccent("\\=", "\\bar")),
        Map.entry('\u0306', new CombiningAccent("\\u", "\\breve")),
        Map.entry('\u030c', new CombiningAccent("\\v", "\\check")),
        Map.entry('\u0302', new CombiningAccent("\\^", "\\hat")),
        Map.entry('\u0307', new CombiningAccent("\\.", "\\dot")),
        Map.entry('\u030a', new CombiningAccent("\\r", "\\mathring")),
        Map.entry('\u030b', new CombiningAccent("\\H", null)));
}
