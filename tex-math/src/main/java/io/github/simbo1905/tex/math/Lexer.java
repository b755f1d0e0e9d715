package io.github.simbo1905.tex.math;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Splits TeX input into tokens on demand.
///
/// Token classes, in order of precedence:
/// - a run of whitespace becomes a single `" "` token
/// - `\` followed by whitespace (at most one newline) is a control space `"\\ "`
/// - `\verb` and `\verb*` with a delimiter closed on the same line form one token
/// - a control word `\[a-zA-Z@]+` swallows the whitespace after it
/// - `\` followed by any other character is a control symbol
/// - any other character, or surrogate pair, plus trailing combining marks
///
/// Category codes decide the rest: catcode 14 starts a comment running to the
/// end of the line, catcode 13 marks an active character for the expander.
final class Lexer {

    static final int CATCODE_ACTIVE = 13;
    static final int CATCODE_COMMENT = 14;
    static final int CATCODE_OTHER = 12;

    private final String input;
    private final Settings settings;
    private final Map<String, Integer> catcodes = new HashMap<>();
    private int pos;

    Lexer(String input, Settings settings) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        catcodes.put("%", CATCODE_COMMENT);
        catcodes.put("~", CATCODE_ACTIVE);
    }

    String input() {
        return input;
    }

    void setCatcode(String ch, int code) {
        catcodes.put(ch, code);
    }

    /// Returns the category code for single-character text, or -1 if unset.
    int catcode(String ch) {
        final Integer code = catcodes.get(ch);
        return code == null ? -1 : code;
    }

    /// Lexes one token. Returns an `EOF` token (with an empty span at the end
    /// of input) once the input is used up, and keeps returning it.
    Token lex() {
        while (true) {
            if (pos >= input.length()) {
                return new Token("EOF", new SourceLocation(input, input.length(), input.length()));
            }
            final int start = pos;
            final String text = scan();
            if (catcode(text) == CATCODE_COMMENT) {
                final int newline = input.indexOf('\n', pos);
                if (newline == -1) {
                    pos = input.length();
                    settings.reportNonstrict("commentAtEnd",
                        "% comment has no terminating newline; LaTeX would fail because of "
                            + "commenting the end of math mode (e.g. $)",
                        null);
                } else {
                    pos = newline + 1;
                }
                continue;
            }
            return new Token(text, new SourceLocation(input, start, pos));
        }
    }

    private String scan() {
        final int start = pos;
        final char c = input.charAt(pos);
        if (isSpace(c)) {
            while (pos < input.length() && isSpace(input.charAt(pos))) {
                pos++;
            }
            return " ";
        }
        if (c == '\\') {
            return scanBackslash();
        }
        if (Character.isHighSurrogate(c)) {
            if (pos + 1 < input.length() && Character.isLowSurrogate(input.charAt(pos + 1))) {
                pos += 2;
                skipCombiningMarks();
                return input.substring(start, pos);
            }
            throw unexpected(pos);
        }
        if (!isSingleCodepoint(c)) {
            throw unexpected(pos);
        }
        pos++;
        skipCombiningMarks();
        return input.substring(start, pos);
    }

    private String scanBackslash() {
        final int start = pos;
        if (pos + 1 >= input.length()) {
            throw unexpected(pos);
        }
        final char next = input.charAt(pos + 1);

        // control space: \ followed by spaces/tabs and at most one newline
        if (next == '\n' || next == ' ' || next == '\r' || next == '\t') {
            int p = pos + 1;
            if (input.charAt(p) == '\n') {
                p++;
            } else {
                while (p < input.length() && isBlank(input.charAt(p))) {
                    p++;
                }
                if (p < input.length() && input.charAt(p) == '\n') {
                    p++;
                }
            }
            while (p < input.length() && isBlank(input.charAt(p))) {
                p++;
            }
            pos = p;
            return "\\ ";
        }

        if (isLetter(next)) {
            final String verb = scanVerb();
            if (verb != null) {
                return verb;
            }
            int p = pos + 1;
            while (p < input.length() && isLetter(input.charAt(p))) {
                p++;
            }
            final String word = input.substring(start, p);
            while (p < input.length() && isSpace(input.charAt(p))) {
                p++;
            }
            pos = p;
            return word;
        }

        if (Character.isSurrogate(next)) {
            throw unexpected(pos);
        }
        pos += 2;
        return input.substring(start, pos);
    }

    /// `\verb*<d>...<d>` or `\verb<d>...<d>`, closed on the same line, else null.
    private String scanVerb() {
        if (!input.startsWith("\\verb", pos)) {
            return null;
        }
        int p = pos + 5;
        final boolean star = p < input.length() && input.charAt(p) == '*';
        if (star) {
            p++;
        }
        if (p >= input.length()) {
            return null;
        }
        final char delim = input.charAt(p);
        if (!star && (delim == '*' || isAsciiLetter(delim))) {
            return null;
        }
        if (delim == '\n' || Character.isSurrogate(delim)) {
            return null;
        }
        final int close = input.indexOf(delim, p + 1);
        final int newline = input.indexOf('\n', p + 1);
        if (close == -1 || (newline != -1 && newline < close)) {
            return null;
        }
        final int start = pos;
        pos = close + 1;
        return input.substring(start, pos);
    }

    private void skipCombiningMarks() {
        while (pos < input.length() && isCombiningMark(input.charAt(pos))) {
            pos++;
        }
    }

    private LexException unexpected(int at) {
        final int end = Math.min(at + 1, input.length());
        return new LexException("Unexpected character: '" + input.substring(at, end) + "'",
            new SourceLocation(input, at, end));
    }

    static boolean isCombiningMark(char c) {
        return c >= '\u0300' && c <= '\u036f';
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\r' || c == '\n' || c == '\t';
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\r' || c == '\t';
    }

    private static boolean isLetter(char c) {
        return isAsciiLetter(c) || c == '@';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isSingleCodepoint(char c) {
        return (c >= '!' && c <= '[')
            || (c >= ']' && c <= '\u2027')
            || (c >= '\u202a' && c <= '\ud7ff')
            || (c >= '\uf900' && c <= '\uffff');
    }
}
