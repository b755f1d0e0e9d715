package io.github.simbo1905.tex.math;

import java.util.List;
import java.util.Objects;

/// The layout context of one node: math style, size level, font selection,
/// colour and phantom flag.
///
/// Every transition returns a new value; an unchanged transition returns `this`.
///
/// @param size     size level 1..11, where 6 is normal size
/// @param textSize the size level that text style resolves to at this point
/// @param color    the active colour, or null
/// @param font     explicit math font such as `mathbf`, or empty
public record Options(
    Style style,
    String color,
    int size,
    int textSize,
    boolean phantom,
    String font,
    String fontFamily,
    String fontWeight,
    String fontShape,
    double maxSize,
    double minRuleThickness
) {

    public static final int BASESIZE = 6;

    private static final int[][] SIZE_STYLE_MAP = {
        {1, 1, 1},
        {2, 1, 1},
        {3, 1, 1},
        {4, 2, 1},
        {5, 2, 1},
        {6, 3, 1},
        {7, 4, 2},
        {8, 6, 3},
        {9, 7, 6},
        {10, 8, 7},
        {11, 10, 9},
    };

    private static final double[] SIZE_MULTIPLIERS = {
        0.5, 0.6, 0.7, 0.8, 0.9, 1.0, 1.2, 1.44, 1.728, 2.074, 2.488,
    };

    public Options {
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(font, "font must not be null");
        Objects.requireNonNull(fontFamily, "fontFamily must not be null");
        Objects.requireNonNull(fontWeight, "fontWeight must not be null");
        Objects.requireNonNull(fontShape, "fontShape must not be null");
        if (size < 1 || size > SIZE_MULTIPLIERS.length) {
            throw new IllegalArgumentException("size must be between 1 and 11, was " + size);
        }
        if (textSize < 1 || textSize > SIZE_MULTIPLIERS.length) {
            throw new IllegalArgumentException("textSize must be between 1 and 11, was " + textSize);
        }
    }

    /// Top-level options for a render.
    static Options forSettings(Settings settings) {
        return new Options(settings.displayMode() ? Style.DISPLAY : Style.TEXT, null, BASESIZE, BASESIZE,
            false, "", "", "", "", settings.maxSize(), settings.minRuleThickness());
    }

    static int sizeAtStyle(int size, Style style) {
        return style.size() < 2 ? size : SIZE_STYLE_MAP[size - 1][style.size() - 1];
    }

    public double sizeMultiplier() {
        return SIZE_MULTIPLIERS[size - 1];
    }

    FontMetrics.GlobalMetrics fontMetrics() {
        return FontMetrics.global(size);
    }

    private Options with(Style newStyle, String newColor, int newSize, int newTextSize, boolean newPhantom,
                         String newFont, String newFamily, String newWeight, String newShape) {
        return new Options(newStyle, newColor, newSize, newTextSize, newPhantom, newFont, newFamily,
            newWeight, newShape, maxSize, minRuleThickness);
    }

    public Options havingStyle(Style newStyle) {
        if (style == newStyle) {
            return this;
        }
        return with(newStyle, color, sizeAtStyle(textSize, newStyle), textSize, phantom, font, fontFamily,
            fontWeight, fontShape);
    }

    public Options havingCrampedStyle() {
        return havingStyle(style.cramp());
    }

    /// Switches size level, resetting the style to its text variant.
    public Options havingSize(int newSize) {
        if (size == newSize && textSize == newSize) {
            return this;
        }
        return with(style.text(), color, newSize, newSize, phantom, font, fontFamily, fontWeight, fontShape);
    }

    /// Options at base size for `newStyle` (text style when null), used where
    /// glyphs must come out at a fixed size such as delimiters and big operators.
    public Options havingBaseStyle(Style newStyle) {
        final Style target = newStyle == null ? style.text() : newStyle;
        final int wantSize = sizeAtStyle(BASESIZE, target);
        if (size == wantSize && textSize == BASESIZE && style == target) {
            return this;
        }
        return with(target, color, wantSize, BASESIZE, phantom, font, fontFamily, fontWeight, fontShape);
    }

    /// Options whose size matches the current style at base size.
    public Options havingBaseSizing() {
        final int newSize = switch (style.id()) {
            case 4, 5 -> 3;
            case 6, 7 -> 1;
            default -> 6;
        };
        return with(style.text(), color, newSize, textSize, phantom, font, fontFamily, fontWeight, fontShape);
    }

    public Options withColor(String newColor) {
        return with(style, newColor, size, textSize, phantom, font, fontFamily, fontWeight, fontShape);
    }

    public Options withPhantom() {
        return with(style, color, size, textSize, true, font, fontFamily, fontWeight, fontShape);
    }

    public Options withFont(String newFont) {
        return with(style, color, size, textSize, phantom, newFont, fontFamily, fontWeight, fontShape);
    }

    public Options withTextFontFamily(String family) {
        return with(style, color, size, textSize, phantom, "", family, fontWeight, fontShape);
    }

    public Options withTextFontWeight(String weight) {
        return with(style, color, size, textSize, phantom, "", fontFamily, weight, fontShape);
    }

    public Options withTextFontShape(String shape) {
        return with(style, color, size, textSize, phantom, "", fontFamily, fontWeight, shape);
    }

    /// CSS classes that move from `old`'s size to this one.
    List<String> sizingClasses(Options old) {
        if (old.size != size) {
            return List.of("sizing", "reset-size" + old.size, "size" + size);
        }
        return List.of();
    }

    /// CSS classes that move from this size back to base size.
    List<String> baseSizingClasses() {
        if (size != BASESIZE) {
            return List.of("sizing", "reset-size" + size, "size" + BASESIZE);
        }
        return List.of();
    }

    /// The colour to paint with; phantoms are transparent.
    public String getColor() {
        return phantom ? "transparent" : color;
    }
}
