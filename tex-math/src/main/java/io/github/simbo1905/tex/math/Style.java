package io.github.simbo1905.tex.math;

/// The eight TeX math styles: display, text, script and scriptscript, each
/// with a cramped variant.
///
/// Transitions are pure table lookups.
public enum Style {
    DISPLAY(0, 0, false),
    DISPLAY_CRAMPED(1, 0, true),
    TEXT(2, 1, false),
    TEXT_CRAMPED(3, 1, true),
    SCRIPT(4, 2, false),
    SCRIPT_CRAMPED(5, 2, true),
    SCRIPTSCRIPT(6, 3, false),
    SCRIPTSCRIPT_CRAMPED(7, 3, true);

    private static final int[] SUP = {4, 5, 4, 5, 6, 7, 6, 7};
    private static final int[] SUB = {5, 5, 5, 5, 7, 7, 7, 7};
    private static final int[] FRAC_NUM = {2, 3, 4, 5, 6, 7, 6, 7};
    private static final int[] FRAC_DEN = {3, 3, 5, 5, 7, 7, 7, 7};
    private static final int[] CRAMP = {1, 1, 3, 3, 5, 5, 7, 7};
    private static final int[] TEXT_OF = {0, 1, 2, 3, 2, 3, 2, 3};

    private final int id;
    private final int size;
    private final boolean cramped;

    Style(int id, int size, boolean cramped) {
        this.id = id;
        this.size = size;
        this.cramped = cramped;
    }

    public int id() {
        return id;
    }

    /// 0 for display, 1 for text, 2 for script, 3 for scriptscript.
    public int size() {
        return size;
    }

    public boolean cramped() {
        return cramped;
    }

    public Style sup() {
        return values()[SUP[id]];
    }

    public Style sub() {
        return values()[SUB[id]];
    }

    public Style fracNum() {
        return values()[FRAC_NUM[id]];
    }

    public Style fracDen() {
        return values()[FRAC_DEN[id]];
    }

    public Style cramp() {
        return values()[CRAMP[id]];
    }

    /// The text-or-display style at the same crampedness.
    public Style text() {
        return values()[TEXT_OF[id]];
    }

    /// Script and scriptscript styles are tight.
    public boolean isTight() {
        return size >= 2;
    }
}
