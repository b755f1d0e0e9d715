package io.github.simbo1905.tex.math;

import java.util.Map;

/// Outline data for the drawn glyphs: radical signs, stretchy arrows, braces,
/// wide accents and the angle-notation phase sign.
///
/// Horizontal paths are drawn in a viewBox 400000 units wide and clipped by
/// `preserveAspectRatio`, so one outline serves every width.
final class SvgGeometry {

    /// Padding above the vinculum, in viewBox units.
    static final int HLINE_PAD = 80;

    private SvgGeometry() {}

    private static String sqrtMain(double extraVinculum, double hLinePad) {
        return "M95," + fmt(622 + extraVinculum + hLinePad)
            + "c-2.7,0,-7.17,-2.7,-13.5,-8c-5.8,-5.3,-9.5,-10,-9.5,-14"
            + "c0,-2,0.3,-3.3,1,-4c1.3,-2.7,23.83,-20.7,67.5,-54"
            + "c44.2,-33.3,65.8,-50.3,66.5,-51c1.3,-1.3,3,-2,5,-2c4.7,0,8.7,3.3,12,10"
            + "s173,378,173,378c0.7,0,35.3,-71,104,-213c68.7,-142,137.5,-285,206.5,-429"
            + "c69,-144,104.5,-217.7,106.5,-221"
            + "l" + fmt(extraVinculum / 2.075) + " -" + fmt(extraVinculum)
            + "c5.3,-9.3,12,-14,20,-14"
            + "H400000v" + fmt(40 + extraVinculum) + "H845.2724"
            + "s-225.272,467,-225.272,467s-235,486,-235,486c-2.7,4.7,-9,7,-19,7"
            + "c-6,0,-10,-1,-12,-3s-194,-422,-194,-422s-65,47,-65,47z"
            + "M" + fmt(834 + extraVinculum) + " " + fmt(hLinePad) + "h400000v" + fmt(40 + extraVinculum)
            + "h-400000z";
    }

    /// The larger fixed radicals scale the main outline's diagonal to `depth`.
    private static String sqrtSized(double extraVinculum, double hLinePad, double depth) {
        final double foot = depth - 54;
        return "M263," + fmt(601 + extraVinculum + hLinePad)
            + "c0.7,0,18,39.7,52,119c34,79.3,68.167,158.7,102.5,238"
            + "c34.3,79.3,51.8,119.3,52.5,120"
            + "c340," + fmt(-foot) + ",510.7," + fmt(-foot * 1.5) + ",512," + fmt(-foot * 1.5)
            + "l" + fmt(extraVinculum / 2.084) + " -" + fmt(extraVinculum)
            + "c4.7,-7.3,11,-11,19,-11H40000v" + fmt(40 + extraVinculum) + "H1012.3"
            + "s-271.3," + fmt(foot) + ",-271.3," + fmt(foot) + "s-300.7," + fmt(foot * 0.4) + ",-300.7,"
            + fmt(foot * 0.4) + "c-2.7,4.7,-9,7,-19,7c-6,0,-10,-1,-12,-3"
            + "s-159,-346,-159,-346s-50,37,-50,37z"
            + "M" + fmt(1001 + extraVinculum) + " " + fmt(hLinePad) + "h400000v" + fmt(40 + extraVinculum)
            + "h-400000z";
    }

    private static String sqrtTall(double extraVinculum, double hLinePad, double viewBoxHeight) {
        final double vertSegment = viewBoxHeight - 54 - hLinePad - extraVinculum;
        return "M702 " + fmt(extraVinculum + hLinePad) + "H400000" + fmt(40 + extraVinculum)
            + "H742v" + fmt(vertSegment) + "l-4 4-4 4c-.667.7 -2 1.5-4 2.5s-4.167 1.833-6.5 2.5-5.5 1-9.5 1"
            + "h-12l-28-84c-16.667-52-96.667 -294.333-240-727l-212 -643 -85 170"
            + "c-4-3.333-8.333-7.667-13 -13l-13-13l77-155 77-156c66 199.333 139 419.667"
            + " 219 661 l218 661zM702 " + fmt(hLinePad) + "H400000v" + fmt(40 + extraVinculum) + "H742z";
    }

    /// The radical outline for `size` (`sqrtMain`, `sqrtSize1`..`sqrtSize4` or
    /// `sqrtTall`), with the vinculum thickened by `extraVinculum` em.
    static String squareRootPath(String size, double extraVinculum, double viewBoxHeight) {
        final double extra = 1000 * extraVinculum;
        return switch (size) {
            case "sqrtMain" -> sqrtMain(extra, HLINE_PAD);
            case "sqrtSize1" -> sqrtSized(extra, HLINE_PAD, 1000);
            case "sqrtSize2" -> sqrtSized(extra, HLINE_PAD, 1300);
            case "sqrtSize3" -> sqrtSized(extra, HLINE_PAD, 1800);
            case "sqrtSize4" -> sqrtSized(extra, HLINE_PAD, 2400);
            case "sqrtTall" -> sqrtTall(extra, HLINE_PAD, viewBoxHeight);
            default -> throw new IllegalArgumentException("Unsupported sqrt size: " + size);
        };
    }

    /// The slanted underline of `\angl` and `\phase`.
    static String phasePath(double y) {
        final double x = y / 2;
        return "M400000 " + fmt(y) + " H0 L" + fmt(x) + " 0 l65 45 L145 " + fmt(y - 80) + " H400000z";
    }

    /// The repeat segment of a tall delimiter, `height` viewBox units tall.
    static String innerPath(String name, double height) {
        return switch (name) {
            case "⎜" -> "M291 0 H417 V" + fmt(height) + " H291z";
            case "∣" -> "M145 0 H188 V" + fmt(height) + " H145z";
            case "∥" -> "M145 0 H188 V" + fmt(height) + " H145z M367 0 H410 V" + fmt(height) + " H367z";
            case "⎟" -> "M457 0 H583 V" + fmt(height) + " H457z";
            case "⎢" -> "M319 0 H403 V" + fmt(height) + " H319z";
            case "⎥" -> "M263 0 H347 V" + fmt(height) + " H263z";
            case "⎪" -> "M384 0 H504 V" + fmt(height) + " H384z";
            case "⏐" -> "M312 0 H355 V" + fmt(height) + " H312z";
            case "‖" -> "M257 0 H300 V" + fmt(height) + " H257z M478 0 H521 V" + fmt(height) + " H478z";
            default -> "";
        };
    }

    /// A bracket or brace-shaped tall delimiter drawn as one outline.
    static String tallDelim(String label, double midHeight) {
        final String h = fmt(midHeight);
        return switch (label) {
            case "lbrack" -> "M403 1759 V84 H666 V0 H319 V1759 v" + h + " v1759 h347 v-84 H403z M403 1759 V0 H319 V1759"
                + " v" + h + " v1759 h84z";
            case "rbrack" -> "M347 1759 V0 H0 V84 H263 V1759 v" + h + " v1759 H0 v84 H347z M347 1759 V0 H263 V1759"
                + " v" + h + " v1759 h84z";
            case "vert" -> "M145 15 v585 v" + h + " v585 c2.667,10,9.667,15,21,15 c10,0,16.667,-5,20,-15"
                + " v-585 v" + fmt(-midHeight) + " v-585 c-2.667,-10,-9.667,-15,-21,-15 c-10,0,-16.667,5,-20,15z";
            case "doublevert" -> "M145 15 v585 v" + h + " v585 c2.667,10,9.667,15,21,15 c10,0,16.667,-5,20,-15"
                + " v-585 v" + fmt(-midHeight) + " v-585 c-2.667,-10,-9.667,-15,-21,-15 c-10,0,-16.667,5,-20,15z"
                + " M367 15 v585 v" + h + " v585 c2.667,10,9.667,15,21,15 c10,0,16.667,-5,20,-15"
                + " v-585 v" + fmt(-midHeight) + " v-585 c-2.667,-10,-9.667,-15,-21,-15 c-10,0,-16.667,5,-20,15z";
            case "lfloor" -> "M319 602 V0 H403 V602 v" + h + " v1715 h263 v84 H319z";
            case "rfloor" -> "M319 602 V0 H403 V602 v" + h + " v1799 H0 v-84 H319z";
            case "lceil" -> "M403 1759 V84 H666 V0 H319 V1759 v" + h + " v602 h84z";
            case "rceil" -> "M347 1759 V0 H0 V84 H263 V1759 v" + h + " v602 h84z";
            default -> throw new IllegalArgumentException("Unknown stretchy delimiter '" + label + "'");
        };
    }

    private static final Map<String, String> PATHS = Map.ofEntries(
        Map.entry("rightarrow", "M0 241v40h399891l-110 110v40l170-170-170-170v40l110 110z"),
        Map.entry("leftarrow", "M400000 241v40H109l110 110v40L49 261l170-170v40L109 241z"),
        Map.entry("doublerightarrow", "M0 167v40h399805v146H0v40h399805l-110 110v40l190-190-190-190v40z"),
        Map.entry("doubleleftarrow", "M400000 167v40H195v146h399805v40H195l110 110v40L115 353l190-190v40z"),
        Map.entry("leftharpoon", "M400000 241v40H49l170-170v40L109 241z"),
        Map.entry("leftharpoondown", "M400000 281v-40H49l170 170v-40L109 281z"),
        Map.entry("rightharpoon", "M0 241v40h399951l-170-170v40l110 130z"),
        Map.entry("rightharpoondown", "M0 281v-40h399951l-170 170v-40l110-130z"),
        Map.entry("leftharpoonplus", "M400000 241v40H49l170-170v40L109 241zM0 475v40h399951l-170 170v-40l110-170z"),
        Map.entry("rightharpoonplus", "M0 241v40h399951l-170-170v40l110 130zM400000 475v40H49l170 170v-40L109 475z"),
        Map.entry("leftharpoondownplus", "M400000 435v40H49l170 170v-40L109 435zM0 241v40h399951l-170-170v40l110 130z"),
        Map.entry("longequal", "M0 50h400000v40H0zm0 194h400000v40H0z"),
        Map.entry("twoheadleftarrow", "M400000 167v40H109l110 110v40L49 187l170-170v40L109 167zm-399700 0l110-110v-40L339 187z"),
        Map.entry("twoheadrightarrow", "M0 167v40h399891l-110 110v40l170-170-170-170v40l110 110zm399700 0l-110-110v-40L399661 187z"),
        Map.entry("lefthook", "M400000 241v40H90c-40 0-80-30-80-80s40-80 80-80h20v40H90c-20 0-40 20-40 40s20 40 40 40z"),
        Map.entry("righthook", "M0 241v40h399910c40 0 80-30 80-80s-40-80-80-80h-20v40h20c20 0 40 20 40 40s-20 40-40 40z"),
        Map.entry("leftmapsto", "M40 281V428H0V94H40V241H400000v40z"),
        Map.entry("leftToFrom", "M400000 400v40H109l110 110v40L49 420l170-170v40L109 400z"),
        Map.entry("rightToFrom", "M0 128v40h399891l-110 110v40l170-170-170-170v40l110 110z"),
        Map.entry("baraboveleftarrow", "M400000 620v40H109l110 110v40L49 640l170-170v40L109 620zM0 241v40h400000v-40z"),
        Map.entry("rightarrowabovebar", "M0 241v40h399891l-110 110v40l170-170-170-170v40l110 110zM0 620v40h400000v-40z"),
        Map.entry("baraboveshortleftharpoon", "M400000 475v40H49l170-170v40L109 475zM0 241v40h400000v-40z"),
        Map.entry("rightharpoonaboveshortbar", "M0 241v40h399951l-170-170v40l110 130zM0 475v40h399000v-40z"),
        Map.entry("shortbaraboveleftharpoon", "M400000 475v40H49l170-170v40L109 475zM1000 241v40h399000v-40z"),
        Map.entry("shortrightharpoonabovebar", "M0 241v40h399951l-170-170v40l110 130zM0 475v40h400000v-40z"),
        Map.entry("leftbrace", "M6 548l-6-6v-35l6-11c56-104 135.3-181.3 238-232 57.3-28.7 117-45 179-50h399577v120H403"
            + "c-43.3 7-81 15-113 26-100.7 33-179.7 91-237 174-2.7 5-6 9-10 13-.7 1-7.3 1-20 1H6z"),
        Map.entry("midbrace", "M200428 334c-100.7-8.3-195.3-44-280-108-55.3-42-101.7-93-139-153l-9-14c-2.7 4-5.7 8.7-9 14"
            + "-53.3 86.7-123.7 153-211 199-66.7 36-137.3 56.3-212 62H0V214h199568c178.3-11.7 311.7-78.3 403-201"
            + " 6-8 9.7-12 11-12 .7-.7 6.7-1 18-1s17.3.3 18 1c1.3 0 5 4 11 12 44.7 59.3 101.3 106.3 170 141"
            + " 41.3 20.7 82.7 35.3 124 44 22.7 4.7 59.3 7.3 110 8h-400000v120z"),
        Map.entry("rightbrace", "M400000 542l-6 6h-17c-12.7 0-19.3-.3-20-1-4-4-7.3-8.3-10-13-35.3-51.3-80.8-93.8-136.5"
            + "-127.5s-117.2-55.8-184.5-66.5c-.7 0-2-.3-4-1-18.7-2.7-76-4.3-172-5H0V214h399571l6 1c124.7 8 235 61.7"
            + " 331 161 31.3 33.3 59.7 72.7 85 118l7 13v35z"),
        Map.entry("leftbraceunder", "M0 6l6-6h17c12.688 0 19.313.3 20 1 4 4 7.313 8.3 10 13 35.313 51.3 80.813 93.8"
            + " 136.5 127.5 55.688 33.7 117.188 55.8 184.5 66.5.688 0 2 .3 4 1 18.688 2.7 76 4.3 172 5h399450v120H429"
            + "l-6-1c-124.688-8-235-61.7-331-161C60.687 138.7 32.312 99.3 7 54L0 41V6z"),
        Map.entry("midbraceunder", "M199572 214c100.7 8.3 195.3 44 280 108 55.3 42 101.7 93 139 153l9 14c2.7-4 5.7-8.7"
            + " 9-14 53.3-86.7 123.7-153 211-199 66.7-36 137.3-56.3 212-62h199568v120H200432c-178.3 11.7-311.7 78.3"
            + "-403 201-6 8-9.7 12-11 12-.7.7-6.7 1-18 1s-17.3-.3-18-1c-1.3 0-5-4-11-12-44.7-59.3-101.3-106.3-170-141"
            + "s-145.3-54.3-229-60H0V214z"),
        Map.entry("rightbraceunder", "M399994 0l6 6v35l-6 11c-56 104-135.3 181.3-238 232-57.3 28.7-117 45-179 50H-300V214"
            + "h399897c43.3-7 81-15 113-26 100.7-33 179.7-91 237-174 2.7-5 6-9 10-13 .7-1 7.3-1 20-1h17z"),
        Map.entry("leftgroup", "M400000 80H435C64 80 168.3 229.4 21 260c-5.9 1.2-18 0-18 0-2 0-3-1-3-3v-38C76 61 257 0"
            + " 435 0h399565z"),
        Map.entry("rightgroup", "M0 80h399565c371 0 266.7 149.4 414 180 5.9 1.2 18 0 18 0 2 0 3-1 3-3v-38c-76-158-257-219"
            + "-435-219H0z"),
        Map.entry("leftgroupunder", "M400000 262H435C64 262 168.3 112.6 21 82c-5.9-1.2-18 0-18 0-2 0-3 1-3 3v38c76 158"
            + " 257 219 435 219h399565z"),
        Map.entry("rightgroupunder", "M0 262h399565c371 0 266.7-149.4 414-180 5.9-1.2 18 0 18 0 2 0 3 1 3 3v38c-76 158"
            + "-257 219-435 219H0z"),
        Map.entry("leftlinesegment", "M40 281V428H0V94H40V241H400000v40z"),
        Map.entry("rightlinesegment", "M399960 241V94h40V428h-40V281H0v-40z"),
        Map.entry("vec", "M377 20c0-5.333 1.833-10 5.5-14S391 0 397 0c4.667 0 8.667 1.667 12 5 3.333 2.667 6.667 9 10"
            + " 19 6.667 24.667 20.333 43.667 41 57 7.333 4.667 11 10.667 11 18 0 6-1 10-3 12s-6.667 5-14 9"
            + "c-28.667 14.667-53.667 35.667-75 63-1.333 1.333-3.167 3.5-5.5 6.5s-4 4.833-5 5.5c-1 .667-2.5 1.333"
            + "-4.5 2s-4.333 1-7 1c-4.667 0-9.167-1.833-13.5-5.5S337 184 337 178c0-12.667 15.667-32.333 47-59"
            + "H213l-171-1c-8.667-6-13-12.333-13-19 0-4.667 4.333-11.333 13-20h359c-16-25.333-24-45-24-59z"),
        Map.entry("oiintSize1", "M512.6 71.6c272.6 0 320.3 106.8 320.3 178.2 0 70.8-47.7 177.6-320.3 177.6S193.1"
            + " 320.6 193.1 249.8c0-71.4 46.9-178.2 319.5-178.2z m368.1 178.2c0-86.4-60.9-215.4-368.1-215.4-306.4 0"
            + "-367.3 129-367.3 215.4 0 85.8 60.9 214.8 367.3 214.8 307.2 0 368.1-129 368.1-214.8z"),
        Map.entry("oiintSize2", "M757.8 100.1c384.7 0 451.1 137.6 451.1 230 0 91.3-66.4 228.8-451.1 228.8-386.3 0"
            + "-452.7-137.5-452.7-228.8 0-92.4 66.4-230 452.7-230z m502.4 230c0-111.2-82.4-277.2-502.4-277.2s-504"
            + " 166-504 277.2 82.4 276.1 504 276.1 502.4-163.8 502.4-276.1z"),
        Map.entry("oiiintSize1", "M681.4 71.6c408.9 0 480.5 106.8 480.5 178.2 0 70.8-71.6 177.6-480.5 177.6S202.1"
            + " 320.6 202.1 249.8c0-71.4 70.5-178.2 479.3-178.2z m525.8 178.2c0-86.4-86.8-215.4-525.7-215.4-437.9"
            + " 0-524.7 129-524.7 215.4 0 85.8 86.8 214.8 524.7 214.8 438.9 0 525.7-129 525.7-214.8z"),
        Map.entry("oiiintSize2", "M1021.2 53c603.6 0 707.8 165.8 707.8 277.2 0 110-104.2 275.8-707.8 275.8-606 0"
            + "-710.2-165.8-710.2-275.8C311 218.8 415.2 53 1021.2 53z m770.4 277.1c0-131.2-126.4-327.6-770.5-327.6"
            + "S248.4 198.9 248.4 330.1c0 130 128.8 326.4 772.7 326.4s770.5-196.4 770.5-326.4z"),
        Map.entry("phase", phasePath(0))
    );

    /// Builds the hat, check and tilde outlines of the wide accents.
    private static String wideAccent(String name) {
        final int index = name.charAt(name.length() - 1) - '0';
        final int width = switch (index) {
            case 1 -> 1062;
            case 2, 3, 4 -> 2364;
            default -> 600;
        };
        final int height = switch (index) {
            case 1 -> 239;
            case 2 -> 300;
            case 3 -> 360;
            default -> 420;
        };
        final int half = width / 2;
        if (name.startsWith("widehat")) {
            return "M0 " + (height - 20) + "L" + half + " 0 L" + width + " " + (height - 20) + "v20L" + half + " 40 L0 "
                + height + "z";
        }
        if (name.startsWith("widecheck")) {
            return "M0 20L" + half + " " + height + " L" + width + " 20v-20L" + half + " " + (height - 40) + " L0 0z";
        }
        final int mid = height / 2;
        return "M0 " + (mid + 40) + "C" + (width / 6) + " 0 " + (width / 3) + " 0 " + half + " " + mid
            + "S" + (width * 5 / 6) + " " + height + " " + width + " " + (mid - 40) + "v40C" + (width * 5 / 6) + " "
            + (height + 40) + " " + (width * 2 / 3) + " " + (height + 40) + " " + half + " " + (mid + 40)
            + "S" + (width / 6) + " 40 0 " + (mid + 80) + "z";
    }

    /// The outline registered under `name`.
    static String path(String name) {
        final String known = PATHS.get(name);
        if (known != null) {
            return known;
        }
        if (name.startsWith("widehat") || name.startsWith("widecheck") || name.startsWith("tilde")) {
            return wideAccent(name);
        }
        throw new IllegalArgumentException("Unknown SVG path '" + name + "'");
    }

    static String fmt(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return Long.toString((long) v);
        }
        return Double.toString(Math.round(v * 1000) / 1000.0);
    }
}
