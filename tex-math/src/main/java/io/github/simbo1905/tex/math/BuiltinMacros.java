package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// The macro library every parser starts with: TeX and LaTeX primitives
/// written as macros, conditionals, the `\dots` family, spacing shorthands,
/// logos, `\tag` and friends.
final class BuiltinMacros {

    private BuiltinMacros() {}

    /// Where `\dots` looks at the next token to pick its flavour.
    private static final Map<String, String> DOTS_BY_TOKEN = Map.ofEntries(
        Map.entry(",", "\\dotsc"),
        Map.entry("\\not", "\\dotsb"),
        Map.entry("+", "\\dotsb"),
        Map.entry("=", "\\dotsb"),
        Map.entry("<", "\\dotsb"),
        Map.entry(">", "\\dotsb"),
        Map.entry("-", "\\dotsb"),
        Map.entry("*", "\\dotsb"),
        Map.entry(":", "\\dotsb"),
        Map.entry("\\DOTSB", "\\dotsb"),
        Map.entry("\\coprod", "\\dotsb"),
        Map.entry("\\bigvee", "\\dotsb"),
        Map.entry("\\bigwedge", "\\dotsb"),
        Map.entry("\\biguplus", "\\dotsb"),
        Map.entry("\\bigcap", "\\dotsb"),
        Map.entry("\\bigcup", "\\dotsb"),
        Map.entry("\\prod", "\\dotsb"),
        Map.entry("\\sum", "\\dotsb"),
        Map.entry("\\bigotimes", "\\dotsb"),
        Map.entry("\\bigoplus", "\\dotsb"),
        Map.entry("\\bigodot", "\\dotsb"),
        Map.entry("\\bigsqcup", "\\dotsb"),
        Map.entry("\\And", "\\dotsb"),
        Map.entry("\\longrightarrow", "\\dotsb"),
        Map.entry("\\Longrightarrow", "\\dotsb"),
        Map.entry("\\longleftarrow", "\\dotsb"),
        Map.entry("\\Longleftarrow", "\\dotsb"),
        Map.entry("\\longleftrightarrow", "\\dotsb"),
        Map.entry("\\Longleftrightarrow", "\\dotsb"),
        Map.entry("\\mapsto", "\\dotsb"),
        Map.entry("\\longmapsto", "\\dotsb"),
        Map.entry("\\hookrightarrow", "\\dotsb"),
        Map.entry("\\doteq", "\\dotsb"),
        Map.entry("\\mathbin", "\\dotsb"),
        Map.entry("\\mathrel", "\\dotsb"),
        Map.entry("\\relbar", "\\dotsb"),
        Map.entry("\\Relbar", "\\dotsb"),
        Map.entry("\\xrightarrow", "\\dotsb"),
        Map.entry("\\xleftarrow", "\\dotsb"),
        Map.entry("\\DOTSI", "\\dotsi"),
        Map.entry("\\int", "\\dotsi"),
        Map.entry("\\oint", "\\dotsi"),
        Map.entry("\\iint", "\\dotsi"),
        Map.entry("\\iiint", "\\dotsi"),
        Map.entry("\\iiiint", "\\dotsi"),
        Map.entry("\\idotsint", "\\dotsi"),
        Map.entry("\\DOTSX", "\\dotsx")
    );

    /// Tokens after which a trailing `\ldots` gets a thin space.
    private static final Set<String> SPACE_AFTER_DOTS = Set.of(")", "]", "\\rbrack", "\\}", "\\rbrace",
        "\\rangle", "\\rceil", "\\rfloor", "\\rgroup", "\\rmoustache", "\\right", "\\bigr", "\\biggr", "\\Bigr",
        "\\Biggr", "$", ";", ".", ",");

    static void register(Registry.Builder builder) {
        registerPrimitives(builder);
        registerConditionals(builder);
        registerCharacters(builder);
        registerDots(builder);
        registerSpacing(builder);
        registerOperators(builder);
        registerBoxes(builder);
        registerLogos(builder);
        registerTags(builder);
    }

    /// A token list handed back by [MacroContext] (stack order) as a fixed
    /// expansion, which wants reading order.
    static MacroDefinition expansionOf(List<Token> stackOrder) {
        final List<Token> tokens = new ArrayList<>(stackOrder);
        Collections.reverse(tokens);
        return new MacroDefinition.Expansion(tokens, 0);
    }

    // ========== TeX primitives ==========

    private static void registerPrimitives(Registry.Builder builder) {
        builder.defineMacro("\\bgroup", "{");
        builder.defineMacro("\\egroup", "}");

        builder.defineMacro("\\noexpand", MacroDefinition.callback(context -> {
            Token token = context.popToken();
            if (context.isExpandable(token.text())) {
                token = token.withNoExpand().withTreatAsRelax();
            }
            return new MacroDefinition.Expansion(List.of(token), 0);
        }));

        builder.defineMacro("\\expandafter", MacroDefinition.callback(context -> {
            final Token token = context.popToken();
            context.expandOnce(true);
            return new MacroDefinition.Expansion(List.of(token), 0);
        }));

        builder.defineMacro("\\message", MacroDefinition.callback(context -> {
            final List<Token> arg = context.consumeArgs(1).get(0);
            final var text = new StringBuilder();
            for (int i = arg.size() - 1; i >= 0; i--) {
                text.append(arg.get(i).text());
            }
            LOG.info(text::toString);
            return MacroDefinition.text("");
        }));
        builder.defineMacro("\\errmessage", MacroDefinition.callback(context -> {
            final List<Token> arg = context.consumeArgs(1).get(0);
            final var text = new StringBuilder();
            for (int i = arg.size() - 1; i >= 0; i--) {
                text.append(arg.get(i).text());
            }
            LOG.warning(text::toString);
            return MacroDefinition.text("");
        }));

        builder.defineMacro("\\lq", "`");
        builder.defineMacro("\\rq", "'");
        builder.defineMacro("\\mathstrut", "\\vphantom{(}");
        builder.defineMacro("\\newline", "\\\\\\relax");
        builder.defineMacro("\\underbar", "\\underline{\\text{#1}}");
    }

    // ========== Conditionals ==========

    private static void registerConditionals(Registry.Builder builder) {
        builder.defineMacro("\\@firstoftwo", MacroDefinition.callback(
            context -> expansionOf(context.consumeArgs(2).get(0))));
        builder.defineMacro("\\@secondoftwo", MacroDefinition.callback(
            context -> expansionOf(context.consumeArgs(2).get(1))));

        // \@ifnextchar{c}{then}{else} compares the next unexpanded token with c
        builder.defineMacro("\\@ifnextchar", MacroDefinition.callback(context -> {
            final List<List<Token>> args = context.consumeArgs(3);
            context.consumeSpaces();
            final Token next = context.future();
            if (args.get(0).size() == 1 && args.get(0).get(0).text().equals(next.text())) {
                return expansionOf(args.get(1));
            }
            return expansionOf(args.get(2));
        }));
        builder.defineMacro("\\@ifstar", "\\@ifnextchar *{\\@firstoftwo{#1}}");

        builder.defineMacro("\\TextOrMath", MacroDefinition.callback(context -> {
            final List<List<Token>> args = context.consumeArgs(2);
            return expansionOf(context.mode() == Mode.TEXT ? args.get(0) : args.get(1));
        }));
    }

    // ========== Characters ==========

    private static void registerCharacters(Registry.Builder builder) {
        // \char followed by a decimal, 'octal, "hex or `character code
        builder.defineMacro("\\char", MacroDefinition.callback(context -> {
            Token token = context.popToken();
            int base = 0;
            int number;
            if ("'".equals(token.text())) {
                base = 8;
                token = context.popToken();
            } else if ("\"".equals(token.text())) {
                base = 16;
                token = context.popToken();
            } else if ("`".equals(token.text())) {
                token = context.popToken();
                if (token.text().startsWith("\\")) {
                    number = token.text().codePointAt(1);
                } else if (token.isEof()) {
                    throw new TexParseException("\\char` missing argument");
                } else {
                    number = token.text().codePointAt(0);
                }
                return MacroDefinition.text("\\@char{" + number + "}");
            } else {
                base = 10;
            }
            number = digit(token.text());
            if (number < 0 || number >= base) {
                throw new TexParseException("Invalid base-" + base + " digit " + token.text(), token);
            }
            int next;
            while ((next = digit(context.future().text())) >= 0 && next < base) {
                number = number * base + next;
                context.popToken();
            }
            return MacroDefinition.text("\\@char{" + number + "}");
        }));

        builder.defineMacro("\\iff", "\\DOTSB\\;\\Longleftrightarrow\\;");
        builder.defineMacro("\\implies", "\\DOTSB\\;\\Longrightarrow\\;");
        builder.defineMacro("\\impliedby", "\\DOTSB\\;\\Longleftarrow\\;");
        builder.defineMacro("≠", "\\neq");
        builder.defineMacro("∉", "\\notin");
        builder.defineMacro("\\vdots", "{\\varvdots\\rule{0pt}{15pt}}");
        builder.defineMacro("⋮", "\\vdots");
        builder.defineMacro("·", "\\cdotp");

        builder.defineMacro("\\varGamma", "\\mathit{\\Gamma}");
        builder.defineMacro("\\varDelta", "\\mathit{\\Delta}");
        builder.defineMacro("\\varTheta", "\\mathit{\\Theta}");
        builder.defineMacro("\\varLambda", "\\mathit{\\Lambda}");
        builder.defineMacro("\\varXi", "\\mathit{\\Xi}");
        builder.defineMacro("\\varPi", "\\mathit{\\Pi}");
        builder.defineMacro("\\varSigma", "\\mathit{\\Sigma}");
        builder.defineMacro("\\varUpsilon", "\\mathit{\\Upsilon}");
        builder.defineMacro("\\varPhi", "\\mathit{\\Phi}");
        builder.defineMacro("\\varPsi", "\\mathit{\\Psi}");
        builder.defineMacro("\\varOmega", "\\mathit{\\Omega}");

        // script letters that have their own code points
        builder.defineMacro("ℬ", "\\mathscr{B}");
        builder.defineMacro("ℰ", "\\mathscr{E}");
        builder.defineMacro("ℱ", "\\mathscr{F}");
        builder.defineMacro("ℋ", "\\mathscr{H}");
        builder.defineMacro("ℐ", "\\mathscr{I}");
        builder.defineMacro("ℒ", "\\mathscr{L}");
        builder.defineMacro("ℳ", "\\mathscr{M}");
        builder.defineMacro("ℛ", "\\mathscr{R}");
        builder.defineMacro("ℭ", "\\mathfrak{C}");
        builder.defineMacro("ℌ", "\\mathfrak{H}");
        builder.defineMacro("ℨ", "\\mathfrak{Z}");
    }

    private static int digit(String text) {
        if (text.length() != 1) {
            return -1;
        }
        return Character.digit(text.charAt(0), 16);
    }

    // ========== Dots ==========

    private static void registerDots(Registry.Builder builder) {
        builder.defineMacro("\\dots", MacroDefinition.callback(context -> {
            final String next = context.expandAfterFuture().text();
            String dots = "\\dotso";
            if (DOTS_BY_TOKEN.containsKey(next)) {
                dots = DOTS_BY_TOKEN.get(next);
            } else if (next.startsWith("\\not")) {
                dots = "\\dotsb";
            } else {
                final Symbols.Symbol symbol = Symbols.get(Mode.MATH, next);
                if (symbol != null && ("bin".equals(symbol.group()) || "rel".equals(symbol.group()))) {
                    dots = "\\dotsb";
                }
            }
            return MacroDefinition.text(dots);
        }));
        builder.defineMacro("\\dotso", MacroDefinition.callback(context ->
            MacroDefinition.text(SPACE_AFTER_DOTS.contains(context.future().text()) ? "\\ldots\\," : "\\ldots")));
        builder.defineMacro("\\dotsc", MacroDefinition.callback(context -> {
            final String next = context.future().text();
            return MacroDefinition.text(SPACE_AFTER_DOTS.contains(next) && !",".equals(next)
                ? "\\ldots\\," : "\\ldots");
        }));
        builder.defineMacro("\\dotsb", MacroDefinition.callback(context ->
            MacroDefinition.text(SPACE_AFTER_DOTS.contains(context.future().text()) ? "\\cdots\\," : "\\cdots")));
        builder.defineMacro("\\dotsm", "\\dotsb");
        builder.defineMacro("\\dotsi", "\\!\\dotsb");
        builder.defineMacro("\\dotsx", "\\ldots\\,");
        builder.defineMacro("\\DOTSI", "\\relax");
        builder.defineMacro("\\DOTSB", "\\relax");
        builder.defineMacro("\\DOTSX", "\\relax");
    }

    // ========== Spacing ==========

    private static void registerSpacing(Registry.Builder builder) {
        // \tmspace{sign}{math size}{text size}
        builder.defineMacro("\\tmspace", "\\TextOrMath{\\kern#1#3}{\\mskip#1#2}\\relax");
        builder.defineMacro("\\,", "\\tmspace+{3mu}{.1667em}");
        builder.defineMacro("\\thinspace", "\\,");
        builder.defineMacro("\\>", "\\mskip{4mu}");
        builder.defineMacro("\\:", "\\tmspace+{4mu}{.2222em}");
        builder.defineMacro("\\medspace", "\\:");
        builder.defineMacro("\\;", "\\tmspace+{5mu}{.2777em}");
        builder.defineMacro("\\thickspace", "\\;");
        builder.defineMacro("\\!", "\\tmspace-{3mu}{.1667em}");
        builder.defineMacro("\\negthinspace", "\\!");
        builder.defineMacro("\\negmedspace", "\\tmspace-{4mu}{.2222em}");
        builder.defineMacro("\\negthickspace", "\\tmspace-{5mu}{.277em}");
        builder.defineMacro("\\enspace", "\\kern.5em ");
        builder.defineMacro("\\enskip", "\\hskip.5em\\relax");
        builder.defineMacro("\\quad", "\\hskip1em\\relax");
        builder.defineMacro("\\qquad", "\\hskip2em\\relax");

        builder.defineMacro("\\hspace", "\\@ifstar\\@hspacer\\@hspace");
        builder.defineMacro("\\@hspace", "\\hskip #1\\relax");
        builder.defineMacro("\\@hspacer", "\\rule{0pt}{0pt}\\hskip #1\\relax");
    }

    // ========== Operators ==========

    private static void registerOperators(Registry.Builder builder) {
        builder.defineMacro("\\operatorname", "\\@ifstar\\operatornamewithlimits\\operatorname@");
        builder.defineMacro("\\limsup", "\\DOTSB\\operatorname*{lim\\,sup}");
        builder.defineMacro("\\liminf", "\\DOTSB\\operatorname*{lim\\,inf}");
        builder.defineMacro("\\injlim", "\\DOTSB\\operatorname*{inj\\,lim}");
        builder.defineMacro("\\projlim", "\\DOTSB\\operatorname*{proj\\,lim}");
        builder.defineMacro("\\argmin", "\\DOTSB\\operatorname*{arg\\,min}");
        builder.defineMacro("\\argmax", "\\DOTSB\\operatorname*{arg\\,max}");
        builder.defineMacro("\\plim", "\\DOTSB\\mathop{\\operatorname{plim}}\\limits");

        builder.defineMacro("\\bmod", "\\mathchoice{\\mskip1mu}{\\mskip1mu}{\\mskip5mu}{\\mskip5mu}"
            + "\\mathbin{\\rm mod}"
            + "\\mathchoice{\\mskip1mu}{\\mskip1mu}{\\mskip5mu}{\\mskip5mu}");
        builder.defineMacro("\\pod", "\\allowbreak"
            + "\\mathchoice{\\mkern18mu}{\\mkern8mu}{\\mkern8mu}{\\mkern8mu}(#1)");
        builder.defineMacro("\\pmod", "\\pod{{\\rm mod}\\mkern6mu#1}");
        builder.defineMacro("\\mod", "\\allowbreak"
            + "\\mathchoice{\\mkern18mu}{\\mkern12mu}{\\mkern12mu}{\\mkern12mu}"
            + "{\\rm mod}\\,\\,#1");

        builder.defineMacro("\\ordinarycolon", ":");
        builder.defineMacro("\\vcentcolon", "\\mathrel{\\mathop\\ordinarycolon}");
        builder.defineMacro("\\coloneqq", "\\mathrel{\\vcentcolon\\mathrel{\\mkern-1.2mu}=}");
        builder.defineMacro("\\eqqcolon", "\\mathrel{=\\mathrel{\\mkern-1.2mu}\\vcentcolon}");
        builder.defineMacro("\\substack", "\\begin{subarray}{c}#1\\end{subarray}");
    }

    // ========== Boxes ==========

    private static void registerBoxes(Registry.Builder builder) {
        builder.defineMacro("\\boxed", "\\fbox{$\\displaystyle{#1}$}");
        builder.defineMacro("\\llap", "\\mathllap{\\textrm{#1}}");
        builder.defineMacro("\\rlap", "\\mathrlap{\\textrm{#1}}");
        builder.defineMacro("\\clap", "\\mathclap{\\textrm{#1}}");
    }

    // ========== Logos ==========

    private static void registerLogos(Registry.Builder builder) {
        builder.defineMacro("\\TeX", "\\textrm{\\html@mathml{"
            + "T\\kern-.1667em\\raisebox{-.5ex}{E}\\kern-.125emX"
            + "}{TeX}}");
        // A is raised by the height of T less 0.7 of the height of A in Main-Regular
        builder.defineMacro("\\LaTeX", "\\textrm{\\html@mathml{"
            + "L\\kern-.36em\\raisebox{0.205em}{\\scriptstyle A}"
            + "\\kern-.15em\\TeX}{LaTeX}}");
        builder.defineMacro("\\KaTeX", "\\textrm{\\html@mathml{"
            + "K\\kern-.17em\\raisebox{0.205em}{\\scriptstyle A}"
            + "\\kern-.15em\\TeX}{KaTeX}}");
    }

    // ========== Tags ==========

    private static void registerTags(Registry.Builder builder) {
        builder.defineMacro("\\tag", "\\@ifstar\\tag@literal\\tag@paren");
        builder.defineMacro("\\tag@paren", "\\tag@literal{({#1})}");
        builder.defineMacro("\\tag@literal", MacroDefinition.callback(context -> {
            if (context.getMacro("\\df@tag") != null) {
                throw new TexParseException("Multiple \\tag");
            }
            return MacroDefinition.text("\\gdef\\df@tag{\\text{#1}}");
        }));
        builder.defineMacro("\\notag", "\\nonumber");
        builder.defineMacro("\\nonumber", "\\gdef\\@eqnsw{0}");
    }
}
