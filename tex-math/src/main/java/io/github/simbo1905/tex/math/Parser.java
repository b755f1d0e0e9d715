package io.github.simbo1905.tex.math;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// Recursive-descent parser from expanded tokens to a list of [ParseNode]s.
///
/// The parser keeps one token of lookahead pulled from the [MacroExpander].
/// Command invocations are resolved through the [Registry], which decides how
/// many arguments to read and of which [ArgType]. Nesting is capped at
/// [#MAX_NESTING] levels so malicious input fails with a parse error instead
/// of exhausting the call stack.
public final class Parser {

    /// Maximum nesting of groups, arguments and environments.
    static final int MAX_NESTING = 256;

    private static final Set<String> END_OF_EXPRESSION = Set.of("}", "\\endgroup", "\\end", "\\right", "&");

    private static final Pattern VERB = Pattern.compile("^\\\\verb[^a-zA-Z]");
    private static final Pattern SIZE_GROUP = Pattern.compile("^[-+]? *(?:$|\\d+|\\d+\\.\\d*|\\.\\d*) *[a-z]{0,2} *$");
    private static final Pattern SIZE = Pattern.compile("([-+]?) *(\\d+(?:\\.\\d*)?|\\.\\d+) *([a-z]{2})");
    private static final Pattern COLOR = Pattern.compile(
        "^(#[a-f0-9]{3,4}|#[a-f0-9]{6}|#[a-f0-9]{8}|[a-f0-9]{6}|[a-z]+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_HEX = Pattern.compile("^[0-9a-f]{6}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_ESCAPE = Pattern.compile("\\\\([#$%&~_^{}])");

    private final Settings settings;
    private final Registry registry;
    private final MacroExpander gullet;
    private Mode mode = Mode.MATH;
    private Token nextToken;
    private int leftrightDepth;
    private int nesting;

    Parser(String input, Settings settings, Registry registry) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.gullet = new MacroExpander(Objects.requireNonNull(input, "input must not be null"), settings, mode,
            registry);
    }

    public Mode mode() {
        return mode;
    }

    public Settings settings() {
        return settings;
    }

    Registry registry() {
        return registry;
    }

    MacroExpander gullet() {
        return gullet;
    }

    int leftrightDepth() {
        return leftrightDepth;
    }

    void enterLeftRight() {
        leftrightDepth++;
    }

    void exitLeftRight() {
        leftrightDepth--;
    }

    /// Checks that the lookahead has the given text, consuming it if asked.
    ///
    /// @throws TexParseException if it does not
    public void expect(String text, boolean consume) {
        if (!fetch().text().equals(text)) {
            throw new TexParseException("Expected '" + text + "', got '" + fetch().text() + "'", fetch());
        }
        if (consume) {
            consume();
        }
    }

    public void expect(String text) {
        expect(text, true);
    }

    /// Discards the lookahead token.
    public void consume() {
        nextToken = null;
    }

    /// The lookahead token, fully expanded.
    public Token fetch() {
        if (nextToken == null) {
            nextToken = gullet.expandNextToken();
        }
        return nextToken;
    }

    /// Replaces the lookahead token, as `\global` does to the command it prefixes.
    void replaceLookahead(Token token) {
        nextToken = token;
    }

    public void switchMode(Mode newMode) {
        this.mode = newMode;
        gullet.switchMode(newMode);
    }

    /// Parses the whole input.
    List<ParseNode> parse() {
        LOG.fine(() -> "parse start length=" + gullet.lexer().input().length());
        if (!settings.globalGroup()) {
            gullet.beginGroup();
        }
        if (settings.colorIsTextColor()) {
            gullet.macros().set("\\color", MacroDefinition.text("\\textcolor"), true);
        }
        try {
            final List<ParseNode> parse = parseExpression(false, null);
            expect("EOF");
            if (!settings.globalGroup()) {
                gullet.endGroup();
            }
            StructuredLog.fine(LOG, "parsed", "nodes", parse.size(), "expansions", gullet.expansionCount());
            return parse;
        } finally {
            gullet.endGroups();
        }
    }

    /// Parses a separate token list (in stack order) as an expression.
    List<ParseNode> subparse(List<Token> tokens) {
        final Token oldToken = nextToken;
        consume();
        gullet.pushToken(new Token("}"));
        gullet.pushTokens(tokens);
        final List<ParseNode> parse = parseExpression(false, null);
        expect("}");
        nextToken = oldToken;
        return parse;
    }

    /// Parses atoms until the end of the expression.
    ///
    /// @param breakOnInfix     stop before an infix command such as `\over`
    /// @param breakOnTokenText additional stop token, or null
    public List<ParseNode> parseExpression(boolean breakOnInfix, String breakOnTokenText) {
        enterNesting();
        try {
            final List<ParseNode> body = new ArrayList<>();
            while (true) {
                if (mode == Mode.MATH) {
                    consumeSpaces();
                }
                final Token lex = fetch();
                if (END_OF_EXPRESSION.contains(lex.text())) {
                    break;
                }
                if (breakOnTokenText != null && lex.text().equals(breakOnTokenText)) {
                    break;
                }
                final FunctionSpec spec = registry.function(lex.text());
                if (breakOnInfix && spec != null && spec.infix()) {
                    break;
                }
                final ParseNode atom = parseAtom(breakOnTokenText);
                if (atom == null) {
                    break;
                }
                if (atom instanceof ParseNode.Internal) {
                    continue;
                }
                body.add(atom);
            }
            if (mode == Mode.TEXT) {
                formLigatures(body);
            }
            return handleInfixNodes(body);
        } finally {
            nesting--;
        }
    }

    private void enterNesting() {
        if (++nesting > MAX_NESTING) {
            nesting--;
            throw new TexParseException("Too deeply nested: more than " + MAX_NESTING + " levels of grouping",
                nextToken);
        }
    }

    /// Rewrites an infix command like `\over` into its prefix form over the two
    /// halves of the group.
    private List<ParseNode> handleInfixNodes(List<ParseNode> body) {
        int overIndex = -1;
        ParseNode.Infix infix = null;
        for (int i = 0; i < body.size(); i++) {
            if (body.get(i) instanceof ParseNode.Infix node) {
                if (overIndex != -1) {
                    throw new TexParseException("only one infix operator per group", node.token());
                }
                overIndex = i;
                infix = node;
            }
        }
        if (infix == null) {
            return body;
        }
        final ParseNode numer = asGroup(body.subList(0, overIndex));
        final ParseNode denom = asGroup(body.subList(overIndex + 1, body.size()));
        final List<ParseNode> args = "\\\\abovefrac".equals(infix.replaceWith())
            ? List.of(numer, infix, denom)
            : List.of(numer, denom);
        final List<ParseNode> result = new ArrayList<>();
        result.add(callFunction(infix.replaceWith(), args, List.of(), infix.token(), null));
        return result;
    }

    private ParseNode asGroup(List<ParseNode> nodes) {
        if (nodes.size() == 1 && nodes.get(0) instanceof ParseNode.OrdGroup) {
            return nodes.get(0);
        }
        return new ParseNode.OrdGroup(mode, null, nodes);
    }

    /// Reads the group after `^` or `_`.
    private ParseNode handleSupSubscript(String name) {
        final Token symbolToken = fetch();
        final String symbol = symbolToken.text();
        consume();
        consumeSpaces();
        ParseNode group;
        do {
            group = parseGroup(name, null);
        } while (group instanceof ParseNode.Internal);
        if (group == null) {
            throw new TexParseException("Expected group after '" + symbol + "'", symbolToken);
        }
        return group;
    }

    /// The placeholder for a command that cannot be rendered: its name in the
    /// error colour.
    ParseNode formatUnsupportedCmd(String text) {
        final List<ParseNode> textords = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            textords.add(new ParseNode.TextOrd(Mode.TEXT, null, String.valueOf(text.charAt(i))));
        }
        final var textNode = new ParseNode.Text(mode, null, textords, null);
        return new ParseNode.Color(mode, null, settings.errorColor(), List.of(textNode));
    }

    /// Parses a group with any following scripts, primes and limit controls.
    ParseNode parseAtom(String breakOnTokenText) {
        ParseNode base = parseGroup("atom", breakOnTokenText);
        if (base instanceof ParseNode.Internal || mode == Mode.TEXT) {
            return base;
        }
        ParseNode superscript = null;
        ParseNode subscript = null;
        while (true) {
            consumeSpaces();
            final Token lex = fetch();
            final String text = lex.text();
            if ("\\limits".equals(text) || "\\nolimits".equals(text)) {
                final boolean limits = "\\limits".equals(text);
                if (base instanceof ParseNode.Op op) {
                    base = op.withLimits(limits);
                } else if (base instanceof ParseNode.OperatorName opName) {
                    if (opName.alwaysHandleSupSub()) {
                        base = opName.withLimits(limits);
                    }
                } else {
                    throw new TexParseException("Limit controls must follow a math operator", lex);
                }
                consume();
            } else if ("^".equals(text)) {
                if (superscript != null) {
                    throw new TexParseException("Double superscript", lex);
                }
                superscript = handleSupSubscript("superscript");
            } else if ("_".equals(text)) {
                if (subscript != null) {
                    throw new TexParseException("Double subscript", lex);
                }
                subscript = handleSupSubscript("subscript");
            } else if ("'".equals(text)) {
                if (superscript != null) {
                    throw new TexParseException("Double superscript", lex);
                }
                final var prime = new ParseNode.TextOrd(mode, null, "\\prime");
                final List<ParseNode> primes = new ArrayList<>();
                primes.add(prime);
                consume();
                while ("'".equals(fetch().text())) {
                    primes.add(prime);
                    consume();
                }
                if ("^".equals(fetch().text())) {
                    primes.add(handleSupSubscript("superscript"));
                }
                superscript = new ParseNode.OrdGroup(mode, null, primes);
            } else if (isUnicodeScript(text)) {
                final boolean isSub = UnicodeData.SUBSCRIPTS.containsKey(text.charAt(0));
                if (isSub ? subscript != null : superscript != null) {
                    throw new TexParseException(isSub ? "Double subscript" : "Double superscript", lex);
                }
                final List<Token> tokens = new ArrayList<>();
                tokens.add(new Token(unicodeScriptText(text)));
                consume();
                while (true) {
                    final String next = fetch().text();
                    if (!isUnicodeScript(next) || UnicodeData.SUBSCRIPTS.containsKey(next.charAt(0)) != isSub) {
                        break;
                    }
                    tokens.add(0, new Token(unicodeScriptText(next)));
                    consume();
                }
                final List<ParseNode> body = subparse(tokens);
                if (isSub) {
                    subscript = new ParseNode.OrdGroup(Mode.MATH, null, body);
                } else {
                    superscript = new ParseNode.OrdGroup(Mode.MATH, null, body);
                }
            } else {
                break;
            }
        }
        if (superscript != null || subscript != null) {
            return new ParseNode.SupSub(mode, null, base, superscript, subscript);
        }
        return base;
    }

    private static boolean isUnicodeScript(String text) {
        return text.length() == 1
            && (UnicodeData.SUPERSCRIPTS.containsKey(text.charAt(0))
            || UnicodeData.SUBSCRIPTS.containsKey(text.charAt(0)));
    }

    private static String unicodeScriptText(String text) {
        final String sup = UnicodeData.SUPERSCRIPTS.get(text.charAt(0));
        return sup != null ? sup : UnicodeData.SUBSCRIPTS.get(text.charAt(0));
    }

    /// Parses a command and its arguments, or returns null if the lookahead is
    /// not a registered function.
    ParseNode parseFunction(String breakOnTokenText, String name) {
        final Token token = fetch();
        final String func = token.text();
        final FunctionSpec spec = registry.function(func);
        if (spec == null) {
            return null;
        }
        consume();
        if (name != null && !"atom".equals(name) && !spec.allowedInArgument()) {
            throw new TexParseException("Got function '" + func + "' with no arguments as " + name, token);
        } else if (mode == Mode.TEXT && !spec.allowedInText()) {
            throw new TexParseException("Can't use function '" + func + "' in text mode", token);
        } else if (mode == Mode.MATH && !spec.allowedInMath()) {
            throw new TexParseException("Can't use function '" + func + "' in math mode", token);
        }
        final Arguments arguments = parseArguments(func, spec);
        return callFunction(func, arguments.args(), arguments.optArgs(), token, breakOnTokenText);
    }

    /// Invokes a function handler. An untrusted link or image degrades to the
    /// unsupported-command placeholder; a null result becomes an internal node.
    ParseNode callFunction(String name, List<ParseNode> args, List<ParseNode> optArgs, Token token,
                           String breakOnTokenText) {
        final FunctionSpec spec = registry.function(name);
        if (spec == null) {
            throw new TexParseException("No function handler for " + name);
        }
        StructuredLog.finer(LOG, "call", "name", name, "args", args.size());
        final var context = new FunctionContext(name, this, token, breakOnTokenText);
        final ParseNode result;
        try {
            result = spec.handler().handle(context, args, optArgs);
        } catch (TrustException e) {
            LOG.fine(e::getMessage);
            return formatUnsupportedCmd(name);
        }
        return result == null ? new ParseNode.Internal(mode, token == null ? null : token.loc()) : result;
    }

    /// Required and optional arguments, the latter with nulls where absent.
    record Arguments(List<ParseNode> args, List<ParseNode> optArgs) {
    }

    /// Reads the arguments declared by `spec`, optional ones first.
    Arguments parseArguments(String func, FunctionSpec spec) {
        final int total = spec.numArgs() + spec.numOptionalArgs();
        if (total == 0) {
            return new Arguments(List.of(), List.of());
        }
        final List<ParseNode> args = new ArrayList<>();
        final List<ParseNode> optArgs = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            ArgType argType = spec.argType(i);
            final boolean isOptional = i < spec.numOptionalArgs();
            if ((spec.primitive() && argType == null)
                || ("sqrt".equals(spec.type()) && i == 1 && optArgs.get(0) == null)) {
                argType = ArgType.PRIMITIVE;
            }
            final ParseNode arg = parseGroupOfType("argument to '" + func + "'", argType, isOptional);
            if (isOptional) {
                optArgs.add(arg);
            } else if (arg != null) {
                args.add(arg);
            } else {
                throw new TexParseException("Null argument, please report this as a bug");
            }
        }
        return new Arguments(args, optArgs);
    }

    /// Parses one argument of the given type, switching mode where the type asks.
    ParseNode parseGroupOfType(String name, ArgType type, boolean optional) {
        if (type == null) {
            return parseArgumentGroup(optional, null);
        }
        return switch (type) {
            case COLOR -> parseColorGroup(optional);
            case SIZE -> parseSizeGroup(optional);
            case URL -> parseUrlGroup(optional);
            case MATH -> parseArgumentGroup(optional, Mode.MATH);
            case TEXT -> parseArgumentGroup(optional, Mode.TEXT);
            case HBOX -> {
                final ParseNode group = parseArgumentGroup(optional, Mode.TEXT);
                yield group == null ? null
                    : new ParseNode.Styling(group.mode(), null, Style.TEXT, List.of(group));
            }
            case RAW -> {
                final Token token = parseStringGroup(optional);
                yield token == null ? null : new ParseNode.Raw(Mode.TEXT, token.loc(), token.text());
            }
            case PRIMITIVE -> {
                if (optional) {
                    throw new TexParseException("A primitive argument cannot be optional");
                }
                final ParseNode group = parseGroup(name, null);
                if (group == null) {
                    throw new TexParseException("Expected group as " + name, fetch());
                }
                yield group;
            }
            case ORIGINAL -> parseArgumentGroup(optional, null);
        };
    }

    /// Skips space tokens.
    public void consumeSpaces() {
        while (" ".equals(fetch().text())) {
            consume();
        }
    }

    /// Reads an argument as a string of expanded token texts; the returned token
    /// spans the argument.
    Token parseStringGroup(boolean optional) {
        final Token argToken = gullet.scanArgument(optional);
        if (argToken == null) {
            return null;
        }
        final var text = new StringBuilder();
        Token next;
        while (!(next = fetch()).isEof()) {
            text.append(next.text());
            consume();
        }
        consume();
        return new Token(text.toString(), argToken.loc());
    }

    /// Reads tokens while their concatenation matches `regex`.
    private Token parseRegexGroup(Pattern regex, String modeName) {
        final Token firstToken = fetch();
        Token lastToken = firstToken;
        final var text = new StringBuilder();
        Token next;
        while (!(next = fetch()).isEof() && regex.matcher(text + next.text()).matches()) {
            lastToken = next;
            text.append(lastToken.text());
            consume();
        }
        if (text.length() == 0) {
            throw new TexParseException("Invalid " + modeName + ": '" + firstToken.text() + "'", firstToken);
        }
        return firstToken.range(lastToken, text.toString());
    }

    private ParseNode parseColorGroup(boolean optional) {
        final Token res = parseStringGroup(optional);
        if (res == null) {
            return null;
        }
        final Matcher match = COLOR.matcher(res.text());
        if (!match.matches()) {
            throw new TexParseException("Invalid color: '" + res.text() + "'", res);
        }
        String color = match.group(0);
        if (BARE_HEX.matcher(color).matches()) {
            color = "#" + color;
        }
        return new ParseNode.ColorToken(mode, res.loc(), color);
    }

    /// Parses a length such as `3pt` or `-.5em`. An empty mandatory size is `0pt`.
    ParseNode parseSizeGroup(boolean optional) {
        gullet.consumeSpaces();
        final Token token;
        if (!optional && !"{".equals(gullet.future().text())) {
            token = parseRegexGroup(SIZE_GROUP, "size");
        } else {
            token = parseStringGroup(optional);
        }
        if (token == null) {
            return null;
        }
        String text = token.text();
        boolean isBlank = false;
        if (!optional && text.isEmpty()) {
            text = "0pt";
            isBlank = true;
        }
        final Matcher match = SIZE.matcher(text);
        if (!match.find()) {
            throw new TexParseException("Invalid size: '" + text + "'", token);
        }
        final double number = Double.parseDouble(match.group(1) + match.group(2));
        final String unit = match.group(3);
        if (!Units.validUnit(unit)) {
            throw new TexParseException("Invalid unit: '" + unit + "'", token);
        }
        return new ParseNode.Size(mode, token.loc(), new Measurement(number, unit), isBlank);
    }

    /// Parses a URL with `%` active and `~` ordinary, then drops backslash escapes.
    private ParseNode parseUrlGroup(boolean optional) {
        gullet.lexer().setCatcode("%", Lexer.CATCODE_ACTIVE);
        gullet.lexer().setCatcode("~", Lexer.CATCODE_OTHER);
        final Token token;
        try {
            token = parseStringGroup(optional);
        } finally {
            gullet.lexer().setCatcode("%", Lexer.CATCODE_COMMENT);
            gullet.lexer().setCatcode("~", Lexer.CATCODE_ACTIVE);
        }
        if (token == null) {
            return null;
        }
        final String url = URL_ESCAPE.matcher(token.text()).replaceAll("$1");
        return new ParseNode.Url(mode, token.loc(), url);
    }

    /// Parses an argument group, optionally in another mode.
    private ParseNode parseArgumentGroup(boolean optional, Mode newMode) {
        final Token argToken = gullet.scanArgument(optional);
        if (argToken == null) {
            return null;
        }
        final Mode outerMode = mode;
        if (newMode != null) {
            switchMode(newMode);
        }
        gullet.beginGroup();
        final List<ParseNode> expression = parseExpression(false, "EOF");
        expect("EOF");
        gullet.endGroup();
        final var result = new ParseNode.OrdGroup(mode, argToken.loc(), expression);
        if (newMode != null) {
            switchMode(outerMode);
        }
        return result;
    }

    /// Parses a braced group, `\begingroup...\endgroup`, a function or a symbol.
    /// Returns null at the end of an expression.
    ParseNode parseGroup(String name, String breakOnTokenText) {
        final Token firstToken = fetch();
        final String text = firstToken.text();
        if ("{".equals(text) || "\\begingroup".equals(text)) {
            consume();
            final String groupEnd = "{".equals(text) ? "}" : "\\endgroup";
            gullet.beginGroup();
            final List<ParseNode> expression = parseExpression(false, groupEnd);
            final Token lastToken = fetch();
            expect(groupEnd);
            gullet.endGroup();
            return new ParseNode.OrdGroup(mode, SourceLocation.range(firstToken.loc(), lastToken.loc()), expression,
                "\\begingroup".equals(text));
        }
        ParseNode result = parseFunction(breakOnTokenText, name);
        if (result == null) {
            result = parseSymbol();
        }
        if (result == null && text.startsWith("\\") && !MacroExpander.IMPLICIT_COMMANDS.contains(text)) {
            if (settings.throwOnError()) {
                throw new TexParseException("Undefined control sequence: " + text, firstToken);
            }
            result = formatUnsupportedCmd(text);
            consume();
        }
        return result;
    }

    /// Merges `--` and `---` text runs into single ligature nodes.
    private void formLigatures(List<ParseNode> group) {
        int n = group.size() - 1;
        for (int i = 0; i < n; ++i) {
            if (!(group.get(i) instanceof ParseNode.TextOrd a) || !"-".equals(a.text())) {
                continue;
            }
            if (!(group.get(i + 1) instanceof ParseNode.TextOrd b) || !"-".equals(b.text())) {
                continue;
            }
            if (i + 1 < n && group.get(i + 2) instanceof ParseNode.TextOrd c && "-".equals(c.text())) {
                group.subList(i, i + 3).clear();
                group.add(i, new ParseNode.TextOrd(Mode.TEXT, SourceLocation.range(a.loc(), c.loc()), "---"));
                n -= 2;
            } else {
                group.subList(i, i + 2).clear();
                group.add(i, new ParseNode.TextOrd(Mode.TEXT, SourceLocation.range(a.loc(), b.loc()), "--"));
                n -= 1;
            }
        }
    }

    /// Parses a single symbol, `\verb`, or a character with combining accents.
    /// Returns null if the lookahead is not a known symbol.
    ParseNode parseSymbol() {
        final Token nucleus = fetch();
        String text = nucleus.text();

        if (VERB.matcher(text).find()) {
            consume();
            String arg = text.substring(5);
            final boolean star = arg.charAt(0) == '*';
            if (star) {
                arg = arg.substring(1);
            }
            if (arg.length() < 2 || arg.charAt(0) != arg.charAt(arg.length() - 1)) {
                throw new TexParseException("\\verb assertion failed -- please report what input caused this bug",
                    nucleus);
            }
            return new ParseNode.Verb(Mode.TEXT, nucleus.loc(), arg.substring(1, arg.length() - 1), star);
        }

        if (!text.isEmpty() && !Symbols.contains(mode, text.substring(0, 1))) {
            final String decomposed = decomposeAccented(text.charAt(0));
            if (decomposed != null) {
                if (mode == Mode.MATH) {
                    settings.reportNonstrict("unicodeTextInMathMode",
                        "Accented Unicode text character \"" + text.charAt(0) + "\" used in math mode", nucleus);
                }
                text = decomposed + text.substring(1);
            }
        }

        int accentStart = text.length();
        while (accentStart > 1 && Lexer.isCombiningMark(text.charAt(accentStart - 1))) {
            accentStart--;
        }
        String accents = "";
        if (accentStart < text.length()) {
            accents = text.substring(accentStart);
            text = text.substring(0, accentStart);
            if ("i".equals(text)) {
                text = "ı";
            } else if ("j".equals(text)) {
                text = "ȷ";
            }
        }

        ParseNode symbol;
        final Symbols.Symbol info = Symbols.get(mode, text);
        if (info != null) {
            symbol = symbolNode(info.group(), text, nucleus.loc());
        } else if (!text.isEmpty() && text.charAt(0) >= 0x80) {
            final int codepoint = text.codePointAt(0);
            if (!UnicodeData.supportedCodepoint(codepoint)) {
                settings.reportNonstrict("unknownSymbol", "Unrecognized Unicode character \""
                    + new String(Character.toChars(codepoint)) + "\" (" + codepoint + ")", nucleus);
            } else if (mode == Mode.MATH) {
                settings.reportNonstrict("unicodeTextInMathMode", "Unicode text character \""
                    + new String(Character.toChars(codepoint)) + "\" used in math mode", nucleus);
            }
            symbol = new ParseNode.TextOrd(Mode.TEXT, nucleus.loc(), text);
        } else {
            return null;
        }
        consume();

        for (int i = 0; i < accents.length(); i++) {
            final char accent = accents.charAt(i);
            final UnicodeData.CombiningAccent command = UnicodeData.COMBINING_ACCENTS.get(accent);
            if (command == null) {
                throw new TexParseException("Unknown accent ' " + accent + "'", nucleus);
            }
            final String label = mode == Mode.MATH && command.math() != null ? command.math() : command.text();
            symbol = new ParseNode.Accent(mode, nucleus.loc(), label, false, true, symbol);
        }
        return symbol;
    }

    private ParseNode symbolNode(String group, String text, SourceLocation loc) {
        if (Symbols.ATOMS.contains(group)) {
            return new ParseNode.Atom(mode, loc, group, text);
        }
        return switch (group) {
            case "mathord" -> new ParseNode.MathOrd(mode, loc, text);
            case "textord" -> new ParseNode.TextOrd(mode, loc, text);
            case "spacing" -> new ParseNode.SpacingSymbol(mode, loc, text);
            case "accent-token" -> new ParseNode.AccentToken(mode, loc, text);
            case "op-token" -> new ParseNode.OpToken(mode, loc, text);
            default -> throw new TexParseException("Unknown symbol group '" + group + "' for " + text);
        };
    }

    /// Splits a precomposed Latin letter into base letter and combining accents
    /// we know, or returns null.
    private static String decomposeAccented(char c) {
        if (c < 0xc0 || c > 0x24f) {
            return null;
        }
        final String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        if (decomposed.length() < 2) {
            return null;
        }
        for (int i = 1; i < decomposed.length(); i++) {
            if (!UnicodeData.COMBINING_ACCENTS.containsKey(decomposed.charAt(i))) {
                return null;
            }
        }
        return decomposed;
    }
}
