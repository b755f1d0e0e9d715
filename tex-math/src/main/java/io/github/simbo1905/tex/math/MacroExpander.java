package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.tex.math.TexLogging.LOG;

/// The expansion layer between the lexer and the parser.
///
/// Pending tokens live on a stack that always takes precedence over the lexer.
/// Token lists pushed onto it are in stack order: the last element is read first.
/// Every macro expansion counts towards [Settings#maxExpand()]; crossing the
/// ceiling raises [MacroExpansionException], which is what stops self-referential
/// definitions.
final class MacroExpander implements MacroContext {

    /// Names the parser handles itself that count as defined.
    static final Set<String> IMPLICIT_COMMANDS = Set.of("^", "_", "\\limits", "\\nolimits");

    private final Settings settings;
    private final Registry registry;
    private final Namespace<MacroDefinition> macros;
    private final ArrayList<Token> stack = new ArrayList<>();
    private Lexer lexer;
    private Mode mode;
    private int expansionCount;

    MacroExpander(String input, Settings settings, Mode mode, Registry registry) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.macros = new Namespace<>(registry.macros(), settings.macros());
        feed(input);
    }

    /// Replaces the lexer with one over new input; pending stack tokens stay.
    void feed(String input) {
        this.lexer = new Lexer(input, settings);
    }

    Lexer lexer() {
        return lexer;
    }

    Namespace<MacroDefinition> macros() {
        return macros;
    }

    Settings settings() {
        return settings;
    }

    int expansionCount() {
        return expansionCount;
    }

    void switchMode(Mode newMode) {
        this.mode = newMode;
    }

    @Override
    public Mode mode() {
        return mode;
    }

    void beginGroup() {
        macros.beginGroup();
    }

    void endGroup() {
        macros.endGroup();
    }

    void endGroups() {
        macros.endGroups();
    }

    @Override
    public Token future() {
        if (stack.isEmpty()) {
            pushToken(lexer.lex());
        }
        return stack.get(stack.size() - 1);
    }

    @Override
    public Token popToken() {
        future();
        final Token token = stack.remove(stack.size() - 1);
        StructuredLog.finestSampled(LOG, "pop", 64, "text", token.text());
        return token;
    }

    @Override
    public void pushToken(Token token) {
        stack.add(Objects.requireNonNull(token, "token must not be null"));
    }

    @Override
    public void pushTokens(List<Token> tokens) {
        stack.addAll(tokens);
    }

    /// Reads a braced (or optional bracketed) argument without expanding it and
    /// pushes it back followed by an `EOF` marker, so the parser can read it as a
    /// self-contained stream. Returns a token spanning the argument, or null if
    /// an optional argument is absent.
    Token scanArgument(boolean optional) {
        final Token start;
        final MacroArgument arg;
        if (optional) {
            consumeSpaces();
            if (!"[".equals(future().text())) {
                return null;
            }
            start = popToken();
            arg = consumeArg(List.of("]"));
        } else {
            arg = consumeArg();
            start = arg.start();
        }
        final Token end = arg.end();
        pushToken(new Token("EOF", end.loc()));
        pushTokens(arg.tokens());
        return start.range(end, "");
    }

    @Override
    public void consumeSpaces() {
        while (" ".equals(future().text())) {
            stack.remove(stack.size() - 1);
        }
    }

    @Override
    public MacroArgument consumeArg() {
        return consumeArg(null);
    }

    /// Consumes one argument. Without delimiters it is a single token or a
    /// balanced braced group; with delimiters it runs until the delimiter
    /// sequence appears at brace depth 0.
    MacroArgument consumeArg(List<String> delims) {
        final List<Token> tokens = new ArrayList<>();
        final boolean delimited = delims != null && !delims.isEmpty();
        if (!delimited) {
            consumeSpaces();
        }
        final Token start = future();
        Token tok;
        int depth = 0;
        int match = 0;
        do {
            tok = popToken();
            tokens.add(tok);
            if ("{".equals(tok.text())) {
                ++depth;
            } else if ("}".equals(tok.text())) {
                --depth;
                if (depth == -1) {
                    throw new MacroExpansionException("Extra }", tok);
                }
            } else if (tok.isEof()) {
                throw new MacroExpansionException("Unexpected end of input in a macro argument, expected '"
                    + (delimited ? delims.get(match) : "}") + "'", tok);
            }
            if (delimited) {
                if ((depth == 0 || (depth == 1 && "{".equals(delims.get(match))))
                    && tok.text().equals(delims.get(match))) {
                    ++match;
                    if (match == delims.size()) {
                        tokens.subList(tokens.size() - match, tokens.size()).clear();
                        break;
                    }
                } else {
                    match = 0;
                }
            }
        } while (depth != 0 || delimited);

        List<Token> body = tokens;
        if ("{".equals(start.text()) && !body.isEmpty() && "}".equals(body.get(body.size() - 1).text())) {
            body = new ArrayList<>(body.subList(1, body.size() - 1));
        }
        Collections.reverse(body);
        return new MacroArgument(body, start, tok);
    }

    @Override
    public List<List<Token>> consumeArgs(int count) {
        return consumeArgs(count, null);
    }

    /// Consumes `count` arguments; `delimiters` (when not null) holds the text
    /// required before the first argument followed by each argument's terminator.
    List<List<Token>> consumeArgs(int count, List<List<String>> delimiters) {
        if (delimiters != null) {
            if (delimiters.size() != count + 1) {
                throw new MacroExpansionException("The length of delimiters doesn't match the number of args!");
            }
            for (final String delim : delimiters.get(0)) {
                final Token tok = popToken();
                if (!delim.equals(tok.text())) {
                    throw new MacroExpansionException("Use of the macro doesn't match its definition", tok);
                }
            }
        }
        final List<List<Token>> args = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            args.add(consumeArg(delimiters == null ? null : delimiters.get(i + 1)).tokens());
        }
        return args;
    }

    private void countExpansion(int amount, Token token) {
        expansionCount += amount;
        if (expansionCount > settings.maxExpand()) {
            LOG.fine(() -> "expansion ceiling " + settings.maxExpand() + " crossed at "
                + (token == null ? "token list" : token.text()));
            throw new MacroExpansionException(
                "Too many expansions: infinite loop or need to increase maxExpand setting", token);
        }
    }

    /// Expands the next token once if it is a macro.
    ///
    /// @param expandableOnly skip macros marked unexpandable and reject undefined
    ///                       control sequences
    /// @return the number of tokens pushed, or -1 if the token was not expanded
    ///         (it is then back on the stack)
    @Override
    public int expandOnce(boolean expandableOnly) {
        final Token top = popToken();
        final String name = top.text();
        final ResolvedExpansion expansion = top.noExpand() ? null : resolve(name);
        if (expansion == null || (expandableOnly && expansion.unexpandable())) {
            if (expandableOnly && expansion == null && name.startsWith("\\") && !isDefined(name)) {
                throw new MacroExpansionException("Undefined control sequence: " + name, top);
            }
            pushToken(top);
            return -1;
        }
        countExpansion(1, top);
        StructuredLog.finestSampled(LOG, "expand", 16, "name", name, "count", expansionCount);

        List<Token> tokens = expansion.tokens();
        final List<List<Token>> args = consumeArgs(expansion.numArgs(), expansion.delimiters());
        if (expansion.numArgs() > 0) {
            tokens = substitute(tokens, args);
        }
        pushTokens(tokens);
        return tokens.size();
    }

    /// Replaces `#n` with argument n and `##` with `#`, walking the stack-order
    /// body from the end (the reading start).
    static List<Token> substitute(List<Token> body, List<List<Token>> args) {
        final List<Token> tokens = new ArrayList<>(body);
        for (int i = tokens.size() - 1; i >= 0; --i) {
            Token tok = tokens.get(i);
            if (!"#".equals(tok.text())) {
                continue;
            }
            if (i == 0) {
                throw new MacroExpansionException("Incomplete placeholder at end of macro body", tok);
            }
            tok = tokens.get(i - 1);
            if ("#".equals(tok.text())) {
                tokens.remove(i);
                --i;
            } else if (tok.text().length() == 1 && tok.text().charAt(0) >= '1' && tok.text().charAt(0) <= '9') {
                final int index = tok.text().charAt(0) - '1';
                if (index >= args.size()) {
                    throw new MacroExpansionException("Not a valid argument number", tok);
                }
                tokens.subList(i - 1, i + 1).clear();
                tokens.addAll(i - 1, args.get(index));
                --i;
            } else {
                throw new MacroExpansionException("Not a valid argument number", tok);
            }
        }
        return tokens;
    }

    @Override
    public Token expandAfterFuture() {
        expandOnce(false);
        return future();
    }

    @Override
    public Token expandNextToken() {
        while (true) {
            if (expandOnce(false) < 0) {
                final Token token = stack.remove(stack.size() - 1);
                if (token.treatAsRelax()) {
                    return new Token("\\relax", token.loc());
                }
                return token;
            }
        }
    }

    /// Fully expands the macro `name`, or returns null if it is not a macro.
    List<Token> expandMacro(String name) {
        return macros.has(name) ? expandTokens(List.of(new Token(name))) : null;
    }

    @Override
    public List<Token> expandTokens(List<Token> tokens) {
        final List<Token> output = new ArrayList<>();
        final int oldStackLength = stack.size();
        pushTokens(tokens);
        while (stack.size() > oldStackLength) {
            if (expandOnce(true) < 0) {
                Token token = stack.remove(stack.size() - 1);
                if (token.treatAsRelax()) {
                    token = new Token(token.text(), token.loc());
                }
                output.add(token);
            }
        }
        countExpansion(output.size(), null);
        return output;
    }

    @Override
    public String expandMacroAsText(String name) {
        final List<Token> tokens = expandMacro(name);
        if (tokens == null) {
            return null;
        }
        final var sb = new StringBuilder();
        for (final Token token : tokens) {
            sb.append(token.text());
        }
        return sb.toString();
    }

    /// A definition resolved to a token list in stack order.
    private record ResolvedExpansion(List<Token> tokens, int numArgs, List<List<String>> delimiters,
                                     boolean unexpandable) {
    }

    private ResolvedExpansion resolve(String name) {
        final MacroDefinition definition = macros.get(name);
        if (definition == null) {
            return null;
        }
        if (name.length() == 1) {
            final int catcode = lexer.catcode(name);
            if (catcode != -1 && catcode != Lexer.CATCODE_ACTIVE) {
                return null;
            }
        }
        MacroDefinition expansion = definition;
        if (definition instanceof MacroDefinition.Callback callback) {
            expansion = callback.function().expand(this);
            if (expansion == null || expansion instanceof MacroDefinition.Callback) {
                throw new MacroExpansionException("Macro " + name + " did not produce an expansion");
            }
        }
        if (expansion instanceof MacroDefinition.Text text) {
            return new ResolvedExpansion(lexBody(text.body()), countParameters(text.body()), null, false);
        }
        final var fixed = (MacroDefinition.Expansion) expansion;
        final List<Token> reversed = new ArrayList<>(fixed.tokens());
        Collections.reverse(reversed);
        return new ResolvedExpansion(reversed, fixed.numArgs(), fixed.delimiters(), fixed.unexpandable());
    }

    /// Counts `#1`, `#2`, ... in order after removing `##` escapes.
    static int countParameters(String body) {
        if (body.indexOf('#') < 0) {
            return 0;
        }
        final String stripped = body.replace("##", "");
        int numArgs = 0;
        while (stripped.contains("#" + (numArgs + 1))) {
            ++numArgs;
        }
        return numArgs;
    }

    private List<Token> lexBody(String body) {
        final var bodyLexer = new Lexer(body, settings);
        final List<Token> tokens = new ArrayList<>();
        Token tok = bodyLexer.lex();
        while (!tok.isEof()) {
            tokens.add(tok);
            tok = bodyLexer.lex();
        }
        Collections.reverse(tokens);
        return tokens;
    }

    @Override
    public boolean isDefined(String name) {
        return macros.has(name)
            || registry.function(name) != null
            || Symbols.contains(Mode.MATH, name)
            || Symbols.contains(Mode.TEXT, name)
            || IMPLICIT_COMMANDS.contains(name);
    }

    @Override
    public boolean isExpandable(String name) {
        final MacroDefinition macro = macros.get(name);
        if (macro != null) {
            return !(macro instanceof MacroDefinition.Expansion expansion) || !expansion.unexpandable();
        }
        final FunctionSpec function = registry.function(name);
        return function != null && !function.primitive();
    }

    @Override
    public MacroDefinition getMacro(String name) {
        return macros.get(name);
    }

    @Override
    public void setMacro(String name, MacroDefinition definition, boolean global) {
        macros.set(name, definition, global);
    }
}
