package io.github.simbo1905.tex.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Macro definition and assignment: `\def` and its relatives, `\let`,
/// `\futurelet`, the `\global` and `\long` prefixes and the LaTeX
/// `\newcommand` family.
final class DefinitionFunctions {

    private static final Map<String, String> GLOBAL_MAP = Map.of(
        "\\global", "\\global",
        "\\long", "\\\\globallong",
        "\\\\globallong", "\\\\globallong",
        "\\def", "\\gdef",
        "\\gdef", "\\gdef",
        "\\edef", "\\xdef",
        "\\xdef", "\\xdef",
        "\\let", "\\\\globallet",
        "\\futurelet", "\\\\globalfuture"
    );

    private static final Set<String> NOT_CONTROL_SEQUENCES = Set.of("\\", "{", "}", "$", "&", "#", "^", "_", "EOF");

    private DefinitionFunctions() {}

    static void register(Registry.Builder builder) {
        builder.defineFunction(FunctionSpec.builder("internal", "\\global", "\\long", "\\\\globallong")
            .allowedInText(true)
            .handler(DefinitionFunctions::prefix));

        builder.defineFunction(FunctionSpec.builder("internal", "\\def", "\\gdef", "\\edef", "\\xdef")
            .allowedInText(true)
            .primitive(true)
            .handler(DefinitionFunctions::define));

        builder.defineFunction(FunctionSpec.builder("internal", "\\let", "\\\\globallet")
            .allowedInText(true)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final Parser parser = context.parser();
                final String name = checkControlSequence(parser.gullet().popToken());
                parser.gullet().consumeSpaces();
                final Token rhs = rightHandSide(parser);
                let(parser, name, rhs, "\\\\globallet".equals(context.funcName()));
                return new ParseNode.Internal(parser.mode(), context.loc());
            }));

        builder.defineFunction(FunctionSpec.builder("internal", "\\futurelet", "\\\\globalfuture")
            .allowedInText(true)
            .primitive(true)
            .handler((context, args, optArgs) -> {
                final Parser parser = context.parser();
                final MacroExpander gullet = parser.gullet();
                final String name = checkControlSequence(gullet.popToken());
                final Token middle = gullet.popToken();
                final Token tok = gullet.popToken();
                let(parser, name, tok, "\\\\globalfuture".equals(context.funcName()));
                gullet.pushToken(tok);
                gullet.pushToken(middle);
                return new ParseNode.Internal(parser.mode(), context.loc());
            }));

        builder.defineMacro("\\newcommand", MacroDefinition.callback(
            macroContext -> newCommand(macroContext, false, true, false)));
        builder.defineMacro("\\renewcommand", MacroDefinition.callback(
            macroContext -> newCommand(macroContext, true, false, false)));
        builder.defineMacro("\\providecommand", MacroDefinition.callback(
            macroContext -> newCommand(macroContext, true, true, true)));
    }

    private static String checkControlSequence(Token token) {
        if (NOT_CONTROL_SEQUENCES.contains(token.text())) {
            throw new TexParseException("Expected a control sequence", token);
        }
        return token.text();
    }

    /// Reads the right-hand side of `\let`, skipping an optional `=` and one space after it.
    private static Token rightHandSide(Parser parser) {
        Token token = parser.gullet().popToken();
        if ("=".equals(token.text())) {
            token = parser.gullet().popToken();
            if (" ".equals(token.text())) {
                token = parser.gullet().popToken();
            }
        }
        return token;
    }

    private static void let(Parser parser, String name, Token token, boolean global) {
        MacroDefinition macro = parser.gullet().macros().get(token.text());
        if (macro == null) {
            // the token itself, frozen so it is not expanded again later
            macro = new MacroDefinition.Expansion(List.of(token.withNoExpand()), 0, null,
                !parser.gullet().isExpandable(token.text()));
        }
        StructuredLog.finer(TexLogging.LOG, "let", "name", name, "target", token.text(), "global", global);
        parser.gullet().macros().set(name, macro, global);
    }

    private static ParseNode prefix(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final Parser parser = context.parser();
        parser.consumeSpaces();
        final Token token = parser.fetch();
        final String global = GLOBAL_MAP.get(token.text());
        if (global == null) {
            throw new TexParseException("Invalid token after macro prefix", token);
        }
        // \long is a no-op since there is no \par
        if ("\\global".equals(context.funcName()) || "\\\\globallong".equals(context.funcName())) {
            parser.replaceLookahead(new Token(global, token.loc(), token.noExpand(), token.treatAsRelax()));
        }
        final ParseNode node = parser.parseFunction(null, null);
        if (!(node instanceof ParseNode.Internal)) {
            throw new TexParseException("Invalid token after macro prefix", token);
        }
        return node;
    }

    private static ParseNode define(FunctionContext context, List<ParseNode> args, List<ParseNode> optArgs) {
        final Parser parser = context.parser();
        final MacroExpander gullet = parser.gullet();
        final String funcName = context.funcName();
        final String name = checkControlSequence(gullet.popToken());

        int numArgs = 0;
        Token insert = null;
        final List<List<String>> delimiters = new ArrayList<>();
        delimiters.add(new ArrayList<>());
        while (!"{".equals(gullet.future().text())) {
            Token tok = gullet.popToken();
            if ("#".equals(tok.text())) {
                // #{ ends the parameter text with a brace delimiter that stays in the body
                if ("{".equals(gullet.future().text())) {
                    insert = gullet.future();
                    delimiters.get(numArgs).add("{");
                    break;
                }
                tok = gullet.popToken();
                if (!tok.text().matches("^[1-9]$")) {
                    throw new TexParseException("Invalid argument number \"" + tok.text() + "\"", tok);
                }
                if (Integer.parseInt(tok.text()) != numArgs + 1) {
                    throw new TexParseException("Argument number \"" + tok.text() + "\" out of order", tok);
                }
                numArgs++;
                delimiters.add(new ArrayList<>());
            } else if (tok.isEof()) {
                throw new TexParseException("Expected a macro definition", tok);
            } else {
                delimiters.get(numArgs).add(tok.text());
            }
        }

        final List<Token> stackOrder = new ArrayList<>(gullet.consumeArg().tokens());
        if (insert != null) {
            stackOrder.add(0, insert);
        }
        final List<Token> tokens;
        if ("\\edef".equals(funcName) || "\\xdef".equals(funcName)) {
            tokens = gullet.expandTokens(stackOrder);
        } else {
            Collections.reverse(stackOrder);
            tokens = stackOrder;
        }

        final boolean global = funcName.equals(GLOBAL_MAP.get(funcName));
        StructuredLog.finer(TexLogging.LOG, "define", "name", name, "args", numArgs, "global", global);
        gullet.macros().set(name, new MacroDefinition.Expansion(tokens, numArgs, delimiters, false), global);
        return new ParseNode.Internal(parser.mode(), context.loc());
    }

    /// `\newcommand`, `\renewcommand` and `\providecommand`.
    ///
    /// @param existsOk    whether the name may already be defined
    /// @param nonexistsOk whether the name may be new
    /// @param skipIfExists keep an existing definition untouched
    private static MacroDefinition newCommand(MacroContext context, boolean existsOk, boolean nonexistsOk,
                                              boolean skipIfExists) {
        List<Token> arg = context.consumeArg().tokens();
        if (arg.size() != 1) {
            throw new TexParseException("\\newcommand's first argument must be a macro name");
        }
        final String name = arg.get(0).text();
        final boolean exists = context.isDefined(name);
        if (exists && !existsOk) {
            throw new TexParseException("\\newcommand{" + name + "} attempting to redefine " + name
                + "; use \\renewcommand");
        }
        if (!exists && !nonexistsOk) {
            throw new TexParseException("\\renewcommand{" + name + "} when command " + name
                + " does not yet exist; use \\newcommand");
        }

        int numArgs = 0;
        List<Token> defaultArg = null;
        arg = context.consumeArg().tokens();
        if (arg.size() == 1 && "[".equals(arg.get(0).text())) {
            final var argText = new StringBuilder();
            Token token = context.expandNextToken();
            while (!"]".equals(token.text()) && !token.isEof()) {
                argText.append(token.text());
                token = context.expandNextToken();
            }
            if (!argText.toString().matches("^\\s*[0-9]+\\s*$")) {
                throw new TexParseException("Invalid number of arguments: " + argText);
            }
            numArgs = Integer.parseInt(argText.toString().trim());
            context.consumeSpaces();
            if ("[".equals(context.future().text())) {
                context.popToken();
                defaultArg = bracketed(context);
            }
            arg = context.consumeArg().tokens();
        }

        if (!(exists && skipIfExists)) {
            final List<Token> body = new ArrayList<>(arg);
            if (defaultArg != null && numArgs > 0) {
                context.setMacro(name, optionalFirst(body, numArgs, defaultArg), false);
            } else {
                Collections.reverse(body);
                context.setMacro(name, new MacroDefinition.Expansion(body, numArgs), false);
            }
        }
        return MacroDefinition.text("");
    }

    /// Collects tokens up to the `]` that closes an optional argument, in stack order.
    private static List<Token> bracketed(MacroContext context) {
        final List<Token> tokens = new ArrayList<>();
        int depth = 0;
        while (true) {
            final Token token = context.popToken();
            if (token.isEof()) {
                throw new TexParseException("Unexpected end of input in a macro argument, expected ']'", token);
            }
            if ("]".equals(token.text()) && depth == 0) {
                break;
            }
            if ("{".equals(token.text())) {
                depth++;
            } else if ("}".equals(token.text())) {
                depth--;
            }
            tokens.add(token);
        }
        Collections.reverse(tokens);
        return List.copyOf(tokens);
    }

    /// A macro whose first parameter is optional and defaults to `defaultArg`.
    /// `body` and `defaultArg` are in stack order.
    private static MacroDefinition optionalFirst(List<Token> body, int numArgs, List<Token> defaultArg) {
        final List<Token> frozenBody = List.copyOf(body);
        return MacroDefinition.callback(context -> {
            final List<List<Token>> args = new ArrayList<>();
            context.consumeSpaces();
            if ("[".equals(context.future().text())) {
                context.popToken();
                args.add(bracketed(context));
            } else {
                args.add(defaultArg);
            }
            args.addAll(context.consumeArgs(numArgs - 1));
            final List<Token> expanded = MacroExpander.substitute(frozenBody, args);
            Collections.reverse(expanded);
            return new MacroDefinition.Expansion(expanded, 0);
        });
    }
}
