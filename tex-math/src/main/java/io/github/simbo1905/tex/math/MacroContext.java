package io.github.simbo1905.tex.math;

import java.util.List;

/// The part of the macro expander a [MacroFunction] may use.
///
/// Token lists exchanged here are in stack order: the last element is the
/// next token to be read.
public interface MacroContext {

    /// Current parsing mode.
    Mode mode();

    /// Returns the next token without consuming or expanding it.
    Token future();

    /// Consumes the next token without expanding it.
    Token popToken();

    void pushToken(Token token);

    /// Pushes tokens given in stack order.
    void pushTokens(List<Token> tokens);

    /// Consumes any space tokens ahead.
    void consumeSpaces();

    /// Consumes one undelimited argument.
    MacroArgument consumeArg();

    /// Consumes `count` undelimited arguments, each in stack order.
    List<List<Token>> consumeArgs(int count);

    /// Expands the next token once if it is a macro; returns the number of tokens
    /// pushed, or -1 when it was left alone.
    int expandOnce(boolean expandableOnly);

    /// Expands the next token once and returns the new next token.
    Token expandAfterFuture();

    /// Expands until a non-expandable token is next, and consumes it.
    Token expandNextToken();

    /// Fully expands a token list given in stack order; returns reading order.
    List<Token> expandTokens(List<Token> tokens);

    /// Fully expands the macro `name` and joins the token texts, or null if undefined.
    String expandMacroAsText(String name);

    /// True if `name` is a macro, function, symbol, or one of `^ _ \limits \nolimits`.
    boolean isDefined(String name);

    /// True if `name` would be expanded rather than passed to the parser.
    boolean isExpandable(String name);

    MacroDefinition getMacro(String name);

    void setMacro(String name, MacroDefinition definition, boolean global);
}
