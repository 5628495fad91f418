package org.lox.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Scanner} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    DOT,
    MINUS,
    PLUS,
    SEMICOLON,
    STAR,

    // One or two character tokens.
    BANG,
    BANG_EQUAL,
    EQUAL,
    EQUAL_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    SLASH,

    // Trivia. Surfaced as tokens so callers can reconstruct the original spacing.
    /** A line comment starting with '//', excluding the terminating newline. */
    COMMENT_LINE,
    /** A maximal run of spaces, tabs, carriage returns and newlines. */
    WHITESPACE,

    // Literals.
    IDENTIFIER,
    /** A string literal, including both quotes. */
    STRING,
    NUMBER,

    // Keywords.
    AND,
    CLASS,
    ELSE,
    FALSE,
    FUN,
    FOR,
    IF,
    NIL,
    OR,
    PRINT,
    RETURN,
    SUPER,
    THIS,
    TRUE,
    VAR,
    WHILE,

    /**
     * Represents the end of the source. Never produced by the {@link Scanner} itself;
     * callers append it when they need a terminator.
     */
    EOF;

    /**
     * @return {@code true} for whitespace and comments.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT_LINE;
    }
}
