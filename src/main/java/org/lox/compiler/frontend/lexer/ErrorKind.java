package org.lox.compiler.frontend.lexer;

/**
 * The recoverable errors the {@link Scanner} can report.
 */
public enum ErrorKind {
    /** A byte that does not start any known lexeme. */
    UNKNOWN("Unknown token"),
    /** A string literal whose closing quote is missing before the end of the input. */
    UNFINISHED_STRING("Unfinished string"),
    /** A numeric literal with more than one decimal point, e.g. {@code 9.9.9}. */
    INVALID_NUMBER("Invalid number");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
