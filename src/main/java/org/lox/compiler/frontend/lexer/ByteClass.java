package org.lox.compiler.frontend.lexer;

/**
 * Closed classification of the byte that starts a lexeme. The {@link Scanner} dispatches on
 * this with an exhaustive switch.
 */
enum ByteClass {
    /** ASCII letters and '_'. */
    LETTER,
    DIGIT,
    /** Space, tab, carriage return and newline. */
    WHITESPACE,
    /** One of {@code ( ) { } , . - + ; *}. */
    PUNCTUATION,
    /** One of {@code ! = < >}, each of which may be followed by '='. */
    OPERATOR,
    SLASH,
    QUOTE,
    OTHER;

    static ByteClass of(int b) {
        if (isAlpha(b)) return LETTER;
        if (isDigit(b)) return DIGIT;
        return switch (b) {
            case ' ', '\t', '\r', '\n' -> WHITESPACE;
            case '(', ')', '{', '}', ',', '.', '-', '+', ';', '*' -> PUNCTUATION;
            case '!', '=', '<', '>' -> OPERATOR;
            case '/' -> SLASH;
            case '"' -> QUOTE;
            default -> OTHER;
        };
    }

    static boolean isDigit(int b) {
        return b >= '0' && b <= '9';
    }

    static boolean isAlpha(int b) {
        return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || b == '_';
    }

    static boolean isAlphaNumeric(int b) {
        return isAlpha(b) || isDigit(b);
    }

    static boolean isWhitespace(int b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }
}
