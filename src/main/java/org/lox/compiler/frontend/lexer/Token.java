package org.lox.compiler.frontend.lexer;

import java.nio.charset.StandardCharsets;

/**
 * Represents a single token recognized by the {@link Scanner}.
 * <p>
 * A token does not own its text. The half-open range {@code [start, end)} refers into the
 * source buffer the scanner was created with, so that buffer must stay unchanged for as long
 * as lexemes are read through {@link #lexeme(byte[])}.
 *
 * @param type The type of the token.
 * @param start The offset of the first byte of the lexeme.
 * @param end The offset one past the last byte of the lexeme.
 */
public record Token(TokenType type, int start, int end) {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("Token type must not be null");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid token range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Slices this token's lexeme out of the source it was scanned from.
     * @param source The buffer the token was scanned from.
     * @return The lexeme decoded as UTF-8.
     */
    public String lexeme(byte[] source) {
        return new String(source, start, length(), StandardCharsets.UTF_8);
    }
}
