package org.lox.compiler.frontend.lexer;

import java.nio.charset.StandardCharsets;

/**
 * A positioned error produced by the {@link Scanner}. Like {@link Token}, it references the
 * source buffer by range only.
 *
 * @param kind What went wrong.
 * @param start The offset of the first offending byte.
 * @param end The offset one past the last offending byte.
 */
public record ScanError(ErrorKind kind, int start, int end) {

    public ScanError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind must not be null");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid error range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String lexeme(byte[] source) {
        return new String(source, start, length(), StandardCharsets.UTF_8);
    }
}
