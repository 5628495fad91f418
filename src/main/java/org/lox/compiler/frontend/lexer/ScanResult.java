package org.lox.compiler.frontend.lexer;

/**
 * The outcome of a single {@link Scanner#next()} step: either a token or an error.
 */
public sealed interface ScanResult permits ScanResult.Ok, ScanResult.Err {

    /**
     * A successfully recognized token.
     * @param token The token.
     */
    record Ok(Token token) implements ScanResult {
        @Override
        public int start() {
            return token.start();
        }

        @Override
        public int end() {
            return token.end();
        }
    }

    /**
     * A lexeme that could not be recognized.
     * @param error The error.
     */
    record Err(ScanError error) implements ScanResult {
        @Override
        public int start() {
            return error.start();
        }

        @Override
        public int end() {
            return error.end();
        }
    }

    /** @return The offset of the first byte covered by this result. */
    int start();

    /** @return The offset one past the last byte covered by this result. */
    int end();

    static ScanResult ok(TokenType type, int start, int end) {
        return new Ok(new Token(type, start, end));
    }

    static ScanResult error(ErrorKind kind, int start, int end) {
        return new Err(new ScanError(kind, start, end));
    }
}
