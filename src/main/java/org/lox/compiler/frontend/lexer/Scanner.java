package org.lox.compiler.frontend.lexer;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The Scanner (also known as Lexer or Tokenizer) turns a byte buffer into a sequence of
 * tokens and errors, one lexeme per call to {@link #next()}.
 * <p>
 * Scanning is error tolerant: an unrecognized lexeme is reported as a {@link ScanError} and
 * the scanner moves past it, so callers can keep pulling results to collect every error in
 * one pass. Whitespace and comments are reported as tokens. The emitted ranges partition the
 * input: they cover {@code [0, length)} in order, without gaps or overlaps.
 * <p>
 * A scanner holds mutable position state and is not thread-safe.
 */
public class Scanner {

    private final Cursor cursor;
    private int start = 0;

    /**
     * Creates a new Scanner.
     * @param source The source buffer. It is borrowed, not copied, and must not be modified while
     *               the scanner or any token range derived from it is in use.
     */
    public Scanner(byte[] source) {
        this.cursor = new Cursor(source);
    }

    /**
     * Creates a scanner over the UTF-8 encoding of the given text.
     * @param source The source text.
     * @return A new scanner.
     */
    public static Scanner of(String source) {
        return new Scanner(source.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Scans the next lexeme.
     * @return The token or error for the next lexeme, or an empty optional once the input is
     *         exhausted. Calling this again after exhaustion keeps returning empty.
     */
    public Optional<ScanResult> next() {
        int c = cursor.advance();
        if (c == Cursor.NONE) {
            return Optional.empty();
        }
        start = cursor.position() - 1;
        return Optional.of(scan(c));
    }

    /**
     * @return The remaining results as a lazy, sequential stream.
     */
    public Stream<ScanResult> stream() {
        Iterator<ScanResult> iterator = new Iterator<>() {
            private ScanResult pending;

            @Override
            public boolean hasNext() {
                if (pending == null) {
                    pending = Scanner.this.next().orElse(null);
                }
                return pending != null;
            }

            @Override
            public ScanResult next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ScanResult result = pending;
                pending = null;
                return result;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private ScanResult scan(int c) {
        return switch (ByteClass.of(c)) {
            case LETTER -> token(identifier());
            case WHITESPACE -> token(whitespace());
            case DIGIT -> number();
            case PUNCTUATION -> token(punctuation(c));
            case OPERATOR -> token(operator(c));
            case SLASH -> token(slash());
            case QUOTE -> string();
            case OTHER -> error(ErrorKind.UNKNOWN);
        };
    }

    private TokenType identifier() {
        while (ByteClass.isAlphaNumeric(cursor.peek())) cursor.advance();
        return Keywords.lookup(cursor.source(), start, cursor.position());
    }

    private TokenType whitespace() {
        while (ByteClass.isWhitespace(cursor.peek())) cursor.advance();
        return TokenType.WHITESPACE;
    }

    private ScanResult number() {
        boolean seenDot = false;
        while (true) {
            int c = cursor.peek();
            if (ByteClass.isDigit(c)) {
                cursor.advance();
            } else if (c == '.' && ByteClass.isDigit(cursor.peek(1))) {
                if (seenDot) {
                    // Swallow the rest of the malformed literal so scanning resumes after it.
                    while (ByteClass.isDigit(cursor.peek()) || cursor.peek() == '.') cursor.advance();
                    return error(ErrorKind.INVALID_NUMBER);
                }
                cursor.advance();
                seenDot = true;
            } else {
                break;
            }
        }
        return token(TokenType.NUMBER);
    }

    private static TokenType punctuation(int c) {
        return switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case '-' -> TokenType.MINUS;
            case '+' -> TokenType.PLUS;
            case ';' -> TokenType.SEMICOLON;
            case '*' -> TokenType.STAR;
            default -> throw new IllegalStateException("Not a punctuation byte: " + c);
        };
    }

    private TokenType operator(int c) {
        boolean equal = match('=');
        return switch (c) {
            case '!' -> equal ? TokenType.BANG_EQUAL : TokenType.BANG;
            case '=' -> equal ? TokenType.EQUAL_EQUAL : TokenType.EQUAL;
            case '<' -> equal ? TokenType.LESS_EQUAL : TokenType.LESS;
            case '>' -> equal ? TokenType.GREATER_EQUAL : TokenType.GREATER;
            default -> throw new IllegalStateException("Not an operator byte: " + c);
        };
    }

    private TokenType slash() {
        if (!match('/')) {
            return TokenType.SLASH;
        }
        // A comment goes until the end of the line.
        while (cursor.peek() != '\n' && !cursor.isAtEnd()) cursor.advance();
        return TokenType.COMMENT_LINE;
    }

    private ScanResult string() {
        while (!cursor.isAtEnd()) {
            if (cursor.advance() == '"') {
                return token(TokenType.STRING);
            }
        }
        return error(ErrorKind.UNFINISHED_STRING);
    }

    private boolean match(int expected) {
        if (cursor.peek() != expected) {
            return false;
        }
        cursor.advance();
        return true;
    }

    private ScanResult token(TokenType type) {
        return ScanResult.ok(type, start, cursor.position());
    }

    private ScanResult error(ErrorKind kind) {
        return ScanResult.error(kind, start, cursor.position());
    }
}
