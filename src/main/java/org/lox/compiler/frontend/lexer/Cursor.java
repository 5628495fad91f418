package org.lox.compiler.frontend.lexer;

/**
 * A forward-only reader over an immutable byte buffer.
 * <p>
 * The cursor never copies the buffer it is given and never moves backwards. Bytes are
 * returned as unsigned values in the range 0..255, or {@link #NONE} when no byte is available.
 */
public final class Cursor {

    /** Returned by {@link #peek(int)} and {@link #advance()} when there is no byte. */
    public static final int NONE = -1;

    private final byte[] source;
    private int position = 0;
    private int previous = NONE;
    private int current = NONE;

    /**
     * Creates a cursor positioned before the first byte of the given buffer.
     * @param source The buffer to read. It is borrowed, not copied.
     */
    public Cursor(byte[] source) {
        this.source = source;
    }

    /**
     * Returns the next unconsumed byte without consuming it.
     * @return The byte, or {@link #NONE} at the end of the input.
     */
    public int peek() {
        return peek(0);
    }

    /**
     * Looks ahead {@code n} bytes past the current position without consuming anything.
     * @param n The distance from the next unconsumed byte; 0 is the next byte itself.
     * @return The byte at {@code position + n}, or {@link #NONE} if that is out of bounds.
     */
    public int peek(int n) {
        if (n < 0 || n >= source.length - position) {
            return NONE;
        }
        return source[position + n] & 0xFF;
    }

    /**
     * Consumes one byte.
     * At the end of the input this is a no-op, so it is safe to call repeatedly.
     * @return The consumed byte, or {@link #NONE} if the input is exhausted.
     */
    public int advance() {
        if (position >= source.length) {
            return NONE;
        }
        previous = current;
        current = source[position++] & 0xFF;
        return current;
    }

    public int position() {
        return position;
    }

    public int previous() {
        return previous;
    }

    public int current() {
        return current;
    }

    public int length() {
        return source.length;
    }

    public boolean isAtEnd() {
        return position >= source.length;
    }

    byte[] source() {
        return source;
    }
}
