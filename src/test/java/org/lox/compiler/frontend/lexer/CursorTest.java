package org.lox.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link Cursor}.
 */
@Tag("unit")
class CursorTest {

    @Test
    void emptySourceHasNothingToReadOrPeek() {
        Cursor cursor = new Cursor(new byte[0]);

        assertThat(cursor.peek()).isEqualTo(Cursor.NONE);
        assertThat(cursor.advance()).isEqualTo(Cursor.NONE);
        assertThat(cursor.position()).isZero();
        assertThat(cursor.isAtEnd()).isTrue();
    }

    @Test
    void peekLooksAheadWithoutConsuming() {
        Cursor cursor = new Cursor(bytes("ab"));

        assertThat(cursor.peek()).isEqualTo('a');
        assertThat(cursor.peek(1)).isEqualTo('b');
        assertThat(cursor.peek(2)).isEqualTo(Cursor.NONE);
        assertThat(cursor.peek(-1)).isEqualTo(Cursor.NONE);
        assertThat(cursor.position()).isZero();
        assertThat(cursor.current()).isEqualTo(Cursor.NONE);
    }

    @Test
    void advanceShiftsCurrentIntoPrevious() {
        Cursor cursor = new Cursor(bytes("ab"));

        assertThat(cursor.advance()).isEqualTo('a');
        assertThat(cursor.position()).isEqualTo(1);
        assertThat(cursor.current()).isEqualTo('a');
        assertThat(cursor.previous()).isEqualTo(Cursor.NONE);
        assertThat(cursor.peek()).isEqualTo('b');

        assertThat(cursor.advance()).isEqualTo('b');
        assertThat(cursor.position()).isEqualTo(2);
        assertThat(cursor.current()).isEqualTo('b');
        assertThat(cursor.previous()).isEqualTo('a');
    }

    @Test
    void advancePastEndIsANoOp() {
        Cursor cursor = new Cursor(bytes("x"));
        cursor.advance();

        for (int i = 0; i < 3; i++) {
            assertThat(cursor.advance()).isEqualTo(Cursor.NONE);
        }
        assertThat(cursor.position()).isEqualTo(1);
        assertThat(cursor.current()).isEqualTo('x');
        assertThat(cursor.previous()).isEqualTo(Cursor.NONE);
    }

    @Test
    void farLookaheadIsOutOfBoundsRatherThanOverflowing() {
        Cursor cursor = new Cursor(bytes("ab"));
        cursor.advance();

        assertThat(cursor.peek(Integer.MAX_VALUE)).isEqualTo(Cursor.NONE);
        assertThat(cursor.peek(Integer.MAX_VALUE - 1)).isEqualTo(Cursor.NONE);
        assertThat(cursor.peek(Integer.MIN_VALUE)).isEqualTo(Cursor.NONE);
        assertThat(cursor.peek(0)).isEqualTo('b');
    }

    @Test
    void bytesAreReturnedUnsigned() {
        Cursor cursor = new Cursor(new byte[]{(byte) 0xFF, (byte) 0x80});

        assertThat(cursor.peek(1)).isEqualTo(0x80);
        assertThat(cursor.advance()).isEqualTo(0xFF);
    }

    @Test
    void sourceIsBorrowedNotCopied() {
        byte[] source = bytes("abc");
        Cursor cursor = new Cursor(source);

        assertThat(cursor.source()).isSameAs(source);
        assertThat(cursor.length()).isEqualTo(3);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
