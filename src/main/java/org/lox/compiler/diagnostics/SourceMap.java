package org.lox.compiler.diagnostics;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Maps byte offsets of a source buffer to lines and columns.
 * <p>
 * The scanner only deals in byte offsets; line and column information is derived here, on the
 * reporting side. Lines are separated by '\n'; a '\r' right before it is not part of the line text.
 */
public final class SourceMap {

    private final byte[] source;
    private final int[] lineStarts;

    public SourceMap(byte[] source) {
        this.source = source;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length; i++) {
            if (source[i] == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    /**
     * @param offset A byte offset in {@code [0, length]}.
     * @return The line and column of that offset.
     */
    public SourceLocation locate(int offset) {
        if (offset < 0 || offset > source.length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + source.length + "]");
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new SourceLocation(line + 1, offset - lineStarts[line] + 1);
    }

    /**
     * @return The location of the first byte of the range.
     */
    public SourceLocation startOf(int start, int end) {
        return locate(start);
    }

    /**
     * @return The location of the last byte of the range (not one past it).
     */
    public SourceLocation endOf(int start, int end) {
        return locate(end > start ? end - 1 : start);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * @param line A 1-based line number.
     * @return The offset of the first byte of the line.
     */
    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * @param line A 1-based line number.
     * @return The offset one past the last byte of the line text, excluding the line terminator.
     */
    public int lineEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] - 1 : source.length;
        if (end > lineStarts[line - 1] && source[end - 1] == '\r') {
            end--;
        }
        return end;
    }

    public String lineText(int line) {
        int start = lineStart(line);
        return new String(source, start, lineEnd(line) - start, StandardCharsets.UTF_8);
    }

    public byte[] source() {
        return source;
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("Line " + line + " outside [1, " + lineStarts.length + "]");
        }
    }
}
