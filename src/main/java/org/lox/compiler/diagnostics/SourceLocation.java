package org.lox.compiler.diagnostics;

/**
 * A human-facing position in a source buffer.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column, counted in bytes.
 */
public record SourceLocation(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
