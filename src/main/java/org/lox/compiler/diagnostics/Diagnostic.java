package org.lox.compiler.diagnostics;

/**
 * Represents a single error that occurs while scanning a source unit.
 *
 * @param message The diagnostic message.
 * @param fileName The name of the source the issue occurred in.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column of the issue.
 * @param start The byte offset where the offending range starts.
 * @param end The byte offset one past the end of the offending range.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        int start,
        int end
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
