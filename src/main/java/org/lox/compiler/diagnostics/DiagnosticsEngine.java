package org.lox.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages for one source unit.
 * <p>
 * An engine belongs to a single batch scan; a new one is created for every unit so that
 * diagnostics never leak between runs.
 */
public class DiagnosticsEngine {

    private final String fileName;
    private final SourceMap sourceMap;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param fileName The name reported for the source unit.
     * @param sourceMap Line information for the source unit.
     */
    public DiagnosticsEngine(String fileName, SourceMap sourceMap) {
        this.fileName = fileName;
        this.sourceMap = sourceMap;
    }

    /**
     * Reports an error over the byte range {@code [start, end)}.
     *
     * @param message The error message.
     * @param start The first offending byte.
     * @param end One past the last offending byte.
     */
    public void reportError(String message, int start, int end) {
        SourceLocation location = sourceMap.startOf(start, end);
        diagnostics.add(new Diagnostic(message, fileName, location.line(), location.column(), start, end));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public long errorCount() {
        return diagnostics.size();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public SourceMap getSourceMap() {
        return sourceMap;
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
