package org.lox.compiler.api;

import org.lox.compiler.diagnostics.DiagnosticsEngine;

/**
 * An exception that is thrown when a source unit scanned with one or more errors.
 * <p>
 * The unit as a whole counts as failed, but the valid tokens that were recognized stay
 * available through {@link #getReport()}.
 */
public class CompilationException extends Exception {

    private final transient ScanReport report;
    private final transient DiagnosticsEngine diagnostics;

    /**
     * Constructs a new compilation exception for a failed batch scan.
     * @param message The detail message.
     * @param report The complete scan result, tokens included.
     * @param diagnostics The diagnostics reported for the unit.
     */
    public CompilationException(String message, ScanReport report, DiagnosticsEngine diagnostics) {
        super(message);
        this.report = report;
        this.diagnostics = diagnostics;
    }

    public ScanReport getReport() {
        return report;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public int getErrorCount() {
        return report.errors().size();
    }
}
