package org.lox.compiler;

import org.lox.compiler.api.CompilationException;
import org.lox.compiler.api.ICompiler;
import org.lox.compiler.api.ScanReport;
import org.lox.compiler.diagnostics.DiagnosticsEngine;
import org.lox.compiler.diagnostics.SourceMap;
import org.lox.compiler.frontend.lexer.ScanError;
import org.lox.compiler.frontend.lexer.ScanResult;
import org.lox.compiler.frontend.lexer.Scanner;
import org.lox.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the {@link Scanner} over whole source units.
 * <p>
 * Every call works on fresh state: the error aggregate is returned to the caller instead of
 * being remembered, so consecutive units (e.g. REPL lines) do not influence each other.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    @Override
    public ScanReport scan(byte[] source) {
        Scanner scanner = new Scanner(source);
        List<Token> tokens = new ArrayList<>();
        List<ScanError> errors = new ArrayList<>();

        Optional<ScanResult> next;
        while ((next = scanner.next()).isPresent()) {
            ScanResult result = next.get();
            if (result instanceof ScanResult.Ok ok) {
                tokens.add(ok.token());
            } else if (result instanceof ScanResult.Err err) {
                errors.add(err.error());
            }
        }
        return new ScanReport(source, tokens, errors);
    }

    @Override
    public List<Token> compile(byte[] source, String sourceName) throws CompilationException {
        ScanReport report = scan(source);
        LOG.debug("Scanned {}: {} bytes, {} tokens, {} errors",
                sourceName, source.length, report.tokens().size(), report.errors().size());

        if (!report.hasErrors()) {
            return report.tokens();
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName, new SourceMap(source));
        for (ScanError error : report.errors()) {
            diagnostics.reportError(describe(error, source), error.start(), error.end());
        }
        throw new CompilationException(
                String.format("%s failed to compile with %d error(s):%n%s", sourceName, diagnostics.errorCount(), diagnostics.summary()),
                report, diagnostics);
    }

    /**
     * @return A message naming the error kind and the offending lexeme, e.g. {@code Invalid number '9.9.9'}.
     */
    static String describe(ScanError error, byte[] source) {
        return error.kind().description() + " '" + error.lexeme(source) + "'";
    }
}
