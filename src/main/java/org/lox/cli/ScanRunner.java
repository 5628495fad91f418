package org.lox.cli;

import org.lox.cli.config.CliSettings;
import org.lox.cli.rendering.TokenRenderer;
import org.lox.compiler.api.CompilationException;
import org.lox.compiler.api.ICompiler;
import org.lox.compiler.diagnostics.DiagnosticRenderer;
import org.lox.compiler.frontend.lexer.Token;
import org.lox.compiler.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Scans one source unit and reports the outcome: tokens on {@code out}, diagnostics on {@code err}.
 * Shared by the file driver and the REPL.
 */
public class ScanRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScanRunner.class);

    private final ICompiler compiler;
    private final CliSettings settings;
    private final TokenRenderer tokenRenderer = new TokenRenderer();
    private final DiagnosticRenderer diagnosticRenderer;

    public ScanRunner(ICompiler compiler, CliSettings settings) {
        this.compiler = compiler;
        this.settings = settings;
        this.diagnosticRenderer = new DiagnosticRenderer(settings.contextLines(), settings.color());
    }

    /**
     * Reads and scans a file.
     *
     * @return {@link CommandLineInterface#EXIT_OK}, {@link CommandLineInterface#EXIT_SCAN_ERRORS}
     *         or {@link CommandLineInterface#EXIT_IO_ERROR}.
     */
    public int runFile(Path path, PrintWriter out, PrintWriter err) {
        final byte[] source;
        try {
            source = Files.readAllBytes(path);
        } catch (IOException e) {
            LOG.error("Failed to read {}", path, e);
            err.printf("Error: Failed to read \"%s\": %s%n", path, e.getMessage());
            err.flush();
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        return run(source, path.toString(), out, err)
                ? CommandLineInterface.EXIT_OK
                : CommandLineInterface.EXIT_SCAN_ERRORS;
    }

    /**
     * Scans a single REPL line.
     *
     * @return {@code true} if the line scanned without errors.
     */
    public boolean runLine(String line, String sourceName, PrintWriter out, PrintWriter err) {
        return run(line.getBytes(StandardCharsets.UTF_8), sourceName, out, err);
    }

    /**
     * Scans a buffer, printing the recognized tokens even when the unit fails.
     *
     * @return {@code true} if the buffer scanned without errors.
     */
    public boolean run(byte[] source, String sourceName, PrintWriter out, PrintWriter err) {
        try {
            printTokens(compiler.compile(source, sourceName), source, out);
            return true;
        } catch (CompilationException e) {
            printTokens(e.getReport().tokens(), source, out);
            err.printf("Error: Failed to compile with %d error(s):%n", e.getErrorCount());
            err.print(diagnosticRenderer.renderAll(e.getDiagnostics()));
            err.flush();
            return false;
        }
    }

    private void printTokens(List<Token> tokens, byte[] source, PrintWriter out) {
        if (!settings.printTokens()) {
            return;
        }
        for (Token token : tokens) {
            if (settings.showTrivia() || !token.type().isTrivia()) {
                out.println(tokenRenderer.render(token, source));
            }
        }
        if (settings.appendEof()) {
            out.println(tokenRenderer.render(new Token(TokenType.EOF, source.length, source.length), source));
        }
        out.flush();
    }
}
