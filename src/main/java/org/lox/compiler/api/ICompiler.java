package org.lox.compiler.api;

import org.lox.compiler.frontend.lexer.Token;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for scanning whole source units.
 */
public interface ICompiler {

    /**
     * Scans the source to exhaustion without failing, collecting tokens and errors.
     *
     * @param source The source buffer. It is not copied and must not be modified afterwards.
     * @return The tokens and errors, in source order.
     */
    ScanReport scan(byte[] source);

    /**
     * Scans the source and fails if any lexeme could not be recognized.
     *
     * @param source The source buffer.
     * @param sourceName A name for the source, used in diagnostics.
     * @return The tokens of a cleanly scanned unit.
     * @throws CompilationException if at least one scan error occurred.
     */
    List<Token> compile(byte[] source, String sourceName) throws CompilationException;

    /**
     * Scans the source code from a file.
     * @param path The path to the source file.
     * @return The tokens of a cleanly scanned unit.
     * @throws CompilationException if at least one scan error occurred.
     * @throws IOException if the file cannot be read.
     */
    default List<Token> compile(Path path) throws CompilationException, IOException {
        return compile(Files.readAllBytes(path), path.toString());
    }
}
