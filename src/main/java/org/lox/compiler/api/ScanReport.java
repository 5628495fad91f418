package org.lox.compiler.api;

import org.lox.compiler.frontend.lexer.ScanError;
import org.lox.compiler.frontend.lexer.Token;
import org.lox.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a batch scan of one source unit produced.
 * <p>
 * The token and error ranges refer into the source buffer that was scanned; the report keeps
 * a reference to it so lexemes can be sliced out later.
 *
 * @param source The scanned buffer.
 * @param tokens The tokens in source order, including whitespace and comments.
 * @param errors The errors in source order.
 */
public record ScanReport(byte[] source, List<Token> tokens, List<ScanError> errors) {

    public ScanReport {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return The tokens followed by an empty {@link TokenType#EOF} token at the end of the source.
     */
    public List<Token> tokensWithEof() {
        List<Token> result = new ArrayList<>(tokens);
        result.add(new Token(TokenType.EOF, source.length, source.length));
        return result;
    }

    /**
     * @return The tokens without whitespace and comments.
     */
    public List<Token> significantTokens() {
        return tokens.stream().filter(t -> !t.type().isTrivia()).toList();
    }
}
