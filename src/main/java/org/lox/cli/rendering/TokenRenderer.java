package org.lox.cli.rendering;

import org.lox.compiler.frontend.lexer.Token;

/**
 * Formats tokens as one line each: type, byte range and the quoted lexeme.
 * <pre>
 * IDENTIFIER    [4, 9) 'count'
 * </pre>
 */
public class TokenRenderer {

    public String render(Token token, byte[] source) {
        return String.format("%-13s [%d, %d) '%s'", token.type(), token.start(), token.end(), escape(token.lexeme(source)));
    }

    static String escape(String lexeme) {
        StringBuilder sb = new StringBuilder(lexeme.length());
        for (int i = 0; i < lexeme.length(); i++) {
            char c = lexeme.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
