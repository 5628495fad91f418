package org.lox.compiler.frontend.lexer;

/**
 * The fixed keyword table. Lookups match the exact lexeme, first by length and then by
 * content, so {@code forward} is not mistaken for {@code for}.
 */
final class Keywords {

    private Keywords() {}

    /**
     * @param source The buffer holding the lexeme.
     * @param start The offset of the lexeme.
     * @param end One past the last byte of the lexeme.
     * @return The keyword type, or {@link TokenType#IDENTIFIER} when the lexeme is not a keyword.
     */
    static TokenType lookup(byte[] source, int start, int end) {
        return switch (end - start) {
            case 2 -> {
                if (matches(source, start, "if")) yield TokenType.IF;
                if (matches(source, start, "or")) yield TokenType.OR;
                yield TokenType.IDENTIFIER;
            }
            case 3 -> {
                if (matches(source, start, "and")) yield TokenType.AND;
                if (matches(source, start, "for")) yield TokenType.FOR;
                if (matches(source, start, "fun")) yield TokenType.FUN;
                if (matches(source, start, "var")) yield TokenType.VAR;
                if (matches(source, start, "nil")) yield TokenType.NIL;
                yield TokenType.IDENTIFIER;
            }
            case 4 -> {
                if (matches(source, start, "else")) yield TokenType.ELSE;
                if (matches(source, start, "true")) yield TokenType.TRUE;
                if (matches(source, start, "this")) yield TokenType.THIS;
                yield TokenType.IDENTIFIER;
            }
            case 5 -> {
                if (matches(source, start, "class")) yield TokenType.CLASS;
                if (matches(source, start, "false")) yield TokenType.FALSE;
                if (matches(source, start, "print")) yield TokenType.PRINT;
                if (matches(source, start, "super")) yield TokenType.SUPER;
                if (matches(source, start, "while")) yield TokenType.WHILE;
                yield TokenType.IDENTIFIER;
            }
            case 6 -> matches(source, start, "return") ? TokenType.RETURN : TokenType.IDENTIFIER;
            default -> TokenType.IDENTIFIER;
        };
    }

    // Callers guarantee the lexeme has the keyword's length.
    private static boolean matches(byte[] source, int start, String keyword) {
        for (int i = 0; i < keyword.length(); i++) {
            if (source[start + i] != keyword.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
