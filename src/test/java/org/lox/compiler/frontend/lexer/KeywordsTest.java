package org.lox.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class KeywordsTest {

    @Test
    void lookupUsesOnlyTheGivenRange() {
        byte[] source = "xxwhilexx".getBytes(StandardCharsets.US_ASCII);

        assertThat(Keywords.lookup(source, 2, 7)).isEqualTo(TokenType.WHILE);
        assertThat(Keywords.lookup(source, 2, 6)).isEqualTo(TokenType.IDENTIFIER);
        assertThat(Keywords.lookup(source, 1, 7)).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void lengthsWithoutKeywordsAreIdentifiers() {
        byte[] source = "abcdefgh".getBytes(StandardCharsets.US_ASCII);

        assertThat(Keywords.lookup(source, 0, 1)).isEqualTo(TokenType.IDENTIFIER);
        assertThat(Keywords.lookup(source, 0, 7)).isEqualTo(TokenType.IDENTIFIER);
        assertThat(Keywords.lookup(source, 0, 8)).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void everyByteClassIsReachable() {
        assertThat(ByteClass.of('q')).isEqualTo(ByteClass.LETTER);
        assertThat(ByteClass.of('_')).isEqualTo(ByteClass.LETTER);
        assertThat(ByteClass.of('7')).isEqualTo(ByteClass.DIGIT);
        assertThat(ByteClass.of('\r')).isEqualTo(ByteClass.WHITESPACE);
        assertThat(ByteClass.of(';')).isEqualTo(ByteClass.PUNCTUATION);
        assertThat(ByteClass.of('<')).isEqualTo(ByteClass.OPERATOR);
        assertThat(ByteClass.of('/')).isEqualTo(ByteClass.SLASH);
        assertThat(ByteClass.of('"')).isEqualTo(ByteClass.QUOTE);
        assertThat(ByteClass.of('$')).isEqualTo(ByteClass.OTHER);
        assertThat(ByteClass.of(0xE9)).isEqualTo(ByteClass.OTHER);
    }
}
