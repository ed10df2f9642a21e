package org.stabel.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenSequenceTest {

    private static Token id(String name) {
        return new Token(TokenType.IDENTIFIER, name, name, 1, 1, "<memory>");
    }

    @Test
    void neighborsOutsideTheSequenceAreAbsent() {
        TokenSequence tokens = new TokenSequence(List.of(id("a"), id("b")));

        assertThat(tokens.previous(0)).isEmpty();
        assertThat(tokens.next(1)).isEmpty();
        assertThat(tokens.at(-1)).isEmpty();
        assertThat(tokens.at(2)).isEmpty();
        assertThat(tokens.next(0)).get().extracting(Token::text).isEqualTo("b");
        assertThat(tokens.previous(1)).get().extracting(Token::text).isEqualTo("a");
    }

    @Test
    void emptySequenceHasNoTokens() {
        TokenSequence tokens = new TokenSequence(List.of());

        assertThat(tokens.isEmpty()).isTrue();
        assertThat(tokens.size()).isZero();
        assertThat(tokens.at(0)).isEmpty();
    }

    @Test
    void sequenceIsDetachedFromTheSourceList() {
        List<Token> source = new ArrayList<>(List.of(id("a")));
        TokenSequence tokens = new TokenSequence(source);

        source.add(id("b"));

        assertThat(tokens.size()).isEqualTo(1);
        assertThatThrownBy(() -> tokens.asList().add(id("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
