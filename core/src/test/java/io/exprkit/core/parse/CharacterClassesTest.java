package io.exprkit.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CharacterClassesTest {

    @Test
    void minusAndDotAreNotOperatorCharacters() {
        assertThat(CharacterClasses.isOperator('-')).isFalse();
        assertThat(CharacterClasses.isOperator('.')).isFalse();
        assertThat(CharacterClasses.isOperator('+')).isTrue();
        assertThat(CharacterClasses.isOperator('×')).isTrue();
        assertThat(CharacterClasses.isOperator('→')).isTrue();
    }

    @Test
    void identifierHeads() {
        assertThat(CharacterClasses.isIdentifierHead('_')).isTrue();
        assertThat(CharacterClasses.isIdentifierHead('#')).isTrue();
        assertThat(CharacterClasses.isIdentifierHead('é')).isTrue();
        assertThat(CharacterClasses.isIdentifierHead(0x1F600)).isTrue();
        assertThat(CharacterClasses.isIdentifierHead('1')).isFalse();
        assertThat(CharacterClasses.isIdentifier('1')).isTrue();
        assertThat(CharacterClasses.isIdentifier(0x0301)).isTrue();
    }

    @Test
    void whitespace() {
        assertThat(CharacterClasses.isWhitespace(' ')).isTrue();
        assertThat(CharacterClasses.isWhitespace('\t')).isTrue();
        assertThat(CharacterClasses.isWhitespace(0x00A0)).isFalse();
    }
}
