package org.pragmatica.regex.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenKindTest {

    @Test
    void symbol_acceptsLettersDigitsAndUnderscore() {
        for (var c : "azAZ09_".toCharArray()) {
            assertTrue(TokenKind.SYMBOL.matches(c, '#'), "should accept " + c);
        }
    }

    @Test
    void symbol_rejectsOperatorsAndOtherCharacters() {
        for (var c : "#()*+- .é".toCharArray()) {
            assertFalse(TokenKind.SYMBOL.matches(c, '#'), "should reject " + c);
        }
    }

    @Test
    void emptyMarker_followsConfiguredCharacter() {
        assertTrue(TokenKind.EMPTY_MARKER.matches('#', '#'));
        assertFalse(TokenKind.EMPTY_MARKER.matches('#', '~'));
        assertTrue(TokenKind.EMPTY_MARKER.matches('~', '~'));
    }

    @Test
    void operators_matchTheirLiteral() {
        assertTrue(TokenKind.LEFT_PAREN.matches('(', '#'));
        assertTrue(TokenKind.RIGHT_PAREN.matches(')', '#'));
        assertTrue(TokenKind.STAR.matches('*', '#'));
        assertTrue(TokenKind.PLUS.matches('+', '#'));
        assertFalse(TokenKind.PLUS.matches('*', '#'));
    }

    @Test
    void expected_describesClass() {
        assertEquals("symbol", TokenKind.SYMBOL.expected('#'));
        assertEquals("'~'", TokenKind.EMPTY_MARKER.expected('~'));
        assertEquals("')'", TokenKind.RIGHT_PAREN.expected('#'));
    }

    @Test
    void literal_ofSymbol_isUndefined() {
        assertThrows(IllegalStateException.class, TokenKind.SYMBOL::literal);
        assertEquals('*', TokenKind.STAR.literal());
    }

    @Test
    void isTokenChar_coversWholeAlphabet() {
        for (var c : "#()*+a_9".toCharArray()) {
            assertTrue(TokenKind.isTokenChar(c, '#'));
        }
        assertFalse(TokenKind.isTokenChar('-', '#'));
        assertFalse(TokenKind.isTokenChar(' ', '#'));
    }
}
