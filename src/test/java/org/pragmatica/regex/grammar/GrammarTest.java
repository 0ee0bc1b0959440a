package org.pragmatica.regex.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.regex.error.GrammarException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.regex.grammar.Symbol.ref;
import static org.pragmatica.regex.grammar.Symbol.terminal;

class GrammarTest {

    // === Standard grammar ===

    @Test
    void standard_startsFromRe() {
        var grammar = RegexGrammar.standard();

        assertEquals(RegexGrammar.RE, grammar.effectiveStartRule().name());
        assertTrue(grammar.rule(RegexGrammar.RE_PRIME).isPresent());
    }

    @Test
    void standard_reAlternativesKeepPriorityOrder() {
        var alternatives = RegexGrammar.standard()
                                       .rule(RegexGrammar.RE)
                                       .orElseThrow()
                                       .alternatives();

        assertEquals(List.of(
                         "empty_marker RE'",
                         "symbol RE'",
                         "left_paren RE right_paren RE'",
                         "left_paren RE right_paren",
                         "empty_marker",
                         "symbol"),
                     alternatives.stream().map(Alternative::toString).toList());
    }

    @Test
    void standard_rePrimeAlternativesKeepPriorityOrder() {
        var alternatives = RegexGrammar.standard()
                                       .rule(RegexGrammar.RE_PRIME)
                                       .orElseThrow()
                                       .alternatives();

        assertEquals(List.of(
                         "plus RE RE'",
                         "plus RE",
                         "star RE'",
                         "RE RE'",
                         "RE",
                         "star"),
                     alternatives.stream().map(Alternative::toString).toList());
    }

    @Test
    void standard_validatesWithDefaultBounds() {
        assertDoesNotThrow(() -> RegexGrammar.standard().validate(15, 4));
    }

    @Test
    void standard_widestAlternativeNeedsFourChildren() {
        var e = assertThrows(GrammarException.class, () -> RegexGrammar.standard().validate(15, 3));

        assertTrue(e.getMessage().contains("left_paren RE right_paren RE'"));
    }

    @Test
    void standard_ruleNamesMustFitLabels() {
        assertThrows(GrammarException.class, () -> RegexGrammar.standard().validate(2, 4));
    }

    // === Validation ===

    @Test
    void validate_undefinedReference_fails() {
        var grammar = new Grammar(List.of(Rule.of("A", Alternative.of(ref("B")))), "A");

        var e = assertThrows(GrammarException.class, () -> grammar.validate(15, 4));

        assertEquals("Undefined rule reference: 'B'", e.getMessage());
    }

    @Test
    void validate_undefinedStartRule_fails() {
        var grammar = new Grammar(List.of(Rule.of("A", Alternative.of(terminal(TokenKind.STAR)))), "Z");

        assertThrows(GrammarException.class, () -> grammar.validate(15, 4));
    }

    @Test
    void validate_duplicateRule_fails() {
        var grammar = new Grammar(List.of(
            Rule.of("A", Alternative.of(terminal(TokenKind.STAR))),
            Rule.of("A", Alternative.of(terminal(TokenKind.PLUS)))), "A");

        assertThrows(GrammarException.class, () -> grammar.validate(15, 4));
    }

    @Test
    void validate_emptyAlternative_fails() {
        var grammar = new Grammar(List.of(Rule.of("A", Alternative.of())), "A");

        assertThrows(GrammarException.class, () -> grammar.validate(15, 4));
    }

    @Test
    void validate_ruleWithoutAlternatives_fails() {
        var grammar = new Grammar(List.of(Rule.of("A")), "A");

        assertThrows(GrammarException.class, () -> grammar.validate(15, 4));
    }

    @Test
    void validate_noRules_fails() {
        var grammar = new Grammar(List.of(), "A");

        assertThrows(GrammarException.class, () -> grammar.validate(15, 4));
    }

    @Test
    void toString_listsRulesInPegNotation() {
        var grammar = new Grammar(List.of(
            Rule.of("A", Alternative.of(terminal(TokenKind.SYMBOL), ref("A")), Alternative.of(terminal(TokenKind.SYMBOL)))), "A");

        assertEquals("A <- symbol A / symbol", grammar.toString());
    }
}
