package org.pragmatica.regex.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.regex.error.CapacityExceededException;
import org.pragmatica.regex.grammar.TokenKind;
import org.pragmatica.regex.tree.ParseNode;
import org.pragmatica.regex.tree.ParseTree;

import static org.junit.jupiter.api.Assertions.*;

class TerminalMatcherTest {

    private static ParsingContext context(String input, ParserConfig config) {
        return ParsingContext.create(input, config, config.newTree());
    }

    private static ParsingContext context(String input) {
        return context(input, ParserConfig.DEFAULT);
    }

    private static void assertMatched(ParsingContext ctx, ParseNode parent, ParseResult result, String label) {
        assertTrue(result.isSuccess());
        var success = (ParseResult.Success) result;
        assertEquals(label, success.node().label());
        assertEquals(1, success.end());
        assertEquals(1, ctx.pos());
        assertEquals(1, parent.childCount());
        assertSame(success.node(), parent.child(0));
    }

    private static void assertUnmatched(ParsingContext ctx, ParseNode parent, ParseResult result) {
        assertTrue(result.isFailure());
        assertEquals(0, ctx.pos());
        assertEquals(0, parent.childCount());
        assertEquals(1, ctx.tree().liveNodes());
    }

    @Test
    void emptyMarker_matchesHash() {
        var ctx = context("#");
        var parent = ctx.tree().initRoot();

        assertMatched(ctx, parent, TerminalMatcher.emptyMarker(ctx, parent), "#");
    }

    @Test
    void emptyMarker_customCharacterIsUsedAsLabel() {
        var config = new ParserConfig(15, 4, '~', true);
        var ctx = context("~", config);
        var parent = ctx.tree().initRoot();

        assertMatched(ctx, parent, TerminalMatcher.emptyMarker(ctx, parent), "~");
    }

    @Test
    void symbol_labelsLeafWithMatchedCharacter() {
        var ctx = context("Z");
        var parent = ctx.tree().initRoot();

        assertMatched(ctx, parent, TerminalMatcher.symbol(ctx, parent), "Z");
    }

    @Test
    void parensAndOperators_matchTheirCharacter() {
        var cases = new Object[][]{
            {"(", TokenKind.LEFT_PAREN},
            {")", TokenKind.RIGHT_PAREN},
            {"*", TokenKind.STAR},
            {"+", TokenKind.PLUS}
        };
        for (var c : cases) {
            var input = (String) c[0];
            var ctx = context(input);
            var parent = ctx.tree().initRoot();

            assertMatched(ctx, parent, TerminalMatcher.match(ctx, (TokenKind) c[1], parent), input);
        }
    }

    @Test
    void namedMatchers_delegateToTheirClass() {
        var ctx = context("()*+");
        var parent = ctx.tree().initRoot();

        assertTrue(TerminalMatcher.leftParen(ctx, parent).isSuccess());
        assertTrue(TerminalMatcher.rightParen(ctx, parent).isSuccess());
        assertTrue(TerminalMatcher.star(ctx, parent).isSuccess());
        assertTrue(TerminalMatcher.plus(ctx, parent).isSuccess());
        assertEquals("()*+", parent.leafText());
        assertTrue(ctx.isAtEnd());
    }

    @Test
    void mismatch_leavesTreeAndPositionUntouched() {
        var ctx = context("a");
        var parent = ctx.tree().initRoot();

        assertUnmatched(ctx, parent, TerminalMatcher.star(ctx, parent));
        assertEquals("'*'", ctx.furthestExpected());
    }

    @Test
    void endOfInput_isMismatch() {
        var ctx = context("");
        var parent = ctx.tree().initRoot();

        assertUnmatched(ctx, parent, TerminalMatcher.symbol(ctx, parent));
    }

    @Test
    void unknownCharacter_matchesNoTerminal() {
        var ctx = context("-");
        var parent = ctx.tree().initRoot();

        for (var kind : TokenKind.values()) {
            assertUnmatched(ctx, parent, TerminalMatcher.match(ctx, kind, parent));
        }
    }

    @Test
    void match_inspectsOnlyCurrentPosition() {
        var ctx = context("ab");
        var parent = ctx.tree().initRoot();

        TerminalMatcher.symbol(ctx, parent);
        var second = TerminalMatcher.symbol(ctx, parent);

        assertEquals(2, ((ParseResult.Success) second).end());
        assertEquals("ab", parent.leafText());
        assertEquals(3, ctx.tree().liveNodes());
    }

    @Test
    void match_intoFullParent_surfacesCapacityError() {
        var config = new ParserConfig(15, 4, '#', true);
        var tree = ParseTree.create(15, 1);
        var ctx = ParsingContext.create("ab", config, tree);
        var parent = tree.initRoot();
        TerminalMatcher.symbol(ctx, parent);

        assertThrows(CapacityExceededException.class, () -> TerminalMatcher.symbol(ctx, parent));
        assertEquals(1, parent.childCount());
        assertEquals(1, ctx.pos());
        assertEquals(2, tree.liveNodes());
    }
}
