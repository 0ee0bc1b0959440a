package org.pragmatica.regex.parser;

import org.pragmatica.regex.grammar.TokenKind;
import org.pragmatica.regex.tree.ParseNode;

/**
 * Single-character recognizers for the terminal classes.
 *
 * <p>A match attaches exactly one leaf, labeled with the matched character, to the
 * destination parent and advances one position. A mismatch changes neither the tree
 * nor the position.
 */
public final class TerminalMatcher {
    private TerminalMatcher() {}

    public static ParseResult match(ParsingContext ctx, TokenKind kind, ParseNode parent) {
        var emptyMarker = ctx.config().emptyMarker();
        if (ctx.isAtEnd() || !kind.matches(ctx.peek(), emptyMarker)) {
            var expected = kind.expected(emptyMarker);
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.pos(), expected);
        }

        var leaf = ctx.tree()
                      .addChild(parent, String.valueOf(ctx.peek()));
        ctx.advance();
        return ParseResult.Success.of(leaf, ctx.pos());
    }

    public static ParseResult emptyMarker(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.EMPTY_MARKER, parent);
    }

    public static ParseResult symbol(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.SYMBOL, parent);
    }

    public static ParseResult leftParen(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.LEFT_PAREN, parent);
    }

    public static ParseResult rightParen(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.RIGHT_PAREN, parent);
    }

    public static ParseResult star(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.STAR, parent);
    }

    public static ParseResult plus(ParsingContext ctx, ParseNode parent) {
        return match(ctx, TokenKind.PLUS, parent);
    }
}
