package org.pragmatica.regex.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.regex.error.CapacityExceededException;
import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.grammar.Alternative;
import org.pragmatica.regex.grammar.Grammar;
import org.pragmatica.regex.grammar.Rule;
import org.pragmatica.regex.grammar.Symbol;
import org.pragmatica.regex.grammar.TokenKind;
import org.pragmatica.regex.tree.NodeShape;
import org.pragmatica.regex.tree.ParseNode;
import org.pragmatica.regex.tree.ParseTree;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Recursive-descent backtracking engine - interprets an ordered-choice Grammar and
 * grows the derivation tree in place while it speculates.
 *
 * <p>Every rule application attaches its own node to the caller's node up front and
 * tries the rule's alternatives in order. When an alternative fails part way, the
 * children it added are freed and the position is restored before the next one is
 * tried. The first alternative that succeeds is final: a later failure of the caller
 * never reopens it. When all alternatives fail the rule's node is detached and freed.
 *
 * <p>With packrat enabled, the outcome of each (rule, position) pair is computed once per
 * parse. A repeated failure returns immediately; a repeated success replays the
 * remembered subtree shape into fresh nodes, so ownership and rollback work exactly as
 * for a subtree built the first time.
 *
 * <p>Rule applications may nest at most {@link ParserConfig#maxDepth()} levels deep. Going
 * past the bound rejects the whole input with a capacity error, the same way an
 * overfull node does, so recursion depth stays proportional to the bound rather than to
 * the input length.
 *
 * <p>The engine is immutable; all per-parse state lives in {@link ParsingContext}.
 */
public final class BacktrackingEngine implements Parser {
    private static final Logger log = LogManager.getLogger();

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;

    private BacktrackingEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
    }

    /**
     * @throws org.pragmatica.regex.error.GrammarException if the grammar does not fit the configured bounds
     */
    public static BacktrackingEngine create(Grammar grammar, ParserConfig config) {
        grammar.validate(config.maxLabelLength(), config.maxChildren());
        return new BacktrackingEngine(grammar, config);
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseOutcome parse(String input) {
        return parseInto(input, grammar.startRule(), config.newTree());
    }

    @Override
    public ParseOutcome parse(String input, String startRule) {
        return parseInto(input, startRule, config.newTree());
    }

    @Override
    public ParseOutcome parseInto(String input, ParseTree tree) {
        return parseInto(input, grammar.startRule(), tree);
    }

    @Override
    public ParseOutcome parseInto(String input, String startRule, ParseTree tree) {
        checkNotNull(input, "input");
        checkNotNull(tree, "tree");
        checkArgument(tree.liveNodes() == 0, "tree must be empty, has %s live nodes", tree.liveNodes());
        var rule = rules.get(startRule);
        checkArgument(rule != null, "Unknown rule: %s", startRule);

        log.debug("Parsing '{}' from {}", input, startRule);
        var ctx = ParsingContext.create(input, config, tree);
        try {
            var result = parseRule(ctx, rule, tree.initRoot());

            if (result.isFailure()) {
                return reject(ctx, exhausted(ctx, rule));
            }

            // The derivation is already committed under Root; trailing input still rejects it
            if (!ctx.isAtEnd()) {
                return reject(ctx, new ParseError.IncompleteConsumption(ctx.pos(), ctx.describeAt(ctx.pos())));
            }
        } catch (CapacityExceededException e) {
            return reject(ctx, new ParseError.CapacityExceeded(ctx.pos(), e.getMessage()));
        }

        log.debug("Accepted '{}': {} nodes, {} packrat hits", input, tree.liveNodes(), ctx.cacheHits());
        return new ParseOutcome.Accepted(input, tree);
    }

    private ParseOutcome reject(ParsingContext ctx, ParseError error) {
        var tree = ctx.tree();
        tree.root()
            .ifPresent(tree::freeAllChildren);
        tree.release();
        log.debug("Rejected '{}': {}", ctx.input(), error.message());
        return new ParseOutcome.Rejected(ctx.input(), error);
    }

    private ParseError exhausted(ParsingContext ctx, Rule rule) {
        var location = ctx.furthestPos();
        var found = ctx.describeAt(location);
        var lexicallyValid = location < ctx.input().length()
                             && TokenKind.isTokenChar(ctx.input().charAt(location), config.emptyMarker());
        return lexicallyValid
               ? new ParseError.GrammarExhausted(location, rule.name(), found, ctx.furthestExpected())
               : new ParseError.LexicalReject(location, found, ctx.furthestExpected());
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule, ParseNode parent) {
        var start = ctx.pos();

        var cached = ctx.getCachedAt(rule.name(), start);
        if (cached.isPresent()) {
            ctx.replayReach(cached.get().reach());
            if (cached.get() instanceof MemoEntry.Matched matched) {
                log.trace("{} replayed at {}", rule.name(), start);
                var node = ctx.tree().graft(parent, matched.shape());
                ctx.advanceTo(matched.end());
                return ParseResult.Success.of(node, matched.end());
            }
            log.trace("{} known to fail at {}", rule.name(), start);
            return ParseResult.Failure.at(start, rule.name());
        }

        var outer = ctx.beginReach();
        ctx.enterRule();
        ParseResult result;
        try {
            result = parseAlternatives(ctx, rule, parent);
        } finally {
            ctx.exitRule();
        }
        var reach = ctx.endReach(outer);

        if (ctx.config().packratEnabled()) {
            ctx.cacheAt(rule.name(), start, result instanceof ParseResult.Success success
                                            ? MemoEntry.matched(NodeShape.of(success.node()), success.end(), reach)
                                            : MemoEntry.failed(reach));
        }
        return result;
    }

    private ParseResult parseAlternatives(ParsingContext ctx, Rule rule, ParseNode parent) {
        var start = ctx.pos();
        var tree = ctx.tree();
        var node = tree.addChild(parent, rule.name());

        for (var alternative : rule.alternatives()) {
            if (parseAlternative(ctx, rule, alternative, node).isSuccess()) {
                return ParseResult.Success.of(node, ctx.pos());
            }
        }

        // Detach and free this rule's own node from the caller
        tree.freeLastChildren(parent, 1);
        return ParseResult.Failure.at(start, rule.name());
    }

    private ParseResult parseAlternative(ParsingContext ctx, Rule rule, Alternative alternative, ParseNode node) {
        var start = ctx.pos();
        var mark = node.childCount();

        for (var symbol : alternative.symbols()) {
            var result = parseSymbol(ctx, symbol, node);
            if (result.isFailure()) {
                var added = node.childCount() - mark;
                log.trace("{} <- {} failed at {}, depth {}, rolling back {} node(s)",
                          rule.name(), alternative, ctx.pos(), ctx.depth(), added);
                ctx.tree().freeLastChildren(node, added);
                ctx.restorePos(start);
                return result;
            }
        }
        return ParseResult.Success.of(node, ctx.pos());
    }

    private ParseResult parseSymbol(ParsingContext ctx, Symbol symbol, ParseNode node) {
        if (symbol instanceof Symbol.Terminal terminal) {
            return TerminalMatcher.match(ctx, terminal.kind(), node);
        }
        var ref = (Symbol.Reference) symbol;
        return parseRule(ctx, rules.get(ref.ruleName()), node);
    }
}
