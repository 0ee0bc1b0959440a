package org.pragmatica.regex.parser;

import org.pragmatica.regex.error.CapacityExceededException;
import org.pragmatica.regex.tree.ParseTree;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Mutable state of one parse: input position, rule nesting depth, the tree being grown,
 * furthest failure for diagnostics, and the packrat cache of rule outcomes.
 */
public final class ParsingContext {

    private final String input;
    private final ParserConfig config;
    private final ParseTree tree;
    private final Map<Long, MemoEntry> packratCache;
    private final Map<String, Integer> ruleIds;

    private int pos;
    private int furthestPos;
    private String furthestExpected;
    private int cacheHits;
    private int depth;
    private int peakDepth;

    private ParsingContext(String input, ParserConfig config, ParseTree tree) {
        this.input = input;
        this.config = config;
        this.tree = tree;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = config.packratEnabled() ? new HashMap<>() : null;
        this.pos = 0;
        this.furthestPos = 0;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config, ParseTree tree) {
        return new ParsingContext(input, config, tree);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    /**
     * Move back to a position saved before a failed attempt.
     */
    public void restorePos(int saved) {
        checkArgument(saved >= 0 && saved <= pos, "cannot restore position %s from %s", saved, pos);
        this.pos = saved;
    }

    /**
     * Jump forward to the end of a memoized match.
     */
    public void advanceTo(int end) {
        checkArgument(end >= pos && end <= input.length(), "cannot advance from %s to %s", pos, end);
        this.pos = end;
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char advance() {
        return input.charAt(pos++);
    }

    /**
     * Printable description of the character at {@code position}.
     */
    public String describeAt(int position) {
        return position >= input.length()
               ? "end of input"
               : "'" + input.charAt(position) + "'";
    }

    // === Nesting Depth ===

    /**
     * Number of rule applications currently in progress.
     */
    public int depth() {
        return depth;
    }

    /**
     * @throws CapacityExceededException if the new level exceeds {@link ParserConfig#maxDepth()}
     */
    public void enterRule() {
        if (depth >= config.maxDepth()) {
            throw CapacityExceededException.nestingTooDeep(config.maxDepth());
        }
        depth++;
        peakDepth = Math.max(peakDepth, depth);
    }

    public void exitRule() {
        depth--;
    }

    /**
     * Start measuring the deepest nesting reached below the current depth.
     *
     * @return the enclosing measurement, to be handed back to {@link #endReach(int)}
     */
    public int beginReach() {
        var outer = peakDepth;
        peakDepth = depth;
        return outer;
    }

    /**
     * Finish the measurement started by {@link #beginReach()}.
     *
     * @return levels reached below the current depth
     */
    public int endReach(int outer) {
        var reach = peakDepth - depth;
        peakDepth = Math.max(peakDepth, outer);
        return reach;
    }

    /**
     * Account for a memoized computation that went {@code reach} levels below the current depth.
     *
     * @throws CapacityExceededException if that computation would exceed {@link ParserConfig#maxDepth()} from here
     */
    public void replayReach(int reach) {
        if (depth + reach > config.maxDepth()) {
            throw CapacityExceededException.nestingTooDeep(config.maxDepth());
        }
        peakDepth = Math.max(peakDepth, depth + reach);
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                ? expected
                : furthestExpected + " or " + expected;
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    // === Packrat Cache ===

    public Optional<MemoEntry> getCachedAt(String rule, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        var entry = Optional.ofNullable(packratCache.get(packratKey(rule, position)));
        if (entry.isPresent()) {
            cacheHits++;
        }
        return entry;
    }

    public void cacheAt(String rule, int position, MemoEntry entry) {
        if (packratCache != null) {
            packratCache.put(packratKey(rule, position), entry);
        }
    }

    public int cacheHits() {
        return cacheHits;
    }

    private long packratKey(String rule, int position) {
        int ruleId = ruleIds.computeIfAbsent(rule, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    // === Accessors ===

    public String input() {
        return input;
    }

    public ParserConfig config() {
        return config;
    }

    public ParseTree tree() {
        return tree;
    }
}
