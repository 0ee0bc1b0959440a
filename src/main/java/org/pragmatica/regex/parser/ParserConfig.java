package org.pragmatica.regex.parser;

import org.pragmatica.regex.grammar.TokenKind;
import org.pragmatica.regex.tree.ParseTree;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser configuration options.
 *
 * @param maxLabelLength  longest label a tree node may carry
 * @param maxChildren     most children a tree node may hold
 * @param emptyMarker     character standing for the empty production
 * @param packratEnabled  memoize rule outcomes per (rule, position) within one parse
 * @param maxDepth        deepest nesting of rule applications a parse may reach
 */
public record ParserConfig(
    int maxLabelLength,
    int maxChildren,
    char emptyMarker,
    boolean packratEnabled,
    int maxDepth
) {
    /**
     * Each nesting level costs a few stack frames; 1000 levels fit a default thread stack.
     */
    public static final int DEFAULT_MAX_DEPTH = 1000;

    public static final ParserConfig DEFAULT = new ParserConfig(
        ParseTree.DEFAULT_MAX_LABEL_LENGTH,
        ParseTree.DEFAULT_MAX_CHILDREN,
        TokenKind.DEFAULT_EMPTY_MARKER,
        true,
        DEFAULT_MAX_DEPTH
    );

    public ParserConfig {
        checkArgument(maxLabelLength > 0, "maxLabelLength must be positive: %s", maxLabelLength);
        checkArgument(maxChildren > 0, "maxChildren must be positive: %s", maxChildren);
        checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
        checkArgument(!collidesWithToken(emptyMarker), "empty marker '%s' collides with another terminal", emptyMarker);
    }

    public ParserConfig(int maxLabelLength, int maxChildren, char emptyMarker, boolean packratEnabled) {
        this(maxLabelLength, maxChildren, emptyMarker, packratEnabled, DEFAULT_MAX_DEPTH);
    }

    private static boolean collidesWithToken(char marker) {
        if (TokenKind.isSymbol(marker)) {
            return true;
        }
        for (var kind : TokenKind.values()) {
            if (kind != TokenKind.EMPTY_MARKER && kind != TokenKind.SYMBOL && kind.literal() == marker) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fresh, empty tree honoring this configuration's bounds.
     */
    public ParseTree newTree() {
        return ParseTree.create(maxLabelLength, maxChildren);
    }
}
