package org.pragmatica.regex;

import org.pragmatica.regex.grammar.RegexGrammar;
import org.pragmatica.regex.grammar.TokenKind;
import org.pragmatica.regex.parser.BacktrackingEngine;
import org.pragmatica.regex.parser.ParseOutcome;
import org.pragmatica.regex.parser.Parser;
import org.pragmatica.regex.parser.ParserConfig;
import org.pragmatica.regex.tree.ParseTree;

/**
 * Entry point for creating regular expression parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var outcome = RegexParsers.standard().parse("a+b*");
 * outcome.topNode().ifPresent(top -> TreePrinter.standard().print(top, 0));
 * outcome.acceptedTree().ifPresent(ParseTree::release);
 * }</pre>
 */
public final class RegexParsers {
    private static final Parser STANDARD = create(ParserConfig.DEFAULT);

    private RegexParsers() {}

    /**
     * Parser with the default configuration: {@code #} as empty marker, labels of at
     * most 15 characters, at most 4 children per node.
     */
    public static Parser standard() {
        return STANDARD;
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return BacktrackingEngine.create(RegexGrammar.standard(), config);
    }

    /**
     * Parse with the standard parser.
     */
    public static ParseOutcome parse(String input) {
        return STANDARD.parse(input);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxLabelLength = ParseTree.DEFAULT_MAX_LABEL_LENGTH;
        private int maxChildren = ParseTree.DEFAULT_MAX_CHILDREN;
        private char emptyMarker = TokenKind.DEFAULT_EMPTY_MARKER;
        private boolean packratEnabled = true;
        private int maxDepth = ParserConfig.DEFAULT_MAX_DEPTH;

        private Builder() {}

        public Builder maxLabelLength(int length) {
            this.maxLabelLength = length;
            return this;
        }

        public Builder maxChildren(int count) {
            this.maxChildren = count;
            return this;
        }

        public Builder emptyMarker(char marker) {
            this.emptyMarker = marker;
            return this;
        }

        /**
         * Deepest nesting of rule applications; each input symbol in a chain costs two levels.
         */
        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(maxLabelLength, maxChildren, emptyMarker, packratEnabled, maxDepth));
        }
    }
}
