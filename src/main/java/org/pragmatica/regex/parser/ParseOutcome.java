package org.pragmatica.regex.parser;

import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.tree.ParseNode;
import org.pragmatica.regex.tree.ParseTree;

import java.util.Optional;

/**
 * Outcome of parsing a whole input.
 *
 * <p>An accepted outcome hands the tree over to the caller, who releases it when done.
 * A rejected outcome carries no tree: everything built during the attempt has already
 * been released.
 */
public sealed interface ParseOutcome {

    String input();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    Optional<ParseTree> acceptedTree();

    Optional<ParseError> rejection();

    /**
     * Top of the derivation, i.e. the single child of the synthetic root.
     */
    default Optional<ParseNode> topNode() {
        return acceptedTree().flatMap(ParseTree::top);
    }

    record Accepted(String input, ParseTree tree) implements ParseOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ParseTree> acceptedTree() {
            return Optional.of(tree);
        }

        @Override
        public Optional<ParseError> rejection() {
            return Optional.empty();
        }
    }

    record Rejected(String input, ParseError error) implements ParseOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ParseTree> acceptedTree() {
            return Optional.empty();
        }

        @Override
        public Optional<ParseError> rejection() {
            return Optional.of(error);
        }
    }
}
