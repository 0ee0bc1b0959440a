package org.pragmatica.regex.parser;

import org.pragmatica.regex.tree.ParseNode;

/**
 * Result of matching one symbol at a position - either success with the node that
 * was attached and the position after it, or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match: {@code node} is attached to the destination parent.
     */
    record Success(ParseNode node, int end) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(ParseNode node, int end) {
            return new Success(node, end);
        }
    }

    /**
     * Failed match. The tree and the position are as before the attempt.
     */
    record Failure(int location, String expected) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(int location, String expected) {
            return new Failure(location, expected);
        }
    }
}
