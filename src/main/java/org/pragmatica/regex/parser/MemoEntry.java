package org.pragmatica.regex.parser;

import org.pragmatica.regex.tree.NodeShape;

/**
 * Memoized outcome of applying a rule at a position.
 *
 * <p>{@code reach} is how many nesting levels the original computation went below its
 * caller, failed attempts included. Replaying an entry must respect the depth bound
 * exactly as recomputing it would.
 */
public sealed interface MemoEntry {
    int reach();

    /**
     * The rule fails at this position.
     */
    record Failed(int reach) implements MemoEntry {}

    /**
     * The rule matches at this position, producing {@code shape} and ending at {@code end}.
     */
    record Matched(NodeShape shape, int end, int reach) implements MemoEntry {}

    static MemoEntry failed(int reach) {
        return new Failed(reach);
    }

    static MemoEntry matched(NodeShape shape, int end, int reach) {
        return new Matched(shape, end, reach);
    }
}
