package org.pragmatica.regex.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a subtree: labels and structure, no identity.
 * Used to replay a memoized derivation into fresh nodes.
 */
public record NodeShape(String label, List<NodeShape> children) {

    public NodeShape {
        children = List.copyOf(children);
    }

    public static NodeShape of(ParseNode node) {
        var children = new ArrayList<NodeShape>(node.childCount());
        for (var child : node.children()) {
            children.add(of(child));
        }
        return new NodeShape(node.label(), children);
    }
}
