package org.pragmatica.regex.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Labeled vertex of a derivation tree.
 *
 * <p>Nodes are created and linked only through their owning {@link ParseTree}, which
 * enforces the label and arity bounds. Each node exclusively owns its children, kept
 * in left-to-right derivation order.
 */
public final class ParseNode {

    private final ParseTree owner;
    private final String label;
    private final List<ParseNode> children;
    private ParseNode parent;
    private boolean released;

    ParseNode(ParseTree owner, String label, int capacity) {
        this.owner = owner;
        this.label = label;
        this.children = new ArrayList<>(capacity);
    }

    public String label() {
        return label;
    }

    public int childCount() {
        return children.size();
    }

    public ParseNode child(int index) {
        return children.get(index);
    }

    /**
     * Read-only view of the children.
     */
    public List<ParseNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<ParseNode> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Number of nodes in the subtree rooted here, this node included.
     */
    public int size() {
        int size = 1;
        for (var child : children) {
            size += child.size();
        }
        return size;
    }

    /**
     * Concatenated labels of the leaves, read left to right.
     * For a complete derivation this reproduces the parsed text.
     */
    public String leafText() {
        var sb = new StringBuilder();
        appendLeaves(sb);
        return sb.toString();
    }

    private void appendLeaves(StringBuilder sb) {
        if (children.isEmpty()) {
            sb.append(label);
            return;
        }
        for (var child : children) {
            child.appendLeaves(sb);
        }
    }

    /**
     * Structural comparison: same labels in the same shape, regardless of identity.
     */
    public boolean sameShape(ParseNode other) {
        if (other == null || !label.equals(other.label) || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameShape(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    // === Linkage, driven by ParseTree ===

    ParseTree owner() {
        return owner;
    }

    void appendChild(ParseNode child) {
        children.add(child);
        child.parent = this;
    }

    ParseNode lastChild() {
        return children.get(children.size() - 1);
    }

    void detachChild(ParseNode child) {
        children.remove(child);
        child.parent = null;
    }

    void markReleased() {
        released = true;
        parent = null;
    }

    @Override
    public String toString() {
        return children.isEmpty()
               ? label
               : label + children;
    }
}
