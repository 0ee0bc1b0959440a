package org.pragmatica.regex.tree;

import org.pragmatica.regex.error.CapacityExceededException;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Owner of one derivation tree: allocates nodes, links them, and releases them.
 *
 * <p>The tree counts its live nodes, i.e. nodes created and not yet freed, which makes
 * speculative growth and rollback observable. Freeing is recursive and idempotent:
 * freeing {@code null} or an already freed node does nothing.
 *
 * <p>Not thread-safe. One tree serves one parse at a time.
 */
public final class ParseTree {
    public static final String ROOT_LABEL = "Root";
    public static final int DEFAULT_MAX_LABEL_LENGTH = 15;
    public static final int DEFAULT_MAX_CHILDREN = 4;

    private final int maxLabelLength;
    private final int maxChildren;
    private ParseNode root;
    private int liveNodes;

    private ParseTree(int maxLabelLength, int maxChildren) {
        this.maxLabelLength = maxLabelLength;
        this.maxChildren = maxChildren;
    }

    public static ParseTree create() {
        return create(DEFAULT_MAX_LABEL_LENGTH, DEFAULT_MAX_CHILDREN);
    }

    public static ParseTree create(int maxLabelLength, int maxChildren) {
        checkArgument(maxLabelLength > 0, "maxLabelLength must be positive: %s", maxLabelLength);
        checkArgument(maxChildren > 0, "maxChildren must be positive: %s", maxChildren);
        return new ParseTree(maxLabelLength, maxChildren);
    }

    public int maxLabelLength() {
        return maxLabelLength;
    }

    public int maxChildren() {
        return maxChildren;
    }

    // === Allocation ===

    /**
     * Create a detached node with no children.
     *
     * @throws CapacityExceededException if the label is longer than {@link #maxLabelLength()}
     */
    public ParseNode newNode(String label) {
        checkNotNull(label, "label");
        checkArgument(!label.isEmpty(), "label must not be empty");
        if (label.length() > maxLabelLength) {
            throw CapacityExceededException.labelTooLong(label, maxLabelLength);
        }
        liveNodes++;
        return new ParseNode(this, label, maxChildren);
    }

    /**
     * Create the synthetic root. A tree has at most one root at a time.
     */
    public ParseNode initRoot() {
        checkState(root == null, "tree already has a root");
        root = newNode(ROOT_LABEL);
        return root;
    }

    public Optional<ParseNode> root() {
        return Optional.ofNullable(root);
    }

    /**
     * The first child of the root, i.e. the top of the derivation, if present.
     */
    public Optional<ParseNode> top() {
        return root().filter(r -> r.childCount() > 0)
                     .map(r -> r.child(0));
    }

    public int liveNodes() {
        return liveNodes;
    }

    // === Linkage ===

    /**
     * Append {@code child} into the next free slot of {@code parent}.
     *
     * @throws CapacityExceededException if {@code parent} already holds {@link #maxChildren()} children
     */
    public void attach(ParseNode parent, ParseNode child) {
        checkOwned(parent);
        checkOwned(child);
        checkArgument(!child.parent().isPresent() && child != root, "node '%s' is already attached", child.label());
        checkArgument(!isAncestorOrSelf(child, parent), "attaching '%s' would create a cycle", child.label());
        if (parent.childCount() >= maxChildren) {
            throw CapacityExceededException.tooManyChildren(parent.label(), maxChildren);
        }
        parent.appendChild(child);
    }

    /**
     * Create a node and attach it to {@code parent} in one step. Capacity is checked
     * before allocation, so a rejected call leaves no orphan behind.
     *
     * @throws CapacityExceededException if the label is too long or {@code parent} is full
     */
    public ParseNode addChild(ParseNode parent, String label) {
        checkOwned(parent);
        if (parent.childCount() >= maxChildren) {
            throw CapacityExceededException.tooManyChildren(parent.label(), maxChildren);
        }
        var child = newNode(label);
        parent.appendChild(child);
        return child;
    }

    /**
     * Rebuild {@code shape} as fresh nodes under {@code parent}.
     *
     * @return the node created for the top of {@code shape}
     */
    public ParseNode graft(ParseNode parent, NodeShape shape) {
        var node = addChild(parent, shape.label());
        for (var child : shape.children()) {
            graft(node, child);
        }
        return node;
    }

    // === Release ===

    /**
     * Release {@code node} and all of its descendants, detaching it from its parent first.
     */
    public void freeSubtree(ParseNode node) {
        if (node == null || node.isReleased()) {
            return;
        }
        checkOwned(node);
        node.parent().ifPresent(p -> p.detachChild(node));
        releaseRecursively(node);
        if (node == root) {
            root = null;
        }
    }

    /**
     * Release the {@code n} most recently attached children of {@code parent},
     * leaving earlier children in place.
     */
    public void freeLastChildren(ParseNode parent, int n) {
        checkOwned(parent);
        checkArgument(n >= 0 && n <= parent.childCount(),
                      "cannot free %s of %s children of '%s'", n, parent.childCount(), parent.label());
        for (int i = 0; i < n; i++) {
            freeSubtree(parent.lastChild());
        }
    }

    /**
     * Release every child of {@code parent}; the parent itself stays live.
     */
    public void freeAllChildren(ParseNode parent) {
        freeLastChildren(parent, parent.childCount());
    }

    /**
     * Release the whole tree, root included.
     */
    public void release() {
        freeSubtree(root);
    }

    private void releaseRecursively(ParseNode node) {
        while (node.childCount() > 0) {
            var child = node.lastChild();
            node.detachChild(child);
            releaseRecursively(child);
        }
        node.markReleased();
        liveNodes--;
    }

    private void checkOwned(ParseNode node) {
        checkNotNull(node, "node");
        checkArgument(node.owner() == this, "node '%s' belongs to another tree", node.label());
        checkArgument(!node.isReleased(), "node '%s' has been released", node.label());
    }

    private static boolean isAncestorOrSelf(ParseNode candidate, ParseNode node) {
        for (var current = node; current != null; current = current.parent().orElse(null)) {
            if (current == candidate) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ParseTree[live=" + liveNodes + ", root=" + root + "]";
    }
}
