package com.arbor.tree;

/**
 * Thrown when an edit would break a tree invariant: giving a node a second parent,
 * detaching a parentless node, splicing in a parent that is already attached,
 * or giving the root a sibling. The tree is not modified when this is thrown.
 */
public final class StructuralException extends ArborException {

    private final String node;

    public StructuralException(String message, Node node) {
        super(message + (node != null ? " (node: " + node.toDisplayString() + ")" : ""));
        this.node = node != null ? node.toDisplayString() : null;
    }

    public StructuralException(String message) {
        this(message, null);
    }

    /** Display form of the node the rejected edit was applied to; null when not tied to a node. */
    public String getNode() {
        return node;
    }
}
