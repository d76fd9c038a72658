package com.arbor.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of an ordered, labeled tree. Holds an optional label, an optional value, ordered children
 * and a back-reference to its parent.
 * <p>
 * A node has at most one parent and appears exactly once in that parent's children. Cycles cannot be
 * built: a node only gains a parent while it has none, and only a parentless node can be spliced in
 * as a new parent. Every mutator checks its preconditions first and throws {@link StructuralException}
 * without touching the tree when they do not hold.
 */
public final class Node {

    private String label;
    private String value;
    private final List<Node> children = new ArrayList<>();
    private Node parent;

    public Node() {
        this(null, null);
    }

    public Node(String label, String value) {
        this.label = label;
        this.value = value;
    }

    /**
     * Builds a fresh node graph from its record form. Every call creates new instances.
     */
    public static Node fromRecord(NodeRecord record) {
        Node node = new Node(record.label(), record.value());
        for (NodeRecord child : record.children()) {
            node.addChild(fromRecord(child));
        }
        return node;
    }

    /** Returns the structural value form of this node and its subtree. */
    public NodeRecord toRecord() {
        List<NodeRecord> records = new ArrayList<>(children.size());
        for (Node child : children) {
            records.add(child.toRecord());
        }
        return new NodeRecord(label, value, records);
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /** Children in order. Unmodifiable view; use the structural operations to change it. */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Node getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Position among the parent's children, or -1 for a parentless node. */
    public int indexInParent() {
        return parent == null ? -1 : parent.indexOf(this);
    }

    /** Topmost ancestor (this node when parentless). */
    public Node getRoot() {
        Node n = this;
        while (n.parent != null) {
            n = n.parent;
        }
        return n;
    }

    /** True if {@code ancestor} is this node or one of its ancestors. */
    public boolean isDescendantOf(Node ancestor) {
        for (Node n = this; n != null; n = n.parent) {
            if (n == ancestor) return true;
        }
        return false;
    }

    /**
     * Appends {@code child} to this node's children.
     *
     * @throws StructuralException if the child already has a parent, or is an ancestor of this node
     */
    public void addChild(Node child) {
        if (child.parent != null) {
            throw new StructuralException("Node already has a parent", child);
        }
        if (isDescendantOf(child)) {
            throw new StructuralException("Node cannot become a child of its own subtree", child);
        }
        children.add(child);
        child.parent = this;
    }

    /**
     * Removes this node (with its subtree) from its parent's children and clears its parent.
     *
     * @throws StructuralException if this node has no parent; removing a root is handled by the owner
     */
    public void detach() {
        if (parent == null) {
            throw new StructuralException("Cannot detach a node without a parent", this);
        }
        parent.children.remove(parent.indexOf(this));
        parent = null;
    }

    /**
     * Splices {@code newParent} into this node's position among its siblings, then makes this node
     * the only child of {@code newParent}.
     *
     * @throws StructuralException if this node has no parent (replacing a root is handled by the owner),
     *                             or if {@code newParent} is already attached
     */
    public void insertParent(Node newParent) {
        if (parent == null) {
            throw new StructuralException("Cannot insert a parent above a parentless node", this);
        }
        if (newParent.parent != null) {
            throw new StructuralException("New parent is already attached", newParent);
        }
        if (isDescendantOf(newParent)) {
            throw new StructuralException("Node cannot become a parent of its own ancestor", newParent);
        }
        Node oldParent = parent;
        int i = oldParent.indexOf(this);
        oldParent.children.set(i, newParent);
        newParent.parent = oldParent;
        parent = null;
        newParent.addChild(this);
    }

    /**
     * Swaps this node with the sibling {@code offset} positions away (-1 previous, +1 next).
     * Does nothing when the target position is outside the parent's children.
     *
     * @return true if the node moved
     * @throws StructuralException if this node has no parent
     */
    public boolean moveWithinParent(int offset) {
        if (parent == null) {
            throw new StructuralException("Cannot reorder a node without a parent", this);
        }
        List<Node> siblings = parent.children;
        int from = parent.indexOf(this);
        int to = from + offset;
        if (offset == 0 || to < 0 || to >= siblings.size()) {
            return false;
        }
        Collections.swap(siblings, from, to);
        return true;
    }

    /** Label (or the localized placeholder), followed by {@code ": value"} when a value is present. */
    public String toDisplayString(Messages messages) {
        String res = label != null && !label.isEmpty() ? label : messages.get(Messages.UNLABELLED);
        if (value != null && !value.isEmpty()) {
            res += ": " + value;
        }
        return res;
    }

    public String toDisplayString() {
        return toDisplayString(Messages.defaults());
    }

    private int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
