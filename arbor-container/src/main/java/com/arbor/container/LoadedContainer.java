package com.arbor.container;

import com.arbor.tree.Node;
import com.arbor.tree.NodeRecord;

/**
 * Contents of a loaded container.
 *
 * @param manifest the stored manifest merged over the codec defaults
 * @param tree     the root record; null for an empty tree
 */
public record LoadedContainer(Manifest manifest, NodeRecord tree) {

    /** Fresh node graph for the stored tree; null when empty. */
    public Node toNode() {
        return tree != null ? Node.fromRecord(tree) : null;
    }
}
