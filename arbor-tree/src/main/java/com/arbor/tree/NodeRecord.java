package com.arbor.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable value form of a subtree: label, value and ordered child records.
 * Absent label/value stay null (never the empty string). Used for JSON, the clipboard and round trips.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeRecord(
        @JsonProperty("label") String label,
        @JsonProperty("value") String value,
        @JsonProperty("children") List<NodeRecord> children
) {
    public NodeRecord {
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static NodeRecord leaf(String label, String value) {
        return new NodeRecord(label, value, List.of());
    }

    /** Number of nodes in this subtree, including this one. */
    public int size() {
        int n = 1;
        for (NodeRecord child : children) {
            n += child.size();
        }
        return n;
    }
}
