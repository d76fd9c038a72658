package com.arbor.export;

/**
 * Graph-level settings of the DOT export.
 *
 * @param dpi       output resolution for renderers
 * @param nodesep   minimum space between nodes of one rank, in inches
 * @param ranksep   height of edges in inches; Graphviz's minimum is 0.02
 * @param nodeShape default node shape ({@code plain} draws the label only)
 * @param graphName graph name; null for an anonymous graph
 */
public record DiagramOptions(int dpi, String nodesep, String ranksep, String nodeShape, String graphName) {

    public static final int DEFAULT_DPI = 400;
    public static final String DEFAULT_NODESEP = ".25";
    public static final String DEFAULT_RANKSEP = "0.02";
    public static final String DEFAULT_NODE_SHAPE = "plain";

    public DiagramOptions {
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive: " + dpi);
        }
        nodesep = nodesep != null && !nodesep.isBlank() ? nodesep.trim() : DEFAULT_NODESEP;
        ranksep = ranksep != null && !ranksep.isBlank() ? ranksep.trim() : DEFAULT_RANKSEP;
        nodeShape = nodeShape != null && !nodeShape.isBlank() ? nodeShape.trim() : DEFAULT_NODE_SHAPE;
    }

    public static DiagramOptions defaults() {
        return new DiagramOptions(DEFAULT_DPI, DEFAULT_NODESEP, DEFAULT_RANKSEP, DEFAULT_NODE_SHAPE, null);
    }

    public DiagramOptions withDpi(int newDpi) {
        return new DiagramOptions(newDpi, nodesep, ranksep, nodeShape, graphName);
    }

    public DiagramOptions withGraphName(String newName) {
        return new DiagramOptions(dpi, nodesep, ranksep, nodeShape, newName);
    }
}
