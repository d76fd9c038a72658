package com.arbor.export.dot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Undirected DOT graph under construction: graph/node default attributes, node statements with labels,
 * and edges, rendered in insertion order by {@link #source()}.
 */
public final class DotGraph {

    public record NodeStatement(String id, String label) {
    }

    public record Edge(String tail, String head) {
    }

    private final String name;
    private final Map<String, String> graphAttributes = new TreeMap<>();
    private final Map<String, String> nodeAttributes = new TreeMap<>();
    private final List<NodeStatement> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Object> body = new ArrayList<>();

    public DotGraph(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public DotGraph graphAttribute(String key, String value) {
        graphAttributes.put(key, value);
        return this;
    }

    public DotGraph nodeAttribute(String key, String value) {
        nodeAttributes.put(key, value);
        return this;
    }

    public DotGraph node(String id, String label) {
        NodeStatement statement = new NodeStatement(id, label);
        nodes.add(statement);
        body.add(statement);
        return this;
    }

    public DotGraph edge(String tail, String head) {
        Edge edge = new Edge(tail, head);
        edges.add(edge);
        body.add(edge);
        return this;
    }

    public Map<String, String> getGraphAttributes() {
        return Collections.unmodifiableMap(graphAttributes);
    }

    public List<NodeStatement> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /** DOT source text, tab-indented, ending with a newline. */
    public String source() {
        StringBuilder sb = new StringBuilder();
        sb.append("graph ");
        if (name != null && !name.isEmpty()) {
            sb.append(DotQuoting.quoteId(name)).append(' ');
        }
        sb.append("{\n");
        if (!graphAttributes.isEmpty()) {
            sb.append("\tgraph").append(attributeList(graphAttributes)).append('\n');
        }
        if (!nodeAttributes.isEmpty()) {
            sb.append("\tnode").append(attributeList(nodeAttributes)).append('\n');
        }
        for (Object statement : body) {
            if (statement instanceof NodeStatement n) {
                sb.append('\t').append(DotQuoting.quoteId(n.id()));
                if (n.label() != null) {
                    sb.append(" [label=").append(DotQuoting.quoteValue(n.label())).append(']');
                }
                sb.append('\n');
            } else if (statement instanceof Edge e) {
                sb.append('\t').append(DotQuoting.quoteId(e.tail()))
                        .append(" -- ").append(DotQuoting.quoteId(e.head())).append('\n');
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String attributeList(Map<String, String> attributes) {
        StringBuilder sb = new StringBuilder(" [");
        boolean first = true;
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (!first) sb.append(' ');
            sb.append(DotQuoting.quoteId(e.getKey())).append('=').append(DotQuoting.quoteValue(e.getValue()));
            first = false;
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return source();
    }
}
