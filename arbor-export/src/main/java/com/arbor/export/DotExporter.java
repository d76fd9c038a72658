package com.arbor.export;

import com.arbor.export.dot.DotGraph;
import com.arbor.markup.HtmlText;
import com.arbor.markup.MarkupTranslator;
import com.arbor.tree.Node;
import com.arbor.tree.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders a tree as an undirected Graphviz graph: one node statement per tree node (pre-order) and one
 * unlabeled edge per parent/child pair.
 * <p>
 * Node ids come from the label's plain text ({@code null}/{@code bar} tags contribute {@code Null}/{@code Bar}),
 * {@code node} when that is empty, made unique across the graph with numeric suffixes starting at 2.
 * Labels are HTML-like: valid markup passes through (Graphviz renders {@code b i u sup sub} itself) with
 * {@code <null/>} and {@code <bar/>} replaced by their glyphs and any {@code <} that opens no tag escaped;
 * invalid markup is escaped entirely. A node with a value
 * gets a two-line label.
 */
public final class DotExporter {

    private static final Logger log = LoggerFactory.getLogger(DotExporter.class);

    static final String FALLBACK_ID = "node";
    static final String NULL_SENTINEL = "<null/>";
    static final String NULL_GLYPH = "Ø";
    static final String PRIME_SENTINEL = "<bar/>";
    static final String PRIME_GLYPH = "<sup>′</sup>";
    // comments, declarations and processing instructions; the markup translator drops them too
    private static final Pattern IGNORED_MARKUP = Pattern.compile("<!--.*?-->|<![^>]*>|<\\?[^>]*>", Pattern.DOTALL);

    private final DiagramOptions options;

    public DotExporter() {
        this(DiagramOptions.defaults());
    }

    public DotExporter(DiagramOptions options) {
        this.options = options != null ? options : DiagramOptions.defaults();
    }

    public DiagramOptions getOptions() {
        return options;
    }

    /**
     * Builds the graph for {@code root}.
     *
     * @throws StructuralException if {@code root} is null
     */
    public DotGraph export(Node root) {
        if (root == null) {
            throw new StructuralException("Cannot export an empty tree");
        }
        DotGraph graph = new DotGraph(options.graphName())
                .graphAttribute("dpi", String.valueOf(options.dpi()))
                .graphAttribute("nodesep", options.nodesep())
                .graphAttribute("ranksep", options.ranksep())
                .nodeAttribute("shape", options.nodeShape());
        addNode(root, null, graph, new HashSet<>(), new MarkupTranslator());
        log.debug("Built DOT graph with {} nodes and {} edges", graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    /** Shorthand for {@code export(root).source()}. */
    public String exportSource(Node root) {
        return export(root).source();
    }

    private static void addNode(Node node, String parentId, DotGraph graph, Set<String> usedIds,
                                MarkupTranslator translator) {
        String label = node.getLabel() != null ? node.getLabel() : "";
        String id = freshId(translator.reset().feed(label).close().plain(), usedIds);

        String rendered;
        if (node.getValue() != null && !node.getValue().isEmpty()) {
            rendered = "<" + escapeIfNeeded(label, translator) + "<br/>" + escapeIfNeeded(node.getValue(), translator) + ">";
        } else {
            rendered = escapeIfNeeded(label, translator);
            if (isValid(rendered, translator)) {
                rendered = "<" + rendered + ">";
            }
        }
        graph.node(id, rendered);
        if (parentId != null) {
            graph.edge(parentId, id);
        }
        for (Node child : node.getChildren()) {
            addNode(child, id, graph, usedIds, translator);
        }
    }

    static String freshId(String name, Set<String> usedIds) {
        String base = name == null || name.isEmpty() ? FALLBACK_ID : name;
        String id = base;
        int num = 1;
        while (usedIds.contains(id)) {
            num++;
            id = base + num;
        }
        usedIds.add(id);
        return id;
    }

    private static String escapeIfNeeded(String text, MarkupTranslator translator) {
        if (!isValid(text, translator)) {
            return HtmlText.escape(text);
        }
        String markup = escapeStrayLessThan(IGNORED_MARKUP.matcher(text).replaceAll(""));
        return markup.replace(NULL_SENTINEL, NULL_GLYPH).replace(PRIME_SENTINEL, PRIME_GLYPH);
    }

    /** Escapes every {@code <} that does not open a complete tag, so the label stays well-formed. */
    static String escapeStrayLessThan(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<' && !startsTag(text, i)) {
                sb.append("&lt;");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean startsTag(String text, int i) {
        int k = i + 1;
        if (k < text.length() && text.charAt(k) == '/') k++;
        return k < text.length() && Character.isLetter(text.charAt(k)) && text.indexOf('>', k) >= 0;
    }

    private static boolean isValid(String text, MarkupTranslator translator) {
        return translator.reset().feed(text).close().valid();
    }
}
