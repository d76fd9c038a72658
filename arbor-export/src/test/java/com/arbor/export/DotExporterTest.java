package com.arbor.export;

import com.arbor.export.dot.DotGraph;
import com.arbor.tree.Node;
import com.arbor.tree.NodeRecord;
import com.arbor.tree.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DotExporterTest {

    private static final NodeRecord SIMPLE_TREE = new NodeRecord("TP", null, List.of(
            NodeRecord.leaf("DP", null),
            NodeRecord.leaf("T<bar/>", null)));

    @Test
    void exportSource_simpleTree() {
        String expected = "graph {\n"
                + "\tgraph [dpi=400 nodesep=.25 ranksep=0.02]\n"
                + "\tnode [shape=plain]\n"
                + "\tTP [label=<TP>]\n"
                + "\tDP [label=<DP>]\n"
                + "\tTP -- DP\n"
                + "\tTBar [label=<T<sup>′</sup>>]\n"
                + "\tTP -- TBar\n"
                + "}\n";
        assertEquals(expected, new DotExporter().exportSource(Node.fromRecord(SIMPLE_TREE)));
    }

    @Test
    void export_deduplicatesIdsAcrossWholeGraph() {
        Node root = Node.fromRecord(new NodeRecord("X", null, List.of(
                new NodeRecord("X", null, List.of(NodeRecord.leaf("X", null))),
                NodeRecord.leaf("X", null))));

        DotGraph graph = new DotExporter().export(root);

        assertEquals(List.of("X", "X2", "X3", "X4"),
                graph.getNodes().stream().map(DotGraph.NodeStatement::id).toList());
        assertEquals(List.of(new DotGraph.Edge("X", "X2"), new DotGraph.Edge("X2", "X3"), new DotGraph.Edge("X", "X4")),
                graph.getEdges());
    }

    @Test
    void export_emptyLabelUsesQuotedFallbackId() {
        Node root = new Node(null, null);
        root.addChild(new Node("", null));
        String source = new DotExporter().exportSource(root);
        assertTrue(source.contains("\t\"node\" [label=<>]\n"));
        assertTrue(source.contains("\t\"node\" -- node2\n"));
    }

    @Test
    void export_valueMakesTwoLineLabel() {
        DotGraph graph = new DotExporter().export(new Node("<b>D</b>", "the"));
        assertEquals(new DotGraph.NodeStatement("D", "<<b>D</b><br/>the>"), graph.getNodes().get(0));
    }

    @Test
    void export_invalidMarkupIsEscaped() {
        DotGraph graph = new DotExporter().export(new Node("a<em>b</em> & c", null));
        DotGraph.NodeStatement statement = graph.getNodes().get(0);
        assertEquals("<a&lt;em&gt;b&lt;/em&gt; &amp; c>", statement.label());
        assertEquals("ab & c", statement.id());
        assertTrue(graph.source().contains("\t\"ab & c\" [label=<a&lt;em&gt;b&lt;/em&gt; &amp; c>]\n"));
    }

    @Test
    void export_nullSymbolGlyph() {
        DotGraph graph = new DotExporter().export(new Node("<null/>", null));
        assertEquals(new DotGraph.NodeStatement("Null", "<Ø>"), graph.getNodes().get(0));
    }

    @Test
    void export_strayLessThanInValidLabelIsEscaped() {
        DotGraph graph = new DotExporter().export(new Node("a<b", "1 < <b>2</b>"));
        assertEquals(new DotGraph.NodeStatement("a<b", "<a&lt;b<br/>1 &lt; <b>2</b>>"), graph.getNodes().get(0));

        DotGraph single = new DotExporter().export(new Node("x<y", null));
        assertEquals("<x&lt;y>", single.getNodes().get(0).label());
    }

    @Test
    void export_commentsAreDroppedFromIdAndLabel() {
        DotGraph graph = new DotExporter().export(new Node("T<!-- check -->P", null));
        assertEquals(new DotGraph.NodeStatement("TP", "<TP>"), graph.getNodes().get(0));
    }

    @Test
    void escapeStrayLessThan_keepsCompleteTags() {
        assertEquals("<b>x</b> &lt; &lt;/ &lt;c", DotExporter.escapeStrayLessThan("<b>x</b> < </ <c"));
    }

    @Test
    void export_usesOptions() {
        DiagramOptions options = DiagramOptions.defaults().withDpi(96).withGraphName("my tree");
        String source = new DotExporter(options).exportSource(new Node("S", null));
        assertTrue(source.startsWith("graph \"my tree\" {\n\tgraph [dpi=96 nodesep=.25 ranksep=0.02]\n"));
    }

    @Test
    void export_emptyTreeIsRejected() {
        assertThrows(StructuralException.class, () -> new DotExporter().export(null));
    }

    @Test
    void freshId_appendsIncreasingSuffix() {
        Set<String> used = new HashSet<>();
        assertEquals("NP", DotExporter.freshId("NP", used));
        assertEquals("NP2", DotExporter.freshId("NP", used));
        assertEquals("NP3", DotExporter.freshId("NP", used));
        assertEquals("node", DotExporter.freshId("", used));
    }
}
