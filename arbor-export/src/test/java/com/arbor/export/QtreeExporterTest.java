package com.arbor.export;

import com.arbor.tree.Node;
import com.arbor.tree.NodeRecord;
import com.arbor.tree.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QtreeExporterTest {

    private static final NodeRecord SIMPLE_TREE = new NodeRecord("TP", null, List.of(
            NodeRecord.leaf("DP", null),
            NodeRecord.leaf("T<bar/>", null)));

    private static final String SIMPLE_QTREE = "\\Tree [.TP\n"
            + "  DP\n"
            + "  T$^{\\prime}$\n"
            + "]\n";

    private final QtreeExporter exporter = new QtreeExporter();

    @Test
    void render_simpleTreeMatchesFixture() {
        assertEquals(SIMPLE_QTREE, exporter.render(Node.fromRecord(SIMPLE_TREE)));
    }

    @Test
    void render_singleRootStillGetsBrackets() {
        assertEquals("\\Tree [.root\n]\n", exporter.render(new Node("root", null)));
    }

    @Test
    void render_boldLabel() {
        assertEquals("\\Tree [.\\textbf{root}\n]\n", exporter.render(new Node("<b>root</b>", null)));
    }

    @Test
    void render_unclosedTagFallsBackToRawLabel() {
        assertEquals("\\Tree [.<b>root\n]\n", exporter.render(new Node("<b>root", null)));
    }

    @Test
    void render_unopenedCloseFallsBackToRawLabel() {
        assertEquals("\\Tree [.root</b>\n]\n", exporter.render(new Node("root</b>", null)));
    }

    @Test
    void render_nestedGroupsAndValues() {
        Node s = Node.fromRecord(new NodeRecord("S", null, List.of(
                new NodeRecord("NP", null, List.of(
                        NodeRecord.leaf("D", "the"),
                        NodeRecord.leaf("N", "<i>cat</i>"))),
                NodeRecord.leaf("VP", ""))));

        String expected = "\\Tree [.S\n"
                + "  [.NP\n"
                + "    D\\\\the\n"
                + "    N\\\\\\textit{cat}\n"
                + "  ]\n"
                + "  VP\n"
                + "]\n";
        assertEquals(expected, exporter.render(s));
    }

    @Test
    void render_absentLabelIsEmpty() {
        assertEquals("\\Tree [.\\\\x\n]\n", exporter.render(new Node(null, "x")));
    }

    @Test
    void export_prefixesHeaderComment() {
        assertEquals("% Add \\usepackage{qtree} to the preamble of your document.\n\n" + SIMPLE_QTREE,
                exporter.export(Node.fromRecord(SIMPLE_TREE)));
    }

    @Test
    void render_emptyTreeIsRejected() {
        assertThrows(StructuralException.class, () -> exporter.render(null));
    }
}
