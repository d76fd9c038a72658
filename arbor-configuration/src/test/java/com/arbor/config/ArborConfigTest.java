package com.arbor.config;

import com.arbor.export.DiagramOptions;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArborConfigTest {

    @Test
    void fromEnvironment_emptyUsesDefaults() {
        ArborConfig config = ArborConfig.fromEnvironment(Map.of());
        assertEquals(400, config.getGraphDpi());
        assertEquals(".25", config.getGraphNodesep());
        assertEquals("0.02", config.getGraphRanksep());
        assertEquals("plain", config.getNodeShape());
        assertEquals(Locale.getDefault(), config.getLocale());
        assertEquals(DiagramOptions.defaults(), config.toDiagramOptions());
    }

    @Test
    void fromEnvironment_readsValues() {
        ArborConfig config = ArborConfig.fromEnvironment(Map.of(
                "ARBOR_GRAPH_DPI", " 150 ",
                "ARBOR_GRAPH_NODESEP", "0.5",
                "ARBOR_GRAPH_RANKSEP", "0.1",
                "ARBOR_NODE_SHAPE", "box",
                "ARBOR_LOCALE", "pt_BR"));

        DiagramOptions options = config.toDiagramOptions();
        assertEquals(150, options.dpi());
        assertEquals("0.5", options.nodesep());
        assertEquals("0.1", options.ranksep());
        assertEquals("box", options.nodeShape());
        assertNull(options.graphName());
        assertEquals(Locale.forLanguageTag("pt-BR"), config.getLocale());
        assertEquals(config.getLocale(), config.messages().getLocale());
    }

    @Test
    void fromEnvironment_invalidNumbersFallBack() {
        ArborConfig config = ArborConfig.fromEnvironment(Map.of(
                "ARBOR_GRAPH_DPI", "-3",
                "ARBOR_GRAPH_NODESEP", "wide",
                "ARBOR_GRAPH_RANKSEP", "-1"));
        assertEquals(400, config.getGraphDpi());
        assertEquals(".25", config.getGraphNodesep());
        assertEquals("0.02", config.getGraphRanksep());
    }

    @Test
    void builder_rejectsNonPositiveDpi() {
        assertThrows(IllegalArgumentException.class, () -> ArborConfig.builder().graphDpi(0));
    }
}
