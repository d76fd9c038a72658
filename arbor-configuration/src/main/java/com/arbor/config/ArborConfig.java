package com.arbor.config;

import com.arbor.export.DiagramOptions;
import com.arbor.tree.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables.
 * <p>
 * Diagram export: ARBOR_GRAPH_DPI, ARBOR_GRAPH_NODESEP, ARBOR_GRAPH_RANKSEP, ARBOR_NODE_SHAPE.
 * Messages: ARBOR_LOCALE (language tag, e.g. {@code de} or {@code pt-BR}; JVM default when unset).
 * Unset or unparseable values fall back to the defaults.
 */
public final class ArborConfig {

    private static final Logger log = LoggerFactory.getLogger(ArborConfig.class);

    private static final String ENV_GRAPH_DPI = "ARBOR_GRAPH_DPI";
    private static final String ENV_GRAPH_NODESEP = "ARBOR_GRAPH_NODESEP";
    private static final String ENV_GRAPH_RANKSEP = "ARBOR_GRAPH_RANKSEP";
    private static final String ENV_NODE_SHAPE = "ARBOR_NODE_SHAPE";
    private static final String ENV_LOCALE = "ARBOR_LOCALE";

    private final int graphDpi;
    private final String graphNodesep;
    private final String graphRanksep;
    private final String nodeShape;
    private final Locale locale;

    private ArborConfig(Builder b) {
        this.graphDpi = b.graphDpi;
        this.graphNodesep = b.graphNodesep;
        this.graphRanksep = b.graphRanksep;
        this.nodeShape = b.nodeShape;
        this.locale = b.locale != null ? b.locale : Locale.getDefault();
    }

    /** Configuration with every default. */
    public static ArborConfig defaults() {
        return builder().build();
    }

    public static ArborConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from the given map (e.g. for tests). */
    public static ArborConfig fromEnvironment(Map<String, String> env) {
        Builder b = builder()
                .graphDpi(parsePositiveInt(env, ENV_GRAPH_DPI, DiagramOptions.DEFAULT_DPI))
                .graphNodesep(parseDecimal(env, ENV_GRAPH_NODESEP, DiagramOptions.DEFAULT_NODESEP))
                .graphRanksep(parseDecimal(env, ENV_GRAPH_RANKSEP, DiagramOptions.DEFAULT_RANKSEP))
                .nodeShape(getEnv(env, ENV_NODE_SHAPE, DiagramOptions.DEFAULT_NODE_SHAPE));
        String localeTag = getEnv(env, ENV_LOCALE, null);
        if (localeTag != null) {
            b.locale(Locale.forLanguageTag(localeTag.replace('_', '-')));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** DOT {@code dpi}. Default 400. */
    public int getGraphDpi() {
        return graphDpi;
    }

    /** DOT {@code nodesep} in inches. Default {@code .25}. */
    public String getGraphNodesep() {
        return graphNodesep;
    }

    /** DOT {@code ranksep} (edge height) in inches. Default {@code 0.02}, Graphviz's minimum. */
    public String getGraphRanksep() {
        return graphRanksep;
    }

    /** DOT node shape. Default {@code plain}. */
    public String getNodeShape() {
        return nodeShape;
    }

    public Locale getLocale() {
        return locale;
    }

    public Messages messages() {
        return Messages.forLocale(locale);
    }

    /** Diagram options for an anonymous graph. */
    public DiagramOptions toDiagramOptions() {
        return new DiagramOptions(graphDpi, graphNodesep, graphRanksep, nodeShape, null);
    }

    private static int parsePositiveInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) return parsed;
        } catch (NumberFormatException e) {
            // fall through to the warning below
        }
        log.warn("Ignoring {}={}: expected a positive integer; using {}", key, value, defaultValue);
        return defaultValue;
    }

    private static String parseDecimal(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        try {
            if (Double.parseDouble(trimmed) >= 0) return trimmed;
        } catch (NumberFormatException e) {
            // fall through to the warning below
        }
        log.warn("Ignoring {}={}: expected a non-negative number; using {}", key, value, defaultValue);
        return defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private int graphDpi = DiagramOptions.DEFAULT_DPI;
        private String graphNodesep = DiagramOptions.DEFAULT_NODESEP;
        private String graphRanksep = DiagramOptions.DEFAULT_RANKSEP;
        private String nodeShape = DiagramOptions.DEFAULT_NODE_SHAPE;
        private Locale locale;

        public Builder graphDpi(int graphDpi) {
            if (graphDpi <= 0) {
                throw new IllegalArgumentException("graphDpi must be positive: " + graphDpi);
            }
            this.graphDpi = graphDpi;
            return this;
        }

        public Builder graphNodesep(String graphNodesep) {
            this.graphNodesep = graphNodesep != null ? graphNodesep : DiagramOptions.DEFAULT_NODESEP;
            return this;
        }

        public Builder graphRanksep(String graphRanksep) {
            this.graphRanksep = graphRanksep != null ? graphRanksep : DiagramOptions.DEFAULT_RANKSEP;
            return this;
        }

        public Builder nodeShape(String nodeShape) {
            this.nodeShape = nodeShape != null ? nodeShape : DiagramOptions.DEFAULT_NODE_SHAPE;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = Objects.requireNonNull(locale, "locale");
            return this;
        }

        public ArborConfig build() {
            return new ArborConfig(this);
        }
    }
}
