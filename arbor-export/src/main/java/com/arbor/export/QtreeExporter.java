package com.arbor.export;

import com.arbor.markup.MarkupTranslator;
import com.arbor.tree.Messages;
import com.arbor.tree.Node;
import com.arbor.tree.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a tree as LaTeX source for the {@code qtree} package: {@code \Tree [.root ... ]}.
 * <p>
 * Nodes with children, and the root in any case, open a bracket group {@code [.label} and close it with
 * {@code ]} on its own line; leaves below the root are written inline. A non-empty value follows the label
 * after {@code \\}. Labels and values are translated from markup when valid and written raw otherwise.
 * Each level indents by two spaces.
 */
public final class QtreeExporter {

    private static final Logger log = LoggerFactory.getLogger(QtreeExporter.class);

    private static final String INDENT = "  ";
    private static final String TREE_COMMAND = "\\Tree ";
    private static final String GROUP_OPEN = "[.";
    private static final String GROUP_CLOSE = "]";
    private static final String VALUE_SEPARATOR = "\\\\";

    private final Messages messages;

    public QtreeExporter() {
        this(Messages.defaults());
    }

    public QtreeExporter(Messages messages) {
        this.messages = messages;
    }

    /**
     * Full export: a LaTeX comment telling the reader to load {@code qtree}, a blank line, then {@link #render}.
     *
     * @throws StructuralException if {@code root} is null
     */
    public String export(Node root) {
        return "% " + messages.get(Messages.QTREE_HEADER) + "\n\n" + render(root);
    }

    /**
     * The {@code \Tree} command for the given root, one node per line.
     *
     * @throws StructuralException if {@code root} is null
     */
    public String render(Node root) {
        if (root == null) {
            throw new StructuralException("Cannot export an empty tree");
        }
        StringBuilder sb = new StringBuilder(TREE_COMMAND);
        renderNode(root, 0, new MarkupTranslator(), sb);
        log.debug("Rendered qtree source ({} chars) for root {}", sb.length(), root);
        return sb.toString();
    }

    private static void renderNode(Node node, int level, MarkupTranslator translator, StringBuilder sb) {
        String label = translate(node.getLabel(), translator);
        String value = node.getValue() != null && !node.getValue().isEmpty()
                ? translate(node.getValue(), translator)
                : null;
        boolean leaf = node.isLeaf() && level > 0;
        String indent = INDENT.repeat(level);

        sb.append(indent);
        if (!leaf) {
            sb.append(GROUP_OPEN);
        }
        sb.append(label);
        if (value != null && !value.isEmpty()) {
            sb.append(VALUE_SEPARATOR).append(value);
        }
        sb.append('\n');
        for (Node child : node.getChildren()) {
            renderNode(child, level + 1, translator, sb);
        }
        if (!leaf) {
            sb.append(indent).append(GROUP_CLOSE).append('\n');
        }
    }

    private static String translate(String raw, MarkupTranslator translator) {
        String text = raw != null ? raw : "";
        return translator.reset().feed(text).close().texOr(text);
    }
}
