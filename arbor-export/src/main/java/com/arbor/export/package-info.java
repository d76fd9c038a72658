/**
 * Text exports of a tree.
 *
 * <ul>
 *   <li>{@link com.arbor.export.QtreeExporter} – LaTeX {@code qtree} source</li>
 *   <li>{@link com.arbor.export.DotExporter} – Graphviz graph built as a {@link com.arbor.export.dot.DotGraph},
 *       configured by {@link com.arbor.export.DiagramOptions}</li>
 * </ul>
 * Neither format can be read back into a tree; use the container for that.
 */
package com.arbor.export;
