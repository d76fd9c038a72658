/**
 * Ordered, labeled tree model.
 *
 * <ul>
 *   <li>{@link com.arbor.tree.Node} – mutable node with parent back-reference and checked structural edits</li>
 *   <li>{@link com.arbor.tree.NodeRecord} – immutable {@code {label, value, children}} value form</li>
 *   <li>{@link com.arbor.tree.NodeJson} – {@code toJson}/{@code fromJson} for the value form</li>
 *   <li>{@link com.arbor.tree.Messages} – localized placeholders and messages</li>
 *   <li>{@link com.arbor.tree.ArborException} – base of all Arbor errors; {@link com.arbor.tree.StructuralException}</li>
 * </ul>
 */
package com.arbor.tree;
