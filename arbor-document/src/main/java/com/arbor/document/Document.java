package com.arbor.document;

import com.arbor.config.ArborConfig;
import com.arbor.container.ContainerCodec;
import com.arbor.container.LoadedContainer;
import com.arbor.container.Manifest;
import com.arbor.export.DiagramOptions;
import com.arbor.export.DotExporter;
import com.arbor.export.QtreeExporter;
import com.arbor.tree.Node;
import com.arbor.tree.NodeRecord;
import com.arbor.tree.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An editable tree with a selection, a manifest and a dirty flag.
 * <p>
 * Edits act on the selection and leave the new or affected node selected. Copy and paste go through the
 * injected {@link Clipboard}, so documents sharing one clipboard can paste each other's copies.
 * Not thread-safe.
 */
public final class Document {

    private static final Logger log = LoggerFactory.getLogger(Document.class);

    private final Clipboard clipboard;
    private final ContainerCodec codec;
    private final ArborConfig config;

    private Node root;
    private Node selection;
    private Manifest manifest;
    private boolean dirty;
    private Path lastPath;

    /** Empty document with default settings. */
    public Document(Clipboard clipboard) {
        this(clipboard, ArborConfig.defaults());
    }

    public Document(Clipboard clipboard, ArborConfig config) {
        this(clipboard, new ContainerCodec(ContainerCodec.CURRENT_VERSION, config.messages()), config);
    }

    public Document(Clipboard clipboard, ContainerCodec codec, ArborConfig config) {
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.manifest = codec.defaultManifest();
    }

    /**
     * Loads a container file.
     *
     * @throws com.arbor.container.IncompatibleFormatException if the file is damaged or too new
     * @throws java.io.UncheckedIOException                    if the file cannot be opened
     */
    public static Document open(Path path, Clipboard clipboard) {
        return open(path, clipboard, new ContainerCodec(), ArborConfig.defaults());
    }

    public static Document open(Path path, Clipboard clipboard, ContainerCodec codec) {
        return open(path, clipboard, codec, ArborConfig.defaults());
    }

    public static Document open(Path path, Clipboard clipboard, ContainerCodec codec, ArborConfig config) {
        LoadedContainer loaded = codec.load(path);
        Document doc = new Document(clipboard, codec, config);
        doc.root = loaded.toNode();
        doc.manifest = loaded.manifest();
        doc.lastPath = path;
        return doc;
    }

    // --- edits ---

    /**
     * Adds a node. Empty strings are stored as absent. In an empty document the node becomes the root
     * whatever the location; otherwise it is placed relative to the selection. The new node is selected.
     *
     * @throws NoSelectionException if the document is not empty and nothing is selected
     * @throws StructuralException  for {@link Location#SIBLING} of the root
     */
    public Node add(Location location, String label, String value) {
        Node node = new Node(emptyToNull(label), emptyToNull(value));
        place(location, node);
        log.debug("Added {} as {}", node, location);
        return node;
    }

    /**
     * Changes the selection's fields: null keeps a field, an empty string clears it.
     *
     * @throws NoSelectionException if nothing is selected
     */
    public void edit(String label, String value) {
        Node node = requireSelection();
        boolean changed = false;
        if (label != null && !Objects.equals(node.getLabel(), emptyToNull(label))) {
            node.setLabel(emptyToNull(label));
            changed = true;
        }
        if (value != null && !Objects.equals(node.getValue(), emptyToNull(value))) {
            node.setValue(emptyToNull(value));
            changed = true;
        }
        if (changed) {
            dirty = true;
            log.debug("Edited {}", node);
        }
    }

    /**
     * Removes the selected subtree. Deleting the root empties the document; otherwise the former
     * parent becomes the selection.
     *
     * @throws NoSelectionException if nothing is selected
     */
    public void delete() {
        Node node = requireSelection();
        if (node == root) {
            root = null;
            selection = null;
        } else {
            Node parent = node.getParent();
            node.detach();
            selection = parent;
        }
        dirty = true;
        log.debug("Deleted {}", node);
    }

    /**
     * Puts a copy of the selected subtree on the clipboard.
     *
     * @throws NoSelectionException if nothing is selected
     */
    public void copy() {
        Node node = requireSelection();
        clipboard.put(node.toRecord());
        log.debug("Copied {}", node);
    }

    /**
     * Places a fresh copy of the clipboard contents the way {@link #add} places a new node.
     *
     * @throws EmptyClipboardException if nothing has been copied
     */
    public Node paste(Location location) {
        NodeRecord record = clipboard.contents()
                .orElseThrow(() -> new EmptyClipboardException("Nothing to paste"));
        Node node = Node.fromRecord(record);
        place(location, node);
        log.debug("Pasted {} as {}", node, location);
        return node;
    }

    /** Swaps the selection with its previous sibling; does nothing when it is already first. */
    public void moveUp() {
        move(-1);
    }

    /** Swaps the selection with its next sibling; does nothing when it is already last. */
    public void moveDown() {
        move(1);
    }

    private void move(int offset) {
        Node node = requireSelection();
        if (node.isRoot()) {
            throw new RootImmutableException("The root node has no siblings to move among");
        }
        if (node.moveWithinParent(offset)) {
            dirty = true;
            log.debug("Moved {} by {}", node, offset);
        }
    }

    private void place(Location location, Node node) {
        Objects.requireNonNull(location, "location");
        if (root == null) {
            root = node;
        } else {
            Node anchor = requireSelection();
            switch (location) {
                case CHILD -> anchor.addChild(node);
                case PARENT -> {
                    if (anchor == root) {
                        node.addChild(root);
                        root = node;
                    } else {
                        anchor.insertParent(node);
                    }
                }
                case SIBLING -> {
                    if (anchor == root) {
                        throw new StructuralException("The root node cannot have siblings", anchor);
                    }
                    anchor.getParent().addChild(node);
                }
            }
        }
        selection = node;
        dirty = true;
    }

    // --- selection ---

    /**
     * Selects a node of this document's tree; null clears the selection.
     *
     * @throws StructuralException if the node is not part of this document's tree
     */
    public void select(Node node) {
        if (node != null && (root == null || node.getRoot() != root)) {
            throw new StructuralException("Node is not part of this document", node);
        }
        selection = node;
    }

    public void clearSelection() {
        selection = null;
    }

    public Node getSelection() {
        return selection;
    }

    public boolean hasSelection() {
        return selection != null;
    }

    private Node requireSelection() {
        if (selection == null) {
            throw new NoSelectionException("No node is selected");
        }
        return selection;
    }

    // --- state ---

    public Node getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /** True when there are changes not yet saved to a container. */
    public boolean isDirty() {
        return dirty;
    }

    /** Container file this document was last opened from or saved to; null for a new document. */
    public Path getLastPath() {
        return lastPath;
    }

    /** The live manifest. Keys other than {@code version} and {@code notes} are kept as read. */
    public Manifest getManifest() {
        return manifest;
    }

    public String getNotes() {
        return manifest.getNotes();
    }

    public void setNotes(String notes) {
        manifest.setNotes(notes);
        dirty = true;
    }

    // --- export ---

    /**
     * qtree source with its header comment.
     *
     * @throws StructuralException if the document is empty
     */
    public String toQtree() {
        return new QtreeExporter(config.messages()).export(root);
    }

    /**
     * DOT source using the configured diagram options, named after the last saved file.
     *
     * @throws StructuralException if the document is empty
     */
    public String toDot() {
        return toDot(config.toDiagramOptions().withGraphName(DocumentFiles.stem(lastPath)));
    }

    public String toDot(DiagramOptions options) {
        return new DotExporter(options).exportSource(root);
    }

    // --- persistence ---

    /**
     * Saves to the container file this document was opened from or last saved to.
     *
     * @throws SaveException if the document has no such file
     */
    public void save() {
        if (lastPath == null) {
            throw new SaveException("Document has not been saved before; a path is required");
        }
        saveContainer(lastPath);
    }

    /**
     * Saves or exports by extension; see {@link DocumentFiles}.
     *
     * @return the format written
     */
    public ExportFormat save(Path path) {
        return DocumentFiles.save(this, path);
    }

    void saveContainer(Path path) {
        codec.save(path, manifest, root != null ? root.toRecord() : null);
        manifest.setVersion(codec.getVersion().toString());
        lastPath = path;
        dirty = false;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
