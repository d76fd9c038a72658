package com.arbor.document;

import com.arbor.container.ContainerCodec;
import com.arbor.container.IncompatibleFormatException;
import com.arbor.container.Manifest;
import com.arbor.tree.Messages;
import com.arbor.tree.NodeRecord;
import com.arbor.tree.StructuralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentFilesTest {

    @TempDir
    Path tempDir;

    private final Clipboard clipboard = new Clipboard();
    private Document doc;

    @BeforeEach
    void setUp() {
        doc = new Document(clipboard);
        doc.add(Location.CHILD, "TP", null);
        doc.add(Location.CHILD, "DP", "the cat");
        doc.add(Location.SIBLING, "T<bar/>", null);
        doc.setNotes("The cat sat.");
    }

    @Test
    void formatForPath_routesByExtension() {
        assertEquals(ExportFormat.DOT, ExportFormat.forPath(Path.of("tree.gv")));
        assertEquals(ExportFormat.DOT, ExportFormat.forPath(Path.of("TREE.DOT")));
        assertEquals(ExportFormat.QTREE, ExportFormat.forPath(Path.of("tree.tex")));
        assertEquals(ExportFormat.CONTAINER, ExportFormat.forPath(Path.of("tree.arbor")));
        assertEquals(ExportFormat.CONTAINER, ExportFormat.forPath(Path.of("tree")));
    }

    @Test
    void stem_dropsLastExtension() {
        assertEquals("simple", DocumentFiles.stem(Path.of("dir", "simple.arbor")));
        assertEquals("a.b", DocumentFiles.stem(Path.of("a.b.gv")));
        assertEquals(".hidden", DocumentFiles.stem(Path.of(".hidden")));
        assertNull(DocumentFiles.stem(null));
    }

    @Test
    void saveContainer_thenOpen_restoresDocument() {
        Path file = tempDir.resolve("simple.arbor");

        assertEquals(ExportFormat.CONTAINER, doc.save(file));
        assertFalse(doc.isDirty());
        assertEquals(file, doc.getLastPath());

        Document reopened = Document.open(file, clipboard);
        assertEquals(doc.getRoot().toRecord(), reopened.getRoot().toRecord());
        assertEquals("The cat sat.", reopened.getNotes());
        assertEquals(file, reopened.getLastPath());
        assertFalse(reopened.isDirty());
        assertFalse(reopened.hasSelection());
    }

    @Test
    void save_withoutPathRequiresEarlierSave() {
        assertThrows(SaveException.class, () -> doc.save());

        Path file = tempDir.resolve("again.arbor");
        doc.save(file);
        doc.edit("CP", null);

        doc.save();
        assertFalse(doc.isDirty());
        assertEquals("CP", Document.open(file, clipboard).getRoot().getChildren().get(1).getLabel());
    }

    @Test
    void saveDot_writesSourceAndLeavesDocumentState() throws IOException {
        Path gv = tempDir.resolve("diagram.gv");

        assertEquals(ExportFormat.DOT, doc.save(gv));

        String source = Files.readString(gv, StandardCharsets.UTF_8);
        assertTrue(source.startsWith("graph {\n\tgraph [dpi=400 nodesep=.25 ranksep=0.02]\n\tnode [shape=plain]\n"));
        assertTrue(source.contains("\tDP [label=<DP<br/>the cat>]\n"));
        assertTrue(source.contains("\tTP -- DP\n"));
        assertTrue(doc.isDirty());
        assertNull(doc.getLastPath());
    }

    @Test
    void saveQtree_writesSource() throws IOException {
        Path tex = tempDir.resolve("tree.tex");

        assertEquals(ExportFormat.QTREE, doc.save(tex));

        assertEquals(doc.toQtree(), Files.readString(tex, StandardCharsets.UTF_8));
        assertTrue(doc.isDirty());
    }

    @Test
    void save_imageExtensionIsRejectedWithoutWriting() {
        Path container = tempDir.resolve("tree.arbor");
        doc.save(container);
        doc.edit("CP", null);

        for (String name : List.of("tree.png", "tree.SVG", "tree.pdf")) {
            Path image = tempDir.resolve(name);
            assertThrows(SaveException.class, () -> doc.save(image));
            assertFalse(Files.exists(image));
        }
        assertEquals(container, doc.getLastPath());
        assertTrue(doc.isDirty());
    }

    @Test
    void emptyDocument_savesAsNullTreeAndLoadsEmpty() {
        Document empty = new Document(clipboard);
        Path file = tempDir.resolve("empty.arbor");

        empty.save(file);

        Document reopened = Document.open(file, clipboard);
        assertTrue(reopened.isEmpty());
        assertThrows(StructuralException.class, () -> empty.save(tempDir.resolve("empty.tex")));
    }

    @Test
    void open_keepsUnknownManifestKeys() {
        ContainerCodec codec = new ContainerCodec();
        Manifest manifest = codec.defaultManifest();
        manifest.put("author", "someone");
        Path file = tempDir.resolve("extra.arbor");
        codec.save(file, manifest, NodeRecord.leaf("S", null));

        Document opened = Document.open(file, clipboard, codec);
        opened.setNotes("edited");
        opened.save();

        Manifest stored = codec.load(file).manifest();
        assertEquals("someone", stored.get("author"));
        assertEquals("edited", stored.getNotes());
    }

    @Test
    void open_tooNewFileFails() {
        Path file = tempDir.resolve("future.arbor");
        new ContainerCodec("2.1.0", Messages.defaults())
                .save(file, null, new NodeRecord("S", null, List.of()));

        IncompatibleFormatException e = assertThrows(IncompatibleFormatException.class,
                () -> Document.open(file, clipboard));
        assertTrue(e.isTooNew());
        assertEquals("2.0.0", e.getRequiredVersion());
    }
}
