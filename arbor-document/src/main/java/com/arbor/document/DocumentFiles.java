package com.arbor.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Routes a document save by file extension: {@code .gv}/{@code .dot} write DOT source, {@code .tex}
 * writes qtree source, anything else writes the container. Only a container write counts as saving the
 * document (clears dirty and sets the last path). Image extensions ({@code .png}, {@code .svg}, {@code .pdf}, ...)
 * are rejected: images are rendered from the DOT source with Graphviz.
 */
public final class DocumentFiles {

    private static final Logger log = LoggerFactory.getLogger(DocumentFiles.class);

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "png", "svg", "svgz", "pdf", "ps", "eps", "jpg", "jpeg", "gif", "bmp", "tif", "tiff", "webp");

    private DocumentFiles() {
    }

    /**
     * Writes {@code document} to {@code path} in the format its extension selects.
     *
     * @return the format written
     * @throws SaveException                      if the extension names an image format; nothing is written
     * @throws com.arbor.tree.StructuralException if a text export is requested for an empty document
     * @throws UncheckedIOException               on I/O failure
     */
    public static ExportFormat save(Document document, Path path) {
        String extension = extension(path);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            throw new SaveException("Cannot render ." + extension + " images; save as .gv and render it with Graphviz: "
                    + path);
        }
        ExportFormat format = ExportFormat.forPath(path);
        switch (format) {
            case DOT -> writeText(path, document.toDot());
            case QTREE -> writeText(path, document.toQtree());
            case CONTAINER -> document.saveContainer(path);
        }
        log.debug("Wrote {} as {}", path, format);
        return format;
    }

    /** Writes UTF-8 text, replacing any existing file. */
    public static void writeText(Path path, String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    /** Lower-cased extension without the dot; empty when the file name has none. */
    static String extension(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : "";
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /** File name without its last extension; null for a null path. */
    public static String stem(Path path) {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
