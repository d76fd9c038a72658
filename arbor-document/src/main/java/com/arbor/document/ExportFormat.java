package com.arbor.document;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** Output format chosen from a file name's extension. */
public enum ExportFormat {
    /** Graphviz source. */
    DOT(List.of(".gv", ".dot")),
    /** LaTeX qtree source. */
    QTREE(List.of(".tex")),
    /** The container format; used for every other extension. */
    CONTAINER(List.of());

    private final List<String> extensions;

    ExportFormat(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    /** Format for the given path, matching the extension case-insensitively. */
    public static ExportFormat forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        for (ExportFormat format : values()) {
            for (String ext : format.extensions) {
                if (name.endsWith(ext)) return format;
            }
        }
        return CONTAINER;
    }
}
