package com.arbor.container;

import com.arbor.tree.Messages;
import com.arbor.tree.NodeJson;
import com.arbor.tree.NodeRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes the container format: a zip archive with two JSON entries,
 * {@value #MANIFEST_ENTRY} (an object holding at least {@code version}) and {@value #TREE_ENTRY}
 * (the root in {@code {label, value, children}} form, or {@code null} for an empty tree).
 * <p>
 * Loading merges the stored manifest over {@link #defaultManifest()} and checks the major version
 * before the tree entry is parsed. Every failure to read is reported as {@link IncompatibleFormatException}.
 * Saving always stamps the codec version into the manifest.
 */
public final class ContainerCodec {

    private static final Logger log = LoggerFactory.getLogger(ContainerCodec.class);

    public static final String CURRENT_VERSION = "1.0.0";
    public static final String MANIFEST_ENTRY = "manifest.json";
    public static final String TREE_ENTRY = "tree.json";

    private static final TypeReference<Map<String, Object>> MANIFEST_TYPE = new TypeReference<>() {};

    private final FormatVersion version;
    private final Messages messages;
    private final ObjectMapper mapper = NodeJson.mapper();

    public ContainerCodec() {
        this(CURRENT_VERSION, Messages.defaults());
    }

    /**
     * @param version  version this codec writes and the newest major it accepts
     * @param messages source of the user-facing error messages
     */
    public ContainerCodec(String version, Messages messages) {
        this.version = FormatVersion.parse(version);
        this.messages = messages;
    }

    public FormatVersion getVersion() {
        return version;
    }

    /** Manifest written for a new document: the codec version only. */
    public Manifest defaultManifest() {
        return Manifest.withVersion(version.toString());
    }

    /**
     * Loads a container file.
     *
     * @throws IncompatibleFormatException if the file is not a readable container or is too new
     * @throws UncheckedIOException        if the file does not exist or cannot be opened
     */
    public LoadedContainer load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new NoSuchFileException(path.toString()));
        }
        try (ZipFile zip = new ZipFile(path.toFile())) {
            LoadedContainer loaded = decode(name -> {
                ZipEntry entry = zip.getEntry(name);
                if (entry == null) return null;
                try (InputStream in = zip.getInputStream(entry)) {
                    return in.readAllBytes();
                }
            });
            log.info("Loaded container {} (version={}, nodes={})", path, loaded.manifest().getVersion(),
                    loaded.tree() != null ? loaded.tree().size() : 0);
            return loaded;
        } catch (IncompatibleFormatException e) {
            log.warn("Rejected container {}: {}", path, e.getMessage());
            throw e;
        } catch (IOException e) {
            log.warn("Unreadable container {}: {}", path, e.toString());
            throw unreadable(e);
        }
    }

    /**
     * Reads a container from a stream. The stream is consumed but not closed.
     *
     * @throws IncompatibleFormatException if the data is not a readable container or is too new
     */
    public LoadedContainer read(InputStream in) {
        Map<String, byte[]> entries = new HashMap<>();
        try {
            ZipInputStream zip = new ZipInputStream(in);
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (MANIFEST_ENTRY.equals(entry.getName()) || TREE_ENTRY.equals(entry.getName())) {
                    entries.put(entry.getName(), zip.readAllBytes());
                }
            }
            return decode(entries::get);
        } catch (IOException e) {
            throw unreadable(e);
        }
    }

    /**
     * Writes the container to {@code path}. Data goes to a temporary file in the same directory which then
     * replaces the target, so a failed write leaves any existing file untouched.
     *
     * @param manifest manifest to store; its version is set to this codec's version
     * @param tree     root record, or null for an empty tree
     * @throws UncheckedIOException on I/O failure
     */
    public void save(Path path, Manifest manifest, NodeRecord tree) {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                write(out, manifest, tree);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            log.info("Saved container {} (version={}, nodes={})", target, version, tree != null ? tree.size() : 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save container " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temporary file {}: {}", tmp, e.toString());
                }
            }
        }
    }

    /**
     * Writes the container to a stream. The stream is finished as a zip but not closed.
     *
     * @throws IOException on write failure
     */
    public void write(OutputStream out, Manifest manifest, NodeRecord tree) throws IOException {
        Manifest stamped = manifest != null ? manifest.copy() : defaultManifest();
        stamped.setVersion(version.toString());

        ZipOutputStream zip = new ZipOutputStream(out);
        zip.setMethod(ZipOutputStream.DEFLATED);
        zip.putNextEntry(new ZipEntry(TREE_ENTRY));
        zip.write(mapper.writeValueAsBytes(tree));
        zip.closeEntry();
        zip.putNextEntry(new ZipEntry(MANIFEST_ENTRY));
        zip.write(mapper.writeValueAsBytes(stamped.asMap()));
        zip.closeEntry();
        zip.finish();
        zip.flush();
    }

    /** Container bytes, for callers that route the data themselves. */
    public byte[] toBytes(Manifest manifest, NodeRecord tree) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(out, manifest, tree);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    @FunctionalInterface
    private interface EntryReader {
        /** Entry bytes, or null when the entry is missing. */
        byte[] read(String name) throws IOException;
    }

    private LoadedContainer decode(EntryReader entries) throws IOException {
        byte[] manifestBytes = entries.read(MANIFEST_ENTRY);
        if (manifestBytes == null) {
            throw unreadable(new NoSuchFileException(MANIFEST_ENTRY));
        }
        JsonNode manifestJson = mapper.readTree(manifestBytes);
        if (manifestJson == null || !manifestJson.isObject()) {
            throw unreadable(new IOException(MANIFEST_ENTRY + " is not a JSON object"));
        }
        Manifest manifest = defaultManifest();
        manifest.merge(new Manifest(mapper.convertValue(manifestJson, MANIFEST_TYPE)));
        checkVersion(manifest.getVersion());

        byte[] treeBytes = entries.read(TREE_ENTRY);
        if (treeBytes == null) {
            throw unreadable(new NoSuchFileException(TREE_ENTRY));
        }
        NodeRecord tree = mapper.readValue(treeBytes, NodeRecord.class);
        return new LoadedContainer(manifest, tree);
    }

    private void checkVersion(String stored) {
        FormatVersion theirs;
        try {
            theirs = FormatVersion.parse(stored);
        } catch (IllegalArgumentException e) {
            throw unreadable(e);
        }
        if (!version.canRead(theirs)) {
            String required = FormatVersion.firstOfMajor(theirs.getMajor()).toString();
            throw new IncompatibleFormatException(
                    messages.format(Messages.CONTAINER_TOO_NEW, version.toString(), required),
                    required, version.toString());
        }
    }

    private IncompatibleFormatException unreadable(Exception cause) {
        return new IncompatibleFormatException(messages.get(Messages.CONTAINER_UNREADABLE), cause);
    }
}
