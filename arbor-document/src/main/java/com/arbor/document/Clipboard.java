package com.arbor.document;

import com.arbor.tree.NodeRecord;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recently copied subtree. One instance is shared by every {@link Document} that
 * should see the same copies; the last writer wins and reading never clears it.
 */
public final class Clipboard {

    private final AtomicReference<NodeRecord> contents = new AtomicReference<>();

    public void put(NodeRecord record) {
        contents.set(Objects.requireNonNull(record, "record"));
    }

    public Optional<NodeRecord> contents() {
        return Optional.ofNullable(contents.get());
    }

    public boolean isEmpty() {
        return contents.get() == null;
    }

    public void clear() {
        contents.set(null);
    }
}
