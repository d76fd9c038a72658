package com.arbor.container;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata stored next to the tree: always a {@code version}, optionally free-form {@code notes}.
 * Keys this version does not know are kept so they survive a load/save cycle.
 */
public final class Manifest {

    public static final String VERSION = "version";
    public static final String NOTES = "notes";

    private final Map<String, Object> entries;

    public Manifest(Map<String, Object> entries) {
        this.entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
    }

    /** A manifest holding only {@code version}. */
    public static Manifest withVersion(String version) {
        Manifest manifest = new Manifest(null);
        manifest.entries.put(VERSION, Objects.requireNonNull(version, "version"));
        return manifest;
    }

    /** Version text as stored; null if absent. Non-string values are converted with {@code toString()}. */
    public String getVersion() {
        Object v = entries.get(VERSION);
        return v != null ? v.toString() : null;
    }

    public void setVersion(String version) {
        entries.put(VERSION, Objects.requireNonNull(version, "version"));
    }

    /** Free-form notes, e.g. the sentence a syntax tree was built from. Empty string when unset. */
    public String getNotes() {
        Object v = entries.get(NOTES);
        return v != null ? v.toString() : "";
    }

    public void setNotes(String notes) {
        entries.put(NOTES, notes != null ? notes : "");
    }

    public Object get(String key) {
        return entries.get(key);
    }

    public void put(String key, Object value) {
        entries.put(key, value);
    }

    /** Copies every entry of {@code other} over this manifest. */
    public void merge(Manifest other) {
        entries.putAll(other.entries);
    }

    public Manifest copy() {
        return new Manifest(entries);
    }

    /** Unmodifiable view of all entries, in insertion order. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Manifest) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Manifest" + entries;
    }
}
