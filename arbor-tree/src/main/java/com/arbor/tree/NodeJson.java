package com.arbor.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON serialization of the nested {@code {label, value, children}} form.
 * Absent fields are omitted when writing and unknown fields are ignored when reading,
 * so files written by newer minor versions still load.
 */
public final class NodeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private NodeJson() {
    }

    /** Mapper configured for the tree format; shared by the container codec. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a record to pretty-printed JSON. {@code null} serializes to {@code "null"} (empty tree).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(NodeRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJson(Node node) {
        return toJson(node != null ? node.toRecord() : null);
    }

    /**
     * Parses a record from JSON. Returns null for the literal {@code null}.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static NodeRecord fromJson(String json) {
        try {
            return MAPPER.readValue(json, NodeRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Parses JSON straight into a fresh node graph; null for an empty tree. */
    public static Node nodeFromJson(String json) {
        NodeRecord record = fromJson(json);
        return record != null ? Node.fromRecord(record) : null;
    }
}
