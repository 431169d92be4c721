package com.tiergate.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Read-only event payload shared by every invocation of a run.
 * Serialized to JSON once, at creation.
 */
public final class TaskInput {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final JsonNode payload;
    private final byte[] serialized;

    private TaskInput(JsonNode payload, byte[] serialized) {
        this.payload = payload;
        this.serialized = serialized;
    }

    /**
     * Wrap a payload. Accepts a {@link JsonNode}, a JSON-compatible object graph
     * (maps, lists, records), or null for the empty object.
     */
    public static TaskInput of(Object payload) {
        JsonNode node;
        if (payload == null) {
            node = JsonNodeFactory.instance.objectNode();
        } else if (payload instanceof JsonNode jsonNode) {
            node = jsonNode.deepCopy();
        } else {
            node = objectMapper.valueToTree(payload);
        }
        try {
            return new TaskInput(node, objectMapper.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Input is not serializable as JSON: " + e.getMessage(), e);
        }
    }

    public static TaskInput empty() {
        return of(null);
    }

    /**
     * Copy of the payload tree.
     */
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /**
     * Write the serialized document to a stream. The stream is not closed.
     */
    public void writeTo(OutputStream out) throws IOException {
        out.write(serialized);
    }

    public String asJson() {
        return new String(serialized, StandardCharsets.UTF_8);
    }

    public int size() {
        return serialized.length;
    }

    @Override
    public String toString() {
        return "TaskInput[" + serialized.length + " bytes]";
    }
}
