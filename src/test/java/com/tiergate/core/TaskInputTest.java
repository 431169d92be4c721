package com.tiergate.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskInput.
 */
class TaskInputTest {

    @Test
    @DisplayName("Null payload is the empty object")
    void nullIsEmptyObject() {
        assertEquals("{}", TaskInput.of(null).asJson());
        assertEquals("{}", TaskInput.empty().asJson());
        assertEquals(2, TaskInput.empty().size());
    }

    @Test
    @DisplayName("Object graphs are serialized once")
    void serializesObjectGraph() throws Exception {
        TaskInput input = TaskInput.of(Map.of("tool", "Edit", "paths", List.of("a", "b")));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        input.writeTo(out);

        assertEquals(input.asJson(), out.toString(StandardCharsets.UTF_8));
        assertEquals("Edit", input.payload().get("tool").asText());
    }

    @Test
    @DisplayName("Later changes to the source tree do not leak into the input")
    void isolatedFromSource() {
        ObjectNode source = new ObjectMapper().createObjectNode().put("n", 1);
        TaskInput input = TaskInput.of(source);

        source.put("n", 2);
        ((ObjectNode) input.payload()).put("n", 3);

        assertEquals("{\"n\":1}", input.asJson());
        assertEquals(1, input.payload().get("n").asInt());
    }

    @Test
    @DisplayName("Unserializable payload is rejected")
    void rejectsUnserializable() {
        Object selfReferencing = new Object() {
            public Object getSelf() {
                return this;
            }
        };

        assertThrows(IllegalArgumentException.class, () -> TaskInput.of(selfReferencing));
    }
}
