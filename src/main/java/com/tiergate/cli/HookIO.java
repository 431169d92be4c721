package com.tiergate.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code {"hooks": [...], "data": {...}}} documents and writes JSON results.
 */
class HookIO {

    private static final TypeReference<List<Map<String, Object>>> HOOK_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final InputStream stdin;

    HookIO(InputStream stdin) {
        this.stdin = stdin;
    }

    /**
     * Read the input document from a file, or from stdin when the file is null or "-".
     *
     * @throws IOException              if the input cannot be read or is not JSON
     * @throws IllegalArgumentException if the document does not have the expected shape
     */
    HookInput read(String file) throws IOException {
        JsonNode root;
        if (file == null || file.equals("-")) {
            root = objectMapper.readTree(stdin);
        } else {
            try (InputStream in = Files.newInputStream(Path.of(file))) {
                root = objectMapper.readTree(in);
            }
        }
        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("No input");
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Input must be a JSON object");
        }

        JsonNode hooks = root.get("hooks");
        List<Map<String, Object>> hookList;
        if (hooks == null || hooks.isNull()) {
            hookList = List.of();
        } else if (!hooks.isArray()) {
            throw new IllegalArgumentException("'hooks' must be an array");
        } else {
            // Throws IllegalArgumentException for elements that are not objects
            hookList = objectMapper.convertValue(hooks, HOOK_LIST);
        }

        JsonNode data = root.get("data");
        return new HookInput(hookList, data == null || data.isNull() ? null : data);
    }

    void print(PrintWriter out, Object value) throws JsonProcessingException {
        out.println(objectMapper.writeValueAsString(value));
        out.flush();
    }
}
