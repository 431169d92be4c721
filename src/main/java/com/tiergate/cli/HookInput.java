package com.tiergate.cli;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Parsed CLI input: raw hook definitions and the event payload handed to every hook.
 *
 * @param hooks Raw hook maps, empty when the input has none
 * @param data  Event payload, null for the empty object
 */
record HookInput(List<Map<String, Object>> hooks, JsonNode data) {
}
