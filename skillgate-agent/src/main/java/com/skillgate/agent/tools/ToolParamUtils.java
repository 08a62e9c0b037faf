package com.skillgate.agent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Helpers for reading tool parameters and building JSON tool results.
 */
public final class ToolParamUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolParamUtils() {
    }

    /**
     * Trimmed string parameter, or null when absent, not textual or blank.
     */
    public static String readStringParam(JsonNode params, String key) {
        if (params == null || !params.has(key))
            return null;
        JsonNode node = params.get(key);
        if (!node.isTextual())
            return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    public static ObjectNode createObject() {
        return MAPPER.createObjectNode();
    }

    public static String toJsonString(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    /**
     * Wrap a JSON payload carrying an {@code ok} flag. The payload is both
     * the output text and the structured data; {@code success} mirrors
     * {@code ok}.
     */
    public static AgentTool.ToolResult jsonResult(ObjectNode payload) {
        boolean ok = payload.path("ok").asBoolean(false);
        String error = !ok && payload.hasNonNull("error") ? payload.get("error").asText() : null;
        return AgentTool.ToolResult.builder()
                .success(ok)
                .output(toJsonString(payload))
                .data(payload)
                .error(error)
                .build();
    }
}
