package com.skillgate.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Agent tool interface.
 *
 * <p>
 * Every tool has a name, description, parameter schema, and an
 * asynchronous execute method that returns a {@link ToolResult}.
 * </p>
 */
public interface AgentTool {

    /** Unique tool name (e.g. "skill_memory_write"). */
    String getName();

    /** Human-readable description for the LLM. */
    String getDescription();

    /** JSON Schema describing the tool's input parameters. */
    JsonNode getParameterSchema();

    /** Execute the tool with the given context. */
    CompletableFuture<ToolResult> execute(ToolContext context);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolResult {
        private boolean success;
        private String output;
        private Object data;
        private String error;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolContext {
        private JsonNode parameters;
    }
}
