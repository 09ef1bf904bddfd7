package io.github.drompincen.turnstile.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    /** Safe internal tools run without asking for approval. */
    default boolean safeInternal() {
        return false;
    }

    ToolResult execute(ToolContext ctx, JsonNode input);
}
