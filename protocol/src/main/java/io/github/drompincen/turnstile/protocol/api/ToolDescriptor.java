package io.github.drompincen.turnstile.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema,
        boolean safeInternal
) {}
