package io.github.drompincen.turnstile.runtime.backend;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;

public record BackendToolCall(
        String id,
        String name,
        JsonNode input
) {
    public ToolCallData toEventData() {
        return new ToolCallData(id, name, input);
    }

    public static BackendToolCall from(ToolCallData call) {
        return new BackendToolCall(call.id(), call.name(), call.arguments());
    }
}
