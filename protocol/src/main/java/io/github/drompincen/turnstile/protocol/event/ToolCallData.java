package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public record ToolCallData(
        String id,
        String name,
        JsonNode arguments
) implements EventData {

    public ToolCallData {
        if (arguments == null) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
    }

    @Override
    public EventType type() {
        return EventType.TOOL_CALL;
    }
}
