package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Text the model produced for one backend call. {@code tokenUsage} is null when the backend
 * reported no usage for the call.
 */
public record AgentMessageData(
        String content,
        @JsonInclude(JsonInclude.Include.NON_NULL) TokenUsage tokenUsage
) implements EventData {

    public AgentMessageData(String content) {
        this(content, null);
    }

    @Override
    public EventType type() {
        return EventType.AGENT_MESSAGE;
    }
}
