package io.github.drompincen.turnstile.protocol.event;

public record SystemPromptData(String content) implements EventData {
    @Override
    public EventType type() {
        return EventType.SYSTEM_PROMPT;
    }
}
