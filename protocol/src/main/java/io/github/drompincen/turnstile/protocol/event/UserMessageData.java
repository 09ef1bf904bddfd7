package io.github.drompincen.turnstile.protocol.event;

public record UserMessageData(String content) implements EventData {
    @Override
    public EventType type() {
        return EventType.USER_MESSAGE;
    }
}
