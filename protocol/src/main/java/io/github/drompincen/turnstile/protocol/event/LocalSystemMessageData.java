package io.github.drompincen.turnstile.protocol.event;

/** Informational message for the operator. Never sent to the model. */
public record LocalSystemMessageData(String content) implements EventData {
    @Override
    public EventType type() {
        return EventType.LOCAL_SYSTEM_MESSAGE;
    }
}
