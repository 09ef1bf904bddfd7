package io.github.drompincen.turnstile.protocol.event;

import java.time.Instant;
import java.util.Objects;

public record Event(
        String id,
        String threadId,
        long seq,
        EventType type,
        Instant timestamp,
        EventData data
) {
    public Event {
        Objects.requireNonNull(threadId, "threadId");
        Objects.requireNonNull(data, "data");
        if (type == null) {
            type = data.type();
        } else if (type != data.type()) {
            throw new IllegalArgumentException("Event type " + type + " does not match payload " + data.type());
        }
    }

    public <T extends EventData> T dataAs(Class<T> dataClass) {
        return dataClass.cast(data);
    }

    public boolean is(EventType eventType) {
        return type == eventType;
    }
}
