package io.github.drompincen.turnstile.persistence.store;

import io.github.drompincen.turnstile.protocol.event.Event;

import java.util.List;

/**
 * Durable, append-only storage for thread events. Implementations only store; sequence numbers
 * are assigned by the caller and a duplicate {@code (threadId, seq)} pair is rejected.
 */
public interface EventStore {

    void createThread(String threadId);

    boolean threadExists(String threadId);

    List<String> threadIds();

    void append(Event event);

    /** All events of the thread ordered by {@code seq}; empty for an unknown thread. */
    List<Event> read(String threadId);

    /** Highest stored {@code seq} for the thread, 0 when it has no events. */
    long lastSeq(String threadId);

    void purge(String threadId);

    void clear();

    default void close() {
    }
}
