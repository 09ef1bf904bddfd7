package io.github.drompincen.turnstile.persistence.store;

import io.github.drompincen.turnstile.persistence.StorageUnavailableException;
import io.github.drompincen.turnstile.protocol.event.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventStore implements EventStore {

    private final Map<String, List<Event>> threads = new ConcurrentHashMap<>();

    @Override
    public void createThread(String threadId) {
        threads.computeIfAbsent(threadId, k -> new ArrayList<>());
    }

    @Override
    public boolean threadExists(String threadId) {
        return threads.containsKey(threadId);
    }

    @Override
    public List<String> threadIds() {
        return List.copyOf(threads.keySet());
    }

    @Override
    public void append(Event event) {
        List<Event> events = threads.computeIfAbsent(event.threadId(), k -> new ArrayList<>());
        synchronized (events) {
            long last = events.isEmpty() ? 0 : events.get(events.size() - 1).seq();
            if (event.seq() <= last) {
                throw new StorageUnavailableException("Duplicate seq " + event.seq() + " for thread " + event.threadId());
            }
            events.add(event);
        }
    }

    @Override
    public List<Event> read(String threadId) {
        List<Event> events = threads.get(threadId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    @Override
    public long lastSeq(String threadId) {
        List<Event> events = threads.get(threadId);
        if (events == null) {
            return 0;
        }
        synchronized (events) {
            return events.isEmpty() ? 0 : events.get(events.size() - 1).seq();
        }
    }

    @Override
    public void purge(String threadId) {
        threads.remove(threadId);
    }

    @Override
    public void clear() {
        threads.clear();
    }
}
