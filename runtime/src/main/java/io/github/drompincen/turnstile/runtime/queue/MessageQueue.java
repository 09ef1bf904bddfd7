package io.github.drompincen.turnstile.runtime.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Messages waiting for an agent. High priority first, arrival order within a priority.
 */
public class MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(MessageQueue.class);

    private final Clock clock;
    private final Deque<QueuedMessage> high = new ArrayDeque<>();
    private final Deque<QueuedMessage> normal = new ArrayDeque<>();

    public MessageQueue() {
        this(Clock.systemUTC());
    }

    public MessageQueue(Clock clock) {
        this.clock = clock;
    }

    public String enqueue(QueuedMessage.Kind kind, String content, QueuedMessage.Metadata metadata) {
        return enqueue(newMessage(kind, content, metadata));
    }

    /** Builds a message stamped with this queue's clock without enqueuing it. */
    public QueuedMessage newMessage(QueuedMessage.Kind kind, String content, QueuedMessage.Metadata metadata) {
        return new QueuedMessage(UUID.randomUUID().toString(), kind, content, clock.instant(), metadata);
    }

    public synchronized String enqueue(QueuedMessage message) {
        if (message.priority() == QueuedMessage.Priority.HIGH) {
            high.addLast(message);
        } else {
            normal.addLast(message);
        }
        log.debug("Queued {} message {} ({} waiting)", message.kind(), message.id(), high.size() + normal.size());
        return message.id();
    }

    public synchronized Optional<QueuedMessage> dequeueNext() {
        QueuedMessage next = high.pollFirst();
        if (next == null) {
            next = normal.pollFirst();
        }
        return Optional.ofNullable(next);
    }

    public synchronized QueueStats stats() {
        Instant oldest = null;
        for (QueuedMessage message : contents()) {
            if (oldest == null || message.timestamp().isBefore(oldest)) {
                oldest = message.timestamp();
            }
        }
        Long age = oldest == null ? null : Duration.between(oldest, clock.instant()).toMillis();
        return new QueueStats(high.size() + normal.size(), age, high.size());
    }

    /** Snapshot in dequeue order. */
    public synchronized List<QueuedMessage> contents() {
        List<QueuedMessage> all = new ArrayList<>(high.size() + normal.size());
        all.addAll(high);
        all.addAll(normal);
        return all;
    }

    public synchronized boolean isEmpty() {
        return high.isEmpty() && normal.isEmpty();
    }

    public synchronized int clear() {
        int removed = high.size() + normal.size();
        high.clear();
        normal.clear();
        return removed;
    }

    public synchronized int clear(Predicate<QueuedMessage> filter) {
        return removeIf(high, filter) + removeIf(normal, filter);
    }

    private static int removeIf(Deque<QueuedMessage> deque, Predicate<QueuedMessage> filter) {
        int removed = 0;
        Iterator<QueuedMessage> it = deque.iterator();
        while (it.hasNext()) {
            if (filter.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
