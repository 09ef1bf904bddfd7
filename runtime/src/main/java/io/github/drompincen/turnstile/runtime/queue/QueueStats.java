package io.github.drompincen.turnstile.runtime.queue;

/**
 * {@code oldestMessageAge} is in milliseconds and null when the queue is empty.
 */
public record QueueStats(
        int queueLength,
        Long oldestMessageAge,
        int highPriorityCount
) {}
