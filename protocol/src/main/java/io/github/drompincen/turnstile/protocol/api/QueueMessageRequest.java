package io.github.drompincen.turnstile.protocol.api;

/** {@code taskId} is required when {@code kind} is {@code task_notification}. */
public record QueueMessageRequest(
        String content,
        String kind,
        String priority,
        String source,
        String taskId,
        String fromAgent
) {}
