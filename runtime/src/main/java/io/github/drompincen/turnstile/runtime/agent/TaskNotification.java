package io.github.drompincen.turnstile.runtime.agent;

public record TaskNotification(
        String taskId,
        String fromAgent,
        String targetThreadId,
        String message
) {}
