package io.github.drompincen.turnstile.protocol.api;

public record ThreadDto(
        String threadId,
        String state,
        long eventCount
) {}
