package io.github.drompincen.turnstile.protocol.api;

import java.util.List;

public record TurnOutcomeDto(
        String threadId,
        String status,
        List<String> pendingCallIds,
        String queuedMessageId
) {}
