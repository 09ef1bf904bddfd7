package io.github.drompincen.turnstile.runtime.thread;

import io.github.drompincen.turnstile.protocol.event.ToolCallData;

import java.time.Instant;

public record PendingApproval(
        String toolCallId,
        ToolCallData toolCall,
        Instant requestedAt
) {}
