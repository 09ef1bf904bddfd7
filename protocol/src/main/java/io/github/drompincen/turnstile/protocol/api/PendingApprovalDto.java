package io.github.drompincen.turnstile.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record PendingApprovalDto(
        String toolCallId,
        String toolName,
        JsonNode arguments,
        Instant requestedAt
) {}
