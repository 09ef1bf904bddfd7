package io.github.drompincen.turnstile.runtime.backend;

import io.github.drompincen.turnstile.protocol.event.TokenUsage;

import java.util.List;

/**
 * One model reply. {@code usage} is null when the provider did not report token counts.
 */
public record BackendResponse(
        String content,
        List<BackendToolCall> toolCalls,
        TokenUsage usage,
        String stopReason
) {
    public BackendResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static BackendResponse text(String content, TokenUsage usage) {
        return new BackendResponse(content, List.of(), usage, "end_turn");
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
