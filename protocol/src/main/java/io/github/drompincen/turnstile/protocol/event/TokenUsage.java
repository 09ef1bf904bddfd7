package io.github.drompincen.turnstile.protocol.event;

public record TokenUsage(
        long promptTokens,
        long completionTokens,
        long totalTokens
) {
    public static TokenUsage of(long promptTokens, long completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
