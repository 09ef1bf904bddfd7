package io.github.drompincen.turnstile.runtime.tokens;

public record ThreadTokenUsage(
        long totalPromptTokens,
        long totalCompletionTokens,
        long totalTokens,
        long contextLimit,
        double percentUsed,
        boolean nearLimit
) {}
