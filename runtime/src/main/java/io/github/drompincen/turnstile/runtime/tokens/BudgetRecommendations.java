package io.github.drompincen.turnstile.runtime.tokens;

public record BudgetRecommendations(
        boolean shouldSummarize,
        boolean shouldPrune,
        long maxRequestSize
) {}
