package io.github.drompincen.turnstile.runtime.tokens;

public record TokenBudgetConfig(
        long contextLimit,
        long reserveTokens,
        double warningThreshold
) {
    public static final long DEFAULT_CONTEXT_LIMIT = 200_000;
    public static final double DEFAULT_WARNING_THRESHOLD = 0.8;

    public TokenBudgetConfig {
        if (contextLimit <= 0) {
            throw new IllegalArgumentException("contextLimit must be positive");
        }
        if (reserveTokens < 0) {
            throw new IllegalArgumentException("reserveTokens must not be negative");
        }
        if (warningThreshold <= 0 || warningThreshold > 1) {
            throw new IllegalArgumentException("warningThreshold must be in (0, 1]");
        }
    }

    public static TokenBudgetConfig defaults() {
        return new TokenBudgetConfig(DEFAULT_CONTEXT_LIMIT, 0, DEFAULT_WARNING_THRESHOLD);
    }
}
