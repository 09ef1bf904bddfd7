package io.github.drompincen.turnstile.runtime.tokens;

import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Cumulative token accounting for one thread. Totals only grow.
 */
public class TokenBudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetTracker.class);

    static final double PRUNE_PERCENT = 90.0;
    public static final double BLOCK_PERCENT = 95.0;

    private final TokenBudgetConfig config;
    private long promptTokens;
    private long completionTokens;
    private long totalTokens;

    public TokenBudgetTracker(TokenBudgetConfig config) {
        this.config = config == null ? TokenBudgetConfig.defaults() : config;
    }

    /**
     * Rebuilds the totals from the usage recorded on agent messages. Entries with negative counts
     * are skipped so one bad record cannot lock a thread out of its budget.
     */
    public static TokenBudgetTracker fromEvents(List<Event> events, TokenBudgetConfig config) {
        TokenBudgetTracker tracker = new TokenBudgetTracker(config);
        for (Event event : events) {
            if (event.is(EventType.AGENT_MESSAGE)) {
                TokenUsage usage = event.dataAs(AgentMessageData.class).tokenUsage();
                if (isValid(usage)) {
                    tracker.recordUsage(usage);
                } else {
                    log.warn("Ignoring invalid token usage {} on event {} of thread {}", usage, event.seq(), event.threadId());
                }
            }
        }
        return tracker;
    }

    public static boolean isValid(TokenUsage usage) {
        return usage == null
                || (usage.promptTokens() >= 0 && usage.completionTokens() >= 0 && usage.totalTokens() >= 0);
    }

    public synchronized void recordUsage(TokenUsage usage) {
        if (usage == null) {
            return;
        }
        if (!isValid(usage)) {
            throw new IllegalArgumentException("Token counts must not be negative: " + usage);
        }
        promptTokens += usage.promptTokens();
        completionTokens += usage.completionTokens();
        totalTokens += usage.totalTokens();
    }

    public synchronized ThreadTokenUsage getUsage() {
        double percentUsed = totalTokens * 100.0 / config.contextLimit();
        boolean nearLimit = totalTokens >= config.warningThreshold() * config.contextLimit();
        return new ThreadTokenUsage(promptTokens, completionTokens, totalTokens, config.contextLimit(),
                percentUsed, nearLimit);
    }

    public BudgetRecommendations getRecommendations() {
        ThreadTokenUsage usage = getUsage();
        long available = config.contextLimit() - usage.totalTokens() - config.reserveTokens();
        return new BudgetRecommendations(usage.nearLimit(), usage.percentUsed() >= PRUNE_PERCENT, Math.max(0, available));
    }

    public boolean canMakeRequest(long estimatedTokens) {
        return estimatedTokens <= getRecommendations().maxRequestSize();
    }

    public boolean isExhausted() {
        return getUsage().percentUsed() >= BLOCK_PERCENT;
    }

    public TokenBudgetConfig config() {
        return config;
    }
}
