package io.github.drompincen.turnstile.runtime.tokens;

import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.TokenUsage;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBudgetTrackerTest {

    @Test
    void totalsAreTheSumOfRecordedUsage() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(TokenBudgetConfig.defaults());
        long previous = 0;
        for (int i = 1; i <= 5; i++) {
            tracker.recordUsage(new TokenUsage(i * 10, i, i * 11));
            long total = tracker.getUsage().totalTokens();
            assertThat(total).isGreaterThanOrEqualTo(previous);
            previous = total;
        }

        ThreadTokenUsage usage = tracker.getUsage();
        assertThat(usage.totalPromptTokens()).isEqualTo(150);
        assertThat(usage.totalCompletionTokens()).isEqualTo(15);
        assertThat(usage.totalTokens()).isEqualTo(165);
        assertThat(usage.contextLimit()).isEqualTo(200_000);
    }

    @Test
    void absentUsageIsIgnored() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(null);
        tracker.recordUsage(null);

        assertThat(tracker.getUsage().totalTokens()).isZero();
    }

    @Test
    void negativeUsageIsRejected() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(TokenBudgetConfig.defaults());

        assertThatThrownBy(() -> tracker.recordUsage(new TokenUsage(-1, 0, -1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nearLimitFollowsWarningThreshold() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(new TokenBudgetConfig(1000, 0, 0.8));
        tracker.recordUsage(TokenUsage.of(700, 99));
        assertThat(tracker.getUsage().nearLimit()).isFalse();

        tracker.recordUsage(TokenUsage.of(1, 0));
        assertThat(tracker.getUsage().percentUsed()).isEqualTo(80.0);
        assertThat(tracker.getUsage().nearLimit()).isTrue();
    }

    @Test
    void recommendationsReflectUsage() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(new TokenBudgetConfig(1000, 50, 0.8));
        tracker.recordUsage(TokenUsage.of(900, 20));

        BudgetRecommendations recommendations = tracker.getRecommendations();

        assertThat(recommendations.shouldSummarize()).isTrue();
        assertThat(recommendations.shouldPrune()).isTrue();
        assertThat(recommendations.maxRequestSize()).isEqualTo(30);
        assertThat(tracker.canMakeRequest(30)).isTrue();
        assertThat(tracker.canMakeRequest(31)).isFalse();
        assertThat(tracker.isExhausted()).isFalse();
    }

    @Test
    void maxRequestSizeNeverGoesNegative() {
        TokenBudgetTracker tracker = new TokenBudgetTracker(new TokenBudgetConfig(100, 50, 0.8));
        tracker.recordUsage(TokenUsage.of(90, 10));

        assertThat(tracker.getRecommendations().maxRequestSize()).isZero();
        assertThat(tracker.isExhausted()).isTrue();
    }

    @Test
    void rebuildsFromAgentMessages() {
        List<Event> events = List.of(
                new Event("e1", "t1", 1, null, Instant.EPOCH, new UserMessageData("hi")),
                new Event("e2", "t1", 2, null, Instant.EPOCH, new AgentMessageData("a", new TokenUsage(100, 50, 150))),
                new Event("e3", "t1", 3, null, Instant.EPOCH, new AgentMessageData("b")),
                new Event("e4", "t1", 4, null, Instant.EPOCH, new AgentMessageData("c", new TokenUsage(10, 5, 15))));

        ThreadTokenUsage usage = TokenBudgetTracker.fromEvents(events, TokenBudgetConfig.defaults()).getUsage();

        assertThat(usage.totalPromptTokens()).isEqualTo(110);
        assertThat(usage.totalCompletionTokens()).isEqualTo(55);
        assertThat(usage.totalTokens()).isEqualTo(165);
    }

    @Test
    void rebuildSkipsNegativeUsage() {
        List<Event> events = List.of(
                new Event("e1", "t1", 1, null, Instant.EPOCH, new AgentMessageData("a", new TokenUsage(10, -1, -1))),
                new Event("e2", "t1", 2, null, Instant.EPOCH, new AgentMessageData("b", new TokenUsage(20, 5, 25))));

        ThreadTokenUsage usage = TokenBudgetTracker.fromEvents(events, TokenBudgetConfig.defaults()).getUsage();

        assertThat(usage.totalTokens()).isEqualTo(25);
        assertThat(usage.totalPromptTokens()).isEqualTo(20);
    }

    @Test
    void invalidConfigIsRejected() {
        assertThatThrownBy(() -> new TokenBudgetConfig(0, 0, 0.8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBudgetConfig(10, -1, 0.8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBudgetConfig(10, 0, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
