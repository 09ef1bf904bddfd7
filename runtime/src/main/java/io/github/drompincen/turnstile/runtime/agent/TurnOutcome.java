package io.github.drompincen.turnstile.runtime.agent;

import java.util.List;

public record TurnOutcome(
        Status status,
        List<String> pendingCallIds,
        String queuedMessageId
) {
    public enum Status {
        COMPLETED,
        AWAITING_APPROVAL,
        QUEUED,
        BUDGET_EXHAUSTED,
        IDLE
    }

    public TurnOutcome {
        pendingCallIds = pendingCallIds == null ? List.of() : List.copyOf(pendingCallIds);
    }

    public static TurnOutcome completed() {
        return new TurnOutcome(Status.COMPLETED, List.of(), null);
    }

    public static TurnOutcome idle() {
        return new TurnOutcome(Status.IDLE, List.of(), null);
    }

    public static TurnOutcome awaitingApproval(List<String> pendingCallIds) {
        return new TurnOutcome(Status.AWAITING_APPROVAL, pendingCallIds, null);
    }

    public static TurnOutcome queued(String messageId) {
        return new TurnOutcome(Status.QUEUED, List.of(), messageId);
    }

    public static TurnOutcome budgetExhausted() {
        return new TurnOutcome(Status.BUDGET_EXHAUSTED, List.of(), null);
    }
}
