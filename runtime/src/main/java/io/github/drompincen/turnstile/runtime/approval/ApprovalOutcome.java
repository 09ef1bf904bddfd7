package io.github.drompincen.turnstile.runtime.approval;

import io.github.drompincen.turnstile.protocol.event.ApprovalDecision;

/**
 * Either a recorded decision or pending. Pending means a request event exists and no response
 * has been recorded yet.
 */
public record ApprovalOutcome(ApprovalDecision decision) {

    private static final ApprovalOutcome PENDING = new ApprovalOutcome(null);

    public static ApprovalOutcome pending() {
        return PENDING;
    }

    public static ApprovalOutcome decided(ApprovalDecision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        return new ApprovalOutcome(decision);
    }

    public boolean isPending() {
        return decision == null;
    }

    public boolean isAllowed() {
        return decision != null && decision.isAllowed();
    }
}
