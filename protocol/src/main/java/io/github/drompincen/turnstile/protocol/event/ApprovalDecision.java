package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalDecision {
    ALLOW_ONCE("allow_once"),
    ALLOW_SESSION("allow_session"),
    DENY("deny");

    private final String value;

    ApprovalDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isAllowed() {
        return this != DENY;
    }

    @JsonCreator
    public static ApprovalDecision fromValue(String value) {
        for (ApprovalDecision decision : values()) {
            if (decision.value.equalsIgnoreCase(value) || decision.name().equalsIgnoreCase(value)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown approval decision: " + value);
    }
}
