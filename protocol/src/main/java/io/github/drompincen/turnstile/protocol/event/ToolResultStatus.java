package io.github.drompincen.turnstile.protocol.event;

public enum ToolResultStatus {
    COMPLETED,
    FAILED,
    DENIED,
    ABORTED
}
