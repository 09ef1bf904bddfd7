package io.github.drompincen.turnstile.runtime.tools;

import io.github.drompincen.turnstile.protocol.event.ToolResultData;

/**
 * Outcome of dispatching one tool call: either a finished result or a call parked until an
 * approval response arrives.
 */
public record ToolExecution(
        Status status,
        String callId,
        ToolResultData result
) {
    public enum Status {
        COMPLETED,
        PENDING
    }

    public static ToolExecution completed(ToolResultData result) {
        return new ToolExecution(Status.COMPLETED, result.callId(), result);
    }

    public static ToolExecution pending(String callId) {
        return new ToolExecution(Status.PENDING, callId, null);
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
