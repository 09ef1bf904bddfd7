package io.github.drompincen.turnstile.runtime.approval;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;

/**
 * Decides whether a tool call may run. Implementations never block waiting for a person: they
 * answer with a recorded decision or with {@link ApprovalOutcome#pending()}.
 */
public interface ApprovalGate {

    ApprovalOutcome requestApproval(ToolCallData call);

    /** Looks up the most recent matching tool call and asks for approval of it. */
    ApprovalOutcome requestApproval(String toolName, JsonNode input);
}
