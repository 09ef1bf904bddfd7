package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Payload of a thread event. The set of payloads is closed; each one maps to exactly one
 * {@link EventType}.
 */
public sealed interface EventData permits UserMessageData, AgentMessageData, ToolCallData,
        ToolResultData, ToolApprovalRequestData, ToolApprovalResponseData,
        SystemPromptData, LocalSystemMessageData {

    @JsonIgnore
    EventType type();
}
