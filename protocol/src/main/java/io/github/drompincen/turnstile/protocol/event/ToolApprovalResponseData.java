package io.github.drompincen.turnstile.protocol.event;

public record ToolApprovalResponseData(String toolCallId, ApprovalDecision decision) implements EventData {
    @Override
    public EventType type() {
        return EventType.TOOL_APPROVAL_RESPONSE;
    }
}
