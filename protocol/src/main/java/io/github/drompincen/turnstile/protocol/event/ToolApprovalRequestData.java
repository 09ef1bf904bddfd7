package io.github.drompincen.turnstile.protocol.event;

public record ToolApprovalRequestData(String toolCallId) implements EventData {
    @Override
    public EventType type() {
        return EventType.TOOL_APPROVAL_REQUEST;
    }
}
