package io.github.drompincen.turnstile.protocol.event;

public enum EventType {
    USER_MESSAGE(UserMessageData.class),
    AGENT_MESSAGE(AgentMessageData.class),
    TOOL_CALL(ToolCallData.class),
    TOOL_RESULT(ToolResultData.class),
    TOOL_APPROVAL_REQUEST(ToolApprovalRequestData.class),
    TOOL_APPROVAL_RESPONSE(ToolApprovalResponseData.class),
    SYSTEM_PROMPT(SystemPromptData.class),
    LOCAL_SYSTEM_MESSAGE(LocalSystemMessageData.class);

    private final Class<? extends EventData> dataClass;

    EventType(Class<? extends EventData> dataClass) {
        this.dataClass = dataClass;
    }

    /** Payload record stored under this type; used when reading events back from storage. */
    public Class<? extends EventData> dataClass() {
        return dataClass;
    }
}
