package io.github.drompincen.turnstile.protocol.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.stream.Collectors;

public record ToolResultData(
        String callId,
        List<ContentBlock> content,
        ToolResultStatus status
) implements EventData {

    public ToolResultData {
        content = content == null ? List.of() : List.copyOf(content);
        if (status == null) {
            status = ToolResultStatus.COMPLETED;
        }
    }

    public static ToolResultData completed(String callId, String text) {
        return new ToolResultData(callId, List.of(ContentBlock.text(text)), ToolResultStatus.COMPLETED);
    }

    public static ToolResultData failed(String callId, String error) {
        return new ToolResultData(callId, List.of(ContentBlock.text(error)), ToolResultStatus.FAILED);
    }

    public static ToolResultData denied(String callId, String reason) {
        return new ToolResultData(callId, List.of(ContentBlock.text(reason)), ToolResultStatus.DENIED);
    }

    public static ToolResultData aborted(String callId) {
        return new ToolResultData(callId, List.of(ContentBlock.text("Tool execution aborted")), ToolResultStatus.ABORTED);
    }

    @JsonIgnore
    public boolean isError() {
        return status != ToolResultStatus.COMPLETED;
    }

    @JsonIgnore
    public String text() {
        return content.stream()
                .map(ContentBlock::text)
                .filter(t -> t != null)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public EventType type() {
        return EventType.TOOL_RESULT;
    }
}
