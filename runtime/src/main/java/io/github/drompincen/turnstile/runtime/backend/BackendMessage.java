package io.github.drompincen.turnstile.runtime.backend;

import io.github.drompincen.turnstile.protocol.event.ToolResultData;

import java.util.List;

public record BackendMessage(
        Role role,
        String content,
        List<BackendToolCall> toolCalls,
        List<ToolResultData> toolResults
) {
    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public BackendMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static BackendMessage system(String content) {
        return new BackendMessage(Role.SYSTEM, content, null, null);
    }

    public static BackendMessage user(String content) {
        return new BackendMessage(Role.USER, content, null, null);
    }

    public static BackendMessage assistant(String content, List<BackendToolCall> toolCalls) {
        return new BackendMessage(Role.ASSISTANT, content, toolCalls, null);
    }

    public static BackendMessage toolResults(List<ToolResultData> results) {
        return new BackendMessage(Role.USER, "", null, results);
    }
}
