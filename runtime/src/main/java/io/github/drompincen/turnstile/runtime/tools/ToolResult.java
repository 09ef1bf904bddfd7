package io.github.drompincen.turnstile.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult success(String text) {
        return new ToolResult(true, TextNode.valueOf(text), null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    public String outputText() {
        if (output == null || output.isNull()) {
            return "";
        }
        return output.isTextual() ? output.asText() : output.toString();
    }
}
