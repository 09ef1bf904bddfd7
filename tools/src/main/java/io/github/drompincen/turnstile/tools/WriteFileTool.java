package io.github.drompincen.turnstile.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.turnstile.runtime.tools.Tool;
import io.github.drompincen.turnstile.runtime.tools.ToolContext;
import io.github.drompincen.turnstile.runtime.tools.ToolResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/** Creates or overwrites a file. Not safe-internal, so the policy decides whether it needs approval. */
public class WriteFileTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "file_write"; }
    @Override public String description() { return "Write content to a file (creates or overwrites)"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "File path to write");
        props.putObject("content").put("type", "string").put("description", "Content to write");
        schema.putArray("required").add("path").add("content");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (!input.hasNonNull("path") || !input.hasNonNull("content")) {
            return ToolResult.failure("Missing required arguments 'path' and 'content'");
        }
        String filePath = input.get("path").asText();
        String content = input.get("content").asText();
        try {
            Path resolved = ctx.resolve(filePath);
            if (resolved.getParent() != null) {
                Files.createDirectories(resolved.getParent());
            }
            Files.writeString(resolved, content);
            return ToolResult.success("Written " + content.length() + " chars to " + filePath);
        } catch (IOException | InvalidPathException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }
}
