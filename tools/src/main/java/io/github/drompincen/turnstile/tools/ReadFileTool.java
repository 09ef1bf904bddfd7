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

public class ReadFileTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "file_read"; }
    @Override public String description() { return "Read the contents of a text file"; }
    @Override public boolean safeInternal() { return true; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "File path, relative to the working directory");
        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (!input.hasNonNull("path")) {
            return ToolResult.failure("Missing required argument 'path'");
        }
        String filePath = input.get("path").asText();
        try {
            Path resolved = ctx.resolve(filePath);
            if (Files.isDirectory(resolved)) {
                return ToolResult.failure("Failed to read file: " + filePath + " is a directory");
            }
            return ToolResult.success(Files.readString(resolved));
        } catch (IOException | InvalidPathException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }
}
