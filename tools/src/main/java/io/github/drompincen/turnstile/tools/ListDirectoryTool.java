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
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class ListDirectoryTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "file_list"; }
    @Override public String description() { return "List files and directories in a path"; }
    @Override public boolean safeInternal() { return true; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Directory to list, defaults to the working directory");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        String dirPath = input.hasNonNull("path") ? input.get("path").asText() : ".";
        try {
            Path resolved = ctx.resolve(dirPath);
            List<String> entries;
            try (Stream<Path> listing = Files.list(resolved)) {
                entries = listing
                        .map(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : ""))
                        .sorted()
                        .collect(Collectors.toList());
            }
            return ToolResult.success(MAPPER.valueToTree(entries));
        } catch (IOException | InvalidPathException e) {
            return ToolResult.failure("Failed to list directory: " + e.getMessage());
        }
    }
}
