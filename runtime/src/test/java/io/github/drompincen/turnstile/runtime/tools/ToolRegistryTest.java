package io.github.drompincen.turnstile.runtime.tools;

import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(StubTool.returning("test_tool", "ok"));

        assertThat(registry.get("test_tool")).isPresent();
        assertThat(registry.get("test_tool").get().name()).isEqualTo("test_tool");
        assertThat(registry.get("nonexistent")).isEmpty();
    }

    @Test
    void allReturnsRegisteredTools() {
        assertThat(registry.all()).isEmpty();

        registry.register(StubTool.returning("tool1", "ok"));

        assertThat(registry.all()).hasSize(1);
    }

    @Test
    void descriptorsAreSortedAndCarrySafeFlag() {
        registry.register(new StubTool("zeta", true, (ctx, input) -> ToolResult.success("z")));
        registry.register(StubTool.returning("alpha", "a"));

        List<ToolDescriptor> descriptors = registry.descriptors();

        assertThat(descriptors).extracting(ToolDescriptor::name).containsExactly("alpha", "zeta");
        assertThat(descriptors.get(1).safeInternal()).isTrue();
        assertThat(descriptors.get(0).inputSchema().get("type").asText()).isEqualTo("object");
    }

    @Test
    void registeringSameNameReplacesTool() {
        registry.register(StubTool.returning("dup", "first"));
        StubTool second = StubTool.returning("dup", "second");
        registry.register(second);

        assertThat(registry.get("dup")).containsSame(second);
        assertThat(registry.all()).hasSize(1);
    }
}
