package io.github.drompincen.turnstile.tools;

import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import io.github.drompincen.turnstile.runtime.tools.ToolRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceToolsTest {

    @Test
    void serviceLoaderFindsBuiltInTools() {
        ToolRegistry registry = new ToolRegistry();
        registry.loadServiceTools();

        assertThat(registry.descriptors()).extracting(ToolDescriptor::name)
                .containsExactly("file_list", "file_read", "file_write");
        assertThat(registry.get("file_read")).isPresent();
    }
}
