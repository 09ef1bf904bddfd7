package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.runtime.backend.Backend;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import io.github.drompincen.turnstile.runtime.tools.ToolRegistry;

import java.util.function.Function;

/**
 * Builds agents that share one thread store, tool registry and backend. Per-thread settings come
 * from a template config.
 */
public class AgentFactory {

    private final ThreadStore threadStore;
    private final ToolRegistry toolRegistry;
    private final Backend backend;
    private final Function<String, AgentConfig> configTemplate;

    public AgentFactory(ThreadStore threadStore, ToolRegistry toolRegistry, Backend backend,
                        Function<String, AgentConfig> configTemplate) {
        this.threadStore = threadStore;
        this.toolRegistry = toolRegistry;
        this.backend = backend;
        this.configTemplate = configTemplate;
    }

    public Agent create(String threadId) {
        return create(configTemplate.apply(threadId));
    }

    public Agent create(AgentConfig config) {
        return new Agent(config, threadStore, backend, toolRegistry);
    }
}
