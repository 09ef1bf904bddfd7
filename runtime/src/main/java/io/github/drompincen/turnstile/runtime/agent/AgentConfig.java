package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.protocol.api.ToolPolicy;
import io.github.drompincen.turnstile.runtime.tokens.TokenBudgetConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public final class AgentConfig {

    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final String threadId;
    private final Path workingDirectory;
    private final String systemPrompt;
    private final int maxIterations;
    private final boolean streaming;
    private final TokenBudgetConfig tokenBudget;
    private final ToolPolicy toolPolicy;
    private final Map<String, String> environment;
    private final int maxRetries;
    private final Duration retryInitialDelay;

    private AgentConfig(Builder builder) {
        this.threadId = Objects.requireNonNull(builder.threadId, "threadId");
        this.workingDirectory = (builder.workingDirectory != null ? builder.workingDirectory : Path.of(""))
                .toAbsolutePath().normalize();
        this.systemPrompt = builder.systemPrompt;
        this.maxIterations = builder.maxIterations;
        this.streaming = builder.streaming;
        this.tokenBudget = builder.tokenBudget != null ? builder.tokenBudget : TokenBudgetConfig.defaults();
        this.toolPolicy = builder.toolPolicy != null ? builder.toolPolicy : ToolPolicy.requireApproval();
        this.environment = builder.environment != null ? Map.copyOf(builder.environment) : Map.of();
        this.maxRetries = builder.maxRetries;
        this.retryInitialDelay = builder.retryInitialDelay;
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
    }

    public static Builder builder(String threadId) {
        return new Builder(threadId);
    }

    public String threadId() { return threadId; }
    public Path workingDirectory() { return workingDirectory; }
    public String systemPrompt() { return systemPrompt; }
    public int maxIterations() { return maxIterations; }
    public boolean streaming() { return streaming; }
    public TokenBudgetConfig tokenBudget() { return tokenBudget; }
    public ToolPolicy toolPolicy() { return toolPolicy; }
    public Map<String, String> environment() { return environment; }
    public int maxRetries() { return maxRetries; }
    public Duration retryInitialDelay() { return retryInitialDelay; }

    public static final class Builder {
        private final String threadId;
        private Path workingDirectory;
        private String systemPrompt;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private boolean streaming;
        private TokenBudgetConfig tokenBudget;
        private ToolPolicy toolPolicy;
        private Map<String, String> environment;
        private int maxRetries = 0;
        private Duration retryInitialDelay = Duration.ofSeconds(1);

        private Builder(String threadId) {
            this.threadId = threadId;
        }

        public Builder workingDirectory(Path workingDirectory) { this.workingDirectory = workingDirectory; return this; }
        public Builder systemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; return this; }
        public Builder maxIterations(int maxIterations) { this.maxIterations = maxIterations; return this; }
        public Builder streaming(boolean streaming) { this.streaming = streaming; return this; }
        public Builder tokenBudget(TokenBudgetConfig tokenBudget) { this.tokenBudget = tokenBudget; return this; }
        public Builder toolPolicy(ToolPolicy toolPolicy) { this.toolPolicy = toolPolicy; return this; }
        public Builder environment(Map<String, String> environment) { this.environment = environment; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryInitialDelay(Duration retryInitialDelay) { this.retryInitialDelay = retryInitialDelay; return this; }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
