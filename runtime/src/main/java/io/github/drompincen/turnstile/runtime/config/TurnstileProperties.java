package io.github.drompincen.turnstile.runtime.config;

import io.github.drompincen.turnstile.protocol.api.ToolPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code turnstile.*} in application.yml.
 */
@ConfigurationProperties(prefix = "turnstile")
public class TurnstileProperties {

    private Persistence persistence = new Persistence();
    private AgentSettings agent = new AgentSettings();
    private TokenBudget tokenBudget = new TokenBudget();
    private ToolPolicySettings toolPolicy = new ToolPolicySettings();
    private BackendSettings backend = new BackendSettings();

    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public AgentSettings getAgent() { return agent; }
    public void setAgent(AgentSettings agent) { this.agent = agent; }

    public TokenBudget getTokenBudget() { return tokenBudget; }
    public void setTokenBudget(TokenBudget tokenBudget) { this.tokenBudget = tokenBudget; }

    public ToolPolicySettings getToolPolicy() { return toolPolicy; }
    public void setToolPolicy(ToolPolicySettings toolPolicy) { this.toolPolicy = toolPolicy; }

    public BackendSettings getBackend() { return backend; }
    public void setBackend(BackendSettings backend) { this.backend = backend; }

    public static class Persistence {
        private String locator = "memory:";

        public String getLocator() { return locator; }
        public void setLocator(String locator) { this.locator = locator; }
    }

    public static class AgentSettings {
        private String workingDirectory = ".";
        private String systemPrompt;
        private int maxIterations = 50;
        private boolean streaming = true;
        private Duration responseTimeout = Duration.ofSeconds(60);

        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

        public boolean isStreaming() { return streaming; }
        public void setStreaming(boolean streaming) { this.streaming = streaming; }

        public Duration getResponseTimeout() { return responseTimeout; }
        public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }
    }

    public static class TokenBudget {
        private long contextLimit = 200_000;
        private long reserveTokens = 0;
        private double warningThreshold = 0.8;

        public long getContextLimit() { return contextLimit; }
        public void setContextLimit(long contextLimit) { this.contextLimit = contextLimit; }

        public long getReserveTokens() { return reserveTokens; }
        public void setReserveTokens(long reserveTokens) { this.reserveTokens = reserveTokens; }

        public double getWarningThreshold() { return warningThreshold; }
        public void setWarningThreshold(double warningThreshold) { this.warningThreshold = warningThreshold; }
    }

    public static class ToolPolicySettings {
        private List<String> allow = new ArrayList<>(List.of("*"));
        private List<String> deny = new ArrayList<>();
        private Map<String, ToolPolicy.ApprovalMode> overrides = new HashMap<>();
        private ToolPolicy.ApprovalMode defaultMode = ToolPolicy.ApprovalMode.REQUIRE_APPROVAL;

        public List<String> getAllow() { return allow; }
        public void setAllow(List<String> allow) { this.allow = allow; }

        public List<String> getDeny() { return deny; }
        public void setDeny(List<String> deny) { this.deny = deny; }

        public Map<String, ToolPolicy.ApprovalMode> getOverrides() { return overrides; }
        public void setOverrides(Map<String, ToolPolicy.ApprovalMode> overrides) { this.overrides = overrides; }

        public ToolPolicy.ApprovalMode getDefaultMode() { return defaultMode; }
        public void setDefaultMode(ToolPolicy.ApprovalMode defaultMode) { this.defaultMode = defaultMode; }

        public ToolPolicy toPolicy() {
            return new ToolPolicy(allow, deny, overrides, defaultMode);
        }
    }

    public static class BackendSettings {
        private String provider = "echo";
        private int maxRetries = 3;
        private Duration retryInitialDelay = Duration.ofSeconds(1);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getRetryInitialDelay() { return retryInitialDelay; }
        public void setRetryInitialDelay(Duration retryInitialDelay) { this.retryInitialDelay = retryInitialDelay; }
    }
}
