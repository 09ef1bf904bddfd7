package io.github.drompincen.turnstile.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.PersistenceContext;
import io.github.drompincen.turnstile.runtime.agent.AgentConfig;
import io.github.drompincen.turnstile.runtime.agent.AgentFactory;
import io.github.drompincen.turnstile.runtime.agent.AgentRegistry;
import io.github.drompincen.turnstile.runtime.agent.TaskNotificationRouter;
import io.github.drompincen.turnstile.runtime.backend.Backend;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import io.github.drompincen.turnstile.runtime.tokens.TokenBudgetConfig;
import io.github.drompincen.turnstile.runtime.tools.ToolRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(TurnstileProperties.class)
public class RuntimeConfiguration {

    @Bean(destroyMethod = "reset")
    PersistenceContext persistenceContext(ObjectMapper objectMapper, TurnstileProperties properties) {
        PersistenceContext context = new PersistenceContext(objectMapper);
        context.init(properties.getPersistence().getLocator());
        return context;
    }

    @Bean
    ThreadStore threadStore(PersistenceContext persistenceContext) {
        return new ThreadStore(persistenceContext);
    }

    @Bean
    ToolRegistry toolRegistry() {
        ToolRegistry registry = new ToolRegistry();
        registry.loadServiceTools();
        return registry;
    }

    @Bean(destroyMethod = "stopAll")
    AgentRegistry agentRegistry() {
        return new AgentRegistry();
    }

    @Bean
    TaskNotificationRouter taskNotificationRouter(AgentRegistry agentRegistry) {
        return new TaskNotificationRouter(agentRegistry);
    }

    @Bean
    AgentFactory agentFactory(ThreadStore threadStore, ToolRegistry toolRegistry, Backend backend,
                              TurnstileProperties properties) {
        TurnstileProperties.AgentSettings agent = properties.getAgent();
        TurnstileProperties.TokenBudget budget = properties.getTokenBudget();
        TokenBudgetConfig budgetConfig = new TokenBudgetConfig(
                budget.getContextLimit(), budget.getReserveTokens(), budget.getWarningThreshold());
        return new AgentFactory(threadStore, toolRegistry, backend, threadId -> AgentConfig.builder(threadId)
                .workingDirectory(Path.of(agent.getWorkingDirectory()))
                .systemPrompt(agent.getSystemPrompt())
                .maxIterations(agent.getMaxIterations())
                .streaming(agent.isStreaming())
                .tokenBudget(budgetConfig)
                .toolPolicy(properties.getToolPolicy().toPolicy())
                .maxRetries(properties.getBackend().getMaxRetries())
                .retryInitialDelay(properties.getBackend().getRetryInitialDelay())
                .build());
    }
}
