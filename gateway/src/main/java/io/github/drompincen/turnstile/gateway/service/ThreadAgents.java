package io.github.drompincen.turnstile.gateway.service;

import io.github.drompincen.turnstile.runtime.agent.Agent;
import io.github.drompincen.turnstile.runtime.agent.AgentFactory;
import io.github.drompincen.turnstile.runtime.agent.AgentRegistry;
import io.github.drompincen.turnstile.runtime.agent.TurnOutcome;
import io.github.drompincen.turnstile.runtime.config.TurnstileProperties;
import io.github.drompincen.turnstile.runtime.thread.ThreadNotFoundException;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the live agent for a thread, creating it on first use, and waits on turn outcomes for
 * request/response callers.
 */
@Service
public class ThreadAgents {

    private static final Logger log = LoggerFactory.getLogger(ThreadAgents.class);

    private final ThreadStore threadStore;
    private final AgentRegistry registry;
    private final AgentFactory factory;
    private final Duration responseTimeout;

    @Autowired
    public ThreadAgents(ThreadStore threadStore, AgentRegistry registry, AgentFactory factory,
                        TurnstileProperties properties) {
        this(threadStore, registry, factory, properties.getAgent().getResponseTimeout());
    }

    ThreadAgents(ThreadStore threadStore, AgentRegistry registry, AgentFactory factory, Duration responseTimeout) {
        this.threadStore = threadStore;
        this.registry = registry;
        this.factory = factory;
        this.responseTimeout = responseTimeout;
    }

    public String createThread(String parentThreadId) {
        if (parentThreadId == null || parentThreadId.isBlank()) {
            return threadStore.createThread();
        }
        requireThread(parentThreadId);
        return threadStore.generateDelegateThreadId(parentThreadId);
    }

    public void requireThread(String threadId) {
        if (!threadStore.threadExists(threadId)) {
            throw new ThreadNotFoundException(threadId);
        }
    }

    public Agent agentFor(String threadId) {
        requireThread(threadId);
        return registry.getOrCreate(threadId, id -> {
            log.info("Creating agent for thread {}", id);
            Agent agent = factory.create(id);
            // picks up tool calls left unresolved by a previous process before any new input
            agent.start().whenComplete((outcome, error) -> {
                if (error != null) {
                    log.warn("Recovery of thread {} failed: {}", id, error.getMessage(), error);
                } else {
                    log.debug("Agent for thread {} ready: {}", id, outcome.status());
                }
            });
            return agent;
        });
    }

    public Optional<Agent> activeAgent(String threadId) {
        return registry.get(threadId);
    }

    public boolean stop(String threadId) {
        requireThread(threadId);
        return registry.remove(threadId).isPresent();
    }

    /**
     * Waits up to the configured response timeout. Returns empty when the turn is still running;
     * failures of the turn are rethrown unwrapped.
     */
    public Optional<TurnOutcome> await(CompletableFuture<TurnOutcome> future) {
        try {
            return Optional.of(future.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.debug("Turn still running after {}", responseTimeout);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the turn", e);
        } catch (CancellationException e) {
            throw new IllegalStateException("Turn was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Turn failed", cause);
        }
    }
}
