package io.github.drompincen.turnstile.runtime.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    private final ConcurrentHashMap<String, Agent> agents = new ConcurrentHashMap<>();

    public void register(Agent agent) {
        Agent previous = agents.putIfAbsent(agent.getThreadId(), agent);
        if (previous != null && previous != agent) {
            throw new IllegalStateException("Agent already registered for thread " + agent.getThreadId());
        }
    }

    public Agent getOrCreate(String threadId, Function<String, Agent> factory) {
        return agents.computeIfAbsent(threadId, factory);
    }

    public Optional<Agent> get(String threadId) {
        return Optional.ofNullable(agents.get(threadId));
    }

    public Optional<Agent> remove(String threadId) {
        Agent agent = agents.remove(threadId);
        if (agent != null) {
            agent.stop();
        }
        return Optional.ofNullable(agent);
    }

    public Collection<Agent> all() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public void stopAll() {
        agents.values().forEach(Agent::stop);
        log.info("Stopped {} agents", agents.size());
        agents.clear();
    }
}
