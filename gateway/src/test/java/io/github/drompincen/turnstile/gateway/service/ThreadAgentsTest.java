package io.github.drompincen.turnstile.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.PersistenceContext;
import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalRequestData;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import io.github.drompincen.turnstile.runtime.agent.Agent;
import io.github.drompincen.turnstile.runtime.agent.AgentConfig;
import io.github.drompincen.turnstile.runtime.agent.AgentFactory;
import io.github.drompincen.turnstile.runtime.agent.AgentRegistry;
import io.github.drompincen.turnstile.runtime.agent.AgentState;
import io.github.drompincen.turnstile.runtime.agent.TurnOutcome;
import io.github.drompincen.turnstile.runtime.backend.Backend;
import io.github.drompincen.turnstile.runtime.backend.BackendException;
import io.github.drompincen.turnstile.runtime.thread.ThreadNotFoundException;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import io.github.drompincen.turnstile.runtime.tools.Tool;
import io.github.drompincen.turnstile.runtime.tools.ToolContext;
import io.github.drompincen.turnstile.runtime.tools.ToolRegistry;
import io.github.drompincen.turnstile.runtime.tools.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ThreadAgentsTest {

    @Mock private Backend backend;

    private ThreadStore threadStore;
    private AgentRegistry registry;
    private final AtomicInteger shellRuns = new AtomicInteger();
    private ThreadAgents agents;

    @BeforeEach
    void setUp() {
        PersistenceContext persistence = new PersistenceContext(new ObjectMapper());
        persistence.init("memory:");
        threadStore = new ThreadStore(persistence);
        registry = new AgentRegistry();
        ToolRegistry tools = new ToolRegistry();
        tools.register(new Tool() {
            @Override
            public String name() {
                return "shell";
            }

            @Override
            public String description() {
                return "Runs a shell command";
            }

            @Override
            public JsonNode inputSchema() {
                return new ObjectMapper().createObjectNode().put("type", "object");
            }

            @Override
            public ToolResult execute(ToolContext ctx, JsonNode input) {
                shellRuns.incrementAndGet();
                return ToolResult.success("ok");
            }
        });
        AgentFactory factory = new AgentFactory(threadStore, tools, backend,
                id -> AgentConfig.builder(id).build());
        agents = new ThreadAgents(threadStore, registry, factory, Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        registry.stopAll();
    }

    @Test
    void unknownThreadIsNotFound() {
        assertThatThrownBy(() -> agents.agentFor("missing")).isInstanceOf(ThreadNotFoundException.class);
    }

    @Test
    void agentIsCreatedOnceAndReused() {
        String threadId = agents.createThread(null);

        Agent first = agents.agentFor(threadId);

        assertThat(agents.agentFor(threadId)).isSameAs(first);
        assertThat(agents.activeAgent(threadId)).containsSame(first);
    }

    @Test
    void delegateThreadsAreNumberedUnderParent() {
        String parent = agents.createThread(null);

        assertThat(agents.createThread(parent)).isEqualTo(parent + ".1");
        assertThat(agents.createThread(parent)).isEqualTo(parent + ".2");
    }

    @Test
    void delegateOfUnknownParentIsNotFound() {
        assertThatThrownBy(() -> agents.createThread("ghost")).isInstanceOf(ThreadNotFoundException.class);
    }

    @Test
    void stopRemovesAndStopsAgent() {
        String threadId = agents.createThread(null);
        Agent agent = agents.agentFor(threadId);

        assertThat(agents.stop(threadId)).isTrue();

        assertThat(agent.getState()).isEqualTo(AgentState.STOPPED);
        assertThat(agents.activeAgent(threadId)).isEmpty();
    }

    @Test
    void agentOverLogWithUnansweredApprovalQueuesNewInput() throws Exception {
        String threadId = agents.createThread(null);
        JsonNode input = new ObjectMapper().createObjectNode().put("command", "ls");
        threadStore.appendEvent(threadId, new UserMessageData("go"));
        threadStore.appendEvent(threadId, new AgentMessageData("using shell"));
        threadStore.appendEvent(threadId, new ToolCallData("c1", "shell", input));
        threadStore.appendEvent(threadId, new ToolApprovalRequestData("c1"));

        Agent agent = agents.agentFor(threadId);
        CompletableFuture<TurnOutcome> next = agent.sendMessage("next");

        long deadline = System.currentTimeMillis() + 2000;
        while (agent.getState() != AgentState.WAITING_APPROVAL && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(agent.getState()).isEqualTo(AgentState.WAITING_APPROVAL);
        assertThat(agents.await(next)).isEmpty();
        assertThat(agent.getQueueStats().queueLength()).isEqualTo(1);
        assertThat(shellRuns).hasValue(0);
        verifyNoInteractions(backend);
    }

    @Test
    void awaitReturnsEmptyWhileTurnRuns() {
        assertThat(agents.await(new CompletableFuture<>())).isEmpty();
    }

    @Test
    void awaitReturnsCompletedOutcome() {
        assertThat(agents.await(CompletableFuture.completedFuture(TurnOutcome.idle())))
                .contains(TurnOutcome.idle());
    }

    @Test
    void awaitRethrowsTurnFailureUnwrapped() {
        CompletableFuture<TurnOutcome> failed = CompletableFuture.failedFuture(new BackendException("rejected", false));

        assertThatThrownBy(() -> agents.await(failed))
                .isInstanceOf(BackendException.class)
                .hasMessage("rejected");
    }
}
