package io.github.drompincen.turnstile.gateway.controller;

import io.github.drompincen.turnstile.gateway.service.ThreadAgents;
import io.github.drompincen.turnstile.protocol.api.CreateThreadRequest;
import io.github.drompincen.turnstile.protocol.api.QueueMessageRequest;
import io.github.drompincen.turnstile.protocol.api.SendMessageRequest;
import io.github.drompincen.turnstile.protocol.api.ThreadDto;
import io.github.drompincen.turnstile.protocol.api.TurnOutcomeDto;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.runtime.agent.Agent;
import io.github.drompincen.turnstile.runtime.agent.AgentState;
import io.github.drompincen.turnstile.runtime.agent.TurnOutcome;
import io.github.drompincen.turnstile.runtime.queue.QueueStats;
import io.github.drompincen.turnstile.runtime.queue.QueuedMessage;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import io.github.drompincen.turnstile.runtime.tokens.BudgetRecommendations;
import io.github.drompincen.turnstile.runtime.tokens.ThreadTokenUsage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/threads")
public class ThreadController {

    static final String RUNNING = "RUNNING";

    private final ThreadStore threadStore;
    private final ThreadAgents agents;

    public ThreadController(ThreadStore threadStore, ThreadAgents agents) {
        this.threadStore = threadStore;
        this.agents = agents;
    }

    @PostMapping
    public ResponseEntity<ThreadDto> create(@RequestBody(required = false) CreateThreadRequest req) {
        String threadId = agents.createThread(req != null ? req.parentThreadId() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(threadId));
    }

    @GetMapping
    public List<ThreadDto> list() {
        return threadStore.threadIds().stream().map(this::toDto).toList();
    }

    @GetMapping("/{id}")
    public ThreadDto get(@PathVariable String id) {
        agents.requireThread(id);
        return toDto(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        agents.stop(id);
        threadStore.purgeThread(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/events")
    public List<Event> events(@PathVariable String id) {
        agents.requireThread(id);
        return threadStore.getEvents(id);
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<TurnOutcomeDto> sendMessage(@PathVariable String id, @RequestBody SendMessageRequest req) {
        if (req == null || req.content() == null || req.content().isBlank()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        Agent agent = agents.agentFor(id);
        if (agent.getState() != AgentState.IDLE || !agent.getQueueContents().isEmpty()) {
            String messageId = agent.queueMessage(req.content(), QueuedMessage.Kind.USER,
                    QueuedMessage.Metadata.normal("user"));
            return ResponseEntity.accepted().body(toDto(id, TurnOutcome.queued(messageId)));
        }
        return respond(id, agent.sendMessage(req.content()));
    }

    @PostMapping("/{id}/queue")
    public ResponseEntity<TurnOutcomeDto> queue(@PathVariable String id, @RequestBody QueueMessageRequest req) {
        if (req == null || req.content() == null || req.content().isBlank()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        QueuedMessage.Kind kind = req.kind() == null ? QueuedMessage.Kind.USER
                : QueuedMessage.Kind.valueOf(req.kind().toUpperCase(Locale.ROOT));
        QueuedMessage.Priority priority = req.priority() == null ? QueuedMessage.Priority.NORMAL
                : QueuedMessage.Priority.valueOf(req.priority().toUpperCase(Locale.ROOT));
        if (kind == QueuedMessage.Kind.TASK_NOTIFICATION && (req.taskId() == null || req.taskId().isBlank())) {
            throw new IllegalArgumentException("A task_notification message needs a taskId");
        }
        String source = req.source() != null ? req.source() : "api";
        QueuedMessage.Metadata metadata = new QueuedMessage.Metadata(req.taskId(), req.fromAgent(), priority, source);
        String messageId = agents.agentFor(id).queueMessage(req.content(), kind, metadata);
        return ResponseEntity.accepted().body(toDto(id, TurnOutcome.queued(messageId)));
    }

    @GetMapping("/{id}/queue")
    public QueueStats queueStats(@PathVariable String id) {
        return agents.agentFor(id).getQueueStats();
    }

    @GetMapping("/{id}/queue/messages")
    public List<QueuedMessage> queueContents(@PathVariable String id) {
        return agents.agentFor(id).getQueueContents();
    }

    @DeleteMapping("/{id}/queue")
    public Map<String, Integer> clearQueue(@PathVariable String id) {
        return Map.of("cleared", agents.agentFor(id).clearQueue());
    }

    @GetMapping("/{id}/usage")
    public ThreadTokenUsage usage(@PathVariable String id) {
        return agents.agentFor(id).getTokenUsage();
    }

    @GetMapping("/{id}/usage/recommendations")
    public BudgetRecommendations recommendations(@PathVariable String id) {
        return agents.agentFor(id).getTokenRecommendations();
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<TurnOutcomeDto> start(@PathVariable String id) {
        return respond(id, agents.agentFor(id).start());
    }

    @PostMapping("/{id}/abort")
    public Map<String, Boolean> abort(@PathVariable String id) {
        agents.requireThread(id);
        boolean aborted = agents.activeAgent(id).map(Agent::abort).orElse(false);
        return Map.of("aborted", aborted);
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<Void> stop(@PathVariable String id) {
        agents.stop(id);
        return ResponseEntity.accepted().build();
    }

    ResponseEntity<TurnOutcomeDto> respond(String threadId, CompletableFuture<TurnOutcome> future) {
        Optional<TurnOutcome> outcome = agents.await(future);
        if (outcome.isEmpty()) {
            return ResponseEntity.accepted().body(new TurnOutcomeDto(threadId, RUNNING, List.of(), null));
        }
        return ResponseEntity.ok(toDto(threadId, outcome.get()));
    }

    static TurnOutcomeDto toDto(String threadId, TurnOutcome outcome) {
        return new TurnOutcomeDto(threadId, outcome.status().name(), outcome.pendingCallIds(), outcome.queuedMessageId());
    }

    private ThreadDto toDto(String threadId) {
        String state = agents.activeAgent(threadId).map(a -> a.getState().name()).orElse(AgentState.IDLE.name());
        return new ThreadDto(threadId, state, threadStore.getEvents(threadId).size());
    }
}
