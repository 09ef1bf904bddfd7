package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.ApprovalDecision;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventData;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.LocalSystemMessageData;
import io.github.drompincen.turnstile.protocol.event.SystemPromptData;
import io.github.drompincen.turnstile.protocol.event.TokenUsage;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalResponseData;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import io.github.drompincen.turnstile.protocol.event.ToolResultStatus;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import io.github.drompincen.turnstile.runtime.approval.EventApprovalGate;
import io.github.drompincen.turnstile.runtime.backend.Backend;
import io.github.drompincen.turnstile.runtime.backend.BackendException;
import io.github.drompincen.turnstile.runtime.backend.BackendMessage;
import io.github.drompincen.turnstile.runtime.backend.BackendResponse;
import io.github.drompincen.turnstile.runtime.backend.BackendToolCall;
import io.github.drompincen.turnstile.runtime.backend.RetryListener;
import io.github.drompincen.turnstile.runtime.backend.RetryingBackend;
import io.github.drompincen.turnstile.runtime.cancel.CancellationSignal;
import io.github.drompincen.turnstile.runtime.cancel.TurnCancelledException;
import io.github.drompincen.turnstile.runtime.queue.MessageQueue;
import io.github.drompincen.turnstile.runtime.queue.QueueStats;
import io.github.drompincen.turnstile.runtime.queue.QueuedMessage;
import io.github.drompincen.turnstile.runtime.thread.ConversationBuilder;
import io.github.drompincen.turnstile.runtime.thread.PendingApproval;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import io.github.drompincen.turnstile.runtime.tokens.BudgetRecommendations;
import io.github.drompincen.turnstile.runtime.tokens.ThreadTokenUsage;
import io.github.drompincen.turnstile.runtime.tokens.TokenBudgetTracker;
import io.github.drompincen.turnstile.runtime.tools.ToolContext;
import io.github.drompincen.turnstile.runtime.tools.ToolExecution;
import io.github.drompincen.turnstile.runtime.tools.ToolExecutor;
import io.github.drompincen.turnstile.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Drives one thread: alternates backend calls and tool dispatch until the model stops asking for
 * tools, a call needs approval, or the budget runs out.
 *
 * <p>All turn work runs on a single daemon thread owned by the agent, so at most one turn is in
 * flight. Input that arrives while a turn is active or an approval is outstanding goes through the
 * {@link MessageQueue} and is processed once the agent is idle again. Every state change worth
 * keeping is written to the {@link ThreadStore} first; after a restart {@link #start()} picks up
 * tool calls that never got a result.
 */
public class Agent {

    private static final Logger log = LoggerFactory.getLogger(Agent.class);
    static final String FILE_READ_TOOL = "file_read";

    private final AgentConfig config;
    private final String threadId;
    private final ThreadStore threadStore;
    private final Backend backend;
    private final ToolExecutor toolExecutor;
    private final MessageQueue queue;
    private final ConversationBuilder conversationBuilder = new ConversationBuilder();
    private final List<AgentListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<CompletableFuture<TurnOutcome>> outstanding = ConcurrentHashMap.newKeySet();
    private final Map<String, CompletableFuture<TurnOutcome>> queuedFutures = new ConcurrentHashMap<>();
    private final ExecutorService turnExecutor;
    private final Object lock = new Object();

    private volatile AgentState state = AgentState.IDLE;
    private volatile CancellationSignal currentSignal;
    private volatile TokenBudgetTracker tokenTracker;
    private boolean initialized;
    private boolean recoveryChecked;
    private int scheduled;

    public Agent(AgentConfig config, ThreadStore threadStore, Backend backend, ToolRegistry toolRegistry) {
        this(config, threadStore, backend, toolRegistry, new MessageQueue());
    }

    public Agent(AgentConfig config, ThreadStore threadStore, Backend backend, ToolRegistry toolRegistry,
                 MessageQueue queue) {
        this.config = config;
        this.threadId = config.threadId();
        this.threadStore = threadStore;
        this.backend = config.maxRetries() > 0
                ? new RetryingBackend(backend, config.maxRetries() + 1, config.retryInitialDelay(), new RetryBridge())
                : backend;
        this.toolExecutor = new ToolExecutor(toolRegistry, config.toolPolicy(),
                new EventApprovalGate(threadStore, threadId, this::announce));
        this.queue = queue;
        this.turnExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agent-" + threadId);
            t.setDaemon(true);
            return t;
        });
    }

    // --- lifecycle ---

    /**
     * Prepares the thread and resumes unfinished work from the log: tool calls of the latest batch
     * that have no result are dispatched again. Approved calls run, unanswered ones stay pending.
     */
    public CompletableFuture<TurnOutcome> start() {
        synchronized (lock) {
            recoveryChecked = true;
        }
        return schedule(this::resume);
    }

    private TurnOutcome resume() {
        ensureInitialized();
        Optional<TurnOutcome> resumed = resumeLatestBatch();
        if (resumed.isPresent()) {
            return resumed.get();
        }
        setState(AgentState.IDLE);
        return TurnOutcome.idle();
    }

    /**
     * An agent built over an existing log must not start a fresh turn while the latest tool batch
     * is unresolved. The first input triggers the same recovery as {@link #start()}, ahead of it.
     */
    private void recoverOnFirstUse() {
        synchronized (lock) {
            if (recoveryChecked || state == AgentState.STOPPED) {
                return;
            }
            boolean unresolved = unresolvedLatestBatch(threadStore.getEvents(threadId)).isPresent();
            recoveryChecked = true;
            if (!unresolved) {
                return;
            }
            scheduled++;
        }
        log.info("Thread {} has unresolved tool calls, resuming them before new input", threadId);
        submit(this::resume, new CompletableFuture<>());
    }

    /** Cancels in-flight work and rejects further input. Appended events are kept. */
    public void stop() {
        AgentState previous;
        synchronized (lock) {
            previous = state;
            if (previous == AgentState.STOPPED) {
                return;
            }
            state = AgentState.STOPPED;
        }
        fire(l -> l.onStateChange(previous, AgentState.STOPPED));
        CancellationSignal signal = currentSignal;
        if (signal != null) {
            signal.cancel();
        }
        turnExecutor.shutdownNow();

        TurnCancelledException cancelled = new TurnCancelledException("Agent " + threadId + " stopped");
        for (CompletableFuture<TurnOutcome> future : outstanding) {
            future.completeExceptionally(cancelled);
        }
        for (CompletableFuture<TurnOutcome> future : queuedFutures.values()) {
            future.completeExceptionally(cancelled);
        }
        queuedFutures.clear();
        int dropped = queue.clear();
        log.info("Agent {} stopped ({} queued messages dropped)", threadId, dropped);
    }

    /** Cancels the current backend call or tool batch. The agent stays usable. */
    public boolean abort() {
        CancellationSignal signal = currentSignal;
        if (signal == null) {
            return false;
        }
        log.info("Aborting current turn in thread {}", threadId);
        signal.cancel();
        return true;
    }

    // --- input ---

    /**
     * Sends a user message. When the agent is idle the message is appended and a turn starts;
     * otherwise it is queued and the returned future completes when its turn finishes.
     */
    public CompletableFuture<TurnOutcome> sendMessage(String content) {
        CompletableFuture<TurnOutcome> result = new CompletableFuture<>();
        try {
            recoverOnFirstUse();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return result;
        }
        QueuedMessage queued = null;
        synchronized (lock) {
            if (state == AgentState.STOPPED) {
                result.completeExceptionally(new IllegalStateException("Agent " + threadId + " is stopped"));
                return result;
            }
            if (scheduled > 0 || state != AgentState.IDLE || !queue.isEmpty()) {
                queued = queue.newMessage(QueuedMessage.Kind.USER, content, QueuedMessage.Metadata.normal("user"));
                queue.enqueue(queued);
                queuedFutures.put(queued.id(), result);
            } else {
                scheduled++;
            }
        }
        if (queued != null) {
            QueuedMessage message = queued;
            log.debug("Agent {} busy ({}), queued message {}", threadId, state, message.id());
            fire(l -> l.onMessageQueued(message));
            drainNext();
            return result;
        }
        submit(() -> {
            ensureInitialized();
            append(new UserMessageData(content));
            return runTurnLoop();
        }, result);
        return result;
    }

    /** Queues a message without waiting for it; it is processed once the agent is idle. */
    public String queueMessage(String content, QueuedMessage.Kind kind, QueuedMessage.Metadata metadata) {
        recoverOnFirstUse();
        QueuedMessage message = queue.newMessage(kind, content, metadata);
        synchronized (lock) {
            if (state == AgentState.STOPPED) {
                throw new IllegalStateException("Agent " + threadId + " is stopped");
            }
            queue.enqueue(message);
        }
        fire(l -> l.onMessageQueued(message));
        drainNext();
        return message.id();
    }

    /**
     * Records an approval decision and resumes the batch that contains the call. The response is
     * written immediately; a second response for the same call is ignored.
     */
    public CompletableFuture<TurnOutcome> respondToApproval(String callId, ApprovalDecision decision) {
        if (threadStore.findToolCall(threadId, callId).isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("No tool call " + callId + " in thread " + threadId));
        }
        if (state == AgentState.STOPPED) {
            return CompletableFuture.failedFuture(new IllegalStateException("Agent " + threadId + " is stopped"));
        }
        synchronized (lock) {
            recoveryChecked = true;
        }
        Optional<ApprovalDecision> earlier = threadStore.findApprovalResponse(threadId, callId);
        Event response = threadStore.appendEvent(threadId, new ToolApprovalResponseData(callId, decision));
        if (earlier.isEmpty()) {
            announce(response);
        } else if (earlier.get() != decision) {
            log.info("Approval for {} already recorded as {}, ignoring {}", callId, earlier.get(), decision);
        }
        return schedule(() -> resumeBatchOf(callId));
    }

    public Event addSystemMessage(String text) {
        return append(new LocalSystemMessageData(text));
    }

    // --- queries ---

    public List<Event> getEvents() {
        return threadStore.getEvents(threadId);
    }

    public List<BackendMessage> buildConversation() {
        return conversationBuilder.build(getEvents());
    }

    public ThreadTokenUsage getTokenUsage() {
        return tracker().getUsage();
    }

    public BudgetRecommendations getTokenRecommendations() {
        return tracker().getRecommendations();
    }

    public QueueStats getQueueStats() {
        return queue.stats();
    }

    public List<QueuedMessage> getQueueContents() {
        return queue.contents();
    }

    public int clearQueue() {
        return queue.clear();
    }

    public List<PendingApproval> getPendingApprovals() {
        return threadStore.getPendingApprovals(threadId);
    }

    public AgentState getState() {
        return state;
    }

    public String getThreadId() {
        return threadId;
    }

    public AgentConfig getConfig() {
        return config;
    }

    /**
     * True when a {@code file_read} call for this path finished successfully. Relative paths on
     * both sides resolve against the agent's working directory.
     */
    public boolean hasFileBeenRead(String path) {
        Path target = resolvePath(path);
        List<Event> events = getEvents();
        Set<String> succeeded = new HashSet<>();
        for (Event event : events) {
            if (event.is(EventType.TOOL_RESULT)) {
                ToolResultData result = event.dataAs(ToolResultData.class);
                if (!result.isError()) {
                    succeeded.add(result.callId());
                }
            }
        }
        return events.stream()
                .filter(e -> e.is(EventType.TOOL_CALL))
                .map(e -> e.dataAs(ToolCallData.class))
                .filter(c -> FILE_READ_TOOL.equals(c.name()) && c.arguments().hasNonNull("path"))
                .filter(c -> succeeded.contains(c.id()))
                .anyMatch(c -> resolvePath(c.arguments().get("path").asText()).equals(target));
    }

    public void addListener(AgentListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AgentListener listener) {
        listeners.remove(listener);
    }

    // --- turn loop ---

    private TurnOutcome runTurnLoop() {
        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            if (tokenTracker.isExhausted()) {
                ThreadTokenUsage usage = tokenTracker.getUsage();
                log.warn("Token budget exhausted for thread {}: {}/{}", threadId, usage.totalTokens(), usage.contextLimit());
                addSystemMessage(String.format(
                        "Token budget exhausted: %d of %d tokens used (%.1f%%). Start a new thread to continue.",
                        usage.totalTokens(), usage.contextLimit(), usage.percentUsed()));
                setState(AgentState.IDLE);
                return TurnOutcome.budgetExhausted();
            }

            setState(AgentState.RUNNING);
            List<BackendMessage> messages = buildMessages(threadStore.getEvents(threadId));
            CancellationSignal signal = newSignal();
            try {
                BackendResponse response = callBackend(messages, signal);
                if (signal.isCancelled()) {
                    throw new TurnCancelledException("Turn cancelled, backend response discarded");
                }
                TokenUsage usage = checkedUsage(response.usage());
                append(new AgentMessageData(response.content(), usage));
                tokenTracker.recordUsage(usage);

                if (!response.hasToolCalls()) {
                    setState(AgentState.IDLE);
                    return TurnOutcome.completed();
                }

                List<ToolCallData> calls = new ArrayList<>();
                for (BackendToolCall call : response.toolCalls()) {
                    String id = call.id() != null ? call.id() : "call_" + UUID.randomUUID();
                    ToolCallData data = new ToolCallData(id, call.name(), call.input());
                    append(data);
                    calls.add(data);
                }
                BatchResult batch = dispatch(calls, signal);
                if (!batch.pending().isEmpty()) {
                    setState(AgentState.WAITING_APPROVAL);
                    return TurnOutcome.awaitingApproval(batch.pending());
                }
                if (batch.interrupted()) {
                    setState(AgentState.IDLE);
                    return TurnOutcome.completed();
                }
            } finally {
                clearSignal(signal);
            }
        }
        log.warn("Thread {} reached {} iterations without a final response", threadId, config.maxIterations());
        addSystemMessage("Stopped after " + config.maxIterations() + " model calls without a final response.");
        setState(AgentState.IDLE);
        return TurnOutcome.completed();
    }

    private TokenUsage checkedUsage(TokenUsage usage) {
        if (!TokenBudgetTracker.isValid(usage)) {
            throw new BackendException(backend.providerName() + " reported negative token usage: " + usage, false);
        }
        return usage;
    }

    private BackendResponse callBackend(List<BackendMessage> messages, CancellationSignal signal) {
        List<ToolDescriptor> tools = toolExecutor.registry().descriptors();
        if (config.streaming() && backend.supportsStreaming()) {
            // cancelling the signal disposes the subscription, so an abort cuts the stream short
            Mono<Boolean> cancelled = Mono.create(sink -> signal.onCancel(() -> sink.success(true)));
            BackendResponse response = backend.streamResponse(messages, tools, signal,
                            text -> fire(l -> l.onTokenDelta(text)))
                    .takeUntilOther(cancelled)
                    .block();
            if (signal.isCancelled()) {
                throw new TurnCancelledException("Turn cancelled, stream from " + backend.providerName() + " disposed");
            }
            if (response == null) {
                throw new BackendException(backend.providerName() + " stream completed without a response", false);
            }
            return response;
        }
        return backend.createResponse(messages, tools, signal);
    }

    private List<BackendMessage> buildMessages(List<Event> events) {
        List<BackendMessage> messages = new ArrayList<>();
        Optional<String> prompt = conversationBuilder.systemPrompt(events);
        if (prompt.isEmpty() && config.systemPrompt() != null && !config.systemPrompt().isBlank()) {
            prompt = Optional.of(config.systemPrompt());
        }
        prompt.ifPresent(p -> messages.add(BackendMessage.system(p)));
        messages.addAll(conversationBuilder.build(events));
        return messages;
    }

    private BatchResult dispatch(List<ToolCallData> calls, CancellationSignal signal) {
        setState(AgentState.TOOL_DISPATCH);
        ToolContext ctx = new ToolContext(threadId, config.workingDirectory(), config.environment(), signal);
        List<String> pending = new ArrayList<>();
        boolean interrupted = false;
        for (ToolCallData call : calls) {
            Optional<ToolResultData> existing = threadStore.findToolResult(threadId, call.id());
            if (existing.isPresent()) {
                interrupted |= interrupts(existing.get());
                continue;
            }
            fire(l -> l.onToolCallStart(call));
            ToolExecution execution = toolExecutor.executeTool(call, ctx);
            if (execution.isPending()) {
                pending.add(call.id());
                continue;
            }
            ToolResultData result = execution.result();
            append(result);
            fire(l -> l.onToolCallComplete(call, result));
            interrupted |= interrupts(result);
        }
        return new BatchResult(pending, interrupted);
    }

    private Optional<TurnOutcome> resumeLatestBatch() {
        Optional<ToolBatch> batch = unresolvedLatestBatch(threadStore.getEvents(threadId));
        if (batch.isEmpty()) {
            return Optional.empty();
        }
        log.info("Resuming {} tool calls in thread {}", batch.get().calls().size(), threadId);
        return Optional.of(resolveBatch(batch.get()));
    }

    /** The batch after the last user or agent message, if any of its calls has no result yet. */
    private static Optional<ToolBatch> unresolvedLatestBatch(List<Event> events) {
        int last = lastIndexOf(events, EventType.TOOL_CALL);
        if (last < 0) {
            return Optional.empty();
        }
        ToolBatch batch = ToolBatch.around(events, last);
        Set<String> answered = new HashSet<>();
        for (Event event : events) {
            if (event.is(EventType.TOOL_RESULT)) {
                answered.add(event.dataAs(ToolResultData.class).callId());
            }
        }
        boolean unresolved = batch.calls().stream().anyMatch(c -> !answered.contains(c.id()));
        return batch.latest() && unresolved ? Optional.of(batch) : Optional.empty();
    }

    private TurnOutcome resumeBatchOf(String callId) {
        ensureInitialized();
        List<Event> events = threadStore.getEvents(threadId);
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            if (event.is(EventType.TOOL_CALL) && event.dataAs(ToolCallData.class).id().equals(callId)) {
                return resolveBatch(ToolBatch.around(events, i));
            }
        }
        throw new IllegalArgumentException("No tool call " + callId + " in thread " + threadId);
    }

    private TurnOutcome resolveBatch(ToolBatch batch) {
        CancellationSignal signal = newSignal();
        BatchResult result;
        try {
            result = dispatch(batch.calls(), signal);
        } finally {
            clearSignal(signal);
        }
        if (!result.pending().isEmpty()) {
            setState(AgentState.WAITING_APPROVAL);
            return TurnOutcome.awaitingApproval(result.pending());
        }
        if (result.interrupted() || !batch.latest()) {
            setState(AgentState.IDLE);
            return TurnOutcome.completed();
        }
        return runTurnLoop();
    }

    private static boolean interrupts(ToolResultData result) {
        return result.status() == ToolResultStatus.DENIED || result.status() == ToolResultStatus.ABORTED;
    }

    private static int lastIndexOf(List<Event> events, EventType type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).is(type)) {
                return i;
            }
        }
        return -1;
    }

    // --- scheduling ---

    private CompletableFuture<TurnOutcome> schedule(Callable<TurnOutcome> work) {
        CompletableFuture<TurnOutcome> result = new CompletableFuture<>();
        synchronized (lock) {
            if (state == AgentState.STOPPED) {
                result.completeExceptionally(new IllegalStateException("Agent " + threadId + " is stopped"));
                return result;
            }
            scheduled++;
        }
        submit(work, result);
        return result;
    }

    private void submit(Callable<TurnOutcome> work, CompletableFuture<TurnOutcome> result) {
        outstanding.add(result);
        try {
            turnExecutor.execute(() -> runTask(work, result));
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                scheduled--;
            }
            outstanding.remove(result);
            result.completeExceptionally(new IllegalStateException("Agent " + threadId + " is stopped", e));
        }
    }

    private void runTask(Callable<TurnOutcome> work, CompletableFuture<TurnOutcome> result) {
        try {
            TurnOutcome outcome = work.call();
            result.complete(outcome);
            fire(l -> l.onTurnComplete(outcome));
        } catch (Throwable e) {
            if (e instanceof TurnCancelledException) {
                log.info("Turn cancelled in thread {}: {}", threadId, e.getMessage());
            } else {
                log.error("Turn failed in thread {}", threadId, e);
            }
            setState(AgentState.IDLE);
            result.completeExceptionally(e);
            fire(l -> l.onError(e));
            if (e instanceof VirtualMachineError fatal) {
                throw fatal;
            }
        } finally {
            if (!result.isDone()) {
                result.completeExceptionally(new IllegalStateException("Turn in thread " + threadId + " ended without an outcome"));
            }
            outstanding.remove(result);
            synchronized (lock) {
                scheduled--;
            }
            drainNext();
        }
    }

    private void drainNext() {
        QueuedMessage next;
        synchronized (lock) {
            if (state != AgentState.IDLE || scheduled > 0) {
                return;
            }
            next = queue.dequeueNext().orElse(null);
            if (next == null) {
                return;
            }
            scheduled++;
        }
        CompletableFuture<TurnOutcome> result = queuedFutures.remove(next.id());
        if (result == null) {
            result = new CompletableFuture<>();
        }
        log.debug("Processing queued {} message {} in thread {}", next.kind(), next.id(), threadId);
        submit(() -> {
            ensureInitialized();
            append(new UserMessageData(renderQueued(next)));
            return runTurnLoop();
        }, result);
    }

    private static String renderQueued(QueuedMessage message) {
        QueuedMessage.Metadata meta = message.metadata();
        return switch (message.kind()) {
            case USER -> message.content();
            case SYSTEM -> "[system" + (meta.source() != null ? ": " + meta.source() : "") + "] " + message.content();
            case TASK_NOTIFICATION -> "[task " + meta.taskId()
                    + (meta.fromAgent() != null ? " from " + meta.fromAgent() : "") + "] " + message.content();
        };
    }

    private void ensureInitialized() {
        if (initialized) {
            return;
        }
        if (!threadStore.threadExists(threadId)) {
            threadStore.createThread(threadId);
        }
        List<Event> events = threadStore.getEvents(threadId);
        if (events.isEmpty() && config.systemPrompt() != null && !config.systemPrompt().isBlank()) {
            append(new SystemPromptData(config.systemPrompt()));
        }
        tokenTracker = TokenBudgetTracker.fromEvents(events, config.tokenBudget());
        initialized = true;
    }

    private TokenBudgetTracker tracker() {
        TokenBudgetTracker current = tokenTracker;
        return current != null ? current : TokenBudgetTracker.fromEvents(getEvents(), config.tokenBudget());
    }

    private CancellationSignal newSignal() {
        CancellationSignal signal = new CancellationSignal();
        currentSignal = signal;
        if (state == AgentState.STOPPED) {
            signal.cancel();
        }
        return signal;
    }

    private void clearSignal(CancellationSignal signal) {
        if (currentSignal == signal) {
            currentSignal = null;
        }
    }

    private Event append(EventData data) {
        Event event = threadStore.appendEvent(threadId, data);
        announce(event);
        return event;
    }

    private void announce(Event event) {
        fire(l -> l.onEventAppended(event));
    }

    private void setState(AgentState next) {
        AgentState previous;
        synchronized (lock) {
            previous = state;
            if (previous == AgentState.STOPPED || previous == next) {
                return;
            }
            state = next;
        }
        log.debug("Agent {} {} -> {}", threadId, previous, next);
        fire(l -> l.onStateChange(previous, next));
    }

    private Path resolvePath(String path) {
        Path candidate = Path.of(path);
        return (candidate.isAbsolute() ? candidate : config.workingDirectory().resolve(candidate)).normalize();
    }

    private void fire(Consumer<AgentListener> callback) {
        for (AgentListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Agent listener failed in thread {}: {}", threadId, e.getMessage(), e);
            }
        }
    }

    private record BatchResult(List<String> pending, boolean interrupted) {}

    private final class RetryBridge implements RetryListener {
        @Override
        public void onRetryAttempt(int attempt, int maxAttempts, Duration delay, BackendException error) {
            fire(l -> l.onRetryAttempt(attempt, maxAttempts, delay, error));
        }

        @Override
        public void onRetryExhausted(int attempts, BackendException error) {
            fire(l -> l.onRetryExhausted(attempts, error));
        }
    }
}
