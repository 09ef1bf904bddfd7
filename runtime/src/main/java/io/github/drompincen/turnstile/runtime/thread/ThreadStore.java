package io.github.drompincen.turnstile.runtime.thread;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.turnstile.persistence.PersistenceContext;
import io.github.drompincen.turnstile.persistence.store.EventStore;
import io.github.drompincen.turnstile.protocol.event.ApprovalDecision;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventData;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalRequestData;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalResponseData;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Append-only event log per thread. Appends to one thread are serialised and numbered; every
 * read returns events in append order. Storage failures propagate to the caller.
 */
public class ThreadStore {

    private static final Logger log = LoggerFactory.getLogger(ThreadStore.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final PersistenceContext persistence;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ConcurrentHashMap<String, AtomicLong> seqCounters = new ConcurrentHashMap<>();
    private final List<ThreadEventListener> listeners = new CopyOnWriteArrayList<>();

    public ThreadStore(PersistenceContext persistence) {
        this(persistence, Clock.systemUTC());
    }

    public ThreadStore(PersistenceContext persistence, Clock clock) {
        this.persistence = persistence;
        this.clock = clock;
    }

    public String generateThreadId() {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "thread_" + LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(ID_DATE) + "_" + suffix;
    }

    /** Next child id of the form {@code parent.N}; the child thread is created immediately. */
    public synchronized String generateDelegateThreadId(String parentThreadId) {
        String prefix = parentThreadId + ".";
        int max = 0;
        for (String id : store().threadIds()) {
            if (!id.startsWith(prefix)) {
                continue;
            }
            String rest = id.substring(prefix.length());
            if (!rest.isEmpty() && rest.chars().allMatch(Character::isDigit)) {
                max = Math.max(max, Integer.parseInt(rest));
            }
        }
        String delegateId = prefix + (max + 1);
        createThread(delegateId);
        return delegateId;
    }

    public String createThread() {
        String threadId = generateThreadId();
        createThread(threadId);
        return threadId;
    }

    public void createThread(String threadId) {
        store().createThread(threadId);
        log.debug("Created thread {}", threadId);
    }

    public boolean threadExists(String threadId) {
        return store().threadExists(threadId);
    }

    public List<String> threadIds() {
        return store().threadIds();
    }

    /**
     * Appends an event and notifies subscribers. Approval request and response payloads are
     * idempotent per tool-call id: when one already exists it is returned and nothing is written.
     */
    public Event appendEvent(String threadId, EventData data) {
        AtomicLong counter = counterFor(threadId);
        Event event;
        synchronized (counter) {
            Optional<Event> existing = existingApprovalEvent(threadId, data);
            if (existing.isPresent()) {
                log.debug("Skipping duplicate {} in thread {}", data.type(), threadId);
                return existing.get();
            }
            long seq = counter.get() + 1;
            event = new Event(UUID.randomUUID().toString(), threadId, seq, data.type(), clock.instant(), data);
            store().append(event);
            counter.set(seq);
        }
        for (ThreadEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed for {} in thread {}: {}", event.type(), threadId, e.getMessage(), e);
            }
        }
        return event;
    }

    public List<Event> getEvents(String threadId) {
        return store().read(threadId);
    }

    public Optional<Event> findEvent(String threadId, Predicate<Event> predicate) {
        return getEvents(threadId).stream().filter(predicate).findFirst();
    }

    public Optional<Event> findLastEvent(String threadId, Predicate<Event> predicate) {
        List<Event> events = getEvents(threadId);
        for (int i = events.size() - 1; i >= 0; i--) {
            if (predicate.test(events.get(i))) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    public Optional<ToolCallData> findToolCall(String threadId, String callId) {
        return findEvent(threadId, e -> e.is(EventType.TOOL_CALL)
                && e.dataAs(ToolCallData.class).id().equals(callId))
                .map(e -> e.dataAs(ToolCallData.class));
    }

    /** Most recent tool call with this name and exactly these arguments. */
    public Optional<ToolCallData> findLatestToolCall(String threadId, String toolName, JsonNode arguments) {
        return findLastEvent(threadId, e -> {
            if (!e.is(EventType.TOOL_CALL)) {
                return false;
            }
            ToolCallData call = e.dataAs(ToolCallData.class);
            return call.name().equals(toolName) && call.arguments().equals(arguments);
        }).map(e -> e.dataAs(ToolCallData.class));
    }

    public boolean hasApprovalRequest(String threadId, String callId) {
        return findEvent(threadId, e -> e.is(EventType.TOOL_APPROVAL_REQUEST)
                && e.dataAs(ToolApprovalRequestData.class).toolCallId().equals(callId)).isPresent();
    }

    public Optional<ApprovalDecision> findApprovalResponse(String threadId, String callId) {
        return findEvent(threadId, e -> e.is(EventType.TOOL_APPROVAL_RESPONSE)
                && e.dataAs(ToolApprovalResponseData.class).toolCallId().equals(callId))
                .map(e -> e.dataAs(ToolApprovalResponseData.class).decision());
    }

    public Optional<ToolResultData> findToolResult(String threadId, String callId) {
        return findEvent(threadId, e -> e.is(EventType.TOOL_RESULT)
                && e.dataAs(ToolResultData.class).callId().equals(callId))
                .map(e -> e.dataAs(ToolResultData.class));
    }

    public boolean hasToolResult(String threadId, String callId) {
        return findToolResult(threadId, callId).isPresent();
    }

    /** Approval requests that have neither a response nor a tool result. */
    public List<PendingApproval> getPendingApprovals(String threadId) {
        List<Event> events = getEvents(threadId);
        Map<String, ToolCallData> calls = new HashMap<>();
        Set<String> resolved = new HashSet<>();
        for (Event event : events) {
            switch (event.type()) {
                case TOOL_CALL -> {
                    ToolCallData call = event.dataAs(ToolCallData.class);
                    calls.put(call.id(), call);
                }
                case TOOL_APPROVAL_RESPONSE -> resolved.add(event.dataAs(ToolApprovalResponseData.class).toolCallId());
                case TOOL_RESULT -> resolved.add(event.dataAs(ToolResultData.class).callId());
                default -> { }
            }
        }
        List<PendingApproval> pending = new ArrayList<>();
        for (Event event : events) {
            if (!event.is(EventType.TOOL_APPROVAL_REQUEST)) {
                continue;
            }
            String callId = event.dataAs(ToolApprovalRequestData.class).toolCallId();
            ToolCallData call = calls.get(callId);
            if (call != null && !resolved.contains(callId)) {
                pending.add(new PendingApproval(callId, call, event.timestamp()));
            }
        }
        return pending;
    }

    public void purgeThread(String threadId) {
        AtomicLong counter = counterFor(threadId);
        synchronized (counter) {
            store().purge(threadId);
            seqCounters.remove(threadId);
        }
        log.info("Purged thread {}", threadId);
    }

    public void subscribe(ThreadEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(ThreadEventListener listener) {
        listeners.remove(listener);
    }

    private Optional<Event> existingApprovalEvent(String threadId, EventData data) {
        if (data instanceof ToolApprovalRequestData request) {
            return findEvent(threadId, e -> e.is(EventType.TOOL_APPROVAL_REQUEST)
                    && e.dataAs(ToolApprovalRequestData.class).toolCallId().equals(request.toolCallId()));
        }
        if (data instanceof ToolApprovalResponseData response) {
            return findEvent(threadId, e -> e.is(EventType.TOOL_APPROVAL_RESPONSE)
                    && e.dataAs(ToolApprovalResponseData.class).toolCallId().equals(response.toolCallId()));
        }
        return Optional.empty();
    }

    private AtomicLong counterFor(String threadId) {
        return seqCounters.computeIfAbsent(threadId, id -> {
            EventStore store = store();
            if (!store.threadExists(id)) {
                store.createThread(id);
            }
            return new AtomicLong(store.lastSeq(id));
        });
    }

    private EventStore store() {
        return persistence.get();
    }
}
