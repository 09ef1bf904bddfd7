package io.github.drompincen.turnstile.runtime.approval;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.turnstile.protocol.event.ApprovalDecision;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalRequestData;
import io.github.drompincen.turnstile.protocol.event.ToolApprovalResponseData;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Approval state kept entirely in the thread log, so it survives restarts. A call is asked about
 * at most once: the request event is written the first time and later requests only read it back.
 * An {@code allow_session} response covers every later call of the same tool in the thread.
 */
public class EventApprovalGate implements ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(EventApprovalGate.class);

    private final ThreadStore threadStore;
    private final String threadId;
    private final Consumer<Event> onAppended;

    public EventApprovalGate(ThreadStore threadStore, String threadId) {
        this(threadStore, threadId, event -> {});
    }

    /** {@code onAppended} sees the request events this gate writes. */
    public EventApprovalGate(ThreadStore threadStore, String threadId, Consumer<Event> onAppended) {
        this.threadStore = threadStore;
        this.threadId = threadId;
        this.onAppended = onAppended;
    }

    @Override
    public ApprovalOutcome requestApproval(ToolCallData call) {
        ToolCallData recorded = threadStore.findToolCall(threadId, call.id())
                .orElseGet(() -> threadStore.findLatestToolCall(threadId, call.name(), call.arguments())
                        .orElseThrow(() -> new IllegalStateException(
                                "No tool call event for " + call.name() + " (" + call.id() + ") in thread " + threadId)));
        return decide(recorded);
    }

    @Override
    public ApprovalOutcome requestApproval(String toolName, JsonNode input) {
        ToolCallData recorded = threadStore.findLatestToolCall(threadId, toolName, input)
                .orElseThrow(() -> new IllegalStateException(
                        "No tool call event for " + toolName + " in thread " + threadId));
        return decide(recorded);
    }

    private ApprovalOutcome decide(ToolCallData call) {
        List<Event> events = threadStore.getEvents(threadId);

        Optional<ApprovalDecision> existing = responseFor(events, call.id());
        if (existing.isPresent()) {
            return ApprovalOutcome.decided(existing.get());
        }
        if (sessionApproved(events, call.name())) {
            log.debug("Tool {} approved for the session in thread {}", call.name(), threadId);
            return ApprovalOutcome.decided(ApprovalDecision.ALLOW_SESSION);
        }
        boolean requested = events.stream().anyMatch(e -> e.is(EventType.TOOL_APPROVAL_REQUEST)
                && e.dataAs(ToolApprovalRequestData.class).toolCallId().equals(call.id()));
        if (!requested) {
            onAppended.accept(threadStore.appendEvent(threadId, new ToolApprovalRequestData(call.id())));
            log.info("Requested approval for {} ({}) in thread {}", call.name(), call.id(), threadId);
        }
        return ApprovalOutcome.pending();
    }

    private static Optional<ApprovalDecision> responseFor(List<Event> events, String callId) {
        return events.stream()
                .filter(e -> e.is(EventType.TOOL_APPROVAL_RESPONSE))
                .map(e -> e.dataAs(ToolApprovalResponseData.class))
                .filter(r -> r.toolCallId().equals(callId))
                .map(ToolApprovalResponseData::decision)
                .findFirst();
    }

    private static boolean sessionApproved(List<Event> events, String toolName) {
        Map<String, String> callNames = new HashMap<>();
        for (Event event : events) {
            if (event.is(EventType.TOOL_CALL)) {
                ToolCallData call = event.dataAs(ToolCallData.class);
                callNames.put(call.id(), call.name());
            } else if (event.is(EventType.TOOL_APPROVAL_RESPONSE)) {
                ToolApprovalResponseData response = event.dataAs(ToolApprovalResponseData.class);
                if (response.decision() == ApprovalDecision.ALLOW_SESSION
                        && toolName.equals(callNames.get(response.toolCallId()))) {
                    return true;
                }
            }
        }
        return false;
    }
}
