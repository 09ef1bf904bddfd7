package io.github.drompincen.turnstile.runtime.thread;

import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.SystemPromptData;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import io.github.drompincen.turnstile.runtime.backend.BackendMessage;
import io.github.drompincen.turnstile.runtime.backend.BackendToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds the model-facing conversation from a thread's events. Pure: the same events always
 * produce the same messages.
 *
 * <p>An agent message owns the tool calls that follow it until the next user or agent message.
 * Tool results of one batch are grouped into a single user message placed right after the
 * assistant message that issued the calls. A result whose call is no longer in the current batch
 * gets a synthetic assistant message rebuilt from its tool call; a result with no recorded call
 * is dropped.
 */
public class ConversationBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConversationBuilder.class);

    public List<BackendMessage> build(List<Event> events) {
        List<BackendMessage> messages = new ArrayList<>();
        Map<String, ToolCallData> knownCalls = new HashMap<>();
        Draft draft = null;

        for (Event event : events) {
            if (!sentToModel(event.type())) {
                continue;
            }
            switch (event.type()) {
                case USER_MESSAGE -> {
                    flush(draft, messages);
                    draft = null;
                    messages.add(BackendMessage.user(event.dataAs(UserMessageData.class).content()));
                }
                case AGENT_MESSAGE -> {
                    flush(draft, messages);
                    draft = new Draft(event.dataAs(AgentMessageData.class).content());
                }
                case TOOL_CALL -> {
                    ToolCallData call = event.dataAs(ToolCallData.class);
                    knownCalls.put(call.id(), call);
                    if (draft == null || !draft.results.isEmpty()) {
                        flush(draft, messages);
                        draft = new Draft("");
                    }
                    draft.calls.add(BackendToolCall.from(call));
                }
                case TOOL_RESULT -> {
                    ToolResultData result = event.dataAs(ToolResultData.class);
                    ToolCallData call = knownCalls.get(result.callId());
                    if (call == null) {
                        log.debug("Dropping tool result {} with no recorded call", result.callId());
                        continue;
                    }
                    if (draft == null || !draft.owns(result.callId())) {
                        flush(draft, messages);
                        draft = new Draft("");
                        draft.calls.add(BackendToolCall.from(call));
                    }
                    draft.results.add(result);
                }
                default -> throw new IllegalStateException("Unhandled model-visible event " + event.type());
            }
        }
        flush(draft, messages);
        return messages;
    }

    /** Content of the most recent system prompt event, if any. */
    public Optional<String> systemPrompt(List<Event> events) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).is(EventType.SYSTEM_PROMPT)) {
                return Optional.ofNullable(events.get(i).dataAs(SystemPromptData.class).content());
            }
        }
        return Optional.empty();
    }

    public static boolean sentToModel(EventType type) {
        return switch (type) {
            case USER_MESSAGE, AGENT_MESSAGE, TOOL_CALL, TOOL_RESULT -> true;
            case TOOL_APPROVAL_REQUEST, TOOL_APPROVAL_RESPONSE, SYSTEM_PROMPT, LOCAL_SYSTEM_MESSAGE -> false;
        };
    }

    private static void flush(Draft draft, List<BackendMessage> messages) {
        if (draft == null) {
            return;
        }
        messages.add(BackendMessage.assistant(draft.content, draft.calls));
        if (!draft.results.isEmpty()) {
            messages.add(BackendMessage.toolResults(draft.results));
        }
    }

    private static final class Draft {
        private final String content;
        private final List<BackendToolCall> calls = new ArrayList<>();
        private final List<ToolResultData> results = new ArrayList<>();

        private Draft(String content) {
            this.content = content;
        }

        private boolean owns(String callId) {
            return calls.stream().anyMatch(c -> c.id().equals(callId));
        }
    }
}
