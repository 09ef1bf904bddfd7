package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;

import java.util.ArrayList;
import java.util.List;

/**
 * The tool calls issued by one agent message: every call between the preceding user or agent
 * message and the next one. {@code latest} is true when no user or agent message follows.
 */
record ToolBatch(List<ToolCallData> calls, boolean latest) {

    static ToolBatch around(List<Event> events, int index) {
        int start = index;
        while (start > 0 && !isBoundary(events.get(start - 1))) {
            start--;
        }
        int end = index;
        while (end + 1 < events.size() && !isBoundary(events.get(end + 1))) {
            end++;
        }
        List<ToolCallData> calls = new ArrayList<>();
        for (int i = start; i <= end; i++) {
            if (events.get(i).is(EventType.TOOL_CALL)) {
                calls.add(events.get(i).dataAs(ToolCallData.class));
            }
        }
        return new ToolBatch(List.copyOf(calls), end == events.size() - 1);
    }

    private static boolean isBoundary(Event event) {
        return event.is(EventType.USER_MESSAGE) || event.is(EventType.AGENT_MESSAGE);
    }
}
