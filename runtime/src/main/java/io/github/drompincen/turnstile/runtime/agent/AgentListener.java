package io.github.drompincen.turnstile.runtime.agent;

import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.ToolCallData;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import io.github.drompincen.turnstile.runtime.backend.BackendException;
import io.github.drompincen.turnstile.runtime.queue.QueuedMessage;

import java.time.Duration;

/**
 * Observer of one agent. All callbacks run on the agent's turn thread and default to no-ops.
 */
public interface AgentListener {

    default void onStateChange(AgentState from, AgentState to) {}

    default void onEventAppended(Event event) {}

    default void onTokenDelta(String text) {}

    default void onToolCallStart(ToolCallData call) {}

    default void onToolCallComplete(ToolCallData call, ToolResultData result) {}

    default void onTurnComplete(TurnOutcome outcome) {}

    default void onMessageQueued(QueuedMessage message) {}

    default void onRetryAttempt(int attempt, int maxAttempts, Duration delay, BackendException error) {}

    default void onRetryExhausted(int attempts, BackendException error) {}

    default void onError(Throwable error) {}
}
