package io.github.drompincen.turnstile.runtime.agent;

public enum AgentState {
    IDLE,
    RUNNING,
    TOOL_DISPATCH,
    WAITING_APPROVAL,
    STOPPED
}
