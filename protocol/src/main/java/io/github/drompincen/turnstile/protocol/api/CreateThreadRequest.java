package io.github.drompincen.turnstile.protocol.api;

public record CreateThreadRequest(String parentThreadId) {}
