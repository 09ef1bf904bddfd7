package io.github.drompincen.turnstile.protocol.api;

public record SendMessageRequest(String content) {}
