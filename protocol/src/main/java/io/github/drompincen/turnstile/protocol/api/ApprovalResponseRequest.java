package io.github.drompincen.turnstile.protocol.api;

import io.github.drompincen.turnstile.protocol.event.ApprovalDecision;

public record ApprovalResponseRequest(ApprovalDecision decision) {}
