package io.github.drompincen.turnstile.gateway.controller;

/** Error body returned by every endpoint. */
public record ApiErrorResponse(int status, String message) {}
