package io.github.drompincen.turnstile.gateway.controller;

import io.github.drompincen.turnstile.persistence.StorageUnavailableException;
import io.github.drompincen.turnstile.runtime.backend.BackendException;
import io.github.drompincen.turnstile.runtime.thread.ThreadNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void unknownThreadIs404() {
        ResponseEntity<ApiErrorResponse> response = handler.handleNotFound(new ThreadNotFoundException("t9"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody().message()).isEqualTo("Thread not found: t9");
    }

    @Test
    void illegalStateIsConflict() {
        ResponseEntity<ApiErrorResponse> response = handler.handleConflict(new IllegalStateException("Agent t1 is stopped"));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody().status()).isEqualTo(409);
    }

    @Test
    void storageFailureIs503() {
        ResponseEntity<ApiErrorResponse> response = handler.handleStorage(new StorageUnavailableException("down"));

        assertThat(response.getStatusCode().value()).isEqualTo(503);
    }

    @Test
    void backendFailureIs502() {
        ResponseEntity<ApiErrorResponse> response = handler.handleBackend(new BackendException("401", false));

        assertThat(response.getStatusCode().value()).isEqualTo(502);
        assertThat(response.getBody().message()).isEqualTo("401");
    }

    @Test
    void unexpectedFailureHidesDetails() {
        ResponseEntity<ApiErrorResponse> response = handler.handleGeneric(new RuntimeException("secret detail"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).isEqualTo("Internal server error");
    }
}
