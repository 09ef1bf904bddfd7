package io.github.drompincen.turnstile.runtime.backend;

import java.time.Duration;

public interface RetryListener {

    void onRetryAttempt(int attempt, int maxAttempts, Duration delay, BackendException error);

    void onRetryExhausted(int attempts, BackendException error);

    RetryListener NONE = new RetryListener() {
        @Override
        public void onRetryAttempt(int attempt, int maxAttempts, Duration delay, BackendException error) {
        }

        @Override
        public void onRetryExhausted(int attempts, BackendException error) {
        }
    };
}
