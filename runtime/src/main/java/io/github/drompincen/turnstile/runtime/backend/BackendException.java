package io.github.drompincen.turnstile.runtime.backend;

public class BackendException extends RuntimeException {

    private final boolean retryable;

    public BackendException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public BackendException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
