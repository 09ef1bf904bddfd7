package io.github.drompincen.turnstile.persistence;

/**
 * The event store could not be reached or refused a write. Callers do not recover from this;
 * it propagates to whoever started the operation.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
