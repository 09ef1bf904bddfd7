package io.github.drompincen.turnstile.runtime.cancel;

public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException(String message) {
        super(message);
    }

    public TurnCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
