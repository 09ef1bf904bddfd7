package io.github.drompincen.turnstile.runtime.thread;

public class ThreadNotFoundException extends RuntimeException {

    public ThreadNotFoundException(String threadId) {
        super("Thread not found: " + threadId);
    }
}
