package io.github.drompincen.turnstile.runtime.thread;

import io.github.drompincen.turnstile.protocol.event.Event;

@FunctionalInterface
public interface ThreadEventListener {

    void onEvent(Event event);
}
