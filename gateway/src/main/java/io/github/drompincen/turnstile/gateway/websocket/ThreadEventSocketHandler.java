package io.github.drompincen.turnstile.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.runtime.thread.ThreadEventListener;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes appended thread events to WebSocket clients. Clients send
 * {@code {"type":"SUBSCRIBE_THREAD","threadId":"..."}} and {@code UNSUBSCRIBE} to manage interest.
 */
@Component
public class ThreadEventSocketHandler extends TextWebSocketHandler implements ThreadEventListener {

    private static final Logger log = LoggerFactory.getLogger(ThreadEventSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ThreadStore threadStore;
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();

    public ThreadEventSocketHandler(ObjectMapper objectMapper, ThreadStore threadStore) {
        this.objectMapper = objectMapper;
        this.threadStore = threadStore;
    }

    @PostConstruct
    public void init() {
        threadStore.subscribe(this);
    }

    @PreDestroy
    public void shutdown() {
        threadStore.unsubscribe(this);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String threadId = node.path("threadId").asText();

        if ("SUBSCRIBE_THREAD".equals(type)) {
            subscriptions.computeIfAbsent(threadId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, new TextMessage(objectMapper.writeValueAsString(
                    Map.of("type", "SUBSCRIBED", "threadId", threadId))));
        } else if ("UNSUBSCRIBE".equals(type)) {
            Set<WebSocketSession> set = subscriptions.get(threadId);
            if (set != null) {
                set.remove(session);
            }
        } else {
            log.debug("Ignoring WebSocket message of type '{}'", type);
        }
    }

    @Override
    public void onEvent(Event event) {
        Set<WebSocketSession> subscribers = subscriptions.get(event.threadId());
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(
                    Map.of("type", "EVENT", "threadId", event.threadId(), "event", event)));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event {} of thread {}", event.seq(), event.threadId(), e);
            return;
        }
        for (WebSocketSession session : subscribers) {
            if (!session.isOpen()) {
                subscribers.remove(session);
                continue;
            }
            try {
                send(session, message);
            } catch (IOException e) {
                log.debug("Dropping WebSocket session {}: {}", session.getId(), e.getMessage());
                subscribers.remove(session);
            }
        }
    }

    private static void send(WebSocketSession session, TextMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(message);
        }
    }
}
