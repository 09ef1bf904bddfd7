package io.github.drompincen.turnstile.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThreadEventSocketHandlerTest {

    @Mock private ThreadStore threadStore;
    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketSession wsSession2;

    private ObjectMapper objectMapper;
    private ThreadEventSocketHandler handler;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        handler = new ThreadEventSocketHandler(objectMapper, threadStore);
    }

    private Event makeEvent(String threadId) {
        return new Event("ev1", threadId, 1, null, Instant.parse("2026-10-17T10:00:00Z"), new UserMessageData("hello"));
    }

    private void subscribe(WebSocketSession session, String threadId) throws Exception {
        handler.handleTextMessage(session, new TextMessage(objectMapper.writeValueAsString(
                Map.of("type", "SUBSCRIBE_THREAD", "threadId", threadId))));
    }

    @Test
    void initRegistersWithThreadStore() {
        handler.init();

        verify(threadStore).subscribe(handler);
    }

    @Test
    void subscribeSendsAck() throws Exception {
        subscribe(wsSession, "t1");

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession).sendMessage(captor.capture());
        assertThat(captor.getValue().getPayload()).contains("\"type\":\"SUBSCRIBED\"").contains("\"threadId\":\"t1\"");
    }

    @Test
    void eventGoesOnlyToThreadSubscribers() throws Exception {
        subscribe(wsSession, "t1");
        subscribe(wsSession2, "t2");
        when(wsSession.isOpen()).thenReturn(true);

        handler.onEvent(makeEvent("t1"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession, times(2)).sendMessage(captor.capture());
        String payload = captor.getAllValues().get(1).getPayload();
        assertThat(payload).contains("\"type\":\"EVENT\"").contains("\"threadId\":\"t1\"").contains("hello");
        verify(wsSession2, times(1)).sendMessage(any());
    }

    @Test
    void closedSessionStopsReceiving() throws Exception {
        subscribe(wsSession, "t1");
        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        handler.onEvent(makeEvent("t1"));

        verify(wsSession, times(1)).sendMessage(any());
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception {
        subscribe(wsSession, "t1");
        handler.handleTextMessage(wsSession, new TextMessage(objectMapper.writeValueAsString(
                Map.of("type", "UNSUBSCRIBE", "threadId", "t1"))));

        handler.onEvent(makeEvent("t1"));

        verify(wsSession, times(1)).sendMessage(any());
    }
}
