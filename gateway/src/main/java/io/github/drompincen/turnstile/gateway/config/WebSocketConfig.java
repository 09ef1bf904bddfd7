package io.github.drompincen.turnstile.gateway.config;

import io.github.drompincen.turnstile.gateway.websocket.ThreadEventSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ThreadEventSocketHandler eventStream;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(ThreadEventSocketHandler eventStream,
                           @Value("${turnstile.websocket.path:/ws}") String path,
                           @Value("${turnstile.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.eventStream = eventStream;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(eventStream, path).setAllowedOrigins(allowedOrigins);
    }
}
