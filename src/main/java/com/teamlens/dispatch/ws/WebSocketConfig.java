package com.teamlens.dispatch.ws;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the observer endpoint. Observers are not authenticated, so any origin may connect.
 */
@Configuration
@EnableWebSocket
@ConditionalOnWebApplication
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObserverWebSocketHandler handler;
    private final BroadcastProperties properties;

    public WebSocketConfig(ObserverWebSocketHandler handler, BroadcastProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getPath()).setAllowedOrigins("*");
    }
}
