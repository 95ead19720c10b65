package com.teamlens.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Connects WebSocket sessions to the {@link BroadcastHub}. Every inbound text frame is
 * treated as one observer request.
 */
@Component
@ConditionalOnWebApplication
public class ObserverWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ObserverWebSocketHandler.class);

    private final BroadcastHub hub;

    public ObserverWebSocketHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        hub.register(new WebSocketObserverChannel(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        hub.handleRequest(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on observer {}: {}", session.getId(), exception.getMessage());
        hub.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.unregister(session.getId());
    }
}
