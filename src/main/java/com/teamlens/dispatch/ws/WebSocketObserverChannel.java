package com.teamlens.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ObserverChannel} over a Spring {@link WebSocketSession}.
 */
class WebSocketObserverChannel implements ObserverChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketObserverChannel.class);

    private final WebSocketSession session;

    WebSocketObserverChannel(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }
}
