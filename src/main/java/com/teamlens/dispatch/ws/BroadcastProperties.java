package com.teamlens.dispatch.ws;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Observer broadcast settings, bound from {@code teamlens.broadcast.*}.
 */
@Component
@ConfigurationProperties(prefix = "teamlens.broadcast")
public class BroadcastProperties {

    /** Interval between heartbeat messages. */
    private int heartbeatSeconds = 5;

    /** Outbound messages an observer may have queued before it is dropped. */
    private int maxPendingMessages = 512;

    /** WebSocket endpoint path. */
    private String path = "/ws";

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public void setHeartbeatSeconds(int heartbeatSeconds) {
        this.heartbeatSeconds = heartbeatSeconds;
    }

    public int getMaxPendingMessages() {
        return maxPendingMessages;
    }

    public void setMaxPendingMessages(int maxPendingMessages) {
        this.maxPendingMessages = maxPendingMessages;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
