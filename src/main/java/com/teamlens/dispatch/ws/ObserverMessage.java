package com.teamlens.dispatch.ws;

import java.time.Instant;

/**
 * Envelope of every server-to-observer message.
 *
 * @param type      message kind
 * @param payload   kind-specific body
 * @param timestamp ISO-8601 send time
 */
public record ObserverMessage(
    ObserverMessageType type,
    Object payload,
    String timestamp
) {

    public static ObserverMessage of(ObserverMessageType type, Object payload) {
        return new ObserverMessage(type, payload, Instant.now().toString());
    }
}
