package com.teamlens.dispatch.ws;

import java.io.IOException;

/**
 * Transport to one connected observer. Implementations need not be thread-safe for
 * {@link #send(String)}; {@link ObserverConnection} never sends concurrently on one channel.
 */
public interface ObserverChannel {

    String id();

    boolean isOpen();

    void send(String json) throws IOException;

    void close();
}
