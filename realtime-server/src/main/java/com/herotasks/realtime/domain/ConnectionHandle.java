package com.herotasks.realtime.domain;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Capability a transport must provide for one open client connection.
 * Registry, dispatcher and broadcaster depend only on this interface.
 */
public interface ConnectionHandle {

    String id();

    void send(byte[] payload) throws IOException;

    void close();

    boolean isOpen();

    void onMessage(Consumer<byte[]> listener);

    void onClose(Runnable listener);

    void onError(Consumer<Throwable> listener);
}
