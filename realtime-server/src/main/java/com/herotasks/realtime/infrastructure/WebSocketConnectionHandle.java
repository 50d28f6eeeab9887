package com.herotasks.realtime.infrastructure;

import com.herotasks.realtime.domain.ConnectionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link ConnectionHandle} over a Spring {@link WebSocketSession}.
 * Sends are serialized by {@link ConcurrentWebSocketSessionDecorator}.
 * The WebSocket handler forwards container callbacks through
 * {@link #fireMessage}, {@link #fireClose} and {@link #fireError}.
 */
@Slf4j
public class WebSocketConnectionHandle implements ConnectionHandle {

    private final WebSocketSession rawSession;
    private final WebSocketSession session;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Consumer<byte[]> messageListener = payload -> { };
    private volatile Runnable closeListener = () -> { };
    private volatile Consumer<Throwable> errorListener = error -> { };

    public WebSocketConnectionHandle(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.rawSession = session;
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return rawSession.getId();
    }

    @Override
    public void send(byte[] payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + id() + " is not open");
        }
        session.sendMessage(new TextMessage(new String(payload, StandardCharsets.UTF_8)));
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            log.warn("Failed to close WebSocket: wsId={}, error={}", id(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    @Override
    public void onMessage(Consumer<byte[]> listener) {
        this.messageListener = listener;
    }

    @Override
    public void onClose(Runnable listener) {
        this.closeListener = listener;
    }

    @Override
    public void onError(Consumer<Throwable> listener) {
        this.errorListener = listener;
    }

    public void fireMessage(String payload) {
        messageListener.accept(payload.getBytes(StandardCharsets.UTF_8));
    }

    public void fireClose() {
        if (closed.compareAndSet(false, true)) {
            closeListener.run();
        }
    }

    public void fireError(Throwable error) {
        if (closed.compareAndSet(false, true)) {
            errorListener.accept(error);
        }
    }
}
