package com.herotasks.realtime.handler;

import com.herotasks.realtime.config.RealtimeProperties;
import com.herotasks.realtime.infrastructure.WebSocketConnectionHandle;
import com.herotasks.realtime.service.LifecycleController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring WebSocket callbacks to {@link WebSocketConnectionHandle}
 * events; all behaviour lives in {@link LifecycleController}.
 */
@Slf4j
@Component
public class TaskWebSocketHandler extends TextWebSocketHandler {

    private static final String HANDLE_ATTRIBUTE = "realtime.handle";

    private final LifecycleController lifecycleController;
    private final RealtimeProperties properties;

    public TaskWebSocketHandler(LifecycleController lifecycleController, RealtimeProperties properties) {
        this.lifecycleController = lifecycleController;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String userId = (String) wsSession.getAttributes().get(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE);
        if (userId == null) {
            log.warn("Connection without authenticated user, closing: wsId={}", wsSession.getId());
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(
                wsSession,
                properties.getSend().getTimeLimitMs(),
                properties.getSend().getBufferSizeLimit());
        wsSession.getAttributes().put(HANDLE_ATTRIBUTE, handle);

        try {
            lifecycleController.open(userId, handle);
        } catch (Exception e) {
            log.error("Error establishing connection: userId={}, wsId={}", userId, wsSession.getId(), e);
            handle.fireError(e);
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        WebSocketConnectionHandle handle = handleOf(wsSession);
        if (handle == null) {
            log.warn("Message on unknown connection dropped: wsId={}", wsSession.getId());
            return;
        }
        handle.fireMessage(message.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        log.info("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
        WebSocketConnectionHandle handle = handleOf(wsSession);
        if (handle != null) {
            handle.fireClose();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
        WebSocketConnectionHandle handle = handleOf(wsSession);
        if (handle != null) {
            handle.fireError(exception);
        }
    }

    private WebSocketConnectionHandle handleOf(WebSocketSession wsSession) {
        return (WebSocketConnectionHandle) wsSession.getAttributes().get(HANDLE_ATTRIBUTE);
    }
}
