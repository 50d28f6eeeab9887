package com.herotasks.realtime.handler;

import com.herotasks.realtime.domain.HandshakeDecision;
import com.herotasks.realtime.domain.HandshakeInfo;
import com.herotasks.realtime.service.LifecycleController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Refuses the upgrade (HTTP 401) unless the request carries a valid token.
 * The authenticated user id is handed to the WebSocket handler through the
 * session attributes.
 */
@Slf4j
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ID_ATTRIBUTE = "realtime.userId";

    private final LifecycleController lifecycleController;

    public TokenHandshakeInterceptor(LifecycleController lifecycleController) {
        this.lifecycleController = lifecycleController;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        HandshakeDecision decision = lifecycleController.accept(toHandshakeInfo(request));
        if (!decision.isAccepted()) {
            log.info("Upgrade refused: uri={}, reason={}", request.getURI().getPath(), decision.getReason());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ID_ATTRIBUTE, decision.getUserId());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("Handshake failed: uri={}, error={}", request.getURI().getPath(), exception.getMessage());
        }
    }

    static HandshakeInfo toHandshakeInfo(ServerHttpRequest request) {
        HandshakeInfo.HandshakeInfoBuilder builder = HandshakeInfo.builder();

        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams();
        query.forEach((name, values) -> {
            if (!values.isEmpty() && values.get(0) != null) {
                builder.queryParam(name, UriUtils.decode(values.get(0), StandardCharsets.UTF_8));
            }
        });

        request.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
