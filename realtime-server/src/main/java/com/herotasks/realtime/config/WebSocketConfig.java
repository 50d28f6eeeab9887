package com.herotasks.realtime.config;

import com.herotasks.realtime.handler.TaskWebSocketHandler;
import com.herotasks.realtime.handler.TokenHandshakeInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TaskWebSocketHandler taskWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
    private final RealtimeProperties properties;

    public WebSocketConfig(TaskWebSocketHandler taskWebSocketHandler,
                           TokenHandshakeInterceptor tokenHandshakeInterceptor,
                           RealtimeProperties properties) {
        this.taskWebSocketHandler = taskWebSocketHandler;
        this.tokenHandshakeInterceptor = tokenHandshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(taskWebSocketHandler, properties.getEndpoint())
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
