package com.herotasks.realtime.controller;

import com.herotasks.realtime.domain.BusState;
import com.herotasks.realtime.infrastructure.ConnectionRegistry;
import com.herotasks.realtime.infrastructure.FanoutBridge;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final FanoutBridge fanoutBridge;
    private final ConnectionRegistry connectionRegistry;

    public HealthController(FanoutBridge fanoutBridge, ConnectionRegistry connectionRegistry) {
        this.fanoutBridge = fanoutBridge;
        this.connectionRegistry = connectionRegistry;
    }

    /**
     * A degraded bus still reports healthy: local delivery keeps working.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        BusState busState = fanoutBridge.getState();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("instanceId", fanoutBridge.getInstanceId());
        response.put("bus", busState.name().toLowerCase());
        response.put("mode", busState == BusState.CONNECTED ? "distributed" : "local");
        response.put("connections", connectionRegistry.size());
        return response;
    }
}
