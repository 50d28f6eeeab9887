package com.herotasks.realtime.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-backed counters for the realtime server.
 *
 * Counters are tagged by message type or outcome; the active connection
 * gauge tracks distinct connected users on this instance.
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("realtime.connections.active", activeConnections, AtomicInteger::get)
                .description("Distinct users connected to this instance")
                .register(registry);
    }

    // ===== Connection lifecycle =====

    public void recordConnection(String userId, boolean accepted) {
        registry.counter("realtime.connections", Tags.of("outcome", accepted ? "accepted" : "rejected"))
                .increment();
        log.debug("📥 WebSocket connection: userId={}, accepted={}", userId, accepted);
    }

    public void recordDisconnection(String userId) {
        registry.counter("realtime.disconnections").increment();
        log.debug("📤 WebSocket disconnection: userId={}", userId);
    }

    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    public void recordAuthenticationAttempt(boolean success) {
        registry.counter("realtime.auth.attempts", Tags.of("result", success ? "success" : "failure"))
                .increment();
        log.debug("🔐 Auth attempt: success={}", success);
    }

    // ===== Messages =====

    public void recordMessageReceived(String messageType) {
        registry.counter("realtime.messages.received", Tags.of("type", messageType)).increment();
    }

    public void recordMessagesSent(String messageType, int recipients) {
        registry.counter("realtime.messages.sent", Tags.of("type", messageType)).increment(recipients);
    }

    public void recordMessageDropped(String reason) {
        registry.counter("realtime.messages.dropped", Tags.of("reason", reason)).increment();
    }

    // ===== Bus =====

    public void recordBusPublish(String channel, boolean success) {
        registry.counter("realtime.bus.publish", Tags.of("channel", channel, "result", success ? "success" : "failure"))
                .increment();
    }

    public void recordBusReceived(String channel) {
        registry.counter("realtime.bus.received", Tags.of("channel", channel)).increment();
    }

    public void recordError(String errorType, String component) {
        registry.counter("realtime.errors", Tags.of("type", errorType, "component", component)).increment();
        log.warn("⚠️ Error: type={}, component={}", errorType, component);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
