package com.herotasks.realtime.infrastructure;

import com.herotasks.realtime.domain.BusMessage;
import com.herotasks.realtime.domain.Connection;
import com.herotasks.realtime.domain.ConnectionHandle;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Same-process delivery. Every fan-out completes before the call returns;
 * a failed send to one handle is logged and does not stop the others.
 * Nothing here touches the bus.
 */
@Component
@Slf4j
public class LocalBroadcaster {

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final EnvelopeCodec codec;
    private final MetricsService metricsService;

    public LocalBroadcaster(ConnectionRegistry connectionRegistry,
                            RoomManager roomManager,
                            EnvelopeCodec codec,
                            MetricsService metricsService) {
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.codec = codec;
        this.metricsService = metricsService;
    }

    public int toAll(Envelope envelope, String excludeUserId) {
        return deliver(envelope, new LinkedHashSet<>(connectionRegistry.connectedUserIds()), excludeUserId);
    }

    public int toRoom(String taskId, Envelope envelope, String excludeUserId) {
        Set<String> members = roomManager.members(taskId);
        if (members.isEmpty()) {
            log.debug("No room for task, skipping broadcast: taskId={}, type={}", taskId, envelope.getType());
            return 0;
        }
        return deliver(envelope, new LinkedHashSet<>(members), excludeUserId);
    }

    /**
     * Everyone connected plus the task room, each recipient once.
     */
    public int toAllAndRoom(String taskId, Envelope envelope, String excludeUserId) {
        Set<String> recipients = new LinkedHashSet<>(connectionRegistry.connectedUserIds());
        if (taskId != null) {
            recipients.addAll(roomManager.members(taskId));
        }
        return deliver(envelope, recipients, excludeUserId);
    }

    public int toUser(String userId, Envelope envelope) {
        return deliver(envelope, Set.of(userId), null);
    }

    public boolean toHandle(ConnectionHandle handle, Envelope envelope) {
        boolean sent = send(handle, codec.encode(envelope), envelope);
        if (sent) {
            metricsService.recordMessagesSent(envelope.getType().getWireName(), 1);
        }
        return sent;
    }

    /**
     * Replays a delivery received from another instance.
     */
    public int replay(BusMessage message) {
        Envelope envelope = message.getEnvelope();
        switch (message.getScope()) {
            case ALL:
                return toAll(envelope, message.getExcludeUserId());
            case ROOM:
                return toRoom(message.getTaskId(), envelope, message.getExcludeUserId());
            case ALL_AND_ROOM:
                return toAllAndRoom(message.getTaskId(), envelope, message.getExcludeUserId());
            default:
                log.warn("Unsupported bus scope: {}", message.getScope());
                return 0;
        }
    }

    private int deliver(Envelope envelope, Set<String> userIds, String excludeUserId) {
        byte[] payload = codec.encode(envelope);
        int delivered = 0;

        for (String userId : userIds) {
            if (Objects.equals(userId, excludeUserId)) {
                continue;
            }
            Connection connection = connectionRegistry.get(userId).orElse(null);
            if (connection == null) {
                log.debug("Skipping member without a live connection: userId={}", userId);
                continue;
            }
            for (ConnectionHandle handle : connection.getHandles()) {
                if (send(handle, payload, envelope)) {
                    delivered++;
                }
            }
        }

        if (delivered > 0) {
            metricsService.recordMessagesSent(envelope.getType().getWireName(), delivered);
        }
        log.debug("Broadcast delivered: type={}, taskId={}, recipients={}",
                envelope.getType(), envelope.getTaskId(), delivered);
        return delivered;
    }

    private boolean send(ConnectionHandle handle, byte[] payload, Envelope envelope) {
        if (!handle.isOpen()) {
            return false;
        }
        try {
            handle.send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send envelope: wsId={}, type={}, error={}",
                    handle.id(), envelope.getType(), e.getMessage());
            return false;
        }
    }
}
