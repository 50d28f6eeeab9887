package com.herotasks.realtime.service;

import com.herotasks.realtime.domain.ConnectionHandle;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import com.herotasks.realtime.infrastructure.ConnectionRegistry;
import com.herotasks.realtime.infrastructure.EnvelopeCodec;
import com.herotasks.realtime.infrastructure.InvalidEnvelopeException;
import com.herotasks.realtime.infrastructure.LocalBroadcaster;
import com.herotasks.realtime.infrastructure.RoomManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;

/**
 * Routes inbound client envelopes.
 *
 * The sender is always the connection's user; a {@code userId} inside the
 * envelope is ignored. Malformed frames and unsupported types are logged
 * and dropped without touching registry or room state, and never close
 * the connection.
 */
@Service
@Slf4j
public class EnvelopeDispatcher {

    private final EnvelopeCodec codec;
    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final BroadcastService broadcastService;
    private final LocalBroadcaster localBroadcaster;
    private final MetricsService metricsService;

    public EnvelopeDispatcher(EnvelopeCodec codec,
                              ConnectionRegistry connectionRegistry,
                              RoomManager roomManager,
                              BroadcastService broadcastService,
                              LocalBroadcaster localBroadcaster,
                              MetricsService metricsService) {
        this.codec = codec;
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.broadcastService = broadcastService;
        this.localBroadcaster = localBroadcaster;
        this.metricsService = metricsService;
    }

    public void handle(byte[] raw, String userId) {
        handle(raw, userId, null);
    }

    /**
     * @param sender the handle the frame arrived on; replies go there when present
     */
    public void handle(byte[] raw, String userId, ConnectionHandle sender) {
        Envelope envelope;
        try {
            envelope = codec.decode(raw);
        } catch (InvalidEnvelopeException e) {
            metricsService.recordMessageDropped("malformed");
            log.warn("Dropping malformed message: userId={}, error={}", userId, e.getMessage());
            return;
        }

        EnvelopeType type = envelope.getType();
        metricsService.recordMessageReceived(type.getWireName());

        switch (type) {
            case PONG -> connectionRegistry.touch(userId);
            case PING -> handlePing(userId, sender);
            case TYPING -> handleTyping(envelope, userId);
            case JOIN_TASK -> handleJoinTask(envelope, userId);
            case LEAVE_TASK -> handleLeaveTask(envelope, userId);
            default -> {
                metricsService.recordMessageDropped("unsupported_type");
                log.warn("Unsupported message type: userId={}, type={}", userId, type.getWireName());
            }
        }
    }

    private void handlePing(String userId, ConnectionHandle sender) {
        connectionRegistry.touch(userId);
        if (sender != null) {
            localBroadcaster.toHandle(sender, Envelope.pong());
        } else {
            localBroadcaster.toUser(userId, Envelope.pong());
        }
    }

    private void handleTyping(Envelope envelope, String userId) {
        String taskId = requireTaskId(envelope, userId);
        if (taskId == null) {
            return;
        }
        broadcastService.broadcastPresenceUpdate(EnvelopeType.TYPING, envelope.getData(), userId, taskId);
    }

    private void handleJoinTask(Envelope envelope, String userId) {
        String taskId = requireTaskId(envelope, userId);
        if (taskId == null) {
            return;
        }
        // Held against teardown of the same user, so a room never outlives its member
        boolean joined = connectionRegistry.ifConnected(userId, connection -> {
            roomManager.join(taskId, userId);
            connection.setCurrentTaskId(taskId);
        });
        if (!joined) {
            log.warn("Join from unregistered user ignored: userId={}, taskId={}", userId, taskId);
            return;
        }

        broadcastService.broadcastPresenceUpdate(EnvelopeType.USER_JOINED,
                Map.of("userId", userId, "taskId", taskId), userId, taskId);

        log.info("User joined task: userId={}, taskId={}, members={}",
                userId, taskId, roomManager.members(taskId).size());
    }

    private void handleLeaveTask(Envelope envelope, String userId) {
        String taskId = requireTaskId(envelope, userId);
        if (taskId == null) {
            return;
        }

        roomManager.leave(taskId, userId);
        connectionRegistry.get(userId).ifPresent(connection -> {
            if (Objects.equals(connection.getCurrentTaskId(), taskId)) {
                connection.setCurrentTaskId(null);
            }
        });

        broadcastService.broadcastPresenceUpdate(EnvelopeType.USER_LEFT,
                Map.of("userId", userId, "taskId", taskId), userId, taskId);

        log.info("User left task: userId={}, taskId={}", userId, taskId);
    }

    private String requireTaskId(Envelope envelope, String userId) {
        String taskId = envelope.getTaskId();
        if (taskId == null || taskId.isBlank()) {
            metricsService.recordMessageDropped("missing_task_id");
            log.warn("Dropping {} without taskId: userId={}", envelope.getType().getWireName(), userId);
            return null;
        }
        return taskId;
    }
}
