package com.herotasks.realtime.service;

import com.herotasks.realtime.domain.BusChannel;
import com.herotasks.realtime.domain.BusMessage;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import com.herotasks.realtime.infrastructure.FanoutBridge;
import com.herotasks.realtime.infrastructure.LocalBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for pushing events to clients.
 *
 * Every call delivers to local connections first and then publishes the same
 * envelope on the bus for the other instances. Publishing is best-effort: a
 * bus failure is logged by the bridge and never undoes or fails local delivery.
 */
@Service
@Slf4j
public class BroadcastService {

    private final LocalBroadcaster localBroadcaster;
    private final FanoutBridge fanoutBridge;

    public BroadcastService(LocalBroadcaster localBroadcaster, FanoutBridge fanoutBridge) {
        this.localBroadcaster = localBroadcaster;
        this.fanoutBridge = fanoutBridge;
    }

    /**
     * Task content change: every connected user except {@code userId}, plus
     * the members of the task room when {@code taskId} is given. A user in
     * both sets receives the envelope once.
     */
    public Envelope broadcastTaskUpdate(EnvelopeType eventType,
                                        Map<String, Object> data,
                                        String userId,
                                        String taskId) {
        if (eventType == null || !eventType.isTaskEvent()) {
            throw new IllegalArgumentException("Not a task event type: " + eventType);
        }

        Envelope envelope = Envelope.of(eventType, data, userId, taskId);
        int delivered = localBroadcaster.toAllAndRoom(taskId, envelope, userId);

        fanoutBridge.publish(BusChannel.TASK_UPDATES, BusMessage.builder()
                .scope(BusMessage.Scope.ALL_AND_ROOM)
                .excludeUserId(userId)
                .taskId(taskId)
                .envelope(envelope)
                .build());

        log.info("Task update broadcast: type={}, taskId={}, userId={}, localRecipients={}",
                eventType.getWireName(), taskId, userId, delivered);
        return envelope;
    }

    /**
     * Presence or typing signal scoped to one task room, excluding {@code userId}.
     */
    public Envelope broadcastPresenceUpdate(EnvelopeType eventType,
                                            Map<String, Object> data,
                                            String userId,
                                            String taskId) {
        if (eventType == null || !eventType.isPresenceEvent()) {
            throw new IllegalArgumentException("Not a presence event type: " + eventType);
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Presence update requires a taskId");
        }

        Envelope envelope = Envelope.of(eventType, data, userId, taskId);
        int delivered = localBroadcaster.toRoom(taskId, envelope, userId);

        fanoutBridge.publish(BusChannel.PRESENCE, BusMessage.builder()
                .scope(BusMessage.Scope.ROOM)
                .excludeUserId(userId)
                .taskId(taskId)
                .envelope(envelope)
                .build());

        log.debug("Presence update broadcast: type={}, taskId={}, userId={}, localRecipients={}",
                eventType.getWireName(), taskId, userId, delivered);
        return envelope;
    }

    /**
     * Server-wide presence (connect/disconnect), to everyone except {@code userId}.
     */
    public void broadcastGlobalPresence(Envelope envelope, String userId) {
        int delivered = localBroadcaster.toAll(envelope, userId);

        fanoutBridge.publish(BusChannel.PRESENCE, BusMessage.builder()
                .scope(BusMessage.Scope.ALL)
                .excludeUserId(userId)
                .envelope(envelope)
                .build());

        log.debug("Global presence broadcast: type={}, userId={}, localRecipients={}",
                envelope.getType().getWireName(), userId, delivered);
    }
}
