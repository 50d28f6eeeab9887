package com.herotasks.realtime.service;

import com.herotasks.realtime.config.RealtimeProperties;
import com.herotasks.realtime.domain.Connection;
import com.herotasks.realtime.domain.ConnectionHandle;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import com.herotasks.realtime.domain.HandshakeDecision;
import com.herotasks.realtime.domain.HandshakeInfo;
import com.herotasks.realtime.infrastructure.ConnectionInbox;
import com.herotasks.realtime.infrastructure.ConnectionRegistry;
import com.herotasks.realtime.infrastructure.LocalBroadcaster;
import com.herotasks.realtime.infrastructure.RoomManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns a connection from handshake to teardown: token check, registration
 * and welcome, heartbeat, inbound queue, and the departure announcements.
 */
@Service
@Slf4j
public class LifecycleController {

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final LocalBroadcaster localBroadcaster;
    private final BroadcastService broadcastService;
    private final EnvelopeDispatcher dispatcher;
    private final SecurityValidator securityValidator;
    private final MetricsService metricsService;
    private final ScheduledExecutorService heartbeatScheduler;
    private final ExecutorService inboxExecutor;
    private final RealtimeProperties properties;

    private static final int USER_LOCK_STRIPES = 64;

    // handle id -> per-connection resources
    private final Map<String, ManagedConnection> managed = new ConcurrentHashMap<>();

    // Serializes arrival and departure of the same user, announcements included
    private final Object[] userLocks = new Object[USER_LOCK_STRIPES];

    public LifecycleController(ConnectionRegistry connectionRegistry,
                               RoomManager roomManager,
                               LocalBroadcaster localBroadcaster,
                               BroadcastService broadcastService,
                               EnvelopeDispatcher dispatcher,
                               SecurityValidator securityValidator,
                               MetricsService metricsService,
                               @Qualifier("heartbeatScheduler") ScheduledExecutorService heartbeatScheduler,
                               @Qualifier("inboxExecutor") ExecutorService inboxExecutor,
                               RealtimeProperties properties) {
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.localBroadcaster = localBroadcaster;
        this.broadcastService = broadcastService;
        this.dispatcher = dispatcher;
        this.securityValidator = securityValidator;
        this.metricsService = metricsService;
        this.heartbeatScheduler = heartbeatScheduler;
        this.inboxExecutor = inboxExecutor;
        this.properties = properties;
        for (int i = 0; i < USER_LOCK_STRIPES; i++) {
            userLocks[i] = new Object();
        }
    }

    /**
     * Decides whether an upgrade request may become a connection.
     * Nothing is registered here; rejection leaves no state behind.
     */
    public HandshakeDecision accept(HandshakeInfo handshake) {
        String claimedUserId = handshake.claimedUserId();
        String token = handshake.token();

        if (token == null) {
            log.warn("Handshake rejected, no token: claimedUserId={}", claimedUserId);
            metricsService.recordConnection(claimedUserId, false);
            return HandshakeDecision.reject("missing token");
        }

        Optional<String> userId = securityValidator.authenticate(token, claimedUserId);
        if (userId.isEmpty()) {
            log.warn("Handshake rejected, invalid token: claimedUserId={}", claimedUserId);
            metricsService.recordConnection(claimedUserId, false);
            return HandshakeDecision.reject("invalid token");
        }

        return HandshakeDecision.accept(userId.get());
    }

    /**
     * Registers an accepted connection, welcomes it, announces the user when
     * this is their first device, and starts its heartbeat and inbox.
     */
    public Connection open(String userId, ConnectionHandle handle) {
        ConnectionInbox inbox = new ConnectionInbox(
                userId,
                handle.id(),
                properties.getInbox().getCapacity(),
                properties.getInbox().getOfferTimeout(),
                frame -> dispatcher.handle(frame, userId, handle));

        handle.onMessage(inbox::offer);
        handle.onClose(() -> teardown(handle));
        handle.onError(error -> {
            log.warn("Connection error: userId={}, wsId={}, error={}", userId, handle.id(), error.getMessage());
            metricsService.recordError("TRANSPORT_ERROR", "LifecycleController");
            teardown(handle);
        });

        Connection connection;
        boolean firstDevice;
        int connectedCount;
        synchronized (lockFor(userId)) {
            connection = connectionRegistry.register(userId, handle);
            firstDevice = connection.getHandles().size() == 1;
            connectedCount = connectionRegistry.size();

            ManagedConnection resources = new ManagedConnection(userId, handle, inbox);
            inbox.start(inboxExecutor);
            resources.heartbeat = scheduleHeartbeat(handle);
            managed.put(handle.id(), resources);

            Envelope welcome = Envelope.userJoined(userId, connectedCount);
            localBroadcaster.toHandle(handle, welcome);
            if (firstDevice) {
                broadcastService.broadcastGlobalPresence(welcome, userId);
            }
        }

        metricsService.recordConnection(userId, true);
        metricsService.setActiveConnections(connectedCount);
        log.info("Connection opened: userId={}, wsId={}, firstDevice={}, connected={}",
                userId, handle.id(), firstDevice, connectedCount);

        // closed before the resources were tracked
        if (!handle.isOpen()) {
            teardown(handle);
        }
        return connection;
    }

    /**
     * Close and error both end here. Safe to call more than once per handle.
     */
    public void teardown(ConnectionHandle handle) {
        ManagedConnection resources = managed.remove(handle.id());
        if (resources == null) {
            return;
        }
        resources.release();
        handle.close();

        String userId = resources.userId;

        boolean removed;
        synchronized (lockFor(userId)) {
            // Rooms are released in the same atomic step that drops the last handle
            List<String> departedRooms = new ArrayList<>();
            removed = connectionRegistry.detach(userId, handle,
                    () -> departedRooms.addAll(roomManager.leaveAll(userId)));

            if (removed) {
                announceRoomDepartures(userId, departedRooms);
                int connectedCount = connectionRegistry.size();
                broadcastService.broadcastGlobalPresence(Envelope.userLeft(userId, connectedCount), userId);
                metricsService.setActiveConnections(connectedCount);
            }
        }

        metricsService.recordDisconnection(userId);
        log.info("Connection closed: userId={}, wsId={}, userGone={}, connected={}",
                userId, handle.id(), removed, connectionRegistry.size());
    }

    public int managedConnectionCount() {
        return managed.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down LifecycleController: open connections={}", managed.size());
        List<ManagedConnection> open = new ArrayList<>(managed.values());
        for (ManagedConnection resources : open) {
            teardown(resources.handle);
        }
    }

    private Object lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), USER_LOCK_STRIPES)];
    }

    private void announceRoomDepartures(String userId, List<String> taskIds) {
        for (String taskId : taskIds) {
            broadcastService.broadcastPresenceUpdate(EnvelopeType.USER_LEFT,
                    Map.of("userId", userId, "taskId", taskId), userId, taskId);
        }
    }

    private ScheduledFuture<?> scheduleHeartbeat(ConnectionHandle handle) {
        long intervalMs = properties.getHeartbeat().getInterval().toMillis();
        return heartbeatScheduler.scheduleAtFixedRate(
                () -> sendPing(handle), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void sendPing(ConnectionHandle handle) {
        try {
            if (!handle.isOpen() || !localBroadcaster.toHandle(handle, Envelope.ping())) {
                log.info("Heartbeat failed, tearing down: wsId={}", handle.id());
                teardown(handle);
            }
        } catch (RuntimeException e) {
            // an exception here would silently cancel the periodic task
            log.error("Heartbeat error: wsId={}", handle.id(), e);
            teardown(handle);
        }
    }

    private static final class ManagedConnection {
        private final String userId;
        private final ConnectionHandle handle;
        private final ConnectionInbox inbox;
        private volatile ScheduledFuture<?> heartbeat;

        private ManagedConnection(String userId, ConnectionHandle handle, ConnectionInbox inbox) {
            this.userId = userId;
            this.handle = handle;
            this.inbox = inbox;
        }

        private void release() {
            ScheduledFuture<?> current = heartbeat;
            if (current != null) {
                current.cancel(false);
            }
            inbox.close();
        }
    }
}
