package com.herotasks.realtime.service;

import com.herotasks.realtime.domain.Connection;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import com.herotasks.realtime.domain.HandshakeDecision;
import com.herotasks.realtime.domain.HandshakeInfo;
import com.herotasks.realtime.support.RealtimeFixture;
import com.herotasks.realtime.support.RecordingConnectionHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class LifecycleControllerTest {

    private final RealtimeFixture fixture = new RealtimeFixture();

    private ScheduledExecutorService heartbeatScheduler;
    private ScheduledFuture<?> heartbeatFuture;
    private ExecutorService inboxExecutor;
    private LifecycleController lifecycle;

    @BeforeEach
    void setUp() {
        heartbeatScheduler = mock(ScheduledExecutorService.class);
        heartbeatFuture = mock(ScheduledFuture.class);
        doReturn(heartbeatFuture).when(heartbeatScheduler)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        inboxExecutor = Executors.newCachedThreadPool();
        lifecycle = fixture.lifecycle(heartbeatScheduler, inboxExecutor);
    }

    @AfterEach
    void tearDown() {
        lifecycle.shutdown();
        inboxExecutor.shutdownNow();
    }

    private Runnable capturedHeartbeat() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(heartbeatScheduler).scheduleAtFixedRate(task.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        return task.getValue();
    }

    @Test
    void acceptsValidToken() {
        String token = fixture.securityValidator.generateToken("alice");

        HandshakeDecision decision = lifecycle.accept(HandshakeInfo.builder()
                .queryParam("token", token)
                .queryParam("userId", "alice")
                .build());

        assertThat(decision.isAccepted()).isTrue();
        assertThat(decision.getUserId()).isEqualTo("alice");
    }

    @Test
    void acceptsBearerHeader() {
        String token = fixture.securityValidator.generateToken("alice");

        HandshakeDecision decision = lifecycle.accept(HandshakeInfo.builder()
                .header("authorization", List.of("Bearer " + token))
                .build());

        assertThat(decision.isAccepted()).isTrue();
        assertThat(decision.getUserId()).isEqualTo("alice");
    }

    @Test
    void rejectsMissingOrInvalidTokenWithoutState() {
        HandshakeDecision missing = lifecycle.accept(HandshakeInfo.builder().queryParam("userId", "alice").build());
        HandshakeDecision invalid = lifecycle.accept(HandshakeInfo.builder()
                .queryParam("token", "forged")
                .queryParam("userId", "alice")
                .build());

        assertThat(missing.isAccepted()).isFalse();
        assertThat(missing.getReason()).isEqualTo("missing token");
        assertThat(invalid.isAccepted()).isFalse();
        assertThat(invalid.getReason()).isEqualTo("invalid token");
        assertThat(fixture.registry.size()).isZero();
        assertThat(lifecycle.managedConnectionCount()).isZero();
    }

    @Test
    void openRegistersWelcomesAndAnnounces() {
        RecordingConnectionHandle bob = fixture.handle("ws-bob");
        lifecycle.open("bob", bob);
        bob.clear();

        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        Connection connection = lifecycle.open("alice", alice);

        assertThat(connection.getUserId()).isEqualTo("alice");
        assertThat(alice.envelopes(EnvelopeType.USER_JOINED))
                .singleElement()
                .satisfies(e -> assertThat(e.getData()).containsEntry("userId", "alice").containsEntry("connectedCount", 2));
        assertThat(bob.envelopes(EnvelopeType.USER_JOINED))
                .singleElement()
                .extracting(Envelope::getUserId)
                .isEqualTo("alice");
        assertThat(fixture.metrics.getActiveConnections()).isEqualTo(2);
    }

    @Test
    void heartbeatPingsEveryIntervalAndStopsOnClose() {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        lifecycle.open("alice", alice);
        verify(heartbeatScheduler).scheduleAtFixedRate(any(Runnable.class), eq(30_000L), eq(30_000L),
                eq(TimeUnit.MILLISECONDS));

        // 65 seconds of fixed-rate ticks
        Runnable heartbeat = capturedHeartbeat();
        heartbeat.run();
        heartbeat.run();

        assertThat(alice.envelopes(EnvelopeType.PING)).hasSize(2);

        alice.simulateClose();

        verify(heartbeatFuture).cancel(false);
        assertThat(fixture.registry.contains("alice")).isFalse();
    }

    @Test
    void failedHeartbeatTearsDownConnection() {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        lifecycle.open("alice", alice);
        alice.failSends();

        capturedHeartbeat().run();

        assertThat(fixture.registry.contains("alice")).isFalse();
        assertThat(lifecycle.managedConnectionCount()).isZero();
        assertThat(alice.isOpen()).isFalse();
    }

    @Test
    void closeReleasesRoomsAndAnnouncesDeparture() {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        RecordingConnectionHandle bob = fixture.handle("ws-bob");
        lifecycle.open("alice", alice);
        lifecycle.open("bob", bob);
        fixture.rooms.join("T1", "alice");
        fixture.rooms.join("T1", "bob");
        fixture.rooms.join("T2", "alice");
        bob.clear();

        alice.simulateClose();

        assertThat(fixture.registry.contains("alice")).isFalse();
        assertThat(fixture.rooms.members("T1")).containsExactly("bob");
        assertThat(fixture.rooms.exists("T2")).isFalse();
        assertThat(bob.envelopes(EnvelopeType.USER_LEFT))
                .extracting(Envelope::getTaskId)
                .containsExactlyInAnyOrder("T1", null);
        assertThat(fixture.metrics.getActiveConnections()).isEqualTo(1);
    }

    @Test
    void closeAndErrorTogetherTearDownOnce() {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        RecordingConnectionHandle bob = fixture.handle("ws-bob");
        lifecycle.open("alice", alice);
        lifecycle.open("bob", bob);
        bob.clear();

        alice.simulateError(new IllegalStateException("reset"));
        alice.simulateClose();
        lifecycle.teardown(alice);

        assertThat(bob.envelopes(EnvelopeType.USER_LEFT)).hasSize(1);
        assertThat(fixture.meterRegistry.counter("realtime.disconnections").count()).isEqualTo(1.0);
        verify(heartbeatFuture, times(1)).cancel(false);
    }

    @Test
    void secondDeviceKeepsUserPresent() {
        RecordingConnectionHandle bob = fixture.handle("ws-bob");
        lifecycle.open("bob", bob);
        RecordingConnectionHandle phone = fixture.handle("ws-alice-phone");
        RecordingConnectionHandle laptop = fixture.handle("ws-alice-laptop");
        lifecycle.open("alice", phone);
        fixture.rooms.join("T1", "alice");
        bob.clear();

        lifecycle.open("alice", laptop);
        assertThat(bob.envelopes(EnvelopeType.USER_JOINED)).isEmpty();
        assertThat(laptop.envelopes(EnvelopeType.USER_JOINED)).hasSize(1);

        phone.simulateClose();
        assertThat(fixture.registry.contains("alice")).isTrue();
        assertThat(fixture.rooms.members("T1")).contains("alice");
        assertThat(bob.envelopes(EnvelopeType.USER_LEFT)).isEmpty();

        laptop.simulateClose();
        assertThat(fixture.registry.contains("alice")).isFalse();
        assertThat(fixture.rooms.exists("T1")).isFalse();
        assertThat(bob.envelopes(EnvelopeType.USER_LEFT)).hasSize(1);
    }

    @Test
    void inboundFramesReachDispatcher() throws Exception {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        lifecycle.open("alice", alice);
        int framesBefore = alice.rawFrames().size();

        alice.receive("{\"type\":\"ping\"}");

        assertThat(alice.awaitFrames(framesBefore + 1, 5_000)).isTrue();
        assertThat(alice.envelopes(EnvelopeType.PONG)).hasSize(1);
    }

    @Test
    void shutdownClosesEverything() {
        RecordingConnectionHandle alice = fixture.handle("ws-alice");
        RecordingConnectionHandle bob = fixture.handle("ws-bob");
        lifecycle.open("alice", alice);
        lifecycle.open("bob", bob);

        lifecycle.shutdown();

        assertThat(fixture.registry.size()).isZero();
        assertThat(lifecycle.managedConnectionCount()).isZero();
        assertThat(alice.isOpen()).isFalse();
        assertThat(bob.isOpen()).isFalse();
    }
}
