package com.herotasks.realtime.infrastructure;

import com.herotasks.realtime.domain.Connection;
import com.herotasks.realtime.support.RealtimeFixture;
import com.herotasks.realtime.support.RecordingConnectionHandle;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final RealtimeFixture fixture = new RealtimeFixture();

    @Test
    void registerCreatesConnection() {
        ConnectionRegistry registry = new ConnectionRegistry();
        RecordingConnectionHandle handle = fixture.handle("ws-1");

        Connection connection = registry.register("alice", handle);

        assertThat(connection.getUserId()).isEqualTo("alice");
        assertThat(connection.getHandles()).containsExactly(handle);
        assertThat(registry.get("alice")).containsSame(connection);
        assertThat(registry.connectedUserIds()).containsExactly("alice");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void secondDeviceJoinsExistingConnection() {
        ConnectionRegistry registry = new ConnectionRegistry();
        RecordingConnectionHandle phone = fixture.handle("ws-phone");
        RecordingConnectionHandle laptop = fixture.handle("ws-laptop");

        registry.register("alice", phone);
        Connection connection = registry.register("alice", laptop);

        assertThat(connection.getHandles()).containsExactlyInAnyOrder(phone, laptop);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void detachReportsLastHandle() {
        ConnectionRegistry registry = new ConnectionRegistry();
        RecordingConnectionHandle phone = fixture.handle("ws-phone");
        RecordingConnectionHandle laptop = fixture.handle("ws-laptop");
        registry.register("alice", phone);
        registry.register("alice", laptop);

        assertThat(registry.detach("alice", phone)).isFalse();
        assertThat(registry.contains("alice")).isTrue();

        assertThat(registry.detach("alice", laptop)).isTrue();
        assertThat(registry.contains("alice")).isFalse();
        assertThat(registry.detach("alice", laptop)).isFalse();
    }

    @Test
    void removeIsIdempotent() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.register("alice", fixture.handle("ws-1"));

        registry.remove("alice");
        registry.remove("alice");
        registry.remove("nobody");

        assertThat(registry.get("alice")).isEmpty();
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void touchUpdatesLastSeen() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-01-01T10:00:00Z"));
        Clock clock = new Clock() {
            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(java.time.ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        ConnectionRegistry registry = new ConnectionRegistry(clock);
        Connection connection = registry.register("alice", fixture.handle("ws-1"));
        assertThat(connection.getLastSeenAt()).isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));

        now.set(Instant.parse("2026-01-01T10:00:30Z"));
        registry.touch("alice");
        registry.touch("nobody");

        assertThat(connection.getLastSeenAt()).isEqualTo(Instant.parse("2026-01-01T10:00:30Z"));
        assertThat(connection.getConnectedAt()).isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void detachRunsHookOnlyForLastHandle() {
        ConnectionRegistry registry = new ConnectionRegistry();
        RecordingConnectionHandle phone = fixture.handle("ws-phone");
        RecordingConnectionHandle laptop = fixture.handle("ws-laptop");
        registry.register("alice", phone);
        registry.register("alice", laptop);
        AtomicInteger hookRuns = new AtomicInteger();

        assertThat(registry.detach("alice", phone, hookRuns::incrementAndGet)).isFalse();
        assertThat(hookRuns).hasValue(0);

        assertThat(registry.detach("alice", laptop, hookRuns::incrementAndGet)).isTrue();
        assertThat(hookRuns).hasValue(1);
        assertThat(registry.contains("alice")).isFalse();

        assertThat(registry.detach("alice", laptop, hookRuns::incrementAndGet)).isFalse();
        assertThat(hookRuns).hasValue(1);
    }

    @Test
    void ifConnectedRunsOnlyForRegisteredUser() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.register("alice", fixture.handle("ws-1"));
        AtomicReference<String> seen = new AtomicReference<>();

        assertThat(registry.ifConnected("bob", c -> seen.set(c.getUserId()))).isFalse();
        assertThat(seen.get()).isNull();

        assertThat(registry.ifConnected("alice", c -> seen.set(c.getUserId()))).isTrue();
        assertThat(seen).hasValue("alice");
        assertThat(registry.contains("alice")).isTrue();
    }
}
