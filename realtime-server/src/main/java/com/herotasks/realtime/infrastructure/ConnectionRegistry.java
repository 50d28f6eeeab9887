package com.herotasks.realtime.infrastructure;

import com.herotasks.realtime.domain.Connection;
import com.herotasks.realtime.domain.ConnectionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Live connections keyed by user id. A user holds one {@link Connection}
 * with one handle per open device; all mutations are atomic per user.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConnectionRegistry() {
        this(Clock.systemUTC());
    }

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Connection register(String userId, ConnectionHandle handle) {
        Connection connection = connections.compute(userId, (id, existing) -> {
            Connection target = existing != null ? existing : new Connection(id, clock.instant());
            target.attach(handle);
            return target;
        });

        log.info("Connection registered: userId={}, wsId={}, devices={}, total={}",
                userId, handle.id(), connection.getHandles().size(), connections.size());
        return connection;
    }

    public Optional<Connection> get(String userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    public void remove(String userId) {
        Connection removed = connections.remove(userId);
        if (removed != null) {
            log.info("Connection removed: userId={}, total={}", userId, connections.size());
        }
    }

    /**
     * Drops one handle of a user.
     *
     * @return true when it was the user's last handle and the connection is gone
     */
    public boolean detach(String userId, ConnectionHandle handle) {
        return detach(userId, handle, () -> { });
    }

    /**
     * Drops one handle of a user. When it was the last one, {@code onLastHandle}
     * runs in the same atomic step that removes the connection, so no
     * registration of the same user can interleave with it.
     *
     * @return true when it was the user's last handle and the connection is gone
     */
    public boolean detach(String userId, ConnectionHandle handle, Runnable onLastHandle) {
        AtomicBoolean lastHandle = new AtomicBoolean(false);
        connections.computeIfPresent(userId, (id, connection) -> {
            connection.detach(handle);
            if (connection.hasHandles()) {
                return connection;
            }
            onLastHandle.run();
            lastHandle.set(true);
            return null;
        });
        return lastHandle.get();
    }

    /**
     * Runs {@code action} against the user's connection while holding its
     * entry. Registration and removal of the same user wait for it.
     *
     * @return false if the user is not connected and nothing ran
     */
    public boolean ifConnected(String userId, Consumer<Connection> action) {
        AtomicBoolean present = new AtomicBoolean(false);
        connections.computeIfPresent(userId, (id, connection) -> {
            action.accept(connection);
            present.set(true);
            return connection;
        });
        return present.get();
    }

    public void touch(String userId) {
        Connection connection = connections.get(userId);
        if (connection != null) {
            connection.touch(clock.instant());
        }
    }

    public boolean contains(String userId) {
        return connections.containsKey(userId);
    }

    public Collection<Connection> all() {
        return new ArrayList<>(connections.values());
    }

    public List<String> connectedUserIds() {
        return new ArrayList<>(connections.keySet());
    }

    public int size() {
        return connections.size();
    }
}
