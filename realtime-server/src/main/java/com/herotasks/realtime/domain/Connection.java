package com.herotasks.realtime.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One connected user and every transport handle (device) they currently hold open.
 */
@Getter
public class Connection {

    private final String userId;
    private final Instant connectedAt;
    private final Map<String, ConnectionHandle> handles = new ConcurrentHashMap<>();
    private volatile Instant lastSeenAt;
    private volatile String currentTaskId;

    public Connection(String userId, Instant connectedAt) {
        this.userId = userId;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }

    public void attach(ConnectionHandle handle) {
        handles.put(handle.id(), handle);
    }

    public boolean detach(ConnectionHandle handle) {
        return handles.remove(handle.id(), handle);
    }

    public boolean hasHandles() {
        return !handles.isEmpty();
    }

    public List<ConnectionHandle> getHandles() {
        return new ArrayList<>(handles.values());
    }

    public void touch(Instant now) {
        this.lastSeenAt = now;
    }

    public void setCurrentTaskId(String currentTaskId) {
        this.currentTaskId = currentTaskId;
    }
}
