package com.herotasks.realtime.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope wrapper published on the Redis bus. Carries the routing needed
 * for a receiving instance to replay the delivery on its own connections.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusMessage {
    private String origin;
    private Scope scope;
    private String excludeUserId;
    private String taskId;
    private Envelope envelope;

    public enum Scope {
        ALL,
        ROOM,
        ALL_AND_ROOM
    }
}
