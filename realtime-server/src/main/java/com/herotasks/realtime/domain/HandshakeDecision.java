package com.herotasks.realtime.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandshakeDecision {
    boolean accepted;
    String userId;
    String reason;

    public static HandshakeDecision accept(String userId) {
        return new HandshakeDecision(true, userId, null);
    }

    public static HandshakeDecision reject(String reason) {
        return new HandshakeDecision(false, null, reason);
    }
}
