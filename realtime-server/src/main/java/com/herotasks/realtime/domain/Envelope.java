package com.herotasks.realtime.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message unit exchanged with clients and carried over the bus.
 * Instances are immutable; build a new one per event.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {

    EnvelopeType type;
    Map<String, Object> data;
    String userId;
    String taskId;
    Instant timestamp;

    public static class EnvelopeBuilder {
        public EnvelopeBuilder data(Map<String, Object> data) {
            this.data = data == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(data));
            return this;
        }
    }

    public Map<String, Object> getData() {
        return data != null ? data : Collections.emptyMap();
    }

    // Factory methods

    public static Envelope of(EnvelopeType type, Map<String, Object> data,
                              String userId, String taskId) {
        return Envelope.builder()
                .type(type)
                .data(data)
                .userId(userId)
                .taskId(taskId)
                .timestamp(Instant.now())
                .build();
    }

    public static Envelope ping() {
        return of(EnvelopeType.PING, Map.of(), null, null);
    }

    public static Envelope pong() {
        return of(EnvelopeType.PONG, Map.of(), null, null);
    }

    public static Envelope userJoined(String userId, int connectedCount) {
        return of(EnvelopeType.USER_JOINED, Map.of(
                "userId", userId,
                "connectedCount", connectedCount
        ), userId, null);
    }

    public static Envelope userLeft(String userId, int connectedCount) {
        return of(EnvelopeType.USER_LEFT, Map.of(
                "userId", userId,
                "connectedCount", connectedCount
        ), userId, null);
    }
}
