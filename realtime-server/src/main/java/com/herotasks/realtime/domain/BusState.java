package com.herotasks.realtime.domain;

public enum BusState {
    CONNECTING,
    CONNECTED,
    /** Retries exhausted; only same-process delivery until restart. */
    DEGRADED
}
