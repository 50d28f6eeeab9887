package com.herotasks.realtime.domain;

/**
 * Logical bus channels; concrete Redis channel names come from configuration.
 */
public enum BusChannel {
    TASK_UPDATES,
    PRESENCE
}
