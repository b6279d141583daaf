package io.github.drompincen.tablecopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle of a schedule record. Transitions only move forward:
 * pending to notified, and pending or notified to cancelled.
 */
public enum ScheduleStatus {
    PENDING,
    NOTIFIED,
    CANCELLED;

    public boolean canTransitionTo(ScheduleStatus next) {
        return switch (this) {
            case PENDING -> next == NOTIFIED || next == CANCELLED;
            case NOTIFIED -> next == CANCELLED;
            case CANCELLED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ScheduleStatus fromWire(String name) {
        return parse(name).orElseThrow(() -> new IllegalArgumentException("Unknown schedule status: " + name));
    }

    public static Optional<ScheduleStatus> parse(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
