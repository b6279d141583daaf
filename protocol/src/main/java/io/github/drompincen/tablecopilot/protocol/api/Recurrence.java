package io.github.drompincen.tablecopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Recurrence {
    ONCE, DAILY, WEEKLY, MONTHLY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Recurrence fromWire(String name) {
        return parse(name).orElse(ONCE);
    }

    public static Optional<Recurrence> parse(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
