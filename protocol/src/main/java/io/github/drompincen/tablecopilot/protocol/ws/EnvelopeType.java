package io.github.drompincen.tablecopilot.protocol.ws;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum EnvelopeType {
    // Client -> Server
    MESSAGE("message"),
    CLEAR_HISTORY("clear_history"),
    PING("ping"),

    // Server -> Client
    CONNECTION("connection"),
    STATUS("status"),
    RESPONSE("response"),
    ERROR("error"),
    PONG("pong"),
    REMINDER("reminder");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isClientType() {
        return this == MESSAGE || this == CLEAR_HISTORY || this == PING;
    }

    public static Optional<EnvelopeType> fromWire(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst();
    }
}
