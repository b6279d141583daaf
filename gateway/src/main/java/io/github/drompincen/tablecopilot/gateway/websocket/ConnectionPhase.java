package io.github.drompincen.tablecopilot.gateway.websocket;

import java.util.EnumSet;
import java.util.Set;

public enum ConnectionPhase {
    CONNECTING,
    OPEN,
    PROCESSING,
    CLOSING,
    CLOSED,
    ERRORED;

    public boolean isTerminal() {
        return this == CLOSED || this == ERRORED;
    }

    public boolean canTransitionTo(ConnectionPhase next) {
        return successors().contains(next);
    }

    private Set<ConnectionPhase> successors() {
        return switch (this) {
            case CONNECTING -> EnumSet.of(OPEN, CLOSING, ERRORED);
            case OPEN -> EnumSet.of(PROCESSING, CLOSING, ERRORED);
            case PROCESSING -> EnumSet.of(OPEN, CLOSING, ERRORED);
            case CLOSING -> EnumSet.of(CLOSED, ERRORED);
            case CLOSED, ERRORED -> EnumSet.noneOf(ConnectionPhase.class);
        };
    }
}
