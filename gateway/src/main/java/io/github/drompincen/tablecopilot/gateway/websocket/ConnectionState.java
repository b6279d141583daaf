package io.github.drompincen.tablecopilot.gateway.websocket;

import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-connection bookkeeping owned by {@link ChatWebSocketHandler}. Phase
 * changes are synchronized because a close can race the message thread.
 */
public class ConnectionState {

    private final WebSocketSession session;
    private final String defaultSessionId;
    private final Clock clock;
    private final Set<String> sessionIds = ConcurrentHashMap.newKeySet();

    private ConnectionPhase phase = ConnectionPhase.CONNECTING;
    private volatile Instant lastActivity;

    public ConnectionState(WebSocketSession session, String defaultSessionId, Clock clock) {
        this.session = session;
        this.defaultSessionId = defaultSessionId;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    public synchronized ConnectionPhase getPhase() {
        return phase;
    }

    /**
     * @throws IllegalStateException if the move is not allowed from the current phase
     */
    public synchronized void transition(ConnectionPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Connection " + session.getId() + " cannot go from " + phase + " to " + next);
        }
        phase = next;
    }

    /** @return false if the connection went away while the message was being processed */
    public synchronized boolean finishProcessing() {
        if (phase != ConnectionPhase.PROCESSING) {
            return false;
        }
        phase = ConnectionPhase.OPEN;
        return true;
    }

    /** Moves through CLOSING to CLOSED unless the connection already ended. */
    public synchronized void close() {
        if (phase.isTerminal()) return;
        if (phase != ConnectionPhase.CLOSING) {
            phase = ConnectionPhase.CLOSING;
        }
        phase = ConnectionPhase.CLOSED;
    }

    public synchronized void fail() {
        if (!phase.isTerminal()) {
            phase = ConnectionPhase.ERRORED;
        }
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    public void touchSession(String sessionId) {
        sessionIds.add(sessionId);
    }

    public WebSocketSession getSession() { return session; }

    public String getDefaultSessionId() { return defaultSessionId; }

    public Set<String> getSessionIds() { return Set.copyOf(sessionIds); }

    public Instant getLastActivity() { return lastActivity; }
}
