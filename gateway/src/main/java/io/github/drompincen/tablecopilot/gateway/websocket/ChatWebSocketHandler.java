package io.github.drompincen.tablecopilot.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tablecopilot.protocol.ws.ClientEnvelope;
import io.github.drompincen.tablecopilot.protocol.ws.ProtocolException;
import io.github.drompincen.tablecopilot.protocol.ws.ServerEnvelope;
import io.github.drompincen.tablecopilot.runtime.agent.AgentSessionRegistry;
import io.github.drompincen.tablecopilot.runtime.agent.AgentTurnResult;
import io.github.drompincen.tablecopilot.runtime.agent.NoAssistantReplyException;
import io.github.drompincen.tablecopilot.runtime.agent.ToolLoopExceededException;
import io.github.drompincen.tablecopilot.runtime.reminder.NotificationSink;
import io.github.drompincen.tablecopilot.runtime.reminder.ReminderNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat endpoint. Each connection gets a {@link ConnectionState}; messages are
 * handed to the {@link AgentSessionRegistry} on the container thread, so one
 * connection has at most one request in flight. Reminders from the notifier
 * are broadcast to every open connection.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    static final String WELCOME = "Connected to Table Copilot";
    static final String PROCESSING = "Processing your message...";
    static final String GENERIC_FAILURE = "Sorry, something went wrong while handling your message. Please try again.";
    static final String LOOP_EXCEEDED = "Too many tool calls were needed for this request. Please try rephrasing it.";
    static final String NO_REPLY = "The assistant did not produce a reply. Please try again.";

    private final ObjectMapper objectMapper;
    private final AgentSessionRegistry registry;
    private final Clock clock;
    private final Map<String, ConnectionState> connections = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ObjectMapper objectMapper, AgentSessionRegistry registry, Clock clock) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        var state = new ConnectionState(decorated, UUID.randomUUID().toString(), clock);
        state.transition(ConnectionPhase.OPEN);
        connections.put(session.getId(), state);
        log.info("Connection {} opened, default session {}", session.getId(), state.getDefaultSessionId());
        send(state, ServerEnvelope.connected(WELCOME));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionState state = connections.get(session.getId());
        if (state == null) {
            log.warn("Message on unknown connection {}", session.getId());
            return;
        }
        state.touch();

        ClientEnvelope envelope;
        try {
            JsonNode node = objectMapper.readTree(message.getPayload());
            envelope = ClientEnvelope.parse(node);
        } catch (JsonProcessingException e) {
            send(state, ServerEnvelope.error("Invalid JSON format: " + e.getOriginalMessage()));
            return;
        } catch (ProtocolException e) {
            send(state, ServerEnvelope.error(e.getMessage()));
            return;
        }

        String sessionId = envelope.sessionId() != null ? envelope.sessionId() : state.getDefaultSessionId();
        switch (envelope.type()) {
            case PING -> send(state, ServerEnvelope.pong());
            case CLEAR_HISTORY -> {
                registry.clear(sessionId);
                send(state, ServerEnvelope.success("History cleared for session " + sessionId));
            }
            case MESSAGE -> handleMessage(state, sessionId, envelope.content());
            default -> send(state, ServerEnvelope.error("Unknown message type: " + envelope.type().wireName()));
        }
    }

    private void handleMessage(ConnectionState state, String sessionId, String content) {
        try {
            state.transition(ConnectionPhase.PROCESSING);
        } catch (IllegalStateException e) {
            log.debug("Dropping message on connection in phase {}", state.getPhase());
            return;
        }
        state.touchSession(sessionId);
        send(state, ServerEnvelope.processing(PROCESSING));

        ServerEnvelope reply;
        try {
            AgentTurnResult result = registry.process(sessionId, content);
            reply = ServerEnvelope.response(result.content(), sessionId, result.toolCalls(), result.thoughts());
        } catch (ToolLoopExceededException e) {
            log.warn("Session {}: {}", sessionId, e.getMessage());
            reply = ServerEnvelope.error(LOOP_EXCEEDED);
        } catch (NoAssistantReplyException e) {
            log.warn("Session {}: {}", sessionId, e.getMessage());
            reply = ServerEnvelope.error(NO_REPLY);
        } catch (RuntimeException e) {
            log.error("Failed to process message for session {}", sessionId, e);
            reply = ServerEnvelope.error(GENERIC_FAILURE);
        }

        if (!state.finishProcessing()) {
            log.debug("Connection {} closed while processing session {}, reply discarded",
                    state.getSession().getId(), sessionId);
            return;
        }
        send(state, reply);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        ConnectionState state = connections.get(session.getId());
        if (state != null) {
            state.fail();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionState state = connections.remove(session.getId());
        if (state != null) {
            state.close();
            log.info("Connection {} closed ({}), sessions used: {}", session.getId(), status, state.getSessionIds());
        }
    }

    @Override
    public void deliver(ReminderNotification notification) {
        ServerEnvelope envelope = ServerEnvelope.reminder(
                notification.scheduleId(), notification.title(), notification.message());
        for (ConnectionState state : connections.values()) {
            ConnectionPhase phase = state.getPhase();
            if (phase == ConnectionPhase.OPEN || phase == ConnectionPhase.PROCESSING) {
                send(state, envelope);
            }
        }
    }

    Collection<ConnectionState> connections() {
        return connections.values();
    }

    private void send(ConnectionState state, ServerEnvelope envelope) {
        WebSocketSession session = state.getSession();
        if (!session.isOpen()) {
            log.debug("Skipping {} for closed connection {}", envelope.type(), session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
        } catch (SessionLimitExceededException e) {
            log.warn("Connection {} is too slow, dropping it: {}", session.getId(), e.getMessage());
            state.fail();
            closeQuietly(session, e.getStatus());
        } catch (IOException e) {
            log.warn("Failed to send {} to connection {}: {}", envelope.type(), session.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to send {} to connection {}", envelope.type(), session.getId(), e);
            state.fail();
        }
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing connection {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
