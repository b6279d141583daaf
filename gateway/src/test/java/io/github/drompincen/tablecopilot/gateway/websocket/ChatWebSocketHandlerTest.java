package io.github.drompincen.tablecopilot.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tablecopilot.gateway.config.JacksonConfig;
import io.github.drompincen.tablecopilot.protocol.api.ThoughtDto;
import io.github.drompincen.tablecopilot.protocol.api.ToolCallDto;
import io.github.drompincen.tablecopilot.runtime.agent.AgentProcessingException;
import io.github.drompincen.tablecopilot.runtime.agent.AgentSessionRegistry;
import io.github.drompincen.tablecopilot.runtime.agent.AgentTurnResult;
import io.github.drompincen.tablecopilot.runtime.agent.NoAssistantReplyException;
import io.github.drompincen.tablecopilot.runtime.agent.ToolLoopExceededException;
import io.github.drompincen.tablecopilot.runtime.reminder.ReminderNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChatWebSocketHandlerTest {

    @Mock private AgentSessionRegistry registry;
    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketSession wsSession2;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T10:00:00Z"), ZoneOffset.UTC);
        handler = new ChatWebSocketHandler(objectMapper, registry, clock);
        when(wsSession.getId()).thenReturn("ws-1");
        when(wsSession.isOpen()).thenReturn(true);
        when(wsSession2.getId()).thenReturn("ws-2");
        when(wsSession2.isOpen()).thenReturn(true);
    }

    private void send(WebSocketSession session, Object payload) throws Exception {
        String text = payload instanceof String s ? s : objectMapper.writeValueAsString(payload);
        handler.handleTextMessage(session, new TextMessage(text));
    }

    private List<JsonNode> sent(WebSocketSession session, int expected) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(expected)).sendMessage(captor.capture());
        var nodes = new java.util.ArrayList<JsonNode>();
        for (TextMessage m : captor.getAllValues()) {
            nodes.add(objectMapper.readTree(m.getPayload()));
        }
        return nodes;
    }

    @Test
    void openingConnectionSendsConnectedStatus() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode hello = sent(wsSession, 1).get(0);
        assertThat(hello.path("type").asText()).isEqualTo("connection");
        assertThat(hello.path("status").asText()).isEqualTo("connected");
        assertThat(hello.path("message").asText()).isNotBlank();
        assertThat(handler.connections()).singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.OPEN);
    }

    @Test
    void messageIsProcessedAndAnswered() throws Exception {
        var call = new ToolCallDto("list_schedules", objectMapper.createObjectNode(), true, null, null);
        when(registry.process("s1", "show my bookings"))
                .thenReturn(new AgentTurnResult("You have no bookings.", List.of(call),
                        List.of(ThoughtDto.assistant("Let me check your bookings."))));
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("type", "message", "content", "show my bookings", "session_id", "s1"));

        List<JsonNode> out = sent(wsSession, 3);
        assertThat(out.get(1).path("type").asText()).isEqualTo("status");
        assertThat(out.get(1).path("status").asText()).isEqualTo("processing");
        JsonNode response = out.get(2);
        assertThat(response.path("type").asText()).isEqualTo("response");
        assertThat(response.path("content").asText()).isEqualTo("You have no bookings.");
        assertThat(response.path("session_id").asText()).isEqualTo("s1");
        assertThat(response.path("tool_calls").get(0).path("name").asText()).isEqualTo("list_schedules");
        assertThat(response.path("thoughts").get(0).path("content").asText()).isEqualTo("Let me check your bookings.");
        assertThat(handler.connections()).singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.OPEN);
    }

    @Test
    void missingTypeIsTreatedAsMessageOnDefaultSession() throws Exception {
        when(registry.process(anyString(), eq("hi"))).thenReturn(new AgentTurnResult("Hello!", List.of()));
        handler.afterConnectionEstablished(wsSession);
        String defaultId = handler.connections().iterator().next().getDefaultSessionId();

        send(wsSession, Map.of("content", "hi"));
        send(wsSession, Map.of("content", "hi"));

        verify(registry, times(2)).process(defaultId, "hi");
        assertThat(sent(wsSession, 5).get(4).path("session_id").asText()).isEqualTo(defaultId);
    }

    @Test
    void invalidJsonYieldsErrorAndStaysOpen() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, "{not json");

        JsonNode error = sent(wsSession, 2).get(1);
        assertThat(error.path("type").asText()).isEqualTo("error");
        assertThat(error.path("message").asText()).startsWith("Invalid JSON format");
        assertThat(handler.connections()).singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.OPEN);
        verifyNoInteractions(registry);
    }

    @Test
    void unknownTypeAndBlankContentAreProtocolErrors() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("type", "shout", "content", "x"));
        send(wsSession, Map.of("type", "message", "content", "  "));

        List<JsonNode> out = sent(wsSession, 3);
        assertThat(out.get(1).path("message").asText()).isEqualTo("Unknown message type: shout");
        assertThat(out.get(2).path("message").asText()).isEqualTo("Message content is required");
        verifyNoInteractions(registry);
    }

    @Test
    void pingRepliesPongWithoutTouchingSessions() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("type", "ping"));

        assertThat(sent(wsSession, 2).get(1).path("type").asText()).isEqualTo("pong");
        verifyNoInteractions(registry);
    }

    @Test
    void clearHistoryAcknowledgesWithSessionId() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("type", "clear_history", "session_id", "s9"));

        verify(registry).clear("s9");
        JsonNode ack = sent(wsSession, 2).get(1);
        assertThat(ack.path("type").asText()).isEqualTo("status");
        assertThat(ack.path("status").asText()).isEqualTo("success");
        assertThat(ack.path("message").asText()).isEqualTo("History cleared for session s9");
    }

    @Test
    void agentFailuresBecomeErrorEnvelopes() throws Exception {
        when(registry.process(anyString(), eq("loop"))).thenThrow(new ToolLoopExceededException(10));
        when(registry.process(anyString(), eq("silent"))).thenThrow(new NoAssistantReplyException());
        when(registry.process(anyString(), eq("boom")))
                .thenThrow(new AgentProcessingException("model down", new IllegalStateException("secret detail")));
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("content", "loop"));
        send(wsSession, Map.of("content", "silent"));
        send(wsSession, Map.of("content", "boom"));

        List<JsonNode> out = sent(wsSession, 7);
        assertThat(out.get(2).path("message").asText()).isEqualTo(ChatWebSocketHandler.LOOP_EXCEEDED);
        assertThat(out.get(4).path("message").asText()).isEqualTo(ChatWebSocketHandler.NO_REPLY);
        assertThat(out.get(6).path("type").asText()).isEqualTo("error");
        assertThat(out.get(6).path("message").asText())
                .isEqualTo(ChatWebSocketHandler.GENERIC_FAILURE)
                .doesNotContain("secret detail");
        assertThat(handler.connections()).singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.OPEN);
    }

    @Test
    void replyIsDiscardedWhenConnectionClosesMidTurn() throws Exception {
        handler.afterConnectionEstablished(wsSession);
        when(registry.process(anyString(), eq("slow"))).thenAnswer(inv -> {
            handler.afterConnectionClosed(wsSession, CloseStatus.GOING_AWAY);
            return new AgentTurnResult("too late", List.of());
        });

        send(wsSession, Map.of("content", "slow"));

        List<JsonNode> out = sent(wsSession, 2);
        assertThat(out).extracting(n -> n.path("type").asText()).containsExactly("connection", "status");
        assertThat(handler.connections()).isEmpty();
    }

    @Test
    void sendFailureIsLoggedNotThrown() throws Exception {
        doThrow(new IOException("broken pipe")).when(wsSession).sendMessage(any());

        handler.afterConnectionEstablished(wsSession);
        send(wsSession, Map.of("type", "ping"));

        verify(wsSession, atLeastOnce()).sendMessage(any());
    }

    @Test
    void slowConnectionDoesNotStopRemindersToOthers() throws Exception {
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger framesToSlow = new AtomicInteger();
        doAnswer(inv -> {
            if (framesToSlow.incrementAndGet() == 2) {
                blocked.countDown();
                release.await(10, TimeUnit.SECONDS);
            }
            return null;
        }).when(wsSession).sendMessage(any());

        handler.afterConnectionEstablished(wsSession);
        handler.afterConnectionEstablished(wsSession2);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> first = pool.submit(() -> handler.deliver(reminder("first", "soon")));
            assertThat(blocked.await(5, TimeUnit.SECONDS)).isTrue();

            String large = "x".repeat(ChatWebSocketHandler.BUFFER_SIZE_LIMIT + 1024);
            handler.deliver(reminder("second", large));

            release.countDown();
            first.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        List<JsonNode> fast = sent(wsSession2, 3);
        assertThat(fast).extracting(n -> n.path("schedule_id").asText()).contains("first", "second");
        verify(wsSession).close(any(CloseStatus.class));
        assertThat(handler.connections())
                .filteredOn(c -> c.getSession().getId().equals("ws-1"))
                .singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.ERRORED);
    }

    private static ReminderNotification reminder(String scheduleId, String message) {
        return new ReminderNotification(scheduleId, "Schedule reminder: Dinner", message,
                LocalDateTime.of(2026, 10, 18, 19, 0), Instant.parse("2026-10-18T18:45:00Z"));
    }

    @Test
    void transportErrorMovesConnectionToErrored() {
        handler.afterConnectionEstablished(wsSession);

        handler.handleTransportError(wsSession, new IOException("reset"));

        assertThat(handler.connections()).singleElement()
                .extracting(ConnectionState::getPhase).isEqualTo(ConnectionPhase.ERRORED);
        handler.afterConnectionClosed(wsSession, CloseStatus.SERVER_ERROR);
        assertThat(handler.connections()).isEmpty();
    }

    @Test
    void remindersAreBroadcastToOpenConnections() throws Exception {
        handler.afterConnectionEstablished(wsSession);
        handler.afterConnectionEstablished(wsSession2);
        handler.handleTransportError(wsSession2, new IOException("reset"));

        handler.deliver(new ReminderNotification("abc12345", "Schedule reminder: Dinner at Luigi's",
                "2026-10-18 19:00 (15 min ahead)", LocalDateTime.of(2026, 10, 18, 19, 0),
                Instant.parse("2026-10-18T18:45:00Z")));

        JsonNode reminder = sent(wsSession, 2).get(1);
        assertThat(reminder.path("type").asText()).isEqualTo("reminder");
        assertThat(reminder.path("schedule_id").asText()).isEqualTo("abc12345");
        assertThat(reminder.path("title").asText()).isEqualTo("Schedule reminder: Dinner at Luigi's");
        sent(wsSession2, 1);
    }
}
