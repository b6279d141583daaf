package io.github.drompincen.tablecopilot.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.drompincen.tablecopilot.protocol.api.ThoughtDto;
import io.github.drompincen.tablecopilot.protocol.api.ToolCallDto;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerEnvelope(
        EnvelopeType type,
        String status,
        String message,
        String content,
        @JsonProperty("session_id") String sessionId,
        List<ThoughtDto> thoughts,
        @JsonProperty("tool_calls") List<ToolCallDto> toolCalls,
        @JsonProperty("schedule_id") String scheduleId,
        String title
) {
    public static final String STATUS_CONNECTED = "connected";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_SUCCESS = "success";

    public static ServerEnvelope connected(String message) {
        return new ServerEnvelope(EnvelopeType.CONNECTION, STATUS_CONNECTED, message, null, null, null, null, null, null);
    }

    public static ServerEnvelope processing(String message) {
        return new ServerEnvelope(EnvelopeType.STATUS, STATUS_PROCESSING, message, null, null, null, null, null, null);
    }

    public static ServerEnvelope success(String message) {
        return new ServerEnvelope(EnvelopeType.STATUS, STATUS_SUCCESS, message, null, null, null, null, null, null);
    }

    public static ServerEnvelope response(String content, String sessionId, List<ToolCallDto> toolCalls) {
        return response(content, sessionId, toolCalls, List.of());
    }

    public static ServerEnvelope response(String content, String sessionId, List<ToolCallDto> toolCalls,
                                          List<ThoughtDto> thoughts) {
        return new ServerEnvelope(EnvelopeType.RESPONSE, null, null, content, sessionId,
                thoughts != null ? List.copyOf(thoughts) : List.of(),
                toolCalls != null ? List.copyOf(toolCalls) : List.of(), null, null);
    }

    public static ServerEnvelope error(String message) {
        return new ServerEnvelope(EnvelopeType.ERROR, null, message, null, null, null, null, null, null);
    }

    public static ServerEnvelope pong() {
        return new ServerEnvelope(EnvelopeType.PONG, null, null, null, null, null, null, null, null);
    }

    public static ServerEnvelope reminder(String scheduleId, String title, String message) {
        return new ServerEnvelope(EnvelopeType.REMINDER, null, message, null, null, null, null, scheduleId, title);
    }
}
