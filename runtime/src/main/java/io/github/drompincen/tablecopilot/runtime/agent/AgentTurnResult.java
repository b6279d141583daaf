package io.github.drompincen.tablecopilot.runtime.agent;

import io.github.drompincen.tablecopilot.protocol.api.ThoughtDto;
import io.github.drompincen.tablecopilot.protocol.api.ToolCallDto;

import java.util.List;

public record AgentTurnResult(
        String content,
        List<ToolCallDto> toolCalls,
        List<ThoughtDto> thoughts
) {
    public AgentTurnResult {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        thoughts = thoughts != null ? List.copyOf(thoughts) : List.of();
    }

    public AgentTurnResult(String content, List<ToolCallDto> toolCalls) {
        this(content, toolCalls, List.of());
    }
}
