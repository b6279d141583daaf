package io.github.drompincen.tablecopilot.runtime.agent.llm;

import io.github.drompincen.tablecopilot.runtime.agent.Turn;

import java.util.List;

/** Immutable snapshot handed to the model: the rendered system prompt and the history so far. */
public record CompletionRequest(
        String sessionId,
        String systemPrompt,
        List<Turn> history
) {
    public CompletionRequest {
        history = List.copyOf(history);
    }

    public Turn lastTurn() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }
}
