package io.github.drompincen.tablecopilot.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    JsonNode outputSchema();

    /**
     * A terminal tool ends the current turn: when it succeeds, its
     * {@code markdown} output is sent to the user as the assistant reply.
     */
    default boolean terminal() {
        return false;
    }

    ToolResult execute(ToolContext ctx, JsonNode input);
}
