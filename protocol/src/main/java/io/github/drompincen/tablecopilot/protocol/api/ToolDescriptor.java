package io.github.drompincen.tablecopilot.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema,
        JsonNode outputSchema,
        boolean terminal
) {}
