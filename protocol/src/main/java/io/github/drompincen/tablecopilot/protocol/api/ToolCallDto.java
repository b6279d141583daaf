package io.github.drompincen.tablecopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** One tool invocation made while producing a reply, as reported to the client. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallDto(
        String name,
        JsonNode arguments,
        boolean success,
        JsonNode result,
        String error
) {}
