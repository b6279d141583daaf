package io.github.drompincen.tablecopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnDto(
        String role,
        String name,
        String content
) {}
