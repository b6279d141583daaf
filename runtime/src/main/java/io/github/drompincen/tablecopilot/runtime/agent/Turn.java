package io.github.drompincen.tablecopilot.runtime.agent;

import io.github.drompincen.tablecopilot.protocol.api.TurnDto;

import java.util.Objects;

/** One entry of a session's history. {@code name} is set on tool turns only. */
public record Turn(TurnRole role, String content, String name) {

    public Turn {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
    }

    public static Turn user(String content) {
        return new Turn(TurnRole.USER, content, null);
    }

    public static Turn assistant(String content) {
        return new Turn(TurnRole.ASSISTANT, content, null);
    }

    public static Turn tool(String toolName, String content) {
        return new Turn(TurnRole.TOOL, content, toolName);
    }

    public TurnDto toDto() {
        return new TurnDto(role.wireName(), name, content);
    }
}
