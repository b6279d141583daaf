package io.github.drompincen.tablecopilot.runtime.tools;

import java.time.Clock;

public record ToolContext(
        String sessionId,
        Clock clock
) {}
