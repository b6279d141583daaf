package io.github.drompincen.tablecopilot.protocol.api;

import java.time.Instant;
import java.util.List;

public record SessionDto(
        String sessionId,
        Instant createdAt,
        Instant lastActiveAt,
        int turnCount,
        List<TurnDto> history
) {}
