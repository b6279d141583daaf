package io.github.drompincen.tablecopilot.runtime.reminder;

import java.time.Instant;
import java.time.LocalDateTime;

public record ReminderNotification(
        String scheduleId,
        String title,
        String message,
        LocalDateTime datetime,
        Instant notifiedAt
) {}
