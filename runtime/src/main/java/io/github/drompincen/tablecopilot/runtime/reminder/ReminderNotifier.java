package io.github.drompincen.tablecopilot.runtime.reminder;

import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodically moves due pending schedules to notified and announces each one
 * to every {@link NotificationSink}. The status change is persisted before any
 * sink runs, so a record is announced at most once.
 */
@Component
@ConditionalOnProperty(name = "tablecopilot.notifier.enabled", havingValue = "true", matchIfMissing = true)
public class ReminderNotifier {

    private static final Logger log = LoggerFactory.getLogger(ReminderNotifier.class);

    private final ScheduleStore store;
    private final List<NotificationSink> sinks;
    private final Clock clock;

    public ReminderNotifier(ScheduleStore store, List<NotificationSink> sinks, Clock clock) {
        this.store = store;
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tablecopilot.notifier.interval-ms:30000}",
            initialDelayString = "${tablecopilot.notifier.initial-delay-ms:5000}")
    public void tick() {
        List<ReminderNotification> due;
        try {
            due = collectDue();
        } catch (RuntimeException e) {
            log.error("Reminder tick failed, retrying on the next tick", e);
            return;
        }

        for (ReminderNotification notification : due) {
            for (NotificationSink sink : sinks) {
                try {
                    sink.deliver(notification);
                } catch (Exception e) {
                    log.error("Sink {} failed to deliver reminder {}",
                            sink.getClass().getSimpleName(), notification.scheduleId(), e);
                }
            }
        }
    }

    List<ReminderNotification> collectDue() {
        return store.locked(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            Instant notifiedAt = clock.instant();
            List<ScheduleDocument> records = store.load();
            List<ReminderNotification> due = new ArrayList<>();

            for (ScheduleDocument record : records) {
                if (!record.isDue(now)) continue;
                record.transitionTo(ScheduleStatus.NOTIFIED);
                record.setNotifiedAt(notifiedAt);
                due.add(toNotification(record));
            }

            if (!due.isEmpty()) {
                store.save(records);
                log.info("Marked {} schedule(s) as notified", due.size());
            }
            return due;
        });
    }

    private static ReminderNotification toNotification(ScheduleDocument record) {
        String when = record.getDatetime().format(ScheduleDocument.DATETIME_FORMAT);
        String message = when + " (" + record.getReminderMinutes() + " min ahead)";
        if (record.getNotes() != null && !record.getNotes().isBlank()) {
            message += " - " + record.getNotes();
        }
        return new ReminderNotification(record.getId(), "Schedule reminder: " + record.getTitle(),
                message, record.getDatetime(), record.getNotifiedAt());
    }
}
