package io.github.drompincen.tablecopilot.runtime.reminder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void deliver(ReminderNotification notification) {
        log.info("[REMINDER] {} | {}", notification.title(), notification.message());
    }
}
