package io.github.drompincen.tablecopilot.runtime.reminder;

/** Egress for due reminders. Implementations must not block for long. */
public interface NotificationSink {

    void deliver(ReminderNotification notification);
}
