package io.github.drompincen.tablecopilot.persistence.document;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.drompincen.tablecopilot.protocol.api.Recurrence;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleDocument {

    public static final String DATETIME_PATTERN = "yyyy-MM-dd HH:mm";
    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern(DATETIME_PATTERN);

    private String id;
    private String title;

    @JsonFormat(pattern = DATETIME_PATTERN)
    private LocalDateTime datetime;

    private Recurrence recurrence = Recurrence.ONCE;
    private String notes;

    @JsonProperty("reminder_minutes")
    private int reminderMinutes;

    private ScheduleStatus status = ScheduleStatus.PENDING;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("notified_at")
    private Instant notifiedAt;

    public ScheduleDocument() {}

    public ScheduleDocument copy() {
        ScheduleDocument c = new ScheduleDocument();
        c.id = id;
        c.title = title;
        c.datetime = datetime;
        c.recurrence = recurrence;
        c.notes = notes;
        c.reminderMinutes = reminderMinutes;
        c.status = status;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.notifiedAt = notifiedAt;
        return c;
    }

    /** The moment the reminder for this record becomes due. */
    public LocalDateTime reminderAt() {
        return datetime != null ? datetime.minusMinutes(reminderMinutes) : null;
    }

    public boolean isDue(LocalDateTime now) {
        LocalDateTime at = reminderAt();
        return status == ScheduleStatus.PENDING && at != null && !at.isAfter(now);
    }

    /**
     * Moves the record to {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow it
     */
    public void transitionTo(ScheduleStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move schedule " + id + " from "
                    + status.wireName() + " to " + next.wireName());
        }
        this.status = next;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public LocalDateTime getDatetime() { return datetime; }
    public void setDatetime(LocalDateTime datetime) { this.datetime = datetime; }

    public Recurrence getRecurrence() { return recurrence; }
    public void setRecurrence(Recurrence recurrence) { this.recurrence = recurrence; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public int getReminderMinutes() { return reminderMinutes; }
    public void setReminderMinutes(int reminderMinutes) { this.reminderMinutes = reminderMinutes; }

    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getNotifiedAt() { return notifiedAt; }
    public void setNotifiedAt(Instant notifiedAt) { this.notifiedAt = notifiedAt; }
}
