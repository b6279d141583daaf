package io.github.drompincen.tablecopilot.persistence.store;

public class ScheduleNotFoundException extends RuntimeException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
