package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.protocol.api.Recurrence;
import io.github.drompincen.tablecopilot.runtime.tools.*;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.github.drompincen.tablecopilot.tools.ScheduleJson.MAPPER;

public class CreateScheduleTool implements Tool {

    static final int DEFAULT_REMINDER_MINUTES = 15;

    private ScheduleStore scheduleStore;

    @Override public String name() { return "create_schedule"; }

    @Override public String description() {
        return "Create a reservation or appointment with a reminder. The reminder fires " +
               "reminder_minutes before the start time.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("title").put("type", "string").put("minLength", 1)
                .put("description", "Short title, e.g. 'Dinner at Luigi's for 4'");
        props.putObject("datetime").put("type", "string")
                .put("description", "Start time as yyyy-MM-dd HH:mm, e.g. 2026-03-15 19:30");
        props.putObject("notes").put("type", "string")
                .put("description", "Optional details");
        props.putObject("reminder_minutes").put("type", "integer").put("minimum", 0)
                .put("description", "Minutes before the start time to remind (default 15)");
        props.putObject("recurrence").put("type", "string")
                .put("description", "once, daily, weekly or monthly (default once)");
        schema.putArray("required").add("title").add("datetime");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }

    public void setScheduleStore(ScheduleStore scheduleStore) {
        this.scheduleStore = scheduleStore;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (scheduleStore == null) {
            return ToolResult.failure(ScheduleJson.STORE_UNAVAILABLE);
        }

        String title = input.path("title").asText("").trim();
        if (title.isEmpty()) return ToolResult.failure("'title' is required");

        String datetimeText = input.path("datetime").asText("");
        Optional<LocalDateTime> datetime = ScheduleJson.parseDatetime(datetimeText);
        if (datetime.isEmpty()) return ToolResult.failure(ScheduleJson.badDatetime(datetimeText));

        String recurrenceText = input.path("recurrence").asText("once");
        Optional<Recurrence> recurrence = Recurrence.parse(recurrenceText);
        if (recurrence.isEmpty()) {
            return ToolResult.failure("Invalid recurrence '" + recurrenceText + "'. Valid options: "
                    + Arrays.stream(Recurrence.values()).map(Recurrence::wireName).collect(Collectors.joining(", ")));
        }

        if (recurrence.get() == Recurrence.ONCE && datetime.get().isBefore(LocalDateTime.now(ctx.clock()))) {
            return ToolResult.failure("The time " + datetimeText + " has already passed. Please choose a future time.");
        }

        ScheduleDocument doc = new ScheduleDocument();
        doc.setTitle(title);
        doc.setDatetime(datetime.get());
        doc.setRecurrence(recurrence.get());
        String notes = input.path("notes").asText(null);
        if (notes != null && !notes.isBlank()) doc.setNotes(notes.trim());
        doc.setReminderMinutes(input.path("reminder_minutes").asInt(DEFAULT_REMINDER_MINUTES));
        doc.setCreatedAt(ctx.clock().instant());

        ScheduleDocument created = scheduleStore.create(doc);

        ObjectNode result = MAPPER.createObjectNode();
        result.set("schedule", ScheduleJson.toJson(created));
        return ToolResult.success("Schedule created: " + created.getTitle() + " at "
                + created.getDatetime().format(ScheduleDocument.DATETIME_FORMAT), result);
    }
}
