package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleNotFoundException;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;
import io.github.drompincen.tablecopilot.runtime.tools.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.github.drompincen.tablecopilot.tools.ScheduleJson.MAPPER;

/**
 * Changes fields of an existing schedule. The only status change offered to the
 * model is cancellation; notification is the reminder notifier's job.
 */
public class UpdateScheduleTool implements Tool {

    private ScheduleStore scheduleStore;

    @Override public String name() { return "update_schedule"; }

    @Override public String description() {
        return "Update an existing reservation or appointment by id. Only the given fields change. " +
               "Set status to 'cancelled' to cancel it.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("schedule_id").put("type", "string").put("minLength", 1);
        props.putObject("title").put("type", "string");
        props.putObject("datetime").put("type", "string")
                .put("description", "New start time as yyyy-MM-dd HH:mm");
        props.putObject("notes").put("type", "string");
        props.putObject("reminder_minutes").put("type", "integer").put("minimum", 0);
        props.putObject("status").put("type", "string")
                .put("description", "Only 'cancelled' is accepted");
        schema.putArray("required").add("schedule_id");
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
        String id = input.path("schedule_id").asText("").trim();

        String title = text(input, "title");
        String notes = text(input, "notes");
        Integer reminderMinutes = input.hasNonNull("reminder_minutes") ? input.get("reminder_minutes").asInt() : null;

        LocalDateTime datetime = null;
        String datetimeText = text(input, "datetime");
        if (datetimeText != null) {
            Optional<LocalDateTime> parsed = ScheduleJson.parseDatetime(datetimeText);
            if (parsed.isEmpty()) return ToolResult.failure(ScheduleJson.badDatetime(datetimeText));
            datetime = parsed.get();
        }

        boolean cancel = false;
        String statusText = text(input, "status");
        if (statusText != null) {
            if (ScheduleStatus.parse(statusText).orElse(null) != ScheduleStatus.CANCELLED) {
                return ToolResult.failure("Invalid status '" + statusText + "'. Only 'cancelled' can be set");
            }
            cancel = true;
        }

        if (title == null && notes == null && reminderMinutes == null && datetime == null && !cancel) {
            return ToolResult.failure("No fields to update were provided");
        }

        List<String> changed = new ArrayList<>();
        LocalDateTime newDatetime = datetime;
        boolean doCancel = cancel;
        try {
            ScheduleDocument updated = scheduleStore.update(id, doc -> {
                if (title != null) { doc.setTitle(title); changed.add("title"); }
                if (newDatetime != null) { doc.setDatetime(newDatetime); changed.add("datetime"); }
                if (notes != null) { doc.setNotes(notes); changed.add("notes"); }
                if (reminderMinutes != null) { doc.setReminderMinutes(reminderMinutes); changed.add("reminder_minutes"); }
                if (doCancel) { doc.transitionTo(ScheduleStatus.CANCELLED); changed.add("status"); }
                return doc;
            });

            ObjectNode result = MAPPER.createObjectNode();
            result.set("schedule", ScheduleJson.toJson(updated));
            result.set("updated_fields", MAPPER.valueToTree(changed));
            return ToolResult.success("Schedule " + id + " updated: " + String.join(", ", changed), result);
        } catch (ScheduleNotFoundException e) {
            return ToolResult.failure("Schedule not found: " + id + ". List schedules to find the right id");
        } catch (IllegalStateException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private static String text(JsonNode input, String field) {
        return input.hasNonNull(field) ? input.get(field).asText() : null;
    }
}
