package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleNotFoundException;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.runtime.tools.*;

import static io.github.drompincen.tablecopilot.tools.ScheduleJson.MAPPER;

public class DeleteScheduleTool implements Tool {

    private ScheduleStore scheduleStore;

    @Override public String name() { return "delete_schedule"; }

    @Override public String description() {
        return "Permanently delete a reservation or appointment by id.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("schedule_id").put("type", "string").put("minLength", 1);
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
        try {
            ScheduleDocument removed = scheduleStore.delete(id);
            ObjectNode result = MAPPER.createObjectNode();
            result.set("schedule", ScheduleJson.toJson(removed));
            return ToolResult.success("Schedule " + id + " (" + removed.getTitle() + ") deleted", result);
        } catch (ScheduleNotFoundException e) {
            return ToolResult.failure("Schedule not found: " + id + ". List schedules to find the right id");
        }
    }
}
