package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;
import io.github.drompincen.tablecopilot.runtime.tools.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.github.drompincen.tablecopilot.tools.ScheduleJson.MAPPER;

public class ListSchedulesTool implements Tool {

    static final String ALL = "all";
    static final int DEFAULT_LIMIT = 10;

    private ScheduleStore scheduleStore;

    @Override public String name() { return "list_schedules"; }

    @Override public String description() {
        return "List reservations and appointments ordered by start time, optionally filtered by status.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("status").put("type", "string")
                .put("description", "pending, notified, cancelled or all (default pending)");
        props.putObject("limit").put("type", "integer").put("minimum", 1)
                .put("description", "Maximum number of schedules to return (default 10)");
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

        String status = input.path("status").asText(ScheduleStatus.PENDING.wireName()).trim().toLowerCase();
        int limit = input.path("limit").asInt(DEFAULT_LIMIT);

        List<ScheduleDocument> schedules = scheduleStore.list();
        if (!ALL.equals(status)) {
            Optional<ScheduleStatus> filter = ScheduleStatus.parse(status);
            if (filter.isEmpty()) {
                return ToolResult.failure("Invalid status '" + status + "'. Valid options: pending, notified, cancelled, all");
            }
            schedules = schedules.stream()
                    .filter(s -> s.getStatus() == filter.get())
                    .collect(Collectors.toList());
        }
        int total = schedules.size();
        schedules = schedules.stream().limit(limit).collect(Collectors.toList());

        ObjectNode result = MAPPER.createObjectNode();
        result.set("schedules", ScheduleJson.toJson(schedules));
        result.put("status", status);
        result.put("limit", limit);
        result.put("total", total);

        String message = schedules.isEmpty()
                ? (ALL.equals(status) ? "There are no schedules." : "There are no " + status + " schedules.")
                : "Found " + total + " schedule(s), returning " + schedules.size() + ".";
        return ToolResult.success(message, result);
    }
}
