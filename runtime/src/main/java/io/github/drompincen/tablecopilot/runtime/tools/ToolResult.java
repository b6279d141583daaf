package io.github.drompincen.tablecopilot.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record ToolResult(
        boolean success,
        String message,
        JsonNode data,
        String error
) {
    public static ToolResult success(String message, JsonNode data) {
        return new ToolResult(true, message, data, null);
    }

    public static ToolResult success(JsonNode data) {
        return new ToolResult(true, null, data, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, null, error);
    }

    /** The JSON fed back to the model as the tool turn. */
    public ObjectNode render(String toolName) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("tool", toolName);
        node.put("success", success);
        if (message != null) node.put("message", message);
        if (data != null) node.set("data", data);
        if (error != null) node.put("error", error);
        return node;
    }
}
