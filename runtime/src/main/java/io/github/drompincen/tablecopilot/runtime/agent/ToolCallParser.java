package io.github.drompincen.tablecopilot.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds inline tool calls in a completion:
 * {@code <tool_call>{"name":"...","args":{...}}</tool_call>}.
 */
public final class ToolCallParser {

    private static final Logger log = LoggerFactory.getLogger(ToolCallParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern TOOL_CALL_PATTERN =
            Pattern.compile("<tool_call>\\s*(\\{.*?\\})\\s*</tool_call>", Pattern.DOTALL);

    public record ToolCallRequest(String name, JsonNode args) {}

    private ToolCallParser() {}

    public static List<ToolCallRequest> parse(String completion) {
        if (completion == null) return List.of();
        List<ToolCallRequest> calls = new ArrayList<>();
        Matcher matcher = TOOL_CALL_PATTERN.matcher(completion);
        while (matcher.find()) {
            String json = matcher.group(1);
            try {
                JsonNode node = MAPPER.readTree(json);
                String name = node.path("name").asText(null);
                JsonNode args = node.path("args");
                if (args.isMissingNode() || args.isNull()) {
                    args = JsonNodeFactory.instance.objectNode();
                }
                if (name != null && !name.isBlank()) {
                    calls.add(new ToolCallRequest(name, args));
                }
            } catch (Exception e) {
                log.warn("Failed to parse tool call JSON: {}", json, e);
            }
        }
        return calls;
    }

    /** Text outside the tool call blocks. */
    public static String stripToolCalls(String completion) {
        if (completion == null) return "";
        return TOOL_CALL_PATTERN.matcher(completion).replaceAll("").trim();
    }
}
