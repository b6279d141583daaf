package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.runtime.tools.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.drompincen.tablecopilot.tools.ScheduleJson.MAPPER;

/**
 * Asks the user a structured clarification question. Terminal: the rendered
 * markdown is sent as the reply and the model waits for the user's answer.
 */
public class AskUserQuestionTool implements Tool {

    static final String SINGLE_CHOICE = "single_choice";
    static final String MULTI_CHOICE = "multi_choice";
    static final String BOOLEAN = "boolean";
    private static final Set<String> QUESTION_TYPES = Set.of(SINGLE_CHOICE, MULTI_CHOICE, BOOLEAN);
    private static final String LABELS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    @Override public String name() { return "askUserQuestion"; }

    @Override public String description() {
        return "Ask the user a clarification question when the request is ambiguous or missing details. " +
               "Ends your turn; the user's answer arrives as the next message.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("question").put("type", "string").put("minLength", 1);
        props.putObject("question_type").put("type", "string")
                .put("description", "single_choice, multi_choice or boolean (default single_choice)");
        ObjectNode options = props.putObject("options");
        options.put("type", "array");
        options.putObject("items").put("type", "string");
        options.put("description", "Choices; at least 2 for single_choice and multi_choice");
        schema.putArray("required").add("question");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }

    @Override public boolean terminal() { return true; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        String question = input.path("question").asText("").trim();
        if (question.isEmpty()) return ToolResult.failure("'question' is required");

        String type = input.path("question_type").asText(SINGLE_CHOICE).trim().toLowerCase();
        if (!QUESTION_TYPES.contains(type)) {
            return ToolResult.failure("Unsupported question_type '" + type + "'. Use single_choice, multi_choice or boolean");
        }

        List<String> options = new ArrayList<>();
        if (!BOOLEAN.equals(type)) {
            for (JsonNode option : input.path("options")) {
                String text = option.asText("").trim();
                if (!text.isEmpty()) options.add(text);
            }
            if (options.size() < 2) {
                return ToolResult.failure(type + " questions need at least 2 non-empty options");
            }
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("question", question);
        result.put("question_type", type);
        options.forEach(result.putArray("options")::add);
        result.put("markdown", markdown(question, type, options));
        return ToolResult.success("Question sent to the user", result);
    }

    static String markdown(String question, String type, List<String> options) {
        StringBuilder sb = new StringBuilder();
        sb.append("To get this right I need to check one thing:\n\n");
        sb.append("**").append(question).append("**\n\n");
        for (int i = 0; i < options.size(); i++) {
            String label = i < LABELS.length() ? String.valueOf(LABELS.charAt(i)) : String.valueOf(i + 1);
            sb.append("- ").append(label).append(". ").append(options.get(i)).append('\n');
        }
        if (!options.isEmpty()) sb.append('\n');
        switch (type) {
            case BOOLEAN -> sb.append("_Please answer yes or no._");
            case MULTI_CHOICE -> sb.append("_Pick one or more letters, for example A,C._");
            default -> sb.append("_Reply with the letter of your choice._");
        }
        return sb.toString();
    }
}
