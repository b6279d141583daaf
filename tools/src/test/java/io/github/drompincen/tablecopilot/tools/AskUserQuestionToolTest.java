package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.runtime.tools.ToolResult;
import org.junit.jupiter.api.Test;

import static io.github.drompincen.tablecopilot.tools.ScheduleToolTestSupport.CTX;
import static org.assertj.core.api.Assertions.assertThat;

class AskUserQuestionToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final AskUserQuestionTool tool = new AskUserQuestionTool();

    @Test
    void singleChoiceRendersLetteredOptions() {
        ObjectNode input = MAPPER.createObjectNode().put("question", "Which evening works?");
        input.putArray("options").add("Friday").add(" ").add("Saturday");

        ToolResult result = tool.execute(CTX, input);

        assertThat(tool.terminal()).isTrue();
        assertThat(result.success()).isTrue();
        assertThat(result.data().path("question_type").asText()).isEqualTo("single_choice");
        assertThat(result.data().path("options")).hasSize(2);
        assertThat(result.data().path("markdown").asText())
                .contains("**Which evening works?**")
                .contains("- A. Friday")
                .contains("- B. Saturday")
                .contains("letter of your choice");
    }

    @Test
    void choiceQuestionsNeedTwoOptions() {
        ObjectNode input = MAPPER.createObjectNode()
                .put("question", "Pick toppings").put("question_type", "multi_choice");
        input.putArray("options").add("Cheese");

        ToolResult result = tool.execute(CTX, input);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("at least 2");
    }

    @Test
    void booleanNeedsNoOptions() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode()
                .put("question", "Should I add a reminder?").put("question_type", "boolean"));

        assertThat(result.success()).isTrue();
        assertThat(result.data().path("options")).isEmpty();
        assertThat(result.data().path("markdown").asText()).contains("yes or no");
    }

    @Test
    void unknownTypeFails() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode()
                .put("question", "?").put("question_type", "essay"));

        assertThat(result.success()).isFalse();
    }
}
