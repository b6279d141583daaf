package io.github.drompincen.tablecopilot.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void renderSuccessIncludesMessageAndData() {
        ToolResult result = ToolResult.success("Created", mapper.createObjectNode().put("id", "ab12cd34"));

        ObjectNode json = result.render("create_schedule");

        assertThat(json.get("tool").asText()).isEqualTo("create_schedule");
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("message").asText()).isEqualTo("Created");
        assertThat(json.get("data").get("id").asText()).isEqualTo("ab12cd34");
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void renderFailureOmitsData() {
        ObjectNode json = ToolResult.failure("Schedule not found: x").render("delete_schedule");

        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("error").asText()).isEqualTo("Schedule not found: x");
        assertThat(json.has("data")).isFalse();
        assertThat(json.has("message")).isFalse();
    }
}
