package io.github.drompincen.tablecopilot.runtime.agent.llm;

import io.github.drompincen.tablecopilot.runtime.agent.ToolCallParser;
import io.github.drompincen.tablecopilot.runtime.agent.Turn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FakeLlmServiceTest {

    private final FakeLlmService fake = new FakeLlmService(0);

    @Test
    void echoesPlainMessagesWordByWord() {
        CompletionRequest request = new CompletionRequest("s1", "sys", List.of(Turn.user("hello there")));

        List<String> fragments = fake.streamResponse(request).collectList().block();

        assertThat(fragments).hasSizeGreaterThan(1);
        assertThat(String.join("", fragments)).isEqualTo("You said: hello there");
    }

    @Test
    void listRequestProducesToolCall() {
        CompletionRequest request = new CompletionRequest("s1", "sys", List.of(Turn.user("Show my reservations")));

        String response = fake.blockingResponse(request);

        assertThat(ToolCallParser.parse(response)).extracting(ToolCallParser.ToolCallRequest::name)
                .containsExactly("list_schedules");
    }

    @Test
    void summarizesToolResults() {
        CompletionRequest ok = new CompletionRequest("s1", "sys", List.of(
                Turn.user("list schedules"),
                Turn.tool("list_schedules", "{\"tool\":\"list_schedules\",\"success\":true,\"message\":\"Found 2 schedule(s)\"}")));
        CompletionRequest failed = new CompletionRequest("s1", "sys", List.of(
                Turn.user("list schedules"),
                Turn.tool("list_schedules", "{\"tool\":\"list_schedules\",\"success\":false,\"error\":\"bad status\"}")));

        assertThat(fake.blockingResponse(ok)).isEqualTo("Found 2 schedule(s)");
        assertThat(fake.blockingResponse(failed)).contains("bad status");
    }
}
