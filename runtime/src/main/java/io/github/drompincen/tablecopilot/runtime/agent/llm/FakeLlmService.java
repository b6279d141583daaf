package io.github.drompincen.tablecopilot.runtime.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tablecopilot.runtime.agent.Turn;
import io.github.drompincen.tablecopilot.runtime.agent.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Fake LLM service for running without an API key. Lists schedules when
 * asked to, summarizes tool output, and otherwise echoes the user.
 *
 * Activate with: TABLECOPILOT_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "tablecopilot.llm.provider", havingValue = "fake")
public class FakeLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final long tokenDelayMs;

    public FakeLlmService(@Value("${tablecopilot.llm.fake.token-delay-ms:30}") long tokenDelayMs) {
        this.tokenDelayMs = tokenDelayMs;
    }

    @Override
    public Flux<String> streamResponse(CompletionRequest request) {
        String response = generateResponse(request);
        log.debug("[FAKE LLM] session={}, response length={}", request.sessionId(), response.length());
        // Stream word by word to exercise fragment assembly
        Flux<String> words = Flux.fromArray(response.split("(?<=\\s)"));
        return tokenDelayMs > 0 ? words.delayElements(Duration.ofMillis(tokenDelayMs)) : words;
    }

    @Override
    public String blockingResponse(CompletionRequest request) {
        return generateResponse(request);
    }

    String generateResponse(CompletionRequest request) {
        Turn last = request.lastTurn();
        if (last == null) {
            return "Hello! I can book, list, change and cancel your reservations.";
        }
        if (last.role() == TurnRole.TOOL) {
            return summarizeToolResult(last);
        }

        String lower = last.content().toLowerCase();
        if ((lower.contains("list") || lower.contains("show"))
                && (lower.contains("schedule") || lower.contains("reservation") || lower.contains("booking"))) {
            return "Let me check your schedule.\n<tool_call>{\"name\":\"list_schedules\",\"args\":{\"status\":\"all\"}}</tool_call>";
        }
        return "You said: " + last.content();
    }

    private String summarizeToolResult(Turn toolTurn) {
        try {
            JsonNode result = MAPPER.readTree(toolTurn.content());
            if (!result.path("success").asBoolean(false)) {
                return "The " + toolTurn.name() + " tool reported a problem: " + result.path("error").asText("unknown error");
            }
            String message = result.path("message").asText("");
            return message.isBlank() ? "Done." : message;
        } catch (Exception e) {
            log.warn("[FAKE LLM] unreadable tool result from {}", toolTurn.name(), e);
            return "Done.";
        }
    }
}
