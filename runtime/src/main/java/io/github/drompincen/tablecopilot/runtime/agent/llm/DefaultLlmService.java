package io.github.drompincen.tablecopilot.runtime.agent.llm;

import io.github.drompincen.tablecopilot.runtime.agent.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Completions from the OpenAI-compatible chat model configured under
 * {@code spring.ai.openai.*} (OpenRouter by default). Without a real key it
 * answers every request with an onboarding message instead of failing.
 */
@Service
@ConditionalOnProperty(name = "tablecopilot.llm.provider", havingValue = "openai", matchIfMissing = true)
public class DefaultLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(DefaultLlmService.class);

    static final String PLACEHOLDER_PREFIX = "sk-placeholder";

    static final String ONBOARDING_MESSAGE = """
            **Welcome to Table Copilot!** No API key is configured yet.

            Set `OPENROUTER_API_KEY` (https://openrouter.ai/keys) and restart.
            Optionally set `MODEL_NAME` to pick a different model.

            To try the assistant without a key, start with `TABLECOPILOT_LLM_PROVIDER=fake`.""";

    private final ChatModel chatModel;
    private final Environment environment;

    public DefaultLlmService(@Autowired(required = false) ChatModel chatModel, Environment environment) {
        this.chatModel = chatModel;
        this.environment = environment;
        log.info("DefaultLlmService initialized, model={}, key={}",
                environment.getProperty("spring.ai.openai.chat.options.model", "unset"),
                hasRealKey() ? "configured" : "missing");
    }

    private boolean hasRealKey() {
        String key = environment.getProperty("spring.ai.openai.api-key", "");
        return !key.isBlank() && !key.startsWith(PLACEHOLDER_PREFIX);
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null && hasRealKey();
    }

    @Override
    public String getProviderInfo() {
        return isAvailable()
                ? environment.getProperty("spring.ai.openai.chat.options.model", "openai")
                : "No API Key";
    }

    @Override
    public Flux<String> streamResponse(CompletionRequest request) {
        if (!isAvailable()) {
            return Flux.just(ONBOARDING_MESSAGE);
        }
        log.debug("Streaming completion for session {} ({} turns)", request.sessionId(), request.history().size());

        return chatModel.stream(buildPrompt(request))
                .map(response -> {
                    if (response.getResult() != null && response.getResult().getOutput() != null) {
                        String text = response.getResult().getOutput().getText();
                        return text != null ? text : "";
                    }
                    return "";
                })
                .filter(text -> !text.isEmpty());
    }

    @Override
    public String blockingResponse(CompletionRequest request) {
        if (!isAvailable()) {
            return ONBOARDING_MESSAGE;
        }
        var response = chatModel.call(buildPrompt(request));
        return response.getResult().getOutput().getText();
    }

    Prompt buildPrompt(CompletionRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        for (Turn turn : request.history()) {
            switch (turn.role()) {
                case ASSISTANT -> messages.add(new AssistantMessage(turn.content()));
                // Tool output goes back as user input; the model only speaks the inline protocol
                case TOOL -> messages.add(new UserMessage("[tool result: " + turn.name() + "]\n" + turn.content()));
                default -> messages.add(new UserMessage(turn.content()));
            }
        }
        return new Prompt(messages);
    }
}
