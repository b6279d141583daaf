package io.github.drompincen.tablecopilot.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.protocol.api.ThoughtDto;
import io.github.drompincen.tablecopilot.protocol.api.ToolCallDto;
import io.github.drompincen.tablecopilot.runtime.agent.ToolCallParser.ToolCallRequest;
import io.github.drompincen.tablecopilot.runtime.agent.llm.CompletionRequest;
import io.github.drompincen.tablecopilot.runtime.agent.llm.LlmService;
import io.github.drompincen.tablecopilot.runtime.lock.SessionLockService;
import io.github.drompincen.tablecopilot.runtime.tools.Tool;
import io.github.drompincen.tablecopilot.runtime.tools.ToolContext;
import io.github.drompincen.tablecopilot.runtime.tools.ToolException;
import io.github.drompincen.tablecopilot.runtime.tools.ToolRegistry;
import io.github.drompincen.tablecopilot.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One conversation. {@link #process(String)} appends the user turn and drives
 * the model/tool loop until the model answers in plain text, a terminal tool
 * asks the user something, or the tool budget runs out. History is only
 * mutated while holding the session's lock.
 */
public class AgentSession {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);

    private final String sessionId;
    private final LlmService llmService;
    private final ToolRegistry toolRegistry;
    private final SessionLockService lockService;
    private final SystemPromptBuilder promptBuilder;
    private final Clock clock;
    private final int maxToolInvocations;

    private final List<Turn> history = new CopyOnWriteArrayList<>();
    private final Instant createdAt;
    private volatile Instant lastActiveAt;

    public AgentSession(String sessionId, LlmService llmService, ToolRegistry toolRegistry,
                        SessionLockService lockService, SystemPromptBuilder promptBuilder,
                        Clock clock, int maxToolInvocations) {
        this.sessionId = sessionId;
        this.llmService = llmService;
        this.toolRegistry = toolRegistry;
        this.lockService = lockService;
        this.promptBuilder = promptBuilder;
        this.clock = clock;
        this.maxToolInvocations = maxToolInvocations;
        this.createdAt = clock.instant();
        this.lastActiveAt = createdAt;
    }

    public AgentTurnResult process(String userText) {
        return lockService.withLock(sessionId, () -> runTurn(userText));
    }

    /** Empties the history; the session keeps its identity. */
    public void clear() {
        lockService.withLock(sessionId, () -> {
            history.clear();
            lastActiveAt = clock.instant();
            return null;
        });
        log.info("[{}] History cleared", sessionId);
    }

    private AgentTurnResult runTurn(String userText) {
        append(Turn.user(userText));

        List<Turn> produced = new ArrayList<>();
        List<ToolCallDto> toolCalls = new ArrayList<>();
        List<ThoughtDto> thoughts = new ArrayList<>();
        int invocations = 0;

        while (true) {
            String completion = complete();
            List<ToolCallRequest> requests = ToolCallParser.parse(completion);

            if (requests.isEmpty()) {
                produced.add(Turn.assistant(ToolCallParser.stripToolCalls(completion)));
                Turn reply = AssistantReplyExtractor.extract(produced);
                append(reply);
                return new AgentTurnResult(reply.content(), toolCalls, thoughts);
            }

            String thought = ToolCallParser.stripToolCalls(completion).trim();
            if (!thought.isEmpty()) {
                thoughts.add(ThoughtDto.assistant(thought));
            }
            log.info("[{}] Executing {} tool call(s)", sessionId, requests.size());
            for (ToolCallRequest request : requests) {
                if (invocations == maxToolInvocations) {
                    log.warn("[{}] Tool invocation limit {} reached", sessionId, maxToolInvocations);
                    throw new ToolLoopExceededException(maxToolInvocations);
                }
                invocations++;

                ToolResult result = invoke(request);
                ObjectNode rendered = result.render(request.name());
                Turn toolTurn = Turn.tool(request.name(), rendered.toString());
                append(toolTurn);
                produced.add(toolTurn);
                toolCalls.add(new ToolCallDto(request.name(), request.args(), result.success(),
                        result.data(), result.error()));

                if (result.success() && isTerminal(request.name())) {
                    JsonNode markdown = result.data() != null ? result.data().path("markdown") : null;
                    String content = markdown != null && markdown.isTextual()
                            ? markdown.asText()
                            : result.message();
                    produced.add(Turn.assistant(content));
                    Turn reply = AssistantReplyExtractor.extract(produced);
                    append(reply);
                    return new AgentTurnResult(reply.content(), toolCalls, thoughts);
                }
            }
        }
    }

    private String complete() {
        CompletionRequest request = new CompletionRequest(sessionId,
                promptBuilder.build(toolRegistry.descriptors()), history);
        long start = System.currentTimeMillis();
        try {
            StringBuilder sb = new StringBuilder();
            llmService.streamResponse(request)
                    .doOnNext(sb::append)
                    .blockLast();
            log.debug("[{}] Completion of {} chars in {} ms", sessionId, sb.length(),
                    System.currentTimeMillis() - start);
            return sb.toString();
        } catch (RuntimeException e) {
            log.error("[{}] LLM call failed", sessionId, e);
            throw new AgentProcessingException("The language model could not be reached", e);
        }
    }

    private ToolResult invoke(ToolCallRequest request) {
        log.info("[{}] [tool] {} args={}", sessionId, request.name(), request.args());
        try {
            return toolRegistry.invoke(request.name(), request.args(), new ToolContext(sessionId, clock));
        } catch (ToolException e) {
            log.error("[{}] Tool call {} failed", sessionId, request.name(), e);
            throw new AgentProcessingException("A tool call failed while handling your message", e);
        }
    }

    private boolean isTerminal(String toolName) {
        return toolRegistry.get(toolName).map(Tool::terminal).orElse(false);
    }

    private void append(Turn turn) {
        history.add(turn);
        lastActiveAt = clock.instant();
    }

    public String getSessionId() { return sessionId; }

    public List<Turn> getHistory() { return List.copyOf(history); }

    public int getTurnCount() { return history.size(); }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getLastActiveAt() { return lastActiveAt; }

    public LlmService getLlmService() { return llmService; }
}
