package io.github.drompincen.tablecopilot.runtime.agent;

import io.github.drompincen.tablecopilot.runtime.agent.llm.LlmService;
import io.github.drompincen.tablecopilot.runtime.lock.SessionLockService;
import io.github.drompincen.tablecopilot.runtime.tools.ToolRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns every live {@link AgentSession}, keyed by session id. Created with the
 * application context and emptied when it shuts down.
 */
@Service
public class AgentSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionRegistry.class);

    private final ConcurrentMap<String, AgentSession> sessions = new ConcurrentHashMap<>();

    private final LlmService llmService;
    private final ToolRegistry toolRegistry;
    private final SessionLockService lockService;
    private final SystemPromptBuilder promptBuilder;
    private final Clock clock;
    private final int maxToolInvocations;

    public AgentSessionRegistry(LlmService llmService,
                                ToolRegistry toolRegistry,
                                SessionLockService lockService,
                                SystemPromptBuilder promptBuilder,
                                Clock clock,
                                @Value("${tablecopilot.agent.max-tool-invocations:10}") int maxToolInvocations) {
        if (maxToolInvocations < 1) {
            throw new IllegalArgumentException("max-tool-invocations must be positive: " + maxToolInvocations);
        }
        this.llmService = llmService;
        this.toolRegistry = toolRegistry;
        this.lockService = lockService;
        this.promptBuilder = promptBuilder;
        this.clock = clock;
        this.maxToolInvocations = maxToolInvocations;
    }

    public AgentSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("Creating session {}", id);
            return new AgentSession(id, llmService, toolRegistry, lockService, promptBuilder,
                    clock, maxToolInvocations);
        });
    }

    public AgentTurnResult process(String sessionId, String userText) {
        return getOrCreate(sessionId).process(userText);
    }

    public Optional<AgentSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return false if no such session exists */
    public boolean clear(String sessionId) {
        AgentSession session = sessions.get(sessionId);
        if (session == null) return false;
        session.clear();
        return true;
    }

    /** Drops the session and, when no turn is running on it, its lock. */
    public boolean remove(String sessionId) {
        AgentSession removed = sessions.remove(sessionId);
        if (removed != null) {
            boolean lockDropped = lockService.release(sessionId);
            log.info("Removed session {} (lock released: {})", sessionId, lockDropped);
        }
        return removed != null;
    }

    public Set<String> ids() {
        return new TreeSet<>(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    public int getMaxToolInvocations() {
        return maxToolInvocations;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down session registry with {} session(s)", sessions.size());
        sessions.clear();
    }
}
