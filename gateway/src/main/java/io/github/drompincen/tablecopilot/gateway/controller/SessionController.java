package io.github.drompincen.tablecopilot.gateway.controller;

import io.github.drompincen.tablecopilot.protocol.api.SessionDto;
import io.github.drompincen.tablecopilot.runtime.agent.AgentSession;
import io.github.drompincen.tablecopilot.runtime.agent.AgentSessionRegistry;
import io.github.drompincen.tablecopilot.runtime.agent.Turn;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final AgentSessionRegistry registry;

    public SessionController(AgentSessionRegistry registry) {
        this.registry = registry;
    }

    /** Summaries only; history is left out of the listing. */
    @GetMapping
    public List<SessionDto> list() {
        return registry.ids().stream()
                .flatMap(id -> registry.find(id).stream())
                .map(s -> toDto(s, false))
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionDto> get(@PathVariable String id) {
        return registry.find(id)
                .map(s -> ResponseEntity.ok(toDto(s, true)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}/history")
    public ResponseEntity<Void> clearHistory(@PathVariable String id) {
        return registry.clear(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return registry.remove(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private static SessionDto toDto(AgentSession session, boolean withHistory) {
        var history = session.getHistory();
        return new SessionDto(session.getSessionId(), session.getCreatedAt(), session.getLastActiveAt(),
                history.size(), withHistory ? history.stream().map(Turn::toDto).toList() : List.of());
    }
}
