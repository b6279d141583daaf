package io.github.drompincen.tablecopilot.gateway.controller;

import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleStore store;

    public ScheduleController(ScheduleStore store) {
        this.store = store;
    }

    /**
     * Lists stored schedules sorted by time. {@code status} narrows to one
     * status; absent or {@code all} returns everything.
     */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String status) {
        List<ScheduleDocument> all = store.list();
        if (status == null || status.isBlank() || "all".equalsIgnoreCase(status)) {
            return ResponseEntity.ok(all);
        }
        Optional<ScheduleStatus> wanted = ScheduleStatus.parse(status);
        if (wanted.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }
        return ResponseEntity.ok(all.stream().filter(s -> s.getStatus() == wanted.get()).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduleDocument> get(@PathVariable String id) {
        return store.find(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }
}
