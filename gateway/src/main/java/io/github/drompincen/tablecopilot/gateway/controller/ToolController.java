package io.github.drompincen.tablecopilot.gateway.controller;

import io.github.drompincen.tablecopilot.protocol.api.ToolDescriptor;
import io.github.drompincen.tablecopilot.runtime.tools.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.get(name)
                .map(t -> ResponseEntity.ok(new ToolDescriptor(
                        t.name(), t.description(), t.inputSchema(), t.outputSchema(), t.terminal())))
                .orElse(ResponseEntity.notFound().build());
    }
}
