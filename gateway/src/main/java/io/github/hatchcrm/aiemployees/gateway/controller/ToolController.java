package io.github.hatchcrm.aiemployees.gateway.controller;

import io.github.hatchcrm.aiemployees.protocol.api.ToolDescriptor;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ai-employees/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/{key}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String key) {
        return toolRegistry.descriptors().stream()
                .filter(d -> d.key().equals(key))
                .findFirst()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
