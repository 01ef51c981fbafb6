package com.codewatch.dispatch.api;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller listing registered capabilities.
 */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private final CapabilityRegistry registry;

    public CapabilityController(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, String>>> listCapabilities() {
        var list = registry.all().stream().map(CapabilityController::describe).toList();
        return ResponseEntity.ok(list);
    }

    private static Map<String, String> describe(Capability capability) {
        var entry = new LinkedHashMap<String, String>();
        entry.put("capability_id", capability.id());
        entry.put("source_id", capability.sourceId());
        entry.put("role", capability.role().name().toLowerCase());
        entry.put("description", capability.description());
        return entry;
    }
}
