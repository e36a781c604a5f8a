package com.f1.prediction.controller;

import com.f1.prediction.dto.ModelStatus;
import com.f1.prediction.service.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/models")
@Tag(name = "Models", description = "Loaded model bundles")
public class ModelController {

    private final ModelRegistry modelRegistry;

    public ModelController(ModelRegistry modelRegistry) {
        this.modelRegistry = modelRegistry;
    }

    @GetMapping
    @Operation(summary = "Model status", description = "Loaded version, per-role schemas and training metrics")
    public ModelStatus status() {
        return modelRegistry.status();
    }

    @GetMapping("/versions")
    @Operation(summary = "Available versions", description = "Version directories found under the model base directory")
    public List<String> versions() {
        return modelRegistry.availableVersions();
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload models", description = "Load the configured or given version and swap it in")
    public ModelStatus reload(@RequestParam(required = false) String version) {
        return version != null ? modelRegistry.reload(version) : modelRegistry.reload();
    }
}
