package com.phillippitts.tastemodel.presentation.controller;

import com.phillippitts.tastemodel.domain.VersionInfo;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.service.pipeline.RetrainCoordinator;
import com.phillippitts.tastemodel.service.registry.LoadedModel;
import com.phillippitts.tastemodel.service.registry.ModelRegistry;
import com.phillippitts.tastemodel.service.registry.VersionComparison;
import com.phillippitts.tastemodel.service.registry.VersionRef;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read and maintenance access to the model registry.
 */
@RestController
@RequestMapping("/models")
class ModelController {

    private final ModelRegistry registry;
    private final RetrainCoordinator coordinator;

    ModelController(ModelRegistry registry, RetrainCoordinator coordinator) {
        this.registry = registry;
        this.coordinator = coordinator;
    }

    @GetMapping
    List<String> modelTypes() {
        return registry.modelTypes();
    }

    @GetMapping("/{type}/versions")
    List<VersionInfo> versions(@PathVariable String type) {
        return registry.listVersions(type);
    }

    /**
     * Verified load of a version ({@code latest}, {@code v3} or {@code 3}); the artifact bytes
     * are not returned.
     */
    @GetMapping("/{type}/versions/{version}")
    Map<String, Object> version(@PathVariable String type, @PathVariable String version) {
        LoadedModel model = registry.loadVersion(type, parseRef(version));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelType", model.modelType());
        body.put("version", model.version());
        body.put("artifactHash", model.artifactHash());
        body.put("artifactBytes", model.artifact().length);
        body.put("metadata", model.metadata());
        body.put("metrics", model.metrics());
        return body;
    }

    @GetMapping("/{type}/compare")
    VersionComparison compare(@PathVariable String type, @RequestParam int a, @RequestParam int b) {
        return registry.compareVersions(type, a, b);
    }

    @PostMapping("/{type}/rollback/{version}")
    Map<String, Object> rollback(@PathVariable String type, @PathVariable int version) {
        if (!coordinator.rollback(type, version)) {
            throw NotFoundException.modelVersion(type, version);
        }
        return Map.of("modelType", type, "latest", version);
    }

    @DeleteMapping("/{type}/versions/{version}")
    ResponseEntity<Void> delete(@PathVariable String type, @PathVariable int version) {
        if (!registry.deleteVersion(type, version)) {
            throw NotFoundException.modelVersion(type, version);
        }
        return ResponseEntity.noContent().build();
    }

    private static VersionRef parseRef(String text) {
        try {
            return VersionRef.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("version", "expected 'latest', 'vN' or N, got: " + text);
        }
    }
}
