package com.phillippitts.tastemodel.presentation.controller;

import com.phillippitts.tastemodel.domain.ControllerEvent;
import com.phillippitts.tastemodel.domain.Feedback;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.service.pipeline.PipelineStatus;
import com.phillippitts.tastemodel.service.pipeline.RetrainCoordinator;
import com.phillippitts.tastemodel.service.pipeline.TriggerResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Control surface of the retrain pipeline. Feedback endpoints answer 202 and never wait on
 * the collector.
 */
@RestController
@RequestMapping("/pipeline")
class PipelineController {

    private static final Logger LOG = LogManager.getLogger(PipelineController.class);

    private final RetrainCoordinator coordinator;

    PipelineController(RetrainCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/status")
    PipelineStatus status() {
        return coordinator.status();
    }

    @PostMapping("/start")
    Map<String, Object> start() {
        coordinator.start();
        return Map.of("running", coordinator.isRunning(), "state", coordinator.state());
    }

    @PostMapping("/stop")
    Map<String, Object> stop() {
        coordinator.stop();
        return Map.of("running", coordinator.isRunning(), "state", coordinator.state());
    }

    @PostMapping("/train")
    ResponseEntity<Map<String, Object>> train(@RequestParam(required = false) String modelType,
                                              @RequestParam(defaultValue = "false") boolean force) {
        String type = modelType == null || modelType.isBlank() ? coordinator.status().modelType() : modelType;
        TriggerResult result = coordinator.triggerTrain(type, force);
        LOG.info("Train requested: modelType={}, force={}, result={}", type, force, result);
        HttpStatus status = result == TriggerResult.STARTED ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(Map.of("modelType", type, "result", result));
    }

    @PostMapping("/feedback")
    ResponseEntity<Map<String, Object>> feedback(@RequestBody FeedbackRequest request) {
        if (request.trackId() == null || request.trackId().isBlank()) {
            throw new InvalidInputException("trackId", "must not be blank");
        }
        if (request.rating() == null) {
            throw new InvalidInputException("rating", "is required");
        }
        boolean accepted = coordinator.collectFeedback(
                new Feedback(request.trackId(), request.rating(), Instant.now()));
        return ResponseEntity.accepted().body(Map.of("accepted", accepted));
    }

    @PostMapping("/controller-data")
    ResponseEntity<Map<String, Object>> controllerData(@RequestBody Map<String, Object> payload) {
        Map<String, Object> attributes = new HashMap<>(payload);
        attributes.values().removeIf(v -> v == null);
        Object type = attributes.remove("type");
        boolean accepted = coordinator.collectControllerData(
                new ControllerEvent(type == null ? null : type.toString(), attributes, Instant.now()));
        return ResponseEntity.accepted().body(Map.of("accepted", accepted));
    }

    record FeedbackRequest(String trackId, Double rating) {}
}
