package com.phillippitts.tastemodel.presentation.controller;

import com.phillippitts.tastemodel.domain.HealthCheckResult;
import com.phillippitts.tastemodel.domain.HealthSample;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.service.health.HealthMonitor;
import com.phillippitts.tastemodel.service.health.HealthSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Serving health: an on-demand check, the recent history and a trend summary.
 */
@RestController
@RequestMapping("/monitor/health")
class MonitorController {

    private final HealthMonitor monitor;

    MonitorController(HealthMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    HealthCheckResult check() {
        return monitor.checkHealth();
    }

    @GetMapping("/history")
    List<HealthSample> history(@RequestParam(defaultValue = "24") int hours) {
        if (hours <= 0) {
            throw new InvalidInputException("hours", "must be positive, got: " + hours);
        }
        return monitor.getHistory(hours);
    }

    @GetMapping("/summary")
    HealthSummary summary() {
        return monitor.summary();
    }
}
