package com.teamlens.dispatch.api;

import com.teamlens.core.health.HealthCheckService;
import com.teamlens.core.health.HealthReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: observer count, watched directories and per-component status.
     * 503 when any component is DOWN.
     */
    @GetMapping
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthCheckService != null ? healthCheckService.check() : HealthReport.unavailable();
        return ResponseEntity.status(report.isDown() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(report);
    }
}
