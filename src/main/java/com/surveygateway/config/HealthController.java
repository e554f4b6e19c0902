package com.surveygateway.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ReadinessHealthIndicator readinessHealthIndicator;
    private final GatewayConfigSnapshot config;

    public HealthController(ReadinessHealthIndicator readinessHealthIndicator, GatewayConfigSnapshot config) {
        this.readinessHealthIndicator = readinessHealthIndicator;
        this.config = config;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health dbHealth = readinessHealthIndicator.health();

        Map<String, Object> response = new HashMap<>();
        response.put("status", dbHealth.getStatus().getCode());
        response.put("timestamp", Instant.now().toString());
        response.put("serviceEnabled", config.isServiceEnabled());

        Map<String, Object> checks = new HashMap<>();
        checks.put("db", dbHealth.getDetails().getOrDefault("database", dbHealth.getStatus().getCode()));
        response.put("checks", checks);

        HttpStatus status = Status.UP.equals(dbHealth.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
