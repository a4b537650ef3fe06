package com.factql.controller;

import com.factql.api.HealthResponse;
import com.factql.service.FactQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final FactQueryService factQueryService;

    public HealthController(FactQueryService factQueryService) {
        this.factQueryService = factQueryService;
    }

    /**
     * Store reachability.
     *
     * GET /health
     *
     * @return 200 {@code {"status":"ok"}} or 503 {@code {"status":"unhealthy","error":...}}
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse response = factQueryService.health();
        HttpStatus status = response.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
