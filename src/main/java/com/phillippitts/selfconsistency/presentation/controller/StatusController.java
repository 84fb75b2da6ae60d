package com.phillippitts.selfconsistency.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight status endpoint; also a quick way to see the request id in structured logs.
 */
@RestController
class StatusController {

    private static final Logger log = LogManager.getLogger(StatusController.class);

    private final String serviceName;
    private final String version;

    StatusController(@Value("${spring.application.name:self-consistency-engine}") String serviceName,
                     @Value("${app.version:1.0.0}") String version) {
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> status() {
        log.debug("Status requested");
        return ResponseEntity.ok(Map.of(
                "status", "running",
                "service", serviceName,
                "version", version,
                "timestamp", Instant.now().toString()
        ));
    }
}
