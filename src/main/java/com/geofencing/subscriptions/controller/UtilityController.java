package com.geofencing.subscriptions.controller;

import com.geofencing.subscriptions.dto.CloudEventRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Health check and a local notification sink.
 *
 * Pointing a subscription sink at http://localhost:8080/callback lets you watch
 * the emitted CloudEvents in the service log without running a separate receiver.
 */
@RestController
@Slf4j
@Tag(name = "Utility", description = "Health check and test callback sink")
public class UtilityController {

    static final List<String> APIS = List.of(
            "geofencing-subscriptions/v0.4",
            "location-verification/v1",
            "location-retrieval/v0.4"
    );

    /**
     * Health check endpoint.
     *
     * Example:
     * GET /health
     */
    @Operation(summary = "Health check")
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Geofencing Subscriptions Service",
            "apis", APIS,
            "timestamp", Instant.now().toString()
        ));
    }

    @Operation(summary = "Test callback sink", description = "Logs a received CloudEvent and acknowledges it.")
    @PostMapping("/callback")
    public ResponseEntity<Map<String, Boolean>> callback(@RequestBody CloudEventRecord event) {
        log.info("Callback received {}: {}", event.toLogString(), event.data());
        return ResponseEntity.ok(Map.of("received", true));
    }
}
