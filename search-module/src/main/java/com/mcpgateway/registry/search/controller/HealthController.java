package com.mcpgateway.registry.search.controller;

import com.mcpgateway.registry.common.exception.IndexBackendException;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health Check", description = "Health check endpoints for monitoring")
public class HealthController {

    private final VectorIndexStore store;

    @GetMapping
    @Operation(summary = "Health check",
               description = "Check that the search index is reachable and report its mode")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Service is healthy"),
        @ApiResponse(responseCode = "503", description = "Vector store is unreachable")
    })
    public ResponseEntity<Map<String, Object>> getHealth() {
        log.debug("Health check requested");
        try {
            return ResponseEntity.ok(Map.of(
                "status", "UP",
                "backend", store.backendName(),
                "mode", store.mode().wireName(),
                "records", store.size()));
        } catch (IndexBackendException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "status", "DOWN",
                "backend", store.backendName(),
                "error", e.getMessage()));
        }
    }
}
