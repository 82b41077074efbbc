package com.adlanda.repoindexer.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint listing the available operations.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Repo Indexer",
                "version", appVersion,
                "endpoints", Map.of(
                        "scan", "POST /api/v1/scan - Scan a repository and rebuild the index",
                        "snapshot", "GET /api/v1/snapshot - Summary of the current snapshot",
                        "query", "POST /api/v1/query - Search indexed chunks",
                        "sources", "GET /api/v1/sources - Index statistics",
                        "dependencies", "GET /api/v1/dependencies - File-level import graph",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
