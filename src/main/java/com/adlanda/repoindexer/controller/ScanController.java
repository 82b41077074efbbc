package com.adlanda.repoindexer.controller;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.exception.PathNotFoundException;
import com.adlanda.repoindexer.graph.DependencyGraphService;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.model.ScanRequest;
import com.adlanda.repoindexer.model.ScanSummary;
import com.adlanda.repoindexer.service.IngestionService;
import com.adlanda.repoindexer.service.ScanOptions;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for scanning repositories and inspecting the current snapshot.
 */
@RestController
@RequestMapping("/api/v1")
public class ScanController {

    private final IngestionService ingestionService;
    private final DependencyGraphService dependencyGraphService;
    private final IngestionProperties properties;

    public ScanController(IngestionService ingestionService,
                          DependencyGraphService dependencyGraphService,
                          IngestionProperties properties) {
        this.ingestionService = ingestionService;
        this.dependencyGraphService = dependencyGraphService;
        this.properties = properties;
    }

    /**
     * Scan a repository, rebuild the index and make both current.
     *
     * @param request Path to scan plus optional per-scan limits
     * @return Summary of the new snapshot
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanSummary> scan(@Valid @RequestBody ScanRequest request) {
        ScanOptions options = new ScanOptions(
                request.maxFiles() != null ? request.maxFiles() : properties.getMaxFiles(),
                request.maxBytesPerFile() != null ? request.maxBytesPerFile() : properties.getMaxBytesPerFile(),
                request.incremental() != null ? request.incremental() : properties.isIncremental()
        );
        RepositorySnapshot snapshot = ingestionService.ingest(Path.of(request.path()), options);
        return ResponseEntity.ok(ScanSummary.from(snapshot));
    }

    @GetMapping("/snapshot")
    public ResponseEntity<ScanSummary> snapshot() {
        return ingestionService.currentSnapshot()
                .map(ScanSummary::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * File-level import graph of the current snapshot.
     */
    @GetMapping("/dependencies")
    public ResponseEntity<Map<String, Set<String>>> dependencies() {
        return ingestionService.currentSnapshot()
                .map(dependencyGraphService::build)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(PathNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handlePathNotFound(PathNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "error", e.getMessage(),
                "path", e.getPath().toString()
        ));
    }
}
