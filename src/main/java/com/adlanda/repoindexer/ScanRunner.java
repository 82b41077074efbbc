package com.adlanda.repoindexer;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Scans the configured repository on application startup.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class ScanRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScanRunner.class);

    private final IngestionService ingestionService;
    private final IngestionProperties properties;

    public ScanRunner(IngestionService ingestionService, IngestionProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Startup scan disabled");
            return;
        }
        String repoPath = properties.getRepoPath();
        if (repoPath == null || repoPath.isBlank()) {
            log.info("No repository configured (indexer.ingestion.repo-path); waiting for POST /api/v1/scan");
            return;
        }

        log.info("Starting startup scan of {}...", repoPath);
        try {
            ingestionService.ingest(Path.of(repoPath));
        } catch (Exception e) {
            log.error("Failed to scan {}: {}", repoPath, e.getMessage(), e);
        }
    }
}
