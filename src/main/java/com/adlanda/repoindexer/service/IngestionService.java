package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.exception.PathNotFoundException;
import com.adlanda.repoindexer.health.IngestionHealthIndicator;
import com.adlanda.repoindexer.index.IndexStore;
import com.adlanda.repoindexer.index.LexicalIndex;
import com.adlanda.repoindexer.index.LexicalIndexBuilder;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.repository.InMemorySnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Scans a repository, indexes the snapshot and publishes both.
 *
 * Indexes are looked up by snapshot content before being built, so re-scanning
 * an unchanged repository skips the indexing step too.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final RepositoryScanner scanner;
    private final LexicalIndexBuilder indexBuilder;
    private final IndexStore indexStore;
    private final InMemorySnapshotStore snapshotStore;
    private final IngestionProperties properties;
    private final IngestionHealthIndicator healthIndicator;

    public IngestionService(RepositoryScanner scanner,
                            LexicalIndexBuilder indexBuilder,
                            IndexStore indexStore,
                            InMemorySnapshotStore snapshotStore,
                            IngestionProperties properties,
                            IngestionHealthIndicator healthIndicator) {
        this.scanner = scanner;
        this.indexBuilder = indexBuilder;
        this.indexStore = indexStore;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Ingests a repository with the configured limits.
     */
    public RepositorySnapshot ingest(Path root) {
        return ingest(root, ScanOptions.from(properties));
    }

    /**
     * Scans, indexes and publishes a repository.
     *
     * @throws PathNotFoundException if the root does not exist
     */
    public RepositorySnapshot ingest(Path root, ScanOptions options) {
        RepositorySnapshot snapshot;
        try {
            snapshot = scanner.scan(root, options);
        } catch (PathNotFoundException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw e;
        }

        LexicalIndex index = loadOrBuildIndex(snapshot);
        snapshotStore.publish(snapshot, index);

        healthIndicator.markHealthy(new IngestionSummary(
                snapshot.root(),
                snapshot.summary().fileCount(),
                snapshot.summary().slocTotal(),
                snapshot.statistics().reused(),
                snapshot.statistics().reprocessed(),
                index.size()
        ));
        return snapshot;
    }

    public Optional<RepositorySnapshot> currentSnapshot() {
        return snapshotStore.snapshot();
    }

    private LexicalIndex loadOrBuildIndex(RepositorySnapshot snapshot) {
        if (!properties.isPersistIndex()) {
            return indexBuilder.build(snapshot);
        }
        String key = indexBuilder.contentKey(snapshot);
        Optional<LexicalIndex> persisted = indexStore.load(key);
        if (persisted.isPresent()) {
            log.info("Reusing persisted index {} ({} chunks)", key, persisted.get().size());
            return persisted.get();
        }
        LexicalIndex index = indexBuilder.build(snapshot);
        indexStore.save(key, index);
        return index;
    }

    /**
     * Outcome of one ingestion, as reported by the health endpoint.
     */
    public record IngestionSummary(
            String root,
            int fileCount,
            long slocTotal,
            int reusedFiles,
            int processedFiles,
            int totalChunks
    ) {}
}
