package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.exception.PathNotFoundException;
import com.adlanda.repoindexer.health.IngestionHealthIndicator;
import com.adlanda.repoindexer.index.IndexStore;
import com.adlanda.repoindexer.index.LexicalIndex;
import com.adlanda.repoindexer.index.LexicalIndexBuilder;
import com.adlanda.repoindexer.model.FileRecord;
import com.adlanda.repoindexer.model.Language;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.model.ScanStatistics;
import com.adlanda.repoindexer.model.VcsStats;
import com.adlanda.repoindexer.repository.InMemorySnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private RepositoryScanner scanner;

    @Mock
    private IndexStore indexStore;

    private IngestionProperties properties;
    private InMemorySnapshotStore snapshotStore;
    private IngestionHealthIndicator healthIndicator;
    private IngestionService ingestionService;

    private final RepositorySnapshot snapshot = RepositorySnapshot.of(
            "/repo",
            Map.of("app.py", new FileRecord("app.py", Language.PYTHON, "def run():\n    pass\n", 2, "h1")),
            new VcsStats(false, Map.of("app.py", 0), Map.of("app.py", 0L)),
            new ScanStatistics(1, 0, 1, 0, 5)
    );

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        snapshotStore = new InMemorySnapshotStore();
        healthIndicator = new IngestionHealthIndicator();
        ingestionService = new IngestionService(
                scanner,
                new LexicalIndexBuilder(new FileHashService(), 120, 1000),
                indexStore,
                snapshotStore,
                properties,
                healthIndicator
        );
    }

    @Test
    void ingest_publishesSnapshotAndIndex() {
        when(scanner.scan(any(), any())).thenReturn(snapshot);
        when(indexStore.load(anyString())).thenReturn(Optional.empty());

        RepositorySnapshot result = ingestionService.ingest(Path.of("/repo"));

        assertThat(result).isSameAs(snapshot);
        assertThat(snapshotStore.snapshot()).contains(snapshot);
        assertThat(snapshotStore.size()).isEqualTo(1);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(healthIndicator.health().getDetails()).containsEntry("files", 1).containsEntry("chunksIndexed", 1);
    }

    @Test
    void ingest_usesConfiguredLimits() {
        properties.setMaxFiles(7);
        properties.setMaxBytesPerFile(100);
        properties.setIncremental(false);
        when(scanner.scan(any(), any())).thenReturn(snapshot);
        when(indexStore.load(anyString())).thenReturn(Optional.empty());

        ingestionService.ingest(Path.of("/repo"));

        verify(scanner).scan(Path.of("/repo"), new ScanOptions(7, 100, false));
    }

    @Test
    void ingest_newContent_savesBuiltIndex() {
        when(scanner.scan(any(), any())).thenReturn(snapshot);
        when(indexStore.load(anyString())).thenReturn(Optional.empty());

        ingestionService.ingest(Path.of("/repo"));

        ArgumentCaptor<LexicalIndex> saved = ArgumentCaptor.forClass(LexicalIndex.class);
        verify(indexStore).save(anyString(), saved.capture());
        assertThat(saved.getValue()).isSameAs(snapshotStore.index());
    }

    @Test
    void ingest_persistedIndex_isReusedWithoutRebuilding() {
        LexicalIndex persisted = LexicalIndex.empty();
        when(scanner.scan(any(), any())).thenReturn(snapshot);
        when(indexStore.load(anyString())).thenReturn(Optional.of(persisted));

        ingestionService.ingest(Path.of("/repo"));

        assertThat(snapshotStore.index()).isSameAs(persisted);
        verify(indexStore, never()).save(anyString(), any());
    }

    @Test
    void ingest_persistenceDisabled_neverTouchesIndexStore() {
        properties.setPersistIndex(false);
        when(scanner.scan(any(), any())).thenReturn(snapshot);

        ingestionService.ingest(Path.of("/repo"));

        verify(indexStore, never()).load(anyString());
        verify(indexStore, never()).save(anyString(), any());
        assertThat(snapshotStore.size()).isEqualTo(1);
    }

    @Test
    void ingest_missingPath_marksUnhealthyAndKeepsPreviousSnapshot() {
        when(scanner.scan(any(), any())).thenThrow(new PathNotFoundException(Path.of("/missing")));

        assertThatThrownBy(() -> ingestionService.ingest(Path.of("/missing")))
                .isInstanceOf(PathNotFoundException.class);

        assertThat(snapshotStore.snapshot()).isEmpty();
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
        assertThat(healthIndicator.health().getDetails().get("error").toString()).contains("/missing");
    }
}
