package com.adlanda.repoindexer.repository;

import com.adlanda.repoindexer.index.LexicalIndex;
import com.adlanda.repoindexer.model.Chunk;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.model.ScanStatistics;
import com.adlanda.repoindexer.model.VcsStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySnapshotStoreTest {

    private InMemorySnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
    }

    @Test
    void beforePublish_isEmpty() {
        assertThat(store.snapshot()).isEmpty();
        assertThat(store.index().size()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void publish_replacesSnapshotAndIndexTogether() {
        RepositorySnapshot snapshot = RepositorySnapshot.of("/repo", Map.of(),
                new VcsStats(false, Map.of(), Map.of()), ScanStatistics.empty());
        LexicalIndex index = LexicalIndex.build(List.of(new Chunk("a.py", 1, 1, "x = 1", List.of())));

        store.publish(snapshot, index);

        assertThat(store.snapshot()).contains(snapshot);
        assertThat(store.index()).isSameAs(index);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void clear_removesEverything() {
        store.publish(RepositorySnapshot.of("/repo", Map.of(), new VcsStats(false, Map.of(), Map.of()),
                ScanStatistics.empty()), LexicalIndex.empty());

        store.clear();

        assertThat(store.snapshot()).isEmpty();
    }
}
