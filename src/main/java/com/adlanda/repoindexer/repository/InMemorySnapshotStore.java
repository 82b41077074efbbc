package com.adlanda.repoindexer.repository;

import com.adlanda.repoindexer.index.LexicalIndex;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recent snapshot and the index built from it.
 *
 * Both are immutable, so they are published together through a single atomic
 * reference and readers never see a snapshot paired with another scan's index.
 */
@Repository
public class InMemorySnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private final AtomicReference<Indexed> current = new AtomicReference<>();

    /**
     * Replaces the current snapshot and index.
     */
    public void publish(RepositorySnapshot snapshot, LexicalIndex index) {
        current.set(new Indexed(snapshot, index));
        log.info("Published snapshot of {} with {} chunks", snapshot.root(), index.size());
    }

    public Optional<RepositorySnapshot> snapshot() {
        return Optional.ofNullable(current.get()).map(Indexed::snapshot);
    }

    /**
     * Returns the current index, or an empty one before the first scan.
     */
    public LexicalIndex index() {
        Indexed indexed = current.get();
        return indexed == null ? LexicalIndex.empty() : indexed.index();
    }

    /**
     * Returns the total number of chunks indexed.
     */
    public int size() {
        return index().size();
    }

    public void clear() {
        current.set(null);
    }

    private record Indexed(RepositorySnapshot snapshot, LexicalIndex index) {}
}
