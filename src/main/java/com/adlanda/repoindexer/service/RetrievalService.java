package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.index.LexicalIndex;
import com.adlanda.repoindexer.model.QueryResponse;
import com.adlanda.repoindexer.model.QueryResult;
import com.adlanda.repoindexer.repository.InMemorySnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for retrieving relevant chunks for a query.
 *
 * Callers assemble the returned chunks into whatever context their answer
 * generator needs; nothing here formats prompts.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final InMemorySnapshotStore snapshotStore;

    public RetrievalService(InMemorySnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
    }

    /**
     * Searches the current index.
     *
     * @param question   The question to search for
     * @param maxResults Maximum number of results to return
     * @return QueryResponse containing the matched chunks and metadata
     */
    public QueryResponse query(String question, int maxResults) {
        long startTime = System.currentTimeMillis();

        LexicalIndex index = snapshotStore.index();
        List<QueryResult> results = index.search(question, maxResults).stream()
                .map(QueryResult::from)
                .toList();

        long queryTimeMs = System.currentTimeMillis() - startTime;

        log.debug("Query '{}' returned {} results in {}ms",
                truncate(question, 50), results.size(), queryTimeMs);

        return new QueryResponse(results, index.size(), queryTimeMs);
    }

    /**
     * Returns the number of chunks in the index.
     */
    public int getIndexSize() {
        return snapshotStore.size();
    }

    /**
     * Returns the number of files in the current snapshot.
     */
    public int getFileCount() {
        return snapshotStore.snapshot().map(s -> s.summary().fileCount()).orElse(0);
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
