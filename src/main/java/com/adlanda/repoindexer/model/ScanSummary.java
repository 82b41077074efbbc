package com.adlanda.repoindexer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Operator-facing projection of a snapshot, without file contents.
 */
public record ScanSummary(
        String root,
        int fileCount,
        long slocTotal,
        List<String> languages,
        @JsonProperty("isRepo") boolean isRepo,
        ScanStatistics statistics
) {
    public static ScanSummary from(RepositorySnapshot snapshot) {
        return new ScanSummary(
                snapshot.root(),
                snapshot.summary().fileCount(),
                snapshot.summary().slocTotal(),
                snapshot.languages().stream().map(Language::id).toList(),
                snapshot.vcs().isRepo(),
                snapshot.statistics()
        );
    }
}
