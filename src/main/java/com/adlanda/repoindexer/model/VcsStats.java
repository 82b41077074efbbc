package com.adlanda.repoindexer.model;

import java.util.Map;

/**
 * Version-control metadata for the files of a snapshot.
 *
 * A value of 0 in either map means "unknown", not "no changes".
 *
 * @param isRepo             Whether the scanned root is a git working tree
 * @param churnByFile        Number of commits touching each file
 * @param lastModifiedByFile Unix seconds of the last commit touching each file
 */
public record VcsStats(
        boolean isRepo,
        Map<String, Integer> churnByFile,
        Map<String, Long> lastModifiedByFile
) {
    public VcsStats {
        churnByFile = Map.copyOf(churnByFile);
        lastModifiedByFile = Map.copyOf(lastModifiedByFile);
    }
}
