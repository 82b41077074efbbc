package com.adlanda.repoindexer.model;

/**
 * Diagnostics of a single scan. Never influences the file map.
 *
 * @param candidates   Files collected by the walk
 * @param reused       Records taken verbatim from the cache
 * @param reprocessed  Records produced by the worker pool (files read again and kept)
 * @param sampledOut   Changed files dropped by priority sampling
 * @param durationMs   Wall-clock duration of the scan
 */
public record ScanStatistics(
        int candidates,
        int reused,
        int reprocessed,
        int sampledOut,
        long durationMs
) {
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0);
    }
}
