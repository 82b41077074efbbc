package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.config.IngestionProperties;

/**
 * Per-scan limits.
 *
 * @param maxFiles        Upper bound on the files in the snapshot, also bounding the walk
 * @param maxBytesPerFile Byte cap per file; longer files are truncated
 * @param incremental     Whether to reuse and update the scan cache
 */
public record ScanOptions(
        int maxFiles,
        int maxBytesPerFile,
        boolean incremental
) {
    public ScanOptions {
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must not be negative: " + maxFiles);
        }
        if (maxBytesPerFile <= 0) {
            throw new IllegalArgumentException("maxBytesPerFile must be positive: " + maxBytesPerFile);
        }
    }

    public static ScanOptions from(IngestionProperties properties) {
        return new ScanOptions(properties.getMaxFiles(), properties.getMaxBytesPerFile(), properties.isIncremental());
    }
}
