package com.adlanda.repoindexer.repository;

import com.adlanda.repoindexer.model.FileRecord;

import java.util.Map;

/**
 * Persisted result of a previous scan of one (root, HEAD) pair.
 *
 * @param files  Records of the previous snapshot, keyed by relative path
 * @param mtimes Modification time in seconds of every candidate of the previous walk,
 *               used only for change detection
 * @param root   Absolute repository root
 * @param head   HEAD commit id, or "nogit"
 */
public record CacheEntry(
        Map<String, FileRecord> files,
        Map<String, Double> mtimes,
        String root,
        String head
) {
    public CacheEntry {
        files = files == null ? Map.of() : Map.copyOf(files);
        mtimes = mtimes == null ? Map.of() : Map.copyOf(mtimes);
    }
}
