package com.adlanda.repoindexer.repository;

import java.util.Optional;

/**
 * Key-value store for scan results, keyed by repository fingerprint.
 *
 * Caching only saves work: implementations must not throw, and a missing or
 * unreadable entry reads as empty.
 */
public interface CacheStore {

    Optional<CacheEntry> load(String fingerprint);

    void save(String fingerprint, CacheEntry entry);
}
