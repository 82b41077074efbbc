package com.adlanda.repoindexer.repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache store kept in memory, for tests and embedded use where nothing
 * should touch the user's cache directory.
 */
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> load(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void save(String fingerprint, CacheEntry entry) {
        entries.put(fingerprint, entry);
    }

    public int size() {
        return entries.size();
    }
}
