package com.adlanda.repoindexer.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Cache store writing one JSON file per fingerprint under a cache directory.
 *
 * Read and write failures are logged and otherwise ignored; deleting the
 * directory only costs the next scan its speed-up.
 */
public class FileCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    private final Path cacheDir;
    private final ObjectMapper objectMapper;

    public FileCacheStore(Path cacheDir, ObjectMapper objectMapper) {
        this.cacheDir = cacheDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry> load(String fingerprint) {
        Path file = fileFor(fingerprint);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String fingerprint, CacheEntry entry) {
        Path file = fileFor(fingerprint);
        Path tmp = null;
        try {
            Files.createDirectories(cacheDir);
            // write then rename so a concurrent reader never sees a half-written file
            tmp = Files.createTempFile(cacheDir, "repo_", ".tmp");
            objectMapper.writeValue(tmp.toFile(), entry);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved cache entry with {} files to {}", entry.files().size(), file);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write cache file {}: {}", file, e.getMessage());
            deleteQuietly(tmp);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", tmp, e.getMessage());
        }
    }

    Path fileFor(String fingerprint) {
        return cacheDir.resolve("repo_" + fingerprint + ".json");
    }
}
