package com.adlanda.repoindexer.config;

import com.adlanda.repoindexer.index.IndexStore;
import com.adlanda.repoindexer.repository.CacheStore;
import com.adlanda.repoindexer.repository.FileCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the on-disk stores to the configured cache directory.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public CacheStore cacheStore(IngestionProperties properties, ObjectMapper objectMapper) {
        Path cacheDir = Path.of(properties.getCacheDir());
        log.info("Scan cache directory: {}", cacheDir);
        return new FileCacheStore(cacheDir, objectMapper);
    }

    @Bean
    public IndexStore indexStore(IngestionProperties properties, ObjectMapper objectMapper) {
        return new IndexStore(Path.of(properties.getCacheDir()), objectMapper);
    }
}
