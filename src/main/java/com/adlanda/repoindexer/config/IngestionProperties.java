package com.adlanda.repoindexer.config;

import com.adlanda.repoindexer.index.Chunker;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for repository ingestion.
 *
 * Maps to properties prefixed with 'indexer.ingestion' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "indexer.ingestion")
public class IngestionProperties {

    /**
     * Whether the configured repository is scanned at startup.
     * When false, nothing is ingested until a scan is requested (useful for testing).
     */
    private boolean enabled = true;

    /**
     * Whether to reuse cached records for files whose mtime has not changed.
     */
    private boolean incremental = true;

    /**
     * Repository scanned at startup. Empty means no startup scan.
     */
    private String repoPath = "";

    private int maxFiles = 2000;

    private int maxBytesPerFile = 1_000_000;

    /**
     * Directory holding the per-repository cache files and persisted indexes.
     */
    private String cacheDir = System.getProperty("user.home") + "/.repo-indexer-cache";

    private int linesPerChunk = Chunker.DEFAULT_LINES_PER_CHUNK;

    /**
     * Upper bound on the number of files whose chunks go into the search index.
     */
    private int indexMaxFiles = 1000;

    /**
     * Whether built indexes are written to the cache directory and reused
     * when the snapshot content has not changed.
     */
    private boolean persistIndex = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public void setIncremental(boolean incremental) {
        this.incremental = incremental;
    }

    public String getRepoPath() {
        return repoPath;
    }

    public void setRepoPath(String repoPath) {
        this.repoPath = repoPath;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }

    public int getMaxBytesPerFile() {
        return maxBytesPerFile;
    }

    public void setMaxBytesPerFile(int maxBytesPerFile) {
        this.maxBytesPerFile = maxBytesPerFile;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public int getLinesPerChunk() {
        return linesPerChunk;
    }

    public void setLinesPerChunk(int linesPerChunk) {
        this.linesPerChunk = linesPerChunk;
    }

    public int getIndexMaxFiles() {
        return indexMaxFiles;
    }

    public void setIndexMaxFiles(int indexMaxFiles) {
        this.indexMaxFiles = indexMaxFiles;
    }

    public boolean isPersistIndex() {
        return persistIndex;
    }

    public void setPersistIndex(boolean persistIndex) {
        this.persistIndex = persistIndex;
    }
}
