package com.adlanda.repoindexer.model;

import java.util.Objects;

/**
 * One ingested source file.
 *
 * @param path        Repository-relative path using forward slashes
 * @param language    Detected language (records are never created without one)
 * @param text        Decoded UTF-8 content
 * @param sloc        Number of non-blank lines
 * @param contentHash SHA-256 hash of {@code text} (for change detection)
 */
public record FileRecord(
        String path,
        Language language,
        String text,
        int sloc,
        String contentHash
) {
    public FileRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
    }
}
