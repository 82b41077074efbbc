package com.adlanda.repoindexer.index;

import com.adlanda.repoindexer.model.Chunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists built indexes as {@code tfidf_<key>.json} so an unchanged snapshot
 * does not have to be re-indexed.
 *
 * Like the scan cache, failures only cost time: they are logged and a load
 * reads as empty.
 */
public class IndexStore {

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public IndexStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Optional<LexicalIndex> load(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            PersistedIndex persisted = objectMapper.readValue(file.toFile(), PersistedIndex.class);
            return Optional.of(LexicalIndex.restore(persisted.vocabIdf(), persisted.docVectors(), persisted.docs()));
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable index file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String key, LexicalIndex index) {
        Path file = fileFor(key);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, "tfidf_", ".tmp");
            objectMapper.writeValue(tmp.toFile(), new PersistedIndex(
                    index.getDocuments(), index.getVocabularyIdf(), index.getDocumentVectors()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved index with {} chunks to {}", index.size(), file);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write index file {}: {}", file, e.getMessage());
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException ignored) {
                    log.debug("Could not delete {}", tmp);
                }
            }
        }
    }

    Path fileFor(String key) {
        return directory.resolve("tfidf_" + key + ".json");
    }

    record PersistedIndex(
            List<Chunk> docs,
            Map<String, Double> vocabIdf,
            List<Map<String, Double>> docVectors
    ) {}
}
