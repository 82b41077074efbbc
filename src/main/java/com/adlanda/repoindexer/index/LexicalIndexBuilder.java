package com.adlanda.repoindexer.index;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.model.Chunk;
import com.adlanda.repoindexer.model.FileRecord;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.service.FileHashService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a snapshot into a {@link LexicalIndex}.
 *
 * Files are taken in path order so the same snapshot always yields the same
 * chunk order, and therefore the same tie-breaking in search results.
 */
@Component
public class LexicalIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(LexicalIndexBuilder.class);

    private final FileHashService hashService;
    private final int linesPerChunk;
    private final int maxFiles;

    @Autowired
    public LexicalIndexBuilder(FileHashService hashService, IngestionProperties properties) {
        this(hashService, properties.getLinesPerChunk(), properties.getIndexMaxFiles());
    }

    public LexicalIndexBuilder(FileHashService hashService, int linesPerChunk, int maxFiles) {
        this.hashService = hashService;
        this.linesPerChunk = linesPerChunk;
        this.maxFiles = maxFiles;
    }

    public LexicalIndex build(RepositorySnapshot snapshot) {
        List<Chunk> chunks = chunk(snapshot);
        LexicalIndex index = LexicalIndex.build(chunks);
        log.info("Indexed {} chunks from {} files ({} terms)",
                index.size(), Math.min(maxFiles, snapshot.files().size()), index.getVocabularyIdf().size());
        return index;
    }

    List<Chunk> chunk(RepositorySnapshot snapshot) {
        List<Chunk> chunks = new ArrayList<>();
        snapshot.files().values().stream()
                .sorted(Comparator.comparing(FileRecord::path))
                .limit(maxFiles)
                .forEach(file -> chunks.addAll(Chunker.split(file.path(), file.text(), linesPerChunk)));
        return chunks;
    }

    /**
     * Key identifying the indexed content of a snapshot: the root plus every
     * (path, content hash) pair, truncated to 16 hex characters. Chunking
     * settings are part of the key so a changed window size forces a rebuild.
     */
    public String contentKey(RepositorySnapshot snapshot) {
        StringBuilder material = new StringBuilder(snapshot.root())
                .append('|').append(linesPerChunk)
                .append('|').append(maxFiles);
        snapshot.files().values().stream()
                .sorted(Comparator.comparing(FileRecord::path))
                .forEach(file -> material.append('\n').append(file.path()).append('\0').append(file.contentHash()));
        return hashService.computeHash(material.toString()).substring(0, 16);
    }
}
