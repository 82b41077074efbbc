package com.adlanda.repoindexer.index;

import com.adlanda.repoindexer.model.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits file text into fixed-size line windows.
 */
public final class Chunker {

    public static final int DEFAULT_LINES_PER_CHUNK = 120;

    private Chunker() {
    }

    /**
     * Splits {@code text} into windows of {@code linesPerChunk} lines; the last
     * window may be shorter. Each chunk carries the definition names found in it.
     */
    public static List<Chunk> split(String path, String text, int linesPerChunk) {
        if (linesPerChunk <= 0) {
            throw new IllegalArgumentException("linesPerChunk must be positive: " + linesPerChunk);
        }
        List<String> lines = text.lines().toList();
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < lines.size(); i += linesPerChunk) {
            int end = Math.min(i + linesPerChunk, lines.size());
            String window = String.join("\n", lines.subList(i, end));
            chunks.add(new Chunk(path, i + 1, end, window, TermExtractor.extractFunctions(window)));
        }
        return chunks;
    }
}
