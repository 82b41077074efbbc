package com.adlanda.repoindexer.model;

/**
 * A single result from a query, containing the matched chunk and its score.
 *
 * @param path       Repository-relative path of the source file
 * @param startLine  First line of the chunk (1-based)
 * @param endLine    Last line of the chunk (inclusive)
 * @param content    The text of the matched chunk
 * @param score      Cosine similarity of the TF-IDF vectors (0.0 to 1.0)
 */
public record QueryResult(
        String path,
        int startLine,
        int endLine,
        String content,
        double score
) {
    public static QueryResult from(ScoredChunk scored) {
        Chunk chunk = scored.chunk();
        return new QueryResult(chunk.path(), chunk.startLine(), chunk.endLine(), chunk.text(), scored.score());
    }
}
