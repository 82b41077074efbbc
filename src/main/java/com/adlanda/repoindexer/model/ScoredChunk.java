package com.adlanda.repoindexer.model;

/**
 * A chunk with its similarity score.
 */
public record ScoredChunk(Chunk chunk, double score) {}
