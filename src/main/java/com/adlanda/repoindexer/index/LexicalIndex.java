package com.adlanda.repoindexer.index;

import com.adlanda.repoindexer.model.Chunk;
import com.adlanda.repoindexer.model.ScoredChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Immutable TF-IDF index over chunks.
 *
 * Document term counts are boosted with the chunk's definition names and the
 * file's stem, so a chunk that defines {@code parseConfig} or lives in
 * {@code parse_config.py} ranks higher for those terms.
 *
 * <p>{@link #addDocuments} does not merge statistics: it returns a new index
 * whose IDF table and every document vector are recomputed over the whole
 * corpus, so any sequence of additions equals a single bulk build.
 */
public final class LexicalIndex {

    /** Weight of query terms the corpus has never seen. */
    static final double UNSEEN_TERM_IDF = 1.0;

    /** Extra count given to each definition name written out in a query. */
    static final int QUERY_DEFINITION_BOOST = 2;

    private final Map<String, Double> vocabularyIdf;
    private final List<Map<String, Double>> documentVectors;
    private final List<Chunk> documents;

    private LexicalIndex(Map<String, Double> vocabularyIdf,
                         List<Map<String, Double>> documentVectors,
                         List<Chunk> documents) {
        if (documentVectors.size() != documents.size()) {
            throw new IllegalArgumentException("Expected one vector per document, got "
                    + documentVectors.size() + " vectors for " + documents.size() + " documents");
        }
        this.vocabularyIdf = Map.copyOf(vocabularyIdf);
        this.documentVectors = documentVectors.stream().map(Map::copyOf).toList();
        this.documents = List.copyOf(documents);
    }

    public static LexicalIndex empty() {
        return new LexicalIndex(Map.of(), List.of(), List.of());
    }

    /**
     * Builds an index over the given chunks.
     */
    public static LexicalIndex build(List<Chunk> chunks) {
        List<Map<String, Integer>> counts = chunks.stream()
                .map(LexicalIndex::documentCounts)
                .toList();

        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Map<String, Integer> docCounts : counts) {
            for (String term : docCounts.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        int n = chunks.size();
        Map<String, Double> idf = new HashMap<>(documentFrequency.size());
        documentFrequency.forEach((term, df) -> idf.put(term, Math.log((1.0 + n) / (1.0 + df)) + 1.0));

        List<Map<String, Double>> vectors = counts.stream()
                .map(docCounts -> weigh(docCounts, idf))
                .toList();

        return new LexicalIndex(idf, vectors, chunks);
    }

    /**
     * Restores a previously built index, e.g. one read back from disk.
     */
    public static LexicalIndex restore(Map<String, Double> vocabularyIdf,
                                       List<Map<String, Double>> documentVectors,
                                       List<Chunk> documents) {
        return new LexicalIndex(vocabularyIdf, documentVectors, documents);
    }

    /**
     * Returns a new index over this index's documents plus the given ones.
     */
    public LexicalIndex addDocuments(List<Chunk> chunks) {
        List<Chunk> all = new ArrayList<>(documents.size() + chunks.size());
        all.addAll(documents);
        all.addAll(chunks);
        return build(all);
    }

    /**
     * Ranks documents by cosine similarity to the query.
     *
     * @param query Free text; definition syntax such as "def load_config" boosts that name
     * @param topK  Maximum number of results; more than the index holds returns everything
     * @return Scored chunks, highest score first, ties in index order
     */
    public List<ScoredChunk> search(String query, int topK) {
        if (topK <= 0 || documents.isEmpty()) {
            return List.of();
        }
        Map<String, Double> queryVector = vectorizeQuery(query);
        return IntStream.range(0, documents.size())
                .mapToObj(i -> new ScoredChunk(documents.get(i), dot(queryVector, documentVectors.get(i))))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(topK)
                .toList();
    }

    Map<String, Double> vectorizeQuery(String query) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : TermExtractor.tokenize(query)) {
            counts.merge(token, 1, Integer::sum);
        }
        for (String name : TermExtractor.extractFunctions(query)) {
            counts.merge(name, QUERY_DEFINITION_BOOST, Integer::sum);
        }
        return weigh(counts, vocabularyIdf);
    }

    private static Map<String, Integer> documentCounts(Chunk chunk) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : TermExtractor.tokenize(chunk.text())) {
            counts.merge(token, 1, Integer::sum);
        }
        for (String name : chunk.functions()) {
            counts.merge(name.toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        counts.merge(TermExtractor.fileStem(chunk.path()), 1, Integer::sum);
        return counts;
    }

    /**
     * (count / total) * idf per term, then L2-normalised.
     */
    private static Map<String, Double> weigh(Map<String, Integer> counts, Map<String, Double> idf) {
        int total = Math.max(1, counts.values().stream().mapToInt(Integer::intValue).sum());
        Map<String, Double> vector = new HashMap<>(counts.size());
        double norm = 0.0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double weight = ((double) entry.getValue() / total) * idf.getOrDefault(entry.getKey(), UNSEEN_TERM_IDF);
            vector.put(entry.getKey(), weight);
            norm += weight * weight;
        }
        double length = Math.sqrt(norm);
        if (length == 0.0) {
            length = 1.0;
        }
        for (Map.Entry<String, Double> entry : vector.entrySet()) {
            entry.setValue(entry.getValue() / length);
        }
        return vector;
    }

    private static double dot(Map<String, Double> query, Map<String, Double> document) {
        double score = 0.0;
        for (Map.Entry<String, Double> entry : query.entrySet()) {
            score += entry.getValue() * document.getOrDefault(entry.getKey(), 0.0);
        }
        return score;
    }

    public Map<String, Double> getVocabularyIdf() {
        return vocabularyIdf;
    }

    public List<Map<String, Double>> getDocumentVectors() {
        return documentVectors;
    }

    public List<Chunk> getDocuments() {
        return documents;
    }

    /**
     * Returns the number of indexed chunks.
     */
    public int size() {
        return documents.size();
    }
}
