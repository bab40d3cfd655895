package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brute force cosine similarity search over the in-memory corpus. Equal scores
 * keep corpus order because {@link List#sort} is stable.
 */
public class SimilarityRanker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityRanker.class);

    private static final Comparator<ScoredChunk> BY_SCORE_DESCENDING = Comparator
            .comparingDouble(ScoredChunk::score).reversed();

    private final CorpusStore corpus;
    private final EmbeddingProvider embeddingProvider;
    private final int topK;

    public SimilarityRanker(CorpusStore corpus, EmbeddingProvider embeddingProvider, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.topK = topK;
    }

    public float[] embed(String text) {
        return embeddingProvider.embed(text);
    }

    /**
     * Rank all chunks of the corpus.
     */
    public List<ScoredChunk> rank(float[] queryVector) {
        return rank(queryVector, corpus.chunks());
    }

    /**
     * Rank only the chunks of one document.
     */
    public List<ScoredChunk> rank(float[] queryVector, String documentId) {
        return rank(queryVector, corpus.chunksOf(documentId));
    }

    private List<ScoredChunk> rank(float[] queryVector, List<Chunk> candidates) {
        List<ScoredChunk> scored = new ArrayList<>(candidates.size());
        for (Chunk chunk : candidates) {
            scored.add(new ScoredChunk(chunk, cosineSimilarity(queryVector, chunk.embedding())));
        }
        scored.sort(BY_SCORE_DESCENDING);
        LOGGER.debug("Scored {} candidates, keeping top {}", scored.size(), topK);
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    /**
     * Cosine similarity of two vectors of equal length. Zero vectors score 0.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
