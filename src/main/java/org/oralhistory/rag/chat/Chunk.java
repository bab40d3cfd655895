package org.oralhistory.rag.chat;

import java.util.Objects;

/**
 * Contiguous span of transcript text together with its precomputed embedding.
 * The {@code position} is the index of the chunk inside the corpus artifact and
 * keeps rankings deterministic when scores tie.
 */
public record Chunk(
        int position,
        String text,
        String sourceFileName,
        String documentId,
        Integer page,
        int tokenCount,
        float[] embedding) {

    public Chunk {
        embedding = Objects.requireNonNull(embedding, "embedding").clone();
    }

    /**
     * Copy of the embedding; the corpus itself is never exposed for writing.
     */
    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public boolean hasPage() {
        return page != null;
    }
}
