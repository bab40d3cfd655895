package org.oralhistory.rag.chat;

/**
 * Chunk paired with its cosine similarity to the query.
 */
public record ScoredChunk(Chunk chunk, double score) {

    public String documentId() {
        return chunk.documentId();
    }
}
