package org.oralhistory.rag.ingest;

/**
 * Transcript chunk together with its embedding.
 */
public record EmbeddedChunk(TranscriptChunk chunk, float[] embedding) {
}
