package org.oralhistory.rag.ingest;

/**
 * Chunk of a transcript before it is embedded.
 */
public record TranscriptChunk(String text, String source, int page, int tokens) {
}
