package org.oralhistory.rag.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire representation of the embedding artifact produced by the ingestion
 * command: three parallel arrays with one entry per chunk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusArtifact(List<float[]> embeddings, List<String> texts, List<ChunkMetadata> metadata) {

    /**
     * Provenance of a chunk. {@code source} is the transcript file name, e.g.
     * {@code document4.pdf}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChunkMetadata(String source, Integer page, Integer tokens) {
    }
}
