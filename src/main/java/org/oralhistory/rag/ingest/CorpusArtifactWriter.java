package org.oralhistory.rag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.oralhistory.rag.chat.CorpusArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Writes embedded chunks as the parallel-array artifact the chat service loads.
 */
public class CorpusArtifactWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusArtifactWriter.class);

    private final ObjectMapper objectMapper;

    public CorpusArtifactWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public CorpusArtifact toArtifact(List<EmbeddedChunk> chunks) {
        return new CorpusArtifact(
                chunks.stream().map(EmbeddedChunk::embedding).toList(),
                chunks.stream().map(embedded -> embedded.chunk().text()).toList(),
                chunks.stream()
                        .map(EmbeddedChunk::chunk)
                        .map(chunk -> new CorpusArtifact.ChunkMetadata(chunk.source(), chunk.page(), chunk.tokens()))
                        .toList());
    }

    public void write(List<EmbeddedChunk> chunks, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(output.toFile(), toArtifact(chunks));
        LOGGER.info("Saved {} embeddings to {}", chunks.size(), output);
    }
}
