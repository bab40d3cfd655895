package org.oralhistory.rag.ingest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.oralhistory.rag.chat.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds transcript chunks in fixed size batches. Calls inside one batch run
 * concurrently, batches are separated by a pause to stay below the provider's
 * rate limit. A chunk whose embedding fails is dropped as a whole so texts,
 * metadata and vectors stay aligned.
 */
public class BatchEmbedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchEmbedder.class);

    public static final int DEFAULT_BATCH_SIZE = 20;
    public static final Duration DEFAULT_PAUSE = Duration.ofSeconds(1);

    private final EmbeddingProvider embeddingProvider;
    private final int batchSize;
    private final Duration pause;
    private final Executor executor;

    public BatchEmbedder(EmbeddingProvider embeddingProvider, int batchSize, Duration pause, Executor executor) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.batchSize = batchSize;
        this.pause = Objects.requireNonNull(pause, "pause");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<EmbeddedChunk> embedAll(List<TranscriptChunk> chunks) {
        List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
        int batches = (chunks.size() + batchSize - 1) / batchSize;
        for (int start = 0; start < chunks.size(); start += batchSize) {
            LOGGER.info("Processing batch {} of {}", start / batchSize + 1, batches);
            List<CompletableFuture<Optional<EmbeddedChunk>>> futures = chunks
                    .subList(start, Math.min(start + batchSize, chunks.size())).stream()
                    .map(chunk -> CompletableFuture.supplyAsync(() -> embed(chunk), executor))
                    .toList();
            futures.forEach(future -> future.join().ifPresent(embedded::add));
            if (start + batchSize < chunks.size()) {
                pause();
            }
        }
        int dropped = chunks.size() - embedded.size();
        if (dropped > 0) {
            LOGGER.warn("Dropped {} of {} chunks without embedding", dropped, chunks.size());
        }
        return embedded;
    }

    private Optional<EmbeddedChunk> embed(TranscriptChunk chunk) {
        try {
            return Optional.of(new EmbeddedChunk(chunk, embeddingProvider.embed(chunk.text())));
        } catch (RuntimeException ex) {
            LOGGER.warn("Error generating embedding for chunk of {} (page {}): {}", chunk.source(), chunk.page(),
                    ex.getMessage());
            return Optional.empty();
        }
    }

    private void pause() {
        if (pause.isZero()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between embedding batches", ex);
        }
    }
}
