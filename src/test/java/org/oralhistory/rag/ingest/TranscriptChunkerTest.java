package org.oralhistory.rag.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.Test;

class TranscriptChunkerTest {

    private final TranscriptDocument document = new TranscriptDocument("document4.pdf", List.of(
            "First page paragraph one.\n\nFirst page paragraph two.",
            "Second page paragraph."));

    @Test
    void packsParagraphsBelowBudgetIntoOneChunk() {
        List<TranscriptChunk> chunks = new TranscriptChunker(TranscriptChunker.DEFAULT_MAX_TOKENS).split(document);

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.text())
                    .isEqualTo("First page paragraph one.\nFirst page paragraph two.\nSecond page paragraph.");
            assertThat(chunk.source()).isEqualTo("document4.pdf");
            assertThat(chunk.page()).isEqualTo(1);
            assertThat(chunk.tokens()).isPositive();
        });
    }

    @Test
    void startsNewChunkWhenBudgetIsExceeded() {
        TranscriptChunker chunker = new TranscriptChunker(1);

        List<TranscriptChunk> chunks = chunker.split(document);

        assertThat(chunks).extracting(TranscriptChunk::text, TranscriptChunk::page)
                .containsExactly(
                        tuple("First page paragraph one.", 1),
                        tuple("First page paragraph two.", 1),
                        tuple("Second page paragraph.", 2));
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.tokens()).isEqualTo(chunker.countTokens(chunk.text())));
    }

    @Test
    void blankPagesProduceNoChunks() {
        TranscriptDocument empty = new TranscriptDocument("document5.pdf", List.of("   \n\n  ", ""));

        assertThat(new TranscriptChunker(50).split(empty)).isEmpty();
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> new TranscriptChunker(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
