package org.oralhistory.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    private final CorpusStore corpus = TestCorpus.builder()
            .person("Ann Able", "2001-01-01")
            .person("Bob Baker", "2002-02-02")
            .chunk("1", 4, "Ann talks.", 1f)
            .chunk("1", null, "Ann again.", 1f)
            .chunk("2", 9, "Bob talks.", 1f)
            .build();

    @Test
    void formatsOneHeaderPerDocument() {
        ContextAssembler.DocumentContext document = new ContextAssembler.DocumentContext(
                corpus.record("1").orElseThrow(), scored(corpus.chunksOf("1")));

        assertThat(assembler.formatDocument(document)).isEqualTo(
                "Interview 1 with Ann Able (2001-01-01):\n[Page 4] Ann talks.\n\n[Page unknown] Ann again.");
    }

    @Test
    void separatesDocumentBlocks() {
        List<ContextAssembler.DocumentContext> documents = List.of(
                new ContextAssembler.DocumentContext(corpus.record("1").orElseThrow(),
                        scored(corpus.chunksOf("1").subList(0, 1))),
                new ContextAssembler.DocumentContext(corpus.record("2").orElseThrow(), scored(corpus.chunksOf("2"))));

        assertThat(assembler.formatDocuments(documents)).isEqualTo(
                "Interview 1 with Ann Able (2001-01-01):\n[Page 4] Ann talks.\n\n---\n\n"
                        + "Interview 2 with Bob Baker (2002-02-02):\n[Page 9] Bob talks.");
    }

    @Test
    void largestGroupWinsAndTiesGoToFirstRanked() {
        List<ScoredChunk> ranked = scored(List.of(
                corpus.chunksOf("2").get(0),
                corpus.chunksOf("1").get(0),
                corpus.chunksOf("1").get(1)));
        assertThat(assembler.largestDocumentGroup(ranked)).extracting(ScoredChunk::documentId)
                .containsExactly("1", "1");

        List<ScoredChunk> tied = scored(List.of(corpus.chunksOf("2").get(0), corpus.chunksOf("1").get(0)));
        assertThat(assembler.largestDocumentGroup(tied)).extracting(ScoredChunk::documentId).containsExactly("2");

        assertThat(assembler.largestDocumentGroup(List.of())).isEmpty();
    }

    private static List<ScoredChunk> scored(List<Chunk> chunks) {
        return chunks.stream().map(chunk -> new ScoredChunk(chunk, 1.0d)).toList();
    }
}
