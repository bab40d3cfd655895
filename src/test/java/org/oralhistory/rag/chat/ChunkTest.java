package org.oralhistory.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChunkTest {

    @Test
    void embeddingCannotBeChangedFromOutside() {
        float[] source = { 0.6f, 0.8f };
        Chunk chunk = new Chunk(0, "videos", "document1.pdf", "1", 2, 1, source);

        source[0] = 9.0f;
        chunk.embedding()[1] = 9.0f;

        assertThat(chunk.embedding()).containsExactly(0.6f, 0.8f);
    }

    @Test
    void corpusVectorsStayIntactWhenCallerModifiesThem() {
        CorpusStore corpus = TestCorpus.builder()
                .person("Jean Carlomusto", "1993-05-12")
                .chunk("1", 1, "safer sex videos", 1.0f, 0.0f)
                .build();

        corpus.chunks().get(0).embedding()[0] = -1.0f;

        assertThat(corpus.chunksOf("1").get(0).embedding()).containsExactly(1.0f, 0.0f);
        assertThat(corpus.dimensions()).isEqualTo(2);
    }
}
