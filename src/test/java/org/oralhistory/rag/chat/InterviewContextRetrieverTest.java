package org.oralhistory.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

class InterviewContextRetrieverTest {

    private static final float[] QUERY = { 1f, 0f, 0f };

    private final CorpusStore corpus = TestCorpus.builder()
            .person("Jean Carlomusto", "1993-05-12")
            .person("Vito Russo", "1990-03-01")
            .person("Larry Kramer", "1987-07-20")
            .chunk("1", 1, "Jean produced safer sex videos.", 1f, 0f, 0f)
            .chunk("1", 2, "She founded a cable show.", 0.9f, 0.1f, 0f)
            .chunk("2", 1, "Vito wrote about film.", 0f, 1f, 0f)
            .chunk("2", 3, "He spoke at a demonstration.", 0.1f, 0.9f, 0f)
            .build();

    @Test
    void comparesInterviewsOfAllNamedPeople() {
        TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);

        RetrievalResult result = retriever(corpus, provider)
                .retrieveContext("compare the activism of Jean Carlomusto and Vito Russo", List.of());

        assertThat(result.context()).hasValue("Interview 1 with Jean Carlomusto (1993-05-12):\n"
                + "[Page 1] Jean produced safer sex videos.\n\n"
                + "[Page 2] She founded a cable show.\n\n---\n\n"
                + "Interview 2 with Vito Russo (1990-03-01):\n"
                + "[Page 3] He spoke at a demonstration.\n\n"
                + "[Page 1] Vito wrote about film.");
        assertThat(provider.calls()).isEqualTo(2);
    }

    @Test
    void comparisonOnThreadPoolKeepsMatchOrder() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);
            InterviewContextRetriever parallel = new InterviewContextRetriever(corpus, new QueryReformulator(4, 60),
                    new EntityResolver(corpus), new SimilarityRanker(corpus, provider, 5), executor);

            String question = "compare the activism of Jean Carlomusto and Vito Russo";
            RetrievalResult sequential = retriever(corpus, provider).retrieveContext(question, List.of());

            assertThat(parallel.retrieveContext(question, List.of())).isEqualTo(sequential);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void answersFromSingleNamedInterview() {
        TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);

        RetrievalResult result = retriever(corpus, provider).retrieveContext("Tell me about Jean Carlomusto",
                List.of());

        assertThat(result.context()).hasValue("Interview 1 with Jean Carlomusto (1993-05-12):\n"
                + "[Page 1] Jean produced safer sex videos.\n\n"
                + "[Page 2] She founded a cable show.");
        assertThat(provider.calls()).isEqualTo(1);
    }

    @Test
    void followUpQuestionUsesPersonFromHistory() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Tell me about Vito Russo"),
                ConversationTurn.assistant("From Interview #2: he wrote about film."));

        RetrievalResult result = retriever(corpus, new TestCorpus.FixedEmbeddingProvider(0f, 1f, 0f))
                .retrieveContext("why?", history);

        assertThat(result.context()).get().asString()
                .startsWith("Interview 2 with Vito Russo (1990-03-01):\n[Page 1] Vito wrote about film.")
                .doesNotContain("Jean");
    }

    @Test
    void comparisonWithOneInterviewWithoutPassagesFallsBackToTheOther() {
        TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);

        RetrievalResult result = retriever(corpus, provider)
                .retrieveContext("What is the difference between Larry Kramer and Vito Russo?", List.of());

        assertThat(result.context()).hasValue("Interview 2 with Vito Russo (1990-03-01):\n"
                + "[Page 3] He spoke at a demonstration.\n\n"
                + "[Page 1] Vito wrote about film.");
        assertThat(provider.calls()).isEqualTo(2);
    }

    @Test
    void singleInterviewWithoutPassagesFallsBackToCorpusSearch() {
        TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);

        RetrievalResult result = retriever(corpus, provider).retrieveContext("What did Larry Kramer found in 1987?",
                List.of());

        assertThat(result.context()).get().asString().startsWith("Interview 1 with Jean Carlomusto");
        assertThat(provider.calls()).isEqualTo(2);
    }

    @Test
    void corpusSearchKeepsOnlyTheDominantInterview() {
        CorpusStore unnamed = TestCorpus.builder()
                .person("Ann Able", "2001")
                .person("Bob Baker", "2002")
                .person("Cy Cole", "2003")
                .chunk("1", 1, "a", 1f, 0f, 0f)
                .chunk("2", 1, "b", 0.95f, 0.05f, 0f)
                .chunk("1", 2, "c", 0.9f, 0.1f, 0f)
                .chunk("3", 1, "d", 0.8f, 0.2f, 0f)
                .chunk("1", 3, "e", 0.7f, 0.3f, 0f)
                .chunk("2", 2, "f", 0f, 1f, 0f)
                .chunk("3", 2, "g", 0f, 0f, 1f)
                .build();

        RetrievalResult result = retriever(unnamed, new TestCorpus.FixedEmbeddingProvider(QUERY))
                .retrieveContext("What happened at the first meeting of the group?", List.of());

        assertThat(result.context())
                .hasValue("Interview 1 with Ann Able (2001):\n[Page 1] a\n\n[Page 2] c\n\n[Page 3] e");
    }

    @Test
    void emptyCorpusYieldsExplicitNotFound() {
        TestCorpus.FixedEmbeddingProvider provider = new TestCorpus.FixedEmbeddingProvider(QUERY);

        RetrievalResult result = retriever(CorpusStore.empty(), provider)
                .retrieveContext("What happened at the first meeting?", List.of());

        assertThat(result).isSameAs(RetrievalResult.notFound());
        assertThat(result.isFound()).isFalse();
        assertThat(result.context()).isEmpty();
        assertThat(provider.calls()).isEqualTo(1);
    }

    @Test
    void embeddingFailureAbortsComparison() {
        EmbeddingProvider failing = text -> {
            throw new EmbeddingProviderException("quota exceeded");
        };

        assertThatThrownBy(() -> retriever(corpus, failing)
                .retrieveContext("compare Jean Carlomusto and Vito Russo", List.of()))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessage("quota exceeded");
    }

    @Test
    void embeddingFailureAbortsCorpusSearch() {
        EmbeddingProvider failing = text -> {
            throw new EmbeddingProviderException("timeout");
        };

        assertThatThrownBy(() -> retriever(corpus, failing).retrieveContext("What happened next?", List.of()))
                .isInstanceOf(EmbeddingProviderException.class);
    }

    private static InterviewContextRetriever retriever(CorpusStore corpus, EmbeddingProvider provider) {
        return new InterviewContextRetriever(corpus, new QueryReformulator(4, 60), new EntityResolver(corpus),
                new SimilarityRanker(corpus, provider, 5), Runnable::run);
    }
}
