package org.oralhistory.rag.chat;

import java.util.List;

/**
 * Entry point of the retrieval pipeline consumed by the chat service.
 */
@FunctionalInterface
public interface ContextRetriever {

    /**
     * Select and format the interview passages relevant to the question.
     *
     * @param question the raw user question
     * @param history  the conversation so far, oldest turn first
     * @return the formatted context or {@link RetrievalResult#notFound()}
     * @throws EmbeddingProviderException if any embedding call fails
     */
    RetrievalResult retrieveContext(String question, List<ConversationTurn> history);
}
