package org.oralhistory.rag.chat;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Compose an answer.
     *
     * @param systemPrompt instructions including the retrieved context
     * @param history      previous turns of the conversation, oldest first
     * @param question     the new user question
     * @return the completion text
     * @throws LlmClientException if the model cannot be reached
     */
    String chat(String systemPrompt, List<ConversationTurn> history, String question);
}
