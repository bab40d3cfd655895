package org.oralhistory.rag.chat;

import java.util.List;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted. It echoes the first cited interview so
 * the retrieval result stays visible in the answer.
 */
class MockLlmClient implements LlmClient {

    @Override
    public String chat(String systemPrompt, List<ConversationTurn> history, String question) {
        String citation = firstCitation(systemPrompt);
        if (citation == null) {
            return "[mocked answer] I don't find information about this in the interviews. Question was: "
                    + question;
        }
        return "[mocked answer] From " + citation + " Previous turns: " + history.size() + ". Question was: "
                + question;
    }

    private String firstCitation(String systemPrompt) {
        return systemPrompt.lines()
                .filter(line -> line.startsWith("Interview "))
                .findFirst()
                .orElse(null);
    }
}
