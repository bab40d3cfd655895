package org.oralhistory.rag.chat;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Folds recent conversation turns into elliptical questions ("why did she ...")
 * so that the embedding carries enough context, and flags comparative intent.
 */
public class QueryReformulator {

    private final int historyTurns;
    private final int shortQuestionLength;

    public QueryReformulator(int historyTurns, int shortQuestionLength) {
        if (historyTurns < 0) {
            throw new IllegalArgumentException("historyTurns must not be negative");
        }
        this.historyTurns = historyTurns;
        this.shortQuestionLength = shortQuestionLength;
    }

    public ReformulatedQuery reformulate(String question, List<ConversationTurn> history) {
        String query = question;
        if (needsHistory(question) && history != null && !history.isEmpty()) {
            String previous = history.subList(Math.max(0, history.size() - historyTurns), history.size()).stream()
                    .map(ConversationTurn::content)
                    .collect(Collectors.joining(" "));
            query = previous + " " + question;
        }
        return new ReformulatedQuery(query, isComparative(query));
    }

    boolean needsHistory(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        return question.length() < shortQuestionLength
                || lower.startsWith("why")
                || lower.startsWith("how")
                || !question.contains("?");
    }

    static boolean isComparative(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        return lower.contains("between") || lower.contains("compare");
    }

    /**
     * Query text that is embedded and matched against the registry.
     */
    public record ReformulatedQuery(String queryText, boolean comparative) {
    }
}
