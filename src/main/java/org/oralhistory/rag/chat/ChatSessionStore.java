package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime conversation histories keyed by session id. Appends for one
 * key are applied atomically, so concurrent exchanges of the same session never
 * overwrite each other; different sessions do not contend.
 */
public class ChatSessionStore {

    private final Map<String, List<ConversationTurn>> sessions = new ConcurrentHashMap<>();

    /**
     * Snapshot of the session history, oldest turn first. Unknown sessions have
     * an empty history.
     */
    public List<ConversationTurn> history(String sessionId) {
        return sessions.getOrDefault(sessionId, List.of());
    }

    public void appendExchange(String sessionId, String question, String answer) {
        sessions.compute(sessionId, (key, current) -> {
            List<ConversationTurn> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(ConversationTurn.user(question));
            updated.add(ConversationTurn.assistant(answer));
            return List.copyOf(updated);
        });
    }
}
