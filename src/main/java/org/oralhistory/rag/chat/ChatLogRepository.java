package org.oralhistory.rag.chat;

import java.util.List;

/**
 * Append-only log of every message exchanged with the chatbot.
 */
public interface ChatLogRepository {

    void record(ChatMessage message);

    /**
     * All messages of a participant in chronological order.
     */
    List<ChatMessage> findByParticipant(String participantId);
}
