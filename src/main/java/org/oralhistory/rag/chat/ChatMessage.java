package org.oralhistory.rag.chat;

import java.time.OffsetDateTime;

/**
 * Persisted chat log entry.
 */
public record ChatMessage(
        String participantId,
        String sessionId,
        ConversationTurn.Role role,
        String content,
        String chatbotId,
        OffsetDateTime createdAt) {
}
