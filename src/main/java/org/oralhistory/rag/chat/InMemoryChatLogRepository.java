package org.oralhistory.rag.chat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Chat log kept in memory for local development and tests.
 */
class InMemoryChatLogRepository implements ChatLogRepository {

    private final List<ChatMessage> messages = new CopyOnWriteArrayList<>();

    @Override
    public void record(ChatMessage message) {
        messages.add(message);
    }

    @Override
    public List<ChatMessage> findByParticipant(String participantId) {
        return messages.stream().filter(message -> message.participantId().equals(participantId)).toList();
    }
}
