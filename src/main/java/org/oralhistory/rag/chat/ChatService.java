package org.oralhistory.rag.chat;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates the retrieval of interview passages and delegates the answer
 * generation to the large language model integration. Every message is written
 * to the chat log and successful exchanges extend the session history.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final ContextRetriever contextRetriever;
    private final LlmClient llmClient;
    private final ChatSessionStore sessionStore;
    private final ChatLogRepository chatLog;
    private final String chatbotId;
    private final Clock clock;

    public ChatService(ContextRetriever contextRetriever, LlmClient llmClient, ChatSessionStore sessionStore,
            ChatLogRepository chatLog, String chatbotId, Clock clock) {
        this.contextRetriever = Objects.requireNonNull(contextRetriever, "contextRetriever");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
        this.chatLog = Objects.requireNonNull(chatLog, "chatLog");
        this.chatbotId = Objects.requireNonNull(chatbotId, "chatbotId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String answer(String sessionId, String participantId, String question) {
        log(participantId, sessionId, ConversationTurn.Role.USER, question);

        List<ConversationTurn> history = sessionStore.history(sessionId);
        RetrievalResult context;
        String response;
        try {
            context = contextRetriever.retrieveContext(question, history);
            response = ResponseCompleter.ensureComplete(
                    llmClient.chat(SystemPrompt.render(context), history, question));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to produce response for question '{}': {}", question, ex.getMessage(), ex);
            throw ex;
        }
        if (!context.isFound()) {
            LOGGER.info("No interview passages found for question '{}'", question);
        }

        log(participantId, sessionId, ConversationTurn.Role.ASSISTANT, response);
        sessionStore.appendExchange(sessionId, question, response);
        return response;
    }

    public List<ChatMessage> history(String participantId) {
        return chatLog.findByParticipant(participantId);
    }

    private void log(String participantId, String sessionId, ConversationTurn.Role role, String content) {
        chatLog.record(new ChatMessage(participantId, sessionId, role, content, chatbotId,
                OffsetDateTime.now(clock)));
    }
}
