package org.oralhistory.rag.chat;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * PostgreSQL backed {@link ChatLogRepository}.
 */
class JdbcChatLogRepository implements ChatLogRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcChatLogRepository.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS chat_messages (
              id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              participant_id VARCHAR(255),
              session_id VARCHAR(255),
              role VARCHAR(10),
              content TEXT,
              chatbot_id VARCHAR(50),
              created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO chat_messages (participant_id, session_id, role, content, chatbot_id, created_at)
            VALUES (:participantId, :sessionId, :role, :content, :chatbotId, :createdAt)
            """;

    private static final String SELECT_BY_PARTICIPANT_SQL = """
            SELECT participant_id, session_id, role, content, chatbot_id, created_at
            FROM chat_messages
            WHERE participant_id = :participantId
            ORDER BY created_at, id
            """;

    private final JdbcClient jdbcClient;

    JdbcChatLogRepository(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    void createTableIfMissing() {
        jdbcClient.sql(CREATE_TABLE_SQL).update();
        LOGGER.debug("Ensured chat_messages table exists");
    }

    @Override
    public void record(ChatMessage message) {
        jdbcClient.sql(INSERT_SQL)
                .param("participantId", message.participantId())
                .param("sessionId", message.sessionId())
                .param("role", message.role().apiName())
                .param("content", message.content())
                .param("chatbotId", message.chatbotId())
                .param("createdAt", message.createdAt())
                .update();
    }

    @Override
    public List<ChatMessage> findByParticipant(String participantId) {
        return jdbcClient.sql(SELECT_BY_PARTICIPANT_SQL)
                .param("participantId", participantId)
                .query(ChatMessageRowMapper.INSTANCE)
                .list();
    }

    private enum ChatMessageRowMapper implements RowMapper<ChatMessage> {
        INSTANCE;

        @Override
        public ChatMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ChatMessage(
                    rs.getString("participant_id"),
                    rs.getString("session_id"),
                    ConversationTurn.Role.valueOf(rs.getString("role").toUpperCase(Locale.ROOT)),
                    rs.getString("content"),
                    rs.getString("chatbot_id"),
                    rs.getObject("created_at", OffsetDateTime.class));
        }
    }
}
