package org.oralhistory.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcChatLogRepositoryTest {

    private JdbcChatLogRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        repository = new JdbcChatLogRepository(JdbcClient.create(dataSource));
        repository.createTableIfMissing();
    }

    @Test
    void storesMessagesAndReadsThemChronologically() {
        OffsetDateTime first = OffsetDateTime.parse("2024-03-01T10:15:30Z");
        repository.record(new ChatMessage("R_1", "s1", ConversationTurn.Role.ASSISTANT, "From Interview #2: yes.",
                "direct-answers-bot", first.plusSeconds(2)));
        repository.record(new ChatMessage("R_1", "s1", ConversationTurn.Role.USER, "Who was Vito Russo?",
                "direct-answers-bot", first));
        repository.record(new ChatMessage("R_2", "s9", ConversationTurn.Role.USER, "hello", "direct-answers-bot",
                first.plusSeconds(1)));

        assertThat(repository.findByParticipant("R_1"))
                .extracting(ChatMessage::role, ChatMessage::content)
                .containsExactly(
                        tuple(ConversationTurn.Role.USER, "Who was Vito Russo?"),
                        tuple(ConversationTurn.Role.ASSISTANT, "From Interview #2: yes."));
        assertThat(repository.findByParticipant("R_2")).singleElement().satisfies(message -> {
            assertThat(message.sessionId()).isEqualTo("s9");
            assertThat(message.createdAt().toInstant()).isEqualTo(first.plusSeconds(1).toInstant());
        });
        assertThat(repository.findByParticipant("R_3")).isEmpty();
    }

    @Test
    void creatingTheTableTwiceIsHarmless() {
        repository.createTableIfMissing();

        assertThat(repository.findByParticipant("R_1")).isEmpty();
    }
}
