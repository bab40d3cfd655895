package org.oralhistory.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class ChatSessionStoreTest {

    private final ChatSessionStore store = new ChatSessionStore();

    @Test
    void unknownSessionHasEmptyHistory() {
        assertThat(store.history("nobody")).isEmpty();
    }

    @Test
    void appendsUserAndAssistantTurnsInOrder() {
        store.appendExchange("s1", "Who was Vito Russo?", "A film historian.");
        store.appendExchange("s1", "why?", "Because of his book.");

        assertThat(store.history("s1")).containsExactly(
                ConversationTurn.user("Who was Vito Russo?"),
                ConversationTurn.assistant("A film historian."),
                ConversationTurn.user("why?"),
                ConversationTurn.assistant("Because of his book."));
        assertThat(store.history("s2")).isEmpty();
    }

    @Test
    void historySnapshotIsImmutable() {
        store.appendExchange("s1", "q", "a");

        List<ConversationTurn> history = store.history("s1");

        assertThatThrownBy(() -> history.add(ConversationTurn.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void concurrentExchangesOfOneSessionAreNotLost() throws Exception {
        int exchanges = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < exchanges; i++) {
                int index = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    store.appendExchange("shared", "q" + index, "a" + index);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }

        List<ConversationTurn> history = store.history("shared");
        assertThat(history).hasSize(exchanges * 2);
        for (int i = 0; i < history.size(); i += 2) {
            String question = history.get(i).content();
            assertThat(history.get(i + 1).content()).isEqualTo("a" + question.substring(1));
        }
    }
}
