package org.oralhistory.rag.chat;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a context retrieval. Either a formatted block of source passages
 * or the explicit marker that nothing relevant exists in the corpus.
 */
public interface RetrievalResult {

    Optional<String> context();

    default boolean isFound() {
        return context().isPresent();
    }

    static RetrievalResult found(String context) {
        return new Found(context);
    }

    static RetrievalResult notFound() {
        return NotFound.INSTANCE;
    }

    record Found(String text) implements RetrievalResult {

        public Found {
            Objects.requireNonNull(text, "text");
            if (text.isBlank()) {
                throw new IllegalArgumentException("found context must not be blank");
            }
        }

        @Override
        public Optional<String> context() {
            return Optional.of(text);
        }
    }

    enum NotFound implements RetrievalResult {
        INSTANCE;

        @Override
        public Optional<String> context() {
            return Optional.empty();
        }
    }
}
