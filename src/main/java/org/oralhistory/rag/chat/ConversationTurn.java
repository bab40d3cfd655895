package org.oralhistory.rag.chat;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Single message of a conversation as it is kept in the session history.
 */
public record ConversationTurn(Role role, String content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }

    public enum Role {
        USER,
        ASSISTANT;

        /**
         * Name of the role in the chat completion wire format.
         */
        @JsonValue
        public String apiName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
