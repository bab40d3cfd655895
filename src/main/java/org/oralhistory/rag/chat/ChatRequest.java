package org.oralhistory.rag.chat;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests. The participant id is the survey
 * respondent id the chat log is keyed by.
 */
public record ChatRequest(
        @NotBlank String question,
        String sessionId,
        @JsonAlias("qualtricsId") String participantId) {

    static final String DEFAULT_SESSION = "default";
    static final String UNKNOWN_PARTICIPANT = "unknown";

    public String sessionOrDefault() {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION : sessionId;
    }

    public String participantOrUnknown() {
        return participantId == null || participantId.isBlank() ? UNKNOWN_PARTICIPANT : participantId;
    }
}
