package org.oralhistory.rag.chat;

/**
 * Signals that the generation provider failed to return a completion.
 */
public class LlmClientException extends RuntimeException {

    public LlmClientException(String message) {
        super(message);
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
