package org.oralhistory.rag.chat;

/**
 * Signals that the embedding provider could not produce a vector, e.g. because
 * of a transport failure or an exhausted quota. Not retried by the retrieval
 * pipeline.
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
