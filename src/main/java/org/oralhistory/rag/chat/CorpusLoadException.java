package org.oralhistory.rag.chat;

/**
 * Raised when the corpus artifact or the metadata table cannot be turned into a
 * consistent {@link CorpusStore}. The application must not start in that case.
 */
public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
