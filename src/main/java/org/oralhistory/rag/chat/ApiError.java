package org.oralhistory.rag.chat;

/**
 * Error body returned by the REST endpoints.
 */
public record ApiError(String error, String status) {

    static ApiError of(String message) {
        return new ApiError(message, "error");
    }
}
