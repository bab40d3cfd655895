package org.oralhistory.rag.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates failures of the chat pipeline into JSON error responses. Provider
 * failures are distinguishable from "nothing relevant found", which is never an
 * error.
 */
@RestControllerAdvice
public class ChatExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatExceptionHandler.class);

    @ExceptionHandler({ MethodArgumentNotValidException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<ApiError> handleInvalidRequest(Exception ex) {
        LOGGER.debug("Rejected chat request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of("Question is required"));
    }

    @ExceptionHandler(EmbeddingProviderException.class)
    public ResponseEntity<ApiError> handleEmbeddingFailure(EmbeddingProviderException ex) {
        LOGGER.error("Embedding provider failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiError.of("The embedding provider is unavailable"));
    }

    @ExceptionHandler(LlmClientException.class)
    public ResponseEntity<ApiError> handleLlmFailure(LlmClientException ex) {
        LOGGER.error("Language model failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiError.of("The language model is unavailable"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleUnknownRoute(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("Route not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOGGER.error("Error in chat endpoint", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("An error occurred while processing your request"));
    }
}
