package org.oralhistory.rag.chat;

/**
 * Answer returned to the chat front end.
 */
public record ChatResponse(String response) {
}
