package org.oralhistory.rag.chat;

/**
 * Registry entry whose person name was found in a query.
 */
public record EntityMatch(String documentId, PersonRecord record) {
}
