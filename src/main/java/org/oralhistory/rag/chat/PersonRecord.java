package org.oralhistory.rag.chat;

/**
 * Metadata row describing one interview transcript and the person interviewed.
 */
public record PersonRecord(String documentId, String name, String date, String title, String tags) {
}
