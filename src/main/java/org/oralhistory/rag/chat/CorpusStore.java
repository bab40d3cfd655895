package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory corpus: every chunk in artifact order plus the person
 * registry in metadata table order. Safe to share between request threads.
 */
public final class CorpusStore {

    private final List<Chunk> chunks;
    private final List<PersonRecord> records;
    private final Map<String, PersonRecord> recordsById;
    private final Map<String, List<Chunk>> chunksByDocument;

    CorpusStore(List<Chunk> chunks, List<PersonRecord> records) {
        this.chunks = List.copyOf(chunks);
        this.records = List.copyOf(records);
        Map<String, PersonRecord> byId = new LinkedHashMap<>();
        for (PersonRecord record : records) {
            if (byId.putIfAbsent(record.documentId(), record) != null) {
                throw new CorpusLoadException("Duplicate document id " + record.documentId());
            }
        }
        this.recordsById = Collections.unmodifiableMap(byId);
        Map<String, List<Chunk>> byDocument = new LinkedHashMap<>();
        for (Chunk chunk : this.chunks) {
            byDocument.computeIfAbsent(chunk.documentId(), key -> new ArrayList<>()).add(chunk);
        }
        byDocument.replaceAll((key, value) -> List.copyOf(value));
        this.chunksByDocument = Collections.unmodifiableMap(byDocument);
    }

    public static CorpusStore empty() {
        return new CorpusStore(List.of(), List.of());
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    /**
     * Chunks of one document in transcript order; empty for unknown ids.
     */
    public List<Chunk> chunksOf(String documentId) {
        return chunksByDocument.getOrDefault(documentId, List.of());
    }

    /**
     * Registry entries in metadata table order.
     */
    public List<PersonRecord> records() {
        return records;
    }

    public Optional<PersonRecord> record(String documentId) {
        return Optional.ofNullable(recordsById.get(documentId));
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int dimensions() {
        return chunks.isEmpty() ? 0 : chunks.get(0).embedding().length;
    }
}
