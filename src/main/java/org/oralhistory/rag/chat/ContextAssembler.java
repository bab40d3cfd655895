package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders ranked chunks into the citation format the answer prompt refers to:
 *
 * <pre>
 * Interview 4 with Jean Carlomusto (1993-05-12):
 * [Page 3] ...
 *
 * [Page 7] ...
 * </pre>
 *
 * Blocks of different interviews are separated by a horizontal rule.
 */
class ContextAssembler {

    static final String BLOCK_SEPARATOR = "\n\n---\n\n";
    static final String CHUNK_SEPARATOR = "\n\n";

    String formatDocument(DocumentContext document) {
        PersonRecord record = document.record();
        StringJoiner lines = new StringJoiner(CHUNK_SEPARATOR);
        for (ScoredChunk scored : document.chunks()) {
            lines.add(pageTag(scored.chunk()) + " " + scored.chunk().text());
        }
        return "Interview " + record.documentId() + " with " + record.name() + " (" + record.date() + "):\n"
                + lines;
    }

    String formatDocuments(List<DocumentContext> documents) {
        StringJoiner blocks = new StringJoiner(BLOCK_SEPARATOR);
        documents.forEach(document -> blocks.add(formatDocument(document)));
        return blocks.toString();
    }

    /**
     * Groups ranked chunks by document and returns the largest group. On equal
     * sizes the group whose first chunk ranked highest wins. Chunks keep their
     * ranked order.
     */
    List<ScoredChunk> largestDocumentGroup(List<ScoredChunk> ranked) {
        Map<String, List<ScoredChunk>> groups = new LinkedHashMap<>();
        for (ScoredChunk scored : ranked) {
            groups.computeIfAbsent(scored.documentId(), key -> new ArrayList<>()).add(scored);
        }
        List<ScoredChunk> best = List.of();
        for (List<ScoredChunk> group : groups.values()) {
            if (group.size() > best.size()) {
                best = group;
            }
        }
        return List.copyOf(best);
    }

    private static String pageTag(Chunk chunk) {
        return "[Page " + (chunk.hasPage() ? chunk.page().toString() : "unknown") + "]";
    }

    /**
     * Chunks selected from one interview.
     */
    record DocumentContext(PersonRecord record, List<ScoredChunk> chunks) {

        boolean hasChunks() {
            return !chunks.isEmpty();
        }
    }
}
