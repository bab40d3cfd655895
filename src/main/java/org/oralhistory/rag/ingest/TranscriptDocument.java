package org.oralhistory.rag.ingest;

import java.util.List;

/**
 * Text of a transcript PDF, one entry per page (page numbers start at 1).
 */
public record TranscriptDocument(String fileName, List<String> pages) {

    public int pageCount() {
        return pages.size();
    }
}
