package org.oralhistory.rag.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Packs consecutive paragraphs of a transcript into chunks that stay below a
 * token budget. A paragraph that alone exceeds the budget becomes its own
 * chunk. Each chunk remembers the page its first paragraph is on.
 */
public class TranscriptChunker {

    public static final int DEFAULT_MAX_TOKENS = 500;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private final Encoding encoding;
    private final int maxTokens;

    public TranscriptChunker(int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.R50K_BASE);
        this.maxTokens = maxTokens;
    }

    public List<TranscriptChunk> split(TranscriptDocument document) {
        List<TranscriptChunk> chunks = new ArrayList<>();
        String current = "";
        int currentPage = 1;
        for (int pageIndex = 0; pageIndex < document.pages().size(); pageIndex++) {
            int page = pageIndex + 1;
            for (String paragraph : PARAGRAPH_BREAK.split(document.pages().get(pageIndex))) {
                String trimmed = paragraph.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String candidate = current + "\n" + trimmed;
                if (countTokens(candidate) > maxTokens && !current.isEmpty()) {
                    chunks.add(chunkOf(current, document.fileName(), currentPage));
                    current = trimmed;
                    currentPage = page;
                } else {
                    if (current.isEmpty()) {
                        currentPage = page;
                    }
                    current = candidate;
                }
            }
        }
        if (!current.isBlank()) {
            chunks.add(chunkOf(current, document.fileName(), currentPage));
        }
        return chunks;
    }

    int countTokens(String text) {
        return encoding.countTokens(text);
    }

    private TranscriptChunk chunkOf(String text, String source, int page) {
        String trimmed = text.trim();
        return new TranscriptChunk(trimmed, source, page, countTokens(trimmed));
    }
}
