package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds interviewees mentioned in free text. A record matches when its full
 * name, or any name token longer than two characters, is contained in the
 * lowercased text. Matches keep the registry order.
 */
public class EntityResolver {

    private static final int MIN_TOKEN_LENGTH = 3;

    private final CorpusStore corpus;

    public EntityResolver(CorpusStore corpus) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
    }

    public List<EntityMatch> findMatches(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        List<EntityMatch> matches = new ArrayList<>();
        for (PersonRecord record : corpus.records()) {
            if (mentions(normalized, record.name())) {
                matches.add(new EntityMatch(record.documentId(), record));
            }
        }
        return List.copyOf(matches);
    }

    public Optional<EntityMatch> findBestMatch(String text) {
        return findMatches(text).stream().findFirst();
    }

    private boolean mentions(String normalizedText, String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String normalizedName = name.toLowerCase(Locale.ROOT);
        if (normalizedText.contains(normalizedName)) {
            return true;
        }
        for (String token : normalizedName.split("\\s+")) {
            if (token.length() >= MIN_TOKEN_LENGTH && normalizedText.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
