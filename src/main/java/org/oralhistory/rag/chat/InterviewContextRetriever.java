package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieval pipeline over the interview corpus. Depending on the people named
 * in the (reformulated) question it either compares several interviews, digs
 * into one interview or searches the whole corpus and keeps the interview
 * that dominates the top results.
 */
public class InterviewContextRetriever implements ContextRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterviewContextRetriever.class);

    private final CorpusStore corpus;
    private final QueryReformulator reformulator;
    private final EntityResolver entityResolver;
    private final SimilarityRanker ranker;
    private final ContextAssembler assembler = new ContextAssembler();
    private final Executor fanOutExecutor;

    public InterviewContextRetriever(CorpusStore corpus, QueryReformulator reformulator,
            EntityResolver entityResolver, SimilarityRanker ranker, Executor fanOutExecutor) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        this.reformulator = Objects.requireNonNull(reformulator, "reformulator");
        this.entityResolver = Objects.requireNonNull(entityResolver, "entityResolver");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.fanOutExecutor = Objects.requireNonNull(fanOutExecutor, "fanOutExecutor");
    }

    @Override
    public RetrievalResult retrieveContext(String question, List<ConversationTurn> history) {
        QueryReformulator.ReformulatedQuery query = reformulator.reformulate(question, history);
        String queryText = query.queryText();
        List<EntityMatch> matches = entityResolver.findMatches(queryText);
        LOGGER.debug("Query resolved to {} interviewee(s), comparative={}", matches.size(), query.comparative());

        if (matches.size() >= 2) {
            List<ContextAssembler.DocumentContext> documents = rankEachDocument(queryText, matches);
            if (documents.size() >= 2) {
                LOGGER.debug("Comparing {} interviews", documents.size());
                return RetrievalResult.found(assembler.formatDocuments(documents));
            }
            if (documents.size() == 1) {
                ContextAssembler.DocumentContext single = documents.get(0);
                LOGGER.debug("Only interview {} yielded passages, answering from it alone",
                        single.record().documentId());
                return RetrievalResult.found(assembler.formatDocument(single));
            }
        } else if (matches.size() == 1) {
            EntityMatch match = matches.get(0);
            LOGGER.info("Found match for person: {} (ID: {})", match.record().name(), match.documentId());
            ContextAssembler.DocumentContext document = rankDocument(queryText, match);
            if (document.hasChunks()) {
                return RetrievalResult.found(assembler.formatDocument(document));
            }
        }
        return searchWholeCorpus(queryText);
    }

    private RetrievalResult searchWholeCorpus(String queryText) {
        List<ScoredChunk> ranked = ranker.rank(ranker.embed(queryText));
        List<ScoredChunk> group = assembler.largestDocumentGroup(ranked);
        if (group.isEmpty()) {
            LOGGER.debug("No passages found in a corpus of {} chunks", corpus.chunks().size());
            return RetrievalResult.notFound();
        }
        String documentId = group.get(0).documentId();
        PersonRecord record = corpus.record(documentId)
                .orElseThrow(() -> new IllegalStateException("No metadata for interview " + documentId));
        LOGGER.debug("Corpus search favours interview {} with {} of {} passages", documentId, group.size(),
                ranked.size());
        return RetrievalResult.found(assembler.formatDocument(new ContextAssembler.DocumentContext(record, group)));
    }

    /**
     * Ranks every matched interview on the fan-out executor and gathers the
     * non-empty results in match order.
     */
    private List<ContextAssembler.DocumentContext> rankEachDocument(String queryText, List<EntityMatch> matches) {
        List<CompletableFuture<ContextAssembler.DocumentContext>> futures = matches.stream()
                .map(match -> CompletableFuture.supplyAsync(() -> rankDocument(queryText, match), fanOutExecutor))
                .toList();
        List<ContextAssembler.DocumentContext> documents = new ArrayList<>();
        try {
            for (CompletableFuture<ContextAssembler.DocumentContext> future : futures) {
                ContextAssembler.DocumentContext document = future.join();
                if (document.hasChunks()) {
                    documents.add(document);
                }
            }
        } catch (CompletionException ex) {
            futures.forEach(future -> future.cancel(false));
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
        return documents;
    }

    private ContextAssembler.DocumentContext rankDocument(String queryText, EntityMatch match) {
        float[] queryVector = ranker.embed(queryText);
        return new ContextAssembler.DocumentContext(match.record(), ranker.rank(queryVector, match.documentId()));
    }
}
