package org.oralhistory.rag.chat;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the contextual retrieval pipeline.
 */
@ConfigurationProperties(prefix = "rag.chat.retrieval")
public class RetrievalProperties {

    /**
     * Resource location of the embedding artifact written by the ingestion command.
     */
    private String embeddingsLocation = "file:./embeddings.json";

    /**
     * Resource location of the interview metadata table.
     */
    private String metadataLocation = "file:./metadata.csv";

    /**
     * Number of chunks kept per ranking call.
     */
    private int topK = 5;

    /**
     * Number of most recent conversation turns folded into short questions.
     */
    private int historyTurns = 4;

    /**
     * Questions shorter than this are treated as follow-ups.
     */
    private int shortQuestionLength = 60;

    /**
     * Maximum number of concurrent per-document rankings for comparative questions.
     */
    private int fanOutParallelism = 4;

    /**
     * Vector size of the deterministic embedding provider.
     */
    private int embeddingDimensions = 1536;

    public String getEmbeddingsLocation() {
        return embeddingsLocation;
    }

    public void setEmbeddingsLocation(String embeddingsLocation) {
        this.embeddingsLocation = embeddingsLocation;
    }

    public String getMetadataLocation() {
        return metadataLocation;
    }

    public void setMetadataLocation(String metadataLocation) {
        this.metadataLocation = metadataLocation;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getHistoryTurns() {
        return historyTurns;
    }

    public void setHistoryTurns(int historyTurns) {
        this.historyTurns = historyTurns;
    }

    public int getShortQuestionLength() {
        return shortQuestionLength;
    }

    public void setShortQuestionLength(int shortQuestionLength) {
        this.shortQuestionLength = shortQuestionLength;
    }

    public int getFanOutParallelism() {
        return fanOutParallelism;
    }

    public void setFanOutParallelism(int fanOutParallelism) {
        this.fanOutParallelism = fanOutParallelism;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }
}
