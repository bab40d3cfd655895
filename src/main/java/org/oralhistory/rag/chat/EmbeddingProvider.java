package org.oralhistory.rag.chat;

/**
 * Strategy abstraction used to compute embeddings for questions and transcript
 * chunks. The provider must use the same model and dimensionality that built
 * the corpus artifact, otherwise similarity scores are meaningless.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws EmbeddingProviderException if the provider cannot be reached
     */
    float[] embed(String text);
}
