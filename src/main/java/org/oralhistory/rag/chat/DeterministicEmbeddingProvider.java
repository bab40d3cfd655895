package org.oralhistory.rag.chat;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline embedding provider. Each vector is expanded from SHA-256 digests of
 * the text followed by a block counter, read as signed 16 bit components and
 * scaled to unit length. Ingestion with {@code --no-openai} uses the same
 * provider, so a corpus built offline can be queried without the OpenAI API.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final int dimensions;

    public DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        byte[] input = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        MessageDigest digest = newDigest();
        float[] vector = new float[dimensions];
        int filled = 0;
        for (int block = 0; filled < dimensions; block++) {
            digest.update(input);
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(block).array());
            ByteBuffer hash = ByteBuffer.wrap(digest.digest());
            while (hash.remaining() >= Short.BYTES && filled < dimensions) {
                vector[filled++] = hash.getShort() / 32768.0f;
            }
        }
        return toUnitLength(vector);
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * Fails when the loaded corpus was embedded with a different vector size,
     * since every similarity query against it would be rejected.
     */
    public void checkCompatibleWith(CorpusStore corpus) {
        if (!corpus.isEmpty() && corpus.dimensions() != dimensions) {
            throw new CorpusLoadException("Corpus embeddings have " + corpus.dimensions()
                    + " dimensions but deterministic embeddings are configured with " + dimensions);
        }
    }

    private static float[] toUnitLength(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " algorithm not available", ex);
        }
    }
}
