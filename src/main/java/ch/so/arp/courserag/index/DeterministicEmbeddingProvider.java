package ch.so.arp.courserag.index;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider based on feature hashing. Every lower-cased
 * word is hashed onto one signed dimension, so texts sharing words end up close
 * to each other. It allows the application to run without an external model
 * while still supporting fuzzy course name resolution and content search.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private final String modelName;
    private final int dimensions;

    public DeterministicEmbeddingProvider(String modelName, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.modelName = modelName;
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings for model '{}' with {} dimensions", modelName, dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) {
                continue;
            }
            long hash = bytesToLong(sha256(token));
            int index = (int) Math.floorMod(hash, (long) dimensions);
            vector[index] += hash < 0 ? -1.0f : 1.0f;
        }
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

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private long bytesToLong(byte[] bytes) {
        long result = 0L;
        for (int i = 0; i < Math.min(8, bytes.length); i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}
