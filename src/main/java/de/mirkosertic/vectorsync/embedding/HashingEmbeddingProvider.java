package de.mirkosertic.vectorsync.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedding by feature hashing. Needs no model server;
 * useful offline and in tests. Texts sharing words get similar vectors.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public HashingEmbeddingProvider(final int dimension) {
        if (dimension < 2) {
            throw new IllegalArgumentException("dimension must be at least 2");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embedPassages(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (final String text : texts) {
            result.add(embed(text));
        }
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embed(text);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    float[] embed(final String text) {
        final float[] vector = new float[dimension];
        if (text != null) {
            for (final String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
                if (token.isBlank()) {
                    continue;
                }
                vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
            }
        }

        float norm = 0f;
        for (final float v : vector) {
            norm += v * v;
        }
        if (norm == 0f) {
            // Cosine is undefined for the zero vector
            vector[0] = 1f;
            return vector;
        }
        norm = (float) Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }
}
