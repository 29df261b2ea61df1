package de.mirkosertic.vectorsync.store;

import java.util.Map;

/**
 * A search hit. For {@link Metric#COSINE} collections the score is the cosine similarity in [-1, 1].
 */
public record ScoredPoint(String id, double score, Map<String, Object> metadata) {
}
