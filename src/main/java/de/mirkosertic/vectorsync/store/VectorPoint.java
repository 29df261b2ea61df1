package de.mirkosertic.vectorsync.store;

import java.util.Map;

/**
 * A point to be written: id, embedding and metadata.
 */
public record VectorPoint(String id, float[] vector, Map<String, Object> metadata) {

    public VectorPoint {
        metadata = Map.copyOf(metadata);
    }
}
