package de.mirkosertic.vectorsync.store;

import java.util.Map;

/**
 * A point as returned by {@link VectorStore#scroll(String)}, without its vector.
 */
public record StoredPoint(String id, Map<String, Object> metadata) {

    public String stringValue(final String key) {
        final Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    public int intValue(final String key, final int defaultValue) {
        final Object value = metadata.get(key);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }
}
