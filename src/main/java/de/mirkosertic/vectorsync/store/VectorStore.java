package de.mirkosertic.vectorsync.store;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Storage for embedded fragments, grouped into named collections, plus a small
 * key/value area for metadata blobs that live next to the index.
 * <p>
 * Every operation reports failures as {@link IndexStoreException}.
 */
public interface VectorStore extends AutoCloseable {

    void createCollection(String name, int vectorSize, Metric metric) throws IndexStoreException;

    boolean collectionExists(String name) throws IndexStoreException;

    void deleteCollection(String name) throws IndexStoreException;

    /**
     * Inserts the points, replacing points with the same id.
     */
    void upsert(String collection, List<VectorPoint> points) throws IndexStoreException;

    /**
     * Deletes the points with the given ids. Unknown ids are ignored.
     */
    void delete(String collection, Collection<String> ids) throws IndexStoreException;

    /**
     * Merges {@code patch} into the metadata of the given points, keeping their vectors.
     */
    void updateMetadata(String collection, Collection<String> ids, Map<String, Object> patch) throws IndexStoreException;

    /**
     * All points of a collection, metadata only.
     */
    List<StoredPoint> scroll(String collection) throws IndexStoreException;

    long count(String collection) throws IndexStoreException;

    List<ScoredPoint> search(String collection, float[] vector, int limit) throws IndexStoreException;

    @Nullable
    String getMetadata(String id) throws IndexStoreException;

    void putMetadata(String id, String blob) throws IndexStoreException;

    @Override
    void close() throws IndexStoreException;
}
