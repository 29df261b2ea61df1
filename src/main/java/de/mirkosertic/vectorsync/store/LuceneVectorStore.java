package de.mirkosertic.vectorsync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link VectorStore} on a local Lucene index.
 * <p>
 * All collections share one index. Three kinds of documents exist: collection
 * descriptors, points (HNSW vector plus JSON metadata) and metadata blobs. Points
 * carry their collection as a keyword field that doubles as the kNN filter. The
 * vector field name encodes metric and dimension because Lucene fixes both per field.
 * <p>
 * Writes refresh the searcher before returning, so a read after a write observes it.
 * Commits happen on a timer, on {@link #putMetadata} and on close.
 */
public class LuceneVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneVectorStore.class);

    static final String FIELD_KIND = "kind";
    static final String FIELD_UID = "uid";
    static final String FIELD_ID = "id";
    static final String FIELD_COLLECTION = "collection";
    static final String FIELD_METADATA = "metadata_json";
    static final String FIELD_VECTOR_BYTES = "vector_bytes";
    static final String FIELD_VECTOR_SIZE = "vector_size";
    static final String FIELD_METRIC = "metric";
    static final String FIELD_BLOB = "blob";

    static final String KIND_COLLECTION = "collection";
    static final String KIND_POINT = "point";
    static final String KIND_METADATA = "metadata";

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final Path indexPath;
    private final long commitIntervalMs;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, CollectionInfo> collections = new ConcurrentHashMap<>();

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService commitScheduler;

    public LuceneVectorStore(final Path indexPath, final long commitIntervalMs) {
        this.indexPath = indexPath;
        this.commitIntervalMs = commitIntervalMs;
    }

    /**
     * Opens (or creates) the index. Must be called before using the store.
     */
    public void init() throws IndexStoreException {
        try {
            if (!Files.exists(indexPath)) {
                Files.createDirectories(indexPath);
                logger.info("Created index directory: {}", indexPath.toAbsolutePath());
            }

            directory = FSDirectory.open(indexPath);
            final IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            indexWriter = new IndexWriter(directory, config);
            indexWriter.commit();

            searcherManager = new SearcherManager(indexWriter, null);
            loadCollections();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot open index at " + indexPath, e);
        }

        if (commitIntervalMs > 0) {
            commitScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "lucene-commit");
                t.setDaemon(true);
                return t;
            });
            commitScheduler.scheduleAtFixedRate(this::commitQuietly,
                    commitIntervalMs, commitIntervalMs, TimeUnit.MILLISECONDS);
        }

        logger.info("Vector index initialized at: {} with {} collection(s), commit interval {}ms",
                indexPath.toAbsolutePath(), collections.size(), commitIntervalMs);
    }

    private void loadCollections() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final Query query = new TermQuery(new Term(FIELD_KIND, KIND_COLLECTION));
            final TopDocs topDocs = searcher.search(query, Math.max(1, searcher.count(query)));
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = searcher.storedFields().document(scoreDoc.doc);
                final CollectionInfo info = new CollectionInfo(
                        doc.getField(FIELD_VECTOR_SIZE).numericValue().intValue(),
                        Metric.valueOf(doc.get(FIELD_METRIC)));
                collections.put(doc.get(FIELD_COLLECTION), info);
            }
        } finally {
            searcherManager.release(searcher);
        }
    }

    private void commitQuietly() {
        try {
            indexWriter.commit();
        } catch (final IOException | RuntimeException e) {
            logger.warn("Periodic index commit failed", e);
        }
    }

    @Override
    public synchronized void createCollection(final String name, final int vectorSize, final Metric metric)
            throws IndexStoreException {
        final CollectionInfo existing = collections.get(name);
        if (existing != null) {
            if (existing.vectorSize != vectorSize || existing.metric != metric) {
                throw new IndexStoreException("Collection " + name + " already exists with size "
                        + existing.vectorSize + " and metric " + existing.metric);
            }
            return;
        }

        final Document doc = new Document();
        doc.add(new StringField(FIELD_KIND, KIND_COLLECTION, Field.Store.YES));
        doc.add(new StringField(FIELD_UID, collectionUid(name), Field.Store.NO));
        doc.add(new StringField(FIELD_COLLECTION, name, Field.Store.YES));
        doc.add(new StoredField(FIELD_VECTOR_SIZE, vectorSize));
        doc.add(new StringField(FIELD_METRIC, metric.name(), Field.Store.YES));
        try {
            indexWriter.updateDocument(new Term(FIELD_UID, collectionUid(name)), doc);
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot create collection " + name, e);
        }
        collections.put(name, new CollectionInfo(vectorSize, metric));
        logger.info("Created collection {} (size {}, metric {})", name, vectorSize, metric);
    }

    @Override
    public boolean collectionExists(final String name) {
        return collections.containsKey(name);
    }

    @Override
    public synchronized void deleteCollection(final String name) throws IndexStoreException {
        try {
            indexWriter.deleteDocuments(new Term(FIELD_COLLECTION, name));
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot delete collection " + name, e);
        }
        collections.remove(name);
        logger.info("Deleted collection {}", name);
    }

    @Override
    public void upsert(final String collection, final List<VectorPoint> points) throws IndexStoreException {
        if (points.isEmpty()) {
            return;
        }
        final CollectionInfo info = requireCollection(collection);
        try {
            for (final VectorPoint point : points) {
                if (point.vector().length != info.vectorSize) {
                    throw new IndexStoreException("Vector of point " + point.id() + " has size "
                            + point.vector().length + ", collection " + collection + " expects " + info.vectorSize);
                }
                indexWriter.updateDocument(new Term(FIELD_UID, pointUid(collection, point.id())),
                        pointDocument(collection, info, point.id(), point.vector(), point.metadata()));
            }
            searcherManager.maybeRefreshBlocking();
        } catch (final IndexStoreException e) {
            throw e;
        } catch (final IOException | IllegalArgumentException e) {
            throw new IndexStoreException("Cannot upsert " + points.size() + " point(s) into " + collection, e);
        }
    }

    @Override
    public void delete(final String collection, final Collection<String> ids) throws IndexStoreException {
        if (ids.isEmpty()) {
            return;
        }
        requireCollection(collection);
        try {
            final Term[] terms = ids.stream()
                    .map(id -> new Term(FIELD_UID, pointUid(collection, id)))
                    .toArray(Term[]::new);
            indexWriter.deleteDocuments(terms);
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot delete " + ids.size() + " point(s) from " + collection, e);
        }
    }

    @Override
    public synchronized void updateMetadata(final String collection, final Collection<String> ids,
                                            final Map<String, Object> patch) throws IndexStoreException {
        if (ids.isEmpty()) {
            return;
        }
        final CollectionInfo info = requireCollection(collection);
        try {
            final List<Document> originals = new ArrayList<>();
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                for (final String id : ids) {
                    final TopDocs topDocs = searcher.search(
                            new TermQuery(new Term(FIELD_UID, pointUid(collection, id))), 1);
                    if (topDocs.scoreDocs.length > 0) {
                        originals.add(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
                    }
                }
            } finally {
                searcherManager.release(searcher);
            }

            for (final Document original : originals) {
                final Map<String, Object> metadata = readMetadata(original);
                metadata.putAll(patch);
                final String id = original.get(FIELD_ID);
                final float[] vector = decodeVector(original.getBinaryValue(FIELD_VECTOR_BYTES));
                indexWriter.updateDocument(new Term(FIELD_UID, pointUid(collection, id)),
                        pointDocument(collection, info, id, vector, metadata));
            }
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot update metadata in " + collection, e);
        }
    }

    @Override
    public List<StoredPoint> scroll(final String collection) throws IndexStoreException {
        requireCollection(collection);
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Query query = pointsOf(collection);
                final int total = searcher.count(query);
                if (total == 0) {
                    return List.of();
                }
                final TopDocs topDocs = searcher.search(query, total);
                final List<StoredPoint> result = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document doc = searcher.storedFields().document(scoreDoc.doc);
                    result.add(new StoredPoint(doc.get(FIELD_ID), readMetadata(doc)));
                }
                return result;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot scroll collection " + collection, e);
        }
    }

    @Override
    public long count(final String collection) throws IndexStoreException {
        requireCollection(collection);
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(pointsOf(collection));
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot count collection " + collection, e);
        }
    }

    @Override
    public List<ScoredPoint> search(final String collection, final float[] vector, final int limit)
            throws IndexStoreException {
        final CollectionInfo info = requireCollection(collection);
        if (vector.length != info.vectorSize) {
            throw new IndexStoreException("Query vector has size " + vector.length
                    + ", collection " + collection + " expects " + info.vectorSize);
        }
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Query query = new KnnFloatVectorQuery(info.vectorField(), vector, limit,
                        new TermQuery(new Term(FIELD_COLLECTION, collection)));
                final TopDocs topDocs = searcher.search(query, limit);
                final List<ScoredPoint> result = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document doc = searcher.storedFields().document(scoreDoc.doc);
                    result.add(new ScoredPoint(doc.get(FIELD_ID), info.similarity(scoreDoc.score), readMetadata(doc)));
                }
                return result;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Search in collection " + collection + " failed", e);
        }
    }

    @Override
    public @Nullable String getMetadata(final String id) throws IndexStoreException {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(new TermQuery(new Term(FIELD_UID, metadataUid(id))), 1);
                if (topDocs.totalHits.value == 0) {
                    return null;
                }
                return searcher.storedFields().document(topDocs.scoreDocs[0].doc).get(FIELD_BLOB);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot read metadata record " + id, e);
        }
    }

    @Override
    public void putMetadata(final String id, final String blob) throws IndexStoreException {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_KIND, KIND_METADATA, Field.Store.YES));
        doc.add(new StringField(FIELD_UID, metadataUid(id), Field.Store.NO));
        doc.add(new StringField(FIELD_ID, id, Field.Store.YES));
        doc.add(new StoredField(FIELD_BLOB, blob));
        try {
            indexWriter.updateDocument(new Term(FIELD_UID, metadataUid(id)), doc);
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot write metadata record " + id, e);
        }
    }

    /**
     * Total number of documents of all kinds, for diagnostics.
     */
    public long getDocumentCount() throws IndexStoreException {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(new MatchAllDocsQuery());
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Cannot count documents", e);
        }
    }

    @Override
    public void close() throws IndexStoreException {
        if (commitScheduler != null) {
            commitScheduler.shutdown();
            try {
                if (!commitScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    commitScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                commitScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        try {
            if (searcherManager != null) {
                searcherManager.close();
            }
            if (indexWriter != null) {
                indexWriter.close();
            }
            if (directory != null) {
                directory.close();
            }
        } catch (final IOException e) {
            throw new IndexStoreException("Error closing index", e);
        }
        logger.info("Vector index closed");
    }

    private CollectionInfo requireCollection(final String collection) throws IndexStoreException {
        final CollectionInfo info = collections.get(collection);
        if (info == null) {
            throw new IndexStoreException("Collection does not exist: " + collection);
        }
        return info;
    }

    private Document pointDocument(final String collection, final CollectionInfo info, final String id,
                                   final float[] vector, final Map<String, Object> metadata) throws IndexStoreException {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_KIND, KIND_POINT, Field.Store.YES));
        doc.add(new StringField(FIELD_UID, pointUid(collection, id), Field.Store.NO));
        doc.add(new StringField(FIELD_ID, id, Field.Store.YES));
        doc.add(new StringField(FIELD_COLLECTION, collection, Field.Store.YES));
        doc.add(new KnnFloatVectorField(info.vectorField(), vector, info.similarityFunction()));
        doc.add(new StoredField(FIELD_VECTOR_BYTES, new BytesRef(encodeVector(vector))));
        try {
            doc.add(new StoredField(FIELD_METADATA, objectMapper.writeValueAsString(metadata)));
        } catch (final JsonProcessingException e) {
            throw new IndexStoreException("Metadata of point " + id + " is not serializable", e);
        }
        return doc;
    }

    private Map<String, Object> readMetadata(final Document doc) throws IndexStoreException {
        final String json = doc.get(FIELD_METADATA);
        if (json == null) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (final JsonProcessingException e) {
            throw new IndexStoreException("Corrupt metadata in point " + doc.get(FIELD_ID), e);
        }
    }

    private static Query pointsOf(final String collection) {
        return new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_KIND, KIND_POINT)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(FIELD_COLLECTION, collection)), BooleanClause.Occur.FILTER)
                .build();
    }

    static byte[] encodeVector(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES);
        for (final float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    static float[] decodeVector(final BytesRef bytes) {
        final ByteBuffer buffer = ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length);
        final float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    private static String pointUid(final String collection, final String id) {
        return "p:" + collection + ":" + id;
    }

    private static String collectionUid(final String name) {
        return "c:" + name;
    }

    private static String metadataUid(final String id) {
        return "m:" + id;
    }

    private record CollectionInfo(int vectorSize, Metric metric) {

        String vectorField() {
            return "vector_" + metric.name().toLowerCase(Locale.ROOT) + "_" + vectorSize;
        }

        VectorSimilarityFunction similarityFunction() {
            return switch (metric) {
                case COSINE -> VectorSimilarityFunction.COSINE;
                case DOT_PRODUCT -> VectorSimilarityFunction.DOT_PRODUCT;
                case EUCLIDEAN -> VectorSimilarityFunction.EUCLIDEAN;
            };
        }

        /**
         * Lucene scales cosine and dot product into [0, 1] as (1 + s) / 2; undo that.
         */
        double similarity(final float luceneScore) {
            return switch (metric) {
                case COSINE, DOT_PRODUCT -> 2.0 * luceneScore - 1.0;
                case EUCLIDEAN -> luceneScore;
            };
        }
    }
}
