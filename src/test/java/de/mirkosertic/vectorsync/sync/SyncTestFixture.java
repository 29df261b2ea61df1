package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.embedding.EmbeddingProvider;
import de.mirkosertic.vectorsync.embedding.HashingEmbeddingProvider;
import de.mirkosertic.vectorsync.extract.ContentTypeDetector;
import de.mirkosertic.vectorsync.extract.ExtractorGateway;
import de.mirkosertic.vectorsync.store.InMemoryVectorStore;
import de.mirkosertic.vectorsync.watch.DirectoryWatcherService;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

import static org.mockito.Mockito.mock;

/**
 * Wires synchronizers against an in-memory store, the hashing embedder and a mocked
 * watcher. File events are fed in by the tests.
 */
final class SyncTestFixture implements AutoCloseable {

    static final int DIMENSION = 64;

    final ApplicationConfig config = ApplicationConfig.defaults();
    final InMemoryVectorStore store;
    final DirectoryWatcherService watcherService = mock(DirectoryWatcherService.class);
    final IndexingExecutorService executor = new IndexingExecutorService(2);
    final ScheduledExecutorService debounceScheduler = Executors.newSingleThreadScheduledExecutor();
    final SyncServices services;

    SyncTestFixture() {
        this(new InMemoryVectorStore());
    }

    SyncTestFixture(final InMemoryVectorStore store) {
        this(store, new HashingEmbeddingProvider(DIMENSION));
    }

    SyncTestFixture(final InMemoryVectorStore store, final EmbeddingProvider embeddingProvider) {
        this.store = store;
        config.setChunkSizeWords(20);
        config.setChunkOverlapRatio(0.1);
        config.setQueueDepth(4);
        config.setWatchDebounceMs(50);
        config.setPersistIntervalMs(20);
        config.setErrorRetryIntervalMs(0);
        services = new SyncServices(
                config,
                store,
                embeddingProvider,
                new ExtractorGateway(config),
                new ContentTypeDetector(),
                executor,
                new RetryPolicy(2, 1, 2.0, 5),
                watcherService,
                debounceScheduler);
    }

    static String words(final String prefix, final int count) {
        final StringBuilder result = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                result.append(' ');
            }
            result.append(prefix).append("word").append(i);
        }
        return result.toString();
    }

    static void awaitCondition(final BooleanSupplier condition, final long timeoutMs) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + timeoutMs + "ms");
            }
            Thread.sleep(20);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        debounceScheduler.shutdownNow();
    }
}
