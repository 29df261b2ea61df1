package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.embedding.EmbeddingProvider;
import de.mirkosertic.vectorsync.extract.ContentTypeDetector;
import de.mirkosertic.vectorsync.extract.ExtractorGateway;
import de.mirkosertic.vectorsync.store.VectorStore;
import de.mirkosertic.vectorsync.watch.DirectoryWatcherService;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators shared by all folder synchronizers.
 */
public record SyncServices(
        ApplicationConfig config,
        VectorStore vectorStore,
        EmbeddingProvider embeddingProvider,
        ExtractorGateway extractor,
        ContentTypeDetector contentTypeDetector,
        IndexingExecutorService executor,
        RetryPolicy retryPolicy,
        DirectoryWatcherService watcherService,
        ScheduledExecutorService debounceScheduler
) {
}
