package de.mirkosertic.vectorsync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.config.BuildInfo;
import de.mirkosertic.vectorsync.config.LoggingConfigurator;
import de.mirkosertic.vectorsync.embedding.EmbeddingProvider;
import de.mirkosertic.vectorsync.embedding.HashingEmbeddingProvider;
import de.mirkosertic.vectorsync.embedding.TeiEmbeddingProvider;
import de.mirkosertic.vectorsync.extract.ContentCategory;
import de.mirkosertic.vectorsync.extract.ContentTypeDetector;
import de.mirkosertic.vectorsync.extract.ExtractorGateway;
import de.mirkosertic.vectorsync.rerank.RerankingProvider;
import de.mirkosertic.vectorsync.rerank.TeiRerankingProvider;
import de.mirkosertic.vectorsync.search.SemanticSearchService;
import de.mirkosertic.vectorsync.state.WatcherStateRepository;
import de.mirkosertic.vectorsync.store.LuceneVectorStore;
import de.mirkosertic.vectorsync.sync.IndexingExecutorService;
import de.mirkosertic.vectorsync.sync.RetryPolicy;
import de.mirkosertic.vectorsync.sync.SyncServices;
import de.mirkosertic.vectorsync.sync.WatcherOrchestrator;
import de.mirkosertic.vectorsync.watch.DirectoryWatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point. Wires all services, restores the watched folders from the index and
 * keeps running until the JVM is stopped.
 */
public class VectorSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(VectorSyncApplication.class);

    private final ApplicationConfig config;
    private final LuceneVectorStore vectorStore;
    private final IndexingExecutorService indexingExecutor;
    private final DirectoryWatcherService watcherService;
    private final ScheduledExecutorService debounceScheduler;
    private final WatcherOrchestrator orchestrator;
    private final SemanticSearchService searchService;

    public VectorSyncApplication(final ApplicationConfig config) {
        this.config = config;

        this.vectorStore = new LuceneVectorStore(Path.of(config.getIndexPath()), config.getCommitIntervalMs());
        final EmbeddingProvider embeddingProvider = createEmbeddingProvider(config);
        this.indexingExecutor = new IndexingExecutorService(config);
        this.watcherService = new DirectoryWatcherService(config.getWatchPollIntervalMs());
        this.debounceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "watch-debounce");
            t.setDaemon(true);
            return t;
        });

        final SyncServices services = new SyncServices(
                config,
                vectorStore,
                embeddingProvider,
                new ExtractorGateway(config),
                new ContentTypeDetector(),
                indexingExecutor,
                RetryPolicy.from(config),
                watcherService,
                debounceScheduler
        );
        this.orchestrator = new WatcherOrchestrator(services, new WatcherStateRepository(vectorStore));

        final RerankingProvider rerankingProvider = config.isRerankEnabled()
                ? new TeiRerankingProvider(config.getRerankBaseUrl(), config.getRerankTimeoutMs())
                : null;
        this.searchService = new SemanticSearchService(vectorStore, embeddingProvider, rerankingProvider, config);
    }

    static EmbeddingProvider createEmbeddingProvider(final ApplicationConfig config) {
        final String provider = config.getEmbeddingProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "tei" -> new TeiEmbeddingProvider(config.getEmbeddingBaseUrl(), config.getVectorSize(),
                    config.getPassagePrefix(), config.getQueryPrefix(), config.getEmbeddingTimeoutMs());
            case "hashing" -> new HashingEmbeddingProvider(config.getVectorSize());
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + provider);
        };
    }

    /**
     * Initialize all services and bring back the watched folders.
     */
    public void init() throws IOException {
        logger.info("Initializing Vector Sync {}...", BuildInfo.current().version());

        vectorStore.init();
        orchestrator.init();

        final int restored = orchestrator.restore();
        logger.info("Restored {} watched folder(s)", restored);

        if (!config.getFolders().isEmpty()) {
            orchestrator.watchConfiguredFolders(config.getFolders(), EnumSet.allOf(ContentCategory.class));
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Blocks the calling thread until the application is stopped.
     */
    public void start() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down Vector Sync...");

        try {
            orchestrator.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down watcher orchestrator", e);
        }

        try {
            watcherService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down watcher service", e);
        }

        try {
            debounceScheduler.shutdownNow();
            debounceScheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while stopping debounce scheduler", e);
        }

        try {
            indexingExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down indexing executor", e);
        }

        try {
            vectorStore.close();
        } catch (final Exception e) {
            logger.error("Error closing vector store", e);
        }

        logger.info("Vector Sync shutdown complete");
    }

    public WatcherOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SemanticSearchService getSearchService() {
        return searchService;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("vectorsync.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!config.isDeployedMode()) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
                logger.info("Configured folders: {}", config.getFolders());
            }

            final VectorSyncApplication app = new VectorSyncApplication(config);
            app.init();
            app.start();

            logger.info("Vector Sync finished.");

        } catch (final Exception e) {
            // In deployed mode the console is not a log target
            System.err.println("Failed to start Vector Sync: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
