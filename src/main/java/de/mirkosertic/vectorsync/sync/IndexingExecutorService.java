package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool shared by all folders for extraction, embedding and store calls.
 * Per-folder limits are enforced by the synchronizers, not here.
 */
public class IndexingExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(IndexingExecutorService.class);

    private final ThreadPoolExecutor executor;

    public IndexingExecutorService(final ApplicationConfig config) {
        this(config.getThreadPoolSize());
    }

    public IndexingExecutorService(final int threadPoolSize) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "indexer-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("IndexingExecutorService initialized with {} threads", threadPoolSize);
    }

    public void execute(final Runnable task) {
        executor.execute(task);
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down IndexingExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("IndexingExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for IndexingExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
