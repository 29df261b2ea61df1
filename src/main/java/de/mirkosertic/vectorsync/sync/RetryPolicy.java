package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.embedding.EmbeddingProviderException;
import de.mirkosertic.vectorsync.store.IndexStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Retries store and embedding calls with exponential backoff. Other failures are not retried.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    public interface IoRunnable {
        void run() throws IOException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double multiplier;
    private final long maxBackoffMs;

    public RetryPolicy(final int maxAttempts, final long initialBackoffMs, final double multiplier, final long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.multiplier = multiplier;
        this.maxBackoffMs = maxBackoffMs;
    }

    public static RetryPolicy from(final ApplicationConfig config) {
        return new RetryPolicy(config.getRetryMaxAttempts(), config.getRetryInitialBackoffMs(),
                config.getRetryMultiplier(), config.getRetryMaxBackoffMs());
    }

    public <T> T execute(final String description, final IoCall<T> call) throws IOException {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (final IndexStoreException | EmbeddingProviderException e) {
                if (attempt >= maxAttempts) {
                    logger.warn("{} failed after {} attempt(s)", description, attempt);
                    throw e;
                }
                final long backoff = backoffMs(attempt);
                logger.debug("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt, maxAttempts, backoff, e.getMessage());
                sleep(backoff);
                attempt++;
            }
        }
    }

    public void run(final String description, final IoRunnable runnable) throws IOException {
        execute(description, () -> {
            runnable.run();
            return null;
        });
    }

    long backoffMs(final int attempt) {
        final double backoff = initialBackoffMs * Math.pow(multiplier, attempt - 1);
        return (long) Math.min(backoff, maxBackoffMs);
    }

    private static void sleep(final long millis) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
