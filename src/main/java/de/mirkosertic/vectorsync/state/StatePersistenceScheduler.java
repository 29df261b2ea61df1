package de.mirkosertic.vectorsync.state;

import de.mirkosertic.vectorsync.store.IndexStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Coalesces save requests: at most one write per interval, plus explicit immediate saves.
 */
public class StatePersistenceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(StatePersistenceScheduler.class);

    private final WatcherStateRepository repository;
    private final Supplier<PersistedState> stateSupplier;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "state-persistence");
        t.setDaemon(true);
        return t;
    });

    private final Object writeLock = new Object();
    private ScheduledFuture<?> scheduled;
    private volatile long lastWriteMillis;

    public StatePersistenceScheduler(final WatcherStateRepository repository,
                                     final Supplier<PersistedState> stateSupplier,
                                     final long intervalMs) {
        this.repository = repository;
        this.stateSupplier = stateSupplier;
        this.intervalMs = intervalMs;
    }

    /**
     * Schedules a write unless one is already pending.
     */
    public synchronized void requestSave() {
        if (scheduler.isShutdown() || (scheduled != null && !scheduled.isDone())) {
            return;
        }
        final long delay = Math.max(0, lastWriteMillis + intervalMs - System.currentTimeMillis());
        scheduled = scheduler.schedule(this::runScheduled, delay, TimeUnit.MILLISECONDS);
    }

    /**
     * Writes immediately, replacing any pending write.
     */
    public void saveNow() {
        synchronized (this) {
            if (scheduled != null) {
                scheduled.cancel(false);
                scheduled = null;
            }
        }
        saveQuietly();
    }

    private void runScheduled() {
        // Changes made while this write runs schedule the next one
        synchronized (this) {
            scheduled = null;
        }
        saveQuietly();
    }

    private void saveQuietly() {
        try {
            write();
        } catch (final IndexStoreException | RuntimeException e) {
            // A later request or the shutdown save tries again
            logger.error("Failed to persist watcher state", e);
        }
    }

    private void write() throws IndexStoreException {
        synchronized (writeLock) {
            repository.save(stateSupplier.get());
            lastWriteMillis = System.currentTimeMillis();
        }
    }

    /**
     * Stops scheduling and writes the final state.
     */
    public void shutdown() {
        scheduler.shutdownNow();
        saveQuietly();
    }
}
