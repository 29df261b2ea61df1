package de.mirkosertic.vectorsync.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Collapses bursts of raw notifications into settled events.
 * <p>
 * Every path has its own idle timer that is re-armed by each notification for that
 * path; only when the path has been quiet for the idle window is a single
 * {@link SettledEvent} handed to the sink. A settling removal and a pending arrival
 * (or the other way round) whose contents match according to the {@link MoveCorrelator}
 * are emitted together as one move and both entries are discarded.
 */
public class EventDebouncer implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(EventDebouncer.class);

    private final ScheduledExecutorService scheduler;
    private final long idleWindowMs;
    private final MoveCorrelator correlator;
    private final Consumer<SettledEvent> sink;

    private final Object lock = new Object();
    private final Map<Path, PendingEntry> pending = new HashMap<>();
    private boolean closed;

    public EventDebouncer(final ScheduledExecutorService scheduler, final long idleWindowMs,
                          final MoveCorrelator correlator, final Consumer<SettledEvent> sink) {
        this.scheduler = scheduler;
        this.idleWindowMs = idleWindowMs;
        this.correlator = correlator;
        this.sink = sink;
    }

    @Override
    public void onFileEvent(final RawFileEvent event) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            final PendingEntry previous = pending.get(event.path());
            final RawFileEvent.Kind kind;
            if (previous != null) {
                previous.timer.cancel(false);
                kind = merge(previous.kind, event.kind());
            } else {
                kind = event.kind();
            }
            final PendingEntry entry = new PendingEntry(event.path(), kind);
            entry.timer = scheduler.schedule(() -> settle(entry), idleWindowMs, TimeUnit.MILLISECONDS);
            pending.put(event.path(), entry);
        }
    }

    /**
     * A modification following an arrival is still an arrival; otherwise the latest kind wins.
     */
    static RawFileEvent.Kind merge(final RawFileEvent.Kind current, final RawFileEvent.Kind next) {
        if (next == RawFileEvent.Kind.MODIFIED && current.isArrival()) {
            return current;
        }
        return next;
    }

    private void settle(final PendingEntry entry) {
        final List<PendingEntry> counterparts = new ArrayList<>();
        synchronized (lock) {
            if (pending.get(entry.path) != entry) {
                // Re-armed or already consumed as part of a move
                return;
            }
            pending.remove(entry.path);
            if (entry.kind.isRemoval() || entry.kind.isArrival()) {
                for (final PendingEntry other : pending.values()) {
                    if (entry.kind.isRemoval() ? other.kind.isArrival() : other.kind.isRemoval()) {
                        counterparts.add(other);
                    }
                }
            }
        }

        try {
            // Fingerprinting is file I/O, done outside the lock
            for (final PendingEntry candidate : counterparts) {
                final Path removed = entry.kind.isRemoval() ? entry.path : candidate.path;
                final Path arrived = entry.kind.isRemoval() ? candidate.path : entry.path;
                if (correlator.isSameContent(removed, arrived) && claim(candidate)) {
                    logger.debug("Correlated {} -> {} as move", removed, arrived);
                    sink.accept(SettledEvent.moved(removed, arrived));
                    return;
                }
            }

            if (Files.exists(entry.path)) {
                sink.accept(SettledEvent.changed(entry.path));
            } else {
                sink.accept(SettledEvent.removed(entry.path));
            }
        } catch (final RuntimeException e) {
            logger.error("Failed to deliver settled event for {}", entry.path, e);
        }
    }

    /**
     * Pending entries keep their timers; the rescan only adds what was never reported.
     */
    @Override
    public void onOverflow(final Path root) {
        synchronized (lock) {
            if (closed) {
                return;
            }
        }
        logger.info("Events below {} were lost, emitting a rescan", root);
        sink.accept(SettledEvent.rescan(root));
    }

    private boolean claim(final PendingEntry candidate) {
        synchronized (lock) {
            if (pending.get(candidate.path) != candidate) {
                return false;
            }
            candidate.timer.cancel(false);
            pending.remove(candidate.path);
            return true;
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Drops all pending entries without emitting them.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
            for (final PendingEntry entry : pending.values()) {
                entry.timer.cancel(false);
            }
            pending.clear();
        }
    }

    private static final class PendingEntry {
        private final Path path;
        private final RawFileEvent.Kind kind;
        private ScheduledFuture<?> timer;

        private PendingEntry(final Path path, final RawFileEvent.Kind kind) {
            this.path = path;
            this.kind = kind;
        }
    }
}
