package de.mirkosertic.vectorsync.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Recursive directory watcher on top of the JDK {@link WatchService}.
 * <p>
 * One poll loop serves all watched roots. Directories created below a root are
 * registered on the fly, and the regular files they already contain are reported
 * as created (a directory moved into the tree arrives as a single event).
 */
public class DirectoryWatcherService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    private final long pollIntervalMs;
    private final Map<WatchKey, WatchInfo> watchKeys = new ConcurrentHashMap<>();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;

    public DirectoryWatcherService(final long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public synchronized void watchDirectory(final Path root, final FileChangeListener listener) throws IOException {
        if (watchService == null) {
            watchService = FileSystems.getDefault().newWatchService();
        }

        registerRecursive(root, root, listener, false);

        if (loopStarted.compareAndSet(false, true)) {
            watchExecutor.execute(this::processEvents);
        }
    }

    /**
     * Cancels all watch keys registered for the given root. Events already polled may still be delivered.
     */
    public void unwatchDirectory(final Path root) {
        watchKeys.entrySet().removeIf(entry -> {
            if (entry.getValue().root.equals(root)) {
                entry.getKey().cancel();
                return true;
            }
            return false;
        });
        logger.debug("Stopped watching {}", root);
    }

    private void registerRecursive(final Path root, final Path directory, final FileChangeListener listener,
                                   final boolean reportFiles) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, new WatchInfo(root, dir, listener));
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (reportFiles && attrs.isRegularFile()) {
                    listener.onFileEvent(RawFileEvent.created(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.warn("Cannot access {} while registering watches", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final WatchInfo watchInfo = watchKeys.get(key);
            if (watchInfo == null) {
                // Cancelled by unwatchDirectory while events were queued
                key.reset();
                continue;
            }

            boolean overflowReported = false;
            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    if (!overflowReported) {
                        overflowReported = true;
                        reportOverflow(watchInfo);
                    }
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = watchInfo.directory.resolve(pathEvent.context());

                try {
                    if (kind == ENTRY_CREATE) {
                        if (Files.isDirectory(fullPath)) {
                            registerRecursive(watchInfo.root, fullPath, watchInfo.listener, true);
                        } else if (Files.isRegularFile(fullPath)) {
                            watchInfo.listener.onFileEvent(RawFileEvent.created(fullPath));
                        }
                    } else if (kind == ENTRY_MODIFY) {
                        if (Files.isRegularFile(fullPath)) {
                            watchInfo.listener.onFileEvent(RawFileEvent.modified(fullPath));
                        }
                    } else if (kind == ENTRY_DELETE) {
                        watchInfo.listener.onFileEvent(RawFileEvent.deleted(fullPath));
                    }
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            final boolean valid = key.reset();
            if (!valid) {
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid, removed from tracking", watchInfo.directory);
            }
        }

        logger.info("Directory watcher stopped");
    }

    void reportOverflow(final WatchInfo watchInfo) {
        logger.warn("Watch event overflow below {}, requesting a rescan", watchInfo.root);
        try {
            watchInfo.listener.onOverflow(watchInfo.root);
        } catch (final RuntimeException e) {
            logger.error("Error handling overflow for: {}", watchInfo.root, e);
        }
    }

    public void stopAll() throws IOException {
        logger.info("Stopping all directory watchers");
        watchExecutor.shutdownNow();

        if (watchService != null) {
            watchService.close();
        }

        watchKeys.clear();
    }

    public void shutdown() {
        try {
            stopAll();
        } catch (final IOException e) {
            logger.error("Error shutting down directory watcher service", e);
        }
    }

    record WatchInfo(Path root, Path directory, FileChangeListener listener) {
    }
}
