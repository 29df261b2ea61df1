package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.extract.ContentCategory;
import de.mirkosertic.vectorsync.state.PersistedState;
import de.mirkosertic.vectorsync.state.StatePersistenceScheduler;
import de.mirkosertic.vectorsync.state.WatcherStateRepository;
import de.mirkosertic.vectorsync.store.IndexStoreException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the registry of watched folders and their synchronizers.
 * <p>
 * The registry is guarded by a read/write lock; status queries only take the read
 * lock and never wait for indexing work. Every registry change requests a coalesced
 * write of the {@link PersistedState}. Folders in ERROR are retried periodically.
 */
public class WatcherOrchestrator implements FolderSynchronizer.Listener {

    private static final Logger logger = LoggerFactory.getLogger(WatcherOrchestrator.class);

    private final SyncServices services;
    private final ApplicationConfig config;
    private final WatcherStateRepository stateRepository;
    private final StatePersistenceScheduler persistence;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Path, FolderSynchronizer> registry = new LinkedHashMap<>();
    // Persisted folders whose directory is currently missing; kept so they survive in the state
    private final Map<Path, PersistedState.FolderState> dormant = new LinkedHashMap<>();

    private final ScheduledExecutorService sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "error-sweep");
        t.setDaemon(true);
        return t;
    });

    public WatcherOrchestrator(final SyncServices services, final WatcherStateRepository stateRepository) {
        this.services = services;
        this.config = services.config();
        this.stateRepository = stateRepository;
        this.persistence = new StatePersistenceScheduler(stateRepository, this::currentState,
                config.getPersistIntervalMs());
    }

    /**
     * Starts the periodic retry of folders in ERROR.
     */
    public void init() {
        final long interval = config.getErrorRetryIntervalMs();
        if (interval > 0) {
            sweepScheduler.scheduleWithFixedDelay(this::sweepErrors, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    // ==================== Operations ====================

    /**
     * Starts watching a folder. Returns once the folder is registered; the initial scan runs in the background.
     *
     * @throws PathNotFoundException    if the path is not an existing directory
     * @throws AlreadyWatchedException  if the folder is already watched
     * @throws PathConflictException    if the folder is nested in, or contains, a watched folder, or
     *                                  its collection name is already taken
     */
    public WatchedFolder watchFolder(final Path path, final Set<ContentCategory> categories) {
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("At least one content category is required");
        }
        final Path root = canonicalDirectory(path);

        final FolderSynchronizer synchronizer;
        lock.writeLock().lock();
        try {
            if (registry.containsKey(root)) {
                throw new AlreadyWatchedException(root);
            }
            for (final Path existing : registry.keySet()) {
                if (root.startsWith(existing) || existing.startsWith(root)) {
                    throw new PathConflictException(root, existing);
                }
            }

            final PersistedState.FolderState previous = dormant.get(root);
            final String collection = previous != null
                    ? previous.collectionName()
                    : CollectionNames.forPath(config.getCollectionPrefix(), root);
            final Path owner = collectionOwner(collection, root);
            if (owner != null) {
                throw new PathConflictException(root, owner);
            }
            dormant.remove(root);
            final WatchedFolder folder = previous != null
                    ? new WatchedFolder(previous.id(), root, categories, collection, previous.createdAt())
                    : new WatchedFolder(UUID.randomUUID().toString(), root, categories, collection,
                    System.currentTimeMillis());
            synchronizer = new FolderSynchronizer(folder, services, this);
            registry.put(root, synchronizer);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Watching folder {} (categories {}, collection {})", root, categories,
                synchronizer.getFolder().collectionName());
        synchronizer.start(false);
        persistence.requestSave();
        return synchronizer.getFolder();
    }

    /**
     * Stops watching a folder and removes everything it contributed to the index.
     *
     * @throws NotWatchedException if the folder is not watched
     * @throws IOException         if the fragments or the collection cannot be deleted
     */
    public void unwatchFolder(final Path path) throws IOException {
        final Path root = canonicalOrAbsolute(path);
        final FolderSynchronizer synchronizer;
        final PersistedState.FolderState dormantState;
        lock.writeLock().lock();
        try {
            synchronizer = registry.remove(root);
            dormantState = synchronizer == null ? dormant.remove(root) : null;
            if (synchronizer == null && dormantState == null) {
                throw new NotWatchedException(root);
            }
        } finally {
            lock.writeLock().unlock();
        }

        persistence.requestSave();
        if (synchronizer != null) {
            synchronizer.destroy();
        } else if (services.vectorStore().collectionExists(dormantState.collectionName())) {
            services.retryPolicy().run("Delete collection " + dormantState.collectionName(),
                    () -> services.vectorStore().deleteCollection(dormantState.collectionName()));
        }
        logger.info("Stopped watching folder {}", root);
    }

    public List<FolderStatusSnapshot> getWatchedFolders() {
        lock.readLock().lock();
        try {
            final List<FolderStatusSnapshot> result = new ArrayList<>(registry.size());
            for (final FolderSynchronizer synchronizer : registry.values()) {
                result.add(synchronizer.snapshot());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void pauseFolder(final Path path) {
        lookup(path).pause();
    }

    public void resumeFolder(final Path path) {
        lookup(path).resume();
    }

    /**
     * Rebuilds the registry from the persisted state. Folders that were cleanly watching
     * resume watching and reconcile in the background; all others are rescanned.
     *
     * @return number of folders restored
     */
    public int restore() throws IndexStoreException {
        final PersistedState state = stateRepository.load();
        final List<FolderSynchronizer> started = new ArrayList<>();
        final List<Boolean> clean = new ArrayList<>();

        lock.writeLock().lock();
        try {
            for (final PersistedState.FolderState entry : state.folders()) {
                final Path root = Path.of(entry.path());
                if (registry.containsKey(root)) {
                    continue;
                }
                if (!Files.isDirectory(root)) {
                    logger.warn("Watched folder {} no longer exists, skipping", root);
                    dormant.put(root, entry);
                    continue;
                }
                final Set<ContentCategory> categories;
                try {
                    categories = ContentCategory.fromNames(entry.categories());
                } catch (final IllegalArgumentException e) {
                    logger.error("Cannot restore folder {}: invalid categories {}", root, entry.categories(), e);
                    dormant.put(root, entry);
                    continue;
                }
                final WatchedFolder folder = new WatchedFolder(entry.id(), root, categories,
                        entry.collectionName(), entry.createdAt());
                final FolderSynchronizer synchronizer = new FolderSynchronizer(folder, services, this);
                registry.put(root, synchronizer);
                started.add(synchronizer);
                clean.add(SyncStatus.WATCHING.name().equals(entry.status()));
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (int i = 0; i < started.size(); i++) {
            final FolderSynchronizer synchronizer = started.get(i);
            final boolean wasClean = clean.get(i);
            logger.info("Restoring folder {} ({})", synchronizer.getFolder().rootPath(),
                    wasClean ? "reconciling in background" : "full rescan");
            synchronizer.start(wasClean);
        }
        if (!started.isEmpty()) {
            persistence.requestSave();
        }
        return started.size();
    }

    /**
     * Watches the given folders unless already watched. Invalid entries are logged and skipped.
     */
    public void watchConfiguredFolders(final List<String> folders, final Set<ContentCategory> categories) {
        for (final String folder : folders) {
            final Path root;
            try {
                root = canonicalDirectory(Path.of(folder));
            } catch (final PathNotFoundException e) {
                logger.warn("Configured folder does not exist: {}", folder);
                continue;
            }
            lock.readLock().lock();
            try {
                if (registry.containsKey(root)) {
                    continue;
                }
            } finally {
                lock.readLock().unlock();
            }
            try {
                watchFolder(root, categories);
            } catch (final AlreadyWatchedException | PathConflictException e) {
                logger.warn("Not watching configured folder {}: {}", folder, e.getMessage());
            }
        }
    }

    void sweepErrors() {
        final List<FolderSynchronizer> candidates = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (final FolderSynchronizer synchronizer : registry.values()) {
                if (synchronizer.getStatus() == SyncStatus.ERROR) {
                    candidates.add(synchronizer);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        for (final FolderSynchronizer synchronizer : candidates) {
            try {
                synchronizer.retryPending();
            } catch (final RuntimeException e) {
                logger.error("Retry of folder {} failed", synchronizer.getFolder().rootPath(), e);
            }
        }
    }

    /**
     * Stops all synchronizers and writes the final state. The index is left intact.
     */
    public void shutdown() {
        sweepScheduler.shutdownNow();
        final List<FolderSynchronizer> synchronizers;
        lock.readLock().lock();
        try {
            synchronizers = new ArrayList<>(registry.values());
        } finally {
            lock.readLock().unlock();
        }
        for (final FolderSynchronizer synchronizer : synchronizers) {
            try {
                synchronizer.close();
            } catch (final RuntimeException e) {
                logger.error("Error closing folder {}", synchronizer.getFolder().rootPath(), e);
            }
        }
        persistence.shutdown();
        logger.info("Watcher orchestrator stopped");
    }

    // ==================== Listener ====================

    @Override
    public void onStatusChanged(final FolderSynchronizer synchronizer) {
        persistence.requestSave();
    }

    @Override
    public void onScanCompleted(final FolderSynchronizer synchronizer) {
        persistence.saveNow();
    }

    // ==================== Helpers ====================

    PersistedState currentState() {
        lock.readLock().lock();
        try {
            final List<PersistedState.FolderState> folders = new ArrayList<>();
            for (final FolderSynchronizer synchronizer : registry.values()) {
                final FolderStatusSnapshot snapshot = synchronizer.snapshot();
                final WatchedFolder folder = synchronizer.getFolder();
                folders.add(new PersistedState.FolderState(
                        folder.id(),
                        folder.rootPath().toString(),
                        folder.contentCategories().stream().map(ContentCategory::configName).sorted().toList(),
                        folder.collectionName(),
                        snapshot.status().name(),
                        snapshot.progressPercent(),
                        folder.createdAt()));
            }
            folders.addAll(dormant.values());
            return new PersistedState(folders);
        } finally {
            lock.readLock().unlock();
        }
    }

    FolderSynchronizer lookup(final Path path) {
        final Path root = canonicalOrAbsolute(path);
        lock.readLock().lock();
        try {
            final FolderSynchronizer synchronizer = registry.get(root);
            if (synchronizer == null) {
                throw new NotWatchedException(root);
            }
            return synchronizer;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The other folder, registered or dormant, that already uses the collection. Caller holds the write lock.
     */
    private @Nullable Path collectionOwner(final String collection, final Path root) {
        for (final FolderSynchronizer synchronizer : registry.values()) {
            if (synchronizer.getFolder().collectionName().equals(collection)) {
                return synchronizer.getFolder().rootPath();
            }
        }
        for (final Map.Entry<Path, PersistedState.FolderState> entry : dormant.entrySet()) {
            if (!entry.getKey().equals(root) && entry.getValue().collectionName().equals(collection)) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static Path canonicalDirectory(final Path path) {
        if (!Files.isDirectory(path)) {
            throw new PathNotFoundException(path);
        }
        try {
            return path.toRealPath();
        } catch (final IOException e) {
            throw new PathNotFoundException(path);
        }
    }

    private static Path canonicalOrAbsolute(final Path path) {
        try {
            return path.toRealPath();
        } catch (final IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
