package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.chunking.FragmentIdentity;
import de.mirkosertic.vectorsync.chunking.TextWindow;
import de.mirkosertic.vectorsync.chunking.WordWindowChunker;
import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.embedding.EmbeddingProviderException;
import de.mirkosertic.vectorsync.extract.ContentCategory;
import de.mirkosertic.vectorsync.extract.ExtractionException;
import de.mirkosertic.vectorsync.store.IndexStoreException;
import de.mirkosertic.vectorsync.store.Metric;
import de.mirkosertic.vectorsync.store.VectorPoint;
import de.mirkosertic.vectorsync.watch.EventDebouncer;
import de.mirkosertic.vectorsync.watch.SettledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the collection of one watched folder in line with the folder's files.
 * <p>
 * Work for a single path runs strictly in settlement order: every path has a slot
 * with a queue of pending tasks and a generation counter that is bumped whenever a
 * new task for the path is queued. A task that finds its generation outdated after
 * writing its fragments has been superseded; it leaves the file record alone and
 * marks what it wrote as stale, so the task that follows removes it.
 * <p>
 * The number of queued or running tasks per folder is bounded by {@code queue-depth};
 * the initial walk blocks when the bound is reached.
 */
public class FolderSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(FolderSynchronizer.class);

    /**
     * Receives lifecycle notifications, used to persist the registry.
     */
    public interface Listener {

        void onStatusChanged(FolderSynchronizer synchronizer);

        void onScanCompleted(FolderSynchronizer synchronizer);
    }

    @FunctionalInterface
    private interface SlotTask {
        void run(long generation) throws IOException;
    }

    private record QueuedTask(long generation, SlotTask task) {
    }

    private static final class PathSlot {
        private long generation;
        private boolean running;
        private final Deque<QueuedTask> queue = new ArrayDeque<>();
    }

    private final WatchedFolder folder;
    private final SyncServices services;
    private final ApplicationConfig config;
    private final Listener listener;

    private final FileRecordStore records = new FileRecordStore();
    private final FolderProgress progress = new FolderProgress();
    private final Set<Path> pendingRetry = ConcurrentHashMap.newKeySet();

    private final int queueDepth;
    private final Semaphore permits;
    private final Object slotLock = new Object();
    private final Map<Path, PathSlot> slots = new HashMap<>();

    private final BlockingQueue<SettledEvent> settledEvents = new LinkedBlockingQueue<>();
    private final EventDebouncer debouncer;

    private final Object stateLock = new Object();
    private volatile SyncStatus status = SyncStatus.INITIALIZING;
    private SyncStatus statusBeforePause = SyncStatus.WATCHING;
    private boolean paused;
    private volatile boolean closed;
    private volatile boolean needsRescan;
    private volatile boolean watching;
    private volatile CountDownLatch scanLatch = new CountDownLatch(1);
    private boolean scanRunning;
    private volatile boolean walking;
    private boolean rescanRequested;

    private Thread consumerThread;
    private Thread scanThread;

    public FolderSynchronizer(final WatchedFolder folder, final SyncServices services, final Listener listener) {
        this.folder = folder;
        this.services = services;
        this.config = services.config();
        this.listener = listener;
        this.queueDepth = Math.max(1, config.getQueueDepth());
        this.permits = new Semaphore(queueDepth, true);
        this.debouncer = new EventDebouncer(services.debounceScheduler(), config.getWatchDebounceMs(),
                this::isSameContent, settledEvents::offer);
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the folder asynchronously: collection setup, record rebuild from the index,
     * watch registration and the walk.
     *
     * @param reconcileInBackground the folder is reported as WATCHING while the walk runs;
     *                              otherwise it is reported as SCANNING until the walk ends
     */
    public void start(final boolean reconcileInBackground) {
        setStatus(reconcileInBackground ? SyncStatus.WATCHING : SyncStatus.SCANNING);

        consumerThread = new Thread(this::consumeEvents, "sync-events-" + folder.collectionName());
        consumerThread.setDaemon(true);
        consumerThread.start();

        startScanThread(true);
    }

    private void startScanThread(final boolean initialize) {
        synchronized (stateLock) {
            scanRunning = true;
        }
        walking = true;
        scanLatch = new CountDownLatch(1);
        final CountDownLatch latch = scanLatch;
        scanThread = new Thread(() -> {
            try {
                if (initialize) {
                    initializeAndScan();
                } else {
                    rescan();
                }
                while (takeRescanRequest()) {
                    rescan();
                }
            } catch (final RuntimeException e) {
                synchronized (stateLock) {
                    scanRunning = false;
                }
                throw e;
            } finally {
                walking = false;
                latch.countDown();
            }
        }, "sync-scan-" + folder.collectionName());
        scanThread.setDaemon(true);
        scanThread.start();
    }

    private boolean takeRescanRequest() {
        synchronized (stateLock) {
            if (!rescanRequested || closed) {
                rescanRequested = false;
                scanRunning = false;
                return false;
            }
            rescanRequested = false;
            return true;
        }
    }

    /**
     * Walks the folder again, for example after the notification source lost events.
     * A walk already in progress is followed by one more.
     */
    void requestRescan() {
        synchronized (stateLock) {
            if (closed || status == SyncStatus.REMOVED) {
                return;
            }
            if (scanRunning) {
                rescanRequested = true;
                return;
            }
            scanRunning = true;
        }
        logger.info("Rescanning {}", folder.rootPath());
        startScanThread(false);
    }

    private void rescan() {
        try {
            scan();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Rescan of {} interrupted", folder.rootPath());
        } catch (final IOException e) {
            if (!closed) {
                logger.error("Rescan of {} failed", folder.rootPath(), e);
                needsRescan = true;
                setStatus(SyncStatus.ERROR);
            }
        }
    }

    private void initializeAndScan() {
        try {
            services.retryPolicy().run("Create collection " + folder.collectionName(), () ->
                    services.vectorStore().createCollection(folder.collectionName(),
                            services.embeddingProvider().dimension(), Metric.COSINE));
            records.rebuildFrom(services.retryPolicy().execute("Scroll " + folder.collectionName(),
                    () -> services.vectorStore().scroll(folder.collectionName())));
            logger.info("Folder {}: {} file record(s) rebuilt from index", folder.rootPath(), records.size());

            if (!watching) {
                services.watcherService().watchDirectory(folder.rootPath(), debouncer);
                watching = true;
            }
            needsRescan = false;
            scan();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Scan of {} interrupted", folder.rootPath());
        } catch (final IOException e) {
            if (!closed) {
                logger.error("Cannot initialize folder {}", folder.rootPath(), e);
                needsRescan = true;
                setStatus(SyncStatus.ERROR);
            }
        }
    }

    private void scan() throws IOException, InterruptedException {
        walking = true;
        try {
            walk();
        } finally {
            walking = false;
        }
    }

    private void walk() throws IOException, InterruptedException {
        final long start = System.currentTimeMillis();
        final int total = countCandidates();
        progress.startScan(total);
        logger.info("Scanning {}: {} candidate file(s)", folder.rootPath(), total);

        // Submitting from the visitor keeps the walk at the pace of the workers
        final InterruptedException[] interrupted = new InterruptedException[1];
        Files.walkFileTree(folder.rootPath(), new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || !isAccepted(file)) {
                    return FileVisitResult.CONTINUE;
                }
                try {
                    awaitNotPaused();
                    if (closed) {
                        return FileVisitResult.TERMINATE;
                    }
                    submit(file, generation -> {
                        try {
                            synchronizeFile(file, generation);
                        } finally {
                            progress.fileProcessed();
                        }
                    });
                    return FileVisitResult.CONTINUE;
                } catch (final InterruptedException e) {
                    interrupted[0] = e;
                    return FileVisitResult.TERMINATE;
                }
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.warn("Cannot access {} during scan", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
        if (interrupted[0] != null) {
            throw interrupted[0];
        }
        if (closed) {
            return;
        }

        // Records of files that vanished or no longer qualify while nobody was watching
        for (final FileRecord record : records.all()) {
            if (!Files.isRegularFile(record.path()) || !isAccepted(record.path())) {
                submit(record.path(), generation -> removePath(record.path()));
            }
        }

        awaitIdle();
        if (closed) {
            return;
        }
        walking = false;

        synchronized (stateLock) {
            if (status == SyncStatus.SCANNING) {
                status = SyncStatus.WATCHING;
            } else if (status == SyncStatus.PAUSED && statusBeforePause == SyncStatus.SCANNING) {
                statusBeforePause = SyncStatus.WATCHING;
            }
        }
        logger.info("Scan of {} completed in {}ms: {} file(s), {} error(s)", folder.rootPath(),
                System.currentTimeMillis() - start, progress.getProcessedFiles(), progress.getErrorCount());
        listener.onScanCompleted(this);
    }

    public void pause() {
        synchronized (stateLock) {
            if (paused || status == SyncStatus.REMOVED) {
                return;
            }
            paused = true;
            statusBeforePause = status;
            status = SyncStatus.PAUSED;
        }
        logger.info("Paused folder {}", folder.rootPath());
        listener.onStatusChanged(this);
    }

    public void resume() {
        synchronized (stateLock) {
            if (!paused) {
                return;
            }
            paused = false;
            if (status == SyncStatus.PAUSED) {
                status = statusBeforePause;
            }
            stateLock.notifyAll();
        }
        logger.info("Resumed folder {}", folder.rootPath());
        listener.onStatusChanged(this);
    }

    /**
     * Retries the work that failed permanently since the last call. Only acts while in ERROR.
     */
    public void retryPending() {
        if (status != SyncStatus.ERROR || closed) {
            return;
        }
        if (needsRescan) {
            logger.info("Retrying initialization of {}", folder.rootPath());
            setStatus(SyncStatus.SCANNING);
            startScanThread(true);
            return;
        }

        final List<Path> paths = new ArrayList<>(pendingRetry);
        pendingRetry.removeAll(paths);
        logger.info("Retrying {} failed path(s) in {}", paths.size(), folder.rootPath());
        setStatus(SyncStatus.WATCHING);
        try {
            for (final Path path : paths) {
                submit(path, generation -> {
                    if (Files.exists(path)) {
                        synchronizeFile(path, generation);
                    } else {
                        removePath(path);
                    }
                });
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            pendingRetry.addAll(paths);
        }
    }

    /**
     * Stops watching and processing. The collection is left untouched.
     */
    public void close() {
        closed = true;
        synchronized (stateLock) {
            stateLock.notifyAll();
        }
        debouncer.close();
        services.watcherService().unwatchDirectory(folder.rootPath());
        if (consumerThread != null) {
            consumerThread.interrupt();
        }
        if (scanThread != null) {
            scanThread.interrupt();
        }
        try {
            if (!awaitIdle(30, TimeUnit.SECONDS)) {
                logger.warn("Tasks of {} did not finish in time", folder.rootPath());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Marks the folder as removed, waits for in-flight work, deletes all of its fragments
     * and drops the collection.
     */
    public void destroy() throws IOException {
        setStatus(SyncStatus.REMOVED);
        close();

        final Set<String> ids = new HashSet<>();
        for (final FileRecord record : records.all()) {
            ids.addAll(record.allIds());
        }
        final String collection = folder.collectionName();
        if (services.vectorStore().collectionExists(collection)) {
            services.retryPolicy().run("Delete fragments of " + collection,
                    () -> services.vectorStore().delete(collection, ids));
            services.retryPolicy().run("Delete collection " + collection,
                    () -> services.vectorStore().deleteCollection(collection));
        }
        logger.info("Removed {} fragment(s) and collection {} of {}", ids.size(), collection, folder.rootPath());
    }

    // ==================== Event handling ====================

    private void consumeEvents() {
        try {
            while (!closed) {
                final SettledEvent event = settledEvents.take();
                awaitNotPaused();
                if (closed) {
                    return;
                }
                dispatch(event);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final RuntimeException e) {
            logger.error("Event consumer of {} failed", folder.rootPath(), e);
        }
    }

    void dispatch(final SettledEvent event) throws InterruptedException {
        final Path path = event.path();
        switch (event.type()) {
            case CHANGED -> {
                if (!isAccepted(path) && records.get(path) == null) {
                    return;
                }
                logger.debug("Changed: {}", path);
                submit(path, generation -> synchronizeFile(path, generation));
            }
            case REMOVED -> {
                logger.debug("Removed: {}", path);
                submit(path, generation -> removePath(path));
            }
            case RESCAN -> requestRescan();
            case MOVED -> {
                final Path from = event.previousPath();
                logger.debug("Moved: {} -> {}", from, path);
                supersede(from);
                submit(path, generation -> movePath(from, path, generation));
            }
        }
    }

    /**
     * Rename detection: the removed file's synchronized content equals the arrived file's content.
     */
    boolean isSameContent(final Path removed, final Path arrived) {
        final FileRecord record = records.get(removed);
        if (record == null || record.lastSyncedFingerprint() == null || !Files.isRegularFile(arrived)) {
            return false;
        }
        try {
            return record.lastSyncedFingerprint().equals(FileFingerprint.of(arrived));
        } catch (final IOException e) {
            logger.debug("Cannot fingerprint {} for move detection", arrived, e);
            return false;
        }
    }

    // ==================== Per-path serialization ====================

    private void submit(final Path path, final SlotTask task) throws InterruptedException {
        permits.acquire();
        final PathSlot slot;
        final boolean startDrain;
        synchronized (slotLock) {
            slot = slots.computeIfAbsent(path, p -> new PathSlot());
            slot.generation++;
            slot.queue.add(new QueuedTask(slot.generation, task));
            startDrain = !slot.running;
            slot.running = true;
        }
        if (startDrain) {
            try {
                services.executor().execute(() -> drain(path, slot));
            } catch (final RejectedExecutionException e) {
                logger.warn("Executor rejected work for {}, dropping queued tasks", path);
                synchronized (slotLock) {
                    permits.release(slot.queue.size());
                    slot.queue.clear();
                    slot.running = false;
                    slots.remove(path, slot);
                }
            }
        }
    }

    private void drain(final Path path, final PathSlot slot) {
        while (true) {
            final QueuedTask next;
            synchronized (slotLock) {
                next = slot.queue.poll();
                if (next == null) {
                    slot.running = false;
                    slots.remove(path, slot);
                    return;
                }
            }
            try {
                runTask(path, next);
            } finally {
                permits.release();
            }
        }
    }

    private void runTask(final Path path, final QueuedTask queued) {
        if (status == SyncStatus.REMOVED) {
            return;
        }
        try {
            queued.task().run(queued.generation());
        } catch (final IndexStoreException | EmbeddingProviderException e) {
            logger.error("Giving up on {} for now, will retry later", path, e);
            pendingRetry.add(path);
            progress.fileFailed();
            setStatus(SyncStatus.ERROR);
        } catch (final IOException e) {
            logger.warn("Failed to synchronize {}", path, e);
            progress.fileFailed();
        } catch (final RuntimeException e) {
            logger.error("Unexpected error synchronizing {}", path, e);
            progress.fileFailed();
        }
    }

    private void supersede(final Path path) {
        synchronized (slotLock) {
            final PathSlot slot = slots.get(path);
            if (slot != null) {
                slot.generation++;
            }
        }
    }

    private boolean isSuperseded(final Path path, final long generation) {
        synchronized (slotLock) {
            final PathSlot slot = slots.get(path);
            return slot != null && slot.generation != generation;
        }
    }

    // ==================== Index mutations ====================

    void synchronizeFile(final Path path, final long generation) throws IOException {
        if (!Files.isRegularFile(path)) {
            removePath(path);
            return;
        }
        final ContentCategory category = services.contentTypeDetector().categoryOf(path);
        if (category == null || !folder.contentCategories().contains(category)) {
            removePath(path);
            return;
        }

        final String fingerprint;
        try {
            fingerprint = FileFingerprint.of(path);
        } catch (final NoSuchFileException e) {
            removePath(path);
            return;
        }

        final FileRecord existing = records.get(path);
        if (existing != null && existing.isUpToDate(fingerprint)) {
            logger.debug("Unchanged: {}", path);
            return;
        }

        final String text;
        try {
            text = services.extractor().extract(path, category);
        } catch (final ExtractionException e) {
            logger.warn("Skipping {}: {}", path, e.getMessage());
            progress.fileFailed();
            return;
        }

        final List<TextWindow> windows = chunk(text);
        final List<String> newIds = new ArrayList<>(windows.size());
        for (final TextWindow window : windows) {
            newIds.add(FragmentIdentity.identify(path.toString(), fingerprint, window.ordinal()));
        }
        final List<VectorPoint> points = embed(path, fingerprint, category, windows, newIds);

        for (final Path displaced : records.releaseForeignIds(path, newIds)) {
            logger.info("{} takes over fragment ids held by {}, synchronizing it again", path, displaced);
            settledEvents.offer(SettledEvent.changed(displaced));
        }

        final String collection = folder.collectionName();
        services.retryPolicy().run("Upsert " + path, () -> services.vectorStore().upsert(collection, points));

        if (isSuperseded(path, generation)) {
            handleSuperseded(path, new HashSet<>(newIds));
            return;
        }

        final Set<String> obsolete = existing == null ? new HashSet<>() : existing.allIds();
        obsolete.removeAll(newIds);
        if (!obsolete.isEmpty()) {
            services.retryPolicy().run("Delete obsolete fragments of " + path,
                    () -> services.vectorStore().delete(collection, obsolete));
        }
        records.put(FileRecord.synced(path, fingerprint, newIds));
        logger.info("Indexed {} ({} fragment(s), {} removed)", path, newIds.size(), obsolete.size());
    }

    private void handleSuperseded(final Path path, final Set<String> written) throws IOException {
        final FileRecord current = records.get(path);
        if (current != null) {
            records.put(current.withStale(written));
        } else if (Files.exists(path)) {
            records.put(new FileRecord(path, null, null, List.of(), written));
        } else {
            // Nobody will come back for this path
            services.retryPolicy().run("Delete superseded fragments of " + path,
                    () -> services.vectorStore().delete(folder.collectionName(), written));
        }
        logger.debug("Synchronization of {} superseded, {} fragment(s) marked stale", path, written.size());
    }

    private List<TextWindow> chunk(final String text) {
        final List<TextWindow> windows = WordWindowChunker.chunk(text, config.getChunkSizeWords(),
                config.getChunkOverlapRatio());
        final List<TextWindow> kept = new ArrayList<>(windows.size());
        for (final TextWindow window : windows) {
            if (window.text().length() >= config.getMinChunkCharacters()) {
                kept.add(window);
            }
        }
        return kept;
    }

    private List<VectorPoint> embed(final Path path, final String fingerprint, final ContentCategory category,
                                    final List<TextWindow> windows, final List<String> ids) throws IOException {
        final long mtime = Files.getLastModifiedTime(path).toMillis();
        final int batchSize = Math.max(1, config.getEmbeddingBatchSize());
        final List<VectorPoint> points = new ArrayList<>(windows.size());

        for (int from = 0; from < windows.size(); from += batchSize) {
            final List<TextWindow> batch = windows.subList(from, Math.min(windows.size(), from + batchSize));
            final List<String> texts = batch.stream().map(TextWindow::text).toList();
            final List<float[]> vectors = services.retryPolicy().execute("Embed " + path,
                    () -> services.embeddingProvider().embedPassages(texts));
            if (vectors.size() != batch.size()) {
                throw new EmbeddingProviderException("Expected " + batch.size() + " vectors, got " + vectors.size());
            }
            for (int i = 0; i < batch.size(); i++) {
                final TextWindow window = batch.get(i);
                points.add(new VectorPoint(ids.get(from + i), vectors.get(i),
                        metadata(path, fingerprint, category, mtime, window, windows.size())));
            }
        }
        return points;
    }

    private Map<String, Object> metadata(final Path path, final String fingerprint, final ContentCategory category,
                                         final long mtime, final TextWindow window, final int totalChunks) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("path", path.toString());
        metadata.put("fingerprint", fingerprint);
        metadata.put("chunk_index", window.ordinal());
        metadata.put("total_chunks", totalChunks);
        metadata.put("start_word", window.startWord());
        metadata.put("end_word", window.endWord());
        metadata.put("start_char", window.startChar());
        metadata.put("end_char", window.endChar());
        metadata.put("text", window.text());
        final String text = window.text();
        metadata.put("content_preview", text.length() > config.getPreviewCharacters()
                ? text.substring(0, config.getPreviewCharacters())
                : text);
        metadata.put("mtime", mtime);
        metadata.put("category", category.configName());
        return metadata;
    }

    void removePath(final Path path) throws IOException {
        final String collection = folder.collectionName();
        for (final FileRecord record : records.recordsAtOrBelow(path)) {
            final Set<String> ids = record.allIds();
            if (!ids.isEmpty()) {
                services.retryPolicy().run("Delete fragments of " + record.path(),
                        () -> services.vectorStore().delete(collection, ids));
            }
            records.remove(record.path());
            logger.info("Removed {} from index ({} fragment(s))", record.path(), ids.size());
        }
    }

    void movePath(final Path from, final Path to, final long generation) throws IOException {
        final FileRecord record = records.remove(from);
        if (record == null) {
            synchronizeFile(to, generation);
            return;
        }

        try {
            if (!record.fragmentIds().isEmpty()) {
                services.retryPolicy().run("Rename fragments of " + from, () ->
                        services.vectorStore().updateMetadata(folder.collectionName(), record.fragmentIds(),
                                Map.of("path", to.toString())));
            }
            final FileRecord replaced = records.get(to);
            if (replaced != null) {
                // The rename overwrote a file that was indexed itself
                final Set<String> orphaned = replaced.allIds();
                orphaned.removeAll(record.allIds());
                if (!orphaned.isEmpty()) {
                    services.retryPolicy().run("Delete fragments of replaced " + to,
                            () -> services.vectorStore().delete(folder.collectionName(), orphaned));
                }
            }
        } catch (final IOException e) {
            records.put(record);
            pendingRetry.add(from);
            pendingRetry.add(to);
            throw e;
        }
        records.put(record.withPath(to));
        logger.info("Moved {} -> {} ({} fragment(s))", from, to, record.fragmentIds().size());

        // Content may have changed on the way, or the new name may not qualify any more
        synchronizeFile(to, generation);
    }

    // ==================== Helpers ====================

    private boolean isAccepted(final Path file) {
        return services.contentTypeDetector().accepts(file, folder.contentCategories());
    }

    private int countCandidates() throws IOException {
        final int[] count = new int[1];
        Files.walkFileTree(folder.rootPath(), new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isAccepted(file)) {
                    count[0]++;
                }
                return closed ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        return count[0];
    }

    private void awaitNotPaused() throws InterruptedException {
        synchronized (stateLock) {
            while (paused && !closed) {
                stateLock.wait();
            }
        }
    }

    private void awaitIdle() throws InterruptedException {
        permits.acquire(queueDepth);
        permits.release(queueDepth);
    }

    /**
     * Waits until no task of this folder is queued or running.
     */
    public boolean awaitIdle(final long timeout, final TimeUnit unit) throws InterruptedException {
        if (permits.tryAcquire(queueDepth, timeout, unit)) {
            permits.release(queueDepth);
            return true;
        }
        return false;
    }

    /**
     * Waits for the current walk to finish and then for all queued work.
     */
    public boolean awaitScan(final long timeout, final TimeUnit unit) throws InterruptedException {
        final long deadline = System.nanoTime() + unit.toNanos(timeout);
        if (!scanLatch.await(timeout, unit)) {
            return false;
        }
        return awaitIdle(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    private void setStatus(final SyncStatus newStatus) {
        final boolean changed;
        synchronized (stateLock) {
            if (status == SyncStatus.REMOVED || status == newStatus) {
                return;
            }
            if (paused && newStatus != SyncStatus.REMOVED) {
                statusBeforePause = newStatus;
                changed = false;
            } else {
                status = newStatus;
                changed = true;
            }
        }
        if (changed) {
            listener.onStatusChanged(this);
        }
    }

    public WatchedFolder getFolder() {
        return folder;
    }

    public SyncStatus getStatus() {
        return status;
    }

    public FolderProgress getProgress() {
        return progress;
    }

    FileRecordStore getRecords() {
        return records;
    }

    Set<Path> getPendingRetry() {
        return Set.copyOf(pendingRetry);
    }

    /**
     * Entry point for settled events; used by the debouncer and by tests.
     */
    void accept(final SettledEvent event) {
        settledEvents.offer(event);
    }

    /**
     * 100 only once the folder is watching with neither a walk nor queued work outstanding.
     */
    int progressPercent() {
        final boolean drained = !walking && permits.availablePermits() == queueDepth;
        if (drained && status == SyncStatus.WATCHING) {
            return 100;
        }
        return Math.min(99, progress.percent());
    }

    public FolderStatusSnapshot snapshot() {
        return new FolderStatusSnapshot(
                folder.id(),
                folder.rootPath().toString(),
                folder.contentCategories(),
                status,
                progressPercent(),
                folder.collectionName(),
                progress.getTotalFiles(),
                progress.getProcessedFiles(),
                progress.getErrorCount(),
                FolderProgress.COUNT_TYPE_FILES);
    }
}
