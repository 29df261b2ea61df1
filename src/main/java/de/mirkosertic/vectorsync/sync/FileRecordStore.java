package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.store.StoredPoint;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * The {@link FileRecord}s of one folder, keyed by path, with an index from fragment
 * id to the path whose record holds it.
 */
public class FileRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(FileRecordStore.class);

    private final Map<Path, FileRecord> records = new HashMap<>();
    private final Map<String, Path> owners = new HashMap<>();

    public synchronized @Nullable FileRecord get(final Path path) {
        return records.get(path);
    }

    public synchronized void put(final FileRecord record) {
        final FileRecord previous = records.put(record.path(), record);
        if (previous != null) {
            release(previous);
        }
        for (final String id : record.allIds()) {
            owners.put(id, record.path());
        }
    }

    public synchronized @Nullable FileRecord remove(final Path path) {
        final FileRecord removed = records.remove(path);
        if (removed != null) {
            release(removed);
        }
        return removed;
    }

    private void release(final FileRecord record) {
        for (final String id : record.allIds()) {
            owners.remove(id, record.path());
        }
    }

    /**
     * Takes the given ids away from every record other than {@code path}'s. Fragment ids
     * derive from path and content, so a file that reappears with the content of a file
     * renamed away from its path produces the ids the renamed file still holds.
     *
     * @return the paths that lost ids and have to be synchronized again
     */
    public synchronized Set<Path> releaseForeignIds(final Path path, final Collection<String> ids) {
        final Map<Path, Set<String>> lost = new HashMap<>();
        for (final String id : ids) {
            final Path owner = owners.get(id);
            if (owner != null && !owner.equals(path)) {
                lost.computeIfAbsent(owner, p -> new HashSet<>()).add(id);
            }
        }
        for (final Map.Entry<Path, Set<String>> entry : lost.entrySet()) {
            final FileRecord record = records.get(entry.getKey());
            if (record != null) {
                put(record.withoutIds(entry.getValue()));
            }
        }
        return Set.copyOf(lost.keySet());
    }

    public synchronized @Nullable Path ownerOf(final String id) {
        return owners.get(id);
    }

    /**
     * Records for {@code path} itself and everything below it (a deleted directory).
     */
    public synchronized List<FileRecord> recordsAtOrBelow(final Path path) {
        final List<FileRecord> result = new ArrayList<>();
        for (final FileRecord record : records.values()) {
            if (record.path().startsWith(path)) {
                result.add(record);
            }
        }
        return result;
    }

    public synchronized Collection<FileRecord> all() {
        return List.copyOf(records.values());
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Replaces the content with records derived from the points found in the index.
     * A path whose points disagree on the fingerprint gets no synced fingerprint, so
     * the next synchronization replaces all of them.
     */
    public synchronized void rebuildFrom(final List<StoredPoint> points) {
        final Map<Path, Map<Integer, String>> idsByPath = new HashMap<>();
        final Map<Path, Set<String>> fingerprintsByPath = new HashMap<>();
        final Map<Path, List<String>> unordered = new HashMap<>();

        for (final StoredPoint point : points) {
            final String pathValue = point.stringValue("path");
            if (pathValue == null) {
                logger.warn("Point {} has no path metadata and cannot be attributed to a file", point.id());
                continue;
            }
            final Path path = Path.of(pathValue);
            final int ordinal = point.intValue("chunk_index", -1);
            if (ordinal < 0 || idsByPath.computeIfAbsent(path, p -> new TreeMap<>()).putIfAbsent(ordinal, point.id()) != null) {
                unordered.computeIfAbsent(path, p -> new ArrayList<>()).add(point.id());
            }
            fingerprintsByPath.computeIfAbsent(path, p -> new HashSet<>())
                    .add(Objects.requireNonNullElse(point.stringValue("fingerprint"), ""));
        }

        records.clear();
        owners.clear();
        for (final Map.Entry<Path, Set<String>> entry : fingerprintsByPath.entrySet()) {
            final Path path = entry.getKey();
            final List<String> ids = new ArrayList<>(idsByPath.getOrDefault(path, Map.of()).values());
            ids.addAll(unordered.getOrDefault(path, List.of()));
            final Set<String> fingerprints = entry.getValue();
            final String fingerprint = fingerprints.size() == 1 && !unordered.containsKey(path)
                    ? fingerprints.iterator().next()
                    : null;
            if (fingerprint == null) {
                logger.info("Inconsistent fragments for {}, will be re-synchronized", path);
            }
            put(new FileRecord(path, fingerprint, fingerprint, ids, Set.of()));
        }
    }
}
