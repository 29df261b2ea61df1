package de.mirkosertic.vectorsync.sync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * What the index holds for one file.
 *
 * @param fingerprint           most recently observed content fingerprint
 * @param lastSyncedFingerprint fingerprint the indexed fragments were built from; {@code null}
 *                              if the indexed fragments are of mixed or unknown origin
 * @param fragmentIds           ids currently in the index for this file, in ordinal order
 * @param staleFragmentIds      ids written by a superseded synchronization, to be deleted
 *                              by the next successful one
 */
public record FileRecord(Path path,
                         @Nullable String fingerprint,
                         @Nullable String lastSyncedFingerprint,
                         List<String> fragmentIds,
                         Set<String> staleFragmentIds) {

    public FileRecord {
        fragmentIds = List.copyOf(fragmentIds);
        staleFragmentIds = Set.copyOf(staleFragmentIds);
    }

    public static FileRecord synced(final Path path, final String fingerprint, final List<String> fragmentIds) {
        return new FileRecord(path, fingerprint, fingerprint, fragmentIds, Set.of());
    }

    public boolean isUpToDate(final String currentFingerprint) {
        return currentFingerprint.equals(lastSyncedFingerprint) && staleFragmentIds.isEmpty();
    }

    public FileRecord withPath(final Path newPath) {
        return new FileRecord(newPath, fingerprint, lastSyncedFingerprint, fragmentIds, staleFragmentIds);
    }

    public FileRecord withStale(final Set<String> additionalStaleIds) {
        final Set<String> stale = new HashSet<>(staleFragmentIds);
        stale.addAll(additionalStaleIds);
        stale.removeAll(fragmentIds);
        return new FileRecord(path, fingerprint, lastSyncedFingerprint, fragmentIds, stale);
    }

    /**
     * This record without the given ids. What remains no longer matches any fingerprint,
     * so the next synchronization rebuilds the file.
     */
    public FileRecord withoutIds(final Collection<String> ids) {
        final List<String> kept = new ArrayList<>(fragmentIds);
        kept.removeAll(ids);
        final Set<String> stale = new HashSet<>(staleFragmentIds);
        stale.removeAll(ids);
        return new FileRecord(path, fingerprint, null, kept, stale);
    }

    /**
     * Every id this record is responsible for deleting.
     */
    public Set<String> allIds() {
        final Set<String> ids = new HashSet<>(fragmentIds);
        ids.addAll(staleFragmentIds);
        return ids;
    }
}
