package de.mirkosertic.vectorsync.state;

import java.util.List;

/**
 * The watcher registry as stored next to the index.
 */
public record PersistedState(List<FolderState> folders) {

    public static final PersistedState EMPTY = new PersistedState(List.of());

    public PersistedState {
        folders = List.copyOf(folders);
    }

    /**
     * One watched folder. {@code categories} holds configuration names, {@code status} a
     * {@code SyncStatus} name.
     */
    public record FolderState(
            String id,
            String path,
            List<String> categories,
            String collectionName,
            String status,
            int progressPercent,
            long createdAt
    ) {
        public FolderState {
            categories = List.copyOf(categories);
        }
    }
}
