package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.extract.ContentCategory;

import java.util.Set;

/**
 * Point-in-time view of a watched folder as reported by {@link WatcherOrchestrator#getWatchedFolders()}.
 */
public record FolderStatusSnapshot(
        String id,
        String path,
        Set<ContentCategory> contentCategories,
        SyncStatus status,
        int progressPercent,
        String collectionName,
        int totalFiles,
        int processedFiles,
        int errorCount,
        String countType
) {
}
