package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.extract.ContentCategory;

import java.nio.file.Path;
import java.util.Set;

/**
 * Identity of a watched folder. Status and progress live in the folder's
 * {@link FolderSynchronizer}; see {@link FolderStatusSnapshot}.
 *
 * @param rootPath  canonical absolute path
 * @param id        stable across restarts
 * @param createdAt epoch millis
 */
public record WatchedFolder(String id, Path rootPath, Set<ContentCategory> contentCategories,
                            String collectionName, long createdAt) {

    public WatchedFolder {
        contentCategories = Set.copyOf(contentCategories);
    }
}
