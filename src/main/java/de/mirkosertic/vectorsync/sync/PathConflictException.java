package de.mirkosertic.vectorsync.sync;

import java.nio.file.Path;

/**
 * Thrown when a folder is nested inside, or contains, a folder that is already watched,
 * or when both would share one collection.
 */
public class PathConflictException extends RuntimeException {

    private final Path path;
    private final Path conflictingPath;

    public PathConflictException(final Path path, final Path conflictingPath) {
        super("Folder " + path + " conflicts with watched folder " + conflictingPath);
        this.path = path;
        this.conflictingPath = conflictingPath;
    }

    public Path getPath() {
        return path;
    }

    public Path getConflictingPath() {
        return conflictingPath;
    }
}
