package de.mirkosertic.vectorsync.sync;

import java.nio.file.Path;

public class AlreadyWatchedException extends RuntimeException {

    private final Path path;

    public AlreadyWatchedException(final Path path) {
        super("Folder is already watched: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
