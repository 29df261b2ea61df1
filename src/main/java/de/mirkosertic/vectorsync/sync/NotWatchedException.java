package de.mirkosertic.vectorsync.sync;

import java.nio.file.Path;

public class NotWatchedException extends RuntimeException {

    private final Path path;

    public NotWatchedException(final Path path) {
        super("Folder is not watched: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
