package de.mirkosertic.vectorsync.sync;

import java.nio.file.Path;

public class PathNotFoundException extends RuntimeException {

    private final Path path;

    public PathNotFoundException(final Path path) {
        super("Folder does not exist or is not a directory: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
