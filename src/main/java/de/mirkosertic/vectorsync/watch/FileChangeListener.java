package de.mirkosertic.vectorsync.watch;

import java.nio.file.Path;

@FunctionalInterface
public interface FileChangeListener {

    void onFileEvent(RawFileEvent event);

    /**
     * The notification source dropped events somewhere below {@code root}.
     */
    default void onOverflow(final Path root) {
    }
}
