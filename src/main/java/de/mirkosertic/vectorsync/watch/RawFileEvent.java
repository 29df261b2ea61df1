package de.mirkosertic.vectorsync.watch;

import java.nio.file.Path;

/**
 * A filesystem notification as delivered by the notification source, before debouncing.
 */
public record RawFileEvent(Kind kind, Path path) {

    public enum Kind {
        CREATED,
        MODIFIED,
        MOVED_FROM,
        MOVED_TO,
        DELETED;

        public boolean isRemoval() {
            return this == DELETED || this == MOVED_FROM;
        }

        public boolean isArrival() {
            return this == CREATED || this == MOVED_TO;
        }
    }

    public static RawFileEvent created(final Path path) {
        return new RawFileEvent(Kind.CREATED, path);
    }

    public static RawFileEvent modified(final Path path) {
        return new RawFileEvent(Kind.MODIFIED, path);
    }

    public static RawFileEvent deleted(final Path path) {
        return new RawFileEvent(Kind.DELETED, path);
    }
}
