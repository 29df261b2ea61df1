package de.mirkosertic.vectorsync.watch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * A debounced change, ready to be applied to the index. {@link Type#RESCAN} carries the
 * watched root and asks for a full walk because notifications were lost.
 *
 * @param previousPath only set for {@link Type#MOVED}
 */
public record SettledEvent(Type type, Path path, @Nullable Path previousPath) {

    public enum Type {
        CHANGED,
        REMOVED,
        MOVED,
        RESCAN
    }

    public static SettledEvent changed(final Path path) {
        return new SettledEvent(Type.CHANGED, path, null);
    }

    public static SettledEvent removed(final Path path) {
        return new SettledEvent(Type.REMOVED, path, null);
    }

    public static SettledEvent rescan(final Path root) {
        return new SettledEvent(Type.RESCAN, root, null);
    }

    public static SettledEvent moved(final Path from, final Path to) {
        return new SettledEvent(Type.MOVED, to, from);
    }
}
