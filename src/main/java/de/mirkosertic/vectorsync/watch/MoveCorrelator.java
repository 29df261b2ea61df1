package de.mirkosertic.vectorsync.watch;

import java.nio.file.Path;

/**
 * Decides whether a file that disappeared and a file that appeared are the same content,
 * i.e. whether the pair should be treated as a rename.
 */
@FunctionalInterface
public interface MoveCorrelator {

    MoveCorrelator NEVER = (removed, arrived) -> false;

    boolean isSameContent(Path removed, Path arrived);
}
