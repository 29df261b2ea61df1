package de.mirkosertic.vectorsync.chunking;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives the identifier of a stored fragment from the file path, the content
 * fingerprint of the file and the ordinal of the chunk.
 * <p>
 * The identifier is a name-based UUID, so the same inputs always yield the same id
 * and a new fingerprint always yields a new, disjoint id set. Vector stores that only
 * accept UUID or integer point ids can use it directly.
 */
public final class FragmentIdentity {

    private static final char SEPARATOR = '\u0000';

    private FragmentIdentity() {
    }

    public static String identify(final String path, final String fingerprint, final int ordinal) {
        final String name = path + SEPARATOR + fingerprint + SEPARATOR + ordinal;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
