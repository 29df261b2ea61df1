package de.mirkosertic.vectorsync.sync;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Derives a store collection name from a folder path: {@code <prefix>_<path>_<hash>}.
 * The readable part has everything outside {@code [a-zA-Z0-9_.-]} replaced by an
 * underscore, runs of underscores collapsed and is cut so the whole name fits in 64
 * characters. The hash (8 hex digits of the SHA-256 of the full path) keeps folders
 * apart whose readable parts coincide.
 */
public final class CollectionNames {

    static final int MAX_LENGTH = 64;
    static final int HASH_LENGTH = 8;

    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9_.-]");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    private CollectionNames() {
    }

    public static String forPath(final String prefix, final Path folder) {
        final String hash = hash(folder.toString());
        final String readable = sanitize(prefix + "_" + folder, MAX_LENGTH - HASH_LENGTH - 1);
        return readable.isEmpty() ? hash : readable + "_" + hash;
    }

    static String sanitize(final String raw) {
        return sanitize(raw, MAX_LENGTH);
    }

    static String sanitize(final String raw, final int maxLength) {
        String name = INVALID.matcher(raw).replaceAll("_");
        name = UNDERSCORES.matcher(name).replaceAll("_");
        name = trimUnderscores(name);
        if (name.length() > maxLength) {
            name = trimUnderscores(name.substring(0, maxLength));
        }
        return name;
    }

    static String hash(final String value) {
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, HASH_LENGTH / 2);
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    private static String trimUnderscores(final String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }
}
