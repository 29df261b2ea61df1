package de.mirkosertic.vectorsync.extract;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Kinds of content a watched folder can accept.
 */
public enum ContentCategory {

    /** Source code, configuration, markup and other plain-text files. */
    TEXT,

    /** PDF documents. */
    PDF,

    /** Office and OpenDocument formats. */
    DOCUMENT;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ContentCategory fromName(final String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown content category: " + name, e);
        }
    }

    public static Set<ContentCategory> fromNames(final Collection<String> names) {
        final Set<ContentCategory> result = EnumSet.noneOf(ContentCategory.class);
        for (final String name : names) {
            result.add(fromName(name));
        }
        return result;
    }
}
