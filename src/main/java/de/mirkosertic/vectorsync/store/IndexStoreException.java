package de.mirkosertic.vectorsync.store;

import java.io.IOException;

/**
 * Any failure of the vector store. Considered transient by the synchronizer and retried.
 */
public class IndexStoreException extends IOException {

    public IndexStoreException(final String message) {
        super(message);
    }

    public IndexStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
