package de.mirkosertic.vectorsync.embedding;

import java.io.IOException;

public class EmbeddingProviderException extends IOException {

    public EmbeddingProviderException(final String message) {
        super(message);
    }

    public EmbeddingProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
