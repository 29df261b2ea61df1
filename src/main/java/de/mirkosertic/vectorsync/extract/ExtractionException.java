package de.mirkosertic.vectorsync.extract;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Text could not be obtained from a file. The file is skipped; the folder continues.
 */
public class ExtractionException extends IOException {

    private final Path file;

    public ExtractionException(final Path file, final String message) {
        super(message + ": " + file);
        this.file = file;
    }

    public ExtractionException(final Path file, final String message, final Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
