package de.mirkosertic.vectorsync.extract;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One way of turning a binary document into text. The gateway tries backends in
 * order and falls back to the next on failure.
 */
public interface ExtractionBackend {

    String name();

    /**
     * @return the raw extracted text, possibly empty
     * @throws IOException if the backend cannot handle the file
     */
    String extract(Path file) throws IOException;
}
