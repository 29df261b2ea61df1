package de.mirkosertic.vectorsync.sync;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters of a folder's current scan. Thread-safe, updated by worker threads.
 */
public class FolderProgress {

    public static final String COUNT_TYPE_FILES = "files";

    private final AtomicInteger totalFiles = new AtomicInteger();
    private final AtomicInteger processedFiles = new AtomicInteger();
    private final AtomicInteger errorCount = new AtomicInteger();

    public void startScan(final int total) {
        totalFiles.set(total);
        processedFiles.set(0);
    }

    public void fileProcessed() {
        processedFiles.incrementAndGet();
    }

    public void fileFailed() {
        errorCount.incrementAndGet();
    }

    public int getTotalFiles() {
        return totalFiles.get();
    }

    public int getProcessedFiles() {
        return processedFiles.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public int percent() {
        final int total = totalFiles.get();
        if (total <= 0) {
            return 100;
        }
        return (int) Math.min(100, (processedFiles.get() * 100L) / total);
    }
}
