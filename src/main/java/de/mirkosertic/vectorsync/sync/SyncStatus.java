package de.mirkosertic.vectorsync.sync;

/**
 * Lifecycle of a watched folder.
 */
public enum SyncStatus {
    INITIALIZING,
    SCANNING,
    WATCHING,
    PAUSED,
    ERROR,
    REMOVED
}
