package de.mirkosertic.vectorsync.store;

public enum Metric {
    COSINE,
    DOT_PRODUCT,
    EUCLIDEAN
}
