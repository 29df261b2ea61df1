package de.mirkosertic.vectorsync.search;

import org.jspecify.annotations.Nullable;

/**
 * @param rerankScore cross-encoder score, {@code null} if no reranking took place
 */
public record SearchHit(
        String fragmentId,
        String path,
        int chunkIndex,
        String text,
        double score,
        @Nullable Double rerankScore
) {
}
