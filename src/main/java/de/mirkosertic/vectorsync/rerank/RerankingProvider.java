package de.mirkosertic.vectorsync.rerank;

import java.io.IOException;
import java.util.List;

/**
 * Scores candidate texts against a query with a cross-encoder.
 */
public interface RerankingProvider {

    /**
     * @return at most {@code topK} texts, best first
     */
    List<RerankedText> rerank(String query, List<String> texts, int topK) throws IOException;
}
