package de.mirkosertic.vectorsync.embedding;

import java.util.List;

/**
 * Turns text into fixed-size vectors. Passages (indexed fragments) and queries may be
 * embedded differently, for example with distinct prompt prefixes.
 */
public interface EmbeddingProvider {

    /**
     * @return one vector per input, in input order
     */
    List<float[]> embedPassages(List<String> texts) throws EmbeddingProviderException;

    float[] embedQuery(String text) throws EmbeddingProviderException;

    int dimension();
}
