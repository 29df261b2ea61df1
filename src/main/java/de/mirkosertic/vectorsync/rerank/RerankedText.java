package de.mirkosertic.vectorsync.rerank;

/**
 * @param index position of the text in the list passed to the reranker
 */
public record RerankedText(int index, String text, double score) {
}
