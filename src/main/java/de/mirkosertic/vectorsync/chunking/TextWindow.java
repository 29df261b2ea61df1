package de.mirkosertic.vectorsync.chunking;

/**
 * One overlapping word window of a document's extracted text.
 * <p>
 * Word offsets are half-open ({@code [startWord, endWord)}) positions in the
 * whitespace-separated word sequence; character offsets are half-open positions
 * in the text that was chunked.
 */
public record TextWindow(
        int ordinal,
        String text,
        int startWord,
        int endWord,
        int startChar,
        int endChar
) {

    public int wordCount() {
        return endWord - startWord;
    }
}
