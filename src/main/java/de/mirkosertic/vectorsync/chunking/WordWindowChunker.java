package de.mirkosertic.vectorsync.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into overlapping fixed-size word windows.
 * <p>
 * Words are maximal runs of non-whitespace characters. Consecutive windows share
 * {@code rint(sizeWords * overlapRatio)} words (half-even rounding, so 150 words at
 * 0.15 overlap by 22). The last window may be shorter; no window is emitted after
 * the one that reaches the end of the text. The result depends on the input only.
 */
public final class WordWindowChunker {

    private static final Pattern WORD = Pattern.compile("\\S+");

    private WordWindowChunker() {
    }

    public static List<TextWindow> chunk(final String text, final int sizeWords, final double overlapRatio) {
        if (sizeWords <= 0) {
            throw new IllegalArgumentException("sizeWords must be positive: " + sizeWords);
        }
        if (overlapRatio < 0 || overlapRatio >= 1) {
            throw new IllegalArgumentException("overlapRatio must be in [0, 1): " + overlapRatio);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        // Character span of every word
        final List<int[]> words = new ArrayList<>();
        final Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(new int[]{matcher.start(), matcher.end()});
        }

        final int overlap = overlapWords(sizeWords, overlapRatio);
        final int step = Math.max(1, sizeWords - overlap);

        final List<TextWindow> windows = new ArrayList<>();
        int start = 0;
        int ordinal = 0;
        while (start < words.size()) {
            final int end = Math.min(words.size(), start + sizeWords);
            final StringBuilder windowText = new StringBuilder();
            for (int i = start; i < end; i++) {
                if (i > start) {
                    windowText.append(' ');
                }
                final int[] span = words.get(i);
                windowText.append(text, span[0], span[1]);
            }
            windows.add(new TextWindow(
                    ordinal++,
                    windowText.toString(),
                    start,
                    end,
                    words.get(start)[0],
                    words.get(end - 1)[1]));

            if (end == words.size()) {
                break;
            }
            start += step;
        }
        return windows;
    }

    static int overlapWords(final int sizeWords, final double overlapRatio) {
        final int overlap = (int) Math.rint(sizeWords * overlapRatio);
        return Math.min(overlap, sizeWords - 1);
    }
}
