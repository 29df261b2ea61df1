package de.mirkosertic.vectorsync.extract;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans up extracted text before it is chunked.
 *
 * <ol>
 *   <li>NFKC normalization (ligatures, full-width forms)</li>
 *   <li>removal of control characters except newline and tab</li>
 *   <li>Unicode space variants replaced by an ASCII space</li>
 *   <li>runs of spaces/tabs collapsed, runs of blank lines collapsed</li>
 * </ol>
 */
public final class TextNormalizer {

    private static final Pattern CONTROL = Pattern.compile("[\u0000-\u0008\u000B\u000C\u000E-\u001F\u007F-\u009F]");
    private static final Pattern UNICODE_SPACE = Pattern.compile("[   -​  　﻿]");
    private static final Pattern HORIZONTAL_WS = Pattern.compile("[\\t ]+");
    private static final Pattern NEWLINES = Pattern.compile(" *\\r?\\n *( *\\r?\\n *)*");

    private TextNormalizer() {
    }

    public static String normalize(final String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String result = Normalizer.normalize(content, Normalizer.Form.NFKC);
        result = CONTROL.matcher(result).replaceAll("");
        result = UNICODE_SPACE.matcher(result).replaceAll(" ");
        result = HORIZONTAL_WS.matcher(result).replaceAll(" ");
        result = NEWLINES.matcher(result).replaceAll("\n");
        return result.trim();
    }
}
