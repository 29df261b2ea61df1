package de.mirkosertic.vectorsync.extract;

import org.apache.tika.Tika;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a file to its {@link ContentCategory} using Tika's name based MIME detection
 * plus a list of extensions that are known to be plain text.
 */
public class ContentTypeDetector {

    static final Set<String> TEXT_FILE_EXTENSIONS = Set.of(
            // Programming languages
            "c", "cpp", "cs", "csproj", "go", "h", "hpp", "java", "js", "php",
            "py", "rb", "rs", "sln", "ts",
            // Scripts and configs
            "bat", "cfg", "ini", "sh", "toml", "yaml", "yml",
            // Markup and web
            "txt", "css", "html", "ipynb", "json", "log", "md", "xml"
    );

    private static final Set<String> DOCUMENT_MIME_PREFIXES = Set.of(
            "application/msword",
            "application/rtf",
            "application/vnd.ms-excel",
            "application/vnd.ms-powerpoint",
            "application/vnd.openxmlformats-officedocument",
            "application/vnd.oasis.opendocument"
    );

    private final Tika tika = new Tika();

    /**
     * @return the category of the file, or {@code null} if it is of no interest
     */
    public @Nullable ContentCategory categoryOf(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return null;
        }
        final String name = fileName.toString();
        final String mime = tika.detect(name);

        if ("application/pdf".equals(mime)) {
            return ContentCategory.PDF;
        }
        if (mime.startsWith("text/") || TEXT_FILE_EXTENSIONS.contains(extensionOf(name))) {
            return ContentCategory.TEXT;
        }
        for (final String prefix : DOCUMENT_MIME_PREFIXES) {
            if (mime.startsWith(prefix)) {
                return ContentCategory.DOCUMENT;
            }
        }
        return null;
    }

    public boolean accepts(final Path file, final Set<ContentCategory> categories) {
        final ContentCategory category = categoryOf(file);
        return category != null && categories.contains(category);
    }

    private static String extensionOf(final String fileName) {
        final int lastDot = fileName.lastIndexOf('.');
        if (lastDot > 0 && lastDot < fileName.length() - 1) {
            return fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
