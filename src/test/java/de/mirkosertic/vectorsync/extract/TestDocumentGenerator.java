package de.mirkosertic.vectorsync.extract;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Utility class to generate test documents in the formats the extractor accepts.
 * Uses PDFBox for PDF. ODT files are created manually as ZIP archives with XML content.
 */
public final class TestDocumentGenerator {

    public static final String TEST_CONTENT = "This is test content for document extraction verification.";
    public static final String LATIN1_CONTENT = "Grüße aus Köln, café à la carte.";

    private TestDocumentGenerator() {
    }

    public static void createTxtFile(final Path path) throws IOException {
        Files.writeString(path, TEST_CONTENT, StandardCharsets.UTF_8);
    }

    /**
     * Writes {@link #LATIN1_CONTENT} in windows-1252, which is not valid UTF-8.
     */
    public static void createWindows1252File(final Path path) throws IOException {
        Files.write(path, LATIN1_CONTENT.getBytes(Charset.forName("windows-1252")));
    }

    public static void createBinaryFile(final Path path) throws IOException {
        Files.write(path, new byte[]{'a', 'b', 0, 1, 2, 'c'});
    }

    public static void createPdfFile(final Path path) throws IOException {
        createPdfFile(path, TEST_CONTENT);
    }

    public static void createPdfFile(final Path path, final String text) throws IOException {
        try (final PDDocument document = new PDDocument()) {
            final PDPage page = new PDPage();
            document.addPage(page);

            try (final PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                contentStream.newLineAtOffset(50, 700);
                contentStream.showText(text);
                contentStream.endText();
            }

            document.save(path.toFile());
        }
    }

    public static void createCorruptedPdfFile(final Path path) throws IOException {
        Files.writeString(path, "%PDF-1.7\nthis is not really a pdf", StandardCharsets.US_ASCII);
    }

    /**
     * Creates a minimal RTF file that Tika reads as a document.
     */
    public static void createRtfFile(final Path path) throws IOException {
        final String rtfContent = "{\\rtf1\\ansi\\ansicpg1252\\deff0{\\fonttbl{\\f0\\fswiss Helvetica;}}"
                + "\\f0\\fs24 " + TEST_CONTENT + "}";
        Files.writeString(path, rtfContent, StandardCharsets.US_ASCII);
    }

    /**
     * Creates an ODT file (OpenDocument Text) with test content.
     */
    public static void createOdtFile(final Path path) throws IOException {
        try (final OutputStream fos = Files.newOutputStream(path);
             final ZipOutputStream zos = new ZipOutputStream(fos)) {

            // mimetype must be first and uncompressed
            zos.setMethod(ZipOutputStream.STORED);
            final byte[] mimeBytes = "application/vnd.oasis.opendocument.text".getBytes(StandardCharsets.UTF_8);
            final ZipEntry mimeEntry = new ZipEntry("mimetype");
            mimeEntry.setSize(mimeBytes.length);
            mimeEntry.setCompressedSize(mimeBytes.length);
            final CRC32 crc = new CRC32();
            crc.update(mimeBytes);
            mimeEntry.setCrc(crc.getValue());
            zos.putNextEntry(mimeEntry);
            zos.write(mimeBytes);
            zos.closeEntry();

            zos.setMethod(ZipOutputStream.DEFLATED);

            addZipEntry(zos, "META-INF/manifest.xml", """
                    <?xml version="1.0" encoding="UTF-8"?>
                    <manifest:manifest xmlns:manifest="urn:oasis:names:tc:opendocument:xmlns:manifest:1.0" manifest:version="1.2">
                      <manifest:file-entry manifest:full-path="/" manifest:media-type="application/vnd.oasis.opendocument.text"/>
                      <manifest:file-entry manifest:full-path="content.xml" manifest:media-type="text/xml"/>
                    </manifest:manifest>
                    """);

            addZipEntry(zos, "content.xml", """
                    <?xml version="1.0" encoding="UTF-8"?>
                    <office:document-content xmlns:office="urn:oasis:names:tc:opendocument:xmlns:office:1.0"
                                             xmlns:text="urn:oasis:names:tc:opendocument:xmlns:text:1.0"
                                             office:version="1.2">
                      <office:body>
                        <office:text>
                          <text:p>%s</text:p>
                        </office:text>
                      </office:body>
                    </office:document-content>
                    """.formatted(TEST_CONTENT));
        }
    }

    private static void addZipEntry(final ZipOutputStream zos, final String name, final String content) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        zos.write(content.getBytes(StandardCharsets.UTF_8));
        zos.closeEntry();
    }
}
