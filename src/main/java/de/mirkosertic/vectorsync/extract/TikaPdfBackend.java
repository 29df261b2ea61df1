package de.mirkosertic.vectorsync.extract;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.pdf.PDFParser;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts PDF text through Tika's PDF parser, which copes with some documents
 * the plain PDFBox stripper rejects (broken cross reference tables, odd encodings).
 */
public class TikaPdfBackend implements ExtractionBackend {

    private final PDFParser parser = new PDFParser();

    @Override
    public String name() {
        return "tika-pdf";
    }

    @Override
    public String extract(final Path file) throws IOException {
        try (final InputStream stream = Files.newInputStream(file)) {
            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());
            final BodyContentHandler handler = new BodyContentHandler(-1);
            parser.parse(stream, handler, metadata, new ParseContext());
            return handler.toString();
        } catch (final SAXException | TikaException e) {
            throw new IOException("Failed to parse document", e);
        }
    }
}
