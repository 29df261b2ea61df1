package de.mirkosertic.vectorsync.extract;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts text from Office and OpenDocument files using Tika's auto-detecting parser.
 */
public class TikaDocumentBackend implements ExtractionBackend {

    private final Parser parser = new AutoDetectParser();

    @Override
    public String name() {
        return "tika-auto";
    }

    @Override
    public String extract(final Path file) throws IOException {
        try (final InputStream stream = Files.newInputStream(file)) {
            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

            final BodyContentHandler handler = new BodyContentHandler(-1);
            final ParseContext context = new ParseContext();
            context.set(Parser.class, parser);

            parser.parse(stream, handler, metadata, context);
            return handler.toString();
        } catch (final SAXException | TikaException e) {
            throw new IOException("Failed to parse document", e);
        }
    }
}
