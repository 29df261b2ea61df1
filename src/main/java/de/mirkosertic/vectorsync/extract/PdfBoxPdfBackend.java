package de.mirkosertic.vectorsync.extract;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts PDF text with PDFBox' text stripper in reading order.
 */
public class PdfBoxPdfBackend implements ExtractionBackend {

    @Override
    public String name() {
        return "pdfbox";
    }

    @Override
    public String extract(final Path file) throws IOException {
        try (final PDDocument document = Loader.loadPDF(file.toFile())) {
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document);
        }
    }
}
