package de.mirkosertic.vectorsync.extract;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;

/**
 * Gets text out of a file.
 * <p>
 * Binary categories are handled by an ordered list of backends: a failing backend
 * (exception or blank result) is logged and the next one is tried; only when every
 * backend has failed is an {@link ExtractionException} raised. Plain text is decoded
 * by {@link PlainTextDecoder}. The returned text is normalized.
 */
public class ExtractorGateway {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorGateway.class);

    private final List<ExtractionBackend> pdfBackends;
    private final List<ExtractionBackend> documentBackends;
    private final PlainTextDecoder textDecoder;
    private final long maxContentLength;

    public ExtractorGateway(final ApplicationConfig config) {
        this(List.of(new PdfBoxPdfBackend(), new TikaPdfBackend()),
                List.of(new TikaDocumentBackend()),
                new PlainTextDecoder(Charset.forName(config.getFallbackEncoding())),
                config.getMaxContentLength());
    }

    public ExtractorGateway(final List<ExtractionBackend> pdfBackends,
                            final List<ExtractionBackend> documentBackends,
                            final PlainTextDecoder textDecoder,
                            final long maxContentLength) {
        this.pdfBackends = List.copyOf(pdfBackends);
        this.documentBackends = List.copyOf(documentBackends);
        this.textDecoder = textDecoder;
        this.maxContentLength = maxContentLength;
    }

    public String extract(final Path file, final ContentCategory category) throws ExtractionException {
        final String raw = switch (category) {
            case TEXT -> decodeText(file);
            case PDF -> extractWithFallback(file, pdfBackends);
            case DOCUMENT -> extractWithFallback(file, documentBackends);
        };

        final String normalized = TextNormalizer.normalize(raw);
        if (maxContentLength > 0 && normalized.length() > maxContentLength) {
            logger.debug("Truncating content of {} to {} characters", file, maxContentLength);
            return normalized.substring(0, (int) maxContentLength);
        }
        return normalized;
    }

    private String decodeText(final Path file) throws ExtractionException {
        try {
            return textDecoder.decode(file);
        } catch (final ExtractionException e) {
            throw e;
        } catch (final IOException e) {
            throw new ExtractionException(file, "I/O error reading file", e);
        }
    }

    private String extractWithFallback(final Path file, final List<ExtractionBackend> backends)
            throws ExtractionException {
        ExtractionException failure = new ExtractionException(file, "No extraction backend produced text");
        for (final ExtractionBackend backend : backends) {
            try {
                final String text = backend.extract(file);
                if (text != null && !text.isBlank()) {
                    logger.debug("Extracted {} characters from {} using {}", text.length(), file, backend.name());
                    return text;
                }
                logger.debug("Backend {} returned no text for {}", backend.name(), file);
            } catch (final IOException | RuntimeException e) {
                logger.debug("Backend {} failed for {}", backend.name(), file, e);
                failure.addSuppressed(e);
            }
        }
        logger.warn("All extraction backends failed for {}", file);
        throw failure;
    }
}
