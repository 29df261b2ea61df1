package de.mirkosertic.vectorsync.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes plain-text files: strict UTF-8 first, then the configured fallback
 * encoding. Files containing NUL bytes are treated as binary and rejected.
 */
public class PlainTextDecoder {

    private static final Logger logger = LoggerFactory.getLogger(PlainTextDecoder.class);

    private final Charset fallback;

    public PlainTextDecoder(final Charset fallback) {
        this.fallback = fallback;
    }

    public String decode(final Path file) throws IOException {
        final byte[] bytes = Files.readAllBytes(file);
        for (final byte b : bytes) {
            if (b == 0) {
                throw new ExtractionException(file, "Binary content in text file");
            }
        }

        try {
            return strictDecode(bytes, StandardCharsets.UTF_8);
        } catch (final CharacterCodingException e) {
            logger.debug("File is not valid UTF-8, trying {}: {}", fallback, file);
        }

        try {
            return strictDecode(bytes, fallback);
        } catch (final CharacterCodingException e) {
            throw new ExtractionException(file, "Undecodable text (UTF-8 and " + fallback + ")", e);
        }
    }

    private static String strictDecode(final byte[] bytes, final Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
