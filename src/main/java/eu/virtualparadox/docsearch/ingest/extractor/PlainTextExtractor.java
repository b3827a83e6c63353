package eu.virtualparadox.docsearch.ingest.extractor;

import eu.virtualparadox.docsearch.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads {@code .txt} files, trying UTF-8 first and falling back to windows-1251 and ISO-8859-1.
 */
@Slf4j
@Service
public final class PlainTextExtractor implements TextExtractor {

    private static final List<Charset> CHARSETS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1251"),
            StandardCharsets.ISO_8859_1
    );

    @Override
    public boolean supports(final String fileType) {
        return "txt".equals(fileType);
    }

    @Override
    public String extract(final Path path) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ExtractionException(path, "Failed to read text file", e);
        }

        for (final Charset charset : CHARSETS) {
            try {
                final String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                if (!StandardCharsets.UTF_8.equals(charset)) {
                    log.debug("Decoded {} as {}", path, charset);
                }
                return text;
            } catch (CharacterCodingException e) {
                log.trace("{} is not valid {}", path, charset);
            }
        }
        throw new ExtractionException(path, "Could not decode text file", null);
    }
}
