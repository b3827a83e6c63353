package eu.virtualparadox.docsearch.ingest.fingerprint;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content identity of a chunk: lower-case hex SHA-256 of its UTF-8 bytes.
 * <p>
 * The hash covers the text exactly as produced by the chunker; whitespace normalization
 * happens upstream in {@link eu.virtualparadox.docsearch.ingest.cleaner.TextCleaner}, so
 * identical text yields the identical fingerprint regardless of the owning document.
 * Stateless and thread-safe.
 */
@Component
public class ContentFingerprinter {

    private static final String ALGORITHM = "SHA-256";

    public String fingerprint(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return HexFormat.of().formatHex(newDigest().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (final NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
