package eu.virtualparadox.docsearch.ingest.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Source document handed to the indexing pipeline. Owned by the caller; never mutated.
 *
 * @param id           stable document identifier (non-blank)
 * @param sourcePath   path the text was extracted from
 * @param fileType     lower-case extension without the dot, e.g. {@code pdf}
 * @param rawText      extracted (and normalized) text
 * @param lastModified modification time of the source file
 */
public record Document(String id, Path sourcePath, String fileType, String rawText, Instant lastModified) {

    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(rawText, "rawText");
        fileType = normalizeFileType(fileType);
    }

    /**
     * Lower-cases an extension and strips a leading dot, so {@code ".PDF"} and {@code "pdf"} compare equal.
     *
     * @param fileType extension, possibly {@code null}
     * @return normalized extension, empty for {@code null}
     */
    public static String normalizeFileType(final String fileType) {
        if (fileType == null) {
            return "";
        }
        final String trimmed = fileType.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
