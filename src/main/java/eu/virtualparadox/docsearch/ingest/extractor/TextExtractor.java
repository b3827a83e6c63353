package eu.virtualparadox.docsearch.ingest.extractor;

import eu.virtualparadox.docsearch.exception.ExtractionException;

import java.nio.file.Path;

/**
 * Turns a source file of a supported format into raw text.
 */
public interface TextExtractor {

    /**
     * @param fileType normalized extension without dot, e.g. {@code pdf}
     * @return whether this extractor handles the format
     */
    boolean supports(final String fileType);

    /**
     * @param path file to read
     * @return extracted text, possibly blank
     * @throws ExtractionException if the file cannot be read or parsed
     */
    String extract(final Path path);
}
