package eu.virtualparadox.docsearch.exception;

import lombok.Getter;

import java.nio.file.Path;

/** Raised when the text of a source file cannot be extracted; the file is skipped. */
@Getter
public class ExtractionException extends DocSearchException {

    private final Path path;

    public ExtractionException(final Path path, final String message, final Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
