package eu.virtualparadox.docsearch.exception;

/**
 * The manifest could not durably record or remove an entry.
 * A chunk whose entry failed to persist is never reported as indexed.
 */
public class ManifestException extends DocSearchException {

    public ManifestException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
