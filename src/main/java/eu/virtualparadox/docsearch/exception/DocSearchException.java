package eu.virtualparadox.docsearch.exception;

/** Base type of all failures raised by the indexing and retrieval pipeline. */
public class DocSearchException extends RuntimeException {

    public DocSearchException(final String message) {
        super(message);
    }

    public DocSearchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
