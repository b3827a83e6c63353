package eu.virtualparadox.docsearch.exception;

import lombok.Getter;

/**
 * Query-time failure. Distinguishable from an empty result: a search either returns
 * (possibly zero) ranked results or throws this exception.
 */
@Getter
public class SearchException extends DocSearchException {

    public enum EReason {
        INVALID_QUERY,
        EMBEDDING_FAILED,
        VECTOR_STORE_FAILED
    }

    private final EReason reason;

    public SearchException(final EReason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public SearchException(final EReason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
