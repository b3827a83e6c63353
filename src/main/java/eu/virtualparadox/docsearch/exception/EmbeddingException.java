package eu.virtualparadox.docsearch.exception;

/**
 * Failure reported by an embedding provider.
 * Subclasses tell the batcher whether the call is worth retrying.
 */
public abstract class EmbeddingException extends DocSearchException {

    protected EmbeddingException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
