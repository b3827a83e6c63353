package eu.virtualparadox.docsearch.exception;

/** Timeout, rate limit or any other failure that may succeed on retry. */
public class EmbeddingTransientException extends EmbeddingException {

    public EmbeddingTransientException(final String message) {
        super(message, null);
    }

    public EmbeddingTransientException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
