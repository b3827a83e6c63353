package eu.virtualparadox.docsearch.exception;

/** Malformed input or a broken model; retrying cannot help. */
public class EmbeddingFatalException extends EmbeddingException {

    public EmbeddingFatalException(final String message) {
        super(message, null);
    }

    public EmbeddingFatalException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
