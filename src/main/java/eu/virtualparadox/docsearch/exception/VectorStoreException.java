package eu.virtualparadox.docsearch.exception;

/** Failure of an upsert, commit, search or delete against the vector store. */
public class VectorStoreException extends DocSearchException {

    private final boolean transientFailure;

    public VectorStoreException(final String message, final Throwable cause, final boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
