package eu.virtualparadox.docsearch.rag.embed;

/**
 * Why an item did not receive a vector.
 */
public enum EEmbeddingFailure {
    /** Transient failures (timeouts, rate limits) persisted through the whole retry budget. */
    TRANSIENT_EXHAUSTED,
    /** The provider rejected the input or returned an unusable result; not retried. */
    FATAL,
    /** The batch was never dispatched because the run was cancelled. */
    CANCELLED
}
