package eu.virtualparadox.docsearch.rag.embed;

/**
 * Per-item result of {@link EmbeddingBatcher#embed}: either a vector or a failure kind.
 *
 * @param vector  the embedding, {@code null} on failure
 * @param failure the failure kind, {@code null} on success
 * @param message failure detail, {@code null} on success
 */
public record EmbeddingOutcome(float[] vector, EEmbeddingFailure failure, String message) {

    public static EmbeddingOutcome success(final float[] vector) {
        return new EmbeddingOutcome(vector, null, null);
    }

    public static EmbeddingOutcome failure(final EEmbeddingFailure failure, final String message) {
        return new EmbeddingOutcome(null, failure, message);
    }

    public static EmbeddingOutcome cancelled() {
        return new EmbeddingOutcome(null, EEmbeddingFailure.CANCELLED, "run cancelled before dispatch");
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
