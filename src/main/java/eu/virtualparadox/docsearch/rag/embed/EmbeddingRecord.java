package eu.virtualparadox.docsearch.rag.embed;

/**
 * Vector computed for a chunk fingerprint during an indexing run.
 *
 * @param fingerprint chunk identity
 * @param vector      dense embedding
 * @param dimension   {@code vector.length}
 */
public record EmbeddingRecord(String fingerprint, float[] vector, int dimension) {

    public static EmbeddingRecord of(final String fingerprint, final float[] vector) {
        return new EmbeddingRecord(fingerprint, vector, vector.length);
    }
}
