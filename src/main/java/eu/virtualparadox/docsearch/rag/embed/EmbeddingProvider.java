package eu.virtualparadox.docsearch.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for text.
 */
public interface EmbeddingProvider {

    /**
     * Embeds the given texts in one call.
     *
     * @param texts non-empty list of texts
     * @return one vector per text, in input order
     * @throws eu.virtualparadox.docsearch.exception.EmbeddingTransientException if the call may succeed on retry
     * @throws eu.virtualparadox.docsearch.exception.EmbeddingFatalException     if the input cannot be embedded
     */
    List<float[]> embedBatch(final List<String> texts);

    /**
     * @return identifier of the underlying model, for logs and stats
     */
    String modelId();
}
