package eu.virtualparadox.docsearch.rag.store;

/**
 * @param id       vector-store identifier (the chunk fingerprint)
 * @param score    cosine similarity to the query vector, higher is better
 * @param metadata stored chunk payload
 */
public record VectorStoreCandidate(String id, float score, ChunkMetadata metadata) {

}
