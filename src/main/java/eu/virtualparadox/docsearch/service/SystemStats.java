package eu.virtualparadox.docsearch.service;

import java.time.Instant;

/**
 * @param documentsIndexed documents with at least one indexed chunk
 * @param chunksIndexed    chunks recorded in the manifest
 * @param lastIndexedAt    time of the most recent chunk write, {@code null} if nothing is indexed
 * @param vectorCount      entries in the vector store
 * @param embeddingModel   identifier of the embedding model
 */
public record SystemStats(long documentsIndexed,
                          long chunksIndexed,
                          Instant lastIndexedAt,
                          long vectorCount,
                          String embeddingModel) {
}
