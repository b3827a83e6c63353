package eu.virtualparadox.docsearch.rag.manifest;

import java.time.Instant;

/**
 * Aggregate counts over the manifest.
 *
 * @param documentsIndexed documents owning at least one entry
 * @param chunksIndexed    number of entries (distinct fingerprints)
 * @param lastIndexedAt    most recent {@code indexedAt}, {@code null} for an empty manifest
 */
public record ManifestStats(long documentsIndexed, long chunksIndexed, Instant lastIndexedAt) {
}
