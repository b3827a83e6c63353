package eu.virtualparadox.docsearch.rag.index;

/**
 * Result of an indexing run.
 *
 * @param documentsProcessed documents that passed the file-type filter and were chunked
 * @param chunksProcessed    chunks produced by those documents
 * @param chunksIndexed      chunks upserted and durably recorded in the manifest
 * @param chunksSkipped      chunks already indexed, or duplicates of a chunk earlier in the run
 * @param chunksFailed       chunks whose embedding, upsert or manifest write failed
 * @param totalTimeSeconds   wall-clock duration of the run
 * @param cancelled          whether the run stopped early; undispatched chunks are in no counter
 */
public record IndexStats(int documentsProcessed,
                         int chunksProcessed,
                         int chunksIndexed,
                         int chunksSkipped,
                         int chunksFailed,
                         double totalTimeSeconds,
                         boolean cancelled) {
}
