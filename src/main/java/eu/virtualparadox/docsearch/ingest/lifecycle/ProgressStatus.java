package eu.virtualparadox.docsearch.ingest.lifecycle;

/**
 * Progress status of an indexing run.
 *
 * @param totalPercent    Overall progress percentage (0-100)
 * @param documentPercent Progress percentage for the current document (0-100)
 * @param processedChunks Chunks whose embedding finished (successfully or not)
 * @param totalChunks     Chunks scheduled for embedding in the run
 */
public record ProgressStatus(int totalPercent, int documentPercent, int processedChunks, int totalChunks) {

}
