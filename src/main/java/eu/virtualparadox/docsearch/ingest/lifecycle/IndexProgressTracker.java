package eu.virtualparadox.docsearch.ingest.lifecycle;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.function.Consumer;

/**
 * Tracks the progress of the current indexing run across documents and chunks.
 * <p>
 * Provides both global and per-document progress percentages. Embedding batches complete
 * on worker threads, so every method is synchronized. Batches may complete out of order;
 * the per-document figure is therefore an approximation.
 */
@Service
@Slf4j
public class IndexProgressTracker {

    /**
     * Remaining documents of the run, represented by their pending chunk counts.
     */
    private final Queue<Integer> documentQueue = new ArrayDeque<>();

    private int totalChunks;
    private int processedChunks;
    private int currentDocumentChunks;
    private int currentDocumentProcessed;

    /**
     * Optional callback invoked after each step with the new status.
     */
    @Setter
    private volatile Consumer<ProgressStatus> progressCallback;

    /**
     * Resets the tracker for a new run.
     *
     * @param pendingChunksPerDocument chunks to embed, per document in processing order
     */
    public synchronized void start(final List<Integer> pendingChunksPerDocument) {
        documentQueue.clear();
        totalChunks = 0;
        processedChunks = 0;
        for (final int count : pendingChunksPerDocument) {
            if (count > 0) {
                documentQueue.add(count);
                totalChunks += count;
            }
        }
        startNextDocument();
        log.info("Indexing run started: {} chunks to embed across {} documents",
                totalChunks, pendingChunksPerDocument.size());
    }

    /**
     * Records {@code chunks} more chunks as processed and fires the callback.
     */
    public void step(final int chunks) {
        final ProgressStatus status;
        synchronized (this) {
            int remaining = chunks;
            while (remaining > 0 && currentDocumentChunks > 0) {
                final int taken = Math.min(remaining, currentDocumentChunks - currentDocumentProcessed);
                processedChunks += taken;
                currentDocumentProcessed += taken;
                remaining -= taken;
                if (currentDocumentProcessed >= currentDocumentChunks) {
                    // finished current doc, move to next
                    startNextDocument();
                }
            }
            status = getProgressStatus();
        }

        final Consumer<ProgressStatus> callback = progressCallback;
        if (callback != null) {
            callback.accept(status);
        }
    }

    /**
     * Marks the run finished; chunks that never completed are dropped from the totals.
     */
    public synchronized void finish() {
        documentQueue.clear();
        totalChunks = processedChunks;
        currentDocumentChunks = 0;
        currentDocumentProcessed = 0;
    }

    public synchronized ProgressStatus getProgressStatus() {
        final int totalPercent =
                totalChunks == 0 ? 100 : (int) ((processedChunks * 100L) / totalChunks);

        final int documentPercent =
                currentDocumentChunks == 0 ? 100 : (int) ((currentDocumentProcessed * 100L) / currentDocumentChunks);

        return new ProgressStatus(totalPercent, documentPercent, processedChunks, totalChunks);
    }

    private void startNextDocument() {
        currentDocumentProcessed = 0;
        final Integer next = documentQueue.poll();
        currentDocumentChunks = next == null ? 0 : next;
    }
}
