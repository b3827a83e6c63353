package eu.virtualparadox.docsearch.rag.embed;

import eu.virtualparadox.docsearch.application.config.IndexingProperties;
import eu.virtualparadox.docsearch.application.executor.EmbeddingCallExecutor;
import eu.virtualparadox.docsearch.exception.EmbeddingException;
import eu.virtualparadox.docsearch.exception.EmbeddingFatalException;
import eu.virtualparadox.docsearch.exception.EmbeddingTransientException;
import eu.virtualparadox.docsearch.rag.resilience.GuardedCall;
import eu.virtualparadox.docsearch.util.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives texts through the {@link EmbeddingProvider} in bounded batches.
 *
 * <h2>Concurrency</h2>
 * Each {@link #embed} call owns a worker pool of {@code maxConcurrency} threads. The dispatching
 * (calling) thread blocks once {@code maxConcurrency * 3} batches are running or queued, so chunk
 * volume never outruns embedding throughput. The pool queue holds as many batches as there are
 * dispatch permits, since a permit is returned before its worker thread is free again.
 *
 * <h2>Failures</h2>
 * Every provider call goes through a {@link GuardedCall}: a per-call timeout plus retries with
 * exponential backoff for transient failures. A batch that still fails marks each of its items
 * failed; sibling batches are unaffected. Results are aligned with the input positions.
 *
 * <h2>Cancellation</h2>
 * Checked before each dispatch. Dispatched batches run to completion, also when the dispatching
 * thread is interrupted; the remaining items are reported as {@link EEmbeddingFailure#CANCELLED}.
 */
@Slf4j
@Service
public class EmbeddingBatcher {

    private final EmbeddingProvider provider;
    private final GuardedCall guardedCall;
    private final int defaultBatchSize;
    private final int defaultMaxConcurrency;
    private final AtomicInteger runCounter = new AtomicInteger();

    /**
     * Receives the outcomes of each batch as soon as it completes, on the worker thread.
     */
    @FunctionalInterface
    public interface BatchListener {

        /**
         * @param offset   input position of the first item of the batch
         * @param outcomes outcomes of the batch items, in input order
         */
        void onBatchComplete(int offset, List<EmbeddingOutcome> outcomes);
    }

    @Autowired
    public EmbeddingBatcher(final EmbeddingProvider provider,
                            final EmbeddingCallExecutor callExecutor,
                            final IndexingProperties properties) {
        this(provider,
                new GuardedCall("embedding",
                        properties.getEmbedding().getRetry().toBackoffPolicy(),
                        properties.getEmbedding().getCallTimeout(),
                        callExecutor,
                        EmbeddingBatcher::isTransient),
                properties.getEmbedding().getBatchSize(),
                properties.getEmbedding().getMaxWorkers());
    }

    public EmbeddingBatcher(final EmbeddingProvider provider,
                            final GuardedCall guardedCall,
                            final int defaultBatchSize,
                            final int defaultMaxConcurrency) {
        if (defaultBatchSize <= 0 || defaultMaxConcurrency <= 0) {
            throw new IllegalArgumentException("batch size and concurrency must be positive");
        }
        this.provider = provider;
        this.guardedCall = guardedCall;
        this.defaultBatchSize = defaultBatchSize;
        this.defaultMaxConcurrency = defaultMaxConcurrency;
    }

    /**
     * Embeds {@code texts} with the configured batch size and concurrency.
     */
    public List<EmbeddingOutcome> embed(final List<String> texts) {
        return embed(texts, defaultBatchSize, defaultMaxConcurrency, CancellationSignal.create(), null);
    }

    /**
     * Embeds {@code texts} in batches of at most {@code batchSize}, running up to
     * {@code maxConcurrency} batches at once. Blocks until every dispatched batch finished.
     *
     * @param texts          texts to embed
     * @param batchSize      maximum items per provider call
     * @param maxConcurrency maximum concurrent provider calls
     * @param cancellation   stops dispatching new batches once cancelled
     * @param listener       optional per-batch callback, may be {@code null}
     * @return one outcome per input text, aligned by position
     */
    public List<EmbeddingOutcome> embed(final List<String> texts,
                                        final int batchSize,
                                        final int maxConcurrency,
                                        final CancellationSignal cancellation,
                                        final BatchListener listener) {
        if (texts == null) {
            throw new IllegalArgumentException("texts cannot be null");
        }
        if (batchSize <= 0 || maxConcurrency <= 0) {
            throw new IllegalArgumentException("batchSize and maxConcurrency must be positive");
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        final EmbeddingOutcome[] results = new EmbeddingOutcome[texts.size()];
        final int permits = maxConcurrency * 3;
        final Semaphore slots = new Semaphore(permits);
        final ThreadPoolExecutor pool = new ThreadPoolExecutor(
                maxConcurrency, maxConcurrency, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(permits),
                new CustomizableThreadFactory("embed-batch-" + runCounter.incrementAndGet() + "-"));

        int batches = 0;
        try {
            for (int from = 0; from < texts.size(); from += batchSize) {
                if (cancellation.isCancelled()) {
                    log.info("Embedding cancelled after {} batches; {} items not dispatched", batches, texts.size() - from);
                    break;
                }
                slots.acquire();
                if (cancellation.isCancelled()) {
                    slots.release();
                    log.info("Embedding cancelled after {} batches; {} items not dispatched", batches, texts.size() - from);
                    break;
                }

                final int start = from;
                final int end = Math.min(from + batchSize, texts.size());
                pool.execute(() -> {
                    try {
                        runBatch(texts.subList(start, end), start, results, listener);
                    } finally {
                        slots.release();
                    }
                });
                batches++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while dispatching embedding batches; stopping dispatch");
        } finally {
            awaitCompletion(pool);
        }

        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                results[i] = EmbeddingOutcome.cancelled();
            }
        }
        log.debug("Embedded {} items in {} batches (batchSize={}, concurrency={})",
                texts.size(), batches, batchSize, maxConcurrency);
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    /**
     * Embeds a single text on the calling thread's behalf, without batching.
     *
     * @param text text to embed
     * @return the vector
     * @throws EmbeddingTransientException if every attempt timed out or failed transiently
     * @throws EmbeddingFatalException     if the provider rejected the input
     */
    public float[] embedOne(final String text) {
        try {
            final List<float[]> vectors = guardedCall.call(() -> provider.embedBatch(List.of(text)));
            if (vectors == null || vectors.size() != 1 || !isUsable(vectors.get(0))) {
                throw new EmbeddingFatalException("Provider returned no usable vector");
            }
            return vectors.get(0);
        } catch (EmbeddingException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new EmbeddingTransientException("Embedding call timed out on every attempt", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingTransientException("Interrupted while embedding", e);
        } catch (Exception e) {
            throw new EmbeddingFatalException("Embedding call failed", e);
        }
    }

    public String modelId() {
        return provider.modelId();
    }

    private void runBatch(final List<String> batch,
                          final int offset,
                          final EmbeddingOutcome[] results,
                          final BatchListener listener) {
        final List<EmbeddingOutcome> outcomes = embedBatchGuarded(batch, offset);
        for (int i = 0; i < outcomes.size(); i++) {
            results[offset + i] = outcomes.get(i);
        }

        if (listener != null) {
            try {
                listener.onBatchComplete(offset, outcomes);
            } catch (RuntimeException e) {
                log.error("Batch listener failed for batch at offset {}", offset, e);
            }
        }
    }

    private List<EmbeddingOutcome> embedBatchGuarded(final List<String> batch, final int offset) {
        final List<float[]> vectors;
        try {
            vectors = guardedCall.call(() -> provider.embedBatch(batch));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.nCopies(batch.size(), EmbeddingOutcome.cancelled());
        } catch (Exception e) {
            final EEmbeddingFailure kind = isTransient(e) ? EEmbeddingFailure.TRANSIENT_EXHAUSTED : EEmbeddingFailure.FATAL;
            log.warn("Embedding batch [{}, {}) failed ({}): {}", offset, offset + batch.size(), kind, e.toString());
            return Collections.nCopies(batch.size(), EmbeddingOutcome.failure(kind, e.toString()));
        }

        if (vectors == null || vectors.size() != batch.size()) {
            final String message = "Provider returned " + (vectors == null ? 0 : vectors.size())
                    + " vectors for " + batch.size() + " texts";
            log.warn("Embedding batch [{}, {}) failed: {}", offset, offset + batch.size(), message);
            return Collections.nCopies(batch.size(), EmbeddingOutcome.failure(EEmbeddingFailure.FATAL, message));
        }

        final List<EmbeddingOutcome> outcomes = new ArrayList<>(batch.size());
        for (final float[] vector : vectors) {
            outcomes.add(isUsable(vector)
                    ? EmbeddingOutcome.success(vector)
                    : EmbeddingOutcome.failure(EEmbeddingFailure.FATAL, "empty vector"));
        }
        return outcomes;
    }

    /**
     * Waits for the dispatched batches. An interrupt pending from dispatching is held back
     * during the wait and restored afterwards; only a new interrupt aborts in-flight batches.
     */
    private static void awaitCompletion(final ThreadPoolExecutor pool) {
        pool.shutdown();
        final boolean interruptedBefore = Thread.interrupted();
        try {
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.debug("Waiting for {} in-flight embedding batches", pool.getActiveCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            log.warn("Interrupted while waiting for embedding batches; remaining items are cancelled");
        } finally {
            if (interruptedBefore) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean isUsable(final float[] vector) {
        return vector != null && vector.length > 0;
    }

    static boolean isTransient(final Throwable t) {
        return t instanceof TimeoutException
                || (t instanceof EmbeddingException e && e.isTransient());
    }
}
