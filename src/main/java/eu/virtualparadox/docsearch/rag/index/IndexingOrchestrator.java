package eu.virtualparadox.docsearch.rag.index;

import eu.virtualparadox.docsearch.application.config.IndexingProperties;
import eu.virtualparadox.docsearch.exception.ManifestException;
import eu.virtualparadox.docsearch.exception.VectorStoreException;
import eu.virtualparadox.docsearch.ingest.chunker.Chunker;
import eu.virtualparadox.docsearch.ingest.lifecycle.IndexProgressTracker;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.model.Document;
import eu.virtualparadox.docsearch.rag.embed.EEmbeddingFailure;
import eu.virtualparadox.docsearch.rag.embed.EmbeddingBatcher;
import eu.virtualparadox.docsearch.rag.embed.EmbeddingOutcome;
import eu.virtualparadox.docsearch.rag.embed.EmbeddingRecord;
import eu.virtualparadox.docsearch.rag.manifest.IndexManifest;
import eu.virtualparadox.docsearch.rag.manifest.ManifestEntry;
import eu.virtualparadox.docsearch.rag.manifest.SharedChunk;
import eu.virtualparadox.docsearch.rag.store.ChunkMetadata;
import eu.virtualparadox.docsearch.rag.store.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates the indexing pipeline for a set of documents:
 * <ol>
 *     <li>Filter by file type, chunk &amp; fingerprint every document</li>
 *     <li>Skip chunks already recorded in the {@link IndexManifest} and duplicates seen earlier
 *         in the run; a forced run clears each document first</li>
 *     <li>Embed the remaining chunks through the {@link EmbeddingBatcher}</li>
 *     <li>Per completed batch: upsert the vectors, commit the store, record manifest entries</li>
 *     <li>Retry chunks whose commit or manifest write failed from their cached vectors</li>
 *     <li>Record the chunks each document shares with another owner</li>
 *     <li>After a complete run, release the chunks that no longer occur in their document</li>
 * </ol>
 * <p>
 * Failures are isolated per chunk and aggregated into {@link IndexStats}; a chunk is counted
 * as indexed only once its manifest entry is durable, so a failed chunk is retried next run.
 * The run is not atomic across documents.
 * <p>
 * A released chunk that another document still contains is handed over to that document
 * instead of being deleted; its vector is kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingOrchestrator {

    private final Chunker chunker;
    private final EmbeddingBatcher embeddingBatcher;
    private final VectorStore vectorStore;
    private final IndexManifest manifest;
    private final IndexProgressTracker progressTracker;
    private final IndexingProperties properties;

    /**
     * A chunk scheduled for embedding, with the document it came from.
     */
    private record PendingChunk(Document document, Chunk chunk) {
    }

    /**
     * A selected document with its chunks.
     */
    private record ChunkedDocument(Document document, List<Chunk> chunks) {

        Set<String> fingerprints() {
            final Set<String> fingerprints = new HashSet<>();
            chunks.forEach(chunk -> fingerprints.add(chunk.fingerprint()));
            return fingerprints;
        }
    }

    /**
     * State shared by the embedding worker threads of one run.
     */
    private static final class RunCounters {
        final AtomicInteger indexed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicBoolean cancelledItems = new AtomicBoolean();
        final AtomicInteger dimension = new AtomicInteger();
        /** Vectors of chunks that are not durable yet. */
        final Map<String, EmbeddingRecord> embeddings = new ConcurrentHashMap<>();
        /** Chunks whose commit or manifest write failed, retried once from {@link #embeddings}. */
        final Queue<PendingChunk> retry = new ConcurrentLinkedQueue<>();
    }

    /**
     * Indexes {@code documents}.
     *
     * @param documents documents to index
     * @param options   run options
     * @return statistics of the run
     */
    public IndexStats index(final List<Document> documents, final IndexOptions options) {
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        final IndexOptions opts = options == null ? IndexOptions.defaults() : options;
        final long startNanos = System.nanoTime();

        final List<Document> selected = documents.stream().filter(opts::accepts).toList();
        if (selected.size() < documents.size()) {
            log.info("File type filter {} excluded {} of {} documents",
                    opts.fileTypesFilter(), documents.size() - selected.size(), documents.size());
        }

        int chunksProcessed = 0;
        int chunksSkipped = 0;
        final RunCounters counters = new RunCounters();

        final List<ChunkedDocument> chunked = new ArrayList<>(selected.size());
        for (final Document document : selected) {
            final List<Chunk> chunks = chunker.chunk(document);
            chunksProcessed += chunks.size();
            if (opts.forceReindex() && !clearDocument(document)) {
                counters.failed.addAndGet(chunks.size());
                continue;
            }
            chunked.add(new ChunkedDocument(document, chunks));
        }

        final List<PendingChunk> pending = new ArrayList<>();
        final Map<String, Integer> pendingPerDocument = new LinkedHashMap<>();
        final Set<String> seenInRun = new HashSet<>();
        for (final ChunkedDocument entry : chunked) {
            int documentPending = 0;
            for (final Chunk chunk : entry.chunks()) {
                if (!seenInRun.add(chunk.fingerprint()) || manifest.contains(chunk.fingerprint())) {
                    chunksSkipped++;
                } else {
                    pending.add(new PendingChunk(entry.document(), chunk));
                    documentPending++;
                }
            }
            pendingPerDocument.merge(entry.document().id(), documentPending, Integer::sum);
            log.debug("Document {}: {} chunks, {} to embed", entry.document().id(), entry.chunks().size(), documentPending);
        }

        progressTracker.start(new ArrayList<>(pendingPerDocument.values()));
        try {
            embedAndStore(pending, opts, counters);
        } finally {
            progressTracker.finish();
        }
        retryFromCache(counters);

        chunked.forEach(this::recordSharedChunks);

        final boolean cancelled = opts.cancellation().isCancelled() || counters.cancelledItems.get();
        if (cancelled) {
            log.info("Indexing run cancelled; stale entries are kept until a complete run");
        } else {
            chunked.forEach(entry -> evictStale(entry.document().id(), entry.fingerprints()));
        }

        final double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        final IndexStats stats = new IndexStats(selected.size(), chunksProcessed, counters.indexed.get(),
                chunksSkipped, counters.failed.get(), seconds, cancelled);
        log.info("Indexing finished in {}s: documents={}, chunks={}, indexed={}, skipped={}, failed={}, cancelled={}",
                String.format("%.2f", seconds), stats.documentsProcessed(), stats.chunksProcessed(),
                stats.chunksIndexed(), stats.chunksSkipped(), stats.chunksFailed(), stats.cancelled());
        counters.embeddings.clear();
        return stats;
    }

    /**
     * Removes a document from the vector store and the manifest. Chunks that another document
     * still contains are handed over to it and stay searchable.
     *
     * @param documentId document identifier
     * @return number of chunks the document owned
     * @throws VectorStoreException if the vectors cannot be deleted or handed over
     * @throws ManifestException    if the manifest entries cannot be deleted or handed over
     */
    public int removeDocument(final String documentId) {
        final Set<String> fingerprints = manifest.allFingerprintsFor(documentId);
        final Set<String> handedOver = handOver(fingerprints);
        final Set<String> deleted = new HashSet<>(fingerprints);
        deleted.removeAll(handedOver);
        vectorStore.delete(deleted);
        manifest.deleteByDocument(documentId);
        log.info("Removed document {} ({} chunks, {} handed over)", documentId, fingerprints.size(), handedOver.size());
        return fingerprints.size();
    }

    private void embedAndStore(final List<PendingChunk> pending, final IndexOptions opts, final RunCounters counters) {
        if (pending.isEmpty()) {
            return;
        }
        final List<String> texts = pending.stream().map(p -> p.chunk().text()).toList();
        embeddingBatcher.embed(texts,
                properties.getEmbedding().getBatchSize(),
                properties.getEmbedding().getMaxWorkers(),
                opts.cancellation(),
                (offset, outcomes) -> storeBatch(pending.subList(offset, offset + outcomes.size()), outcomes, counters));
    }

    /**
     * Runs on an embedding worker thread once a batch completes.
     */
    private void storeBatch(final List<PendingChunk> batch,
                            final List<EmbeddingOutcome> outcomes,
                            final RunCounters counters) {
        final List<PendingChunk> upserted = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            final PendingChunk item = batch.get(i);
            final EmbeddingOutcome outcome = outcomes.get(i);
            final String fingerprint = item.chunk().fingerprint();

            if (!outcome.isSuccess()) {
                if (outcome.failure() == EEmbeddingFailure.CANCELLED) {
                    counters.cancelledItems.set(true);
                } else {
                    counters.failed.incrementAndGet();
                    log.warn("Embedding failed for chunk {} of {}: {} ({})", item.chunk().sequenceIndex(),
                            item.document().id(), outcome.failure(), outcome.message());
                }
                continue;
            }

            final EmbeddingRecord record = EmbeddingRecord.of(fingerprint, outcome.vector());
            if (!hasRunDimension(record, counters)) {
                counters.failed.incrementAndGet();
                log.warn("Chunk {} of {} has vector dimension {}, expected the run's dimension",
                        item.chunk().sequenceIndex(), item.document().id(), record.dimension());
                continue;
            }
            counters.embeddings.put(fingerprint, record);

            if (upsert(item, record, counters)) {
                upserted.add(item);
            }
        }

        if (!upserted.isEmpty()) {
            if (commitStore()) {
                for (final PendingChunk item : upserted) {
                    if (!recordInManifest(item, counters)) {
                        counters.retry.add(item);
                    }
                }
            } else {
                counters.retry.addAll(upserted);
            }
        }
        progressTracker.step(batch.size());
    }

    /**
     * Second and last attempt for chunks whose commit or manifest write failed, using the
     * vectors cached during the run instead of embedding again.
     */
    private void retryFromCache(final RunCounters counters) {
        if (counters.retry.isEmpty()) {
            return;
        }
        final List<PendingChunk> items = new ArrayList<>(counters.retry);
        log.info("Retrying {} chunks from cached embeddings", items.size());

        final List<PendingChunk> upserted = new ArrayList<>(items.size());
        for (final PendingChunk item : items) {
            if (upsert(item, counters.embeddings.get(item.chunk().fingerprint()), counters)) {
                upserted.add(item);
            }
        }
        if (upserted.isEmpty()) {
            return;
        }
        if (!commitStore()) {
            counters.failed.addAndGet(upserted.size());
            log.error("Vector store commit failed again; {} chunks will be retried next run", upserted.size());
            return;
        }
        for (final PendingChunk item : upserted) {
            if (!recordInManifest(item, counters)) {
                counters.failed.incrementAndGet();
            }
        }
    }

    private boolean upsert(final PendingChunk item, final EmbeddingRecord record, final RunCounters counters) {
        try {
            vectorStore.upsert(record.fingerprint(), record.vector(), ChunkMetadata.of(item.document(), item.chunk()));
            return true;
        } catch (VectorStoreException | IllegalArgumentException e) {
            counters.failed.incrementAndGet();
            log.warn("Upsert failed for chunk {} of {}: {}", item.chunk().sequenceIndex(),
                    item.document().id(), e.getMessage());
            return false;
        }
    }

    private boolean commitStore() {
        try {
            vectorStore.commit();
            return true;
        } catch (VectorStoreException e) {
            log.error("Vector store commit failed", e);
            return false;
        }
    }

    private boolean recordInManifest(final PendingChunk item, final RunCounters counters) {
        final String fingerprint = item.chunk().fingerprint();
        try {
            manifest.upsert(ManifestEntry.of(item.document().id(), fingerprint, fingerprint));
            counters.indexed.incrementAndGet();
            counters.embeddings.remove(fingerprint);
            return true;
        } catch (ManifestException e) {
            log.error("Manifest write failed for chunk {} of {}", item.chunk().sequenceIndex(),
                    item.document().id(), e);
            return false;
        }
    }

    /**
     * All vectors of a run share the dimension of the first one.
     */
    private static boolean hasRunDimension(final EmbeddingRecord record, final RunCounters counters) {
        counters.dimension.compareAndSet(0, record.dimension());
        return counters.dimension.get() == record.dimension();
    }

    /**
     * Drops the vectors and manifest entries of {@code document} before a forced reindex.
     *
     * @return {@code false} if the document could not be cleared and must be skipped
     */
    private boolean clearDocument(final Document document) {
        try {
            removeDocument(document.id());
            return true;
        } catch (VectorStoreException | ManifestException e) {
            log.error("Failed to clear {} before forced reindex; skipping document", document.id(), e);
            return false;
        }
    }

    /**
     * Brings the shared copies of a document in line with its current chunks: chunks owned by
     * another document are recorded, copies it no longer contains are dropped.
     */
    private void recordSharedChunks(final ChunkedDocument entry) {
        final String documentId = entry.document().id();
        final Set<String> shared = new HashSet<>();
        try {
            for (final Chunk chunk : entry.chunks()) {
                final Optional<ManifestEntry> owner = manifest.lookup(chunk.fingerprint());
                if (owner.isPresent() && !owner.get().getDocumentId().equals(documentId)
                        && shared.add(chunk.fingerprint())) {
                    manifest.recordShared(SharedChunk.of(entry.document(), chunk));
                }
            }
            manifest.retainShared(documentId, shared);
        } catch (ManifestException e) {
            log.warn("Failed to record shared chunks of {}: {}", documentId, e.getMessage());
        }
    }

    private void evictStale(final String documentId, final Set<String> live) {
        final Set<String> stale = new HashSet<>(manifest.allFingerprintsFor(documentId));
        stale.removeAll(live);
        if (stale.isEmpty()) {
            return;
        }
        try {
            final Set<String> handedOver = handOver(stale);
            stale.removeAll(handedOver);
            vectorStore.delete(stale);
            manifest.evictStale(documentId, live);
            log.info("Evicted {} stale chunks of {}, {} handed over", stale.size(), documentId, handedOver.size());
        } catch (VectorStoreException | ManifestException e) {
            log.warn("Failed to evict stale chunks of {}: {}", documentId, e.getMessage());
        }
    }

    /**
     * Gives each fingerprint that another document shares to one of those documents.
     *
     * @return the fingerprints handed over
     */
    private Set<String> handOver(final Set<String> fingerprints) {
        final List<SharedChunk> heirs = new ArrayList<>();
        for (final String fingerprint : fingerprints) {
            manifest.sharersOf(fingerprint).stream()
                    .min(Comparator.comparing(SharedChunk::getDocumentId))
                    .ifPresent(heirs::add);
        }
        if (heirs.isEmpty()) {
            return Set.of();
        }

        final List<SharedChunk> moved = new ArrayList<>(heirs.size());
        for (final SharedChunk heir : heirs) {
            if (vectorStore.reassign(heir.getFingerprint(), heir.toMetadata())) {
                moved.add(heir);
            }
        }
        vectorStore.commit();

        final Set<String> handedOver = new HashSet<>();
        for (final SharedChunk heir : moved) {
            manifest.handOver(heir);
            handedOver.add(heir.getFingerprint());
        }
        return handedOver;
    }
}
