package eu.virtualparadox.docsearch.rag.manifest;

import eu.virtualparadox.docsearch.exception.ManifestException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable record of the chunks already present in the vector store.
 *
 * <h2>State</h2>
 * The H2 table is the source of truth. At startup it is loaded into two maps:
 * {@code fingerprint -> entry} and {@code documentId -> fingerprints}. Every mutation is
 * committed to the database first and mirrored in memory afterwards, so a failed write
 * leaves both unchanged.
 *
 * <h2>Concurrency</h2>
 * Writes to the same fingerprint are serialized with striped locks; reads are lock-free.
 * A fingerprint belongs to exactly one document: re-upserting it from another document moves it.
 *
 * <h2>Shared chunks</h2>
 * Other documents containing an owned fingerprint are recorded as {@link SharedChunk}s.
 * When the owner lets go of the fingerprint, {@link #handOver} makes one of them the owner.
 */
@Slf4j
@Service
public class IndexManifest {

    private static final int LOCK_STRIPES = 64;

    private final ManifestEntryRepository repository;
    private final SharedChunkRepository sharedRepository;
    private final TransactionTemplate transactionTemplate;

    private final Map<String, ManifestEntry> byFingerprint = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byDocument = new ConcurrentHashMap<>();
    private final Map<String, Map<String, SharedChunk>> sharedByFingerprint = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sharedByDocument = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public IndexManifest(final ManifestEntryRepository repository,
                         final SharedChunkRepository sharedRepository,
                         final PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.sharedRepository = sharedRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * (Re)builds the in-memory view from the database.
     */
    @PostConstruct
    public void load() {
        byFingerprint.clear();
        byDocument.clear();
        sharedByFingerprint.clear();
        sharedByDocument.clear();
        for (final ManifestEntry entry : repository.findAll()) {
            byFingerprint.put(entry.getFingerprint(), entry.toBuilder().build());
            byDocument.computeIfAbsent(entry.getDocumentId(), k -> ConcurrentHashMap.newKeySet())
                    .add(entry.getFingerprint());
        }
        for (final SharedChunk shared : sharedRepository.findAll()) {
            putShared(shared.toBuilder().build());
        }
        log.info("Loaded index manifest: {} chunks across {} documents, {} shared copies",
                byFingerprint.size(), byDocument.size(), sharedByDocument.values().stream().mapToInt(Set::size).sum());
    }

    @PreDestroy
    public void close() {
        log.info("Closing index manifest with {} chunks across {} documents", byFingerprint.size(), byDocument.size());
        byFingerprint.clear();
        byDocument.clear();
        sharedByFingerprint.clear();
        sharedByDocument.clear();
    }

    /**
     * @param fingerprint chunk identity
     * @return a copy of the entry, empty if the chunk is not indexed
     */
    public Optional<ManifestEntry> lookup(final String fingerprint) {
        final ManifestEntry entry = byFingerprint.get(fingerprint);
        return entry == null ? Optional.empty() : Optional.of(entry.toBuilder().build());
    }

    public boolean contains(final String fingerprint) {
        return byFingerprint.containsKey(fingerprint);
    }

    /**
     * Inserts or overwrites the entry of {@code entry.fingerprint}. Returns only after the
     * row is committed.
     *
     * @param entry entry to store
     * @throws ManifestException if the database write fails
     */
    public void upsert(final ManifestEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.getFingerprint() == null || entry.getDocumentId() == null || entry.getVectorStoreId() == null) {
            throw new IllegalArgumentException("fingerprint, documentId and vectorStoreId are required");
        }
        final ManifestEntry copy = entry.toBuilder()
                .indexedAt(entry.getIndexedAt() == null ? Instant.now() : entry.getIndexedAt())
                .build();

        final ReentrantLock lock = lockFor(copy.getFingerprint());
        lock.lock();
        try {
            try {
                repository.saveAndFlush(copy);
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw new ManifestException("Failed to persist manifest entry " + copy.getFingerprint(), e);
            }

            final ManifestEntry previous = byFingerprint.put(copy.getFingerprint(), copy);
            if (previous != null && !previous.getDocumentId().equals(copy.getDocumentId())) {
                removeFromDocument(previous.getDocumentId(), copy.getFingerprint());
            }
            byDocument.computeIfAbsent(copy.getDocumentId(), k -> ConcurrentHashMap.newKeySet())
                    .add(copy.getFingerprint());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry owned by {@code documentId} and every shared copy it holds.
     *
     * @return fingerprints that were removed
     * @throws ManifestException if the database delete fails
     */
    public Set<String> deleteByDocument(final String documentId) {
        final Set<String> fingerprints = allFingerprintsFor(documentId);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                repository.deleteByDocumentId(documentId);
                sharedRepository.deleteByDocumentId(documentId);
            });
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            throw new ManifestException("Failed to delete manifest entries of " + documentId, e);
        }

        for (final String fingerprint : fingerprints) {
            removeIfOwnedBy(fingerprint, documentId);
        }
        for (final String fingerprint : sharedFingerprintsFor(documentId)) {
            removeShared(fingerprint, documentId);
        }
        log.debug("Removed {} manifest entries of {}", fingerprints.size(), documentId);
        return fingerprints;
    }

    /**
     * Removes the entries of {@code documentId} whose fingerprints are not in {@code liveFingerprints}.
     *
     * @return fingerprints that were evicted
     * @throws ManifestException if the database delete fails
     */
    public Set<String> evictStale(final String documentId, final Set<String> liveFingerprints) {
        final Set<String> stale = new HashSet<>(allFingerprintsFor(documentId));
        stale.removeAll(liveFingerprints);
        if (stale.isEmpty()) {
            return Set.of();
        }

        try {
            repository.deleteAllByIdInBatch(stale);
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            throw new ManifestException("Failed to evict stale entries of " + documentId, e);
        }
        for (final String fingerprint : stale) {
            removeIfOwnedBy(fingerprint, documentId);
        }
        log.debug("Evicted {} stale manifest entries of {}", stale.size(), documentId);
        return Collections.unmodifiableSet(stale);
    }

    /**
     * Records that {@code shared.documentId} contains a fingerprint owned by another document.
     * Recording an identical copy again is a no-op.
     *
     * @throws ManifestException if the database write fails
     */
    public void recordShared(final SharedChunk shared) {
        Objects.requireNonNull(shared, "shared");
        final ReentrantLock lock = lockFor(shared.getFingerprint());
        lock.lock();
        try {
            final Map<String, SharedChunk> copies = sharedByFingerprint.get(shared.getFingerprint());
            if (copies != null && shared.equals(copies.get(shared.getDocumentId()))) {
                return;
            }
            try {
                sharedRepository.saveAndFlush(shared);
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw new ManifestException("Failed to record shared chunk " + shared.getFingerprint(), e);
            }
            putShared(shared.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the shared copies of {@code documentId} whose fingerprints are not in {@code liveFingerprints}.
     *
     * @return number of copies dropped
     * @throws ManifestException if the database delete fails
     */
    public int retainShared(final String documentId, final Set<String> liveFingerprints) {
        final Set<String> gone = new HashSet<>(sharedFingerprintsFor(documentId));
        gone.removeAll(liveFingerprints);
        if (gone.isEmpty()) {
            return 0;
        }
        final List<SharedChunk.Key> keys = gone.stream().map(fp -> new SharedChunk.Key(fp, documentId)).toList();
        try {
            sharedRepository.deleteAllById(keys);
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            throw new ManifestException("Failed to drop shared chunks of " + documentId, e);
        }
        for (final String fingerprint : gone) {
            removeShared(fingerprint, documentId);
        }
        return gone.size();
    }

    /**
     * @return copies of the shared records of {@code fingerprint}, empty if no other document holds it
     */
    public List<SharedChunk> sharersOf(final String fingerprint) {
        final Map<String, SharedChunk> copies = sharedByFingerprint.get(fingerprint);
        if (copies == null) {
            return List.of();
        }
        final List<SharedChunk> result = new ArrayList<>(copies.size());
        copies.values().forEach(copy -> result.add(copy.toBuilder().build()));
        return result;
    }

    /**
     * @return snapshot of the fingerprints {@code documentId} shares with their owners
     */
    public Set<String> sharedFingerprintsFor(final String documentId) {
        final Set<String> fingerprints = sharedByDocument.get(documentId);
        return fingerprints == null ? Set.of() : Set.copyOf(fingerprints);
    }

    /**
     * Makes {@code heir} the owner of its fingerprint and removes it from the shared copies,
     * in one transaction.
     *
     * @throws ManifestException if the database write fails
     */
    public void handOver(final SharedChunk heir) {
        Objects.requireNonNull(heir, "heir");
        final ManifestEntry entry = ManifestEntry.of(heir.getDocumentId(), heir.getFingerprint(), heir.getFingerprint());
        final ReentrantLock lock = lockFor(heir.getFingerprint());
        lock.lock();
        try {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    repository.saveAndFlush(entry);
                    sharedRepository.deleteById(new SharedChunk.Key(heir.getFingerprint(), heir.getDocumentId()));
                });
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw new ManifestException("Failed to hand over " + heir.getFingerprint() + " to " + heir.getDocumentId(), e);
            }

            final ManifestEntry previous = byFingerprint.put(entry.getFingerprint(), entry);
            if (previous != null && !previous.getDocumentId().equals(entry.getDocumentId())) {
                removeFromDocument(previous.getDocumentId(), entry.getFingerprint());
            }
            byDocument.computeIfAbsent(entry.getDocumentId(), k -> ConcurrentHashMap.newKeySet())
                    .add(entry.getFingerprint());
            removeShared(heir.getFingerprint(), heir.getDocumentId());
        } finally {
            lock.unlock();
        }
        log.debug("Handed {} over to {}", heir.getFingerprint(), heir.getDocumentId());
    }

    /**
     * @return snapshot of the fingerprints owned by {@code documentId}
     */
    public Set<String> allFingerprintsFor(final String documentId) {
        final Set<String> fingerprints = byDocument.get(documentId);
        return fingerprints == null ? Set.of() : Set.copyOf(fingerprints);
    }

    /**
     * @return snapshot of the documents owning at least one entry
     */
    public Set<String> documentIds() {
        final Set<String> ids = new HashSet<>();
        byDocument.forEach((id, fingerprints) -> {
            if (!fingerprints.isEmpty()) {
                ids.add(id);
            }
        });
        return ids;
    }

    public ManifestStats stats() {
        final Instant last = byFingerprint.values().stream()
                .map(ManifestEntry::getIndexedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);
        return new ManifestStats(documentIds().size(), byFingerprint.size(), last);
    }

    private void removeIfOwnedBy(final String fingerprint, final String documentId) {
        final ReentrantLock lock = lockFor(fingerprint);
        lock.lock();
        try {
            final ManifestEntry current = byFingerprint.get(fingerprint);
            if (current != null && current.getDocumentId().equals(documentId)) {
                byFingerprint.remove(fingerprint);
            }
            removeFromDocument(documentId, fingerprint);
        } finally {
            lock.unlock();
        }
    }

    private void removeFromDocument(final String documentId, final String fingerprint) {
        byDocument.computeIfPresent(documentId, (id, fingerprints) -> {
            fingerprints.remove(fingerprint);
            return fingerprints.isEmpty() ? null : fingerprints;
        });
    }

    private void putShared(final SharedChunk shared) {
        sharedByFingerprint.computeIfAbsent(shared.getFingerprint(), k -> new ConcurrentHashMap<>())
                .put(shared.getDocumentId(), shared);
        sharedByDocument.computeIfAbsent(shared.getDocumentId(), k -> ConcurrentHashMap.newKeySet())
                .add(shared.getFingerprint());
    }

    private void removeShared(final String fingerprint, final String documentId) {
        sharedByFingerprint.computeIfPresent(fingerprint, (fp, copies) -> {
            copies.remove(documentId);
            return copies.isEmpty() ? null : copies;
        });
        sharedByDocument.computeIfPresent(documentId, (id, fingerprints) -> {
            fingerprints.remove(fingerprint);
            return fingerprints.isEmpty() ? null : fingerprints;
        });
    }

    private ReentrantLock lockFor(final String fingerprint) {
        return locks[Math.floorMod(fingerprint.hashCode(), LOCK_STRIPES)];
    }
}
