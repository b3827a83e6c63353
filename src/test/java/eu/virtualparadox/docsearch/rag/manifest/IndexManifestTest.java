package eu.virtualparadox.docsearch.rag.manifest;

import eu.virtualparadox.docsearch.exception.ManifestException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import(IndexManifest.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class IndexManifestTest {

    @Autowired
    private IndexManifest manifest;

    @Autowired
    private ManifestEntryRepository repository;

    @Autowired
    private SharedChunkRepository sharedRepository;

    private List<String> storedFingerprintsOf(final String documentId) {
        return repository.findAll().stream()
                .filter(e -> e.getDocumentId().equals(documentId))
                .map(ManifestEntry::getFingerprint)
                .toList();
    }

    private static SharedChunk copy(final String documentId, final String fingerprint) {
        return SharedChunk.builder()
                .fingerprint(fingerprint)
                .documentId(documentId)
                .sourceFile("/docs/" + documentId)
                .fileType("txt")
                .sequenceIndex(0)
                .startOffset(0)
                .endOffset(10)
                .build();
    }

    @Test
    void testUpsertIsVisibleAndDurable() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));

        assertThat(manifest.contains("fp1")).isTrue();
        assertThat(manifest.lookup("fp1")).hasValueSatisfying(e -> {
            assertThat(e.getDocumentId()).isEqualTo("a.txt");
            assertThat(e.getVectorStoreId()).isEqualTo("fp1");
            assertThat(e.getIndexedAt()).isNotNull();
        });
        assertThat(repository.findById("fp1")).isPresent();
    }

    @Test
    void testLookupReturnsCopy() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));

        manifest.lookup("fp1").orElseThrow().setDocumentId("changed");

        assertThat(manifest.lookup("fp1").orElseThrow().getDocumentId()).isEqualTo("a.txt");
        assertThat(manifest.lookup("missing")).isEmpty();
    }

    @Test
    void testReupsertFromOtherDocumentMovesOwnership() {
        manifest.upsert(ManifestEntry.of("a.txt", "shared", "shared"));
        manifest.upsert(ManifestEntry.of("b.txt", "shared", "shared"));

        assertThat(manifest.allFingerprintsFor("a.txt")).isEmpty();
        assertThat(manifest.allFingerprintsFor("b.txt")).containsExactly("shared");
        assertThat(manifest.documentIds()).containsExactly("b.txt");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void testDeleteByDocument() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));
        manifest.upsert(ManifestEntry.of("a.txt", "fp2", "fp2"));
        manifest.upsert(ManifestEntry.of("b.txt", "fp3", "fp3"));

        final Set<String> removed = manifest.deleteByDocument("a.txt");

        assertThat(removed).containsExactlyInAnyOrder("fp1", "fp2");
        assertThat(manifest.contains("fp1")).isFalse();
        assertThat(manifest.contains("fp3")).isTrue();
        assertThat(storedFingerprintsOf("a.txt")).isEmpty();
        assertThat(manifest.deleteByDocument("unknown")).isEmpty();
    }

    @Test
    void testEvictStaleKeepsLiveFingerprints() {
        manifest.upsert(ManifestEntry.of("a.txt", "keep", "keep"));
        manifest.upsert(ManifestEntry.of("a.txt", "old", "old"));

        final Set<String> evicted = manifest.evictStale("a.txt", Set.of("keep", "new"));

        assertThat(evicted).containsExactly("old");
        assertThat(manifest.allFingerprintsFor("a.txt")).containsExactly("keep");
        assertThat(storedFingerprintsOf("a.txt")).containsExactly("keep");
        assertThat(manifest.evictStale("a.txt", Set.of("keep"))).isEmpty();
    }

    @Test
    void testStatsAndReload() {
        final Instant earlier = Instant.parse("2024-01-01T00:00:00Z");
        final Instant later = Instant.parse("2024-06-01T00:00:00Z");
        manifest.upsert(ManifestEntry.builder().fingerprint("fp1").documentId("a.txt").vectorStoreId("fp1").indexedAt(earlier).build());
        manifest.upsert(ManifestEntry.builder().fingerprint("fp2").documentId("b.txt").vectorStoreId("fp2").indexedAt(later).build());

        manifest.close();
        assertThat(manifest.contains("fp1")).isFalse();
        manifest.load();

        final ManifestStats stats = manifest.stats();
        assertThat(stats.documentsIndexed()).isEqualTo(2);
        assertThat(stats.chunksIndexed()).isEqualTo(2);
        assertThat(stats.lastIndexedAt()).isEqualTo(later);
    }

    @Test
    void testFailedWriteLeavesStateUnchanged() {
        final ManifestEntryRepository failing = mock(ManifestEntryRepository.class);
        when(failing.findAll()).thenReturn(List.of());
        when(failing.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("disk full"));
        final IndexManifest broken = new IndexManifest(failing, mock(SharedChunkRepository.class), mock(PlatformTransactionManager.class));
        broken.load();

        assertThatThrownBy(() -> broken.upsert(ManifestEntry.of("a.txt", "fp1", "fp1")))
                .isInstanceOf(ManifestException.class);
        assertThat(broken.contains("fp1")).isFalse();
        assertThat(broken.stats().chunksIndexed()).isZero();
    }

    @Test
    void testSharedCopiesAreRecordedOnceAndRetained() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));
        manifest.upsert(ManifestEntry.of("a.txt", "fp2", "fp2"));

        manifest.recordShared(copy("b.txt", "fp1"));
        manifest.recordShared(copy("b.txt", "fp1"));
        manifest.recordShared(copy("b.txt", "fp2"));

        assertThat(sharedRepository.count()).isEqualTo(2);
        assertThat(manifest.sharersOf("fp1")).extracting(SharedChunk::getDocumentId).containsExactly("b.txt");

        assertThat(manifest.retainShared("b.txt", Set.of("fp2"))).isEqualTo(1);
        assertThat(manifest.sharedFingerprintsFor("b.txt")).containsExactly("fp2");
        assertThat(manifest.sharersOf("fp1")).isEmpty();
        assertThat(sharedRepository.count()).isEqualTo(1);
    }

    @Test
    void testHandOverMovesOwnershipToSharer() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));
        manifest.recordShared(copy("b.txt", "fp1"));

        manifest.handOver(manifest.sharersOf("fp1").get(0));

        assertThat(manifest.lookup("fp1").orElseThrow().getDocumentId()).isEqualTo("b.txt");
        assertThat(manifest.allFingerprintsFor("a.txt")).isEmpty();
        assertThat(manifest.sharersOf("fp1")).isEmpty();
        assertThat(storedFingerprintsOf("b.txt")).containsExactly("fp1");
        assertThat(sharedRepository.count()).isZero();
    }

    @Test
    void testDeleteByDocumentDropsItsSharedCopies() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));
        manifest.recordShared(copy("b.txt", "fp1"));

        manifest.deleteByDocument("b.txt");

        assertThat(manifest.sharersOf("fp1")).isEmpty();
        assertThat(manifest.contains("fp1")).isTrue();
    }

    @Test
    void testReloadRestoresSharedCopies() {
        manifest.upsert(ManifestEntry.of("a.txt", "fp1", "fp1"));
        manifest.recordShared(copy("b.txt", "fp1"));

        manifest.close();
        manifest.load();

        assertThat(manifest.sharersOf("fp1")).containsExactly(copy("b.txt", "fp1"));
    }

    @Test
    void testRejectsIncompleteEntry() {
        assertThatThrownBy(() -> manifest.upsert(ManifestEntry.builder().fingerprint("fp").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
