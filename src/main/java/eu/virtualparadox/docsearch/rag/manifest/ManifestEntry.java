package eu.virtualparadox.docsearch.rag.manifest;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable join between a chunk identity and its vector-store entry.
 * One row per fingerprint; re-indexing the same fingerprint updates the row.
 */
@Entity
@Table(name = "manifest_entries", indexes = @Index(name = "idx_manifest_document", columnList = "document_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ManifestEntry {

    @Id
    @Column(length = 64, nullable = false)
    private String fingerprint;

    @Column(name = "document_id", length = 1024, nullable = false)
    private String documentId;

    @Column(name = "vector_store_id", length = 128, nullable = false)
    private String vectorStoreId;

    @Column(name = "indexed_at", nullable = false)
    private Instant indexedAt;

    public static ManifestEntry of(final String documentId, final String fingerprint, final String vectorStoreId) {
        return ManifestEntry.builder()
                .fingerprint(fingerprint)
                .documentId(documentId)
                .vectorStoreId(vectorStoreId)
                .indexedAt(Instant.now())
                .build();
    }

    @PrePersist
    void prePersist() {
        if (indexedAt == null) {
            indexedAt = Instant.now();
        }
    }
}
