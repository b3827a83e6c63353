package eu.virtualparadox.docsearch.rag.manifest;

import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.model.Document;
import eu.virtualparadox.docsearch.rag.store.ChunkMetadata;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * A document containing a chunk whose vector is owned by another document.
 * Keeps the position of the copy so the vector can be handed over when the owner lets go.
 */
@Entity
@Table(name = "shared_chunks", indexes = @Index(name = "idx_shared_document", columnList = "document_id"))
@IdClass(SharedChunk.Key.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SharedChunk {

    @Id
    @Column(length = 64, nullable = false)
    private String fingerprint;

    @Id
    @Column(name = "document_id", length = 1024, nullable = false)
    private String documentId;

    @Column(name = "source_file", length = 2048, nullable = false)
    private String sourceFile;

    @Column(name = "file_type", length = 32, nullable = false)
    private String fileType;

    @Column(name = "sequence_index", nullable = false)
    private int sequenceIndex;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    public static SharedChunk of(final Document document, final Chunk chunk) {
        return SharedChunk.builder()
                .fingerprint(chunk.fingerprint())
                .documentId(document.id())
                .sourceFile(document.sourcePath().toString())
                .fileType(document.fileType())
                .sequenceIndex(chunk.sequenceIndex())
                .startOffset(chunk.startOffset())
                .endOffset(chunk.endOffset())
                .build();
    }

    /**
     * Metadata of this copy; the text is left to the vector store, which already holds it.
     */
    public ChunkMetadata toMetadata() {
        return new ChunkMetadata(documentId, sourceFile, fileType, sequenceIndex, startOffset, endOffset, null);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String fingerprint;
        private String documentId;
    }
}
