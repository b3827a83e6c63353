package eu.virtualparadox.docsearch.rag.manifest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SharedChunkRepository extends JpaRepository<SharedChunk, SharedChunk.Key> {

    @Modifying
    @Query("delete from SharedChunk s where s.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
