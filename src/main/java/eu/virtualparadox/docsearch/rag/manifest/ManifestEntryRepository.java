package eu.virtualparadox.docsearch.rag.manifest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ManifestEntryRepository extends JpaRepository<ManifestEntry, String> {

    @Modifying
    @Query("delete from ManifestEntry m where m.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
